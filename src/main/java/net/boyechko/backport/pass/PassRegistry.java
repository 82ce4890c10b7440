/*
 * Tree-Backport - Version-gated source rewriting
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.backport.pass;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import net.boyechko.backport.errors.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered table of the available passes. Registration order is execution order; a selector only
 * chooses which passes run, never their order. Each selection yields fresh instances, since
 * fixers accumulate effects.
 *
 * <p>The table is fixed at construction and read-only afterwards.
 */
public final class PassRegistry {
    private static final Logger logger = LoggerFactory.getLogger(PassRegistry.class);

    private final Map<String, Supplier<? extends Checker>> checkers;
    private final Map<String, Supplier<? extends Fixer>> fixers;
    private final Map<String, String> displayNames = new LinkedHashMap<>();

    public PassRegistry(
            List<Supplier<? extends Checker>> checkers, List<Supplier<? extends Fixer>> fixers) {
        this.checkers = index(checkers, "checker");
        this.fixers = index(fixers, "fixer");
        logger.debug(
                "Registered {} checkers and {} fixers", this.checkers.size(), this.fixers.size());
    }

    private <T extends Pass> Map<String, Supplier<? extends T>> index(
            List<Supplier<? extends T>> suppliers, String capability) {
        Map<String, Supplier<? extends T>> out = new LinkedHashMap<>();
        for (Supplier<? extends T> supplier : suppliers) {
            T sample = supplier.get();
            if (sample == null) {
                throw new IllegalStateException("Pass supplier returned null");
            }
            String key = PassSelector.normalize(sample.name());
            if (out.containsKey(key)) {
                throw new IllegalArgumentException(
                        "Duplicate " + capability + " name: " + sample.name());
            }
            out.put(key, supplier);
            displayNames.put(capability + ":" + key, sample.name());
        }
        return out;
    }

    /** @throws ConfigurationException for a token that names no checker */
    public List<Checker> selectCheckers(List<String> selector) {
        return select(checkers, selector, "checker");
    }

    /** @throws ConfigurationException for a token that names no fixer */
    public List<Fixer> selectFixers(List<String> selector) {
        return select(fixers, selector, "fixer");
    }

    private static <T extends Pass> List<T> select(
            Map<String, Supplier<? extends T>> available,
            List<String> selector,
            String capability) {
        Set<String> wanted = new LinkedHashSet<>();
        if (!PassSelector.selectsAll(selector)) {
            for (String token : selector) {
                if (token.isBlank()) {
                    continue;
                }
                String key = PassSelector.normalize(token);
                if (!available.containsKey(key)) {
                    throw new ConfigurationException(
                            "Unknown " + capability + " '" + token.trim() + "'");
                }
                wanted.add(key);
            }
        }

        List<T> selected = new ArrayList<>();
        for (Map.Entry<String, Supplier<? extends T>> entry : available.entrySet()) {
            if (wanted.isEmpty() || wanted.contains(entry.getKey())) {
                selected.add(entry.getValue().get());
            }
        }
        return selected;
    }

    /** Fresh instances of every checker, in registry order. */
    public List<Checker> allCheckers() {
        return selectCheckers(List.of());
    }

    /** Fresh instances of every fixer, in registry order. */
    public List<Fixer> allFixers() {
        return selectFixers(List.of());
    }

    public List<String> checkerNames() {
        return names("checker");
    }

    public List<String> fixerNames() {
        return names("fixer");
    }

    private List<String> names(String capability) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, String> entry : displayNames.entrySet()) {
            if (entry.getKey().startsWith(capability + ":")) {
                out.add(entry.getValue());
            }
        }
        return out;
    }
}
