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
package net.boyechko.backport.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.backport.errors.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Identifiers a module must not rebind: the builtin names, and the modules that fixer-generated
 * code refers to ({@code itertools} and friends).
 */
public final class BuiltinNames {
    private static final String DEFAULT_RESOURCE = "/builtin-names.yaml";
    private static final Logger logger = LoggerFactory.getLogger(BuiltinNames.class);

    private final Set<String> builtins;
    private final Set<String> protectedModules;

    public BuiltinNames(Set<String> builtins, Set<String> protectedModules) {
        this.builtins = Set.copyOf(builtins);
        this.protectedModules = Set.copyOf(protectedModules);
    }

    private static final class DefaultHolder {
        static final BuiltinNames INSTANCE = fromResource(DEFAULT_RESOURCE);
    }

    /** The bundled lists, loaded once. */
    public static BuiltinNames loadDefault() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Load names from classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static BuiltinNames fromResource(String resourcePath) {
        try (InputStream in = BuiltinNames.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new ConfigurationException("Resource not found: " + resourcePath);
            }
            Object doc = Yamls.newYaml().load(in);
            if (!(doc instanceof Map<?, ?> map)) {
                throw new ConfigurationException(resourcePath + ": expected a mapping");
            }
            BuiltinNames names =
                    new BuiltinNames(
                            names(map, "builtins", resourcePath),
                            names(map, "protected_modules", resourcePath));
            logger.debug(
                    "Loaded {} builtin names and {} protected modules from {}",
                    names.builtins.size(),
                    names.protectedModules.size(),
                    resourcePath);
            return names;
        } catch (IOException | YAMLException e) {
            logger.error("Failed to load builtin names from {}: {}", resourcePath, e.getMessage());
            throw new ConfigurationException(
                    "Failed to load builtin names from " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    private static Set<String> names(Map<?, ?> map, String key, String origin) {
        Object value = map.get(key);
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException(origin + ": " + key + " must be a list");
        }
        Set<String> out = new LinkedHashSet<>();
        for (Object item : list) {
            out.add(String.valueOf(item));
        }
        return out;
    }

    public Set<String> builtins() {
        return builtins;
    }

    public Set<String> protectedModules() {
        return protectedModules;
    }

    public boolean isBuiltin(String name) {
        return builtins.contains(name);
    }

    public boolean isProtectedModule(String name) {
        return protectedModules.contains(name);
    }
}
