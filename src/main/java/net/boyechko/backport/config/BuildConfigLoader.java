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
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.backport.errors.ConfigurationException;
import net.boyechko.backport.pass.PassSelector;
import net.boyechko.backport.version.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a {@link BuildConfig} from YAML. Recognized keys are {@code source_version}, {@code
 * target_version}, {@code checkers} and {@code fixers}; selectors may be a comma-separated string
 * or a list. Keys missing from a file keep the bundled defaults.
 */
public final class BuildConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(BuildConfigLoader.class);

    static final String DEFAULTS_RESOURCE = "/backport-defaults.yaml";

    private static final Set<String> KNOWN_KEYS =
            Set.of("source_version", "target_version", "checkers", "fixers");

    private BuildConfigLoader() {}

    public static BuildConfig loadDefaults() {
        return fromResource(DEFAULTS_RESOURCE, null);
    }

    /**
     * Load configuration from a classpath resource, layered over {@code base}.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     * @param base values for keys the resource leaves out; null when the resource must be complete
     */
    public static BuildConfig fromResource(String resourcePath, BuildConfig base) {
        try (InputStream in = BuildConfigLoader.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new ConfigurationException("Resource not found: " + resourcePath);
            }
            return fromYaml(Yamls.newYaml().load(in), base, resourcePath);
        } catch (IOException | YAMLException e) {
            logger.error(
                    "Failed to load configuration from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new ConfigurationException(
                    "Failed to load configuration from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /** Loads {@code path} layered over the bundled defaults. */
    public static BuildConfig load(Path path) {
        BuildConfig defaults = loadDefaults();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            BuildConfig config = fromYaml(Yamls.newYaml().load(reader), defaults, path.toString());
            logger.debug("Loaded configuration from {}: {}", path, config);
            return config;
        } catch (IOException | YAMLException e) {
            throw new ConfigurationException(
                    "Cannot read configuration " + path + ": " + e.getMessage(), e);
        }
    }

    static BuildConfig fromYaml(Object doc, BuildConfig base, String origin) {
        if (doc == null) {
            doc = Map.of();
        }
        if (!(doc instanceof Map<?, ?> map)) {
            throw new ConfigurationException(origin + ": expected a mapping at the top level");
        }
        for (Object key : map.keySet()) {
            if (!KNOWN_KEYS.contains(String.valueOf(key))) {
                logger.warn("Ignoring unknown configuration key '{}' in {}", key, origin);
            }
        }

        Version source =
                version(map, "source_version", base == null ? null : base.sourceVersion(), origin);
        Version target =
                version(map, "target_version", base == null ? null : base.targetVersion(), origin);
        List<String> checkers =
                map.containsKey("checkers")
                        ? selector(map.get("checkers"), "checkers", origin)
                        : (base == null ? List.of() : base.checkers());
        List<String> fixers =
                map.containsKey("fixers")
                        ? selector(map.get("fixers"), "fixers", origin)
                        : (base == null ? List.of() : base.fixers());
        return new BuildConfig(source, target, checkers, fixers);
    }

    private static Version version(Map<?, ?> map, String key, Version fallback, String origin) {
        Object value = map.get(key);
        if (value == null) {
            if (fallback == null) {
                throw new ConfigurationException(origin + ": missing " + key);
            }
            return fallback;
        }
        return parseVersion(String.valueOf(value), origin + ": " + key);
    }

    /** @throws ConfigurationException naming {@code what} if {@code text} is not a version */
    public static Version parseVersion(String text, String what) {
        try {
            return Version.parse(text);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(what + ": " + e.getMessage(), e);
        }
    }

    private static List<String> selector(Object value, String key, String origin) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof String s) {
            return PassSelector.parse(s);
        }
        if (value instanceof List<?> list) {
            List<String> tokens = new ArrayList<>();
            for (Object item : list) {
                tokens.addAll(PassSelector.parse(String.valueOf(item)));
            }
            return tokens;
        }
        throw new ConfigurationException(origin + ": " + key + " must be a string or a list");
    }
}
