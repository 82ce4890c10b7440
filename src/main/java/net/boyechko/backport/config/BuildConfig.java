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

import java.util.List;
import java.util.Objects;
import net.boyechko.backport.pass.PassSelector;
import net.boyechko.backport.version.Version;

/**
 * What one run should do: the dialect the input was written for, the dialect the output must
 * run on, and which checkers and fixers to consider. Empty selectors mean "all".
 */
public record BuildConfig(
        Version sourceVersion, Version targetVersion, List<String> checkers, List<String> fixers) {

    public BuildConfig {
        Objects.requireNonNull(sourceVersion, "sourceVersion");
        Objects.requireNonNull(targetVersion, "targetVersion");
        checkers = checkers == null ? List.of() : List.copyOf(checkers);
        fixers = fixers == null ? List.of() : List.copyOf(fixers);
    }

    public static BuildConfig of(String sourceVersion, String targetVersion) {
        return new BuildConfig(
                Version.parse(sourceVersion), Version.parse(targetVersion), List.of(), List.of());
    }

    public BuildConfig withSourceVersion(Version version) {
        return new BuildConfig(version, targetVersion, checkers, fixers);
    }

    public BuildConfig withTargetVersion(Version version) {
        return new BuildConfig(sourceVersion, version, checkers, fixers);
    }

    public BuildConfig withCheckers(List<String> selector) {
        return new BuildConfig(sourceVersion, targetVersion, selector, fixers);
    }

    /** Comma-separated form, as given on the command line. */
    public BuildConfig withCheckers(String selector) {
        return withCheckers(PassSelector.parse(selector));
    }

    public BuildConfig withFixers(List<String> selector) {
        return new BuildConfig(sourceVersion, targetVersion, checkers, selector);
    }

    public BuildConfig withFixers(String selector) {
        return withFixers(PassSelector.parse(selector));
    }

    /** True when the target is newer than the source, which no fixer is written for. */
    public boolean isUpgrade() {
        return targetVersion.compareTo(sourceVersion) > 0;
    }
}
