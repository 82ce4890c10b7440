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
package net.boyechko.backport.version;

import java.util.Objects;

/**
 * When a fixer runs. {@code applySince..applyUntil} bounds the target versions that need the
 * rewrite; {@code worksSince..worksUntil} bounds the source versions whose code the rewrite
 * understands. A null {@code worksUntil} is unbounded. All bounds are inclusive.
 */
public record VersionWindow(
        Version applySince, Version applyUntil, Version worksSince, Version worksUntil) {

    public VersionWindow {
        Objects.requireNonNull(applySince, "applySince");
        Objects.requireNonNull(applyUntil, "applyUntil");
        if (worksSince == null) {
            worksSince = applySince;
        }
        if (applySince.compareTo(applyUntil) > 0) {
            throw new IllegalArgumentException(
                    "applySince " + applySince + " is after applyUntil " + applyUntil);
        }
    }

    public static VersionWindow of(String applySince, String applyUntil) {
        return new VersionWindow(Version.parse(applySince), Version.parse(applyUntil), null, null);
    }

    public VersionWindow withWorksUntil(String worksUntil) {
        return new VersionWindow(applySince, applyUntil, worksSince, Version.parse(worksUntil));
    }

    /** The target needs this rewrite. */
    public boolean isRequiredFor(Version target) {
        return applySince.isAtMost(target) && target.isAtMost(applyUntil);
    }

    /** Code written for {@code source} is something the rewrite can handle. */
    public boolean isSafeOnSource(Version source) {
        return worksSince.isAtMost(source) && (worksUntil == null || source.isAtMost(worksUntil));
    }

    public boolean isApplicable(Version source, Version target) {
        return isSafeOnSource(source) && isRequiredFor(target);
    }

    @Override
    public String toString() {
        String works = worksUntil == null ? worksSince + "+" : worksSince + ".." + worksUntil;
        return "apply " + applySince + ".." + applyUntil + ", works " + works;
    }
}
