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
package net.boyechko.backport.errors;

/**
 * A fixer broke the rewrite contract: it returned no tree, or rewrote a statement into zero
 * statements. This is a defect in the fixer, not a problem with the input.
 */
public class FixerContractViolation extends IllegalStateException {
    private final String passName;

    public FixerContractViolation(String passName, String message) {
        super(passName + ": " + message);
        this.passName = passName;
    }

    public String passName() {
        return passName;
    }
}
