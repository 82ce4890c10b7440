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
package net.boyechko.backport.core;

import java.util.List;
import java.util.function.Supplier;
import net.boyechko.backport.checks.NoAsyncAwaitChecker;
import net.boyechko.backport.checks.NoOpenWithEncodingChecker;
import net.boyechko.backport.checks.NoOverriddenBuiltinsChecker;
import net.boyechko.backport.checks.NoOverriddenStdlibImportsChecker;
import net.boyechko.backport.checks.NoStarImportsChecker;
import net.boyechko.backport.fixes.BuiltinRenameFixer;
import net.boyechko.backport.fixes.FStringToStrFormatFixer;
import net.boyechko.backport.fixes.FutureImportFixer;
import net.boyechko.backport.fixes.InlineKWOnlyArgsFixer;
import net.boyechko.backport.fixes.ItertoolsBuiltinsFixer;
import net.boyechko.backport.fixes.NamedTupleClassToAssignFixer;
import net.boyechko.backport.fixes.NewStyleClassesFixer;
import net.boyechko.backport.fixes.RemoveAnnAssignFixer;
import net.boyechko.backport.fixes.RemoveFunctionDefAnnotationsFixer;
import net.boyechko.backport.fixes.ShortToLongFormSuperFixer;
import net.boyechko.backport.fixes.unpacking.UnpackingGeneralizationsFixer;
import net.boyechko.backport.pass.Checker;
import net.boyechko.backport.pass.Fixer;
import net.boyechko.backport.pass.PassRegistry;

/**
 * The built-in passes in execution order. The order is part of the tool's behavior: reordering
 * entries changes output.
 */
public final class PassDefaults {
    private PassDefaults() {}

    public static List<Supplier<? extends Checker>> checkers() {
        return List.of(
                NoStarImportsChecker::new,
                NoOverriddenStdlibImportsChecker::new,
                NoOverriddenBuiltinsChecker::new,
                NoOpenWithEncodingChecker::new,
                NoAsyncAwaitChecker::new);
    }

    public static List<Supplier<? extends Fixer>> fixers() {
        return List.of(
                () -> new FutureImportFixer("annotations", "3.7", "3.9"),
                () -> new FutureImportFixer("generator_stop", "3.5", "3.6"),
                () -> new FutureImportFixer("unicode_literals", "2.6", "2.7"),
                () -> new FutureImportFixer("print_function", "2.6", "2.7"),
                () -> new FutureImportFixer("with_statement", "2.5", "2.5"),
                () -> new FutureImportFixer("absolute_import", "2.5", "2.7"),
                () -> new FutureImportFixer("division", "2.2", "2.7"),
                () -> new FutureImportFixer("generators", "2.2", "2.2"),
                () -> new FutureImportFixer("nested_scopes", "2.1", "2.1"),
                () -> new BuiltinRenameFixer("xrange", "range"),
                () -> new BuiltinRenameFixer("unicode", "str"),
                () -> new BuiltinRenameFixer("unichr", "chr"),
                () -> new BuiltinRenameFixer("raw_input", "input"),
                RemoveFunctionDefAnnotationsFixer::new,
                // must see the annotated fields before they become plain assignments
                NamedTupleClassToAssignFixer::new,
                RemoveAnnAssignFixer::new,
                ShortToLongFormSuperFixer::new,
                InlineKWOnlyArgsFixer::new,
                FStringToStrFormatFixer::new,
                NewStyleClassesFixer::new,
                ItertoolsBuiltinsFixer::new,
                UnpackingGeneralizationsFixer::new);
    }

    public static PassRegistry registry() {
        return new PassRegistry(checkers(), fixers());
    }
}
