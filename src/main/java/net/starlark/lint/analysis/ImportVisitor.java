// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.starlark.lint.analysis;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import net.starlark.lint.syntax.Argument;
import net.starlark.lint.syntax.CallExpression;
import net.starlark.lint.syntax.Expression;
import net.starlark.lint.syntax.Identifier;
import net.starlark.lint.syntax.StringLiteral;

/**
 * Finds the {@code import_module} calls of a file and the aliases between variables, building the
 * file's {@link ImportTable}.
 *
 * <p>Optionally reports global variables holding imported modules whose names are not private, and
 * imports whose target file does not exist.
 */
public final class ImportVisitor extends ScopedVisitor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** The builtin that loads another file as a module. */
  public static final String IMPORT_FUNCTION = "import_module";

  private final Path file;
  private final Path workspaceRoot;
  private final boolean checkNaming;
  private final boolean checkFileExists;

  private final ImportTable table = new ImportTable();
  private final List<Violation> violations = new ArrayList<>();

  public ImportVisitor(
      Path file, Path workspaceRoot, boolean checkNaming, boolean checkFileExists) {
    this.file = file;
    this.workspaceRoot = workspaceRoot;
    this.checkNaming = checkNaming;
    this.checkFileExists = checkFileExists;
  }

  public ImportTable getImportTable() {
    return table;
  }

  public ImmutableList<Violation> getViolations() {
    return ImmutableList.copyOf(violations);
  }

  @Override
  protected void onAssign(Identifier target, @Nullable Expression value) {
    if (value instanceof CallExpression call && isImportCall(call)) {
      String path = modulePathArgument(call);
      if (path == null) {
        logger.atFine().log(
            "%s: ignoring %s call without a string path", call.getStartLocation(), IMPORT_FUNCTION);
        return;
      }
      addImport(target, path);
    } else if (value instanceof Identifier source) {
      table.addAlias(target.getName(), source.getName());
      if (table.isImport(source.getName())) {
        checkGlobalName(target, /* isAlias= */ true);
      }
    }
  }

  private void addImport(Identifier target, String path) {
    ImportBinding binding =
        ImportBinding.create(target.getName(), path, file, workspaceRoot, target.getLine());
    table.addBinding(binding);
    logger.atFine().log(
        "%s: %s = %s(\"%s\") [%s] -> %s",
        file, target.getName(), IMPORT_FUNCTION, path, binding.kind(), binding.resolvedPath());

    if (checkFileExists
        && binding.resolvedPath() != null
        && !Files.isRegularFile(binding.resolvedPath())) {
      violations.add(
          Violation.of(
              file,
              target.getLine(),
              "Imported module '%s' does not exist at resolved path '%s'",
              path,
              binding.resolvedPath()));
    }
    checkGlobalName(target, /* isAlias= */ false);
  }

  // Only module-level state is subject to the naming convention.
  private void checkGlobalName(Identifier target, boolean isAlias) {
    if (!checkNaming || !scope.isGlobal() || target.isPrivate()) {
      return;
    }
    violations.add(
        isAlias
            ? Violation.of(
                file,
                target.getLine(),
                "Global variable '%s' is an alias to an `%s` result and should be private",
                target.getName(),
                IMPORT_FUNCTION)
            : Violation.of(
                file,
                target.getLine(),
                "Global variable '%s' contains the result of `%s` and should be private",
                target.getName(),
                IMPORT_FUNCTION));
  }

  static boolean isImportCall(CallExpression call) {
    return call.getFunction() instanceof Identifier fn && fn.getName().equals(IMPORT_FUNCTION);
  }

  // Returns the first argument if it is a positional string literal.
  @Nullable
  private static String modulePathArgument(CallExpression call) {
    List<Argument> args = call.getArguments();
    if (!args.isEmpty()
        && args.get(0) instanceof Argument.Positional
        && args.get(0).getValue() instanceof StringLiteral literal) {
      return literal.getValue();
    }
    return null;
  }
}
