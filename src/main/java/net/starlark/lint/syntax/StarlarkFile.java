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
package net.starlark.lint.syntax;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Syntax tree for a script file.
 *
 * <p>A file is parsed in full even when it contains errors; the statements of a file with errors
 * are a best-effort approximation and should generally not be analyzed.
 */
public final class StarlarkFile extends Node {

  private final ImmutableList<Statement> statements;
  final List<SyntaxError> errors; // appended to by parser

  private StarlarkFile(
      FileLocations locs, ImmutableList<Statement> statements, List<SyntaxError> errors) {
    super(locs);
    this.statements = statements;
    this.errors = errors;
  }

  /**
   * Returns an unmodifiable view of the list of scanner, parser, and (perhaps) resolver errors
   * accumulated in this file.
   */
  public List<SyntaxError> errors() {
    return Collections.unmodifiableList(errors);
  }

  /** Returns errors().isEmpty(). */
  public boolean ok() {
    return errors.isEmpty();
  }

  /** Returns an (immutable, ordered) list of statements in this file. */
  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public int getStartOffset() {
    return 0;
  }

  @Override
  public int getEndOffset() {
    return statements.isEmpty() ? 0 : statements.get(statements.size() - 1).getEndOffset();
  }

  @Override
  public String toString() {
    return "<StarlarkFile with " + statements.size() + " statements>";
  }

  /**
   * Parse the specified file, returning its syntax tree with the errors list set. Clients should
   * check {@link #ok} before using the tree.
   */
  public static StarlarkFile parse(ParserInput input) {
    Parser.ParseResult result = Parser.parseFile(input);
    return new StarlarkFile(result.locs(), result.statements(), result.errors());
  }

  /**
   * Reads and parses the file at the given path.
   *
   * @throws IOException if the file could not be read
   * @throws SyntaxError.Exception if the file contains syntax errors
   */
  public static StarlarkFile parseStrict(Path path) throws IOException, SyntaxError.Exception {
    StarlarkFile file = parse(ParserInput.readFile(path));
    if (!file.ok()) {
      throw new SyntaxError.Exception(file.errors());
    }
    return file;
  }
}
