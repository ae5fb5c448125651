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
import javax.annotation.Nullable;

/** Syntax node for a 'def' statement, which defines a function. */
public final class DefStatement extends Statement {

  private final int defOffset;
  private final Identifier identifier;
  private final ImmutableList<Parameter> parameters;
  @Nullable private final Expression returnType;
  private final ImmutableList<Statement> body; // non-empty if well formed

  DefStatement(
      FileLocations locs,
      int defOffset,
      Identifier identifier,
      ImmutableList<Parameter> parameters,
      @Nullable Expression returnType,
      ImmutableList<Statement> body) {
    super(locs, Kind.DEF);
    this.defOffset = defOffset;
    this.identifier = identifier;
    this.parameters = parameters;
    this.returnType = returnType;
    this.body = body;
  }

  @Override
  public String toString() {
    // "def f(...): \n"
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf).printDefSignature(this);
    buf.append(" ...\n");
    return buf.toString();
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  /** Returns the function's name. */
  public String getName() {
    return identifier.getName();
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  public ImmutableList<Parameter> getParameters() {
    return parameters;
  }

  /** Returns the return type annotation ({@code -> T}), if any. */
  @Nullable
  public Expression getReturnType() {
    return returnType;
  }

  /**
   * Reports whether the body starts with a string literal expression statement, which documents
   * the function.
   */
  public boolean hasDocString() {
    return !body.isEmpty()
        && body.get(0) instanceof ExpressionStatement stmt
        && stmt.getExpression() instanceof StringLiteral;
  }

  @Override
  public int getStartOffset() {
    return defOffset;
  }

  @Override
  public int getEndOffset() {
    return body.isEmpty()
        ? identifier.getEndOffset() // wrong, but tree is ill formed
        : body.get(body.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
