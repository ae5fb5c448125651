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

import net.starlark.lint.syntax.Expression;
import net.starlark.lint.syntax.Identifier;

/**
 * The value a {@link Scope} records for a bound name. Only the shapes needed for alias tracking are
 * distinguished; anything else is kept as the raw right-hand side.
 */
public sealed interface SymbolicValue
    permits SymbolicValue.Unknown,
        SymbolicValue.NameAlias,
        SymbolicValue.PositionalElement,
        SymbolicValue.RawExpression {

  /** The answer for a name with nothing recorded. */
  SymbolicValue UNKNOWN = new Unknown();

  /** Nothing is known about the value. */
  record Unknown() implements SymbolicValue {}

  /** The name was assigned the plain value of another name, {@code x = y}. */
  record NameAlias(String name) implements SymbolicValue {}

  /**
   * The name is element {@code index} of a destructuring assignment whose right-hand side is not a
   * literal sequence, {@code a, b = f()}.
   */
  record PositionalElement(Expression source, int index) implements SymbolicValue {}

  /** The name was assigned some other expression. */
  record RawExpression(Expression expression) implements SymbolicValue {}

  /** Returns the symbolic value of assigning {@code value} to a single name. */
  static SymbolicValue of(Expression value) {
    return value instanceof Identifier id
        ? new NameAlias(id.getName())
        : new RawExpression(value);
  }
}
