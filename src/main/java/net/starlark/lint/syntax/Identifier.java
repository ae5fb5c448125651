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

/** Syntax node for an identifier. */
public final class Identifier extends Expression {

  private final String name;
  private final int nameOffset;

  Identifier(FileLocations locs, String name, int nameOffset) {
    super(locs);
    this.name = name;
    this.nameOffset = nameOffset;
  }

  @Override
  public int getStartOffset() {
    return nameOffset;
  }

  @Override
  public int getEndOffset() {
    return nameOffset + name.length();
  }

  /**
   * Returns the name of the Identifier. If there were parse errors, misparsed regions may be
   * represented as an Identifier for which {@code !isValid(getName())}.
   */
  public String getName() {
    return name;
  }

  public boolean isPrivate() {
    return name.startsWith("_");
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.IDENTIFIER;
  }

  /** Reports whether the string is a valid identifier. */
  public static boolean isValid(String name) {
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!(('a' <= c && c <= 'z')
          || ('A' <= c && c <= 'Z')
          || (i > 0 && '0' <= c && c <= '9')
          || (c == '_'))) {
        return false;
      }
    }
    return !name.isEmpty();
  }

  /**
   * Returns all names bound by an LHS expression, in order.
   *
   * <p>Examples:
   *
   * <ul>
   *   <li>{@code x = ...} binds x.
   *   <li>{@code x, [y,z] = ..} binds x, y, z.
   *   <li>{@code x[5] = ..} does not bind any names.
   * </ul>
   */
  public static ImmutableList<Identifier> boundIdentifiers(Expression lhs) {
    ImmutableList.Builder<Identifier> result = ImmutableList.builder();
    collectBoundIdentifiers(lhs, result);
    return result.build();
  }

  private static void collectBoundIdentifiers(
      Expression lhs, ImmutableList.Builder<Identifier> result) {
    if (lhs instanceof Identifier id) {
      result.add(id);
    } else if (lhs instanceof ListExpression list) {
      for (Expression elem : list.getElements()) {
        collectBoundIdentifiers(elem, result);
      }
    }
  }
}
