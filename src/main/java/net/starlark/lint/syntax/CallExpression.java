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

/** Syntax node for a function call expression. */
public final class CallExpression extends Expression {

  private final Expression function;
  private final int lparenOffset;
  private final ImmutableList<Argument> arguments;
  private final int rparenOffset;

  // Counts of arguments by kind, computed once.
  private final int numPositionalArgs;
  private final boolean hasStar;
  private final boolean hasStarStar;

  CallExpression(
      FileLocations locs,
      Expression function,
      int lparenOffset,
      ImmutableList<Argument> arguments,
      int rparenOffset) {
    super(locs);
    this.function = function;
    this.lparenOffset = lparenOffset;
    this.arguments = arguments;
    this.rparenOffset = rparenOffset;

    int n = 0;
    boolean star = false;
    boolean starStar = false;
    for (Argument arg : arguments) {
      if (arg instanceof Argument.Positional) {
        n++;
      } else if (arg instanceof Argument.Star) {
        star = true;
      } else if (arg instanceof Argument.StarStar) {
        starStar = true;
      }
    }
    this.numPositionalArgs = n;
    this.hasStar = star;
    this.hasStarStar = starStar;
  }

  /** Returns the function that is called. */
  public Expression getFunction() {
    return this.function;
  }

  /** Returns the number of arguments of type {@code Argument.Positional}. */
  public int getNumPositionalArguments() {
    return numPositionalArgs;
  }

  /** Reports whether the call spreads an iterable with {@code *args}. */
  public boolean hasStarArgument() {
    return hasStar;
  }

  /** Reports whether the call spreads a mapping with {@code **kwargs}. */
  public boolean hasStarStarArgument() {
    return hasStarStar;
  }

  /** Returns the function arguments. */
  public ImmutableList<Argument> getArguments() {
    return arguments;
  }

  @Override
  public int getStartOffset() {
    return function.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return rparenOffset + 1;
  }

  public Location getLparenLocation() {
    return locs.getLocation(lparenOffset);
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.CALL;
  }
}
