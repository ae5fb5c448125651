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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import net.starlark.lint.syntax.Argument;
import net.starlark.lint.syntax.CallExpression;

/**
 * Checks that the arguments of a call can bind to the parameters of a {@link FunctionSignature}.
 *
 * <p>The check is deliberately lenient where the binding cannot be known statically: a call that
 * spreads {@code *args} is not checked for positional counts, and one that spreads {@code **kwargs}
 * is not checked for missing arguments. Excess positional arguments are tolerated as long as they
 * could fill the keyword-only parameters.
 */
final class CallChecker {

  private CallChecker() {}

  /**
   * Returns the problems with {@code call}, a call to {@code signature}, in a fixed order: too
   * many positional arguments, missing positional arguments, invalid keywords, missing keyword-only
   * arguments.
   *
   * @param callee how the function is named in messages
   */
  static ImmutableList<String> check(
      CallExpression call, FunctionSignature signature, String callee) {
    List<String> problems = new ArrayList<>();
    int positional = call.getNumPositionalArguments();
    boolean star = call.hasStarArgument();
    boolean starStar = call.hasStarStarArgument();
    Set<String> keywords = new LinkedHashSet<>();
    for (Argument arg : call.getArguments()) {
      if (arg.getName() != null) {
        keywords.add(arg.getName());
      }
    }

    List<String> params = signature.parameters();
    if (!star && signature.varargs() == null && positional > params.size()) {
      int excess = positional - params.size();
      if (excess > signature.keywordOnly().size()) {
        problems.add(String.format("Too many positional arguments in call to '%s'", callee));
      }
    }

    int required = signature.requiredCount();
    if (!star && !starStar) {
      List<String> missing = new ArrayList<>();
      for (int i = positional; i < required; i++) {
        if (!keywords.contains(params.get(i))) {
          missing.add(params.get(i));
        }
      }
      if (!missing.isEmpty()) {
        problems.add(
            String.format(
                "Missing required positional argument%s %s in call to '%s'",
                missing.size() > 1 ? "s" : "",
                missing.stream().map(name -> "'" + name + "'").collect(Collectors.joining(", ")),
                callee));
      }
    }

    if (signature.kwargs() == null) {
      for (String keyword : keywords) {
        if (!params.contains(keyword) && !signature.keywordOnly().containsKey(keyword)) {
          problems.add(
              String.format("Invalid keyword argument '%s' in call to '%s'", keyword, callee));
        }
      }
    }

    if (!starStar) {
      for (Map.Entry<String, Boolean> param : signature.keywordOnly().entrySet()) {
        if (!param.getValue() && !keywords.contains(param.getKey())) {
          problems.add(
              String.format(
                  "Missing required keyword-only argument '%s' in call to '%s'",
                  param.getKey(), callee));
        }
      }
    }
    return ImmutableList.copyOf(problems);
  }
}
