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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;
import javax.annotation.Nullable;
import net.starlark.lint.syntax.DefStatement;
import net.starlark.lint.syntax.Parameter;

/**
 * The parameter shape of a function definition.
 *
 * <p>For {@code def f(a, b=1, *args, c, d=2, **kwargs)}: parameters are {@code [a, b]}, defaults
 * {@code [1]}, varargs {@code args}, keyword-only {@code {c: required, d: optional}} and kwargs
 * {@code kwargs}.
 */
@AutoValue
public abstract class FunctionSignature {

  public abstract String name();

  /** The file that defines the function. */
  public abstract Path file();

  public abstract int line();

  /** Names of the parameters that may be passed positionally, in order. */
  public abstract ImmutableList<String> parameters();

  /** Source text of the defaults of the trailing optional positional parameters. */
  public abstract ImmutableList<String> defaults();

  @Nullable
  public abstract String varargs();

  /** Keyword-only parameter names, in order, mapped to whether they have a default. */
  public abstract ImmutableMap<String, Boolean> keywordOnly();

  @Nullable
  public abstract String kwargs();

  /** Whether the body starts with a docstring. */
  public abstract boolean documented();

  /** Returns the number of positional parameters without a default. */
  public final int requiredCount() {
    return parameters().size() - defaults().size();
  }

  public final FunctionSummary summary() {
    return new FunctionSummary(name(), line(), documented());
  }

  /** Extracts the signature of {@code def}, defined in {@code file}. */
  public static FunctionSignature of(DefStatement def, Path file) {
    ImmutableList.Builder<String> parameters = ImmutableList.builder();
    ImmutableList.Builder<String> defaults = ImmutableList.builder();
    ImmutableMap.Builder<String, Boolean> keywordOnly = ImmutableMap.builder();
    String varargs = null;
    String kwargs = null;
    boolean afterStar = false;

    for (Parameter param : def.getParameters()) {
      if (param instanceof Parameter.Star) {
        varargs = param.getName(); // null for a bare '*'
        afterStar = true;
      } else if (param instanceof Parameter.StarStar) {
        kwargs = param.getName();
      } else if (afterStar) {
        keywordOnly.put(param.getName(), param.getDefaultValue() != null);
      } else {
        parameters.add(param.getName());
        if (param.getDefaultValue() != null) {
          defaults.add(param.getDefaultValue().prettyPrint());
        }
      }
    }

    return new AutoValue_FunctionSignature(
        def.getName(),
        file,
        def.getLine(),
        parameters.build(),
        defaults.build(),
        varargs,
        keywordOnly.buildKeepingLast(),
        kwargs,
        def.hasDocString());
  }
}
