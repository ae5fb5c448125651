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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import net.starlark.lint.syntax.CallExpression;
import net.starlark.lint.syntax.DefStatement;
import net.starlark.lint.syntax.ExpressionStatement;
import net.starlark.lint.syntax.ParserInput;
import net.starlark.lint.syntax.StarlarkFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CallCheckerTest {

  private static final Path FILE = Path.of("/ws/lib.star");

  // Checks a call to the function declared by the def line, which must be named f.
  private static ImmutableList<String> check(String def, String call) {
    StarlarkFile file = StarlarkFile.parse(ParserInput.fromLines(def, "  pass", call));
    assertThat(file.errors()).isEmpty();
    FunctionSignature signature =
        FunctionSignature.of((DefStatement) file.getStatements().get(0), FILE);
    CallExpression expr =
        (CallExpression) ((ExpressionStatement) file.getStatements().get(1)).getExpression();
    return CallChecker.check(expr, signature, "f");
  }

  @Test
  public void compatibleCalls() {
    assertThat(check("def f(a, b=1):", "f(1)")).isEmpty();
    assertThat(check("def f(a, b=1):", "f(1, 2)")).isEmpty();
    assertThat(check("def f(a, b=1):", "f(a=1)")).isEmpty();
    assertThat(check("def f(a, b=1):", "f(b=2, a=1)")).isEmpty();
    assertThat(check("def f():", "f()")).isEmpty();
  }

  @Test
  public void missingPositionalArgument() {
    assertThat(check("def f(a, b=1):", "f()"))
        .containsExactly("Missing required positional argument 'a' in call to 'f'");
  }

  @Test
  public void missingPositionalArguments() {
    assertThat(check("def f(a, b, c):", "f(1)"))
        .containsExactly("Missing required positional arguments 'b', 'c' in call to 'f'");
    assertThat(check("def f(a, b, c):", "f(1, c=3)"))
        .containsExactly("Missing required positional argument 'b' in call to 'f'");
  }

  @Test
  public void tooManyPositionalArguments() {
    assertThat(check("def f(a):", "f(1, 2)"))
        .containsExactly("Too many positional arguments in call to 'f'");
  }

  @Test
  public void varargsAbsorbPositionalArguments() {
    assertThat(check("def f(a, *args):", "f(1, 2, 3)")).isEmpty();
  }

  @Test
  public void excessPositionalArgumentsUpToKeywordOnlyCountAreTolerated() {
    assertThat(check("def f(a, *, b=1):", "f(1, 2)")).isEmpty();
    assertThat(check("def f(a, *, b=1):", "f(1, 2, 3)"))
        .containsExactly("Too many positional arguments in call to 'f'");
  }

  @Test
  public void invalidKeywordArgument() {
    assertThat(check("def f(a):", "f(a=1, z=2)"))
        .containsExactly("Invalid keyword argument 'z' in call to 'f'");
  }

  @Test
  public void kwargsAbsorbKeywordArguments() {
    assertThat(check("def f(a, **kwargs):", "f(1, z=2)")).isEmpty();
  }

  @Test
  public void keywordOnlyArguments() {
    assertThat(check("def f(a, *, b, c=1):", "f(1)"))
        .containsExactly("Missing required keyword-only argument 'b' in call to 'f'");
    assertThat(check("def f(a, *, b, c=1):", "f(1, b=2)")).isEmpty();
    assertThat(check("def f(a, *args, b):", "f(1, 2, b=3, c=4)"))
        .containsExactly("Invalid keyword argument 'c' in call to 'f'");
  }

  @Test
  public void spreadArgumentsSuppressCountChecks() {
    assertThat(check("def f(a, b):", "f(*args)")).isEmpty();
    assertThat(check("def f(a, b):", "f(1, 2, 3, *args)")).isEmpty();
    assertThat(check("def f(a, *, b):", "f(**kwargs)")).isEmpty();
    assertThat(check("def f(a, b):", "f(*args, z=1)"))
        .containsExactly("Invalid keyword argument 'z' in call to 'f'");
  }

  @Test
  public void problemsAreReportedInOrder() {
    assertThat(check("def f(a, *, k):", "f(1, 2, 3, z=3)"))
        .containsExactly(
            "Too many positional arguments in call to 'f'",
            "Invalid keyword argument 'z' in call to 'f'",
            "Missing required keyword-only argument 'k' in call to 'f'")
        .inOrder();
  }

  @Test
  public void signatureExtraction() {
    StarlarkFile file =
        StarlarkFile.parse(
            ParserInput.fromLines(
                "def f(a, b=[1], *args, c, d=None, **kw):", "  \"\"\"Doc.\"\"\"", "  pass"));
    FunctionSignature signature =
        FunctionSignature.of((DefStatement) file.getStatements().get(0), FILE);
    assertThat(signature.name()).isEqualTo("f");
    assertThat(signature.file()).isEqualTo(FILE);
    assertThat(signature.line()).isEqualTo(1);
    assertThat(signature.parameters()).containsExactly("a", "b").inOrder();
    assertThat(signature.defaults()).containsExactly("[1]");
    assertThat(signature.requiredCount()).isEqualTo(1);
    assertThat(signature.varargs()).isEqualTo("args");
    assertThat(signature.keywordOnly()).containsExactly("c", false, "d", true).inOrder();
    assertThat(signature.kwargs()).isEqualTo("kw");
    assertThat(signature.documented()).isTrue();
    assertThat(signature.summary()).isEqualTo(new FunctionSummary("f", 1, true));
  }

  @Test
  public void bareStarIsNotVarargs() {
    StarlarkFile file = StarlarkFile.parse(ParserInput.fromLines("def f(a, *, b):", "  pass"));
    FunctionSignature signature =
        FunctionSignature.of((DefStatement) file.getStatements().get(0), FILE);
    assertThat(signature.varargs()).isNull();
    assertThat(signature.keywordOnly()).containsExactly("b", false);
    assertThat(signature.documented()).isFalse();
  }
}
