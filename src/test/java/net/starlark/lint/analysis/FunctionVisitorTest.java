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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import net.starlark.lint.syntax.ParserInput;
import net.starlark.lint.syntax.StarlarkFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FunctionVisitorTest {

  private static final Path ROOT = Path.of("/ws");
  private static final Path LIB = ROOT.resolve("lib.star");
  private static final Path MAIN = ROOT.resolve("main.star");
  private static final Path UTIL = ROOT.resolve("util/util.star");

  private final AnalysisState state =
      new AnalysisState(ModuleIndex.forFiles(ImmutableList.of(LIB, MAIN, UTIL), ROOT));

  private boolean checkCalls = true;

  // Analyzes one file against the shared state, as the first pass of the analyzer does.
  private FunctionVisitor analyze(Path file, String... lines) {
    StarlarkFile ast = StarlarkFile.parse(ParserInput.fromLines(lines));
    assertThat(ast.errors()).isEmpty();
    ImportVisitor imports = new ImportVisitor(file, ROOT, false, false);
    imports.visit(ast);
    state.putImports(file, imports.getImportTable());
    FunctionVisitor functions =
        new FunctionVisitor(file, imports.getImportTable(), state, checkCalls);
    functions.visit(ast);
    state.putSignatures(file, functions.getSignatures());
    return functions;
  }

  private static ImmutableList<String> messages(FunctionVisitor visitor) {
    return visitor.getViolations().stream().map(Violation::message).collect(toImmutableList());
  }

  @Test
  public void collectsTopLevelSignatures() {
    FunctionVisitor visitor =
        analyze(
            MAIN,
            "def run(plan, args):",
            "  \"\"\"Entry point.\"\"\"",
            "  def helper():",
            "    pass",
            "  helper()",
            "def _private():",
            "  pass");
    assertThat(visitor.getSignatures().keySet()).containsExactly("run", "_private").inOrder();
    assertThat(visitor.getSummaries())
        .containsExactly(
            new FunctionSummary("run", 1, true), new FunctionSummary("_private", 6, false))
        .inOrder();
    assertThat(visitor.getViolations()).isEmpty();
  }

  @Test
  public void localCallIsChecked() {
    FunctionVisitor visitor = analyze(MAIN, "def f(a):", "  pass", "f()");
    assertThat(visitor.getViolations()).hasSize(1);
    Violation violation = visitor.getViolations().get(0);
    assertThat(violation.file()).isEqualTo(MAIN);
    assertThat(violation.line()).isEqualTo(3);
    assertThat(violation.message())
        .isEqualTo("Missing required positional argument 'a' in call to 'f'");
  }

  @Test
  public void callMayPrecedeDefinition() {
    FunctionVisitor visitor = analyze(MAIN, "def g():", "  f(1, 2)", "def f(a):", "  pass");
    assertThat(messages(visitor)).containsExactly("Too many positional arguments in call to 'f'");
  }

  @Test
  public void builtinsAndParametersAreNotChecked() {
    FunctionVisitor visitor =
        analyze(
            MAIN,
            "def g(callback):",
            "  callback(1, 2)",
            "  plan.add_service(name = 'x')",
            "print(1, 2, 3)",
            "len()");
    assertThat(visitor.getViolations()).isEmpty();
  }

  @Test
  public void nestedFunctionsAreChecked() {
    FunctionVisitor visitor =
        analyze(MAIN, "def outer():", "  def inner(x):", "    pass", "  inner()");
    assertThat(messages(visitor))
        .containsExactly("Missing required positional argument 'x' in call to 'inner'");
    assertThat(visitor.getSignatures()).doesNotContainKey("inner");
  }

  @Test
  public void nestedCallsAreChecked() {
    FunctionVisitor visitor =
        analyze(
            MAIN,
            "def f(a):",
            "  return struct(g = f)",
            "def g(b):",
            "  pass",
            "f(g())",
            "f(1).g(2)");
    assertThat(messages(visitor))
        .containsExactly("Missing required positional argument 'b' in call to 'g'");
  }

  @Test
  public void qualifiedCallIntoImportedModule() {
    analyze(LIB, "def deploy(plan, name):", "  pass");
    FunctionVisitor visitor =
        analyze(MAIN, "_lib = import_module(\"/lib.star\")", "_lib.deploy(plan)");
    assertThat(messages(visitor))
        .containsExactly(
            "Missing required positional argument 'name' in call to 'lib.star:deploy'");
    assertThat(state.isReferenced(LIB, "deploy")).isTrue();
  }

  @Test
  public void qualifiedCallThroughAlias() {
    analyze(LIB, "def deploy(plan, name):", "  pass");
    FunctionVisitor visitor =
        analyze(
            MAIN,
            "_lib = import_module(\"./lib.star\")",
            "_alias = _lib",
            "_alias.deploy(1, 2, 3)");
    assertThat(messages(visitor))
        .containsExactly("Too many positional arguments in call to 'lib.star:deploy'");
  }

  @Test
  public void relativeImportFromSubdirectory() {
    analyze(LIB, "def deploy(plan):", "  pass");
    FunctionVisitor visitor =
        analyze(UTIL, "_lib = import_module(\"../lib.star\")", "_lib.deploy(plan, 1)");
    assertThat(messages(visitor))
        .containsExactly("Too many positional arguments in call to 'lib.star:deploy'");
  }

  @Test
  public void callToNonExistentFunction() {
    analyze(LIB, "def deploy(plan):", "  pass");
    FunctionVisitor visitor =
        analyze(MAIN, "_lib = import_module(\"/lib.star\")", "_lib.missing()");
    assertThat(messages(visitor))
        .containsExactly("Call to non-existent function 'missing' in module '_lib'");
  }

  @Test
  public void callOnUndefinedObject() {
    FunctionVisitor visitor =
        analyze(MAIN, "x = struct(f = len)", "x.f([])", "undefined.f()", "json.encode({})");
    assertThat(messages(visitor))
        .containsExactly(
            "Invalid object 'undefined' in call to 'undefined.f': object is not defined");
  }

  @Test
  public void callIntoModuleNotAnalyzed() {
    FunctionVisitor visitor = analyze(MAIN, "_o = import_module(\"/other.star\")", "_o.f()");
    assertThat(messages(visitor))
        .containsExactly("Module '_o' has not been analyzed for call to '_o.f'");
  }

  @Test
  public void callIntoUnresolvableModule() {
    StarlarkFile ast =
        StarlarkFile.parse(ParserInput.fromLines("_o = import_module(\"/other.star\")", "_o.f()"));
    ImportVisitor imports = new ImportVisitor(MAIN, ROOT, false, false);
    imports.visit(ast);
    FunctionVisitor visitor =
        new FunctionVisitor(MAIN, imports.getImportTable(), new AnalysisState(), true);
    visitor.visit(ast);
    assertThat(messages(visitor))
        .containsExactly("Could not resolve module '_o' for call to '_o.f'");
  }

  @Test
  public void externalCallsAreNotChecked() {
    FunctionVisitor visitor =
        analyze(
            MAIN,
            "_pg = import_module(\"github.com/kurtosis-tech/postgres-package/main.star\")",
            "_pg.run(1, 2, 3, 4)");
    assertThat(visitor.getViolations()).isEmpty();
  }

  @Test
  public void bareCallToFunctionOfAnotherFile() {
    analyze(LIB, "def deploy(a):", "  pass");
    FunctionVisitor visitor = analyze(MAIN, "deploy()");
    assertThat(messages(visitor))
        .containsExactly(
            "Missing required positional argument 'a' in call to 'lib.star:deploy'");
    assertThat(state.isReferenced(LIB, "deploy")).isTrue();
  }

  @Test
  public void ambiguousBareCallIsNotChecked() {
    analyze(LIB, "def helper(a):", "  pass");
    analyze(UTIL, "def helper(a, b):", "  pass");
    FunctionVisitor visitor = analyze(MAIN, "helper()");
    assertThat(visitor.getViolations()).isEmpty();
    assertThat(state.isReferenced(LIB, "helper")).isTrue();
    assertThat(state.isReferenced(UTIL, "helper")).isFalse();
  }

  @Test
  public void functionsUsedAsValuesAreReferenced() {
    analyze(
        LIB,
        "def a():",
        "  pass",
        "def b():",
        "  pass",
        "def c():",
        "  pass",
        "def d():",
        "  pass");
    FunctionVisitor visitor =
        analyze(
            MAIN,
            "_lib = import_module(\"/lib.star\")",
            "steps = [_lib.a, 1]",
            "handlers = {\"b\": _lib.b}",
            "cb = _lib.c",
            "run(fn = _lib.d, other = _lib.nope)");
    assertThat(visitor.getViolations()).isEmpty();
    assertThat(state.isReferenced(LIB, "a")).isTrue();
    assertThat(state.isReferenced(LIB, "b")).isTrue();
    assertThat(state.isReferenced(LIB, "c")).isTrue();
    assertThat(state.isReferenced(LIB, "d")).isTrue();
    assertThat(state.isReferenced(LIB, "nope")).isFalse();
  }

  @Test
  public void referencesAreRecordedWhenCallsAreNotChecked() {
    checkCalls = false;
    analyze(LIB, "def deploy(a):", "  pass");
    FunctionVisitor visitor =
        analyze(MAIN, "_lib = import_module(\"/lib.star\")", "_lib.deploy()");
    assertThat(visitor.getViolations()).isEmpty();
    assertThat(state.isReferenced(LIB, "deploy")).isTrue();
  }

  @Test
  public void callsWithinTheSameFileAreNotReferences() {
    FunctionVisitor visitor = analyze(LIB, "def deploy():", "  pass", "deploy()");
    assertThat(visitor.getViolations()).isEmpty();
    assertThat(state.references()).isEmpty();
  }
}
