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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** End-to-end tests of {@link Analyzer} over files on disk. */
@RunWith(JUnit4.class)
public final class AnalyzerTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private Path root;

  @Before
  public void setUp() throws IOException {
    root = tmp.getRoot().toPath().toAbsolutePath().normalize();
    Files.writeString(root.resolve("kurtosis.yml"), "name: github.com/example/package\n");
  }

  private Path scratch(String name, String... lines) throws IOException {
    Path file = root.resolve(name);
    Files.createDirectories(file.getParent());
    Files.write(file, Joiner.on('\n').join(lines).getBytes(UTF_8));
    return file;
  }

  private ImmutableMap<Path, ImmutableList<Violation>> analyze(
      AnalysisOptions options, Path... files) throws InterruptedException {
    return new Analyzer(root, options).analyzeFiles(ImmutableList.copyOf(files));
  }

  private static ImmutableList<String> messages(ImmutableList<Violation> violations) {
    return violations.stream().map(Violation::message).collect(toImmutableList());
  }

  private Path writeScenario() throws IOException {
    scratch(
        "module.star",
        "def _private():",
        "    pass",
        "",
        "def documented():",
        "    \"\"\"Documented.\"\"\"",
        "    pass",
        "",
        "def undocumented():",
        "    pass");
    return scratch(
        "imports.star", "module = import_module(\"./module.star\")", "alias = module");
  }

  @Test
  public void allChecksOnImportingWorkspace() throws Exception {
    Path imports = writeScenario();
    Path module = root.resolve("module.star");

    ImmutableMap<Path, ImmutableList<Violation>> result =
        analyze(AnalysisOptions.all(), imports, module);

    assertThat(result.keySet()).containsExactly(imports, module).inOrder();
    assertThat(result.get(imports).stream().map(Violation::toString).collect(toImmutableList()))
        .containsExactly(
            imports
                + ":1: Global variable 'module' contains the result of `import_module` and should"
                + " be private",
            imports
                + ":2: Global variable 'alias' is an alias to an `import_module` result and should"
                + " be private")
        .inOrder();
    assertThat(result.get(module)).hasSize(1);
    assertThat(result.get(module).get(0).line()).isEqualTo(8);
    assertThat(result.get(module).get(0).message())
        .isEqualTo(
            "Function 'undocumented' is not documented and not used in other modules, consider"
                + " making it private");
  }

  @Test
  public void parallelAnalysisGivesTheSameResult() throws Exception {
    Path imports = writeScenario();
    Path module = root.resolve("module.star");
    Path other = scratch("lib/other.star", "def _helper():", "  pass");

    ImmutableMap<Path, ImmutableList<Violation>> sequential =
        analyze(AnalysisOptions.all(), imports, module, other);
    ImmutableMap<Path, ImmutableList<Violation>> parallel =
        analyze(AnalysisOptions.all().toBuilder().jobs(4).build(), imports, module, other);

    assertThat(parallel).isEqualTo(sequential);
  }

  @Test
  public void callsIntoFilesAnalyzedLaterAreChecked() throws Exception {
    Path main =
        scratch("main.star", "_lib = import_module(\"/lib/deploy.star\")", "_lib.deploy()");
    Path lib = scratch("lib/deploy.star", "def deploy(plan):", "  pass");

    ImmutableMap<Path, ImmutableList<Violation>> result =
        analyze(AnalysisOptions.builder().calls(true).build(), main, lib);

    assertThat(result.keySet()).containsExactly(main);
    assertThat(messages(result.get(main)))
        .containsExactly(
            "Missing required positional argument 'plan' in call to 'deploy.star:deploy'");
  }

  @Test
  public void usedFunctionShouldBeDocumented() throws Exception {
    Path main =
        scratch(
            "main.star",
            "_lib = import_module(\"/lib.star\")",
            "def run(plan):",
            "  \"\"\"Runs the package.\"\"\"",
            "  _lib.deploy(plan)");
    Path lib = scratch("lib.star", "def deploy(plan):", "  pass");

    ImmutableMap<Path, ImmutableList<Violation>> result =
        analyze(AnalysisOptions.builder().functionVisibility(true).build(), main, lib);

    assertThat(result.keySet()).containsExactly(lib);
    assertThat(messages(result.get(lib)))
        .containsExactly(
            "Public function 'deploy' is used in other modules and should be documented");
  }

  @Test
  public void functionsReferencedAsValuesAreUsed() throws Exception {
    Path main =
        scratch(
            "main.star",
            "_lib = import_module(\"./lib.star\")",
            "_STEPS = [_lib.first, _lib.second]",
            "_pair = (_lib.third, 1)",
            "_cb = _lib.fourth");
    Path lib =
        scratch(
            "lib.star",
            "def first():",
            "  pass",
            "def second():",
            "  pass",
            "def third():",
            "  pass",
            "def fourth():",
            "  pass");

    ImmutableMap<Path, ImmutableList<Violation>> result =
        analyze(AnalysisOptions.builder().functionVisibility(true).build(), main, lib);

    assertThat(messages(result.get(lib)))
        .containsExactly(
            "Public function 'first' is used in other modules and should be documented",
            "Public function 'second' is used in other modules and should be documented",
            "Public function 'third' is used in other modules and should be documented",
            "Public function 'fourth' is used in other modules and should be documented")
        .inOrder();
  }

  @Test
  public void privateTestAndDocumentedFunctionsAreExempt() throws Exception {
    Path lib =
        scratch(
            "lib.star",
            "def _private():",
            "  pass",
            "def test_something():",
            "  pass",
            "def multiline():",
            "  \"\"\"Does a thing.",
            "",
            "  Args:",
            "    none",
            "  \"\"\"",
            "  pass",
            "def single():",
            "  'Does a thing.'");

    assertThat(analyze(AnalysisOptions.all(), lib)).isEmpty();
  }

  @Test
  public void syntaxErrorIsReportedAtLineZero() throws Exception {
    Path broken = scratch("broken.star", "def f(:", "  pass");
    Path good = scratch("good.star", "def _f():", "  pass");

    ImmutableMap<Path, ImmutableList<Violation>> result =
        analyze(AnalysisOptions.all(), broken, good);

    assertThat(result.keySet()).containsExactly(broken);
    Violation violation = result.get(broken).get(0);
    assertThat(result.get(broken)).hasSize(1);
    assertThat(violation.line()).isEqualTo(0);
    assertThat(violation.message()).startsWith("Error analyzing file " + broken + ": ");
  }

  @Test
  public void missingImportIsReportedUnlessDisabled() throws Exception {
    Path main = scratch("main.star", "_gone = import_module(\"/gone.star\")");

    ImmutableMap<Path, ImmutableList<Violation>> result =
        analyze(AnalysisOptions.builder().build(), main);
    assertThat(messages(result.get(main)))
        .containsExactly(
            "Imported module '/gone.star' does not exist at resolved path '"
                + root.resolve("gone.star")
                + "'");

    assertThat(analyze(AnalysisOptions.builder().checkFileExists(false).build(), main)).isEmpty();
  }

  @Test
  public void duplicateInputsAreAnalyzedOnce() throws Exception {
    Path main = scratch("main.star", "x = import_module(\"github.com/a/b/c.star\")");
    ImmutableMap<Path, ImmutableList<Violation>> result =
        analyze(AnalysisOptions.builder().importNaming(true).build(), main, main);
    assertThat(result.get(main)).hasSize(1);
  }

  @Test
  public void analyzeFileUsesTheGivenState() throws Exception {
    Path lib = scratch("lib.star", "def deploy(plan):", "  pass");
    Path main = scratch("main.star", "_lib = import_module(\"/lib.star\")", "_lib.deploy(1, 2)");
    Analyzer analyzer = new Analyzer(root, AnalysisOptions.builder().calls(true).build());
    AnalysisState state = new AnalysisState();

    assertThat(analyzer.analyzeFile(lib, state)).isEmpty();
    assertThat(messages(analyzer.analyzeFile(main, state)))
        .containsExactly("Too many positional arguments in call to 'lib.star:deploy'");
    assertThat(state.isAnalyzed(lib)).isTrue();
    assertThat(state.isReferenced(lib, "deploy")).isTrue();
  }
}
