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
package net.starlark.lint.cmd;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MainTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
  private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
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

  private int run(String... args) {
    return Main.run(
        args, new PrintStream(outBytes, true, UTF_8), new PrintStream(errBytes, true, UTF_8));
  }

  private String out() {
    return outBytes.toString(UTF_8);
  }

  private String err() {
    return errBytes.toString(UTF_8);
  }

  private void writeWorkspace() throws IOException {
    scratch("main.star", "lib = import_module(\"/lib/deploy.star\")", "lib.deploy()");
    scratch("lib/deploy.star", "def deploy(plan):", "  pass");
  }

  @Test
  public void cleanWorkspace() throws Exception {
    scratch("main.star", "def run(plan):", "  \"\"\"Runs.\"\"\"", "  pass");

    assertThat(run("--all", root.toString())).isEqualTo(Main.EXIT_OK);
    assertThat(out()).contains("Analyzed 1 .star files");
    assertThat(out()).contains("No violations found");
    assertThat(err()).isEmpty();
  }

  @Test
  public void noChecksSelectedFindsNothing() throws Exception {
    writeWorkspace();

    assertThat(run(root.toString())).isEqualTo(Main.EXIT_OK);
    assertThat(out()).contains("Analyzed 2 .star files");
  }

  @Test
  public void allChecksReportViolations() throws Exception {
    writeWorkspace();
    Path main = root.resolve("main.star");
    Path lib = root.resolve("lib/deploy.star");

    assertThat(run("--all", root.toString())).isEqualTo(Main.EXIT_VIOLATIONS);
    assertThat(out())
        .contains(
            main
                + ":1: Global variable 'lib' contains the result of `import_module` and should be"
                + " private");
    assertThat(out())
        .contains(
            main
                + ":2: Missing required positional argument 'plan' in call to"
                + " 'deploy.star:deploy'");
    assertThat(out())
        .contains(
            lib + ":1: Public function 'deploy' is used in other modules and should be documented");
    assertThat(out()).contains("Found violations in the analyzed file(s)");
  }

  @Test
  public void singleCheckWithExplicitValue() throws Exception {
    writeWorkspace();

    assertThat(run("--calls=true", "--import-naming=false", root.toString()))
        .isEqualTo(Main.EXIT_VIOLATIONS);
    assertThat(out()).contains("Missing required positional argument 'plan'");
    assertThat(out()).doesNotContain("Global variable");
    assertThat(out()).doesNotContain("Public function");
  }

  @Test
  public void parallelJobs() throws Exception {
    writeWorkspace();

    assertThat(run("--calls", "--jobs", "3", root.toString())).isEqualTo(Main.EXIT_VIOLATIONS);
    assertThat(out()).contains("Missing required positional argument 'plan'");
  }

  @Test
  public void missingImportCheckCanBeDisabled() throws Exception {
    scratch("main.star", "_gone = import_module(\"/gone.star\")");

    assertThat(run(root.toString())).isEqualTo(Main.EXIT_VIOLATIONS);
    assertThat(out()).contains("Imported module '/gone.star' does not exist");

    outBytes.reset();
    assertThat(run("--no-check-file-exists", root.toString())).isEqualTo(Main.EXIT_OK);
    assertThat(out()).contains("No violations found");
  }

  @Test
  public void noScriptFiles() throws Exception {
    scratch("README.md", "# nothing here");

    assertThat(run(root.toString())).isEqualTo(Main.EXIT_OK);
    assertThat(out()).contains("No .star files found");
  }

  @Test
  public void missingPath() {
    String missing = root.resolve("missing").toString();

    assertThat(run(missing)).isEqualTo(Main.EXIT_USAGE);
    assertThat(err()).contains("No such file or directory: " + missing);
  }

  @Test
  public void unknownOption() {
    assertThat(run("--bogus", root.toString())).isEqualTo(Main.EXIT_USAGE);
    assertThat(err()).contains("--bogus");
  }

  @Test
  public void jobsMustBePositive() {
    assertThat(run("--jobs", "0", root.toString())).isEqualTo(Main.EXIT_USAGE);
    assertThat(err()).contains("--jobs must be positive: 0");
  }
}
