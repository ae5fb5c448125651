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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class WorkspaceTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private Path root;

  @Before
  public void setUp() {
    root = tmp.getRoot().toPath().toAbsolutePath().normalize();
  }

  private Path touch(String name) throws IOException {
    Path file = root.resolve(name);
    Files.createDirectories(file.getParent());
    Files.writeString(file, "");
    return file;
  }

  @Test
  public void findRootStopsAtNearestMarker() throws Exception {
    touch("kurtosis.yml");
    touch("sub/kurtosis.yml");
    Path script = touch("sub/dir/main.star");

    assertThat(Workspace.findRoot(script)).isEqualTo(root.resolve("sub"));
    assertThat(Workspace.findRoot(script.getParent())).isEqualTo(root.resolve("sub"));
    assertThat(Workspace.findRoot(root)).isEqualTo(root);
  }

  @Test
  public void findRootWithoutMarkerIsTheStartDirectory() throws Exception {
    Path script = touch("a/b/main.star");
    // An enclosing directory of the temporary folder could hold a marker; ignore that case.
    Path found = Workspace.findRoot(script);
    if (!Files.exists(found.resolve(Workspace.MARKER))) {
      assertThat(found).isEqualTo(root.resolve("a/b"));
    }
  }

  @Test
  public void findScriptsWalksDirectoriesInPathOrder() throws Exception {
    Path b = touch("pkg/b.star");
    Path a = touch("pkg/a.star");
    Path nested = touch("pkg/nested/c.star");
    touch("pkg/README.md");
    Path single = touch("other/main.star");

    ImmutableList<Path> scripts =
        Workspace.findScripts(ImmutableList.of(single, root.resolve("pkg"), a));

    assertThat(scripts).containsExactly(single, a, b, nested).inOrder();
  }

  @Test
  public void findScriptsSkipsOtherFiles() throws Exception {
    Path notes = touch("notes.txt");
    assertThat(Workspace.findScripts(ImmutableList.of(notes))).isEmpty();
  }

  @Test
  public void findScriptsRejectsMissingPaths() {
    NoSuchFileException e =
        assertThrows(
            NoSuchFileException.class,
            () -> Workspace.findScripts(ImmutableList.of(root.resolve("missing"))));
    assertThat(e.getFile()).endsWith("missing");
  }
}
