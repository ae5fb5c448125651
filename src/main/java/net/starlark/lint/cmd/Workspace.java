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

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import net.starlark.lint.analysis.ModulePath;

/** Locating the workspace root and the script files to analyze. */
final class Workspace {

  /** The file that marks the root directory of a package. */
  static final String MARKER = "kurtosis.yml";

  private Workspace() {}

  /**
   * Returns the nearest directory at or above {@code start} that contains {@link #MARKER}, or the
   * directory of {@code start} itself if there is none.
   */
  static Path findRoot(Path start) {
    Path dir = start.toAbsolutePath().normalize();
    if (!Files.isDirectory(dir) && dir.getParent() != null) {
      dir = dir.getParent();
    }
    for (Path candidate = dir; candidate != null; candidate = candidate.getParent()) {
      if (Files.isRegularFile(candidate.resolve(MARKER))) {
        return candidate;
      }
    }
    return dir;
  }

  /**
   * Returns the script files named by {@code paths}: files are taken as they are, directories are
   * searched recursively. Duplicates are dropped; the first occurrence keeps its position.
   *
   * @throws NoSuchFileException if a path does not exist
   */
  static ImmutableList<Path> findScripts(List<Path> paths) throws IOException {
    Set<Path> scripts = new LinkedHashSet<>();
    for (Path path : paths) {
      Path absolute = path.toAbsolutePath().normalize();
      if (Files.isDirectory(absolute)) {
        try (Stream<Path> files = Files.walk(absolute)) {
          files
              .filter(Files::isRegularFile)
              .filter(Workspace::isScript)
              .sorted()
              .forEach(scripts::add);
        }
      } else if (Files.isRegularFile(absolute)) {
        if (isScript(absolute)) {
          scripts.add(absolute);
        }
      } else {
        throw new NoSuchFileException(path.toString());
      }
    }
    return ImmutableList.copyOf(scripts);
  }

  private static boolean isScript(Path file) {
    return file.getFileName().toString().endsWith(ModulePath.EXTENSION);
  }
}
