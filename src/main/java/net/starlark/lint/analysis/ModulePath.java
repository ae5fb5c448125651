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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/** Classification and resolution of the string argument of {@code import_module}. */
public final class ModulePath {

  /** The extension of package script files. */
  public static final String EXTENSION = ".star";

  // host/org/repo[/...], where the host has at least one dot (github.com, gitlab.example.org).
  private static final Pattern EXTERNAL =
      Pattern.compile("^[A-Za-z0-9-]+(\\.[A-Za-z0-9-]+)+/[^/]+/[^/]+(/.*)?$");

  /** The ways a module path may be written. */
  public enum Kind {
    /** A reference into a third-party package, {@code github.com/org/repo/file.star}. */
    EXTERNAL,
    /** Rooted at the workspace, {@code /lib/file.star}. */
    ABSOLUTE,
    /** Rooted at the importing file's directory, {@code ./file.star} or {@code ../file.star}. */
    RELATIVE,
    /** Any other path, taken relative to the workspace root. */
    WORKSPACE
  }

  private ModulePath() {}

  public static Kind classify(String path) {
    if (EXTERNAL.matcher(path).matches()) {
      return Kind.EXTERNAL;
    }
    if (path.startsWith("/")) {
      return Kind.ABSOLUTE;
    }
    if (path.startsWith("./") || path.startsWith("../")) {
      return Kind.RELATIVE;
    }
    return Kind.WORKSPACE;
  }

  /**
   * Returns the file {@code path} denotes when imported from {@code importingFile}, or null for
   * an external path. The result is not checked for existence.
   */
  @Nullable
  public static Path resolve(String path, Path importingFile, Path workspaceRoot) {
    switch (classify(path)) {
      case EXTERNAL:
        return null;
      case ABSOLUTE:
        return workspaceRoot.resolve(path.substring(1)).normalize();
      case RELATIVE:
        Path dir = importingFile.toAbsolutePath().getParent();
        return (dir != null ? dir.resolve(path) : Path.of(path)).normalize();
      case WORKSPACE:
        return workspaceRoot.resolve(path).normalize();
    }
    throw new IllegalStateException(path);
  }

  /**
   * Returns the package id of an external path, the first three segments ({@code
   * github.com/org/repo}), or null if {@code path} is not external.
   */
  @Nullable
  public static String packageId(String path) {
    if (classify(path) != Kind.EXTERNAL) {
      return null;
    }
    List<String> parts = Splitter.on('/').splitToList(path);
    return Joiner.on('/').join(parts.subList(0, 3));
  }

  /** Returns {@code path} with the script extension appended if it lacks one. */
  public static String withExtension(String path) {
    return path.endsWith(EXTENSION) ? path : path + EXTENSION;
  }

  /** Returns {@code path} with the script extension appended if it lacks one. */
  public static Path withExtension(Path path) {
    Path name = path.getFileName();
    if (name == null || name.toString().endsWith(EXTENSION)) {
      return path;
    }
    return path.resolveSibling(name + EXTENSION);
  }

  /** Returns the path string with forward slashes, as written in import paths. */
  static String slashed(Path path) {
    return path.toString().replace(path.getFileSystem().getSeparator(), "/");
  }
}
