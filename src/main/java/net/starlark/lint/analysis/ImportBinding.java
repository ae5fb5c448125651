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
import java.nio.file.Path;
import javax.annotation.Nullable;

/** One call to {@code import_module}, keyed by the variable it is assigned to. */
@AutoValue
public abstract class ImportBinding {

  /** The variable that holds the imported module. */
  public abstract String variable();

  /** The module path exactly as written. */
  public abstract String modulePath();

  public abstract ModulePath.Kind kind();

  /** The file the module path denotes, or null for an external path. */
  @Nullable
  public abstract Path resolvedPath();

  /** The line of the assignment. */
  public abstract int line();

  public static ImportBinding create(
      String variable, String modulePath, Path importingFile, Path workspaceRoot, int line) {
    return new AutoValue_ImportBinding(
        variable,
        modulePath,
        ModulePath.classify(modulePath),
        ModulePath.resolve(modulePath, importingFile, workspaceRoot),
        line);
  }

  public final boolean isExternal() {
    return kind() == ModulePath.Kind.EXTERNAL;
  }

  /** Returns the third-party package id for an external import, else null. */
  @Nullable
  public final String packageId() {
    return ModulePath.packageId(modulePath());
  }
}
