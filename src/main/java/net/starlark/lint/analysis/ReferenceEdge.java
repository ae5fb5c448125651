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

/** A function of {@code targetFile} that is called or referenced from some other file. */
@AutoValue
public abstract class ReferenceEdge {

  public abstract Path targetFile();

  public abstract String functionName();

  public static ReferenceEdge create(Path targetFile, String functionName) {
    return new AutoValue_ReferenceEdge(targetFile, functionName);
  }
}
