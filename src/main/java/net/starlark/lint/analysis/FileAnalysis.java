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

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;

/**
 * The outcome of walking one file: its import and call findings and the functions it defines. A
 * file that could not be read or parsed has a single line-0 finding and no functions.
 */
record FileAnalysis(
    Path file,
    ImmutableList<Violation> importViolations,
    ImmutableList<Violation> callViolations,
    ImmutableList<FunctionSummary> functions) {

  static FileAnalysis failed(Path file, Violation failure) {
    return new FileAnalysis(
        file, ImmutableList.of(), ImmutableList.of(failure), ImmutableList.of());
  }

  /** Returns all findings of the file: imports, then calls, then {@code visibility}. */
  ImmutableList<Violation> violations(ImmutableList<Violation> visibility) {
    return ImmutableList.<Violation>builder()
        .addAll(importViolations)
        .addAll(callViolations)
        .addAll(visibility)
        .build();
  }
}
