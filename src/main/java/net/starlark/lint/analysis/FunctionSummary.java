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

/** The facts about a function needed to judge its visibility. */
public record FunctionSummary(String name, int line, boolean documented) {

  /** The prefix of private names. */
  static final String PRIVATE_PREFIX = "_";

  /** The prefix of test functions, which are never judged. */
  static final String TEST_PREFIX = "test_";

  public boolean isPrivate() {
    return name.startsWith(PRIVATE_PREFIX);
  }

  public boolean isTest() {
    return name.startsWith(TEST_PREFIX);
  }
}
