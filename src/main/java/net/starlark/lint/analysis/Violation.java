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
import com.google.errorprone.annotations.FormatMethod;
import java.nio.file.Path;

/** A finding in a file: where it is and what is wrong. */
@AutoValue
public abstract class Violation {

  public abstract Path file();

  /** The 1-based line, or 0 for a finding about the whole file. */
  public abstract int line();

  public abstract String message();

  public static Violation create(Path file, int line, String message) {
    return new AutoValue_Violation(file, line, message);
  }

  @FormatMethod
  static Violation of(Path file, int line, String format, Object... args) {
    return create(file, line, String.format(format, args));
  }

  /** Returns the violation as {@code path:line: message}. */
  @Override
  public final String toString() {
    return file() + ":" + line() + ": " + message();
  }
}
