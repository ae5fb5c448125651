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
import com.google.common.base.Preconditions;

/** The checks to run and how to run them. */
@AutoValue
public abstract class AnalysisOptions {

  /** Report global variables holding imported modules whose names are not private. */
  public abstract boolean importNaming();

  /** Report calls whose arguments do not fit the callee's signature. */
  public abstract boolean calls();

  /** Report public functions that are undocumented. */
  public abstract boolean functionVisibility();

  /** Report imports whose target file does not exist. */
  public abstract boolean checkFileExists();

  /** Number of worker threads for each pass. */
  public abstract int jobs();

  public static Builder builder() {
    return new AutoValue_AnalysisOptions.Builder()
        .importNaming(false)
        .calls(false)
        .functionVisibility(false)
        .checkFileExists(true)
        .jobs(1);
  }

  /** Returns options with every check enabled. */
  public static AnalysisOptions all() {
    return builder().importNaming(true).calls(true).functionVisibility(true).build();
  }

  public abstract Builder toBuilder();

  /** This builder is for AnalysisOptions. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder importNaming(boolean value);

    public abstract Builder calls(boolean value);

    public abstract Builder functionVisibility(boolean value);

    public abstract Builder checkFileExists(boolean value);

    public abstract Builder jobs(int value);

    abstract AnalysisOptions autoBuild();

    public final AnalysisOptions build() {
      AnalysisOptions options = autoBuild();
      Preconditions.checkArgument(options.jobs() > 0, "jobs must be positive: %s", options.jobs());
      return options;
    }
  }
}
