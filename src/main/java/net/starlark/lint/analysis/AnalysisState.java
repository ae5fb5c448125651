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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.Nullable;

/**
 * What the analysis of a set of files shares between files: the import tables and function
 * signatures of every analyzed file, the module index, and the set of cross-file references.
 *
 * <p>Writers only insert per-file entries or add references, so the tables may be filled from
 * several threads at once.
 */
public final class AnalysisState {

  private final ModuleIndex moduleIndex;
  private final ConcurrentMap<Path, ImportTable> imports = new ConcurrentHashMap<>();
  private final ConcurrentMap<Path, ImmutableMap<String, FunctionSignature>> signatures =
      new ConcurrentHashMap<>();
  private final Set<ReferenceEdge> references = ConcurrentHashMap.newKeySet();

  public AnalysisState() {
    this(new ModuleIndex());
  }

  public AnalysisState(ModuleIndex moduleIndex) {
    this.moduleIndex = moduleIndex;
  }

  public ModuleIndex moduleIndex() {
    return moduleIndex;
  }

  void putImports(Path file, ImportTable table) {
    imports.put(file, table);
    for (ImportBinding binding : table.bindings().values()) {
      moduleIndex.addImport(binding);
    }
  }

  /** Returns the import table of {@code file}, or null if it has not been analyzed. */
  @Nullable
  public ImportTable importsOf(Path file) {
    return imports.get(file);
  }

  void putSignatures(Path file, ImmutableMap<String, FunctionSignature> table) {
    signatures.put(file, table);
  }

  /** Returns the top-level function signatures of {@code file}, or null if not analyzed. */
  @Nullable
  public ImmutableMap<String, FunctionSignature> signaturesOf(Path file) {
    return signatures.get(file);
  }

  public boolean isAnalyzed(Path file) {
    return signatures.containsKey(file);
  }

  /** Returns the analyzed files that define a top-level function {@code name}, in path order. */
  ImmutableList<Path> filesDefining(String name) {
    return signatures.entrySet().stream()
        .filter(e -> e.getValue().containsKey(name))
        .map(Map.Entry::getKey)
        .sorted()
        .collect(ImmutableList.toImmutableList());
  }

  /** Records that {@code functionName} of {@code targetFile} is used elsewhere; true if new. */
  @CanIgnoreReturnValue
  boolean addReference(Path targetFile, String functionName) {
    return references.add(ReferenceEdge.create(targetFile, functionName));
  }

  public boolean isReferenced(Path file, String functionName) {
    return references.contains(ReferenceEdge.create(file, functionName));
  }

  public ImmutableSet<ReferenceEdge> references() {
    return ImmutableSet.copyOf(references);
  }
}
