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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.Nullable;

/**
 * Maps the strings a script may pass to {@code import_module} onto concrete files.
 *
 * <p>For a set of input files the index holds, for each file: its absolute path, its path relative
 * to the workspace root (with and without a leading slash) and its base name; and for each other
 * input file, the relative path one would use to import it from this file (with and without a
 * {@code ./} prefix). Imports seen while analyzing add their own path and target.
 */
public final class ModuleIndex {

  private final ConcurrentMap<String, Path> byKey = new ConcurrentHashMap<>();
  private final Set<Path> files = ConcurrentHashMap.newKeySet();

  /** Returns an index of {@code files}, which must be absolute and normalized. */
  public static ModuleIndex forFiles(List<Path> inputs, Path workspaceRoot) {
    ModuleIndex index = new ModuleIndex();
    for (Path file : inputs) {
      if (!isScript(file)) {
        continue;
      }
      index.put(file.toString(), file);
      if (file.startsWith(workspaceRoot)) {
        String relative = ModulePath.slashed(workspaceRoot.relativize(file));
        index.put(relative, file);
        index.put("/" + relative, file);
      }
      index.put(file.getFileName().toString(), file);
    }

    for (Path source : inputs) {
      if (!isScript(source) || source.getParent() == null) {
        continue;
      }
      for (Path target : inputs) {
        if (source.equals(target) || !isScript(target)) {
          continue;
        }
        String relative = ModulePath.slashed(source.getParent().relativize(target));
        index.put(relative, target);
        index.put("./" + relative, target);
      }
    }
    return index;
  }

  private static boolean isScript(Path file) {
    return file.getFileName() != null
        && file.getFileName().toString().endsWith(ModulePath.EXTENSION);
  }

  void put(String key, Path file) {
    byKey.put(key, file);
    files.add(file);
  }

  /**
   * Records the target of an import seen while analyzing. Entries built from the input files take
   * precedence.
   */
  void addImport(ImportBinding binding) {
    if (binding.resolvedPath() == null) {
      return;
    }
    Path target = ModulePath.withExtension(binding.resolvedPath());
    byKey.putIfAbsent(ModulePath.withExtension(binding.modulePath()), target);
    files.add(target);
  }

  /**
   * Returns the file {@code binding} refers to, or null if it cannot be determined. External
   * imports never resolve.
   *
   * <p>The binding's own resolved path is preferred when it is a known file; then the module path
   * (with the script extension) is looked up directly; finally any known file with the same base
   * name is taken, the first in path order.
   */
  @Nullable
  public Path resolve(ImportBinding binding) {
    if (binding.isExternal()) {
      return null;
    }
    if (binding.resolvedPath() != null) {
      Path candidate = ModulePath.withExtension(binding.resolvedPath());
      if (files.contains(candidate)) {
        return candidate;
      }
    }
    String key = ModulePath.withExtension(binding.modulePath());
    Path direct = byKey.get(key);
    if (direct != null) {
      return direct;
    }
    String baseName = key.substring(key.lastIndexOf('/') + 1);
    return files.stream()
        .filter(file -> file.getFileName().toString().equals(baseName))
        .sorted()
        .findFirst()
        .orElse(null);
  }

  /** Returns the file registered under {@code key}, or null. */
  @Nullable
  public Path get(String key) {
    return byKey.get(key);
  }

  public ImmutableMap<String, Path> entries() {
    return ImmutableMap.copyOf(byKey);
  }

  public ImmutableSet<Path> files() {
    return ImmutableSet.copyOf(files);
  }
}
