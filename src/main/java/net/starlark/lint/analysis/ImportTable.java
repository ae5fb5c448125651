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
import com.google.common.flogger.GoogleLogger;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * The imports of one file: variables bound directly to {@code import_module} results, and aliases
 * between variables ({@code a = b}).
 *
 * <p>Alias chains are followed with a visited set, so cycles (including {@code a = a}) resolve to
 * "not an import".
 */
public final class ImportTable {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Map<String, ImportBinding> bindings = new LinkedHashMap<>();
  private final Map<String, String> aliases = new LinkedHashMap<>();

  void addBinding(ImportBinding binding) {
    bindings.put(binding.variable(), binding);
  }

  void addAlias(String name, String source) {
    aliases.put(name, source);
  }

  /** Returns the direct bindings, by variable name. */
  public ImmutableMap<String, ImportBinding> bindings() {
    return ImmutableMap.copyOf(bindings);
  }

  /** Returns the aliases, from alias to aliased name. */
  public ImmutableMap<String, String> aliases() {
    return ImmutableMap.copyOf(aliases);
  }

  /** Reports whether {@code name} holds an imported module, directly or through aliases. */
  public boolean isImport(String name) {
    return resolve(name) != null;
  }

  /**
   * Returns the binding {@code name} denotes after following aliases, or null if it does not
   * denote an import.
   */
  @Nullable
  public ImportBinding resolve(String name) {
    Set<String> visited = new HashSet<>();
    String current = name;
    while (true) {
      if (!visited.add(current)) {
        logger.atFine().log("Circular alias chain through '%s'", current);
        return null;
      }
      ImportBinding binding = bindings.get(current);
      if (binding != null) {
        return binding;
      }
      current = aliases.get(current);
      if (current == null) {
        return null;
      }
    }
  }
}
