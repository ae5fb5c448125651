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

import com.google.common.collect.ImmutableSet;

/** Names predeclared by the package script runtime. Calls to them are never checked. */
final class Builtins {

  private Builtins() {}

  static final ImmutableSet<String> FUNCTIONS =
      ImmutableSet.of(
          // core
          "abs",
          "all",
          "any",
          "bool",
          "dict",
          "dir",
          "enumerate",
          "fail",
          "float",
          "getattr",
          "hasattr",
          "hash",
          "int",
          "len",
          "list",
          "max",
          "min",
          "print",
          "range",
          "repr",
          "reversed",
          "sorted",
          "str",
          "struct",
          "tuple",
          "type",
          "zip",
          // package runtime
          "import_module",
          "read_file",
          "Directory",
          "ExecRecipe",
          "GetHttpRequestRecipe",
          "ImageBuildSpec",
          "ImageRegistrySpec",
          "NixBuildSpec",
          "PortSpec",
          "PostHttpRequestRecipe",
          "ReadyCondition",
          "ServiceConfig",
          "StoreSpec",
          "Toleration",
          "UpdateServiceConfig",
          "User");

  static final ImmutableSet<String> MODULES = ImmutableSet.of("json", "kurtosis", "plan", "time");

  static boolean isFunction(String name) {
    return FUNCTIONS.contains(name);
  }

  static boolean isModule(String name) {
    return MODULES.contains(name);
  }
}
