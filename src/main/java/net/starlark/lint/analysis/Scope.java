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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A stack of lexical frames used while walking a syntax tree.
 *
 * <p>Each frame holds the names bound in it and, for some of them, a {@link SymbolicValue}. The
 * scope starts with the global frame pushed. All operations are total: popping an empty stack or
 * binding into it does nothing.
 */
public final class Scope {

  private static final class Frame {
    final Set<String> names = new HashSet<>();
    final Map<String, SymbolicValue> values = new HashMap<>();
  }

  // frames.get(0) is the global frame
  private final List<Frame> frames = new ArrayList<>();

  public Scope() {
    enter();
  }

  /** Pushes an empty frame. */
  public void enter() {
    frames.add(new Frame());
  }

  /** Pops the innermost frame, if any. */
  public void exit() {
    if (!frames.isEmpty()) {
      frames.remove(frames.size() - 1);
    }
  }

  /** Binds {@code name} in the innermost frame. */
  public void bind(String name) {
    if (!frames.isEmpty()) {
      top().names.add(name);
    }
  }

  /** Binds {@code name} in the innermost frame and records its symbolic value there. */
  public void bindValue(String name, SymbolicValue value) {
    Preconditions.checkNotNull(value);
    if (!frames.isEmpty()) {
      Frame top = top();
      top.names.add(name);
      top.values.put(name, value);
    }
  }

  /** Reports whether any frame binds {@code name}. */
  public boolean isBound(String name) {
    for (int i = frames.size() - 1; i >= 0; i--) {
      if (frames.get(i).names.contains(name)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the innermost recorded value of {@code name}, or {@link SymbolicValue#UNKNOWN}. */
  public SymbolicValue valueOf(String name) {
    for (int i = frames.size() - 1; i >= 0; i--) {
      SymbolicValue value = frames.get(i).values.get(name);
      if (value != null) {
        return value;
      }
    }
    return SymbolicValue.UNKNOWN;
  }

  /** Returns the number of frames on the stack; the global frame alone gives 1. */
  public int depth() {
    return frames.size();
  }

  /** Reports whether the innermost frame is the global one. */
  public boolean isGlobal() {
    return frames.size() == 1;
  }

  private Frame top() {
    return frames.get(frames.size() - 1);
  }
}
