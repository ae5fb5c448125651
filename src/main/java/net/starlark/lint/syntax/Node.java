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
package net.starlark.lint.syntax;

/** A Node is a node in a syntax tree. */
public abstract class Node {

  final FileLocations locs;

  Node(FileLocations locs) {
    this.locs = locs;
  }

  /**
   * Returns the node's start offset, as a char index (zero-based count of UTF-16 codes) from the
   * start of the file.
   */
  public abstract int getStartOffset();

  /** Returns the char offset of the source position immediately after this node. */
  public abstract int getEndOffset();

  /** Returns the location of the start of this syntax node. */
  public final Location getStartLocation() {
    return locs.getLocation(getStartOffset());
  }

  /** Returns the location of the end of this syntax node. */
  public final Location getEndLocation() {
    return locs.getLocation(getEndOffset());
  }

  /** Returns the 1-based line of the start of this syntax node. */
  public final int getLine() {
    return getStartLocation().line();
  }

  /** Returns the name of the file containing this node. */
  public final String getFile() {
    return locs.file();
  }

  /**
   * Returns a pretty-printed representation of this syntax tree.
   *
   * <p>This function returns a canonical source code corresponding to the syntax tree. Generally,
   * the output can be parsed again and provide the same syntax tree.
   */
  public final String prettyPrint() {
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf).printNode(this);
    return buf.toString();
  }

  /** Print the syntax node in a form useful for debugging. */
  @Override
  public String toString() {
    return prettyPrint();
  }

  /**
   * Implements the double dispatch by calling into the node specific <code>visit</code> method of
   * the {@link NodeVisitor}
   *
   * @param visitor the {@link NodeVisitor} to be called.
   */
  public abstract void accept(NodeVisitor visitor);
}
