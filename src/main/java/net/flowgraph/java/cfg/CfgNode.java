// Copyright 2026 The Flowgraph Authors. All rights reserved.
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
package net.flowgraph.java.cfg;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import java.util.Objects;
import javax.annotation.Nullable;

/** A node of a {@link ControlFlowGraph}: one execution point. */
public final class CfgNode {

  private final int id;
  private final NodeKind kind;
  private final String label;
  @Nullable private final Integer line;
  private final ImmutableSet<Integer> successors;

  CfgNode(
      int id,
      NodeKind kind,
      String label,
      @Nullable Integer line,
      ImmutableSet<Integer> successors) {
    this.id = id;
    this.kind = Preconditions.checkNotNull(kind);
    this.label = Preconditions.checkNotNull(label);
    this.line = line;
    this.successors = successors;
  }

  /** Returns the id of the node, its index in {@link ControlFlowGraph#getNodes}. */
  public int getId() {
    return id;
  }

  public NodeKind getKind() {
    return kind;
  }

  /** Returns the display text of the node. */
  public String getLabel() {
    return label;
  }

  /** Returns the 1-based source line of the node, or null for a synthetic node. */
  @Nullable
  public Integer getLine() {
    return line;
  }

  /** Returns the ids of the nodes this node transfers control to, in insertion order. */
  public ImmutableSet<Integer> getSuccessors() {
    return successors;
  }

  @Override
  public boolean equals(Object that) {
    if (this == that) {
      return true;
    }
    if (!(that instanceof CfgNode)) {
      return false;
    }
    CfgNode node = (CfgNode) that;
    return id == node.id
        && kind == node.kind
        && label.equals(node.label)
        && Objects.equals(line, node.line)
        && successors.equals(node.successors);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, kind, label, line, successors);
  }

  @Override
  public String toString() {
    return id + ": " + kind + " \"" + label + "\"";
  }
}
