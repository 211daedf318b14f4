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
import java.util.Objects;

/** A labelled transfer of control between two nodes of a {@link ControlFlowGraph}. */
public final class CfgEdge {

  private final int from;
  private final int to;
  private final EdgeLabel label;

  CfgEdge(int from, int to, EdgeLabel label) {
    this.from = from;
    this.to = to;
    this.label = Preconditions.checkNotNull(label);
  }

  public int getFrom() {
    return from;
  }

  public int getTo() {
    return to;
  }

  public EdgeLabel getLabel() {
    return label;
  }

  @Override
  public boolean equals(Object that) {
    if (this == that) {
      return true;
    }
    if (!(that instanceof CfgEdge)) {
      return false;
    }
    CfgEdge edge = (CfgEdge) that;
    return from == edge.from && to == edge.to && label == edge.label;
  }

  @Override
  public int hashCode() {
    return Objects.hash(from, to, label);
  }

  /** Returns a string of the form {@code "0 -> 1"} or {@code "1 -> 2 [true]"}. */
  @Override
  public String toString() {
    return label == EdgeLabel.NONE ? from + " -> " + to : from + " -> " + to + " [" + label + "]";
  }
}
