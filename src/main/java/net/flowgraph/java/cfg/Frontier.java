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

/**
 * The point at which the next statement of a sequence attaches to the graph.
 *
 * <p>A live frontier names a node and the label to put on the edge that leaves it; the label is
 * {@link EdgeLabel#NONE} except at the start of a conditional branch, where it records the branch
 * outcome. A terminated frontier means control cannot fall through to the next statement, for
 * example after a {@code return}; edges drawn from it are skipped.
 */
public final class Frontier {

  private static final Frontier TERMINATED = new Frontier(-1, EdgeLabel.NONE);

  private final int nodeId;
  private final EdgeLabel pendingLabel;

  private Frontier(int nodeId, EdgeLabel pendingLabel) {
    this.nodeId = nodeId;
    this.pendingLabel = pendingLabel;
  }

  /** Returns a live frontier at the given node. */
  public static Frontier at(int nodeId) {
    return at(nodeId, EdgeLabel.NONE);
  }

  /** Returns a live frontier at the given node whose outgoing edge carries the given label. */
  public static Frontier at(int nodeId, EdgeLabel pendingLabel) {
    Preconditions.checkArgument(nodeId >= 0, "invalid node id %s", nodeId);
    return new Frontier(nodeId, Preconditions.checkNotNull(pendingLabel));
  }

  /** Returns the frontier after a statement that never falls through. */
  public static Frontier terminated() {
    return TERMINATED;
  }

  public boolean isLive() {
    return this != TERMINATED;
  }

  /** Returns the id of the frontier node. Fails on a terminated frontier. */
  public int nodeId() {
    Preconditions.checkState(isLive(), "terminated frontier has no node");
    return nodeId;
  }

  public EdgeLabel pendingLabel() {
    return pendingLabel;
  }

  @Override
  public boolean equals(Object that) {
    if (this == that) {
      return true;
    }
    if (!(that instanceof Frontier)) {
      return false;
    }
    Frontier frontier = (Frontier) that;
    return nodeId == frontier.nodeId && pendingLabel == frontier.pendingLabel;
  }

  @Override
  public int hashCode() {
    return Objects.hash(nodeId, pendingLabel);
  }

  @Override
  public String toString() {
    if (!isLive()) {
      return "<terminated>";
    }
    if (pendingLabel == EdgeLabel.NONE) {
      return "@" + nodeId;
    }
    return "@" + nodeId + " [" + pendingLabel + "]";
  }
}
