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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A control-flow graph of one function or module body.
 *
 * <p>Nodes are identified by integer ids assigned from zero in creation order, so {@code
 * getNode(id)} is an index into {@link #getNodes}. Edges are kept in the order they were added.
 * Instances are immutable; use {@link Builder} to construct one.
 */
public final class ControlFlowGraph {

  private final String functionName;
  private final ImmutableList<CfgNode> nodes;
  private final ImmutableList<CfgEdge> edges;
  private final ImmutableListMultimap<Integer, CfgEdge> edgesFrom;
  private final ImmutableListMultimap<Integer, CfgEdge> edgesTo;

  private ControlFlowGraph(
      String functionName, ImmutableList<CfgNode> nodes, ImmutableList<CfgEdge> edges) {
    this.functionName = functionName;
    this.nodes = nodes;
    this.edges = edges;
    ImmutableListMultimap.Builder<Integer, CfgEdge> from = ImmutableListMultimap.builder();
    ImmutableListMultimap.Builder<Integer, CfgEdge> to = ImmutableListMultimap.builder();
    for (CfgEdge edge : edges) {
      from.put(edge.getFrom(), edge);
      to.put(edge.getTo(), edge);
    }
    this.edgesFrom = from.build();
    this.edgesTo = to.build();
  }

  /** Returns a new builder for a graph of the named function. */
  public static Builder builder(String functionName) {
    return new Builder(functionName);
  }

  /** Returns the name of the function the graph describes. */
  public String getFunctionName() {
    return functionName;
  }

  /** Returns the nodes, in id order. */
  public ImmutableList<CfgNode> getNodes() {
    return nodes;
  }

  /** Returns the edges, in insertion order. */
  public ImmutableList<CfgEdge> getEdges() {
    return edges;
  }

  /** Returns the node with the given id. */
  public CfgNode getNode(int id) {
    Preconditions.checkArgument(id >= 0 && id < nodes.size(), "no node with id %s", id);
    return nodes.get(id);
  }

  /** Returns the entry node, which is always the first node of the graph. */
  public CfgNode getEntry() {
    Preconditions.checkState(!nodes.isEmpty(), "empty graph");
    return nodes.get(0);
  }

  /** Returns the exit node, or null if the graph has none (an error graph). */
  @Nullable
  public CfgNode getExit() {
    for (CfgNode node : nodes.reverse()) {
      if (node.getKind() == NodeKind.EXIT) {
        return node;
      }
    }
    return null;
  }

  /** Returns the edges leaving the given node, in insertion order. */
  public ImmutableList<CfgEdge> edgesFrom(int id) {
    checkNode(id);
    return edgesFrom.get(id);
  }

  /** Returns the edges entering the given node, in insertion order. */
  public ImmutableList<CfgEdge> edgesTo(int id) {
    checkNode(id);
    return edgesTo.get(id);
  }

  /** Returns the ids of the nodes with an edge to the given node, without duplicates. */
  public ImmutableSet<Integer> predecessors(int id) {
    ImmutableSet.Builder<Integer> result = ImmutableSet.builder();
    for (CfgEdge edge : edgesTo(id)) {
      result.add(edge.getFrom());
    }
    return result.build();
  }

  private void checkNode(int id) {
    Preconditions.checkArgument(id >= 0 && id < nodes.size(), "no node with id %s", id);
  }

  @Override
  public String toString() {
    return "<control-flow graph " + functionName + ": " + nodes.size() + " nodes>";
  }

  /**
   * The append-only arena in which a graph is built. Nodes are never removed, and an edge is added
   * only once both of its endpoints exist.
   */
  public static final class Builder {

    private final String functionName;
    private final List<NodeKind> kinds = new ArrayList<>();
    private final List<String> labels = new ArrayList<>();
    private final List<Integer> lines = new ArrayList<>();
    private final List<Set<Integer>> successors = new ArrayList<>();
    private final Set<CfgEdge> edges = new LinkedHashSet<>();

    private Builder(String functionName) {
      this.functionName = Preconditions.checkNotNull(functionName);
    }

    /** Adds a node and returns its id. A null line marks a synthetic node. */
    public int newNode(NodeKind kind, String label, @Nullable Integer line) {
      kinds.add(Preconditions.checkNotNull(kind));
      labels.add(Preconditions.checkNotNull(label));
      lines.add(line);
      successors.add(new LinkedHashSet<>());
      return kinds.size() - 1;
    }

    /** Returns the number of nodes added so far. */
    public int nodeCount() {
      return kinds.size();
    }

    /** Returns the number of distinct edges added so far. */
    public int edgeCount() {
      return edges.size();
    }

    /**
     * Adds the edge {@code from -> to} with the given label, unless either endpoint does not exist
     * or the identical edge was already added. Returns whether the graph changed.
     */
    @CanIgnoreReturnValue
    public boolean addEdge(int from, int to, EdgeLabel label) {
      if (!exists(from) || !exists(to)) {
        return false;
      }
      if (!edges.add(new CfgEdge(from, to, label))) {
        return false;
      }
      successors.get(from).add(to);
      return true;
    }

    /**
     * Adds an edge from the frontier to the given node, labelled with the frontier's pending
     * label. Does nothing if the frontier is terminated.
     */
    @CanIgnoreReturnValue
    public boolean addEdge(Frontier from, int to) {
      return addEdge(from, to, EdgeLabel.NONE);
    }

    /**
     * Adds an edge from the frontier to the given node. The edge carries the frontier's pending
     * label if it has one, and {@code label} otherwise. Does nothing if the frontier is terminated.
     */
    @CanIgnoreReturnValue
    public boolean addEdge(Frontier from, int to, EdgeLabel label) {
      if (!from.isLive()) {
        return false;
      }
      EdgeLabel pending = from.pendingLabel();
      return addEdge(from.nodeId(), to, pending != EdgeLabel.NONE ? pending : label);
    }

    /** Returns the successors of the given node added so far. */
    public ImmutableSet<Integer> successorsOf(int id) {
      Preconditions.checkArgument(exists(id), "no node with id %s", id);
      return ImmutableSet.copyOf(successors.get(id));
    }

    private boolean exists(int id) {
      return id >= 0 && id < kinds.size();
    }

    /** Returns an immutable graph holding the nodes and edges added so far. */
    public ControlFlowGraph build() {
      ImmutableList.Builder<CfgNode> nodes = ImmutableList.builderWithExpectedSize(kinds.size());
      for (int id = 0; id < kinds.size(); id++) {
        nodes.add(
            new CfgNode(
                id,
                kinds.get(id),
                labels.get(id),
                lines.get(id),
                ImmutableSet.copyOf(successors.get(id))));
      }
      return new ControlFlowGraph(functionName, nodes.build(), ImmutableList.copyOf(edges));
    }
  }
}
