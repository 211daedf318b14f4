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
import java.util.List;
import net.flowgraph.java.syntax.SyntaxError;

/**
 * The outcome of building a graph from a source file: either a graph, or the syntax errors that
 * prevented building one.
 *
 * <p>A failed result never holds a partially built graph. Its {@link #getGraph} is a one-node
 * graph whose entry node is labelled with the first error, so that consumers that only render
 * graphs still have something to show.
 */
public final class BuildResult {

  private final ControlFlowGraph graph;
  private final ImmutableList<SyntaxError> errors;

  private BuildResult(ControlFlowGraph graph, ImmutableList<SyntaxError> errors) {
    this.graph = graph;
    this.errors = errors;
  }

  static BuildResult success(ControlFlowGraph graph) {
    return new BuildResult(Preconditions.checkNotNull(graph), ImmutableList.of());
  }

  static BuildResult failure(String functionName, List<SyntaxError> errors) {
    Preconditions.checkArgument(!errors.isEmpty(), "a failed build needs at least one error");
    ControlFlowGraph.Builder graph = ControlFlowGraph.builder(functionName);
    graph.newNode(NodeKind.ENTRY, Labels.error(errors.get(0).toString()), null);
    return new BuildResult(graph.build(), ImmutableList.copyOf(errors));
  }

  /** Reports whether the graph was built. */
  public boolean ok() {
    return errors.isEmpty();
  }

  /** Returns the errors that prevented the build; empty if it succeeded. */
  public ImmutableList<SyntaxError> errors() {
    return errors;
  }

  /** Returns the built graph, or the one-node error graph of a failed build. */
  public ControlFlowGraph getGraph() {
    return graph;
  }

  @Override
  public String toString() {
    return ok() ? "<built " + graph.getFunctionName() + ">" : SyntaxError.toString(errors);
  }
}
