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

import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import net.flowgraph.java.syntax.ClassStatement;
import net.flowgraph.java.syntax.DefStatement;
import net.flowgraph.java.syntax.SourceFile;
import net.flowgraph.java.syntax.StatementVisitor;
import net.flowgraph.java.syntax.SyntaxError;

/**
 * Builds one control-flow graph per function of a source file.
 *
 * <p>Functions are found at any depth and named by their enclosing classes and functions: a method
 * {@code m} of class {@code C} is {@code C.m}, a function {@code g} nested in {@code f} is {@code
 * f.g}. A name defined twice gets the line of the later definition as a suffix, e.g. {@code f@12}.
 * A file that defines no functions yields a single graph, {@code module}, of its top-level
 * statements.
 */
public final class FunctionGraphs {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** The name of the graph of a file's top-level statements. */
  public static final String MODULE = "module";

  private FunctionGraphs() {}

  /**
   * Returns the graphs of the functions of the file, keyed by qualified name, in source order.
   *
   * @throws SyntaxError.Exception if the file has syntax errors
   */
  public static ImmutableMap<String, ControlFlowGraph> buildAll(SourceFile file)
      throws SyntaxError.Exception {
    if (!file.ok()) {
      throw new SyntaxError.Exception(file.errors());
    }
    Collector collector = new Collector();
    collector.visit(file);
    if (collector.graphs.isEmpty()) {
      return ImmutableMap.of(MODULE, ControlFlowGraphBuilder.build(MODULE, file.getStatements()));
    }
    logger.atFine().log("%s: built %d function graph(s)", file.getFile(), collector.graphs.size());
    return ImmutableMap.copyOf(collector.graphs);
  }

  private static final class Collector extends StatementVisitor {
    private final Map<String, ControlFlowGraph> graphs = new LinkedHashMap<>();
    private final Deque<String> scope = new ArrayDeque<>();

    @Override
    public void visit(DefStatement node) {
      String name = qualify(node.getName());
      if (graphs.containsKey(name)) {
        name = name + "@" + node.getStartLine();
      }
      graphs.put(name, ControlFlowGraphBuilder.buildFunction(name, node));
      scope.addLast(node.getName());
      try {
        super.visit(node);
      } finally {
        scope.removeLast();
      }
    }

    @Override
    public void visit(ClassStatement node) {
      scope.addLast(node.getName());
      try {
        super.visit(node);
      } finally {
        scope.removeLast();
      }
    }

    private String qualify(String name) {
      return scope.isEmpty() ? name : String.join(".", scope) + "." + name;
    }
  }
}
