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
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import javax.annotation.Nullable;
import net.flowgraph.java.syntax.BlockStatement;
import net.flowgraph.java.syntax.ClassStatement;
import net.flowgraph.java.syntax.DefStatement;
import net.flowgraph.java.syntax.ExceptClause;
import net.flowgraph.java.syntax.ForStatement;
import net.flowgraph.java.syntax.IfStatement;
import net.flowgraph.java.syntax.ReturnStatement;
import net.flowgraph.java.syntax.SimpleStatement;
import net.flowgraph.java.syntax.SourceFile;
import net.flowgraph.java.syntax.Statement;
import net.flowgraph.java.syntax.TryStatement;
import net.flowgraph.java.syntax.WhileStatement;

/**
 * Builds the control-flow graph of a statement sequence.
 *
 * <p>The builder threads a {@link Frontier} through the statements in source order. Each statement
 * adds its nodes, wires the incoming frontier to its first node, and returns the frontier that the
 * next statement attaches to, or {@link Frontier#terminated} if control cannot fall through.
 * Statements that follow a terminated frontier still get nodes, but no edge leads into them.
 *
 * <p>An instance holds the state of a single build: the graph arena and the stacks of enclosing
 * {@code break} and {@code continue} targets. Instances are created by the static entry points and
 * never shared, so concurrent builds are independent.
 */
public final class ControlFlowGraphBuilder {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ControlFlowGraph.Builder graph;

  // Ids of the end node (break) and header node (continue) of each enclosing loop, innermost first.
  private final Deque<Integer> breakTargets = new ArrayDeque<>();
  private final Deque<Integer> continueTargets = new ArrayDeque<>();

  private ControlFlowGraphBuilder(String functionName) {
    this.graph = ControlFlowGraph.builder(functionName);
  }

  /**
   * Builds the graph of the top-level statements of a file. If the file has syntax errors, returns
   * a failed result carrying them instead.
   */
  public static BuildResult build(String functionName, SourceFile file) {
    if (!file.ok()) {
      logger.atFine().log(
          "not building %s: %s has %d syntax error(s)",
          functionName, file.getFile(), file.errors().size());
      return BuildResult.failure(functionName, file.errors());
    }
    return BuildResult.success(build(functionName, file.getStatements()));
  }

  /** Builds the graph of a well-formed statement sequence. */
  public static ControlFlowGraph build(String functionName, List<Statement> body) {
    return new ControlFlowGraphBuilder(functionName).buildGraph(functionName, null, body);
  }

  /** Builds the graph of a function body, named after the function. */
  public static ControlFlowGraph buildFunction(DefStatement def) {
    return buildFunction(def.getName(), def);
  }

  /** Builds the graph of a function body under the given name, e.g. a qualified method name. */
  public static ControlFlowGraph buildFunction(String name, DefStatement def) {
    return new ControlFlowGraphBuilder(name).buildGraph(name, def.getStartLine(), def.getBody());
  }

  private ControlFlowGraph buildGraph(
      String functionName, @Nullable Integer line, List<Statement> body) {
    int entry = graph.newNode(NodeKind.ENTRY, Labels.entry(functionName), line);
    Frontier frontier = buildBlock(body, Frontier.at(entry));
    int exit = graph.newNode(NodeKind.EXIT, Labels.exit(functionName), null);
    graph.addEdge(frontier, exit);
    Preconditions.checkState(breakTargets.isEmpty() && continueTargets.isEmpty());
    return graph.build();
  }

  private Frontier buildBlock(List<Statement> statements, Frontier frontier) {
    for (Statement stmt : statements) {
      frontier = buildStatement(stmt, frontier);
    }
    return frontier;
  }

  private Frontier buildStatement(Statement stmt, Frontier frontier) {
    return switch (stmt.kind()) {
      case SIMPLE ->
          buildSimple(stmt, Labels.statement(((SimpleStatement) stmt).getText()), frontier);
      case PASS -> buildSimple(stmt, "pass", frontier);
      case DEF -> buildSimple(stmt, Labels.def(((DefStatement) stmt).getName()), frontier);
      case CLASS -> buildSimple(stmt, Labels.classDef(((ClassStatement) stmt).getName()), frontier);
      case BLOCK -> buildBlockStatement((BlockStatement) stmt, frontier);
      case IF -> buildIf((IfStatement) stmt, frontier);
      case WHILE -> buildWhile((WhileStatement) stmt, frontier);
      case FOR -> buildFor((ForStatement) stmt, frontier);
      case RETURN -> buildReturn((ReturnStatement) stmt, frontier);
      case BREAK -> buildJump(stmt, "break", breakTargets, EdgeLabel.BREAK, frontier);
      case CONTINUE -> buildJump(stmt, "continue", continueTargets, EdgeLabel.CONTINUE, frontier);
      case TRY -> buildTry((TryStatement) stmt, frontier);
    };
  }

  private Frontier buildSimple(Statement stmt, String label, Frontier frontier) {
    int node = graph.newNode(NodeKind.STATEMENT, label, stmt.getStartLine());
    graph.addEdge(frontier, node);
    return Frontier.at(node);
  }

  // A 'with' statement or other block header, followed by its body in sequence.
  private Frontier buildBlockStatement(BlockStatement stmt, Frontier frontier) {
    Frontier header = buildSimple(stmt, Labels.statement(stmt.getHeader()), frontier);
    return buildBlock(stmt.getBody(), header);
  }

  private Frontier buildIf(IfStatement stmt, Frontier frontier) {
    int condition =
        graph.newNode(
            NodeKind.CONDITION, Labels.condition(stmt.getCondition()), stmt.getStartLine());
    graph.addEdge(frontier, condition);

    Frontier thenEnd = buildBlock(stmt.getThenBlock(), Frontier.at(condition, EdgeLabel.TRUE));
    Frontier elseEnd = buildBlock(stmt.getElseBlock(), Frontier.at(condition, EdgeLabel.FALSE));

    int merge = graph.newNode(NodeKind.STATEMENT, Labels.MERGE, null);
    graph.addEdge(thenEnd, merge, EdgeLabel.TRUE);
    graph.addEdge(elseEnd, merge, EdgeLabel.FALSE);
    if (!thenEnd.isLive() && !elseEnd.isLive()) {
      return Frontier.terminated();
    }
    return Frontier.at(merge);
  }

  private Frontier buildWhile(WhileStatement stmt, Frontier frontier) {
    return buildLoop(
        stmt, Labels.whileLoop(stmt.getCondition()), "while", stmt.getBody(), frontier);
  }

  private Frontier buildFor(ForStatement stmt, Frontier frontier) {
    return buildLoop(
        stmt, Labels.forLoop(stmt.getVars(), stmt.getIterable()), "for", stmt.getBody(), frontier);
  }

  private Frontier buildLoop(
      Statement stmt, String label, String keyword, List<Statement> body, Frontier frontier) {
    int loop = graph.newNode(NodeKind.LOOP, label, stmt.getStartLine());
    graph.addEdge(frontier, loop);
    int end = graph.newNode(NodeKind.STATEMENT, Labels.endLoop(keyword), null);

    Frontier bodyEnd;
    breakTargets.push(end);
    continueTargets.push(loop);
    try {
      bodyEnd = buildBlock(body, Frontier.at(loop));
    } finally {
      breakTargets.pop();
      continueTargets.pop();
    }

    graph.addEdge(bodyEnd, loop, EdgeLabel.LOOP);
    // The exit edge is drawn even when the body never falls through.
    graph.addEdge(loop, end, EdgeLabel.EXIT);
    return Frontier.at(end);
  }

  private Frontier buildReturn(ReturnStatement stmt, Frontier frontier) {
    buildSimple(stmt, Labels.returnStatement(stmt.getResult()), frontier);
    return Frontier.terminated();
  }

  private Frontier buildJump(
      Statement stmt, String keyword, Deque<Integer> targets, EdgeLabel label, Frontier frontier) {
    Frontier node = buildSimple(stmt, keyword, frontier);
    Integer target = targets.peek();
    if (target != null) {
      graph.addEdge(node, target, label);
    } else {
      logger.atFine().log(
          "'%s' at %s is outside any loop; leaving it unresolved", keyword, stmt.getLocation());
    }
    return Frontier.terminated();
  }

  private Frontier buildTry(TryStatement stmt, Frontier frontier) {
    int tryNode = graph.newNode(NodeKind.STATEMENT, Labels.TRY, stmt.getStartLine());
    graph.addEdge(frontier, tryNode);
    Frontier bodyEnd = buildBlock(stmt.getBody(), Frontier.at(tryNode));

    List<Frontier> ends = new ArrayList<>();
    for (ExceptClause handler : stmt.getHandlers()) {
      int except =
          graph.newNode(
              NodeKind.STATEMENT,
              Labels.except(handler.getExceptionType()),
              handler.getLocation().line());
      graph.addEdge(tryNode, except, EdgeLabel.EXCEPTION);
      ends.add(buildBlock(handler.getBody(), Frontier.at(except)));
    }
    // The else block runs only when the body completes normally.
    ends.add(0, buildBlock(stmt.getElseBlock(), bodyEnd));

    int merge = graph.newNode(NodeKind.STATEMENT, Labels.END_TRY, null);
    boolean reachable = false;
    for (Frontier end : ends) {
      graph.addEdge(end, merge);
      reachable |= end.isLive();
    }
    Frontier after = reachable ? Frontier.at(merge) : Frontier.terminated();
    return buildBlock(stmt.getFinallyBlock(), after);
  }
}
