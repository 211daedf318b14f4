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
package net.flowgraph.java.syntax;

import java.util.List;

/**
 * A visitor for visiting the statements of a syntax tree in lexical order.
 *
 * <p>Typical usage is for a subclass to override the {@code visit()} overloads for the statements
 * relevant to its business logic and to rely on the default implementations in this class to
 * traverse the remaining ones. Overriding implementations should remember to traverse children,
 * using either {@code super.visit()} on the current node or {@link #visitBlock} on its blocks.
 */
public class StatementVisitor {

  /** Entrypoint for visiting a statement. Clients should avoid calling node-specific overloads. */
  public void visit(Statement node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  public void visit(SourceFile node) {
    visitBlock(node.getStatements());
  }

  public void visitBlock(List<Statement> statements) {
    for (Statement stmt : statements) {
      visit(stmt);
    }
  }

  public void visit(@SuppressWarnings("unused") SimpleStatement node) {}

  public void visit(@SuppressWarnings("unused") FlowStatement node) {}

  public void visit(@SuppressWarnings("unused") ReturnStatement node) {}

  public void visit(IfStatement node) {
    visitBlock(node.getThenBlock());
    visitBlock(node.getElseBlock());
  }

  public void visit(WhileStatement node) {
    visitBlock(node.getBody());
  }

  public void visit(ForStatement node) {
    visitBlock(node.getBody());
  }

  public void visit(TryStatement node) {
    visitBlock(node.getBody());
    for (ExceptClause handler : node.getHandlers()) {
      visit(handler);
    }
    visitBlock(node.getElseBlock());
    visitBlock(node.getFinallyBlock());
  }

  public void visit(ExceptClause node) {
    visitBlock(node.getBody());
  }

  public void visit(DefStatement node) {
    visitBlock(node.getBody());
  }

  public void visit(ClassStatement node) {
    visitBlock(node.getBody());
  }

  public void visit(BlockStatement node) {
    visitBlock(node.getBody());
  }
}
