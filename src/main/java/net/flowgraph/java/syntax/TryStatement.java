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

import com.google.common.collect.ImmutableList;

/**
 * Syntax node for a try statement: a guarded body, zero or more except clauses, and optional else
 * and finally blocks.
 */
public final class TryStatement extends Statement {

  private final ImmutableList<Statement> body;
  private final ImmutableList<ExceptClause> handlers;
  private final ImmutableList<Statement> elseBlock;
  private final ImmutableList<Statement> finallyBlock;

  TryStatement(
      Location location,
      ImmutableList<Statement> body,
      ImmutableList<ExceptClause> handlers,
      ImmutableList<Statement> elseBlock,
      ImmutableList<Statement> finallyBlock) {
    super(location, Kind.TRY);
    this.body = body;
    this.handlers = handlers;
    this.elseBlock = elseBlock;
    this.finallyBlock = finallyBlock;
  }

  /** Returns the statements guarded by the handlers. */
  public ImmutableList<Statement> getBody() {
    return body;
  }

  /** Returns the except clauses in source order. */
  public ImmutableList<ExceptClause> getHandlers() {
    return handlers;
  }

  /** Returns the statements run when the body completes without an exception; may be empty. */
  public ImmutableList<Statement> getElseBlock() {
    return elseBlock;
  }

  /** Returns the statements of the finally clause; may be empty. */
  public ImmutableList<Statement> getFinallyBlock() {
    return finallyBlock;
  }

  @Override
  public String toString() {
    return "try: ...";
  }

  @Override
  public void accept(StatementVisitor visitor) {
    visitor.visit(this);
  }
}
