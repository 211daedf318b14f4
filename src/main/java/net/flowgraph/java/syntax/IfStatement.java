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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Syntax node for an if or elif statement.
 *
 * <p>An {@code elif} clause is represented as an IfStatement that is the sole statement of the
 * else block of the preceding one, with {@link #isElif} set.
 */
public final class IfStatement extends Statement {

  private final boolean elif;
  private final String condition;
  private final ImmutableList<Statement> thenBlock; // non-empty if well formed
  private final ImmutableList<Statement> elseBlock; // empty if there is no else clause

  IfStatement(
      Location location,
      boolean elif,
      String condition,
      ImmutableList<Statement> thenBlock,
      ImmutableList<Statement> elseBlock) {
    super(location, Kind.IF);
    this.elif = elif;
    this.condition = Preconditions.checkNotNull(condition);
    this.thenBlock = thenBlock;
    this.elseBlock = elseBlock;
  }

  /** Reports whether this statement was written as an {@code elif} clause. */
  public boolean isElif() {
    return elif;
  }

  public String getCondition() {
    return condition;
  }

  public ImmutableList<Statement> getThenBlock() {
    return thenBlock;
  }

  /** Returns the statements of the else clause, empty if there is none. */
  public ImmutableList<Statement> getElseBlock() {
    return elseBlock;
  }

  @Override
  public String toString() {
    return (elif ? "elif " : "if ") + condition + ": ...";
  }

  @Override
  public void accept(StatementVisitor visitor) {
    visitor.visit(this);
  }
}
