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

/** Syntax node for a while loop statement, {@code while cond: ...}. */
public final class WhileStatement extends Statement {

  private final String condition;
  private final ImmutableList<Statement> body; // non-empty if well formed

  WhileStatement(Location location, String condition, ImmutableList<Statement> body) {
    super(location, Kind.WHILE);
    this.condition = Preconditions.checkNotNull(condition);
    this.body = body;
  }

  /** Returns the source text of the loop condition. */
  public String getCondition() {
    return condition;
  }

  /** Returns the statements of the loop body. Non-empty if parsing succeeded. */
  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public String toString() {
    return "while " + condition + ": ...";
  }

  @Override
  public void accept(StatementVisitor visitor) {
    visitor.visit(this);
  }
}
