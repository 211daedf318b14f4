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

/** Syntax node for a for loop statement, {@code for vars in iterable: ...}. */
public final class ForStatement extends Statement {

  private final String vars;
  private final String iterable;
  private final ImmutableList<Statement> body; // non-empty if well formed

  /** Constructs a for loop statement. */
  ForStatement(Location location, String vars, String iterable, ImmutableList<Statement> body) {
    super(location, Kind.FOR);
    this.vars = Preconditions.checkNotNull(vars);
    this.iterable = Preconditions.checkNotNull(iterable);
    this.body = body;
  }

  /**
   * Returns the source text of the variables assigned by each iteration. May be a compound target
   * such as {@code a, (b, c)}.
   */
  public String getVars() {
    return vars;
  }

  /** Returns the source text of the iterable value. */
  public String getIterable() {
    return iterable;
  }

  /** Returns the statements of the loop body. Non-empty if parsing succeeded. */
  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public String toString() {
    return "for " + vars + " in " + iterable + ": ...";
  }

  @Override
  public void accept(StatementVisitor visitor) {
    visitor.visit(this);
  }
}
