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

/** Syntax node for a function definition, {@code def name(params): ...}. */
public final class DefStatement extends Statement {

  private final String name;
  private final String parameters;
  private final boolean async;
  private final ImmutableList<Statement> body; // non-empty if well formed

  DefStatement(
      Location location,
      String name,
      String parameters,
      boolean async,
      ImmutableList<Statement> body) {
    super(location, Kind.DEF);
    this.name = Preconditions.checkNotNull(name);
    this.parameters = Preconditions.checkNotNull(parameters);
    this.async = async;
    this.body = body;
  }

  public String getName() {
    return name;
  }

  /** Returns the source text between the parentheses of the parameter list. */
  public String getParameters() {
    return parameters;
  }

  /** Reports whether the function was declared with {@code async def}. */
  public boolean isAsync() {
    return async;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public String toString() {
    return (async ? "async def " : "def ") + name + "(" + parameters + "): ...";
  }

  @Override
  public void accept(StatementVisitor visitor) {
    visitor.visit(this);
  }
}
