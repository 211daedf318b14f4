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

/** Syntax node for a class definition, {@code class Name(bases): ...}. */
public final class ClassStatement extends Statement {

  private final String name;
  private final ImmutableList<Statement> body;

  ClassStatement(Location location, String name, ImmutableList<Statement> body) {
    super(location, Kind.CLASS);
    this.name = Preconditions.checkNotNull(name);
    this.body = body;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public String toString() {
    return "class " + name + ": ...";
  }

  @Override
  public void accept(StatementVisitor visitor) {
    visitor.visit(this);
  }
}
