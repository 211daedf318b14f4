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
 * Syntax node for a compound statement whose body runs once, in sequence, after its header:
 * {@code with}, {@code async with}, and blocks introduced by soft keywords such as {@code match}
 * and {@code case}.
 */
public final class BlockStatement extends Statement {

  private final String header;
  private final ImmutableList<Statement> body;

  BlockStatement(Location location, String header, ImmutableList<Statement> body) {
    super(location, Kind.BLOCK);
    this.header = Preconditions.checkNotNull(header);
    this.body = body;
  }

  /** Returns the header text, keyword included and trailing colon excluded. */
  public String getHeader() {
    return header;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public String toString() {
    return header + ": ...";
  }

  @Override
  public void accept(StatementVisitor visitor) {
    visitor.visit(this);
  }
}
