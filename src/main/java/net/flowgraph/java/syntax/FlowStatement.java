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

/** A class for flow statements (break, continue, and pass). */
public final class FlowStatement extends Statement {

  /**
   * Constructs a new flow control statement.
   *
   * @param kind The specific kind of flow control statement (BREAK, CONTINUE, or PASS)
   */
  FlowStatement(Location location, Kind kind) {
    super(location, kind);
    Preconditions.checkArgument(
        kind == Kind.BREAK || kind == Kind.CONTINUE || kind == Kind.PASS,
        "not a flow statement: %s",
        kind);
  }

  @Override
  public String toString() {
    switch (kind()) {
      case BREAK:
        return "break";
      case CONTINUE:
        return "continue";
      default:
        return "pass";
    }
  }

  @Override
  public void accept(StatementVisitor visitor) {
    visitor.visit(this);
  }
}
