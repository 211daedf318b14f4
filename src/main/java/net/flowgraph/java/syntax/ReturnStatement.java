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

import javax.annotation.Nullable;

/** A syntax node for return statements. */
public final class ReturnStatement extends Statement {

  @Nullable private final String result;

  ReturnStatement(Location location, @Nullable String result) {
    super(location, Kind.RETURN);
    this.result = result;
  }

  /** Returns the source text of the returned expression, or null for a bare {@code return}. */
  @Nullable
  public String getResult() {
    return result;
  }

  @Override
  public String toString() {
    return result == null ? "return" : "return " + result;
  }

  @Override
  public void accept(StatementVisitor visitor) {
    visitor.visit(this);
  }
}
