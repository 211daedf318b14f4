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

/**
 * Syntax node for any statement without control-flow meaning: assignments, expression statements,
 * imports, {@code raise}, {@code del}, and so on. Only the normalized source text is kept.
 */
public final class SimpleStatement extends Statement {

  private final String text;

  SimpleStatement(Location location, String text) {
    super(location, Kind.SIMPLE);
    this.text = Preconditions.checkNotNull(text);
  }

  /** Returns the normalized source text of the statement. */
  public String getText() {
    return text;
  }

  @Override
  public String toString() {
    return text;
  }

  @Override
  public void accept(StatementVisitor visitor) {
    visitor.visit(this);
  }
}
