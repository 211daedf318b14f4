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

/** Base class for all statement nodes in the syntax tree. */
public abstract class Statement {

  /**
   * Kind of the statement. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public enum Kind {
    SIMPLE,
    PASS,
    IF,
    WHILE,
    FOR,
    RETURN,
    BREAK,
    CONTINUE,
    TRY,
    DEF,
    CLASS,
    BLOCK,
  }

  private final Location location;
  private final Kind kind;

  Statement(Location location, Kind kind) {
    this.location = Preconditions.checkNotNull(location);
    this.kind = Preconditions.checkNotNull(kind);
  }

  /** Returns the kind of the statement. */
  public final Kind kind() {
    return kind;
  }

  /** Returns the location of the first character of the statement. */
  public final Location getLocation() {
    return location;
  }

  /** Returns the 1-based line on which the statement starts. */
  public final int getStartLine() {
    return location.line();
  }

  /** Implements the double dispatch by calling into the node specific visit method. */
  public abstract void accept(StatementVisitor visitor);
}
