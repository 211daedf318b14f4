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
import java.util.Objects;

/**
 * A Location denotes a position within a source file: a file name plus 1-based line and column
 * numbers.
 */
public final class Location {

  private final String file;
  private final int line;
  private final int column;

  private Location(String file, int line, int column) {
    this.file = Preconditions.checkNotNull(file);
    this.line = line;
    this.column = column;
  }

  /** Returns a location for the given file, line and column. */
  public static Location fromFileLineColumn(String file, int line, int column) {
    Preconditions.checkArgument(line > 0, "line must be positive: %s", line);
    Preconditions.checkArgument(column > 0, "column must be positive: %s", column);
    return new Location(file, line, column);
  }

  /** Returns the name of the file containing this location. */
  public String file() {
    return file;
  }

  /** Returns the 1-based line number. */
  public int line() {
    return line;
  }

  /** Returns the 1-based column number. */
  public int column() {
    return column;
  }

  /** Formats the location as {@code file:line:column}. */
  @Override
  public String toString() {
    return file + ":" + line + ":" + column;
  }

  @Override
  public boolean equals(Object that) {
    if (this == that) {
      return true;
    }
    if (!(that instanceof Location)) {
      return false;
    }
    Location loc = (Location) that;
    return line == loc.line && column == loc.column && file.equals(loc.file);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line, column);
  }
}
