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

import com.google.common.collect.ImmutableList;

/**
 * Syntax tree for a source file.
 *
 * <p>A file that failed to parse still has a (possibly incomplete) list of statements; callers
 * must check {@link #ok} before relying on them.
 */
public final class SourceFile {

  private final String file;
  private final ImmutableList<Statement> statements;
  private final ImmutableList<SyntaxError> errors;

  private SourceFile(
      String file, ImmutableList<Statement> statements, ImmutableList<SyntaxError> errors) {
    this.file = file;
    this.statements = statements;
    this.errors = errors;
  }

  /**
   * Parses the input as a file and returns its syntax tree. Scan and parse errors are recorded in
   * {@link #errors}; this method does not throw.
   */
  public static SourceFile parse(ParserInput input) {
    Parser.ParseResult result = Parser.parseFile(input);
    return new SourceFile(
        input.getFile(), result.statements, ImmutableList.copyOf(result.errors));
  }

  /** Returns the apparent file name given by the parser input. */
  public String getFile() {
    return file;
  }

  /** Returns the top-level statements of the file, in source order. */
  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  /** Returns the scan and parse errors, in the order they were found. */
  public ImmutableList<SyntaxError> errors() {
    return errors;
  }

  /** Reports whether the file parsed without errors. */
  public boolean ok() {
    return errors.isEmpty();
  }

  @Override
  public String toString() {
    return "<source file " + file + ">";
  }
}
