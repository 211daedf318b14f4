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

/**
 * The kinds of token produced by the {@link Lexer}. The lexer works at the granularity of logical
 * lines: expressions are never tokenized, only the block structure is.
 */
enum TokenKind {
  LINE("logical line"),
  INDENT("indent"),
  OUTDENT("outdent"),
  EOF("EOF");

  private final String name;

  TokenKind(String name) {
    this.name = name;
  }

  @Override
  public String toString() {
    return name;
  }
}
