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
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Stack;

/**
 * A scanner that splits source text into logical lines and indentation changes.
 *
 * <p>A logical line is one statement line with its comments removed, the physical lines it spans
 * (inside brackets or after a backslash) joined, and runs of whitespace outside string literals
 * collapsed to a single space. String literals are copied verbatim.
 */
final class Lexer {

  // --- These fields are accessed directly by the parser: ---

  // Information about current token. Updated by nextToken.
  TokenKind kind;
  int start; // start offset
  String text; // normalized text of a LINE token, null otherwise

  // --- end of parser-visible fields ---

  private final String file;
  private final List<SyntaxError> errors;

  // Input buffer and position
  private final char[] buffer;
  private int pos;

  // Offsets of the first character of each physical line.
  private final int[] lineStarts;

  // The stack of enclosing indentation levels in columns.
  // The first (outermost) element is always zero.
  private final Stack<Integer> indentStack = new Stack<>();

  // True after a LINE token: the indentation of the next line has to be checked.
  private boolean checkIndentation;

  // Number of saved INDENT (>0) or OUTDENT (<0) tokens detected but not yet returned.
  private int dents;

  // Constructs a lexer which tokenizes the parser input.
  // Errors are appended to errors.
  Lexer(ParserInput input, List<SyntaxError> errors) {
    this.file = input.getFile();
    this.buffer = input.getContent();
    this.errors = errors;
    this.lineStarts = computeLineStarts(buffer);
    this.pos = 0;
    this.checkIndentation = true;
    this.dents = 0;

    indentStack.push(0);
  }

  private static int[] computeLineStarts(char[] buffer) {
    int[] starts = new int[16];
    int count = 0;
    starts[count++] = 0;
    for (int i = 0; i < buffer.length; i++) {
      if (buffer[i] == '\n') {
        if (count == starts.length) {
          starts = Arrays.copyOf(starts, count * 2);
        }
        starts[count++] = i + 1;
      }
    }
    return Arrays.copyOf(starts, count);
  }

  /** Returns the location of the given character offset. */
  Location locationOf(int offset) {
    int index = Arrays.binarySearch(lineStarts, offset);
    if (index < 0) {
      index = -index - 2; // the line whose start precedes offset
    }
    return Location.fromFileLineColumn(file, index + 1, offset - lineStarts[index] + 1);
  }

  /**
   * Reads the next token, updating the Lexer's token fields. Indentation changes are reported
   * before the line that causes them; at end of input, every open indentation level is closed by
   * an OUTDENT before the EOF token.
   */
  void nextToken() {
    text = null;
    if (dents == 0 && checkIndentation) {
      checkIndentation = false;
      computeIndentation();
    }
    if (dents > 0) {
      dents--;
      setToken(TokenKind.INDENT, pos);
    } else if (dents < 0) {
      dents++;
      setToken(TokenKind.OUTDENT, pos);
    } else if (pos >= buffer.length) {
      setToken(TokenKind.EOF, buffer.length);
    } else {
      scanLogicalLine();
      checkIndentation = true;
    }
    Preconditions.checkState(kind != null);
  }

  private void setToken(TokenKind kind, int start) {
    this.kind = kind;
    this.start = start;
  }

  private void error(String message, int offset) {
    errors.add(new SyntaxError(locationOf(offset), message));
  }

  /**
   * Skips blank lines and comment-only lines, then measures the indentation of the next line and
   * updates {@code dents}. Tabs advance to the next multiple of eight columns.
   */
  private void computeIndentation() {
    int indentLen;
    while (true) {
      indentLen = 0;
      while (pos < buffer.length) {
        char c = buffer[pos];
        if (c == ' ') {
          indentLen++;
        } else if (c == '\t') {
          indentLen = (indentLen / 8 + 1) * 8;
        } else if (c != '\r' && c != '\f') {
          break;
        }
        pos++;
      }
      if (pos == buffer.length) {
        indentLen = 0; // trailing space on last line
        break;
      }
      char c = buffer[pos];
      if (c == '\n') { // entirely blank line: discard
        pos++;
      } else if (c == '#') { // line containing only a comment
        skipComment();
      } else { // printing character
        break;
      }
    }

    int peekedIndent = indentStack.peek();
    if (peekedIndent < indentLen) { // push a level
      indentStack.push(indentLen);
      dents++;

    } else if (peekedIndent > indentLen) { // pop one or more levels
      while (peekedIndent > indentLen) {
        indentStack.pop();
        dents--;
        peekedIndent = indentStack.peek();
      }

      if (peekedIndent < indentLen) {
        error("indentation error", pos);
      }
    }
  }

  // Advances pos to the newline that ends the current comment, or to the end of input.
  private void skipComment() {
    while (pos < buffer.length && buffer[pos] != '\n') {
      pos++;
    }
  }

  /**
   * Scans one logical line starting at the current position, which is the first non-blank
   * character of a physical line. On exit, pos is just past the terminating newline.
   */
  private void scanLogicalLine() {
    setToken(TokenKind.LINE, pos);
    StringBuilder line = new StringBuilder();
    Deque<Integer> openBrackets = new ArrayDeque<>(); // offsets of unclosed brackets
    boolean pendingSpace = false;

    scan:
    while (pos < buffer.length) {
      char c = buffer[pos];
      switch (c) {
        case ' ':
        case '\t':
        case '\r':
        case '\f':
          pendingSpace = true;
          pos++;
          break;
        case '\n':
          pos++;
          if (openBrackets.isEmpty()) {
            break scan;
          }
          pendingSpace = true; // in an expression: a newline is just space
          break;
        case '\\':
          if (peek(1) == '\n') {
            pos += 2;
            pendingSpace = true;
          } else if (peek(1) == '\r' && peek(2) == '\n') {
            pos += 3;
            pendingSpace = true;
          } else {
            pendingSpace = appendSpace(line, pendingSpace);
            line.append(c);
            pos++;
          }
          break;
        case '#':
          skipComment();
          break;
        case '\'':
        case '"':
          pendingSpace = appendSpace(line, pendingSpace);
          stringLiteral(c, line);
          break;
        case '(':
        case '[':
        case '{':
          pendingSpace = appendSpace(line, pendingSpace);
          openBrackets.push(pos);
          line.append(c);
          pos++;
          break;
        case ')':
        case ']':
        case '}':
          pendingSpace = appendSpace(line, pendingSpace);
          if (openBrackets.isEmpty()) {
            error("unexpected '" + c + "'", pos);
          } else {
            char open = buffer[openBrackets.pop()];
            if (closing(open) != c) {
              error("closing '" + c + "' does not match opening '" + open + "'", pos);
            }
          }
          line.append(c);
          pos++;
          break;
        default:
          pendingSpace = appendSpace(line, pendingSpace);
          line.append(c);
          pos++;
          break;
      }
    }

    if (!openBrackets.isEmpty()) {
      int offset = openBrackets.getLast();
      error("unclosed '" + buffer[offset] + "'", offset);
    }
    text = line.toString();
  }

  private static boolean appendSpace(StringBuilder line, boolean pendingSpace) {
    if (pendingSpace && line.length() > 0) {
      line.append(' ');
    }
    return false;
  }

  private static char closing(char open) {
    switch (open) {
      case '(':
        return ')';
      case '[':
        return ']';
      default:
        return '}';
    }
  }

  private char peek(int i) {
    return pos + i < buffer.length ? buffer[pos + i] : 0;
  }

  /**
   * Copies a string literal delimited by 'quot' verbatim into line. Escape sequences are not
   * interpreted, only skipped over.
   *
   * <ul>
   *   <li>ON ENTRY: 'pos' is the index of the first delimiter
   *   <li>ON EXIT: 'pos' is 1 + the index of the last delimiter.
   * </ul>
   */
  private void stringLiteral(char quot, StringBuilder line) {
    int literalStartPos = pos;
    boolean inTripleQuote = peek(1) == quot && peek(2) == quot;
    int delimiterLength = inTripleQuote ? 3 : 1;
    line.append(buffer, pos, delimiterLength);
    pos += delimiterLength;

    while (pos < buffer.length) {
      char c = buffer[pos];
      if (c == '\\') {
        line.append(c);
        pos++;
        if (pos < buffer.length) {
          line.append(buffer[pos]);
          pos++;
        }
      } else if (c == quot && (!inTripleQuote || (peek(1) == quot && peek(2) == quot))) {
        line.append(buffer, pos, delimiterLength);
        pos += delimiterLength;
        return;
      } else if (c == '\n' && !inTripleQuote) {
        break; // the newline is left to end the logical line
      } else {
        line.append(c);
        pos++;
      }
    }
    error("unclosed string literal", literalStartPos);
  }
}
