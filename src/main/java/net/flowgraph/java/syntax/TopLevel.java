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
 * Searches of the normalized text of a logical line that ignore string literals and everything
 * nested inside brackets. The text is assumed to come from the {@link Lexer}, so comments are
 * already gone and string literals are intact.
 */
final class TopLevel {

  private TopLevel() {}

  /**
   * Returns the index of the first occurrence of {@code target} at or after {@code from} that is
   * outside string literals and not nested in brackets opened at or after {@code from}, or -1. The
   * colon of an assignment expression {@code :=} never matches.
   */
  static int indexOf(String text, char target, int from) {
    int depth = 0;
    for (int i = from; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == target && depth == 0 && !isWalrusColon(text, i)) {
        return i;
      }
      switch (c) {
        case '\'':
        case '"':
          i = skipString(text, i) - 1;
          break;
        case '(':
        case '[':
        case '{':
          depth++;
          break;
        case ')':
        case ']':
        case '}':
          depth--;
          break;
        default:
          break;
      }
    }
    return -1;
  }

  /**
   * Returns the index of the first top-level occurrence of {@code keyword} as a whole word at or
   * after {@code from}, or -1.
   */
  static int indexOfKeyword(String text, String keyword, int from) {
    int depth = 0;
    for (int i = from; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '\'':
        case '"':
          i = skipString(text, i) - 1;
          continue;
        case '(':
        case '[':
        case '{':
          depth++;
          continue;
        case ')':
        case ']':
        case '}':
          depth--;
          continue;
        default:
          break;
      }
      if (depth == 0
          && text.startsWith(keyword, i)
          && (i == 0 || !isIdentifierPart(text.charAt(i - 1)))
          && (i + keyword.length() == text.length()
              || !isIdentifierPart(text.charAt(i + keyword.length())))) {
        return i;
      }
    }
    return -1;
  }

  /** Splits the text at top-level occurrences of the separator, dropping empty parts. */
  static ImmutableList<String> split(String text, char separator) {
    ImmutableList.Builder<String> parts = ImmutableList.builder();
    int start = 0;
    while (start <= text.length()) {
      int end = indexOf(text, separator, start);
      if (end < 0) {
        end = text.length();
      }
      String part = text.substring(start, end).trim();
      if (!part.isEmpty()) {
        parts.add(part);
      }
      start = end + 1;
    }
    return parts.build();
  }

  /** Returns the leading identifier of the text, or the empty string. */
  static String firstWord(String text) {
    int end = 0;
    while (end < text.length() && isIdentifierPart(text.charAt(end))) {
      end++;
    }
    return text.substring(0, end);
  }

  static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private static boolean isWalrusColon(String text, int i) {
    return text.charAt(i) == ':' && i + 1 < text.length() && text.charAt(i + 1) == '=';
  }

  // Returns the index just past the string literal whose opening quote is at index i.
  private static int skipString(String text, int i) {
    char quot = text.charAt(i);
    String tripleQuote = new String(new char[] {quot, quot, quot});
    String delimiter = text.startsWith(tripleQuote, i) ? tripleQuote : String.valueOf(quot);
    int j = i + delimiter.length();
    while (j < text.length()) {
      char c = text.charAt(j);
      if (c == '\\') {
        j += 2;
      } else if (text.startsWith(delimiter, j)) {
        return j + delimiter.length();
      } else {
        j++;
      }
    }
    return text.length();
  }
}
