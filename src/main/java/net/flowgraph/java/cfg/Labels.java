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
package net.flowgraph.java.cfg;

import com.google.common.base.Preconditions;
import javax.annotation.Nullable;

/**
 * Display text of graph nodes.
 *
 * <p>Labels are bounded in length. Truncation counts code points, so a label never ends in half a
 * surrogate pair.
 */
public final class Labels {

  /** Maximum length of the label of a simple statement. */
  public static final int MAX_STATEMENT_LENGTH = 50;

  /** Maximum length of the rendered test of a condition or loop. */
  public static final int MAX_TEST_LENGTH = 40;

  /** Maximum length of the rendered value of a return statement. */
  public static final int MAX_RETURN_LENGTH = 30;

  private static final String ELLIPSIS = "...";

  static final String MERGE = "merge";
  static final String TRY = "try";
  static final String END_TRY = "end try";

  private Labels() {}

  /**
   * Returns the text unchanged if it has at most {@code maxLength} code points, and otherwise its
   * first {@code maxLength - 3} code points followed by {@code "..."}.
   */
  public static String truncate(String text, int maxLength) {
    Preconditions.checkArgument(
        maxLength > ELLIPSIS.length(), "maxLength too small: %s", maxLength);
    if (text.codePointCount(0, text.length()) <= maxLength) {
      return text;
    }
    int end = text.offsetByCodePoints(0, maxLength - ELLIPSIS.length());
    return text.substring(0, end) + ELLIPSIS;
  }

  static String entry(String functionName) {
    return "START: " + functionName;
  }

  static String exit(String functionName) {
    return "END: " + functionName;
  }

  static String error(String message) {
    return "ERROR: " + message;
  }

  static String statement(String text) {
    return truncate(text, MAX_STATEMENT_LENGTH);
  }

  static String condition(String test) {
    return "if " + truncate(test, MAX_TEST_LENGTH);
  }

  static String whileLoop(String test) {
    return "while " + truncate(test, MAX_TEST_LENGTH);
  }

  static String forLoop(String vars, String iterable) {
    return "for " + truncate(vars + " in " + iterable, MAX_TEST_LENGTH);
  }

  static String endLoop(String keyword) {
    return "end " + keyword;
  }

  static String returnStatement(@Nullable String value) {
    return value == null ? "return" : "return " + truncate(value, MAX_RETURN_LENGTH);
  }

  static String except(@Nullable String exceptionType) {
    return "except "
        + (exceptionType == null ? "Exception" : truncate(exceptionType, MAX_TEST_LENGTH));
  }

  static String def(String name) {
    return "def " + name + "(...)";
  }

  static String classDef(String name) {
    return "class " + name;
  }
}
