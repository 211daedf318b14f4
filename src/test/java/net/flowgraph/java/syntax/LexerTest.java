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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the logical-line scanning of the {@link Lexer}. */
@RunWith(JUnit4.class)
public class LexerTest {

  private final List<SyntaxError> errors = new ArrayList<>();

  private Lexer createLexer(String input) {
    errors.clear();
    return new Lexer(ParserInput.fromString(input, "foo.py"), errors);
  }

  // Returns the tokens of the input, LINE tokens as their bracketed text, others by kind.
  private String tokens(String input) {
    Lexer lexer = createLexer(input);
    List<String> result = new ArrayList<>();
    do {
      lexer.nextToken();
      result.add(lexer.kind == TokenKind.LINE ? "[" + lexer.text + "]" : lexer.kind.name());
    } while (lexer.kind != TokenKind.EOF);
    return Joiner.on(' ').join(result);
  }

  // Returns the line number of each LINE token of the input.
  private String linenums(String input) {
    Lexer lexer = createLexer(input);
    List<Integer> result = new ArrayList<>();
    for (lexer.nextToken(); lexer.kind != TokenKind.EOF; lexer.nextToken()) {
      if (lexer.kind == TokenKind.LINE) {
        result.add(lexer.locationOf(lexer.start).line());
      }
    }
    return Joiner.on(' ').join(result);
  }

  private String lastError() {
    return errors.isEmpty() ? "" : errors.get(errors.size() - 1).toString();
  }

  @Test
  public void testEmptyInput() {
    assertThat(tokens("")).isEqualTo("EOF");
    assertThat(tokens("\n\n  \n# comment\n")).isEqualTo("EOF");
  }

  @Test
  public void testIndentation() {
    assertThat(tokens("if x:\n  return 1\ny = 2\n"))
        .isEqualTo("[if x:] INDENT [return 1] OUTDENT [y = 2] EOF");
    assertThat(tokens("def f():\n  while x:\n    y\n")) // several levels closed at EOF
        .isEqualTo("[def f():] INDENT [while x:] INDENT [y] OUTDENT OUTDENT EOF");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testTabsAdvanceToMultipleOfEight() {
    // A tab and eight spaces are the same indentation.
    assertThat(tokens("if x:\n\ta\n        b\n"))
        .isEqualTo("[if x:] INDENT [a] [b] OUTDENT EOF");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testBlankAndCommentLinesDoNotAffectIndentation() {
    assertThat(tokens("if x:\n\n    # comment\n  a\n\n  b\n"))
        .isEqualTo("[if x:] INDENT [a] [b] OUTDENT EOF");
  }

  @Test
  public void testWhitespaceIsCollapsedAndCommentsRemoved() {
    assertThat(tokens("x  =\t1   # set x\n")).isEqualTo("[x = 1] EOF");
  }

  @Test
  public void testNewlinesInsideBracketsJoinLines() {
    assertThat(tokens("f(a,\n      b)\ng = [\n  1,\n  2,\n]\n"))
        .isEqualTo("[f(a, b)] [g = [ 1, 2, ]] EOF");
    assertThat(linenums("f(a,\n      b)\ng = [\n  1,\n]\n")).isEqualTo("1 3");
  }

  @Test
  public void testBackslashContinuation() {
    assertThat(tokens("x = 1 + \\\n    2\ny\n")).isEqualTo("[x = 1 + 2] [y] EOF");
  }

  @Test
  public void testStringLiteralsAreCopiedVerbatim() {
    assertThat(tokens("x = 'a  # b'\n")).isEqualTo("[x = 'a  # b'] EOF");
    assertThat(tokens("x = \"it's\"\n")).isEqualTo("[x = \"it's\"] EOF");
    assertThat(tokens("x = r'\\d+'\n")).isEqualTo("[x = r'\\d+'] EOF");
    assertThat(tokens("x = '(' + f(')')\n")).isEqualTo("[x = '(' + f(')')] EOF");
  }

  @Test
  public void testTripleQuotedStringSpansLines() {
    assertThat(tokens("x = \"\"\"a\n   b\"\"\"\ny\n"))
        .isEqualTo("[x = \"\"\"a\n   b\"\"\"] [y] EOF");
    assertThat(linenums("x = '''a\nb'''\ny\n")).isEqualTo("1 3");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testUnclosedStringLiteral() {
    tokens("x = 'abc\ny\n");
    assertThat(lastError()).isEqualTo("foo.py:1:5: unclosed string literal");
  }

  @Test
  public void testUnbalancedBrackets() {
    tokens("x = (1\n");
    assertThat(lastError()).isEqualTo("foo.py:1:5: unclosed '('");

    tokens("x = 1)\n");
    assertThat(lastError()).isEqualTo("foo.py:1:6: unexpected ')'");

    tokens("x = [1)\n");
    assertThat(errors.get(0).toString())
        .isEqualTo("foo.py:1:7: closing ')' does not match opening '['");
  }

  @Test
  public void testDedentToUnknownLevel() {
    assertThat(tokens("if x:\n    a\n  b\n")).isEqualTo("[if x:] INDENT [a] OUTDENT [b] EOF");
    assertThat(lastError()).isEqualTo("foo.py:3:3: indentation error");
  }

  @Test
  public void testLineNumbers() {
    assertThat(linenums("a\n\nb\n  # c\nd\n")).isEqualTo("1 3 5");
  }

  @Test
  public void testEofIsRepeated() {
    Lexer lexer = createLexer("x\n");
    lexer.nextToken();
    lexer.nextToken();
    assertThat(lexer.kind).isEqualTo(TokenKind.EOF);
    lexer.nextToken();
    assertThat(lexer.kind).isEqualTo(TokenKind.EOF);
  }
}
