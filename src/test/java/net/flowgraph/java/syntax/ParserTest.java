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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests of parser. */
@RunWith(TestParameterInjector.class)
public final class ParserTest {

  // Joins the lines, parses them, and asserts that parsing succeeds.
  private static ImmutableList<Statement> parse(String... lines) {
    SourceFile file = SourceFile.parse(ParserInput.fromLines(lines));
    assertThat(file.errors()).isEmpty();
    return file.getStatements();
  }

  // Parses the lines, asserts that parsing fails, and returns the first error message.
  private static String parseError(String... lines) {
    SourceFile file = SourceFile.parse(ParserInput.fromLines(lines));
    if (file.ok()) {
      throw new AssertionError("parseError() succeeded unexpectedly: " + String.join("\n", lines));
    }
    return file.errors().get(0).toString();
  }

  private static Statement parseStatement(String... lines) {
    return Iterables.getOnlyElement(parse(lines));
  }

  // Returns the kinds of the statements, in order.
  private static List<Statement.Kind> kinds(List<Statement> statements) {
    List<Statement.Kind> kinds = new ArrayList<>();
    for (Statement stmt : statements) {
      kinds.add(stmt.kind());
    }
    return kinds;
  }

  @Test
  public void testSimpleStatements() {
    ImmutableList<Statement> stmts = parse("x = 1", "f(x,", "  y)", "print( 'a  b' )");
    assertThat(kinds(stmts))
        .containsExactly(Statement.Kind.SIMPLE, Statement.Kind.SIMPLE, Statement.Kind.SIMPLE)
        .inOrder();
    assertThat(((SimpleStatement) stmts.get(0)).getText()).isEqualTo("x = 1");
    assertThat(((SimpleStatement) stmts.get(1)).getText()).isEqualTo("f(x, y)");
    assertThat(((SimpleStatement) stmts.get(2)).getText()).isEqualTo("print( 'a  b' )");
    assertThat(stmts.get(2).getStartLine()).isEqualTo(4);
  }

  @Test
  public void testSemicolonSeparatedStatements() {
    ImmutableList<Statement> stmts = parse("a = 1; b = ';'; return a;");
    assertThat(kinds(stmts))
        .containsExactly(Statement.Kind.SIMPLE, Statement.Kind.SIMPLE, Statement.Kind.RETURN)
        .inOrder();
    assertThat(((SimpleStatement) stmts.get(1)).getText()).isEqualTo("b = ';'");
  }

  @Test
  public void testFlowStatements() {
    assertThat(kinds(parse("break", "continue", "pass")))
        .containsExactly(Statement.Kind.BREAK, Statement.Kind.CONTINUE, Statement.Kind.PASS)
        .inOrder();
    // Identifiers that merely start with a keyword are not keywords.
    assertThat(parseStatement("passed = True").kind()).isEqualTo(Statement.Kind.SIMPLE);
    assertThat(parseStatement("if_x = 1").kind()).isEqualTo(Statement.Kind.SIMPLE);
  }

  @Test
  public void testReturnStatement() {
    ReturnStatement stmt = (ReturnStatement) parseStatement("return x + 1");
    assertThat(stmt.getResult()).isEqualTo("x + 1");
    assertThat(((ReturnStatement) parseStatement("return")).getResult()).isNull();
  }

  @Test
  public void testIfElifElse() {
    IfStatement stmt =
        (IfStatement)
            parseStatement(
                "if x > 0:", //
                "  a = 1",
                "elif x < 0:",
                "  a = -1",
                "else:",
                "  a = 0");
    assertThat(stmt.getCondition()).isEqualTo("x > 0");
    assertThat(stmt.isElif()).isFalse();
    assertThat(stmt.getThenBlock()).hasSize(1);

    IfStatement elif = (IfStatement) Iterables.getOnlyElement(stmt.getElseBlock());
    assertThat(elif.isElif()).isTrue();
    assertThat(elif.getCondition()).isEqualTo("x < 0");
    assertThat(elif.getStartLine()).isEqualTo(3);
    assertThat(((SimpleStatement) elif.getElseBlock().get(0)).getText()).isEqualTo("a = 0");
  }

  @Test
  public void testIfWithoutElse() {
    IfStatement stmt = (IfStatement) parse("if x:", "  y()", "z()").get(0);
    assertThat(stmt.getElseBlock()).isEmpty();
  }

  @Test
  public void testInlineSuites() {
    IfStatement stmt = (IfStatement) parseStatement("if x: return 1", "else: a = 2; b = 3");
    assertThat(kinds(stmt.getThenBlock())).containsExactly(Statement.Kind.RETURN);
    assertThat(kinds(stmt.getElseBlock()))
        .containsExactly(Statement.Kind.SIMPLE, Statement.Kind.SIMPLE);
  }

  @Test
  public void testConditionWithColonsInBrackets() {
    IfStatement stmt = (IfStatement) parseStatement("if d[1:2] == {'a': 1}: pass");
    assertThat(stmt.getCondition()).isEqualTo("d[1:2] == {'a': 1}");
  }

  @Test
  public void testAssignmentExpressionsInHeaders() {
    IfStatement stmt =
        (IfStatement)
            parseStatement(
                "if m := re.match(p, s):", //
                "  use(m)",
                "elif (n := len(s)) > 3:",
                "  use(n)");
    assertThat(stmt.getCondition()).isEqualTo("m := re.match(p, s)");
    assertThat(stmt.getThenBlock()).hasSize(1);
    IfStatement elif = (IfStatement) Iterables.getOnlyElement(stmt.getElseBlock());
    assertThat(elif.getCondition()).isEqualTo("(n := len(s)) > 3");

    WhileStatement loop =
        (WhileStatement) parseStatement("while chunk := f.read(10):", "  use(chunk)");
    assertThat(loop.getCondition()).isEqualTo("chunk := f.read(10)");
    assertThat(kinds(loop.getBody())).containsExactly(Statement.Kind.SIMPLE);

    WhileStatement inline = (WhileStatement) parseStatement("while x := next(it): use(x)");
    assertThat(inline.getCondition()).isEqualTo("x := next(it)");
    assertThat(inline.getBody()).hasSize(1);
  }

  @Test
  public void testWhileStatement() {
    WhileStatement stmt = (WhileStatement) parseStatement("while not done:", "  step()");
    assertThat(stmt.getCondition()).isEqualTo("not done");
    assertThat(stmt.getBody()).hasSize(1);
  }

  @Test
  public void testForStatement() {
    ForStatement stmt =
        (ForStatement) parseStatement("for i, (k, v) in enumerate(d.items()):", "  f(i)");
    assertThat(stmt.getVars()).isEqualTo("i, (k, v)");
    assertThat(stmt.getIterable()).isEqualTo("enumerate(d.items())");
  }

  @Test
  public void testForInsideString() {
    ForStatement stmt = (ForStatement) parseStatement("for c in 'a in b':", "  f(c)");
    assertThat(stmt.getVars()).isEqualTo("c");
    assertThat(stmt.getIterable()).isEqualTo("'a in b'");
  }

  @Test
  public void testTryStatement() {
    TryStatement stmt =
        (TryStatement)
            parseStatement(
                "try:",
                "  f()",
                "except (KeyError, ValueError) as e:",
                "  g(e)",
                "except:",
                "  h()",
                "else:",
                "  i()",
                "finally:",
                "  j()");
    assertThat(stmt.getBody()).hasSize(1);
    assertThat(stmt.getHandlers()).hasSize(2);
    ExceptClause first = stmt.getHandlers().get(0);
    assertThat(first.getExceptionType()).isEqualTo("(KeyError, ValueError)");
    assertThat(first.getName()).isEqualTo("e");
    assertThat(first.getLocation().line()).isEqualTo(3);
    ExceptClause bare = stmt.getHandlers().get(1);
    assertThat(bare.getExceptionType()).isNull();
    assertThat(bare.getName()).isNull();
    assertThat(stmt.getElseBlock()).hasSize(1);
    assertThat(stmt.getFinallyBlock()).hasSize(1);
  }

  @Test
  public void testTryFinallyOnly() {
    TryStatement stmt = (TryStatement) parseStatement("try:", "  f()", "finally:", "  g()");
    assertThat(stmt.getHandlers()).isEmpty();
    assertThat(stmt.getFinallyBlock()).hasSize(1);
  }

  @Test
  public void testExceptStar() {
    TryStatement stmt =
        (TryStatement) parseStatement("try:", "  f()", "except* OSError as eg:", "  g()");
    assertThat(stmt.getHandlers().get(0).getExceptionType()).isEqualTo("OSError");
  }

  @Test
  public void testDefStatement() {
    DefStatement def =
        (DefStatement) parseStatement("def f(a, b: int = (1), *args) -> int:", "  return a");
    assertThat(def.getName()).isEqualTo("f");
    assertThat(def.getParameters()).isEqualTo("a, b: int = (1), *args");
    assertThat(def.isAsync()).isFalse();
    assertThat(kinds(def.getBody())).containsExactly(Statement.Kind.RETURN);
  }

  @Test
  public void testAsyncStatements() {
    DefStatement def =
        (DefStatement)
            parseStatement(
                "async def fetch(url):", //
                "  async with session:",
                "    async for chunk in stream:",
                "      pass");
    assertThat(def.isAsync()).isTrue();
    assertThat(def.getName()).isEqualTo("fetch");
    BlockStatement with = (BlockStatement) def.getBody().get(0);
    assertThat(with.getHeader()).isEqualTo("async with session");
    ForStatement loop = (ForStatement) with.getBody().get(0);
    assertThat(loop.getIterable()).isEqualTo("stream");
  }

  @Test
  public void testClassStatement() {
    ClassStatement cls =
        (ClassStatement)
            parseStatement("class Point(Base, metaclass=M):", "  def norm(self):", "    pass");
    assertThat(cls.getName()).isEqualTo("Point");
    assertThat(((DefStatement) cls.getBody().get(0)).getName()).isEqualTo("norm");
  }

  @Test
  public void testDecoratorIsSimpleStatement() {
    assertThat(kinds(parse("@property", "def f(self):", "  pass")))
        .containsExactly(Statement.Kind.SIMPLE, Statement.Kind.DEF)
        .inOrder();
  }

  @Test
  public void testWithStatement() {
    BlockStatement with = (BlockStatement) parseStatement("with open(p) as f, lock:", "  f.read()");
    assertThat(with.getHeader()).isEqualTo("with open(p) as f, lock");
    assertThat(with.getBody()).hasSize(1);
  }

  @Test
  public void testMatchStatement() {
    BlockStatement match =
        (BlockStatement)
            parseStatement(
                "match command:", //
                "  case 'go':",
                "    move()",
                "  case _:",
                "    stop()");
    assertThat(match.getHeader()).isEqualTo("match command");
    assertThat(match.getBody()).hasSize(2);
    assertThat(((BlockStatement) match.getBody().get(0)).getHeader()).isEqualTo("case 'go'");
  }

  @Test
  public void testSoftKeywordsAsIdentifiers() {
    assertThat(kinds(parse("match = re.match(p, s)", "case = 1")))
        .containsExactly(Statement.Kind.SIMPLE, Statement.Kind.SIMPLE);
  }

  @Test
  public void testCommentsAndBlankLines() {
    ImmutableList<Statement> stmts =
        parse("# header", "", "if x:  # why", "", "    # note", "    y()", "z()  # done");
    assertThat(kinds(stmts)).containsExactly(Statement.Kind.IF, Statement.Kind.SIMPLE).inOrder();
    assertThat(stmts.get(1).getStartLine()).isEqualTo(7);
  }

  @Test
  public void testNestedBlocks() {
    DefStatement def =
        (DefStatement)
            parseStatement(
                "def f():",
                "  for i in x:",
                "    while i:",
                "      if i:",
                "        break",
                "      i -= 1",
                "  return i");
    assertThat(kinds(def.getBody()))
        .containsExactly(Statement.Kind.FOR, Statement.Kind.RETURN)
        .inOrder();
    ForStatement loop = (ForStatement) def.getBody().get(0);
    WhileStatement inner = (WhileStatement) loop.getBody().get(0);
    assertThat(kinds(inner.getBody()))
        .containsExactly(Statement.Kind.IF, Statement.Kind.SIMPLE)
        .inOrder();
  }

  @Test
  public void testMissingColon() {
    assertThat(parseError("if x", "  y")).isEqualTo(":1:1: expected ':'");
  }

  @Test
  public void testExpectedIndentedBlock() {
    assertThat(parseError("while x:", "y = 1")).isEqualTo(":2:1: expected an indented block");
  }

  @Test
  public void testUnexpectedIndent() {
    SourceFile file = SourceFile.parse(ParserInput.fromLines("x = 1", "  y = 2"));
    assertThat(file.errors().get(0).toString()).isEqualTo(":2:3: unexpected indent");
    // The statements of the stray block are kept.
    assertThat(file.getStatements()).hasSize(2);
  }

  @Test
  public void testClauseWithoutStatement(
      @TestParameter({"else", "elif x", "except", "finally"}) String clause) {
    String keyword = clause.split(" ")[0];
    String expected =
        keyword.equals("except") || keyword.equals("finally")
            ? "'" + keyword + "' without 'try'"
            : "'" + keyword + "' without matching statement";
    assertThat(parseError("x = 1", clause + ":", "  y = 2")).isEqualTo(":2:1: " + expected);
  }

  @Test
  public void testTryWithoutHandler() {
    assertThat(parseError("try:", "  f()", "g()")).isEqualTo(":1:1: try without except or finally");
  }

  @Test
  public void testTryElseWithoutExcept() {
    assertThat(parseError("try:", "  f()", "else:", "  g()", "finally:", "  h()"))
        .isEqualTo(":3:1: 'else' without 'except'");
  }

  @Test
  public void testForWithoutIn() {
    assertThat(parseError("for x:", "  y")).isEqualTo(":1:1: expected 'in'");
  }

  @Test
  public void testLoopElseIsRejected(@TestParameter({"while x:", "for x in y:"}) String header) {
    assertThat(parseError(header, "  f()", "else:", "  g()"))
        .isEqualTo(":3:1: loop 'else' clauses are not supported");
  }

  @Test
  public void testCompoundStatementInInlineSuite() {
    assertThat(parseError("if x: while y: pass"))
        .isEqualTo(":1:1: 'while' statement not allowed here");
  }

  @Test
  public void testTextAfterBreak() {
    assertThat(parseError("while x:", "  break y")).isEqualTo(":2:3: unexpected 'y' after 'break'");
  }

  @Test
  public void testScanErrorsAreReported() {
    assertThat(parseError("x = (1,", "y = 2")).isEqualTo(":1:5: unclosed '('");
  }

  @Test
  public void testErrorRecoveryResumesAtNextStatement() {
    SourceFile file =
        SourceFile.parse(
            ParserInput.fromLines("if x", "  y", "else:", "  z", "w = 1", "for q:", "  r"));
    assertThat(file.errors()).hasSize(2);
    assertThat(file.errors().get(1).toString()).isEqualTo(":6:1: expected 'in'");
  }

  @Test
  public void testErrorCountIsCapped() {
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      lines.add("else: pass");
    }
    SourceFile file = SourceFile.parse(ParserInput.fromLines(lines.toArray(new String[0])));
    assertThat(file.ok()).isFalse();
    assertThat(file.errors()).hasSize(5);
  }

  @Test
  public void testFileNameInErrors() {
    SourceFile file = SourceFile.parse(ParserInput.fromString("if x\n  y\n", "foo.py"));
    assertThat(file.getFile()).isEqualTo("foo.py");
    assertThat(SyntaxError.toString(file.errors())).isEqualTo("foo.py:1:1: expected ':'");
  }
}
