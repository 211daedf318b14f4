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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Parser is a recursive-descent parser for the statement structure of a source file.
 *
 * <p>The parser recognizes statements and blocks but does not parse expressions: conditions,
 * iterables, returned values and simple statements are kept as the normalized source text produced
 * by the {@link Lexer}.
 */
final class Parser {

  /** Combines the parser result into a single value object. */
  static final class ParseResult {
    /** The top-level statements of the parsed file. */
    final ImmutableList<Statement> statements;

    // Errors encountered during scanning or parsing.
    final List<SyntaxError> errors;

    private ParseResult(ImmutableList<Statement> statements, List<SyntaxError> errors) {
      this.statements = Preconditions.checkNotNull(statements);
      this.errors = errors;
    }
  }

  // Limit the number of reported errors to avoid spamming output.
  private static final int MAX_ERRORS = 5;

  /** Current lookahead token. May be mutated by the parser. */
  private final Lexer token; // token.kind is a prettier alias for lexer.kind

  private final Lexer lexer;
  private final List<SyntaxError> errors;

  private int errorsCount;
  private boolean recoveryMode; // stop reporting errors until next statement

  private Parser(Lexer lexer, List<SyntaxError> errors) {
    this.lexer = lexer;
    this.errors = errors;
    this.token = lexer;
    nextToken();
  }

  // Main entry point for parsing a file.
  static ParseResult parseFile(ParserInput input) {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, errors);
    Parser parser = new Parser(lexer, errors);
    ImmutableList<Statement> statements = parser.parseFileInput();
    return new ParseResult(statements, errors);
  }

  private void nextToken() {
    lexer.nextToken();
  }

  private Location location() {
    return lexer.locationOf(token.start);
  }

  @FormatMethod
  private void reportError(Location location, String format, Object... args) {
    errorsCount++;
    if (errorsCount <= MAX_ERRORS) {
      errors.add(new SyntaxError(location, String.format(format, args)));
    }
  }

  private void syntaxError(String message) {
    if (!recoveryMode) {
      reportError(location(), "%s", message);
      recoveryMode = true;
    }
  }

  // file_input = {statement} EOF
  private ImmutableList<Statement> parseFileInput() {
    ImmutableList.Builder<Statement> list = ImmutableList.builder();
    while (token.kind != TokenKind.EOF) {
      parseStatementOrStrayBlock(list);
    }
    return list.build();
  }

  // Parses statements until the OUTDENT that closes the current block, and consumes it.
  private void parseBlockBody(ImmutableList.Builder<Statement> list) {
    while (token.kind != TokenKind.OUTDENT && token.kind != TokenKind.EOF) {
      parseStatementOrStrayBlock(list);
    }
    if (token.kind == TokenKind.OUTDENT) {
      nextToken();
    }
  }

  private void parseStatementOrStrayBlock(ImmutableList.Builder<Statement> list) {
    if (token.kind == TokenKind.INDENT) {
      recoveryMode = false;
      reportError(location(), "unexpected indent");
      recoveryMode = true;
      nextToken();
      // Keep the statements of the stray block; they are still part of the enclosing one.
      parseBlockBody(list);
    } else if (token.kind == TokenKind.OUTDENT) {
      nextToken();
    } else {
      parseStatement(list);
    }
  }

  // stmt = if_stmt | while_stmt | for_stmt | try_stmt | def_stmt | class_stmt | with_stmt
  //      | simple_stmt {';' simple_stmt}
  private void parseStatement(ImmutableList.Builder<Statement> list) {
    Preconditions.checkState(token.kind == TokenKind.LINE, "unexpected token %s", token.kind);
    recoveryMode = false;
    String word = TopLevel.firstWord(token.text);
    switch (word) {
      case "if":
        list.add(parseIfStatement());
        break;
      case "while":
        list.add(parseWhileStatement());
        break;
      case "for":
        list.add(parseForStatement(word, location()));
        break;
      case "try":
        list.add(parseTryStatement());
        break;
      case "def":
        list.add(parseDefStatement(word, location(), /* async= */ false));
        break;
      case "class":
        list.add(parseClassStatement());
        break;
      case "with":
        list.add(parseBlockStatement(word));
        break;
      case "async":
        parseAsyncStatement(list);
        break;
      case "match":
      case "case":
        if (isSoftKeywordHeader(word)) {
          list.add(parseBlockStatement(word));
        } else {
          parseSimpleStatements(list);
        }
        break;
      case "elif":
      case "else":
        syntaxError("'" + word + "' without matching statement");
        skipClause(word);
        break;
      case "except":
      case "finally":
        syntaxError("'" + word + "' without 'try'");
        skipClause(word);
        break;
      default:
        parseSimpleStatements(list);
        break;
    }
  }

  /**
   * The parts of a compound statement header line, {@code keyword text: inline-suite}. For a
   * header followed by an indented block, the inline suite is empty.
   */
  private static final class Header {
    final Location location;
    final String text;
    final String inlineSuite;

    Header(Location location, String text, String inlineSuite) {
      this.location = location;
      this.text = text;
      this.inlineSuite = inlineSuite;
    }
  }

  // Splits the current LINE token, which starts with prefix, at its top-level colon.
  // Does not consume the token.
  private Header parseHeader(String prefix) {
    String text = token.text;
    Location location = location();
    int colon = TopLevel.indexOf(text, ':', prefix.length());
    if (colon < 0) {
      syntaxError("expected ':'");
      return new Header(location, text.substring(prefix.length()).trim(), "");
    }
    return new Header(
        location,
        text.substring(prefix.length(), colon).trim(),
        text.substring(colon + 1).trim());
  }

  // Like parseHeader, for clauses such as 'else' and 'try' that take no header text.
  private Header parseBareHeader(String keyword) {
    Header header = parseHeader(keyword);
    if (!header.text.isEmpty()) {
      syntaxError("expected ':' after '" + keyword + "'");
    }
    return header;
  }

  // suite = simple_stmt {';' simple_stmt}
  //       | LINE INDENT {stmt} OUTDENT
  // Consumes the header token and the block that follows it.
  private ImmutableList<Statement> parseSuite(Header header) {
    ImmutableList.Builder<Statement> list = ImmutableList.builder();
    if (!header.inlineSuite.isEmpty()) {
      parseSimpleStatementList(header.inlineSuite, header.location, list);
      nextToken();
      return list.build();
    }
    nextToken();
    if (token.kind != TokenKind.INDENT) {
      syntaxError("expected an indented block");
      return list.build();
    }
    nextToken();
    parseBlockBody(list);
    return list.build();
  }

  // Reports whether the current token is a LINE token introducing the given clause.
  private boolean atClause(String keyword) {
    return token.kind == TokenKind.LINE && TopLevel.firstWord(token.text).equals(keyword);
  }

  // Skips a clause that cannot be attached to any statement, after its error was reported.
  private void skipClause(String keyword) {
    parseSuite(parseHeader(keyword));
  }

  // if_stmt = IF expr ':' suite [ELIF expr ':' suite]* [ELSE ':' suite]
  private IfStatement parseIfStatement() {
    String keyword = TopLevel.firstWord(token.text); // 'if' or 'elif'
    Header header = parseHeader(keyword);
    if (header.text.isEmpty()) {
      syntaxError("expected a condition after '" + keyword + "'");
    }
    ImmutableList<Statement> thenBlock = parseSuite(header);
    ImmutableList<Statement> elseBlock = ImmutableList.of();
    if (atClause("elif")) {
      elseBlock = ImmutableList.of(parseIfStatement());
    } else if (atClause("else")) {
      elseBlock = parseSuite(parseBareHeader("else"));
    }
    return new IfStatement(
        header.location, keyword.equals("elif"), header.text, thenBlock, elseBlock);
  }

  // while_stmt = WHILE expr ':' suite
  private WhileStatement parseWhileStatement() {
    Header header = parseHeader("while");
    if (header.text.isEmpty()) {
      syntaxError("expected a condition after 'while'");
    }
    ImmutableList<Statement> body = parseSuite(header);
    rejectLoopElse();
    return new WhileStatement(header.location, header.text, body);
  }

  // for_stmt = FOR loop_variables IN expr ':' suite
  private ForStatement parseForStatement(String prefix, Location location) {
    Header header = parseHeader(prefix);
    String vars = header.text;
    String iterable = "";
    int in = TopLevel.indexOfKeyword(header.text, "in", 0);
    if (in < 0) {
      syntaxError("expected 'in'");
    } else {
      vars = header.text.substring(0, in).trim();
      iterable = header.text.substring(in + "in".length()).trim();
    }
    ImmutableList<Statement> body = parseSuite(header);
    rejectLoopElse();
    return new ForStatement(location, vars, iterable, body);
  }

  private void rejectLoopElse() {
    if (atClause("else")) {
      syntaxError("loop 'else' clauses are not supported");
      skipClause("else");
    }
  }

  // try_stmt = TRY ':' suite {EXCEPT [expr [AS name]] ':' suite} [ELSE ':' suite]
  //            [FINALLY ':' suite]
  private TryStatement parseTryStatement() {
    Header header = parseBareHeader("try");
    ImmutableList<Statement> body = parseSuite(header);

    ImmutableList.Builder<ExceptClause> handlers = ImmutableList.builder();
    boolean hasHandler = false;
    while (atClause("except")) {
      handlers.add(parseExceptClause());
      hasHandler = true;
    }

    ImmutableList<Statement> elseBlock = ImmutableList.of();
    if (atClause("else")) {
      if (!hasHandler) {
        syntaxError("'else' without 'except'");
      }
      elseBlock = parseSuite(parseBareHeader("else"));
    }

    ImmutableList<Statement> finallyBlock = ImmutableList.of();
    boolean hasFinally = false;
    if (atClause("finally")) {
      finallyBlock = parseSuite(parseBareHeader("finally"));
      hasFinally = true;
    }

    if (!hasHandler && !hasFinally) {
      if (!recoveryMode) {
        reportError(header.location, "try without except or finally");
        recoveryMode = true;
      }
    }
    return new TryStatement(header.location, body, handlers.build(), elseBlock, finallyBlock);
  }

  private ExceptClause parseExceptClause() {
    Header header = parseHeader("except");
    String type = header.text;
    if (type.startsWith("*")) { // except* for exception groups
      type = type.substring(1).trim();
    }
    String name = null;
    int as = TopLevel.indexOfKeyword(type, "as", 0);
    if (as >= 0) {
      name = type.substring(as + "as".length()).trim();
      type = type.substring(0, as).trim();
      if (name.isEmpty()) {
        syntaxError("expected a name after 'as'");
        name = null;
      }
    }
    ImmutableList<Statement> body = parseSuite(header);
    return new ExceptClause(header.location, emptyToNull(type), name, body);
  }

  // def_stmt = DEF IDENTIFIER '(' params ')' ['->' expr] ':' suite
  private DefStatement parseDefStatement(String prefix, Location location, boolean async) {
    Header header = parseHeader(prefix);
    String name = header.text;
    String params = "";
    int lparen = name.indexOf('(');
    if (lparen >= 0) {
      int rparen = TopLevel.indexOf(header.text, ')', lparen + 1);
      params = header.text.substring(lparen + 1, rparen < 0 ? header.text.length() : rparen).trim();
      name = header.text.substring(0, lparen).trim();
    } else {
      syntaxError("expected '('");
    }
    if (name.isEmpty()) {
      syntaxError("expected a function name after 'def'");
    }
    ImmutableList<Statement> body = parseSuite(header);
    return new DefStatement(location, name, params, async, body);
  }

  // class_stmt = CLASS IDENTIFIER ['(' bases ')'] ':' suite
  private ClassStatement parseClassStatement() {
    Header header = parseHeader("class");
    String name = header.text;
    int lparen = name.indexOf('(');
    if (lparen >= 0) {
      name = name.substring(0, lparen).trim();
    }
    if (name.isEmpty()) {
      syntaxError("expected a class name after 'class'");
    }
    ImmutableList<Statement> body = parseSuite(header);
    return new ClassStatement(header.location, name, body);
  }

  // with_stmt = WITH items ':' suite, and soft-keyword blocks such as MATCH expr ':' suite
  private BlockStatement parseBlockStatement(String prefix) {
    Header header = parseHeader(prefix);
    ImmutableList<Statement> body = parseSuite(header);
    String headerText = header.text.isEmpty() ? prefix : prefix + " " + header.text;
    return new BlockStatement(header.location, headerText, body);
  }

  // async_stmt = ASYNC (def_stmt | for_stmt | with_stmt)
  private void parseAsyncStatement(ImmutableList.Builder<Statement> list) {
    Location location = location();
    String rest = token.text.substring("async".length()).trim();
    String word = TopLevel.firstWord(rest);
    String prefix = "async " + word;
    if (!token.text.startsWith(prefix)) {
      parseSimpleStatements(list);
      return;
    }
    switch (word) {
      case "def":
        list.add(parseDefStatement(prefix, location, /* async= */ true));
        break;
      case "for":
        list.add(parseForStatement(prefix, location));
        break;
      case "with":
        list.add(parseBlockStatement(prefix));
        break;
      default:
        parseSimpleStatements(list);
        break;
    }
  }

  // 'match' and 'case' are keywords only when they introduce a block: 'match x:'.
  private boolean isSoftKeywordHeader(String word) {
    String text = token.text;
    return text.length() > word.length()
        && text.charAt(word.length()) == ' '
        && TopLevel.indexOf(text, ':', word.length()) >= 0
        && !text.substring(word.length()).trim().startsWith("=");
  }

  // Parses the current LINE token as a list of simple statements and consumes it.
  private void parseSimpleStatements(ImmutableList.Builder<Statement> list) {
    parseSimpleStatementList(token.text, location(), list);
    nextToken();
  }

  // simple_stmt_list = small_stmt {';' small_stmt} [';']
  private void parseSimpleStatementList(
      String text, Location location, ImmutableList.Builder<Statement> list) {
    for (String part : TopLevel.split(text, ';')) {
      Statement stmt = parseSmallStatement(part, location);
      if (stmt != null) {
        list.add(stmt);
      }
    }
  }

  // small_stmt = RETURN [expr] | BREAK | CONTINUE | PASS | other
  @Nullable
  private Statement parseSmallStatement(String text, Location location) {
    String word = TopLevel.firstWord(text);
    String rest = text.substring(word.length()).trim();
    switch (word) {
      case "return":
        return new ReturnStatement(location, emptyToNull(rest));
      case "break":
        return flowStatement(location, Statement.Kind.BREAK, word, rest);
      case "continue":
        return flowStatement(location, Statement.Kind.CONTINUE, word, rest);
      case "pass":
        return flowStatement(location, Statement.Kind.PASS, word, rest);
      case "if":
      case "while":
      case "for":
      case "try":
      case "def":
      case "class":
      case "with":
      case "elif":
      case "else":
      case "except":
      case "finally":
        syntaxError("'" + word + "' statement not allowed here");
        return null;
      default:
        return new SimpleStatement(location, text);
    }
  }

  private Statement flowStatement(
      Location location, Statement.Kind kind, String keyword, String rest) {
    if (!rest.isEmpty()) {
      syntaxError("unexpected '" + rest + "' after '" + keyword + "'");
    }
    return new FlowStatement(location, kind);
  }

  @Nullable
  private static String emptyToNull(String s) {
    return s.isEmpty() ? null : s;
  }
}
