// Copyright 2025 The Bazel Authors. All rights reserved.
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
package net.starlark.lint.syntax;

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of tokenization behavior of the {@link Lexer}. */
@RunWith(JUnit4.class)
public class LexerTest {

  private final List<SyntaxError> errors = new ArrayList<>();

  /** Creates a lexer which takes input from the specified string. Resets the errors beforehand. */
  private Lexer createLexer(String input) {
    ParserInput inputSource = ParserInput.fromString(input, "");
    errors.clear();
    return new Lexer(inputSource, errors);
  }

  private static class Token {
    TokenKind kind;
    int start;
    int end;
    Object value;
  }

  private ArrayList<Token> allTokens(Lexer lexer) {
    ArrayList<Token> result = new ArrayList<>();
    do {
      lexer.nextToken();
      Token tok = new Token();
      tok.kind = lexer.kind;
      tok.start = lexer.start;
      tok.end = lexer.end;
      tok.value = lexer.value;
      result.add(tok);
    } while (lexer.kind != TokenKind.EOF);
    return result;
  }

  private Token[] tokens(String input) {
    return allTokens(createLexer(input)).toArray(new Token[0]);
  }

  // Returns the line numbers of each token of input.
  private String linenums(String input) {
    Lexer lexer = createLexer(input);
    StringBuilder buf = new StringBuilder();
    for (Token tok : allTokens(lexer)) {
      if (buf.length() > 0) {
        buf.append(' ');
      }
      buf.append(lexer.locs.getLocation(tok.start).line());
    }
    return buf.toString();
  }

  // Returns the names of the tokens and their values. String literals are not escaped.
  private static String values(Token[] tokens) {
    StringBuilder buffer = new StringBuilder();
    for (Token token : tokens) {
      if (buffer.length() > 0) {
        buffer.append(' ');
      }
      buffer.append(token.kind.name());
      if (token.value != null) {
        buffer.append('(').append(token.value).append(')');
      }
    }
    return buffer.toString();
  }

  private static String positions(Token[] tokens) {
    StringBuilder buf = new StringBuilder();
    for (Token tok : tokens) {
      if (buf.length() > 0) {
        buf.append(' ');
      }
      buf.append('[').append(tok.start).append(',').append(tok.end).append(')');
    }
    return buf.toString();
  }

  // Scans src, and asserts that the tokens match wantTokens and that there are no errors.
  private void check(String src, String wantTokens) {
    assertThat(values(tokens(src))).isEqualTo(wantTokens);
    assertThat(errors).isEmpty();
  }

  // Scans src, and asserts that the tokens match wantTokens and the errors match wantErrors.
  // Errors are formatted with a caret ^ under the errant column.
  private void checkErrors(String src, String wantTokens, String... wantErrors) {
    assertThat(values(tokens(src))).isEqualTo(wantTokens);

    List<String> gotErrors = new ArrayList<>();
    for (SyntaxError err : errors) {
      String msg = " ".repeat(err.location().column() - 1) + "^ " + err.message();
      if (err.location().line() != 1) {
        msg = String.format("%s (line %d)", msg, err.location().line());
      }
      gotErrors.add(msg);
    }
    assertThat(gotErrors).isEqualTo(Arrays.asList(wantErrors));
  }

  /** Asserts that errors contains one whose message includes substr, and returns it. */
  static SyntaxError assertContainsError(List<SyntaxError> errors, String substr) {
    for (SyntaxError error : errors) {
      if (error.message().contains(substr)) {
        return error;
      }
    }
    throw new AssertionError("no error containing '" + substr + "' in " + errors);
  }

  @Test
  public void testAssignment() {
    check("x = 1\n", "IDENTIFIER(x) EQUALS INT(1) NEWLINE EOF");
    // A final newline is implied.
    check("x = 1", "IDENTIFIER(x) EQUALS INT(1) NEWLINE EOF");
  }

  @Test
  public void testEmptyInput() {
    check("", "NEWLINE EOF");
  }

  @Test
  public void testIndentation() {
    check(
        "def f():\n  pass\n",
        "DEF IDENTIFIER(f) LPAREN RPAREN COLON NEWLINE INDENT PASS NEWLINE OUTDENT NEWLINE EOF");
    check(
        "1\n  2\n  3\n4\n",
        "INT(1) NEWLINE INDENT INT(2) NEWLINE INT(3) NEWLINE OUTDENT INT(4) NEWLINE EOF");
  }

  @Test
  public void testBlankAndCommentLinesDoNotAffectIndentation() {
    check(
        "if x:\n\n  # note\n  y\n",
        "IF IDENTIFIER(x) COLON NEWLINE INDENT IDENTIFIER(y) NEWLINE OUTDENT NEWLINE EOF");
  }

  @Test
  public void testIndentationError() {
    checkErrors(
        "if x:\n    a\n  b\n",
        "IF IDENTIFIER(x) COLON NEWLINE INDENT IDENTIFIER(a) NEWLINE OUTDENT IDENTIFIER(b) NEWLINE"
            + " EOF",
        " ^ indentation error (line 3)");
  }

  @Test
  public void testNewlinesInsideBracketsAreIgnored() {
    check(
        "f(a,\n  b)\n",
        "IDENTIFIER(f) LPAREN IDENTIFIER(a) COMMA IDENTIFIER(b) RPAREN NEWLINE EOF");
    check("[1,\n2]", "LBRACKET INT(1) COMMA INT(2) RBRACKET NEWLINE EOF");
  }

  @Test
  public void testComments() {
    check("x # comment\ny", "IDENTIFIER(x) NEWLINE IDENTIFIER(y) NEWLINE EOF");
  }

  @Test
  public void testLineContinuation() {
    check("x = \\\n 1", "IDENTIFIER(x) EQUALS INT(1) NEWLINE EOF");
  }

  @Test
  public void testStringLiterals() {
    check("'foo' \"bar\"", "STRING(foo) STRING(bar) NEWLINE EOF");
    check("'a\\x41\\101'", "STRING(aAA) NEWLINE EOF");
    check("'it\\'s'", "STRING(it's) NEWLINE EOF");
    check("r'a\\nb'", "STRING(a\\nb) NEWLINE EOF");
    check("\"\"\"a\nb\"\"\"", "STRING(a\nb) NEWLINE EOF");
  }

  @Test
  public void testUnclosedString() {
    checkErrors("\"abc", "STRING(abc) NEWLINE EOF", "^ unclosed string literal");
  }

  @Test
  public void testNumbers() {
    check(
        "0x1F 0o17 0b101 12 1.5 1e3 .5",
        "INT(31) INT(15) INT(5) INT(12) FLOAT(1.5) FLOAT(1000.0) FLOAT(0.5) NEWLINE EOF");
    checkErrors("0x", "INT(" + Long.MAX_VALUE + ") NEWLINE EOF", "^ invalid integer literal: 0x");
  }

  @Test
  public void testOperators() {
    check(
        "a += b // c ** d -> e",
        "IDENTIFIER(a) PLUS_EQUALS IDENTIFIER(b) SLASH_SLASH IDENTIFIER(c) STAR_STAR"
            + " IDENTIFIER(d) RARROW IDENTIFIER(e) NEWLINE EOF");
    check(
        "a <<= b >= c != d //= e",
        "IDENTIFIER(a) LESS_LESS_EQUALS IDENTIFIER(b) GREATER_EQUALS IDENTIFIER(c) NOT_EQUALS"
            + " IDENTIFIER(d) SLASH_SLASH_EQUALS IDENTIFIER(e) NEWLINE EOF");
    check("a.b", "IDENTIFIER(a) DOT IDENTIFIER(b) NEWLINE EOF");
  }

  @Test
  public void testKeywords() {
    check("not in and or lambda", "NOT IN AND OR LAMBDA NEWLINE EOF");
    // Reserved words are scanned as keywords; the parser rejects them.
    check("while import", "WHILE IMPORT NEWLINE EOF");
  }

  @Test
  public void testInvalidCharacter() {
    checkErrors(
        "a $ b",
        "IDENTIFIER(a) ILLEGAL IDENTIFIER(b) NEWLINE EOF",
        "  ^ invalid character: '$'");
  }

  @Test
  public void testUnbalancedClosingBracket() {
    checkErrors("a)", "IDENTIFIER(a) RPAREN NEWLINE EOF", " ^ unbalanced closing bracket");
  }

  @Test
  public void testPositions() {
    assertThat(positions(tokens("x = 12"))).isEqualTo("[0,1) [2,3) [4,6) [6,6) [6,6)");
  }

  @Test
  public void testLineNumbers() {
    assertThat(linenums("a\nb\n\nc")).isEqualTo("1 1 2 2 4 4 4");
  }
}
