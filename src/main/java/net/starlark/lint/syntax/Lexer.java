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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/** A scanner for the package script dialect. Comments are discarded. */
final class Lexer {

  // --- These fields are accessed directly by the parser: ---

  // Mapping from file offsets to Locations.
  final FileLocations locs;

  // Information about the current token. Updated by nextToken.
  // value is defined only for STRING, INT, FLOAT and IDENTIFIER.
  TokenKind kind;
  int start; // start offset
  int end; // end offset
  Object value; // String, Long or Double value of token

  // --- end of parser-visible fields ---

  private final List<SyntaxError> errors;

  private final char[] buffer;
  private int pos;

  // Enclosing indentation levels in spaces. The outermost element is always zero.
  private final Deque<Integer> indentStack = new ArrayDeque<>();

  // Number of unclosed brackets. Newlines and indentation are insignificant while nonzero.
  private int openParens = 0;

  // True after a NEWLINE token, when the indentation of the next line must be measured.
  private boolean checkIndentation = true;

  // Number of pending INDENT (>0) or OUTDENT (<0) tokens.
  private int dents = 0;

  private static final ImmutableMap<Character, TokenKind> EQUAL_TOKENS =
      ImmutableMap.<Character, TokenKind>builder()
          .put('=', TokenKind.EQUALS_EQUALS)
          .put('!', TokenKind.NOT_EQUALS)
          .put('>', TokenKind.GREATER_EQUALS)
          .put('<', TokenKind.LESS_EQUALS)
          .put('+', TokenKind.PLUS_EQUALS)
          .put('-', TokenKind.MINUS_EQUALS)
          .put('*', TokenKind.STAR_EQUALS)
          .put('/', TokenKind.SLASH_EQUALS)
          .put('%', TokenKind.PERCENT_EQUALS)
          .put('^', TokenKind.CARET_EQUALS)
          .put('&', TokenKind.AMPERSAND_EQUALS)
          .put('|', TokenKind.PIPE_EQUALS)
          .buildOrThrow();

  private static final ImmutableMap<String, TokenKind> KEYWORDS =
      ImmutableMap.<String, TokenKind>builder()
          .put("and", TokenKind.AND)
          .put("as", TokenKind.AS)
          .put("assert", TokenKind.ASSERT)
          .put("break", TokenKind.BREAK)
          .put("class", TokenKind.CLASS)
          .put("continue", TokenKind.CONTINUE)
          .put("def", TokenKind.DEF)
          .put("del", TokenKind.DEL)
          .put("elif", TokenKind.ELIF)
          .put("else", TokenKind.ELSE)
          .put("except", TokenKind.EXCEPT)
          .put("finally", TokenKind.FINALLY)
          .put("for", TokenKind.FOR)
          .put("from", TokenKind.FROM)
          .put("global", TokenKind.GLOBAL)
          .put("if", TokenKind.IF)
          .put("import", TokenKind.IMPORT)
          .put("in", TokenKind.IN)
          .put("is", TokenKind.IS)
          .put("lambda", TokenKind.LAMBDA)
          .put("nonlocal", TokenKind.NONLOCAL)
          .put("not", TokenKind.NOT)
          .put("or", TokenKind.OR)
          .put("pass", TokenKind.PASS)
          .put("raise", TokenKind.RAISE)
          .put("return", TokenKind.RETURN)
          .put("try", TokenKind.TRY)
          .put("while", TokenKind.WHILE)
          .put("with", TokenKind.WITH)
          .put("yield", TokenKind.YIELD)
          .buildOrThrow();

  // Constructs a lexer which tokenizes the parser input.
  // Errors are appended to errors.
  Lexer(ParserInput input, List<SyntaxError> errors) {
    this.locs = FileLocations.create(input.getContent(), input.getFile());
    this.buffer = input.getContent();
    this.pos = 0;
    this.errors = errors;
    indentStack.push(0);
  }

  /**
   * Reads the next token, updating the Lexer's token fields. It is an error to call nextToken after
   * an EOF token.
   */
  void nextToken() {
    boolean afterNewline = kind == TokenKind.NEWLINE;
    tokenize();
    Preconditions.checkState(kind != null);

    // Like Python, always end with a NEWLINE token, even if no '\n' in input.
    if (kind == TokenKind.EOF && !afterNewline) {
      kind = TokenKind.NEWLINE;
    }
  }

  private void error(String message, int offset) {
    errors.add(new SyntaxError(locs.getLocation(Math.min(offset, buffer.length)), message));
  }

  private void setToken(TokenKind kind, int start, int end) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.value = null;
  }

  private void popParen() {
    if (openParens == 0) {
      error("unbalanced closing bracket", pos - 1);
    } else {
      openParens--;
    }
  }

  private void newline() {
    if (openParens > 0) {
      return; // inside brackets, a newline is just whitespace
    }
    checkIndentation = true;
    setToken(TokenKind.NEWLINE, pos - 1, pos);
  }

  /** Measures the indentation of the next non-blank line, updating dents, and advances pos. */
  private void computeIndentation() {
    int indentLen = 0;
    while (pos < buffer.length) {
      char c = buffer[pos];
      if (c == ' ') {
        indentLen++;
        pos++;
      } else if (c == '\t') {
        // Python rounds tabs up to the next multiple of eight.
        indentLen += 8 - indentLen % 8;
        pos++;
      } else if (c == '\r') {
        pos++;
      } else if (c == '\n') { // blank line
        indentLen = 0;
        pos++;
      } else if (c == '#') { // comment-only line
        while (pos < buffer.length && buffer[pos] != '\n') {
          pos++;
        }
        indentLen = 0;
      } else {
        break;
      }
    }

    if (pos == buffer.length) {
      indentLen = 0;
    }

    int current = indentStack.peek();
    if (current < indentLen) {
      indentStack.push(indentLen);
      dents++;
    } else if (current > indentLen) {
      while (current > indentLen) {
        indentStack.pop();
        dents--;
        current = indentStack.peek();
      }
      if (current < indentLen) {
        error("indentation error", pos - 1);
      }
    }
  }

  // Returns the ith unconsumed char, or -1 for EOF.
  private int peek(int i) {
    return pos + i < buffer.length ? buffer[pos + i] : -1;
  }

  // Consumes a char and returns the next unconsumed char, or -1 for EOF.
  private int next() {
    pos++;
    return peek(0);
  }

  /**
   * Scans a string literal delimited by quot.
   *
   * <p>ON ENTRY: pos is 1 + the index of the first delimiter. ON EXIT: pos is 1 + the index of the
   * last delimiter.
   */
  private void stringLiteral(char quot, boolean isRaw) {
    int literalStart = isRaw ? pos - 2 : pos - 1;
    boolean triple = peek(0) == quot && peek(1) == quot;
    if (triple) {
      pos += 2;
    }
    StringBuilder literal = new StringBuilder();
    while (pos < buffer.length) {
      char c = buffer[pos++];
      if (c == quot) {
        if (!triple) {
          finishString(literalStart, literal);
          return;
        }
        if (peek(0) == quot && peek(1) == quot) {
          pos += 2;
          finishString(literalStart, literal);
          return;
        }
        literal.append(c);
      } else if (c == '\n' && !triple) {
        break;
      } else if (c == '\\' && pos < buffer.length) {
        char escaped = buffer[pos++];
        if (isRaw) {
          literal.append('\\').append(escaped);
        } else {
          appendEscape(escaped, literal);
        }
      } else {
        literal.append(c);
      }
    }
    error("unclosed string literal", literalStart);
    finishString(literalStart, literal);
  }

  private void finishString(int literalStart, StringBuilder literal) {
    setToken(TokenKind.STRING, literalStart, pos);
    value = literal.toString();
  }

  // Appends the character denoted by the escape sequence whose first char (after '\') is c.
  private void appendEscape(char c, StringBuilder literal) {
    switch (c) {
      case '\n' -> {} // line continuation
      case 'n' -> literal.append('\n');
      case 'r' -> literal.append('\r');
      case 't' -> literal.append('\t');
      case '\\', '\'', '"' -> literal.append(c);
      case 'x' -> literal.append((char) scanHexDigits(2));
      case 'u' -> literal.append((char) scanHexDigits(4));
      case '0', '1', '2', '3', '4', '5', '6', '7' -> {
        int octal = c - '0';
        for (int i = 0; i < 2 && isOctalDigit(peek(0)); i++) {
          octal = (octal << 3) | (buffer[pos++] - '0');
        }
        literal.append((char) (octal & 0xff));
      }
      default -> literal.append('\\').append(c); // unknown escapes are kept verbatim
    }
  }

  private int scanHexDigits(int count) {
    int result = 0;
    for (int i = 0; i < count; i++) {
      int digit = Character.digit(peek(0), 16);
      if (digit < 0) {
        error("invalid escape sequence", pos);
        return result;
      }
      result = result * 16 + digit;
      pos++;
    }
    return result;
  }

  /**
   * Scans an identifier or keyword.
   *
   * <p>ON ENTRY: pos is 1 + the index of the first char in the identifier. ON EXIT: pos is 1 + the
   * index of the last char in the identifier.
   */
  private void identifierOrKeyword() {
    int oldPos = pos - 1;
    while (pos < buffer.length && isIdentifierPart(buffer[pos])) {
      pos++;
    }
    String id = bufferSlice(oldPos, pos);
    TokenKind keyword = KEYWORDS.get(id);
    if (keyword == null) {
      setToken(TokenKind.IDENTIFIER, oldPos, pos);
      value = id;
    } else {
      setToken(keyword, oldPos, pos);
    }
  }

  // Tokenizes a two-char operator, if any, at pos.
  private boolean tokenizeTwoChars() {
    if (pos + 1 >= buffer.length) {
      return false;
    }
    char c1 = buffer[pos];
    char c2 = buffer[pos + 1];
    TokenKind tok = null;
    if (c2 == '=') {
      tok = EQUAL_TOKENS.get(c1);
    } else if (c1 == '*' && c2 == '*') {
      tok = TokenKind.STAR_STAR;
    } else if (c1 == '-' && c2 == '>') {
      tok = TokenKind.RARROW;
    }
    if (tok == null) {
      return false;
    }
    setToken(tok, pos, pos + 2);
    pos += 2;
    return true;
  }

  /** Scans the next token. Exactly one token is produced. */
  private void tokenize() {
    if (checkIndentation) {
      checkIndentation = false;
      computeIndentation();
    }

    if (dents != 0) {
      if (dents < 0) {
        dents++;
        setToken(TokenKind.OUTDENT, pos - 1, pos);
      } else {
        dents--;
        setToken(TokenKind.INDENT, pos - 1, pos);
      }
      return;
    }

    kind = null;
    while (pos < buffer.length) {
      if (tokenizeTwoChars()) {
        return;
      }
      char c = buffer[pos];
      pos++;
      switch (c) {
        case '{' -> {
          setToken(TokenKind.LBRACE, pos - 1, pos);
          openParens++;
        }
        case '}' -> {
          setToken(TokenKind.RBRACE, pos - 1, pos);
          popParen();
        }
        case '(' -> {
          setToken(TokenKind.LPAREN, pos - 1, pos);
          openParens++;
        }
        case ')' -> {
          setToken(TokenKind.RPAREN, pos - 1, pos);
          popParen();
        }
        case '[' -> {
          setToken(TokenKind.LBRACKET, pos - 1, pos);
          openParens++;
        }
        case ']' -> {
          setToken(TokenKind.RBRACKET, pos - 1, pos);
          popParen();
        }
        case '>' -> shiftOrCompare('>', TokenKind.GREATER, TokenKind.GREATER_GREATER,
            TokenKind.GREATER_GREATER_EQUALS);
        case '<' -> shiftOrCompare('<', TokenKind.LESS, TokenKind.LESS_LESS,
            TokenKind.LESS_LESS_EQUALS);
        case '/' -> {
          if (peek(0) == '/' && peek(1) == '=') {
            setToken(TokenKind.SLASH_SLASH_EQUALS, pos - 1, pos + 2);
            pos += 2;
          } else if (peek(0) == '/') {
            setToken(TokenKind.SLASH_SLASH, pos - 1, pos + 1);
            pos += 1;
          } else {
            setToken(TokenKind.SLASH, pos - 1, pos);
          }
        }
        case ':' -> setToken(TokenKind.COLON, pos - 1, pos);
        case ',' -> setToken(TokenKind.COMMA, pos - 1, pos);
        case ';' -> setToken(TokenKind.SEMI, pos - 1, pos);
        case '+' -> setToken(TokenKind.PLUS, pos - 1, pos);
        case '-' -> setToken(TokenKind.MINUS, pos - 1, pos);
        case '*' -> setToken(TokenKind.STAR, pos - 1, pos);
        case '%' -> setToken(TokenKind.PERCENT, pos - 1, pos);
        case '|' -> setToken(TokenKind.PIPE, pos - 1, pos);
        case '&' -> setToken(TokenKind.AMPERSAND, pos - 1, pos);
        case '^' -> setToken(TokenKind.CARET, pos - 1, pos);
        case '~' -> setToken(TokenKind.TILDE, pos - 1, pos);
        case '=' -> setToken(TokenKind.EQUALS, pos - 1, pos);
        case ' ', '\t', '\r' -> {}
        case '\\' -> {
          // A backslash is valid only at the end of a line (or in a string).
          if (peek(0) == '\n') {
            pos += 1;
          } else if (peek(0) == '\r' && peek(1) == '\n') {
            pos += 2;
          } else {
            error("invalid character: '\\'", pos - 1);
            setToken(TokenKind.ILLEGAL, pos - 1, pos);
          }
        }
        case '\n' -> newline();
        case '#' -> {
          while (pos < buffer.length && buffer[pos] != '\n') {
            pos++;
          }
        }
        case '\'', '"' -> stringLiteral(c, false);
        default -> {
          // raw strings, e.g. r"str"
          if ((c == 'r' || c == 'R') && (peek(0) == '\'' || peek(0) == '"')) {
            char quot = buffer[pos++];
            stringLiteral(quot, true);
          } else if (c == '.' || isDigit(c)) {
            pos--; // unconsume
            scanNumberOrDot(c);
          } else if (isIdentifierStart(c)) {
            identifierOrKeyword();
          } else {
            error("invalid character: '" + c + "'", pos - 1);
            setToken(TokenKind.ILLEGAL, pos - 1, pos);
          }
        }
      }
      if (kind != null) {
        return;
      }
    }

    if (indentStack.size() > 1) { // close all open blocks at end of input
      setToken(TokenKind.NEWLINE, pos - 1, pos);
      while (indentStack.size() > 1) {
        indentStack.pop();
        dents--;
      }
      return;
    }

    setToken(TokenKind.EOF, pos, pos);
  }

  // Scans one of x, xx or xx= where x is the char c already consumed.
  private void shiftOrCompare(char c, TokenKind single, TokenKind shift, TokenKind shiftEquals) {
    if (peek(0) == c && peek(1) == '=') {
      setToken(shiftEquals, pos - 1, pos + 2);
      pos += 2;
    } else if (peek(0) == c) {
      setToken(shift, pos - 1, pos + 1);
      pos += 1;
    } else {
      setToken(single, pos - 1, pos);
    }
  }

  // Scans a number (INT or FLOAT) or DOT.
  // Precondition: c == peek(0) (a dot or digit)
  private void scanNumberOrDot(int c) {
    int start = this.pos;
    boolean fraction = false;
    boolean exponent = false;
    int radix = 10;

    if (c == '.') {
      if (!isDigit(peek(1))) {
        pos++;
        setToken(TokenKind.DOT, start, pos);
        return;
      }
      fraction = true;
    } else if (c == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
      radix = 16;
      c = next();
      c = next();
      while (Character.digit(c, 16) >= 0) {
        c = next();
      }
    } else if (c == '0' && (peek(1) == 'o' || peek(1) == 'O')) {
      radix = 8;
      c = next();
      c = next();
      while (isOctalDigit(c)) {
        c = next();
      }
    } else if (c == '0' && (peek(1) == 'b' || peek(1) == 'B')) {
      radix = 2;
      c = next();
      c = next();
      while (c == '0' || c == '1') {
        c = next();
      }
    } else {
      while (isDigit(c)) {
        c = next();
      }
      if (c == '.') {
        fraction = true;
      } else if (c == 'e' || c == 'E') {
        exponent = true;
      }
    }

    if (fraction) {
      c = next(); // consume '.'
      while (isDigit(c)) {
        c = next();
      }
      if (c == 'e' || c == 'E') {
        exponent = true;
      }
    }
    if (exponent) {
      c = next(); // consume [eE]
      if (c == '+' || c == '-') {
        c = next();
      }
      while (isDigit(c)) {
        c = next();
      }
    }

    String literal = bufferSlice(start, pos);
    if (fraction || exponent) {
      setToken(TokenKind.FLOAT, start, pos);
      try {
        value = Double.parseDouble(literal);
      } catch (NumberFormatException ex) {
        error("invalid float literal", start);
        value = 0.0;
      }
      return;
    }

    setToken(TokenKind.INT, start, pos);
    try {
      value = radix == 10 ? Long.parseLong(literal) : Long.parseLong(literal.substring(2), radix);
    } catch (NumberFormatException ex) {
      // Out-of-range literals are legal; their value is irrelevant to static checks.
      value = Long.MAX_VALUE;
      if (radix != 10 && literal.length() == 2) {
        error("invalid integer literal: " + literal, start);
      }
    }
  }

  private static boolean isDigit(int c) {
    return '0' <= c && c <= '9';
  }

  private static boolean isOctalDigit(int c) {
    return '0' <= c && c <= '7';
  }

  private static boolean isIdentifierStart(char c) {
    return ('a' <= c && c <= 'z') || ('A' <= c && c <= 'Z') || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isDigit(c);
  }

  /** Returns the text of the source buffer between the given offsets. */
  String bufferSlice(int start, int end) {
    return new String(this.buffer, start, end - start);
  }
}
