/*
 * Copyright 2026 The PySymphony Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.pysymphony.parsing;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits source text into tokens, synthesizing NEWLINE, INDENT and DEDENT tokens from the
 * physical layout of the file. Comments and blank lines produce no tokens. Newlines inside
 * brackets and after a backslash continuation are ignored.
 */
final class Lexer {

  enum Kind {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    EOF
  }

  /** A single token with its 1-based line and 0-based column. */
  static final class Tok {
    final Kind kind;
    final String text;
    final int line;
    final int col;

    Tok(Kind kind, String text, int line, int col) {
      this.kind = kind;
      this.text = text;
      this.line = line;
      this.col = col;
    }

    boolean is(Kind kind, String text) {
      return this.kind == kind && this.text.equals(text);
    }

    @Override
    public String toString() {
      return kind + (text.isEmpty() ? "" : "(" + text + ")") + "@" + line + ":" + col;
    }
  }

  // Longest operators first so that matching is greedy.
  private static final ImmutableList<String> OPERATORS =
      ImmutableList.of(
          "**=", "//=", ">>=", "<<=", "...", "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==",
          "!=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=", "+", "-", "*", "/", "%", "@",
          "&", "|", "^", "~", "<", ">", "(", ")", "[", "]", "{", "}", ",", ":", ";", ".", "=");

  private static final ImmutableSet<String> STRING_PREFIXES =
      ImmutableSet.of("r", "u", "b", "f", "br", "rb", "fr", "rf");

  private final String sourceName;
  private final String src;
  private final List<Tok> tokens = new ArrayList<>();
  private final Deque<Integer> indents = new ArrayDeque<>();
  private int pos;
  private int line = 1;
  private int lineStart;
  private int bracketDepth;

  Lexer(String sourceName, String src) {
    this.sourceName = sourceName;
    this.src = src.startsWith("\uFEFF") ? src.substring(1) : src;
  }

  ImmutableList<Tok> tokenize() {
    indents.push(0);
    boolean atLineStart = true;
    while (pos < src.length()) {
      if (atLineStart && bracketDepth == 0) {
        if (!handleIndentation()) {
          continue;
        }
        atLineStart = false;
      }
      char c = src.charAt(pos);
      if (c == ' ' || c == '\t' || c == '\f') {
        pos++;
      } else if (c == '#') {
        skipToEndOfLine();
      } else if (c == '\\' && isLineBreakAt(pos + 1)) {
        pos++;
        consumeLineBreak();
      } else if (c == '\n' || c == '\r') {
        int col = pos - lineStart;
        int tokLine = line;
        consumeLineBreak();
        if (bracketDepth == 0) {
          addNewline(tokLine, col);
          atLineStart = true;
        }
      } else if (isStringStart()) {
        lexString();
      } else if (isIdentifierStart(c)) {
        lexName();
      } else if (isDigit(c) || (c == '.' && isDigitAt(pos + 1))) {
        lexNumber();
      } else {
        lexOperator();
      }
    }
    addNewline(line, pos - lineStart);
    while (indents.peek() > 0) {
      indents.pop();
      tokens.add(new Tok(Kind.DEDENT, "", line, 0));
    }
    tokens.add(new Tok(Kind.EOF, "", line, pos - lineStart));
    return ImmutableList.copyOf(tokens);
  }

  /**
   * Measures the indentation of a logical line and emits INDENT/DEDENT tokens. Returns false when
   * the line is blank or a comment, in which case it has been consumed.
   */
  private boolean handleIndentation() {
    int column = 0;
    while (pos < src.length()) {
      char c = src.charAt(pos);
      if (c == ' ') {
        column++;
      } else if (c == '\t') {
        column = (column / 8 + 1) * 8;
      } else if (c == '\f') {
        column = 0;
      } else {
        break;
      }
      pos++;
    }
    if (pos >= src.length()) {
      return false;
    }
    char c = src.charAt(pos);
    if (c == '#') {
      skipToEndOfLine();
      if (pos < src.length()) {
        consumeLineBreak();
      }
      return false;
    }
    if (c == '\n' || c == '\r') {
      consumeLineBreak();
      return false;
    }
    if (c == '\\' && isLineBreakAt(pos + 1)) {
      pos++;
      consumeLineBreak();
      return false;
    }
    if (column > indents.peek()) {
      indents.push(column);
      tokens.add(new Tok(Kind.INDENT, "", line, column));
    } else {
      while (column < indents.peek()) {
        indents.pop();
        tokens.add(new Tok(Kind.DEDENT, "", line, column));
      }
      if (column != indents.peek()) {
        throw error("unindent does not match any outer indentation level");
      }
    }
    return true;
  }

  private void addNewline(int tokLine, int col) {
    if (tokens.isEmpty()) {
      return;
    }
    Kind last = tokens.get(tokens.size() - 1).kind;
    if (last == Kind.NEWLINE || last == Kind.INDENT || last == Kind.DEDENT) {
      return;
    }
    tokens.add(new Tok(Kind.NEWLINE, "", tokLine, col));
  }

  private void skipToEndOfLine() {
    while (pos < src.length() && src.charAt(pos) != '\n' && src.charAt(pos) != '\r') {
      pos++;
    }
  }

  private boolean isLineBreakAt(int i) {
    return i < src.length() && (src.charAt(i) == '\n' || src.charAt(i) == '\r');
  }

  private void consumeLineBreak() {
    if (src.charAt(pos) == '\r' && pos + 1 < src.length() && src.charAt(pos + 1) == '\n') {
      pos++;
    }
    pos++;
    line++;
    lineStart = pos;
  }

  private boolean isStringStart() {
    char c = src.charAt(pos);
    if (c == '"' || c == '\'') {
      return true;
    }
    for (int len = 1; len <= 2 && pos + len < src.length(); len++) {
      String prefix = src.substring(pos, pos + len).toLowerCase();
      char next = src.charAt(pos + len);
      if (STRING_PREFIXES.contains(prefix) && (next == '"' || next == '\'')) {
        return true;
      }
    }
    return false;
  }

  private void lexString() {
    int start = pos;
    int startLine = line;
    int startCol = pos - lineStart;
    while (src.charAt(pos) != '"' && src.charAt(pos) != '\'') {
      pos++;
    }
    char quote = src.charAt(pos);
    boolean triple =
        pos + 2 < src.length() && src.charAt(pos + 1) == quote && src.charAt(pos + 2) == quote;
    pos += triple ? 3 : 1;
    while (true) {
      if (pos >= src.length()) {
        throw new ParseException("unterminated string literal", sourceName, startLine, startCol);
      }
      char c = src.charAt(pos);
      if (c == '\\') {
        pos++;
        if (pos < src.length() && isLineBreakAt(pos)) {
          consumeLineBreak();
        } else {
          pos++;
        }
        continue;
      }
      if (c == '\n' || c == '\r') {
        if (!triple) {
          throw new ParseException(
              "unterminated string literal", sourceName, startLine, startCol);
        }
        consumeLineBreak();
        continue;
      }
      if (c == quote) {
        if (!triple) {
          pos++;
          break;
        }
        if (pos + 2 < src.length()
            && src.charAt(pos + 1) == quote
            && src.charAt(pos + 2) == quote) {
          pos += 3;
          break;
        }
      }
      pos++;
    }
    tokens.add(new Tok(Kind.STRING, src.substring(start, pos), startLine, startCol));
  }

  private void lexName() {
    int start = pos;
    pos++;
    while (pos < src.length() && isIdentifierPart(src.charAt(pos))) {
      pos++;
    }
    tokens.add(new Tok(Kind.NAME, src.substring(start, pos), line, start - lineStart));
  }

  private void lexNumber() {
    int start = pos;
    if (src.charAt(pos) == '0'
        && pos + 1 < src.length()
        && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
      pos += 2;
      while (pos < src.length()
          && (Character.digit(src.charAt(pos), 16) >= 0 || src.charAt(pos) == '_')) {
        pos++;
      }
    } else {
      skipDigits();
      if (pos < src.length() && src.charAt(pos) == '.') {
        pos++;
        skipDigits();
      }
      if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
        int save = pos;
        pos++;
        if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
          pos++;
        }
        if (pos < src.length() && isDigit(src.charAt(pos))) {
          skipDigits();
        } else {
          pos = save;
        }
      }
      if (pos < src.length() && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J')) {
        pos++;
      }
    }
    tokens.add(new Tok(Kind.NUMBER, src.substring(start, pos), line, start - lineStart));
  }

  private boolean isDigitAt(int i) {
    return i < src.length() && isDigit(src.charAt(i));
  }

  private void skipDigits() {
    while (pos < src.length() && (isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
      pos++;
    }
  }

  private void lexOperator() {
    for (String op : OPERATORS) {
      if (src.startsWith(op, pos)) {
        int col = pos - lineStart;
        pos += op.length();
        switch (op) {
          case "(":
          case "[":
          case "{":
            bracketDepth++;
            break;
          case ")":
          case "]":
          case "}":
            bracketDepth = Math.max(0, bracketDepth - 1);
            break;
          default:
            break;
        }
        tokens.add(new Tok(Kind.OP, op, line, col));
        return;
      }
    }
    throw error("unexpected character '" + src.charAt(pos) + "'");
  }

  private ParseException error(String detail) {
    return new ParseException(detail, sourceName, line, pos - lineStart);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(char c) {
    return c == '_' || Character.isLetter(c) || (c > 127 && Character.isUnicodeIdentifierStart(c));
  }

  private static boolean isIdentifierPart(char c) {
    return c == '_'
        || Character.isLetterOrDigit(c)
        || (c > 127 && Character.isUnicodeIdentifierPart(c));
  }
}
