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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.pysymphony.parsing.Lexer.Kind;
import com.google.pysymphony.parsing.Lexer.Tok;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LexerTest {

  private static ImmutableList<Tok> lex(String source) {
    return new Lexer("test.py", source).tokenize();
  }

  private static List<String> describe(String source) {
    List<String> result = new ArrayList<>();
    for (Tok tok : lex(source)) {
      result.add(tok.text.isEmpty() ? tok.kind.name() : tok.text);
    }
    return result;
  }

  @Test
  public void testSimpleAssignment() {
    assertThat(describe("x = 1\n")).containsExactly("x", "=", "1", "NEWLINE", "EOF").inOrder();
  }

  @Test
  public void testMissingFinalNewline() {
    assertThat(describe("x")).containsExactly("x", "NEWLINE", "EOF").inOrder();
  }

  @Test
  public void testIndentation() {
    assertThat(describe("if x:\n    y\nz\n"))
        .containsExactly(
            "if", "x", ":", "NEWLINE", "INDENT", "y", "NEWLINE", "DEDENT", "z", "NEWLINE", "EOF")
        .inOrder();
  }

  @Test
  public void testDedentAtEndOfFile() {
    assertThat(describe("def f():\n    if x:\n        return\n"))
        .containsExactly(
            "def", "f", "(", ")", ":", "NEWLINE", "INDENT", "if", "x", ":", "NEWLINE", "INDENT",
            "return", "NEWLINE", "DEDENT", "DEDENT", "EOF")
        .inOrder();
  }

  @Test
  public void testCommentsAndBlankLinesProduceNoTokens() {
    assertThat(describe("# header\n\nx  # trailing\n\n   # indented comment\ny\n"))
        .containsExactly("x", "NEWLINE", "y", "NEWLINE", "EOF")
        .inOrder();
  }

  @Test
  public void testNewlinesInsideBracketsAreIgnored() {
    assertThat(describe("f(a,\n  b)\n"))
        .containsExactly("f", "(", "a", ",", "b", ")", "NEWLINE", "EOF")
        .inOrder();
  }

  @Test
  public void testBackslashContinuation() {
    assertThat(describe("x = 1 + \\\n    2\n"))
        .containsExactly("x", "=", "1", "+", "2", "NEWLINE", "EOF")
        .inOrder();
  }

  @Test
  public void testOperatorsAreMatchedGreedily() {
    assertThat(describe("a **= b // c -> d := e\n"))
        .containsExactly("a", "**=", "b", "//", "c", "->", "d", ":=", "e", "NEWLINE", "EOF")
        .inOrder();
  }

  @Test
  public void testStringsKeepTheirPrefixAndQuotes() {
    ImmutableList<Tok> tokens = lex("s = rb'\\d' + f\"{x}\" + '''a\nb'''\n");
    assertThat(tokens.get(2).kind).isEqualTo(Kind.STRING);
    assertThat(tokens.get(2).text).isEqualTo("rb'\\d'");
    assertThat(tokens.get(4).text).isEqualTo("f\"{x}\"");
    assertThat(tokens.get(6).text).isEqualTo("'''a\nb'''");
  }

  @Test
  public void testNumbers() {
    assertThat(describe("0x1F 1_000 3.14 1e-5 2j .5\n"))
        .containsExactly("0x1F", "1_000", "3.14", "1e-5", "2j", ".5", "NEWLINE", "EOF")
        .inOrder();
  }

  @Test
  public void testPositions() {
    ImmutableList<Tok> tokens = lex("a = 1\nbb = 2\n");
    Tok bb = tokens.get(4);
    assertThat(bb.text).isEqualTo("bb");
    assertThat(bb.line).isEqualTo(2);
    assertThat(bb.col).isEqualTo(0);
    assertThat(tokens.get(6).col).isEqualTo(5);
  }

  @Test
  public void testUnterminatedString() {
    ParseException e = assertThrows(ParseException.class, () -> lex("x = 'abc\n"));
    assertThat(e.getDetail()).isEqualTo("unterminated string literal");
    assertThat(e.getLineNumber()).isEqualTo(1);
    assertThat(e.getColumnNumber()).isEqualTo(4);
  }

  @Test
  public void testInconsistentDedent() {
    assertThrows(ParseException.class, () -> lex("if x:\n    y\n  z\n"));
  }
}
