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

import com.google.pysymphony.ast.Node;
import com.google.pysymphony.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ParserTest {

  private static Node parse(String source) {
    Node module = Parser.parse("test.py", source);
    assertThat(module.getToken()).isEqualTo(Token.MODULE);
    return module;
  }

  private static Node parseStatement(String source) {
    return parse(source).getOnlyChild();
  }

  @Test
  public void testEmptyModule() {
    assertThat(parse("").hasChildren()).isFalse();
    assertThat(parse("# only a comment\n\n").hasChildren()).isFalse();
  }

  @Test
  public void testAssignmentMarksTargetsAsStores() {
    Node assign = parseStatement("a = b = c\n");
    assertThat(assign.getToken()).isEqualTo(Token.ASSIGN);
    assertThat(assign.getChildCount()).isEqualTo(3);
    assertThat(assign.getChildAtIndex(0).getBooleanProp(Node.Prop.STORE)).isTrue();
    assertThat(assign.getChildAtIndex(1).getBooleanProp(Node.Prop.STORE)).isTrue();
    assertThat(assign.getChildAtIndex(2).getBooleanProp(Node.Prop.STORE)).isFalse();
  }

  @Test
  public void testAugmentedAndAnnotatedAssignment() {
    Node aug = parseStatement("total += 1\n");
    assertThat(aug.getToken()).isEqualTo(Token.AUG_ASSIGN);
    assertThat(aug.getString()).isEqualTo("+=");

    Node ann = parseStatement("count: int\n");
    assertThat(ann.getToken()).isEqualTo(Token.ANN_ASSIGN);
    assertThat(ann.getChildAtIndex(2).isEmpty()).isTrue();
  }

  @Test
  public void testFunctionDef() {
    Node fn = parseStatement("@cache\nasync def f(a, b=1, *args, **kw) -> int:\n    return a\n");
    assertThat(fn.getToken()).isEqualTo(Token.FUNCTION_DEF);
    assertThat(fn.getString()).isEqualTo("f");
    assertThat(fn.getBooleanProp(Node.Prop.ASYNC)).isTrue();

    Node decorators = fn.getChildAtIndex(0);
    assertThat(decorators.getToken()).isEqualTo(Token.DECORATORS);
    assertThat(decorators.getOnlyChild().getString()).isEqualTo("cache");

    Node params = fn.getChildAtIndex(1);
    assertThat(params.getChildCount()).isEqualTo(4);
    assertThat(params.getChildAtIndex(1).getChildAtIndex(1).getString()).isEqualTo("1");
    assertThat(params.getChildAtIndex(2).getBooleanProp(Node.Prop.VARARGS)).isTrue();
    assertThat(params.getChildAtIndex(3).getBooleanProp(Node.Prop.KWARGS)).isTrue();

    assertThat(fn.getChildAtIndex(2).getString()).isEqualTo("int");
    Node body = fn.getChildAtIndex(3);
    assertThat(body.getToken()).isEqualTo(Token.SUITE);
    assertThat(body.getOnlyChild().getToken()).isEqualTo(Token.RETURN);
  }

  @Test
  public void testClassDef() {
    Node cls = parseStatement("class A(Base, metaclass=M):\n    x = 1\n");
    assertThat(cls.getToken()).isEqualTo(Token.CLASS_DEF);
    assertThat(cls.getString()).isEqualTo("A");
    Node args = cls.getChildAtIndex(1);
    assertThat(args.getChildCount()).isEqualTo(2);
    assertThat(args.getChildAtIndex(1).getToken()).isEqualTo(Token.KEYWORD_ARG);
    assertThat(args.getChildAtIndex(1).getString()).isEqualTo("metaclass");
  }

  @Test
  public void testElifChain() {
    Node ifNode = parseStatement("if a:\n    pass\nelif b:\n    pass\nelse:\n    pass\n");
    Node elif = ifNode.getChildAtIndex(2);
    assertThat(elif.getToken()).isEqualTo(Token.IF);
    assertThat(elif.getBooleanProp(Node.Prop.ELIF)).isTrue();
    assertThat(elif.getChildAtIndex(2).getToken()).isEqualTo(Token.SUITE);
  }

  @Test
  public void testTryStatement() {
    Node tryNode =
        parseStatement(
            "try:\n    pass\nexcept ValueError as e:\n    pass\nelse:\n    pass\n"
                + "finally:\n    pass\n");
    assertThat(tryNode.getChildCount()).isEqualTo(4);
    Node handler = tryNode.getChildAtIndex(1);
    assertThat(handler.getToken()).isEqualTo(Token.EXCEPT);
    assertThat(handler.getString()).isEqualTo("e");
    assertThat(tryNode.getChildAtIndex(2).getToken()).isEqualTo(Token.TRY_ELSE);
    assertThat(tryNode.getChildAtIndex(3).getToken()).isEqualTo(Token.FINALLY);
  }

  @Test
  public void testImports() {
    Node imp = parseStatement("import os.path, json as j\n");
    assertThat(imp.getToken()).isEqualTo(Token.IMPORT);
    assertThat(imp.getChildAtIndex(0).getString()).isEqualTo("os.path");
    assertThat(imp.getChildAtIndex(0).getAlias()).isNull();
    assertThat(imp.getChildAtIndex(1).getAlias()).isEqualTo("j");

    Node from = parseStatement("from ..pkg.mod import (a, b as c,)\n");
    assertThat(from.getToken()).isEqualTo(Token.IMPORT_FROM);
    assertThat(from.getString()).isEqualTo("pkg.mod");
    assertThat(from.getIntValue()).isEqualTo(2);
    assertThat(from.getChildCount()).isEqualTo(2);
    assertThat(from.getChildAtIndex(1).getAlias()).isEqualTo("c");

    Node relative = parseStatement("from . import sibling\n");
    assertThat(relative.getString()).isEmpty();
    assertThat(relative.getIntValue()).isEqualTo(1);

    Node star = parseStatement("from m import *\n");
    assertThat(star.getOnlyChild().getString()).isEqualTo("*");
  }

  @Test
  public void testAttributeChain() {
    Node value = parseStatement("a.b.c\n").getOnlyChild();
    assertThat(value.getToken()).isEqualTo(Token.GETATTR);
    assertThat(value.getString()).isEqualTo("c");
    Node inner = value.getOnlyChild();
    assertThat(inner.getString()).isEqualTo("b");
    assertThat(inner.getOnlyChild().isName()).isTrue();
  }

  @Test
  public void testComparisonChain() {
    Node compare = parseStatement("a < b is not c\n").getOnlyChild();
    assertThat(compare.getToken()).isEqualTo(Token.COMPARE);
    assertThat(compare.getChildCount()).isEqualTo(5);
  }

  @Test
  public void testFString() {
    Node fstring = parseStatement("f'a{x!r:>{width}}b'\n").getOnlyChild();
    assertThat(fstring.getToken()).isEqualTo(Token.FSTRING);
    assertThat(fstring.getString()).isEqualTo("f'");
    assertThat(fstring.getChildCount()).isEqualTo(3);
    assertThat(fstring.getChildAtIndex(0).getString()).isEqualTo("a");
    Node field = fstring.getChildAtIndex(1);
    assertThat(field.getToken()).isEqualTo(Token.FSTRING_FIELD);
    assertThat(field.getOnlyChild().getString()).isEqualTo("x");
    assertThat(fstring.getChildAtIndex(2).getString()).isEqualTo("b");
  }

  @Test
  public void testImplicitStringConcatenation() {
    Node concat = parseStatement("x = 'a' \"b\"\n").getChildAtIndex(1);
    assertThat(concat.getToken()).isEqualTo(Token.STRING_CONCAT);
    assertThat(concat.getChildCount()).isEqualTo(2);
  }

  @Test
  public void testComprehension() {
    Node comp = parseStatement("[y for x in xs if x for y in x]\n").getOnlyChild();
    assertThat(comp.getToken()).isEqualTo(Token.LIST_COMP);
    assertThat(comp.getChildCount()).isEqualTo(3);
    assertThat(comp.getChildAtIndex(1).getToken()).isEqualTo(Token.COMP_FOR);
    assertThat(comp.getChildAtIndex(1).getChildCount()).isEqualTo(3);
  }

  @Test
  public void testLocations() {
    Node module = parse("x = 1\n\ndef f():\n    return x\n");
    Node fn = module.getChildAtIndex(1);
    assertThat(fn.getLineno()).isEqualTo(3);
    assertThat(fn.getCharno()).isEqualTo(0);
    Node ret = fn.getChildAtIndex(3).getOnlyChild();
    assertThat(ret.getLineno()).isEqualTo(4);
    assertThat(ret.getCharno()).isEqualTo(4);
    assertThat(ret.getSourceFileName()).isEqualTo("test.py");
  }

  @Test
  public void testMissingIndentedBlock() {
    ParseException e =
        assertThrows(ParseException.class, () -> parse("def f():\nreturn 1\n"));
    assertThat(e.getDetail()).isEqualTo("expected an indented block");
    assertThat(e.getSourceName()).isEqualTo("test.py");
    assertThat(e.getLineNumber()).isEqualTo(2);
  }

  @Test
  public void testUnexpectedIndent() {
    assertThrows(ParseException.class, () -> parse("x = 1\n    y = 2\n"));
  }

  @Test
  public void testUnbalancedBrackets() {
    assertThrows(ParseException.class, () -> parse("f(a, b\n"));
  }
}
