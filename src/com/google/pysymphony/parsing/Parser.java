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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.pysymphony.ast.Node;
import com.google.pysymphony.ast.Token;
import com.google.pysymphony.parsing.Lexer.Kind;
import com.google.pysymphony.parsing.Lexer.Tok;
import org.jspecify.annotations.Nullable;

/**
 * A recursive descent parser for the Python statement and expression grammar.
 *
 * <p>Only the syntax that affects name binding and resolution is modeled in detail. String
 * literals are kept verbatim; f-string replacement fields are parsed so that the names they
 * reference take part in linking.
 */
public final class Parser {

  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
          "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
          "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
          "return", "try", "while", "with", "yield");

  private static final ImmutableSet<String> AUGMENTED_ASSIGN_OPS =
      ImmutableSet.of(
          "+=", "-=", "*=", "/=", "//=", "%=", "@=", "&=", "|=", "^=", ">>=", "<<=", "**=");

  private static final ImmutableSet<String> COMPARISON_OPS =
      ImmutableSet.of("<", ">", "==", ">=", "<=", "!=");

  private static final ImmutableList<ImmutableSet<String>> BINARY_LEVELS =
      ImmutableList.of(
          ImmutableSet.of("|"),
          ImmutableSet.of("^"),
          ImmutableSet.of("&"),
          ImmutableSet.of("<<", ">>"),
          ImmutableSet.of("+", "-"),
          ImmutableSet.of("*", "/", "//", "%", "@"));

  // Operators that end an unparenthesized expression list.
  private static final ImmutableSet<String> LIST_TERMINATORS =
      ImmutableSet.<String>builder()
          .add("=", ")", "]", "}", ";", ":")
          .addAll(AUGMENTED_ASSIGN_OPS)
          .build();

  private final String sourceName;
  private final ImmutableList<Tok> tokens;
  private int index;

  private Parser(String sourceName, String source) {
    this.sourceName = sourceName;
    this.tokens = new Lexer(sourceName, source).tokenize();
  }

  /** Parses a whole source file into a MODULE node. */
  public static Node parse(String sourceName, String source) {
    return new Parser(sourceName, source).parseModule();
  }

  private Node parseModule() {
    Node module = node(Token.MODULE, peek());
    while (peek().kind != Kind.EOF) {
      if (peek().kind == Kind.NEWLINE) {
        next();
        continue;
      }
      parseStatement(module);
    }
    return module;
  }

  // Statements

  private void parseStatement(Node parent) {
    Tok t = peek();
    if (t.kind == Kind.OP && t.text.equals("@")) {
      parent.addChildToBack(parseDecorated());
      return;
    }
    if (t.kind == Kind.NAME) {
      switch (t.text) {
        case "def":
          parent.addChildToBack(parseFunctionDef(node(Token.DECORATORS, t), false));
          return;
        case "class":
          parent.addChildToBack(parseClassDef(node(Token.DECORATORS, t)));
          return;
        case "if":
          parent.addChildToBack(parseIf());
          return;
        case "while":
          parent.addChildToBack(parseWhile());
          return;
        case "for":
          parent.addChildToBack(parseFor(false));
          return;
        case "try":
          parent.addChildToBack(parseTry());
          return;
        case "with":
          parent.addChildToBack(parseWith(false));
          return;
        case "async":
          {
            Tok following = peekAt(1);
            if (following.is(Kind.NAME, "def")) {
              next();
              parent.addChildToBack(parseFunctionDef(node(Token.DECORATORS, t), true));
              return;
            } else if (following.is(Kind.NAME, "for")) {
              next();
              parent.addChildToBack(parseFor(true));
              return;
            } else if (following.is(Kind.NAME, "with")) {
              next();
              parent.addChildToBack(parseWith(true));
              return;
            }
            break;
          }
        default:
          break;
      }
    }
    if (t.kind == Kind.INDENT) {
      throw error(t, "unexpected indent");
    }
    parseSimpleStatement(parent);
  }

  private void parseSimpleStatement(Node parent) {
    parent.addChildToBack(parseSmallStatement());
    while (acceptOp(";")) {
      if (atLineEnd()) {
        break;
      }
      parent.addChildToBack(parseSmallStatement());
    }
    expectNewline();
  }

  private Node parseSuite() {
    Tok start = peek();
    Node suite = node(Token.SUITE, start);
    if (start.kind != Kind.NEWLINE) {
      parseSimpleStatement(suite);
      return suite;
    }
    next();
    if (peek().kind != Kind.INDENT) {
      throw error(peek(), "expected an indented block");
    }
    next();
    while (peek().kind != Kind.DEDENT && peek().kind != Kind.EOF) {
      if (peek().kind == Kind.NEWLINE) {
        next();
        continue;
      }
      parseStatement(suite);
    }
    if (peek().kind == Kind.DEDENT) {
      next();
    }
    return suite;
  }

  private Node parseDecorated() {
    Node decorators = node(Token.DECORATORS, peek());
    while (acceptOp("@")) {
      decorators.addChildToBack(parseNamedExprTest());
      expectNewline();
      while (peek().kind == Kind.NEWLINE) {
        next();
      }
    }
    Tok t = peek();
    if (t.is(Kind.NAME, "def")) {
      return parseFunctionDef(decorators, false);
    } else if (t.is(Kind.NAME, "class")) {
      return parseClassDef(decorators);
    } else if (t.is(Kind.NAME, "async") && peekAt(1).is(Kind.NAME, "def")) {
      next();
      return parseFunctionDef(decorators, true);
    }
    throw error(t, "expected a function or class definition after decorator");
  }

  private Node parseFunctionDef(Node decorators, boolean isAsync) {
    Tok defTok = expectKeyword("def");
    String name = expectName();
    expectOp("(");
    Node params = parseParameters(")", true);
    expectOp(")");
    Node returns = acceptOp("->") ? parseTest() : Node.empty();
    expectOp(":");
    Node body = parseSuite();
    Node fn = node(Token.FUNCTION_DEF, defTok, decorators, params, returns, body);
    fn.setString(name);
    fn.putBooleanProp(Node.Prop.ASYNC, isAsync);
    return fn;
  }

  private Node parseParameters(String closer, boolean allowAnnotations) {
    Node list = node(Token.PARAM_LIST, peek());
    while (!isOp(closer)) {
      Tok t = peek();
      Node param = node(Token.PARAM, t);
      if (acceptOp("/")) {
        param.putBooleanProp(Node.Prop.POSITIONAL_ONLY_MARKER, true);
      } else if (acceptOp("*")) {
        param.putBooleanProp(Node.Prop.VARARGS, true);
        if (peek().kind == Kind.NAME) {
          param.setString(expectName());
        }
      } else if (acceptOp("**")) {
        param.putBooleanProp(Node.Prop.KWARGS, true);
        param.setString(expectName());
      } else {
        param.setString(expectName());
      }
      Node annotation = Node.empty();
      if (allowAnnotations && param.getStringOrNull() != null && acceptOp(":")) {
        annotation = parseTest();
      }
      Node defaultValue = acceptOp("=") ? parseTest() : Node.empty();
      param.addChildToBack(annotation);
      param.addChildToBack(defaultValue);
      list.addChildToBack(param);
      if (!acceptOp(",")) {
        break;
      }
    }
    return list;
  }

  private Node parseClassDef(Node decorators) {
    Tok classTok = expectKeyword("class");
    String name = expectName();
    Node args = node(Token.ARG_LIST, peek());
    if (acceptOp("(")) {
      args.putBooleanProp(Node.Prop.PARENTHESIZED, true);
      parseArguments(args);
      expectOp(")");
    }
    expectOp(":");
    Node body = parseSuite();
    Node cls = node(Token.CLASS_DEF, classTok, decorators, args, body);
    cls.setString(name);
    return cls;
  }

  private Node parseIf() {
    Tok t = next();
    Node test = parseNamedExprTest();
    expectOp(":");
    Node ifNode = node(Token.IF, t, test, parseSuite());
    if (isKeyword("elif")) {
      Node elif = parseIf();
      elif.putBooleanProp(Node.Prop.ELIF, true);
      ifNode.addChildToBack(elif);
    } else if (acceptKeyword("else")) {
      expectOp(":");
      ifNode.addChildToBack(parseSuite());
    }
    return ifNode;
  }

  private Node parseWhile() {
    Tok t = next();
    Node test = parseNamedExprTest();
    expectOp(":");
    Node whileNode = node(Token.WHILE, t, test, parseSuite());
    parseOptionalElse(whileNode);
    return whileNode;
  }

  private Node parseFor(boolean isAsync) {
    Tok t = expectKeyword("for");
    Node target = markStore(parseTargetList());
    expectKeyword("in");
    Node iterable = parseTestListStarExpr();
    expectOp(":");
    Node forNode = node(Token.FOR, t, target, iterable, parseSuite());
    forNode.putBooleanProp(Node.Prop.ASYNC, isAsync);
    parseOptionalElse(forNode);
    return forNode;
  }

  private void parseOptionalElse(Node loop) {
    if (acceptKeyword("else")) {
      expectOp(":");
      loop.addChildToBack(parseSuite());
    }
  }

  private Node parseTry() {
    Tok t = next();
    expectOp(":");
    Node tryNode = node(Token.TRY, t, parseSuite());
    while (isKeyword("except")) {
      Tok exceptTok = next();
      Node type = Node.empty();
      String name = null;
      if (!isOp(":")) {
        type = parseTest();
        if (acceptKeyword("as")) {
          name = expectName();
        }
      }
      expectOp(":");
      Node handler = node(Token.EXCEPT, exceptTok, type, parseSuite());
      handler.setString(name);
      tryNode.addChildToBack(handler);
    }
    if (isKeyword("else")) {
      Tok elseTok = next();
      expectOp(":");
      tryNode.addChildToBack(node(Token.TRY_ELSE, elseTok, parseSuite()));
    }
    if (isKeyword("finally")) {
      Tok finallyTok = next();
      expectOp(":");
      tryNode.addChildToBack(node(Token.FINALLY, finallyTok, parseSuite()));
    }
    if (tryNode.getChildCount() == 1) {
      throw error(peek(), "expected 'except' or 'finally' block");
    }
    return tryNode;
  }

  private Node parseWith(boolean isAsync) {
    Tok t = expectKeyword("with");
    Node with = node(Token.WITH, t);
    with.putBooleanProp(Node.Prop.ASYNC, isAsync);
    if (!(isOp("(") && tryParseParenthesizedWithItems(with))) {
      do {
        with.addChildToBack(parseWithItem());
      } while (acceptOp(","));
    }
    expectOp(":");
    with.addChildToBack(parseSuite());
    return with;
  }

  /**
   * Attempts {@code with (a as b, c as d):}. On failure the token position is restored so the
   * parenthesis can be parsed as part of an ordinary expression.
   */
  private boolean tryParseParenthesizedWithItems(Node with) {
    int save = index;
    try {
      next();
      ImmutableList.Builder<Node> items = ImmutableList.builder();
      do {
        if (isOp(")")) {
          break;
        }
        items.add(parseWithItem());
      } while (acceptOp(","));
      expectOp(")");
      if (!isOp(":")) {
        index = save;
        return false;
      }
      for (Node item : items.build()) {
        with.addChildToBack(item);
      }
      return true;
    } catch (ParseException e) {
      // Backtrack: the parenthesis belongs to the context expression.
      index = save;
      return false;
    }
  }

  private Node parseWithItem() {
    Tok t = peek();
    Node context = parseTest();
    Node target = acceptKeyword("as") ? markStore(parseStarOrExpr()) : Node.empty();
    return node(Token.WITH_ITEM, t, context, target);
  }

  private Node parseSmallStatement() {
    Tok t = peek();
    if (t.kind == Kind.NAME) {
      switch (t.text) {
        case "pass":
          next();
          return node(Token.PASS, t);
        case "break":
          next();
          return node(Token.BREAK, t);
        case "continue":
          next();
          return node(Token.CONTINUE, t);
        case "return":
          {
            next();
            Node ret = node(Token.RETURN, t);
            if (!atStatementEnd()) {
              ret.addChildToBack(parseTestListStarExpr());
            }
            return ret;
          }
        case "raise":
          {
            next();
            Node exception = Node.empty();
            Node cause = Node.empty();
            if (!atStatementEnd()) {
              exception = parseTest();
              if (acceptKeyword("from")) {
                cause = parseTest();
              }
            }
            return node(Token.RAISE, t, exception, cause);
          }
        case "global":
        case "nonlocal":
          {
            next();
            Node decl = node(t.text.equals("global") ? Token.GLOBAL : Token.NONLOCAL, t);
            do {
              Tok nameTok = peek();
              Node id = node(Token.IDENTIFIER, nameTok);
              id.setString(expectName());
              decl.addChildToBack(id);
            } while (acceptOp(","));
            return decl;
          }
        case "del":
          {
            next();
            Node del = node(Token.DEL, t);
            do {
              if (atStatementEnd()) {
                break;
              }
              del.addChildToBack(markDelete(parseStarOrExpr()));
            } while (acceptOp(","));
            return del;
          }
        case "assert":
          {
            next();
            Node assertion = node(Token.ASSERT, t, parseTest());
            if (acceptOp(",")) {
              assertion.addChildToBack(parseTest());
            }
            return assertion;
          }
        case "import":
          return parseImport();
        case "from":
          return parseFromImport();
        default:
          break;
      }
    }
    return parseExpressionStatement();
  }

  private Node parseImport() {
    Tok t = next();
    Node imp = node(Token.IMPORT, t);
    do {
      Tok aliasTok = peek();
      Node alias = node(Token.IMPORT_ALIAS, aliasTok);
      alias.setString(parseDottedName());
      if (acceptKeyword("as")) {
        alias.setAlias(expectName());
      }
      imp.addChildToBack(alias);
    } while (acceptOp(","));
    return imp;
  }

  private Node parseFromImport() {
    Tok t = next();
    int level = 0;
    while (true) {
      if (acceptOp(".")) {
        level++;
      } else if (acceptOp("...")) {
        level += 3;
      } else {
        break;
      }
    }
    String module = isKeyword("import") ? "" : parseDottedName();
    expectKeyword("import");
    Node from = node(Token.IMPORT_FROM, t);
    from.setString(module);
    from.setIntValue(level);
    Tok aliasTok = peek();
    if (acceptOp("*")) {
      Node alias = node(Token.IMPORT_ALIAS, aliasTok);
      alias.setString("*");
      from.addChildToBack(alias);
      return from;
    }
    boolean parenthesized = acceptOp("(");
    do {
      if (parenthesized && isOp(")")) {
        break;
      }
      Node alias = node(Token.IMPORT_ALIAS, peek());
      alias.setString(expectName());
      if (acceptKeyword("as")) {
        alias.setAlias(expectName());
      }
      from.addChildToBack(alias);
    } while (acceptOp(","));
    if (parenthesized) {
      expectOp(")");
    }
    if (!from.hasChildren()) {
      throw error(peek(), "expected a name to import");
    }
    return from;
  }

  private String parseDottedName() {
    StringBuilder sb = new StringBuilder(expectName());
    while (acceptOp(".")) {
      sb.append('.').append(expectName());
    }
    return sb.toString();
  }

  private Node parseExpressionStatement() {
    Tok start = peek();
    Node first = parseYieldOrTestList();
    if (acceptOp(":")) {
      Node annotation = parseTest();
      Node value = acceptOp("=") ? parseYieldOrTestList() : Node.empty();
      return node(Token.ANN_ASSIGN, start, markStore(first), annotation, value);
    }
    if (peek().kind == Kind.OP && AUGMENTED_ASSIGN_OPS.contains(peek().text)) {
      String op = next().text;
      Node value = parseYieldOrTestList();
      Node aug = node(Token.AUG_ASSIGN, start, markStore(first), value);
      aug.setString(op);
      return aug;
    }
    if (isOp("=")) {
      Node assign = node(Token.ASSIGN, start, first);
      while (acceptOp("=")) {
        assign.addChildToBack(parseYieldOrTestList());
      }
      for (int i = 0; i < assign.getChildCount() - 1; i++) {
        markStore(assign.getChildAtIndex(i));
      }
      return assign;
    }
    return node(Token.EXPR_STMT, start, first);
  }

  // Expressions

  private Node parseYieldOrTestList() {
    return isKeyword("yield") ? parseYieldExpr() : parseTestListStarExpr();
  }

  private Node parseYieldExpr() {
    Tok t = expectKeyword("yield");
    if (acceptKeyword("from")) {
      return node(Token.YIELD_FROM, t, parseTest());
    }
    Node yield = node(Token.YIELD, t);
    if (!atStatementEnd() && !isOp(")") && !isOp("]") && !isOp("}") && !isOp("=")) {
      yield.addChildToBack(parseTestListStarExpr());
    }
    return yield;
  }

  private Node parseTestListStarExpr() {
    Tok start = peek();
    Node first = parseTestOrStar();
    if (!isOp(",")) {
      return first;
    }
    Node tuple = node(Token.TUPLE, start, first);
    while (acceptOp(",")) {
      if (atExpressionListEnd()) {
        break;
      }
      tuple.addChildToBack(parseTestOrStar());
    }
    return tuple;
  }

  private Node parseTestOrStar() {
    Tok t = peek();
    if (acceptOp("*")) {
      return node(Token.STARRED, t, parseBitOr());
    }
    return parseNamedExprTest();
  }

  private Node parseStarOrExpr() {
    Tok t = peek();
    if (acceptOp("*")) {
      return node(Token.STARRED, t, parseBitOr());
    }
    return parseBitOr();
  }

  /** The target list of a for loop or comprehension, which stops before {@code in}. */
  private Node parseTargetList() {
    Tok start = peek();
    Node first = parseStarOrExpr();
    if (!isOp(",")) {
      return first;
    }
    Node tuple = node(Token.TUPLE, start, first);
    while (acceptOp(",")) {
      if (isKeyword("in") || atExpressionListEnd()) {
        break;
      }
      tuple.addChildToBack(parseStarOrExpr());
    }
    return tuple;
  }

  private Node parseNamedExprTest() {
    Tok t = peek();
    if (t.kind == Kind.NAME && !KEYWORDS.contains(t.text) && peekAt(1).is(Kind.OP, ":=")) {
      next();
      next();
      Node target = node(Token.NAME, t);
      target.setString(t.text);
      target.putBooleanProp(Node.Prop.STORE, true);
      return node(Token.NAMED_EXPR, t, target, parseTest());
    }
    return parseTest();
  }

  private Node parseTest() {
    if (isKeyword("lambda")) {
      return parseLambda(true);
    }
    Tok start = peek();
    Node body = parseOrTest();
    if (acceptKeyword("if")) {
      Node test = parseOrTest();
      expectKeyword("else");
      Node orElse = parseTest();
      return node(Token.IFEXP, start, body, test, orElse);
    }
    return body;
  }

  private Node parseTestNoCond() {
    return isKeyword("lambda") ? parseLambda(false) : parseOrTest();
  }

  private Node parseLambda(boolean allowConditional) {
    Tok t = expectKeyword("lambda");
    Node params = parseParameters(":", false);
    expectOp(":");
    Node body = allowConditional ? parseTest() : parseTestNoCond();
    return node(Token.LAMBDA, t, params, body);
  }

  private Node parseOrTest() {
    Tok start = peek();
    Node first = parseAndTest();
    if (!isKeyword("or")) {
      return first;
    }
    Node or = node(Token.BOOLOP, start, first);
    or.setString("or");
    while (acceptKeyword("or")) {
      or.addChildToBack(parseAndTest());
    }
    return or;
  }

  private Node parseAndTest() {
    Tok start = peek();
    Node first = parseNotTest();
    if (!isKeyword("and")) {
      return first;
    }
    Node and = node(Token.BOOLOP, start, first);
    and.setString("and");
    while (acceptKeyword("and")) {
      and.addChildToBack(parseNotTest());
    }
    return and;
  }

  private Node parseNotTest() {
    Tok t = peek();
    if (acceptKeyword("not")) {
      Node not = node(Token.UNARYOP, t, parseNotTest());
      not.setString("not");
      return not;
    }
    return parseComparison();
  }

  private Node parseComparison() {
    Tok start = peek();
    Node first = parseBitOr();
    if (peekComparisonOperator() == null) {
      return first;
    }
    Node compare = node(Token.COMPARE, start, first);
    String op;
    while ((op = peekComparisonOperator()) != null) {
      Tok opTok = next();
      if (op.equals("not in") || op.equals("is not")) {
        next();
      }
      Node opNode = node(Token.COMPARE_OP, opTok);
      opNode.setString(op);
      compare.addChildToBack(opNode);
      compare.addChildToBack(parseBitOr());
    }
    return compare;
  }

  private @Nullable String peekComparisonOperator() {
    Tok t = peek();
    if (t.kind == Kind.OP && COMPARISON_OPS.contains(t.text)) {
      return t.text;
    }
    if (t.is(Kind.NAME, "in")) {
      return "in";
    }
    if (t.is(Kind.NAME, "not") && peekAt(1).is(Kind.NAME, "in")) {
      return "not in";
    }
    if (t.is(Kind.NAME, "is")) {
      return peekAt(1).is(Kind.NAME, "not") ? "is not" : "is";
    }
    return null;
  }

  private Node parseBitOr() {
    return parseBinary(0);
  }

  private Node parseBinary(int level) {
    if (level == BINARY_LEVELS.size()) {
      return parseFactor();
    }
    Node left = parseBinary(level + 1);
    while (peek().kind == Kind.OP && BINARY_LEVELS.get(level).contains(peek().text)) {
      String op = next().text;
      Node right = parseBinary(level + 1);
      Node binop = new Node(Token.BINOP, left, right).srcref(left);
      binop.setString(op);
      left = binop;
    }
    return left;
  }

  private Node parseFactor() {
    Tok t = peek();
    if (t.kind == Kind.OP && (t.text.equals("+") || t.text.equals("-") || t.text.equals("~"))) {
      next();
      Node unary = node(Token.UNARYOP, t, parseFactor());
      unary.setString(t.text);
      return unary;
    }
    return parsePower();
  }

  private Node parsePower() {
    Node base = parseAwaitPrimary();
    if (acceptOp("**")) {
      Node power = new Node(Token.BINOP, base, parseFactor()).srcref(base);
      power.setString("**");
      return power;
    }
    return base;
  }

  private Node parseAwaitPrimary() {
    Tok t = peek();
    if (acceptKeyword("await")) {
      return node(Token.AWAIT, t, parsePrimary());
    }
    return parsePrimary();
  }

  private Node parsePrimary() {
    Node n = parseAtom();
    while (true) {
      if (isOp("(")) {
        next();
        Node call = new Node(Token.CALL, n).srcref(n);
        parseArguments(call);
        expectOp(")");
        n = call;
      } else if (isOp("[")) {
        next();
        Node subscript = new Node(Token.SUBSCRIPT, n, parseSubscriptList()).srcref(n);
        expectOp("]");
        n = subscript;
      } else if (isOp(".")) {
        next();
        Node getattr = new Node(Token.GETATTR, n).srcref(n);
        getattr.setString(expectName());
        n = getattr;
      } else {
        return n;
      }
    }
  }

  private void parseArguments(Node into) {
    while (!isOp(")")) {
      Tok t = peek();
      if (acceptOp("*")) {
        into.addChildToBack(node(Token.STAR_ARG, t, parseTest()));
      } else if (acceptOp("**")) {
        into.addChildToBack(node(Token.DOUBLE_STAR_ARG, t, parseTest()));
      } else if (t.kind == Kind.NAME
          && !KEYWORDS.contains(t.text)
          && peekAt(1).is(Kind.OP, "=")) {
        next();
        next();
        Node keyword = node(Token.KEYWORD_ARG, t, parseTest());
        keyword.setString(t.text);
        into.addChildToBack(keyword);
      } else {
        Node arg = parseNamedExprTest();
        if (isComprehensionFor()) {
          arg = parseComprehension(Token.GENERATOR_EXP, arg);
        }
        into.addChildToBack(arg);
      }
      if (!acceptOp(",")) {
        break;
      }
    }
  }

  private Node parseSubscriptList() {
    Tok start = peek();
    Node first = parseSubscript();
    if (!isOp(",")) {
      return first;
    }
    Node tuple = node(Token.TUPLE, start, first);
    while (acceptOp(",")) {
      if (isOp("]")) {
        break;
      }
      tuple.addChildToBack(parseSubscript());
    }
    return tuple;
  }

  private Node parseSubscript() {
    Tok start = peek();
    Node lower = Node.empty();
    if (!isOp(":")) {
      lower = parseTestOrStar();
      if (!isOp(":")) {
        return lower;
      }
    }
    expectOp(":");
    Node upper = isOp(":") || isOp("]") || isOp(",") ? Node.empty() : parseTest();
    Node step = Node.empty();
    boolean hasStepColon = false;
    if (acceptOp(":")) {
      hasStepColon = true;
      if (!isOp("]") && !isOp(",")) {
        step = parseTest();
      }
    }
    Node slice = node(Token.SLICE, start, lower, upper, step);
    slice.putBooleanProp(Node.Prop.HAS_STEP_COLON, hasStepColon);
    return slice;
  }

  private Node parseAtom() {
    Tok t = peek();
    switch (t.kind) {
      case NAME:
        if (t.text.equals("None") || t.text.equals("True") || t.text.equals("False")) {
          next();
          Node constant = node(Token.CONSTANT, t);
          constant.setString(t.text);
          return constant;
        }
        if (KEYWORDS.contains(t.text)) {
          throw error(t, "invalid syntax");
        }
        next();
        Node name = node(Token.NAME, t);
        name.setString(t.text);
        return name;
      case NUMBER:
        next();
        Node number = node(Token.NUMBER, t);
        number.setString(t.text);
        return number;
      case STRING:
        return parseStrings();
      case OP:
        switch (t.text) {
          case "(":
            return parseParenthesized();
          case "[":
            return parseListDisplay();
          case "{":
            return parseBraceDisplay();
          case "...":
            next();
            return node(Token.ELLIPSIS, t);
          default:
            throw error(t, "invalid syntax");
        }
      default:
        throw error(t, "invalid syntax");
    }
  }

  private Node parseParenthesized() {
    Tok open = next();
    if (acceptOp(")")) {
      return node(Token.TUPLE, open).putBooleanProp(Node.Prop.PARENTHESIZED, true);
    }
    if (isKeyword("yield")) {
      Node yield = parseYieldExpr();
      expectOp(")");
      return yield.putBooleanProp(Node.Prop.PARENTHESIZED, true);
    }
    Node first = parseTestOrStar();
    if (isComprehensionFor()) {
      Node generator = parseComprehension(Token.GENERATOR_EXP, first);
      expectOp(")");
      return generator.putBooleanProp(Node.Prop.PARENTHESIZED, true);
    }
    if (isOp(",")) {
      Node tuple = node(Token.TUPLE, open, first);
      while (acceptOp(",")) {
        if (isOp(")")) {
          break;
        }
        tuple.addChildToBack(parseTestOrStar());
      }
      expectOp(")");
      return tuple.putBooleanProp(Node.Prop.PARENTHESIZED, true);
    }
    expectOp(")");
    return first.putBooleanProp(Node.Prop.PARENTHESIZED, true);
  }

  private Node parseListDisplay() {
    Tok open = next();
    if (acceptOp("]")) {
      return node(Token.LIST, open);
    }
    Node first = parseTestOrStar();
    if (isComprehensionFor()) {
      Node comprehension = parseComprehension(Token.LIST_COMP, first);
      expectOp("]");
      return comprehension.setLocation(sourceName, open.line, open.col);
    }
    Node list = node(Token.LIST, open, first);
    while (acceptOp(",")) {
      if (isOp("]")) {
        break;
      }
      list.addChildToBack(parseTestOrStar());
    }
    expectOp("]");
    return list;
  }

  private Node parseBraceDisplay() {
    Tok open = next();
    if (acceptOp("}")) {
      return node(Token.DICT, open);
    }
    Tok t = peek();
    if (acceptOp("**")) {
      Node dict = node(Token.DICT, open, node(Token.DOUBLE_STAR_ARG, t, parseBitOr()));
      return parseDictRest(dict);
    }
    Node first = parseTestOrStar();
    if (acceptOp(":")) {
      Node entry = node(Token.DICT_ENTRY, t, first, parseTest());
      if (isComprehensionFor()) {
        Node comprehension = parseComprehension(Token.DICT_COMP, entry);
        expectOp("}");
        return comprehension;
      }
      return parseDictRest(node(Token.DICT, open, entry));
    }
    if (isComprehensionFor()) {
      Node comprehension = parseComprehension(Token.SET_COMP, first);
      expectOp("}");
      return comprehension;
    }
    Node set = node(Token.SET, open, first);
    while (acceptOp(",")) {
      if (isOp("}")) {
        break;
      }
      set.addChildToBack(parseTestOrStar());
    }
    expectOp("}");
    return set;
  }

  private Node parseDictRest(Node dict) {
    while (acceptOp(",")) {
      if (isOp("}")) {
        break;
      }
      Tok t = peek();
      if (acceptOp("**")) {
        dict.addChildToBack(node(Token.DOUBLE_STAR_ARG, t, parseBitOr()));
      } else {
        Node key = parseTest();
        expectOp(":");
        dict.addChildToBack(node(Token.DICT_ENTRY, t, key, parseTest()));
      }
    }
    expectOp("}");
    return dict;
  }

  private boolean isComprehensionFor() {
    return isKeyword("for") || (isKeyword("async") && peekAt(1).is(Kind.NAME, "for"));
  }

  private Node parseComprehension(Token kind, Node element) {
    Node comprehension = new Node(kind, element).srcref(element);
    while (isComprehensionFor()) {
      Tok t = peek();
      boolean isAsync = acceptKeyword("async");
      expectKeyword("for");
      Node target = markStore(parseTargetList());
      expectKeyword("in");
      Node iterable = parseOrTest();
      Node compFor = node(Token.COMP_FOR, t, target, iterable);
      compFor.putBooleanProp(Node.Prop.ASYNC, isAsync);
      while (acceptKeyword("if")) {
        compFor.addChildToBack(parseTestNoCond());
      }
      comprehension.addChildToBack(compFor);
    }
    return comprehension;
  }

  // String literals

  private Node parseStrings() {
    Tok first = peek();
    ImmutableList.Builder<Node> parts = ImmutableList.builder();
    int count = 0;
    while (peek().kind == Kind.STRING) {
      parts.add(parseStringPart(next()));
      count++;
    }
    if (count == 1) {
      return parts.build().get(0);
    }
    Node concat = node(Token.STRING_CONCAT, first);
    for (Node part : parts.build()) {
      concat.addChildToBack(part);
    }
    return concat;
  }

  private Node parseStringPart(Tok t) {
    int quoteIndex = quoteIndex(t.text);
    String prefix = t.text.substring(0, quoteIndex).toLowerCase();
    if (!prefix.contains("f")) {
      Node string = node(Token.STRING, t);
      string.setString(t.text);
      return string;
    }
    return parseFString(t, quoteIndex, prefix.contains("r"));
  }

  private static int quoteIndex(String literal) {
    int i = 0;
    while (literal.charAt(i) != '"' && literal.charAt(i) != '\'') {
      i++;
    }
    return i;
  }

  private Node parseFString(Tok t, int quoteIndex, boolean raw) {
    String text = t.text;
    char quote = text.charAt(quoteIndex);
    String tripleQuote = String.valueOf(new char[] {quote, quote, quote});
    boolean triple =
        text.startsWith(tripleQuote, quoteIndex) && text.length() >= quoteIndex + 6;
    int quoteLength = triple ? 3 : 1;
    String body = text.substring(quoteIndex + quoteLength, text.length() - quoteLength);
    Node fstring = node(Token.FSTRING, t);
    fstring.setString(text.substring(0, quoteIndex + quoteLength));

    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < body.length()) {
      char c = body.charAt(i);
      char next = i + 1 < body.length() ? body.charAt(i + 1) : 0;
      if (c == '\\' && !raw) {
        if (next == 'N' && i + 2 < body.length() && body.charAt(i + 2) == '{') {
          int close = body.indexOf('}', i);
          if (close < 0) {
            throw error(t, "malformed \\N escape in f-string");
          }
          literal.append(body, i, close + 1);
          i = close + 1;
        } else {
          literal.append(body, i, Math.min(i + 2, body.length()));
          i += 2;
        }
      } else if (c == '{' && next == '{') {
        literal.append("{{");
        i += 2;
      } else if (c == '}' && next == '}') {
        literal.append("}}");
        i += 2;
      } else if (c == '{') {
        flushLiteral(fstring, literal, t);
        i = parseReplacementField(fstring, body, i, t);
      } else if (c == '}') {
        throw error(t, "f-string: single '}' is not allowed");
      } else {
        literal.append(c);
        i++;
      }
    }
    flushLiteral(fstring, literal, t);
    return fstring;
  }

  private void flushLiteral(Node fstring, StringBuilder literal, Tok t) {
    if (literal.length() > 0) {
      Node text = node(Token.FSTRING_TEXT, t);
      text.setString(literal.toString());
      fstring.addChildToBack(text);
      literal.setLength(0);
    }
  }

  /** Parses the field opened at {@code start} and returns the index after its closing brace. */
  private int parseReplacementField(Node fstring, String body, int start, Tok t) {
    int i = start + 1;
    int depth = 0;
    int expressionEnd = -1;
    while (i < body.length()) {
      char c = body.charAt(i);
      char next = i + 1 < body.length() ? body.charAt(i + 1) : 0;
      char previous = body.charAt(i - 1);
      if (c == '\'' || c == '"') {
        i = skipQuoted(body, i, t);
        continue;
      }
      if (c == '(' || c == '[' || c == '{') {
        depth++;
      } else if (c == ')' || c == ']') {
        depth--;
      } else if (c == '}') {
        if (depth == 0) {
          expressionEnd = i;
          break;
        }
        depth--;
      } else if (depth == 0 && c == '!' && next != '=') {
        expressionEnd = i;
        break;
      } else if (depth == 0 && c == ':') {
        expressionEnd = i;
        break;
      } else if (depth == 0
          && c == '='
          && next != '='
          && "=!<>".indexOf(previous) < 0) {
        expressionEnd = i;
        break;
      }
      i++;
    }
    if (expressionEnd < 0) {
      throw error(t, "f-string: expecting '}'");
    }
    String expressionText = body.substring(start + 1, expressionEnd);
    String trimmed = expressionText.stripTrailing();
    int suffixStart = start + 1 + trimmed.length();

    int close = expressionEnd;
    int nesting = 0;
    while (close < body.length()) {
      char c = body.charAt(close);
      if (c == '{') {
        nesting++;
      } else if (c == '}') {
        if (nesting == 0) {
          break;
        }
        nesting--;
      }
      close++;
    }
    if (close >= body.length()) {
      throw error(t, "f-string: expecting '}'");
    }
    if (trimmed.isBlank()) {
      throw error(t, "f-string: empty expression not allowed");
    }
    Node field = node(Token.FSTRING_FIELD, t, parseFieldExpression(trimmed.strip(), t));
    field.setString(body.substring(suffixStart, close));
    fstring.addChildToBack(field);
    return close + 1;
  }

  private int skipQuoted(String body, int start, Tok t) {
    char quote = body.charAt(start);
    String tripleQuote = String.valueOf(new char[] {quote, quote, quote});
    boolean triple = body.startsWith(tripleQuote, start);
    int i = start + (triple ? 3 : 1);
    while (i < body.length()) {
      char c = body.charAt(i);
      if (c == '\\') {
        i += 2;
      } else if (triple ? body.startsWith(tripleQuote, i) : c == quote) {
        return i + (triple ? 3 : 1);
      } else {
        i++;
      }
    }
    throw error(t, "f-string: unterminated string");
  }

  private Node parseFieldExpression(String text, Tok t) {
    Parser inner = new Parser(sourceName, "(" + text + ")");
    Node expression = inner.parseTestListStarExpr();
    if (inner.peek().kind == Kind.NEWLINE) {
      inner.next();
    }
    if (inner.peek().kind != Kind.EOF) {
      throw error(t, "f-string: invalid expression");
    }
    expression.putBooleanProp(Node.Prop.PARENTHESIZED, false);
    relocate(expression, t);
    return expression;
  }

  private void relocate(Node n, Tok t) {
    n.setLocation(sourceName, t.line, t.col);
    for (Node child : n.children()) {
      relocate(child, t);
    }
  }

  // Target marking

  @CanIgnoreReturnValue
  private static Node markStore(Node target) {
    return markContext(target, Node.Prop.STORE);
  }

  @CanIgnoreReturnValue
  private static Node markDelete(Node target) {
    return markContext(target, Node.Prop.DELETE);
  }

  private static Node markContext(Node target, Node.Prop prop) {
    switch (target.getToken()) {
      case NAME:
        target.putBooleanProp(prop, true);
        break;
      case TUPLE:
      case LIST:
        for (Node child : target.children()) {
          markContext(child, prop);
        }
        break;
      case STARRED:
        markContext(target.getOnlyChild(), prop);
        break;
      default:
        break;
    }
    return target;
  }

  // Token helpers

  private Tok peek() {
    return tokens.get(index);
  }

  private Tok peekAt(int offset) {
    return tokens.get(Math.min(index + offset, tokens.size() - 1));
  }

  @CanIgnoreReturnValue
  private Tok next() {
    Tok t = tokens.get(index);
    if (t.kind != Kind.EOF) {
      index++;
    }
    return t;
  }

  private boolean isOp(String op) {
    return peek().is(Kind.OP, op);
  }

  private boolean isKeyword(String keyword) {
    return peek().is(Kind.NAME, keyword);
  }

  private boolean acceptOp(String op) {
    if (isOp(op)) {
      next();
      return true;
    }
    return false;
  }

  private boolean acceptKeyword(String keyword) {
    if (isKeyword(keyword)) {
      next();
      return true;
    }
    return false;
  }

  private void expectOp(String op) {
    if (!acceptOp(op)) {
      throw error(peek(), "expected '" + op + "'");
    }
  }

  @CanIgnoreReturnValue
  private Tok expectKeyword(String keyword) {
    Tok t = peek();
    if (!acceptKeyword(keyword)) {
      throw error(t, "expected '" + keyword + "'");
    }
    return t;
  }

  private String expectName() {
    Tok t = peek();
    if (t.kind != Kind.NAME || KEYWORDS.contains(t.text)) {
      throw error(t, "expected a name");
    }
    next();
    return t.text;
  }

  private void expectNewline() {
    Tok t = peek();
    if (t.kind == Kind.NEWLINE) {
      next();
    } else if (t.kind != Kind.EOF && t.kind != Kind.DEDENT) {
      throw error(t, "invalid syntax");
    }
  }

  private boolean atLineEnd() {
    Kind kind = peek().kind;
    return kind == Kind.NEWLINE || kind == Kind.EOF || kind == Kind.DEDENT;
  }

  private boolean atStatementEnd() {
    return atLineEnd() || isOp(";");
  }

  private boolean atExpressionListEnd() {
    Tok t = peek();
    return atLineEnd() || (t.kind == Kind.OP && LIST_TERMINATORS.contains(t.text));
  }

  private Node node(Token token, Tok t, Node... children) {
    return new Node(token, children).setLocation(sourceName, t.line, t.col);
  }

  private ParseException error(Tok t, String detail) {
    return new ParseException(detail, sourceName, t.line, t.col);
  }
}
