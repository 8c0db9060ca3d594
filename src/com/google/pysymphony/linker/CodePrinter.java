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

package com.google.pysymphony.linker;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.pysymphony.ast.Node;
import com.google.pysymphony.ast.Token;
import java.util.ArrayList;
import java.util.List;

/**
 * Prints a syntax tree back to source text.
 *
 * <p>Parentheses are emitted exactly where the source had them, so the printer never needs to
 * reason about operator precedence. Blocks are indented with four spaces.
 */
public final class CodePrinter {

  private static final String INDENT = "    ";

  private final StringBuilder out = new StringBuilder();
  private int depth;

  private CodePrinter() {}

  /** Prints a MODULE, a SUITE or a single statement. */
  public static String print(Node n) {
    CodePrinter printer = new CodePrinter();
    if (n.getToken() == Token.MODULE || n.getToken() == Token.SUITE) {
      for (Node statement : n.children()) {
        printer.printStatement(statement);
      }
    } else {
      printer.printStatement(n);
    }
    return printer.out.toString();
  }

  /** Prints an expression without a trailing newline. */
  public static String printExpression(Node n) {
    return new CodePrinter().expr(n);
  }

  private void line(String text) {
    out.append(INDENT.repeat(depth)).append(text).append('\n');
  }

  private void block(String header, Node suite) {
    checkArgument(suite.getToken() == Token.SUITE, suite);
    line(header + ":");
    depth++;
    if (!suite.hasChildren()) {
      line("pass");
    }
    for (Node statement : suite.children()) {
      printStatement(statement);
    }
    depth--;
  }

  private void printStatement(Node n) {
    switch (n.getToken()) {
      case FUNCTION_DEF:
        {
          printDecorators(n.getChildAtIndex(0));
          Node returns = n.getChildAtIndex(2);
          String header =
              (n.getBooleanProp(Node.Prop.ASYNC) ? "async def " : "def ")
                  + n.getString()
                  + "("
                  + params(n.getChildAtIndex(1))
                  + ")"
                  + (returns.isEmpty() ? "" : " -> " + expr(returns));
          block(header, n.getChildAtIndex(3));
          break;
        }
      case CLASS_DEF:
        {
          printDecorators(n.getChildAtIndex(0));
          Node bases = n.getChildAtIndex(1);
          String header = "class " + n.getString();
          if (bases.hasChildren() || bases.isParenthesized()) {
            header += "(" + joinExpressions(bases.children()) + ")";
          }
          block(header, n.getChildAtIndex(2));
          break;
        }
      case IF:
        printIf(n, "if ");
        break;
      case WHILE:
        block("while " + expr(n.getFirstChild()), n.getChildAtIndex(1));
        if (n.getChildCount() > 2) {
          block("else", n.getChildAtIndex(2));
        }
        break;
      case FOR:
        block(
            (n.getBooleanProp(Node.Prop.ASYNC) ? "async for " : "for ")
                + expr(n.getChildAtIndex(0))
                + " in "
                + expr(n.getChildAtIndex(1)),
            n.getChildAtIndex(2));
        if (n.getChildCount() > 3) {
          block("else", n.getChildAtIndex(3));
        }
        break;
      case TRY:
        block("try", n.getFirstChild());
        for (int i = 1; i < n.getChildCount(); i++) {
          Node clause = n.getChildAtIndex(i);
          switch (clause.getToken()) {
            case EXCEPT:
              {
                Node type = clause.getFirstChild();
                String header = "except";
                if (!type.isEmpty()) {
                  header += " " + expr(type);
                  if (clause.getStringOrNull() != null) {
                    header += " as " + clause.getString();
                  }
                }
                block(header, clause.getLastChild());
                break;
              }
            case TRY_ELSE:
              block("else", clause.getOnlyChild());
              break;
            case FINALLY:
              block("finally", clause.getOnlyChild());
              break;
            default:
              throw new IllegalStateException("Unexpected try clause " + clause);
          }
        }
        break;
      case WITH:
        {
          List<String> items = new ArrayList<>();
          for (int i = 0; i < n.getChildCount() - 1; i++) {
            Node item = n.getChildAtIndex(i);
            Node target = item.getSecondChild();
            items.add(expr(item.getFirstChild()) + (target.isEmpty() ? "" : " as " + expr(target)));
          }
          block(
              (n.getBooleanProp(Node.Prop.ASYNC) ? "async with " : "with ")
                  + String.join(", ", items),
              n.getLastChild());
          break;
        }
      default:
        line(simpleStatement(n));
        break;
    }
  }

  private void printIf(Node n, String keyword) {
    block(keyword + expr(n.getFirstChild()), n.getSecondChild());
    if (n.getChildCount() > 2) {
      Node orElse = n.getChildAtIndex(2);
      if (orElse.getToken() == Token.IF) {
        printIf(orElse, "elif ");
      } else {
        block("else", orElse);
      }
    }
  }

  private void printDecorators(Node decorators) {
    for (Node decorator : decorators.children()) {
      line("@" + expr(decorator));
    }
  }

  private String simpleStatement(Node n) {
    switch (n.getToken()) {
      case EXPR_STMT:
        return expr(n.getOnlyChild());
      case ASSIGN:
        {
          List<String> parts = new ArrayList<>();
          for (Node child : n.children()) {
            parts.add(expr(child));
          }
          return String.join(" = ", parts);
        }
      case AUG_ASSIGN:
        return expr(n.getFirstChild()) + " " + n.getString() + " " + expr(n.getSecondChild());
      case ANN_ASSIGN:
        {
          Node value = n.getChildAtIndex(2);
          return expr(n.getFirstChild())
              + ": "
              + expr(n.getSecondChild())
              + (value.isEmpty() ? "" : " = " + expr(value));
        }
      case RETURN:
        return n.hasChildren() ? "return " + expr(n.getOnlyChild()) : "return";
      case PASS:
        return "pass";
      case BREAK:
        return "break";
      case CONTINUE:
        return "continue";
      case RAISE:
        {
          Node exception = n.getFirstChild();
          Node cause = n.getSecondChild();
          if (exception.isEmpty()) {
            return "raise";
          }
          return "raise " + expr(exception) + (cause.isEmpty() ? "" : " from " + expr(cause));
        }
      case ASSERT:
        return "assert "
            + expr(n.getFirstChild())
            + (n.getChildCount() > 1 ? ", " + expr(n.getSecondChild()) : "");
      case DEL:
        return "del " + joinExpressions(n.children());
      case GLOBAL:
      case NONLOCAL:
        {
          List<String> names = new ArrayList<>();
          for (Node id : n.children()) {
            names.add(id.getString());
          }
          return (n.getToken() == Token.GLOBAL ? "global " : "nonlocal ")
              + String.join(", ", names);
        }
      case IMPORT:
        return "import " + importAliases(n);
      case IMPORT_FROM:
        return "from "
            + ".".repeat(n.getIntValue())
            + n.getString()
            + " import "
            + importAliases(n);
      default:
        throw new IllegalStateException("Unexpected statement " + n);
    }
  }

  private static String importAliases(Node n) {
    List<String> parts = new ArrayList<>();
    for (Node alias : n.children()) {
      parts.add(alias.getString() + (alias.getAlias() == null ? "" : " as " + alias.getAlias()));
    }
    return String.join(", ", parts);
  }

  private String params(Node paramList) {
    List<String> parts = new ArrayList<>();
    for (Node param : paramList.children()) {
      if (param.getBooleanProp(Node.Prop.POSITIONAL_ONLY_MARKER)) {
        parts.add("/");
        continue;
      }
      String name = param.getStringOrNull() == null ? "" : param.getString();
      if (param.getBooleanProp(Node.Prop.VARARGS)) {
        name = "*" + name;
      } else if (param.getBooleanProp(Node.Prop.KWARGS)) {
        name = "**" + name;
      }
      Node annotation = param.getFirstChild();
      Node defaultValue = param.getSecondChild();
      if (!annotation.isEmpty()) {
        name += ": " + expr(annotation);
        if (!defaultValue.isEmpty()) {
          name += " = " + expr(defaultValue);
        }
      } else if (!defaultValue.isEmpty()) {
        name += "=" + expr(defaultValue);
      }
      parts.add(name);
    }
    return String.join(", ", parts);
  }

  private String joinExpressions(List<Node> nodes) {
    List<String> parts = new ArrayList<>();
    for (Node n : nodes) {
      parts.add(expr(n));
    }
    return String.join(", ", parts);
  }

  private String expr(Node n) {
    String text = unparenthesized(n);
    if (n.isParenthesized()) {
      return "(" + text + ")";
    }
    return text;
  }

  private String unparenthesized(Node n) {
    switch (n.getToken()) {
      case NAME:
      case NUMBER:
      case STRING:
      case CONSTANT:
        return n.getString();
      case ELLIPSIS:
        return "...";
      case STRING_CONCAT:
        {
          List<String> parts = new ArrayList<>();
          for (Node part : n.children()) {
            parts.add(expr(part));
          }
          return String.join(" ", parts);
        }
      case FSTRING:
        return fstring(n);
      case GETATTR:
        return expr(n.getOnlyChild()) + "." + n.getString();
      case SUBSCRIPT:
        {
          Node index = n.getSecondChild();
          String indexText =
              index.getToken() == Token.TUPLE && !index.isParenthesized() && index.hasChildren()
                  ? joinExpressions(index.children()) + (index.getChildCount() == 1 ? "," : "")
                  : expr(index);
          return expr(n.getFirstChild()) + "[" + indexText + "]";
        }
      case SLICE:
        {
          Node lower = n.getChildAtIndex(0);
          Node upper = n.getChildAtIndex(1);
          Node step = n.getChildAtIndex(2);
          String text =
              (lower.isEmpty() ? "" : expr(lower)) + ":" + (upper.isEmpty() ? "" : expr(upper));
          if (n.getBooleanProp(Node.Prop.HAS_STEP_COLON) || !step.isEmpty()) {
            text += ":" + (step.isEmpty() ? "" : expr(step));
          }
          return text;
        }
      case CALL:
        {
          List<String> args = new ArrayList<>();
          for (int i = 1; i < n.getChildCount(); i++) {
            args.add(expr(n.getChildAtIndex(i)));
          }
          return expr(n.getFirstChild()) + "(" + String.join(", ", args) + ")";
        }
      case KEYWORD_ARG:
        return n.getString() + "=" + expr(n.getOnlyChild());
      case STAR_ARG:
      case STARRED:
        return "*" + expr(n.getOnlyChild());
      case DOUBLE_STAR_ARG:
        return "**" + expr(n.getOnlyChild());
      case BINOP:
        return expr(n.getFirstChild()) + " " + n.getString() + " " + expr(n.getSecondChild());
      case UNARYOP:
        return n.getString().equals("not")
            ? "not " + expr(n.getOnlyChild())
            : n.getString() + expr(n.getOnlyChild());
      case BOOLOP:
        {
          List<String> parts = new ArrayList<>();
          for (Node operand : n.children()) {
            parts.add(expr(operand));
          }
          return String.join(" " + n.getString() + " ", parts);
        }
      case COMPARE:
        {
          StringBuilder sb = new StringBuilder(expr(n.getFirstChild()));
          for (int i = 1; i < n.getChildCount(); i += 2) {
            sb.append(' ')
                .append(n.getChildAtIndex(i).getString())
                .append(' ')
                .append(expr(n.getChildAtIndex(i + 1)));
          }
          return sb.toString();
        }
      case IFEXP:
        return expr(n.getChildAtIndex(0))
            + " if "
            + expr(n.getChildAtIndex(1))
            + " else "
            + expr(n.getChildAtIndex(2));
      case LAMBDA:
        {
          String params = params(n.getFirstChild());
          return "lambda"
              + (params.isEmpty() ? "" : " " + params)
              + ": "
              + expr(n.getSecondChild());
        }
      case NAMED_EXPR:
        return expr(n.getFirstChild()) + " := " + expr(n.getSecondChild());
      case AWAIT:
        return "await " + expr(n.getOnlyChild());
      case YIELD:
        return n.hasChildren() ? "yield " + expr(n.getOnlyChild()) : "yield";
      case YIELD_FROM:
        return "yield from " + expr(n.getOnlyChild());
      case TUPLE:
        {
          String elements = joinExpressions(n.children());
          if (n.getChildCount() == 1) {
            elements += ",";
          }
          return n.hasChildren() || n.isParenthesized() ? elements : "()";
        }
      case LIST:
        return "[" + joinExpressions(n.children()) + "]";
      case SET:
        return "{" + joinExpressions(n.children()) + "}";
      case DICT:
        return "{" + joinExpressions(n.children()) + "}";
      case DICT_ENTRY:
        return expr(n.getFirstChild()) + ": " + expr(n.getSecondChild());
      case LIST_COMP:
        return "[" + comprehension(n) + "]";
      case SET_COMP:
      case DICT_COMP:
        return "{" + comprehension(n) + "}";
      case GENERATOR_EXP:
        return comprehension(n);
      case COMP_FOR:
        {
          StringBuilder sb = new StringBuilder();
          if (n.getBooleanProp(Node.Prop.ASYNC)) {
            sb.append("async ");
          }
          sb.append("for ")
              .append(expr(n.getChildAtIndex(0)))
              .append(" in ")
              .append(expr(n.getChildAtIndex(1)));
          for (int i = 2; i < n.getChildCount(); i++) {
            sb.append(" if ").append(expr(n.getChildAtIndex(i)));
          }
          return sb.toString();
        }
      default:
        throw new IllegalStateException("Unexpected expression " + n);
    }
  }

  private String comprehension(Node n) {
    StringBuilder sb = new StringBuilder(expr(n.getFirstChild()));
    for (int i = 1; i < n.getChildCount(); i++) {
      sb.append(' ').append(expr(n.getChildAtIndex(i)));
    }
    return sb.toString();
  }

  private String fstring(Node n) {
    String opening = n.getString();
    String closing = opening.substring(opening.indexOf(opening.charAt(opening.length() - 1)));
    StringBuilder sb = new StringBuilder(opening);
    for (Node part : n.children()) {
      if (part.getToken() == Token.FSTRING_TEXT) {
        sb.append(part.getString());
      } else {
        String value = expr(part.getOnlyChild());
        sb.append('{');
        if (value.startsWith("{")) {
          sb.append(' ');
        }
        sb.append(value).append(part.getString()).append('}');
      }
    }
    return sb.append(closing).toString();
  }
}
