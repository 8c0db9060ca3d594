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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.pysymphony.ast.Node;
import com.google.pysymphony.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Static helpers for recognizing statement shapes. */
public final class NodeUtil {

  private static final ImmutableSet<String> IMPORT_ERRORS =
      ImmutableSet.of("ImportError", "ModuleNotFoundError");

  private NodeUtil() {}

  /** {@code try: ... except ImportError: ...}, also with ModuleNotFoundError or a tuple of them. */
  public static boolean isFallbackImportBlock(Node n) {
    if (n.getToken() != Token.TRY) {
      return false;
    }
    for (Node handler : n.children()) {
      if (handler.getToken() == Token.EXCEPT && catchesImportError(handler.getFirstChild())) {
        return true;
      }
    }
    return false;
  }

  private static boolean catchesImportError(Node type) {
    switch (type.getToken()) {
      case NAME:
        return IMPORT_ERRORS.contains(type.getString());
      case GETATTR:
        return IMPORT_ERRORS.contains(type.getString())
            && type.getFirstChild().isName()
            && type.getFirstChild().getString().equals("builtins");
      case TUPLE:
        for (Node element : type.children()) {
          if (catchesImportError(element)) {
            return true;
          }
        }
        return false;
      default:
        return false;
    }
  }

  /** {@code if __name__ == "__main__":}, in either operand order. */
  public static boolean isMainGuard(Node n) {
    if (n.getToken() != Token.IF) {
      return false;
    }
    Node test = n.getFirstChild();
    if (test.getToken() != Token.COMPARE || test.getChildCount() != 3) {
      return false;
    }
    if (!test.getSecondChild().getString().equals("==")) {
      return false;
    }
    Node left = test.getFirstChild();
    Node right = test.getLastChild();
    return (isNameNode(left, "__name__") && isMainString(right))
        || (isMainString(left) && isNameNode(right, "__name__"));
  }

  private static boolean isNameNode(Node n, String name) {
    return n.isName() && n.getString().equals(name);
  }

  private static boolean isMainString(Node n) {
    if (n.getToken() != Token.STRING) {
      return false;
    }
    String literal = n.getString();
    return literal.equals("'__main__'") || literal.equals("\"__main__\"");
  }

  /** An expression statement consisting of a plain string literal. */
  public static boolean isDocstring(Node n) {
    if (n.getToken() != Token.EXPR_STMT) {
      return false;
    }
    Token value = n.getFirstChild().getToken();
    return value == Token.STRING || value == Token.STRING_CONCAT;
  }

  /** The docstring of a module or definition body, if its first statement is one. */
  public static @Nullable Node getDocstring(Node body) {
    Node first = body.getFirstChild();
    return first != null && isDocstring(first) ? first : null;
  }

  public static boolean isFutureImport(Node n) {
    return n.getToken() == Token.IMPORT_FROM
        && n.getIntValue() == 0
        && n.getString().equals("__future__");
  }

  public static boolean isImport(Node n) {
    return n.getToken() == Token.IMPORT || n.getToken() == Token.IMPORT_FROM;
  }

  /**
   * An assignment of the form {@code name = __import__('a.b')}, which stands in for a dotted
   * {@code import a.b} whose root package has been renamed.
   */
  public static boolean isImportAssignment(Node n) {
    if (n.getToken() != Token.ASSIGN || n.getChildCount() != 2 || !n.getFirstChild().isName()) {
      return false;
    }
    Node value = n.getLastChild();
    return value.getToken() == Token.CALL
        && value.getChildCount() == 2
        && isNameNode(value.getFirstChild(), "__import__")
        && value.getLastChild().getToken() == Token.STRING;
  }

  /** Builds {@code name = __import__('module')}. */
  public static Node newImportAssignment(String name, String module) {
    Node call =
        new Node(
            Token.CALL,
            Node.newName("__import__"),
            Node.newString(Token.STRING, "'" + module + "'"));
    return new Node(Token.ASSIGN, Node.newName(name).putBooleanProp(Node.Prop.STORE, true), call);
  }

  /**
   * Top-level statements that can be moved into dependency order: function and class definitions
   * and assignments whose targets are plain names.
   */
  public static boolean isDefinitionStatement(Node n) {
    if (isImportAssignment(n)) {
      return false;
    }
    switch (n.getToken()) {
      case FUNCTION_DEF:
      case CLASS_DEF:
        return true;
      case ASSIGN:
        for (int i = 0; i < n.getChildCount() - 1; i++) {
          if (!isNameTarget(n.getChildAtIndex(i))) {
            return false;
          }
        }
        return true;
      case ANN_ASSIGN:
        return n.getFirstChild().isName() && !n.getLastChild().isEmpty();
      default:
        return false;
    }
  }

  private static boolean isNameTarget(Node target) {
    switch (target.getToken()) {
      case NAME:
        return true;
      case TUPLE:
      case LIST:
        for (Node element : target.children()) {
          if (!isNameTarget(element)) {
            return false;
          }
        }
        return true;
      case STARRED:
        return isNameTarget(target.getOnlyChild());
      default:
        return false;
    }
  }

  /**
   * Whether a top-level statement runs as part of its module's initialization rather than being
   * emitted as a definition, an import or a fallback block. The leading docstring and, unless
   * {@code keepMainGuard} is set, the program entry guard are not part of the initialization.
   */
  public static boolean isInitStatement(Node statement, boolean keepMainGuard) {
    if (isDefinitionStatement(statement)
        || isImport(statement)
        || isImportAssignment(statement)
        || isFallbackImportBlock(statement)) {
      return false;
    }
    if (isDocstring(statement) && statement.getParent().getFirstChild() == statement) {
      return false;
    }
    return keepMainGuard || !isMainGuard(statement);
  }

  /** The innermost statement containing {@code n}: the ancestor whose parent is a block. */
  public static @Nullable Node getEnclosingStatement(Node n) {
    for (Node current = n; current.getParent() != null; current = current.getParent()) {
      Token parent = current.getParent().getToken();
      if (parent == Token.SUITE || parent == Token.MODULE) {
        return current;
      }
    }
    return null;
  }

  /** The statement of {@code n} whose parent is the MODULE node, or null. */
  public static @Nullable Node getTopLevelStatement(Node n) {
    for (Node current = n; current.getParent() != null; current = current.getParent()) {
      if (current.getParent().getToken() == Token.MODULE) {
        return current;
      }
    }
    return null;
  }

  /**
   * The segments of a dotted attribute chain such as {@code a.b.c}, root name first, or null if
   * the chain is not rooted at a name.
   */
  public static @Nullable ImmutableList<String> getAttributeChain(Node n) {
    List<String> reversed = new ArrayList<>();
    Node current = n;
    while (current.getToken() == Token.GETATTR) {
      reversed.add(current.getString());
      current = current.getFirstChild();
    }
    if (!current.isName()) {
      return null;
    }
    reversed.add(current.getString());
    return ImmutableList.copyOf(reversed).reverse();
  }

  /** The GETATTR node covering the first {@code length} segments of the chain ending at n. */
  public static Node getChainPrefix(Node n, int length) {
    int total = getAttributeChain(n).size();
    Node current = n;
    for (int i = total; i > length; i--) {
      current = current.getFirstChild();
    }
    return current;
  }

  /** The name node at the root of an attribute chain. */
  public static Node getChainRoot(Node n) {
    Node current = n;
    while (current.getToken() == Token.GETATTR) {
      current = current.getFirstChild();
    }
    return current;
  }

  /** Whether the node is the outermost GETATTR of its chain. */
  public static boolean isOutermostGetattr(Node n) {
    Node parent = n.getParent();
    return n.getToken() == Token.GETATTR
        && (parent == null
            || parent.getToken() != Token.GETATTR
            || parent.getFirstChild() != n);
  }

  /** The name an IMPORT_ALIAS binds: its {@code as} name, or the first segment of the module. */
  public static String getBoundName(Node alias) {
    if (alias.getAlias() != null) {
      return alias.getAlias();
    }
    String name = alias.getString();
    if (alias.getParent() != null && alias.getParent().getToken() == Token.IMPORT) {
      int dot = name.indexOf('.');
      return dot < 0 ? name : name.substring(0, dot);
    }
    return name;
  }

  public static Node newPass() {
    return new Node(Token.PASS);
  }
}
