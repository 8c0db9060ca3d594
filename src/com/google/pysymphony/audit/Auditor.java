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

package com.google.pysymphony.audit;

import com.google.common.collect.ImmutableList;
import com.google.pysymphony.ast.Node;
import com.google.pysymphony.ast.Token;
import com.google.pysymphony.linker.BuiltinNames;
import com.google.pysymphony.linker.DependencyAnalyzer;
import com.google.pysymphony.linker.DiagnosticType;
import com.google.pysymphony.linker.NodeTraversal;
import com.google.pysymphony.linker.NodeUtil;
import com.google.pysymphony.linker.PyError;
import com.google.pysymphony.linker.Scope;
import com.google.pysymphony.linker.ScopeBuilder;
import com.google.pysymphony.linker.Symbol;
import com.google.pysymphony.linker.SymbolTable;
import com.google.pysymphony.parsing.ParseException;
import com.google.pysymphony.parsing.Parser;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Checks a merged program on its own, without access to the project it was built from.
 *
 * <p>The program is parsed and scoped like any module. The audit then reports top-level
 * definitions that replace an earlier one and top-level imports that rebind a name. It also
 * reports names that resolve to neither a binding nor a builtin, and more than one
 * {@code if __name__ == "__main__"} guard. Findings never stop the audit; every one of them is
 * returned.
 */
public final class Auditor {

  private static final Logger logger = Logger.getLogger(Auditor.class.getName());

  public static final DiagnosticType UNDEFINED_REFERENCE =
      DiagnosticType.warning("PYS_UNDEFINED_REFERENCE", "{0} is not defined");

  public static final DiagnosticType MULTIPLE_MAIN_GUARDS =
      DiagnosticType.warning(
          "PYS_MULTIPLE_MAIN_GUARDS", "Program entry guard number {0}, only one is expected");

  public static final DiagnosticType DUPLICATE_IMPORT =
      DiagnosticType.warning(
          "PYS_DUPLICATE_IMPORT", "Top-level import rebinds {0}, already bound on line {1}");

  public static final DiagnosticType AUDIT_SYNTAX_ERROR =
      DiagnosticType.error("PYS_AUDIT_SYNTAX_ERROR", "Merged program does not parse: {0}");

  private static final String DEFAULT_SOURCE_NAME = "<merged>";

  /** No project imports exist in a merged program, so imports need no resolution. */
  private static final ScopeBuilder.ImportHandler IGNORE_IMPORTS =
      new ScopeBuilder.ImportHandler() {
        @Override
        public void onImport(Node alias, Symbol symbol, boolean inFallbackBlock) {}

        @Override
        public void onWildcardImport(Node alias) {}

        @Override
        public void onFutureImport(Node importFrom) {}
      };

  public AuditResult audit(String code) {
    return audit(DEFAULT_SOURCE_NAME, code);
  }

  public AuditResult audit(String sourceName, String code) {
    Node root;
    try {
      root = Parser.parse(sourceName, code);
    } catch (ParseException e) {
      return AuditResult.of(
          ImmutableList.of(
              PyError.make(
                  e.getSourceName(),
                  e.getLineNumber(),
                  e.getColumnNumber(),
                  AUDIT_SYNTAX_ERROR,
                  e.getDetail())));
    }

    List<PyError> diagnostics = new ArrayList<>();
    SymbolTable table = new SymbolTable();
    Scope moduleScope =
        new ScopeBuilder(table, "", IGNORE_IMPORTS, diagnostics::add).build(root);
    NodeTraversal.traverse(table, root, moduleScope, new ReferenceChecker(table, diagnostics));

    int guards = 0;
    for (Node statement : root.children()) {
      if (NodeUtil.isMainGuard(statement) && ++guards > 1) {
        diagnostics.add(PyError.make(statement, MULTIPLE_MAIN_GUARDS, String.valueOf(guards)));
      }
    }

    checkImportRebinding(root, diagnostics);

    diagnostics.sort(Comparator.comparingInt(PyError::lineno).thenComparingInt(PyError::charno));
    logger.fine(() -> "Audit of " + sourceName + " found " + diagnostics.size() + " problems");
    return AuditResult.of(ImmutableList.copyOf(diagnostics));
  }

  /**
   * Reports top-level imports of a name that an earlier top-level definition or import already
   * binds. Names also imported by a fallback import block are exempt.
   */
  private static void checkImportRebinding(Node root, List<PyError> diagnostics) {
    Set<String> fallbackNames = new HashSet<>();
    for (Node statement : root.children()) {
      if (NodeUtil.isFallbackImportBlock(statement)) {
        collectImportedNames(statement, fallbackNames);
      }
    }
    Map<String, Node> bound = new HashMap<>();
    for (Node statement : root.children()) {
      switch (statement.getToken()) {
        case FUNCTION_DEF:
        case CLASS_DEF:
          bound.putIfAbsent(statement.getString(), statement);
          break;
        case IMPORT:
        case IMPORT_FROM:
          if (NodeUtil.isFutureImport(statement)) {
            break;
          }
          for (Node alias : statement.children()) {
            String name = NodeUtil.getBoundName(alias);
            if (name.equals("*") || fallbackNames.contains(name)) {
              continue;
            }
            Node previous = bound.putIfAbsent(name, alias);
            if (previous != null) {
              diagnostics.add(
                  PyError.make(
                      alias, DUPLICATE_IMPORT, name, String.valueOf(previous.getLineno())));
            }
          }
          break;
        default:
          break;
      }
    }
  }

  private static void collectImportedNames(Node n, Set<String> names) {
    if (NodeUtil.isImport(n)) {
      for (Node alias : n.children()) {
        names.add(NodeUtil.getBoundName(alias));
      }
      return;
    }
    for (Node child : n.children()) {
      collectImportedNames(child, names);
    }
  }

  private static final class ReferenceChecker extends NodeTraversal.AbstractPostOrderCallback {
    private final SymbolTable table;
    private final List<PyError> diagnostics;

    ReferenceChecker(SymbolTable table, List<PyError> diagnostics) {
      this.table = table;
      this.diagnostics = diagnostics;
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      if (n.getToken() != Token.NAME || !DependencyAnalyzer.isLoad(n, parent)) {
        return;
      }
      String name = n.getString();
      if (table.lookup(t.getScope(), name) == null && !BuiltinNames.isBuiltin(name)) {
        diagnostics.add(PyError.make(n, UNDEFINED_REFERENCE, name));
      }
    }
  }
}
