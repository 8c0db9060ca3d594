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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Sets;
import com.google.pysymphony.ast.Node;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Lays out the merged program.
 *
 * <p>The output consists of the entry docstring, the {@code __future__} imports, the library
 * imports of every included module, then the body: fallback-import blocks, project definitions in
 * dependency order, the initialization code of the imported modules in the order they finished
 * loading and finally the entry script's own top-level code.
 *
 * <p>A module that is only loaded from a fallback arm goes inside that arm instead, in front of
 * the import that loads it, so that a failure while loading it still selects another arm.
 */
final class BundleEmitter {

  private static final Logger logger = Logger.getLogger(BundleEmitter.class.getName());

  /**
   * A top-level statement of the output together with the module it comes from. Consecutive
   * statements of the same run are printed without a blank line between them.
   */
  private record Emitted(
      Node statement, ModuleRecord module, @Nullable String comment, @Nullable Object run) {

    static Emitted definition(Node statement, ModuleRecord module, @Nullable String comment) {
      return new Emitted(statement, module, comment, null);
    }
  }

  /** The code of a module emitted inside a fallback arm. */
  private static final class GuardedSection {
    final ModuleRecord module;
    final Node host;
    final List<Node> libraryAliases = new ArrayList<>();
    final List<Emitted> importAssignments = new ArrayList<>();
    final List<Emitted> fallbackBlocks = new ArrayList<>();
    final List<Emitted> inits = new ArrayList<>();
    final List<Emitted> body = new ArrayList<>();

    GuardedSection(ModuleRecord module, Node host) {
      this.module = module;
      this.host = host;
    }
  }

  private final MergeContext context;
  private final SymbolTable table;
  private final boolean emitSourceComments;

  private @Nullable Node docstring;
  private final Set<String> futureFeatures = new TreeSet<>();
  private final List<Node> hoistedAliases = new ArrayList<>();
  private final List<Emitted> importAssignments = new ArrayList<>();
  private final List<Emitted> fallbackBlocks = new ArrayList<>();
  private final List<Emitted> moduleInits = new ArrayList<>();
  private final List<Emitted> entryStatements = new ArrayList<>();
  private final Map<ModuleRecord, GuardedSection> sections = new LinkedHashMap<>();
  private Set<Node> deferred = ImmutableSet.of();

  BundleEmitter(MergeContext context) {
    this.context = context;
    this.table = context.getSymbolTable();
    this.emitSourceComments = context.getOptions().shouldEmitSourceComments();
  }

  /**
   * Emits the program made of {@code included}, with the definitions in {@code order}.
   *
   * @param included the symbol closure of the entry script
   * @param order the definitions to emit, dependencies first
   */
  String emit(Set<Symbol> included, List<Symbol> order) {
    ModuleRecord entry = context.getEntryModule();
    ImmutableMap<ModuleRecord, Node> hosts = new GuardedModules(context).find(included);
    for (ModuleRecord module : context.getModules()) {
      if (hosts.containsKey(module)) {
        sections.put(module, new GuardedSection(module, hosts.get(module)));
      }
    }
    deferred = new DeferredDefinitions(context).find(included);
    for (ModuleRecord module : context.getModules()) {
      if (module == entry || included.contains(module.getInitSymbol())) {
        collectTopLevel(module, module == entry, included);
      }
    }
    List<Emitted> body = layOutBody(order);

    ImmutableMap.Builder<Node, ModuleRecord> statements = ImmutableMap.builder();
    List<Emitted> everything = new ArrayList<>(importAssignments);
    everything.addAll(body);
    for (GuardedSection section : sections.values()) {
      everything.addAll(section.importAssignments);
      everything.addAll(section.body);
    }
    for (Emitted emitted : everything) {
      statements.put(emitted.statement(), emitted.module());
    }
    List<Symbol> hoistedSymbols = new ArrayList<>();
    for (Node alias : hoistedAliases) {
      hoistedSymbols.add(table.getDeclaredSymbol(alias));
    }
    for (GuardedSection section : sections.values()) {
      for (Node alias : section.libraryAliases) {
        hoistedSymbols.add(table.getDeclaredSymbol(alias));
      }
    }
    NameMapping mapping =
        new NameResolver(context, statements.buildOrThrow(), hoistedSymbols).resolve();
    logger.fine(() -> "Emitted names: " + mapping);

    ReferenceRewriter rewriter = new ReferenceRewriter(context, mapping);
    Map<Node, Node> placeholders = new LinkedHashMap<>();
    for (GuardedSection section : sections.values()) {
      placeholders.computeIfAbsent(section.host, BundleEmitter::insertPlaceholder);
    }
    for (Emitted emitted : everything) {
      rewriter.rewrite(emitted.statement(), emitted.module());
    }
    for (GuardedSection section : sections.values()) {
      nestSection(section, placeholders.get(section.host), rewriter);
    }
    for (Node placeholder : placeholders.values()) {
      if (placeholder.getParent().getChildCount() > 1) {
        placeholder.detach();
      }
    }

    List<String> parts = new ArrayList<>();
    if (docstring != null) {
      parts.add(CodePrinter.print(docstring));
    }

    StringBuilder imports = new StringBuilder();
    for (String feature : futureFeatures) {
      imports.append("from __future__ import ").append(feature).append('\n');
    }
    Set<String> importLines = new LinkedHashSet<>();
    for (Node alias : hoistedAliases) {
      for (Node statement : rewriter.rewriteHoistedImport(alias)) {
        importLines.add(CodePrinter.print(statement));
      }
    }
    for (Emitted emitted : importAssignments) {
      importLines.add(CodePrinter.print(emitted.statement()));
    }
    importLines.forEach(imports::append);
    if (imports.length() > 0) {
      parts.add(imports.toString());
    }

    StringBuilder chunks = new StringBuilder();
    Emitted previous = null;
    for (Emitted emitted : body) {
      if (previous != null
          && (emitted.run() == null || !emitted.run().equals(previous.run()))) {
        chunks.append('\n');
      }
      if (emitted.comment() != null) {
        chunks.append(emitted.comment()).append('\n');
      }
      chunks.append(CodePrinter.print(emitted.statement()));
      previous = emitted;
    }
    if (chunks.length() > 0) {
      parts.add(chunks.toString());
    }
    logger.fine(
        () ->
            "Emitted "
                + body.size()
                + " statements, "
                + importLines.size()
                + " library imports and "
                + sections.size()
                + " modules inside fallback arms");
    return String.join("\n", parts);
  }

  /** Marks where the guarded modules loaded by {@code host} go, before it is rewritten. */
  private static Node insertPlaceholder(Node host) {
    Node placeholder = NodeUtil.newPass().srcref(host);
    host.getParent().addChildBefore(placeholder, host);
    return placeholder;
  }

  /** Moves the rewritten code of a guarded module in front of {@code placeholder}. */
  private void nestSection(GuardedSection section, Node placeholder, ReferenceRewriter rewriter) {
    Node suite = placeholder.getParent();
    Set<String> seen = new HashSet<>();
    for (Node alias : section.libraryAliases) {
      for (Node statement : rewriter.rewriteHoistedImport(alias)) {
        if (seen.add(CodePrinter.print(statement))) {
          suite.addChildBefore(statement, placeholder);
        }
      }
    }
    for (Emitted emitted : Iterables.concat(section.importAssignments, section.body)) {
      suite.addChildBefore(emitted.statement().detach(), placeholder);
    }
  }

  private void collectTopLevel(ModuleRecord module, boolean isEntry, Set<Symbol> included) {
    Node root = module.getRoot();
    Node moduleDocstring = NodeUtil.getDocstring(root);
    if (isEntry && moduleDocstring != null && context.getOptions().shouldPreserveEntryDocstring()) {
      docstring = moduleDocstring;
    }
    GuardedSection section = sections.get(module);
    boolean firstInit = true;
    for (Node statement : root.children()) {
      if (NodeUtil.isFutureImport(statement)) {
        for (Node alias : statement.children()) {
          futureFeatures.add(alias.getString());
        }
      } else if (NodeUtil.isImport(statement)) {
        for (Node alias : statement.children()) {
          Symbol symbol = table.getDeclaredSymbol(alias);
          if (symbol != null && symbol.isExternalAlias() && included.contains(symbol)) {
            (section == null ? hoistedAliases : section.libraryAliases).add(alias);
          }
        }
      } else if (NodeUtil.isImportAssignment(statement)) {
        Symbol symbol = table.getDeclaredSymbol(statement.getFirstChild());
        if (symbol != null && included.contains(symbol)) {
          (section == null ? importAssignments : section.importAssignments)
              .add(Emitted.definition(statement, module, null));
        }
      } else if (NodeUtil.isFallbackImportBlock(statement)) {
        if (bindsAny(statement, included) && section == null) {
          fallbackBlocks.add(Emitted.definition(statement, module, commentFor(module)));
        } else if (bindsAny(statement, included)) {
          section.fallbackBlocks.add(Emitted.definition(statement, module, null));
        }
      } else if (NodeUtil.isInitStatement(statement, isEntry) || deferred.contains(statement)) {
        if (section != null) {
          section.inits.add(new Emitted(statement, module, null, module));
        } else if (isEntry) {
          entryStatements.add(new Emitted(statement, module, null, module));
        } else {
          String comment = firstInit ? commentFor(module) : null;
          moduleInits.add(new Emitted(statement, module, comment, module));
          firstInit = false;
        }
      }
    }
  }

  private boolean bindsAny(Node n, Set<Symbol> included) {
    Symbol symbol = table.getDeclaredSymbol(n);
    if (symbol != null
        && table.getScopeOf(symbol).isModuleScope()
        && included.contains(symbol)) {
      return true;
    }
    for (Node child : n.children()) {
      if (bindsAny(child, included)) {
        return true;
      }
    }
    return false;
  }

  private List<Emitted> layOutBody(List<Symbol> order) {
    List<Symbol> topLevel = new ArrayList<>();
    ListMultimap<GuardedSection, Symbol> guardedUnits = ArrayListMultimap.create();
    for (Symbol unit : order) {
      if (!table.getScopeOf(unit).isModuleScope()) {
        continue;
      }
      GuardedSection section = sections.get(context.getModuleOf(unit));
      if (section == null) {
        topLevel.add(unit);
      } else {
        guardedUnits.put(section, unit);
      }
    }
    for (GuardedSection section : sections.values()) {
      section.body.addAll(arrange(guardedUnits.get(section), section.fallbackBlocks, false));
      section.body.addAll(section.inits);
    }

    List<Emitted> body = arrange(topLevel, fallbackBlocks, emitSourceComments);
    body.addAll(moduleInits);
    body.addAll(entryStatements);
    return body;
  }

  /**
   * Emits the definition statements of {@code units} in order, each fallback block following the
   * last definition it depends on.
   */
  private List<Emitted> arrange(List<Symbol> units, List<Emitted> blocks, boolean withComments) {
    Map<Symbol, Integer> positions = new HashMap<>();
    for (int i = 0; i < units.size(); i++) {
      positions.put(units.get(i), i);
    }
    List<Emitted> body = new ArrayList<>();
    ListMultimap<Integer, Emitted> blocksAfter = ArrayListMultimap.create();
    for (Emitted block : blocks) {
      int position = lastDependencyPosition(block.statement(), positions);
      if (position < 0) {
        body.add(block);
      } else {
        blocksAfter.put(position, block);
      }
    }

    Set<Node> emitted = Sets.newIdentityHashSet();
    for (int i = 0; i < units.size(); i++) {
      Symbol unit = units.get(i);
      ModuleRecord module = checkNotNull(context.getModuleOf(unit), "no module for %s", unit);
      for (Node statement : table.getDefinitionStatements(unit)) {
        if (!deferred.contains(statement) && emitted.add(statement)) {
          String comment = withComments ? commentFor(module) : null;
          body.add(Emitted.definition(statement, module, comment));
        }
      }
      body.addAll(blocksAfter.get(i));
    }
    return body;
  }

  /**
   * The position of the last definition a fallback block depends on, so that a block importing
   * project definitions runs after them. Returns -1 if the block depends on no definition. The
   * code of the guarded modules the block loads counts as part of the block.
   */
  private int lastDependencyPosition(Node block, Map<Symbol, Integer> positions) {
    int last = -1;
    for (Symbol symbol : symbolsRunBy(block)) {
      for (Symbol dependency : symbol.getDependencies()) {
        Integer position = positions.get(topLevelOf(dependency));
        if (position != null) {
          last = Math.max(last, position);
        }
      }
    }
    return last;
  }

  private Set<Symbol> symbolsRunBy(Node block) {
    Set<Symbol> symbols = new LinkedHashSet<>(declaredIn(block));
    for (GuardedSection section : sections.values()) {
      if (isAncestor(block, section.host)) {
        symbols.add(section.module.getInitSymbol());
        symbols.addAll(section.module.getScope().getSymbols());
        for (Emitted nested : section.fallbackBlocks) {
          symbols.addAll(symbolsRunBy(nested.statement()));
        }
      }
    }
    return symbols;
  }

  private static boolean isAncestor(Node ancestor, Node n) {
    for (Node current = n; current != null; current = current.getParent()) {
      if (current == ancestor) {
        return true;
      }
    }
    return false;
  }

  private ImmutableList<Symbol> declaredIn(Node root) {
    ImmutableList.Builder<Symbol> symbols = ImmutableList.builder();
    List<Node> pending = new ArrayList<>();
    pending.add(root);
    while (!pending.isEmpty()) {
      Node n = pending.remove(pending.size() - 1);
      Symbol symbol = table.getDeclaredSymbol(n);
      if (symbol != null) {
        symbols.add(symbol);
      }
      pending.addAll(n.children());
    }
    return symbols.build();
  }

  private Symbol topLevelOf(Symbol symbol) {
    Symbol current = symbol;
    while (!table.getScopeOf(current).isModuleScope()) {
      Symbol owner = table.getOwnerSymbol(table.getScopeOf(current));
      if (owner == null) {
        break;
      }
      current = owner;
    }
    return current;
  }

  private @Nullable String commentFor(ModuleRecord module) {
    return emitSourceComments ? "# From " + module.getRelativePath() : null;
  }
}
