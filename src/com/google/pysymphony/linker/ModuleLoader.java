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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.pysymphony.ast.Node;
import com.google.pysymphony.ast.Token;
import com.google.pysymphony.parsing.ParseException;
import com.google.pysymphony.parsing.Parser;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Finds, parses and scopes the modules reachable through imports from an entry script, then links
 * every project import alias to the symbol or module it denotes.
 *
 * <p>Absolute imports are looked up under the project root, as {@code a/b.py} or
 * {@code a/b/__init__.py}; a directory without {@code __init__.py} is a namespace package. An
 * absolute import that is not found is an external import and is left to the runtime.
 */
public final class ModuleLoader {
  private static final Logger logger = Logger.getLogger(ModuleLoader.class.getName());

  public static final DiagnosticType WILDCARD_IMPORT =
      DiagnosticType.error(
          "PYS_WILDCARD_IMPORT", "Wildcard import from {0} cannot be linked statically");

  public static final DiagnosticType RELATIVE_IMPORT_BEYOND_ROOT =
      DiagnosticType.error(
          "PYS_RELATIVE_IMPORT_BEYOND_ROOT",
          "Relative import {0} reaches outside the project root");

  public static final DiagnosticType UNRESOLVED_RELATIVE_IMPORT =
      DiagnosticType.error("PYS_UNRESOLVED_RELATIVE_IMPORT", "Cannot find module for {0}");

  public static final DiagnosticType UNRESOLVED_IMPORT_NAME =
      DiagnosticType.warning(
          "PYS_UNRESOLVED_IMPORT_NAME", "Module {0} defines no top-level name {1}");

  public static final DiagnosticType PARSE_ERROR =
      DiagnosticType.error("PYS_PARSE_ERROR", "Syntax error: {0}");

  private static final Splitter DOT_SPLITTER = Splitter.on('.');
  private static final Joiner DOT_JOINER = Joiner.on('.');

  private final MergeContext context;
  private final Path root;

  public ModuleLoader(MergeContext context) {
    this.context = context;
    this.root = context.getProjectRoot();
  }

  /** Loads the module at {@code path} and, transitively, every project module it imports. */
  public ModuleRecord load(Path path) throws IOException {
    try {
      return loadInternal(path.toAbsolutePath().normalize());
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  private ModuleRecord loadInternal(Path path) {
    ModuleRecord existing = context.getModuleByPath(path);
    if (existing != null) {
      return existing;
    }
    String source;
    try {
      source = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    String relativePath = root.relativize(path).toString().replace(File.separatorChar, '/');
    Node ast;
    try {
      ast = Parser.parse(relativePath, source);
    } catch (ParseException e) {
      throw new MergeException(
          PyError.make(
              e.getSourceName(),
              e.getLineNumber(),
              e.getColumnNumber(),
              PARSE_ERROR,
              e.getDetail()));
    }
    String name = moduleNameOf(path);
    boolean isPackage = path.getFileName().toString().equals("__init__.py");
    ModuleRecord record = new ModuleRecord(name, path, relativePath, ast, isPackage);
    context.registerModule(record);
    logger.fine(() -> "Loading " + relativePath + " as module " + describeModule(name));

    SymbolTable table = context.getSymbolTable();
    ScopeBuilder builder = new ScopeBuilder(table, name, new Importer(record), context::report);
    Scope scope = builder.build(ast);
    record.setScope(scope);
    record.setInitSymbol(table.declareModuleInit(scope));
    for (FallbackBlock block : builder.getFallbackBlocks()) {
      record.addFallbackBlock(block);
    }
    context.markLoaded(record);
    return record;
  }

  /**
   * Finds the file of a module.
   *
   * @param moduleName the module as written, possibly empty for {@code from . import x}
   * @param relativeLevel the number of leading dots, zero for an absolute import
   * @param fromFile the importing file
   * @return the module file, or null if the module is not part of the project
   * @throws ModuleResolutionException if a relative import walks out of the project root
   */
  public @Nullable Path resolve(String moduleName, int relativeLevel, Path fromFile) {
    ModuleRecord from = context.getModuleByPath(fromFile.toAbsolutePath().normalize());
    String packageName =
        from != null ? from.getPackageName() : packageOf(moduleNameOf(fromFile), fromFile);
    return findModuleFile(absoluteModuleName(moduleName, relativeLevel, packageName, null));
  }

  private static String packageOf(String moduleName, Path file) {
    if (file.getFileName().toString().equals("__init__.py")) {
      return moduleName;
    }
    int dot = moduleName.lastIndexOf('.');
    return dot < 0 ? "" : moduleName.substring(0, dot);
  }

  /** The dotted name a relative import refers to, given the package of the importing module. */
  private static String absoluteModuleName(
      String moduleName, int level, String packageName, @Nullable Node where) {
    if (level == 0) {
      return moduleName;
    }
    List<String> parts =
        packageName.isEmpty()
            ? new ArrayList<>()
            : new ArrayList<>(DOT_SPLITTER.splitToList(packageName));
    for (int i = 1; i < level; i++) {
      if (parts.isEmpty()) {
        String text = ".".repeat(level) + moduleName;
        PyError error =
            where != null
                ? PyError.make(where, RELATIVE_IMPORT_BEYOND_ROOT, text)
                : PyError.make(RELATIVE_IMPORT_BEYOND_ROOT, text);
        throw new ModuleResolutionException(error);
      }
      parts.remove(parts.size() - 1);
    }
    if (!moduleName.isEmpty()) {
      parts.add(moduleName);
    }
    return DOT_JOINER.join(parts);
  }

  /** The dotted module name of a project file, dropping a trailing {@code __init__}. */
  public String moduleNameOf(Path file) {
    Path relative = root.relativize(file.toAbsolutePath().normalize());
    List<String> parts = new ArrayList<>();
    for (Path part : relative) {
      parts.add(part.toString());
    }
    String last = parts.remove(parts.size() - 1);
    if (last.endsWith(".py")) {
      last = last.substring(0, last.length() - 3);
    }
    if (!last.equals("__init__")) {
      parts.add(last);
    }
    return DOT_JOINER.join(parts);
  }

  private @Nullable Path findModuleFile(String moduleName) {
    if (moduleName.isEmpty()) {
      return null;
    }
    Path base = root.resolve(moduleName.replace('.', File.separatorChar));
    Path file = base.resolveSibling(base.getFileName() + ".py");
    if (Files.isRegularFile(file)) {
      return file;
    }
    Path init = base.resolve("__init__.py");
    return Files.isRegularFile(init) ? init : null;
  }

  private boolean isNamespacePackage(String moduleName) {
    return !moduleName.isEmpty()
        && Files.isDirectory(root.resolve(moduleName.replace('.', File.separatorChar)));
  }

  /** Whether a dotted name denotes a module or package of the project. */
  public boolean isProjectModule(String moduleName) {
    return findModuleFile(moduleName) != null || isNamespacePackage(moduleName);
  }

  /** Loads {@code a}, {@code a.b} and {@code a.b.c} for {@code a.b.c}, as the runtime would. */
  private void loadWithParents(String moduleName) {
    if (moduleName.isEmpty()) {
      return;
    }
    List<String> parts = DOT_SPLITTER.splitToList(moduleName);
    for (int i = 1; i <= parts.size(); i++) {
      Path file = findModuleFile(DOT_JOINER.join(parts.subList(0, i)));
      if (file != null) {
        loadInternal(file.toAbsolutePath().normalize());
      }
    }
  }

  /**
   * Binds every from-import alias of a project module to the symbol it imports, or to a
   * submodule. Runs after all modules are loaded so that import cycles see complete scopes.
   */
  public void link() {
    int linked = 0;
    for (Symbol symbol : context.getSymbolTable().getSymbols()) {
      ImportBinding binding = symbol.getImportBinding();
      if (binding == null || !binding.isInternal()) {
        continue;
      }
      if (!binding.isFromImport()) {
        Node alias = symbol.getDeclarationNode();
        String module = binding.resolvedModule();
        symbol.setTargetModule(
            alias.getAlias() != null ? module : DOT_SPLITTER.splitToList(module).get(0));
        linked++;
        continue;
      }
      String submodule = SymbolTable.qualify(binding.resolvedModule(), binding.importedName());
      ModuleRecord module = context.getModule(binding.resolvedModule());
      Symbol target = module == null ? null : module.getScope().getSlot(binding.importedName());
      if (target != null && !isSubmoduleImport(target, submodule)) {
        symbol.setAliasTarget(target);
        linked++;
      } else if (isProjectModule(submodule)) {
        symbol.setTargetModule(submodule);
        linked++;
      } else if (symbol.isInFallbackBlock()) {
        logger.fine(() -> "Fallback import of " + submodule + " left to the runtime");
      } else {
        context.report(
            PyError.make(
                symbol.getDeclarationNode(),
                UNRESOLVED_IMPORT_NAME,
                describeModule(binding.resolvedModule()),
                binding.importedName()));
      }
    }
    int count = linked;
    logger.fine(() -> "Linked " + count + " project import aliases");
  }

  /** Whether {@code target} is itself an import of the module {@code submodule}. */
  private static boolean isSubmoduleImport(Symbol target, String submodule) {
    ImportBinding binding = target.getImportBinding();
    if (binding == null || !binding.isInternal()) {
      return false;
    }
    String imported =
        binding.isFromImport()
            ? SymbolTable.qualify(binding.resolvedModule(), binding.importedName())
            : binding.resolvedModule();
    return imported.equals(submodule);
  }

  private static String describeModule(String name) {
    return name.isEmpty() ? "<root>" : name;
  }

  /** Records the imports of one module, loading the project modules they name. */
  private final class Importer implements ScopeBuilder.ImportHandler {
    private final ModuleRecord record;

    Importer(ModuleRecord record) {
      this.record = record;
    }

    @Override
    public void onImport(Node alias, Symbol symbol, boolean inFallbackBlock) {
      Node statement = alias.getParent();
      ImportBinding binding;
      if (statement.getToken() == Token.IMPORT) {
        String name = alias.getString();
        if (isProjectModule(name)) {
          loadWithParents(name);
          binding = new ImportBinding(name, 0, null, name, false);
        } else {
          binding = new ImportBinding(name, 0, null, null, false);
        }
      } else {
        binding = bindFromImport(statement, alias, inFallbackBlock);
      }
      symbol.setImportBinding(binding);
    }

    private ImportBinding bindFromImport(Node statement, Node alias, boolean inFallbackBlock) {
      String module = statement.getString();
      int level = statement.getIntValue();
      String imported = alias.getString();
      String absolute;
      try {
        absolute = absoluteModuleName(module, level, record.getPackageName(), alias);
      } catch (ModuleResolutionException e) {
        if (!inFallbackBlock) {
          throw e;
        }
        logger.fine(() -> "Giving up on fallback import: " + e.getMessage());
        return new ImportBinding(module, level, imported, null, true);
      }
      if (isProjectModule(absolute) || (absolute.isEmpty() && isProjectModule(imported))) {
        loadWithParents(absolute);
        String submodule = SymbolTable.qualify(absolute, imported);
        if (isProjectModule(submodule)) {
          loadWithParents(submodule);
        }
        return new ImportBinding(module, level, imported, absolute, false);
      }
      if (level > 0) {
        ImportBinding missing = new ImportBinding(module, level, imported, null, true);
        if (!inFallbackBlock) {
          throw new ModuleResolutionException(
              PyError.make(alias, UNRESOLVED_RELATIVE_IMPORT, missing.describe()));
        }
        return missing;
      }
      return new ImportBinding(module, 0, imported, null, false);
    }

    @Override
    public void onWildcardImport(Node alias) {
      Node statement = alias.getParent();
      throw new UnsupportedFeatureException(
          PyError.make(
              alias,
              WILDCARD_IMPORT,
              ".".repeat(statement.getIntValue()) + statement.getString()));
    }

    @Override
    public void onFutureImport(Node importFrom) {
      for (Node alias : importFrom.children()) {
        record.addFutureFeature(alias.getString());
      }
    }
  }
}
