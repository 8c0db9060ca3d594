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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The state of one {@link PyMerger#merge} call: options, diagnostics, the symbol table and the
 * registry of loaded modules. Nothing here outlives the call.
 */
public final class MergeContext {
  private final Path projectRoot;
  private final MergeOptions options;
  private final ErrorManager errorManager;
  private final SymbolTable symbolTable = new SymbolTable();
  private final Map<Path, ModuleRecord> modulesByPath = new HashMap<>();
  private final Map<String, ModuleRecord> modulesByName = new LinkedHashMap<>();
  private final Set<String> packageNames = new HashSet<>();
  private final List<ModuleRecord> completionOrder = new ArrayList<>();
  private @Nullable ModuleRecord entryModule;

  public MergeContext(Path projectRoot, MergeOptions options, ErrorManager errorManager) {
    this.projectRoot = projectRoot.toAbsolutePath().normalize();
    this.options = options;
    this.errorManager = errorManager;
  }

  public Path getProjectRoot() {
    return projectRoot;
  }

  public MergeOptions getOptions() {
    return options;
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  public SymbolTable getSymbolTable() {
    return symbolTable;
  }

  /** Reports a diagnostic at the level configured in the options, or its default level. */
  public void report(PyError error) {
    CheckLevel level = options.getWarningLevel(error.type());
    if (level == null) {
      level = error.defaultLevel();
    }
    if (level.isOn()) {
      errorManager.report(level, error);
    }
  }

  void registerModule(ModuleRecord record) {
    modulesByPath.put(record.getPath(), record);
    modulesByName.put(record.getName(), record);
    String name = record.getName();
    for (int dot = name.indexOf('.'); dot >= 0; dot = name.indexOf('.', dot + 1)) {
      packageNames.add(name.substring(0, dot));
    }
  }

  void markLoaded(ModuleRecord record) {
    record.setCompletionIndex(completionOrder.size());
    completionOrder.add(record);
  }

  public @Nullable ModuleRecord getModuleByPath(Path path) {
    return modulesByPath.get(path);
  }

  public @Nullable ModuleRecord getModule(String name) {
    return modulesByName.get(name);
  }

  /** Whether a dotted name is a loaded module or a package containing one. */
  public boolean isKnownModule(String name) {
    return modulesByName.containsKey(name) || packageNames.contains(name);
  }

  public @Nullable ModuleRecord getModuleOf(Symbol symbol) {
    return modulesByName.get(symbol.getModuleName());
  }

  /** Loaded modules in the order in which their loading finished. */
  public ImmutableList<ModuleRecord> getModules() {
    return ImmutableList.copyOf(completionOrder);
  }

  public ModuleRecord getEntryModule() {
    checkState(entryModule != null, "entry module not loaded");
    return entryModule;
  }

  void setEntryModule(ModuleRecord entryModule) {
    this.entryModule = entryModule;
  }
}
