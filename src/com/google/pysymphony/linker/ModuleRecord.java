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
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Everything the linker knows about one loaded source file. */
public final class ModuleRecord {
  private final String name;
  private final Path path;
  private final String relativePath;
  private final Node root;
  private final boolean isPackage;
  private Scope scope;
  private Symbol initSymbol;
  private int completionIndex = -1;
  private final List<FallbackBlock> fallbackBlocks = new ArrayList<>();
  private final Set<String> futureFeatures = new LinkedHashSet<>();

  ModuleRecord(String name, Path path, String relativePath, Node root, boolean isPackage) {
    this.name = name;
    this.path = path;
    this.relativePath = relativePath;
    this.root = root;
    this.isPackage = isPackage;
  }

  /** The dotted module name relative to the project root, empty for a root package. */
  public String getName() {
    return name;
  }

  public Path getPath() {
    return path;
  }

  /** The path relative to the project root, with forward slashes. */
  public String getRelativePath() {
    return relativePath;
  }

  public Node getRoot() {
    return root;
  }

  /** Whether this is the {@code __init__.py} of a package. */
  public boolean isPackage() {
    return isPackage;
  }

  /** The package that relative imports in this module are resolved against. */
  public String getPackageName() {
    if (isPackage) {
      return name;
    }
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(0, dot);
  }

  public Scope getScope() {
    return scope;
  }

  void setScope(Scope scope) {
    this.scope = scope;
  }

  public Symbol getInitSymbol() {
    return initSymbol;
  }

  void setInitSymbol(Symbol initSymbol) {
    this.initSymbol = initSymbol;
  }

  /** The position of this module in the order in which modules finished loading. */
  public int getCompletionIndex() {
    return completionIndex;
  }

  void setCompletionIndex(int completionIndex) {
    this.completionIndex = completionIndex;
  }

  public boolean isLoaded() {
    return completionIndex >= 0;
  }

  public ImmutableList<FallbackBlock> getFallbackBlocks() {
    return ImmutableList.copyOf(fallbackBlocks);
  }

  void addFallbackBlock(FallbackBlock block) {
    fallbackBlocks.add(block);
  }

  public ImmutableSet<String> getFutureFeatures() {
    return ImmutableSet.copyOf(futureFeatures);
  }

  void addFutureFeature(String feature) {
    futureFeatures.add(feature);
  }

  @Override
  public String toString() {
    return "ModuleRecord(" + (name.isEmpty() ? "<root>" : name) + ")";
  }
}
