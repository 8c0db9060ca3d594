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
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Merges a Python entry script and the project modules it imports into a single self-contained
 * script.
 *
 * <p>Each call to {@link #merge} owns a fresh {@link MergeContext}: the same merger can be reused
 * and the output depends only on the files on disk. Fatal problems are thrown as {@link
 * MergeException}s; advisory diagnostics go to the {@link ErrorManager}.
 */
public final class PyMerger {

  private static final Logger logger = Logger.getLogger(PyMerger.class.getName());

  public static final DiagnosticType ENTRY_OUTSIDE_ROOT =
      DiagnosticType.error(
          "PYS_ENTRY_OUTSIDE_ROOT", "Entry script {0} is not inside the project root {1}");

  private final MergeOptions options;
  private final ErrorManager errorManager;

  public PyMerger() {
    this(new MergeOptions(), TextErrorReportGenerator.forLogger(logger).newErrorManager());
  }

  public PyMerger(MergeOptions options, ErrorManager errorManager) {
    this.options = options;
    this.errorManager = errorManager;
  }

  public MergeOptions getOptions() {
    return options;
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /**
   * Merges {@code entryFile} with every project module it transitively needs.
   *
   * @param entryFile the script whose top-level code the merged program runs
   * @param projectRoot the directory that absolute project imports are resolved against
   * @return the merged program text
   * @throws NoSuchFileException if the entry script or the project root does not exist
   * @throws IOException if a module cannot be read
   * @throws UnsupportedFeatureException on a wildcard import
   * @throws CircularDependencyException if the needed definitions cannot be ordered
   * @throws MergeException on any other fatal linking problem
   */
  public String merge(Path entryFile, Path projectRoot) throws IOException {
    Path root = projectRoot.toAbsolutePath().normalize();
    Path entry = entryFile.toAbsolutePath().normalize();
    if (!Files.isDirectory(root)) {
      throw new NoSuchFileException(root.toString(), null, "project root is not a directory");
    }
    if (!Files.isRegularFile(entry)) {
      throw new NoSuchFileException(entry.toString());
    }
    if (!entry.startsWith(root)) {
      throw new ModuleResolutionException(
          PyError.make(ENTRY_OUTSIDE_ROOT, entry.toString(), root.toString()));
    }

    MergeContext context = new MergeContext(root, options, errorManager);
    ModuleLoader loader = new ModuleLoader(context);
    context.setEntryModule(loader.load(entry));
    loader.link();
    logger.fine(() -> "Loaded " + context.getModules().size() + " modules");

    new DependencyAnalyzer(context).analyze();
    ImmutableSet<Symbol> included = new SymbolClosure(context).computeFromEntry();
    ImmutableList<Symbol> order = new DependencyOrderer(context).order(included);
    logger.fine(() -> included.size() + " symbols needed, " + order.size() + " definitions");

    String output = new BundleEmitter(context).emit(included, order);
    logger.info(
        () ->
            "Merged "
                + context.getModules().size()
                + " modules from "
                + context.getEntryModule().getRelativePath());
    return output;
  }
}
