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
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.rules.TemporaryFolder;

/** A throwaway Python project on disk, for tests that load modules. */
final class ProjectFixture {
  private final TemporaryFolder folder;

  ProjectFixture(TemporaryFolder folder) {
    this.folder = folder;
  }

  Path root() {
    return folder.getRoot().toPath().toAbsolutePath().normalize();
  }

  Path path(String relativePath) {
    return root().resolve(relativePath);
  }

  @CanIgnoreReturnValue
  Path write(String relativePath, String... lines) throws IOException {
    Path file = path(relativePath);
    Files.createDirectories(file.getParent());
    Files.writeString(file, lines(lines), StandardCharsets.UTF_8);
    return file;
  }

  /** Loads and links {@code entry} and everything it imports into a fresh context. */
  MergeContext load(String entry) throws IOException {
    return load(entry, new SortingErrorManager(ImmutableSet.of()));
  }

  MergeContext load(String entry, ErrorManager errorManager) throws IOException {
    return load(entry, new MergeOptions(), errorManager);
  }

  MergeContext load(String entry, MergeOptions options, ErrorManager errorManager)
      throws IOException {
    MergeContext context = new MergeContext(root(), options, errorManager);
    ModuleLoader loader = new ModuleLoader(context);
    context.setEntryModule(loader.load(path(entry)));
    loader.link();
    return context;
  }

  /** Loads {@code entry} and computes the dependencies of every symbol. */
  MergeContext analyze(String entry) throws IOException {
    MergeContext context = load(entry);
    new DependencyAnalyzer(context).analyze();
    return context;
  }

  static String lines(String... lines) {
    return lines.length == 0 ? "" : Joiner.on('\n').join(lines) + "\n";
  }
}
