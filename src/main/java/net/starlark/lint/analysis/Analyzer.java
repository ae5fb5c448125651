// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.starlark.lint.analysis;

import static java.lang.Math.min;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.function.Function;
import net.starlark.lint.syntax.StarlarkFile;
import net.starlark.lint.syntax.SyntaxError;

/**
 * Runs the checks over script files.
 *
 * <p>Checking calls across files needs every file's signatures, but files are walked one at a
 * time. {@link #analyzeFiles} therefore walks every file twice against one {@link AnalysisState}:
 * the first pass only fills the state (its findings are dropped), the second reports. Visibility is
 * judged once all second-pass walks are done, so that it sees every cross-file reference.
 *
 * <p>A file that cannot be read or parsed, or whose analysis fails unexpectedly, yields a single
 * line-0 violation; the other files are unaffected.
 */
public final class Analyzer {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Path workspaceRoot;
  private final AnalysisOptions options;

  public Analyzer(Path workspaceRoot, AnalysisOptions options) {
    this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
    this.options = options;
  }

  public Path getWorkspaceRoot() {
    return workspaceRoot;
  }

  /**
   * Analyzes one file against {@code state}, which it updates with the file's imports, signatures
   * and outgoing references. Visibility is judged against the references known so far.
   */
  public ImmutableList<Violation> analyzeFile(Path file, AnalysisState state) {
    FileAnalysis analysis = walk(normalize(file), options, state);
    return analysis.violations(judgeVisibility(analysis, state));
  }

  /**
   * Analyzes {@code files} together from a fresh state.
   *
   * @return the violations of each file that has any, keyed by absolute path in input order
   */
  public ImmutableMap<Path, ImmutableList<Violation>> analyzeFiles(List<Path> files)
      throws InterruptedException {
    ImmutableList<Path> inputs =
        files.stream().map(Analyzer::normalize).distinct().collect(ImmutableList.toImmutableList());
    AnalysisState state = new AnalysisState(ModuleIndex.forFiles(inputs, workspaceRoot));

    logger.atFine().log("First pass over %d files", inputs.size());
    AnalysisOptions firstPass = options.toBuilder().calls(true).functionVisibility(false).build();
    runPass(inputs, file -> walk(file, firstPass, state));

    logger.atFine().log("Second pass over %d files", inputs.size());
    ImmutableList<FileAnalysis> walked = runPass(inputs, file -> walk(file, options, state));

    ImmutableMap.Builder<Path, ImmutableList<Violation>> result = ImmutableMap.builder();
    for (FileAnalysis analysis : walked) {
      ImmutableList<Violation> violations = analysis.violations(judgeVisibility(analysis, state));
      if (!violations.isEmpty()) {
        result.put(analysis.file(), violations);
      }
    }
    logger.atFine().log("Cross-file references: %s", state.references());
    return result.buildOrThrow();
  }

  private static Path normalize(Path file) {
    return file.toAbsolutePath().normalize();
  }

  private ImmutableList<FileAnalysis> runPass(
      List<Path> files, Function<Path, FileAnalysis> task) throws InterruptedException {
    if (options.jobs() == 1 || files.size() < 2) {
      return files.stream().map(task).collect(ImmutableList.toImmutableList());
    }

    ListeningExecutorService executor =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(
                min(options.jobs(), files.size()),
                new ThreadFactoryBuilder()
                    .setNameFormat("starlark-lint-%d")
                    .setDaemon(true)
                    .build()));
    try {
      List<ListenableFuture<FileAnalysis>> futures = new ArrayList<>();
      for (Path file : files) {
        futures.add(executor.submit(() -> task.apply(file)));
      }
      return ImmutableList.copyOf(Futures.allAsList(futures).get());
    } catch (ExecutionException e) {
      // walk() turns failures into violations, so only errors get here.
      Throwables.throwIfUnchecked(e.getCause());
      throw new IllegalStateException(e.getCause());
    } finally {
      executor.shutdownNow();
    }
  }

  private FileAnalysis walk(Path file, AnalysisOptions checks, AnalysisState state) {
    StarlarkFile syntax;
    try {
      syntax = StarlarkFile.parseStrict(file);
    } catch (IOException | SyntaxError.Exception e) {
      logger.atFine().withCause(e).log("Cannot analyze %s", file);
      return failed(file, e);
    }

    try {
      ImportVisitor imports =
          new ImportVisitor(file, workspaceRoot, checks.importNaming(), checks.checkFileExists());
      imports.visit(syntax);
      state.putImports(file, imports.getImportTable());

      FunctionVisitor functions =
          new FunctionVisitor(file, imports.getImportTable(), state, checks.calls());
      functions.visit(syntax);
      state.putSignatures(file, functions.getSignatures());

      return new FileAnalysis(
          file, imports.getViolations(), functions.getViolations(), functions.getSummaries());
    } catch (RuntimeException e) {
      logger.atWarning().withCause(e).log("Unexpected failure analyzing %s", file);
      return failed(file, e);
    }
  }

  private static FileAnalysis failed(Path file, Exception e) {
    return FileAnalysis.failed(
        file, Violation.of(file, 0, "Error analyzing file %s: %s", file, e.getMessage()));
  }

  private ImmutableList<Violation> judgeVisibility(FileAnalysis analysis, AnalysisState state) {
    if (!options.functionVisibility()) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<Violation> violations = ImmutableList.builder();
    for (FunctionSummary function : analysis.functions()) {
      if (function.isPrivate() || function.isTest() || function.documented()) {
        continue;
      }
      if (state.isReferenced(analysis.file(), function.name())) {
        violations.add(
            Violation.of(
                analysis.file(),
                function.line(),
                "Public function '%s' is used in other modules and should be documented",
                function.name()));
      } else {
        violations.add(
            Violation.of(
                analysis.file(),
                function.line(),
                "Function '%s' is not documented and not used in other modules, consider making"
                    + " it private",
                function.name()));
      }
    }
    return violations.build();
  }
}
