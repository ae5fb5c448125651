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
package net.starlark.lint.cmd;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.starlark.lint.analysis.AnalysisOptions;
import net.starlark.lint.analysis.Analyzer;
import net.starlark.lint.analysis.Violation;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.OptionDef;
import org.kohsuke.args4j.OptionHandlerRegistry;
import org.kohsuke.args4j.spi.Parameters;
import org.kohsuke.args4j.spi.Setter;

/**
 * Command-line entry point. Analyzes the script files under the given paths and prints one line
 * per violation.
 *
 * <p>Exit codes: 0 if no violations were found, 1 if some were, 2 for a usage error.
 */
public final class Main {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  // Held so that the configured level is not lost to garbage collection.
  private static final Logger rootLogger = Logger.getLogger("net.starlark.lint");

  static final int EXIT_OK = 0;
  static final int EXIT_VIOLATIONS = 1;
  static final int EXIT_USAGE = 2;
  static final int EXIT_INTERRUPTED = 130; // 128 + SIGINT

  /** Command line options. */
  public static class Options {
    @Option(
        name = "--calls",
        aliases = "--checked-calls",
        handler = BooleanOptionHandler.class,
        usage = "Check function calls for compatibility with the callee's signature.")
    public boolean calls;

    @Option(
        name = "--function-visibility",
        handler = BooleanOptionHandler.class,
        usage = "Check that public functions are documented or used by other files.")
    public boolean functionVisibility;

    @Option(
        name = "--import-naming",
        handler = BooleanOptionHandler.class,
        usage = "Check that global variables holding import_module results are private.")
    public boolean importNaming;

    @Option(name = "--all", handler = BooleanOptionHandler.class, usage = "Run all checks.")
    public boolean all;

    @Option(
        name = "--no-check-file-exists",
        handler = BooleanOptionHandler.class,
        usage = "Do not report imports whose target file does not exist.")
    public boolean noCheckFileExists;

    @Option(name = "--jobs", metaVar = "N", usage = "Number of files to analyze in parallel.")
    public int jobs = 1;

    @Option(
        name = "--verbose",
        aliases = "-v",
        handler = BooleanOptionHandler.class,
        usage = "Log diagnostic details to stderr.")
    public boolean verbose;

    @Argument(metaVar = "PATH", usage = "Files or directories to analyze (default: .).")
    public List<String> paths = new ArrayList<>();

    AnalysisOptions toAnalysisOptions() {
      return AnalysisOptions.builder()
          .calls(calls || all)
          .functionVisibility(functionVisibility || all)
          .importNaming(importNaming || all)
          .checkFileExists(!noCheckFileExists)
          .jobs(jobs)
          .build();
    }
  }

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  @VisibleForTesting
  static int run(String[] args, PrintStream out, PrintStream err) {
    Options options = new Options();
    CmdLineParser parser = new CmdLineParser(options);
    OptionHandlerRegistry.getRegistry().registerHandler(boolean.class, BooleanOptionHandler.class);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      return EXIT_USAGE;
    }
    if (options.jobs < 1) {
      err.println("--jobs must be positive: " + options.jobs);
      parser.printUsage(err);
      return EXIT_USAGE;
    }
    if (options.verbose) {
      enableDiagnostics();
    }

    List<Path> paths = new ArrayList<>();
    for (String path : options.paths.isEmpty() ? List.of(".") : options.paths) {
      paths.add(Path.of(path));
    }

    ImmutableList<Path> scripts;
    try {
      scripts = Workspace.findScripts(paths);
    } catch (NoSuchFileException e) {
      err.println("No such file or directory: " + e.getFile());
      return EXIT_USAGE;
    } catch (IOException e) {
      err.println("Cannot list files: " + e.getMessage());
      return EXIT_USAGE;
    }
    if (scripts.isEmpty()) {
      out.println("No .star files found");
      return EXIT_OK;
    }

    Path root = Workspace.findRoot(paths.get(0));
    AnalysisOptions analysisOptions = options.toAnalysisOptions();
    logger.atFine().log("Workspace root %s, %d files, %s", root, scripts.size(), analysisOptions);

    ImmutableMap<Path, ImmutableList<Violation>> violations;
    try {
      violations = new Analyzer(root, analysisOptions).analyzeFiles(scripts);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      err.println("Interrupted");
      return EXIT_INTERRUPTED;
    }

    for (ImmutableList<Violation> fileViolations : violations.values()) {
      for (Violation violation : fileViolations) {
        out.println(violation);
      }
    }
    out.println();
    out.printf("Analyzed %d .star files%n", scripts.size());
    if (violations.isEmpty()) {
      out.println("No violations found");
      return EXIT_OK;
    }
    out.println("Found violations in the analyzed file(s)");
    return EXIT_VIOLATIONS;
  }

  private static void enableDiagnostics() {
    ConsoleHandler handler = new ConsoleHandler();
    handler.setLevel(Level.FINE);
    rootLogger.addHandler(handler);
    rootLogger.setLevel(Level.FINE);
  }

  /**
   * Custom option handler for boolean values, to support both "--foo=true" and "--foo" syntax. The
   * default args4j boolean handler only supports the latter.
   */
  public static class BooleanOptionHandler extends org.kohsuke.args4j.spi.BooleanOptionHandler {
    public BooleanOptionHandler(
        CmdLineParser parser, OptionDef option, Setter<? super Boolean> setter) {
      super(parser, option, setter);
    }

    @Override
    public int parseArguments(Parameters params) throws CmdLineException {
      if (params.size() > 0) {
        String value = params.getParameter(0);
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
          setter.addValue(Boolean.parseBoolean(value));
          return 1;
        }
      }
      return super.parseArguments(params);
    }
  }
}
