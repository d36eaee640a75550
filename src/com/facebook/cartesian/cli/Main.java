/*
 * Copyright (c) Facebook, Inc. and its affiliates.
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

package com.facebook.cartesian.cli;

import com.facebook.cartesian.config.Config;
import com.facebook.cartesian.config.ConfigOverrides;
import com.facebook.cartesian.config.ExpansionConfig;
import com.facebook.cartesian.expand.ExpansionEngine;
import com.facebook.cartesian.expand.ExpansionResult;
import com.facebook.cartesian.expand.ResolutionFailure;
import com.facebook.cartesian.log.LogConfig;
import com.facebook.cartesian.log.Logger;
import com.facebook.cartesian.model.Configuration;
import com.facebook.cartesian.model.FilterMode;
import com.facebook.cartesian.model.FilterStatement;
import com.facebook.cartesian.model.Scope;
import com.facebook.cartesian.parser.BlockParser;
import com.facebook.cartesian.parser.FileIncludeResolver;
import com.facebook.cartesian.resolve.ParameterResolver;
import com.facebook.cartesian.tree.VariantTree;
import com.facebook.cartesian.tree.VariantTreeBuilder;
import com.facebook.cartesian.util.CartesianException;
import com.facebook.cartesian.util.ExitCode;
import com.facebook.cartesian.util.HumanReadableException;
import com.facebook.cartesian.util.json.ObjectMappers;
import com.fasterxml.jackson.core.JsonGenerator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;

/** Entry point of the {@code cartesian} command. */
public final class Main {
  private static final Logger LOG = Logger.get(Main.class);

  public static final String CONFIG_FILE_NAME = ".cartesianconfig";

  private final PrintStream stdOut;
  private final PrintStream stdErr;
  private final Path projectRoot;

  public Main(PrintStream stdOut, PrintStream stdErr) {
    this(stdOut, stdErr, Paths.get("").toAbsolutePath());
  }

  Main(PrintStream stdOut, PrintStream stdErr, Path projectRoot) {
    this.stdOut = stdOut;
    this.stdErr = stdErr;
    this.projectRoot = projectRoot;
  }

  public static void main(String[] args) {
    ExitCode exitCode = new Main(System.out, System.err).run(args);
    LogConfig.flushLogs();
    System.exit(exitCode.getCode());
  }

  /** Runs one command and maps its outcome to an {@link ExitCode}. Never throws. */
  public ExitCode run(String[] args) {
    CartesianOptions options = new CartesianOptions();
    CmdLineParser parser = new CmdLineParser(options);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      stdErr.println(e.getMessage());
      parser.printUsage(stdErr);
      return ExitCode.COMMANDLINE_ERROR;
    }
    if (options.showHelp()) {
      stdErr.println("Usage: cartesian [options] FILE");
      parser.printUsage(stdErr);
      return ExitCode.SUCCESS;
    }
    if (!options.getFile().isPresent()) {
      stdErr.println("Missing FILE argument");
      parser.printUsage(stdErr);
      return ExitCode.COMMANDLINE_ERROR;
    }

    try {
      LogConfig.setupLogging(
          projectRoot, Optional.of(LogConfig.verbosityToLevel(options.getVerbosity())));
      return runWithOptions(options);
    } catch (HumanReadableException e) {
      stdErr.println(e.getHumanReadableErrorMessage());
      return ExitCode.COMMANDLINE_ERROR;
    } catch (CartesianException e) {
      stdErr.println(e.getHumanReadableErrorMessage());
      return ExitCode.PARSE_ERROR;
    } catch (IOException e) {
      LOG.error(e, "I/O error");
      stdErr.println("I/O error: " + e.getMessage());
      return ExitCode.FATAL_GENERIC;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      stdErr.println("Interrupted");
      return ExitCode.SIGNAL_INTERRUPT;
    } catch (RuntimeException e) {
      LOG.error(e, "Unexpected failure");
      stdErr.println("Unexpected failure: " + e);
      return ExitCode.FATAL_GENERIC;
    }
  }

  private ExitCode runWithOptions(CartesianOptions options)
      throws IOException, InterruptedException, CartesianException {
    ExpansionConfig expansionConfig = new ExpansionConfig(readConfig(options));
    int threads = options.getThreads().orElse(expansionConfig.getThreads());
    if (threads < 1) {
      throw new HumanReadableException("--threads must be a positive integer (was %d)", threads);
    }

    BlockParser parser =
        new BlockParser(
            new FileIncludeResolver(),
            expansionConfig.shouldStripQuotes(),
            expansionConfig.getMaxIncludeDepth());
    Path file = projectRoot.resolve(options.getFile().get());
    if (!Files.isRegularFile(file)) {
      throw new HumanReadableException("No such file: %s", options.getFile().get());
    }
    Scope root = parser.parseFile(file);
    VariantTree tree = VariantTreeBuilder.build(root, getCommandLineFilters(options));

    ExpansionEngine engine =
        new ExpansionEngine(
            tree, new ParameterResolver(), expansionConfig.getUnresolvedReferencePolicy());
    ExpansionResult result;
    if (threads > 1) {
      result = expandInParallel(engine, threads);
    } else {
      result = engine.expand();
    }

    print(options, result.getConfigurations());
    stdOut.flush();
    for (ResolutionFailure failure : result.getFailures()) {
      stdErr.println("Skipped " + failure);
    }
    if (options.shouldPrintSummary()) {
      stdErr.format(
          "%d configurations, %d unresolved, %d rejected by filters, %s paths before filtering%n",
          result.getConfigurations().size(),
          result.getFailures().size(),
          result.getPrunedCount(),
          tree.getCombinationCount());
    }

    if (result.hasFailures()) {
      return ExitCode.PARTIAL_RESULT;
    }
    return result.getConfigurations().isEmpty() ? ExitCode.NOTHING_TO_DO : ExitCode.SUCCESS;
  }

  private Config readConfig(CartesianOptions options) throws IOException {
    ImmutableList.Builder<Path> files = ImmutableList.builder();
    files.add(projectRoot.resolve(CONFIG_FILE_NAME));
    for (Path configFile : options.getConfigFiles()) {
      Path resolved = projectRoot.resolve(configFile);
      if (!Files.isRegularFile(resolved)) {
        throw new HumanReadableException("Config file %s does not exist", configFile);
      }
      files.add(resolved);
    }
    return Config.createFromFiles(
        files.build(), ConfigOverrides.parse(options.getConfigOverrides()));
  }

  private static ImmutableList<FilterStatement> getCommandLineFilters(CartesianOptions options) {
    ImmutableList.Builder<FilterStatement> filters = ImmutableList.builder();
    for (String expression : options.getOnlyFilters()) {
      filters.add(FilterStatement.of(FilterMode.ONLY, expression));
    }
    for (String expression : options.getNoFilters()) {
      filters.add(FilterStatement.of(FilterMode.NO, expression));
    }
    return filters.build();
  }

  private static ExpansionResult expandInParallel(ExpansionEngine engine, int threads)
      throws InterruptedException, CartesianException {
    ListeningExecutorService executor =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(
                threads,
                new ThreadFactoryBuilder()
                    .setNameFormat("cartesian-expand-%d")
                    .setDaemon(true)
                    .build()));
    try {
      return engine.expand(executor);
    } finally {
      executor.shutdownNow();
      executor.awaitTermination(1, TimeUnit.SECONDS);
    }
  }

  private void print(CartesianOptions options, ImmutableList<Configuration> configurations)
      throws IOException {
    if (options.shouldPrintJson()) {
      try (JsonGenerator generator = ObjectMappers.createGenerator(stdOut)) {
        generator.useDefaultPrettyPrinter();
        generator.writeStartArray();
        for (Configuration configuration : configurations) {
          generator.writeObject(
              ImmutableMap.of(
                  "name", configuration.getName(), "params", configuration.getParams()));
        }
        generator.writeEndArray();
      }
      stdOut.println();
      return;
    }
    for (Configuration configuration : configurations) {
      stdOut.println(configuration.getName());
      if (options.shouldPrintContents()) {
        for (Map.Entry<String, String> param : configuration.getParams().entrySet()) {
          stdOut.format("    %s = %s%n", param.getKey(), param.getValue());
        }
      }
    }
  }
}
