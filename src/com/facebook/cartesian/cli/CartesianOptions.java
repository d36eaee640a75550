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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;

/** Command line of {@code cartesian [options] FILE}. */
public class CartesianOptions {

  @Option(
      name = "--contents",
      aliases = {"-c"},
      usage = "Print the parameters of each configuration below its name",
      forbids = {"--json"})
  private boolean printContents;

  @Option(
      name = "--json",
      usage = "Print the configurations as a JSON array of {name, params} objects",
      forbids = {"--contents"})
  private boolean printJson;

  @Option(name = "--summary", usage = "Print counts of emitted and rejected paths to stderr")
  private boolean printSummary;

  @Option(
      name = "--only",
      usage = "Keep only the paths matching this filter expression",
      metaVar = "EXPR")
  private List<String> onlyFilters = new ArrayList<>();

  @Option(name = "--no", usage = "Drop the paths matching this filter expression", metaVar = "EXPR")
  private List<String> noFilters = new ArrayList<>();

  @Option(
      name = "--config",
      usage = "Override a .cartesianconfig option",
      metaVar = "section.option=value")
  private List<String> configOverrides = new ArrayList<>();

  @Option(
      name = "--config-file",
      usage = "Read options from this file after .cartesianconfig",
      metaVar = "PATH")
  private List<String> configFiles = new ArrayList<>();

  @Option(
      name = "--threads",
      aliases = "-j",
      usage = "Threads used to expand the outermost axis. Overrides [expansion] threads.")
  @Nullable
  private Integer threads = null;

  @Option(
      name = "--verbose",
      aliases = {"-v"},
      usage = "Specify a number between 0 and 3. '-v 0' is default, '-v 3' is most verbose.")
  private int verbosity = 0;

  @Option(name = "--help", aliases = "-h", usage = "Prints the available options and exits.")
  private boolean help = false;

  @Argument(metaVar = "FILE", usage = "Configuration file to expand")
  @Nullable
  private String file = null;

  public boolean shouldPrintContents() {
    return printContents;
  }

  public boolean shouldPrintJson() {
    return printJson;
  }

  public boolean shouldPrintSummary() {
    return printSummary;
  }

  public List<String> getOnlyFilters() {
    return onlyFilters;
  }

  public List<String> getNoFilters() {
    return noFilters;
  }

  public List<String> getConfigOverrides() {
    return configOverrides;
  }

  public List<Path> getConfigFiles() {
    List<Path> paths = new ArrayList<>(configFiles.size());
    for (String configFile : configFiles) {
      paths.add(Paths.get(configFile));
    }
    return paths;
  }

  public Optional<Integer> getThreads() {
    return Optional.ofNullable(threads);
  }

  public int getVerbosity() {
    return verbosity;
  }

  public boolean showHelp() {
    return help;
  }

  public Optional<Path> getFile() {
    return file == null ? Optional.empty() : Optional.of(Paths.get(file));
  }
}
