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

package com.facebook.cartesian.log;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;

/**
 * Configures {@link LogManager} from a stack of properties files, concatenated so that later
 * entries override earlier ones:
 *
 * <p>1) the bundled {@code logging.properties}
 * 2) {@code $PROJECT_ROOT/.cartesianlogging.properties}
 * 3) the console level requested on the command line, if any.
 */
public class LogConfig {

  public static final String BUNDLED_PROPERTIES = "logging.properties";
  public static final String PROJECT_PROPERTIES = ".cartesianlogging.properties";

  private static final byte[] NEWLINE = {'\n'};

  private LogConfig() {}

  public static synchronized void setupLogging(Path projectRoot, Optional<Level> consoleLevel)
      throws IOException {
    ImmutableList.Builder<InputStream> inputStreamsBuilder = ImmutableList.builder();

    InputStream bundled = LogConfig.class.getResourceAsStream(BUNDLED_PROPERTIES);
    if (bundled == null) {
      System.err.format("Error: Couldn't open bundled logging properties %s\n", BUNDLED_PROPERTIES);
    } else {
      inputStreamsBuilder.add(bundled).add(new ByteArrayInputStream(NEWLINE));
    }

    // The project file doesn't need to exist.
    Path projectPath = projectRoot.resolve(PROJECT_PROPERTIES);
    if (Files.isRegularFile(projectPath)) {
      inputStreamsBuilder
          .add(Files.newInputStream(projectPath))
          .add(new ByteArrayInputStream(NEWLINE));
    }

    if (consoleLevel.isPresent()) {
      String override =
          String.format(
              "%s.level=%s\n.level=%s\n",
              ConsoleHandler.class.getName(),
              consoleLevel.get().getName(),
              consoleLevel.get().getName());
      inputStreamsBuilder.add(new ByteArrayInputStream(override.getBytes(StandardCharsets.UTF_8)));
    }

    try (InputStream is =
        new SequenceInputStream(Iterators.asEnumeration(inputStreamsBuilder.build().iterator()))) {
      LogManager.getLogManager().readConfiguration(is);
    }
  }

  /** Maps the {@code --verbose} level (0-3) to a console {@link Level}. */
  public static Level verbosityToLevel(int verbosity) {
    switch (verbosity) {
      case 0:
        return Level.WARNING;
      case 1:
        return Level.INFO;
      case 2:
        return Level.FINE;
      default:
        return Level.FINER;
    }
  }

  public static void flushLogs() {
    java.util.logging.Logger rootLogger = LogManager.getLogManager().getLogger(""); // NOPMD
    if (rootLogger == null) {
      return;
    }
    Handler[] handlers = rootLogger.getHandlers();
    if (handlers == null) {
      return;
    }
    for (Handler h : handlers) {
      h.flush();
    }
  }
}
