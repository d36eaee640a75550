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

import java.util.logging.Level;
import java.util.logging.LogRecord;
import javax.annotation.Nullable;

/**
 * Wrapper around {@link java.util.logging.Logger} with printf-style formatting. Arguments are
 * only formatted when the level is enabled.
 *
 * <p>Levels map to java.util.logging as: error=SEVERE, warn=WARNING, debug=FINE, verbose=FINER.
 */
public class Logger {

  private final java.util.logging.Logger delegate; // NOPMD

  private Logger(java.util.logging.Logger delegate) { // NOPMD
    this.delegate = delegate;
  }

  public static Logger get(Class<?> cls) {
    return get(cls.getName());
  }

  public static Logger get(String name) {
    return new Logger(java.util.logging.Logger.getLogger(name)); // NOPMD
  }

  public void verbose(String format, Object... args) {
    logFormatted(Level.FINER, null, format, args);
  }

  public void debug(String format, Object... args) {
    logFormatted(Level.FINE, null, format, args);
  }

  public void warn(String format, Object... args) {
    logFormatted(Level.WARNING, null, format, args);
  }

  public void error(String format, Object... args) {
    logFormatted(Level.SEVERE, null, format, args);
  }

  public void error(Throwable t, String format, Object... args) {
    logFormatted(Level.SEVERE, t, format, args);
  }

  private void logFormatted(
      Level level, @Nullable Throwable t, String format, Object... args) {
    if (!delegate.isLoggable(level)) {
      return;
    }
    String message = args.length == 0 ? format : String.format(format, args);
    LogRecord record = new LogRecord(level, message);
    record.setLoggerName(delegate.getName());
    record.setThrown(t);
    delegate.log(record);
  }
}
