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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.base.Throwables;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.Locale;
import java.util.TimeZone;
import java.util.logging.Level;
import java.util.logging.LogRecord;

public class LogFormatter extends java.util.logging.Formatter {
  private static final int ERROR_LEVEL = Level.SEVERE.intValue();
  private static final int WARN_LEVEL = Level.WARNING.intValue();
  private static final int INFO_LEVEL = Level.INFO.intValue();
  private static final int DEBUG_LEVEL = Level.FINE.intValue();
  private static final int VERBOSE_LEVEL = Level.FINER.intValue();
  private final ThreadLocal<SimpleDateFormat> simpleDateFormat;

  public LogFormatter() {
    this(Locale.US, TimeZone.getDefault());
  }

  @VisibleForTesting
  LogFormatter(Locale locale, TimeZone timeZone) {
    simpleDateFormat =
        ThreadLocal.withInitial(
            () -> {
              SimpleDateFormat format = new SimpleDateFormat("[yyyy-MM-dd HH:mm:ss.SSS]", locale);
              format.setTimeZone(timeZone);
              return format;
            });
  }

  @Override
  public String format(LogRecord record) {
    String timestamp = simpleDateFormat.get().format(new Date(record.getMillis()));

    long tid = record.getThreadID();
    StringBuilder sb =
        new StringBuilder(255)
            .append(timestamp)
            .append(formatRecordLevel(record.getLevel()))
            .append("[tid:")
            .append(Strings.padStart(Long.toString(tid), 2, '0'));
    sb.append("][").append(record.getLoggerName()).append("] ");
    sb.append(formatMessage(record));
    sb.append("\n");
    Throwable t = record.getThrown();
    if (t != null) {
      sb.append(Throwables.getStackTraceAsString(t)).append("\n");
    }
    return sb.toString();
  }

  private static String formatRecordLevel(Level level) {
    int l = level.intValue();
    if (l == ERROR_LEVEL) {
      return "[error]";
    } else if (l == WARN_LEVEL) {
      return "[warn ]";
    } else if (l == INFO_LEVEL) {
      return "[info ]";
    } else if (l == DEBUG_LEVEL) {
      return "[debug]";
    } else if (l == VERBOSE_LEVEL) {
      return "[vrbos]";
    } else {
      return String.format("[%-5d]", l);
    }
  }
}
