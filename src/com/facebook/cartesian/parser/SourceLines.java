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

package com.facebook.cartesian.parser;

import com.facebook.cartesian.log.Logger;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns source text into the list of significant lines, measuring indentation and splicing in the
 * lines of {@code include}d files at the indentation of the include line.
 */
class SourceLines {
  private static final Logger LOG = Logger.get(SourceLines.class);

  private static final Pattern INCLUDE = Pattern.compile("^include\\s++(?![+<]?=)(\\S.*)$");
  private static final int TAB_WIDTH = 8;

  private final IncludeResolver includeResolver;
  private final int maxIncludeDepth;
  private final Deque<String> includeStack = new ArrayDeque<>();
  private final ImmutableList.Builder<SourceLine> lines = ImmutableList.builder();

  private SourceLines(IncludeResolver includeResolver, int maxIncludeDepth) {
    this.includeResolver = includeResolver;
    this.maxIncludeDepth = maxIncludeDepth;
  }

  static ImmutableList<SourceLine> read(
      SourceText source, IncludeResolver includeResolver, int maxIncludeDepth)
      throws ParseException {
    SourceLines reader = new SourceLines(includeResolver, maxIncludeDepth);
    reader.append(source, 0);
    return reader.lines.build();
  }

  private void append(SourceText source, int indentOffset) throws ParseException {
    includeStack.push(source.getName());
    List<String> rawLines = Splitter.onPattern("\r?\n").splitToList(source.getText());
    for (int i = 0; i < rawLines.size(); i++) {
      String raw = rawLines.get(i);
      String text = CharMatcher.whitespace().trimFrom(raw);
      if (text.isEmpty() || text.startsWith("#")) {
        continue;
      }
      SourceLine line =
          SourceLine.of(source.getName(), i + 1, indentOffset + measureIndent(raw), text);
      Matcher include = INCLUDE.matcher(text);
      if (include.matches()) {
        appendInclude(line, include.group(1).trim());
      } else {
        lines.add(line);
      }
    }
    includeStack.pop();
  }

  private void appendInclude(SourceLine line, String path) throws ParseException {
    if (includeStack.size() > maxIncludeDepth) {
      throw new ParseException(
          line, "include of %s exceeds the maximum include depth of %d", path, maxIncludeDepth);
    }
    SourceText included;
    try {
      included = includeResolver.resolve(line.getSource(), path);
    } catch (IOException e) {
      throw new ParseException(line, "unable to include %s: %s", path, e.getMessage());
    }
    if (includeStack.contains(included.getName())) {
      throw new ParseException(line, "include cycle through %s", included.getName());
    }
    LOG.debug("%s includes %s at indentation %d", line, included.getName(), line.getIndent());
    append(included, line.getIndent());
  }

  private static int measureIndent(String raw) {
    int columns = 0;
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (c == ' ') {
        columns++;
      } else if (c == '\t') {
        columns = (columns / TAB_WIDTH + 1) * TAB_WIDTH;
      } else {
        break;
      }
    }
    return columns;
  }
}
