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

import com.facebook.cartesian.util.CartesianException;

/** Raised for text that does not follow the block grammar: bad indentation or syntax. */
public class ParseException extends CartesianException {

  private final String source;
  private final int lineNumber;

  public ParseException(SourceLine line, String humanReadableFormatString, Object... args) {
    this(line.getSource(), line.getLineNumber(), String.format(humanReadableFormatString, args));
  }

  public ParseException(String source, int lineNumber, String message) {
    super(String.format("%s:%d: %s", source, lineNumber, message));
    this.source = source;
    this.lineNumber = lineNumber;
  }

  public String getSource() {
    return source;
  }

  public int getLineNumber() {
    return lineNumber;
  }
}
