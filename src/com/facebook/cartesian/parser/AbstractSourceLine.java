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

import com.facebook.cartesian.util.immutables.CartesianStyleTuple;
import org.immutables.value.Value;

/** A significant (non-blank, non-comment) line with its indentation measured and stripped. */
@Value.Immutable
@CartesianStyleTuple
abstract class AbstractSourceLine {

  /** Name of the file (or other source) the line was read from. */
  public abstract String getSource();

  /** 1-based line number within {@link #getSource()}. */
  public abstract int getLineNumber();

  /** Indentation width in columns, after include offsets and tab expansion. */
  public abstract int getIndent();

  /** Line content without leading or trailing whitespace. */
  public abstract String getText();

  @Override
  public String toString() {
    return String.format("%s:%d", getSource(), getLineNumber());
  }
}
