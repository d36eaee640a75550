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

package com.facebook.cartesian.config;

import com.facebook.cartesian.util.HumanReadableException;
import java.util.Optional;

/** Typed view of the settings that control parsing and expansion. */
public class ExpansionConfig {

  public static final String EXPANSION_SECTION = "expansion";
  public static final String PARSER_SECTION = "parser";

  private static final long DEFAULT_THREADS = 1L;
  private static final long DEFAULT_MAX_INCLUDE_DEPTH = 16L;

  /** What to do when a {@code ${name}} reference cannot be resolved on some path. */
  public enum UnresolvedReferencePolicy {
    /** Drop the offending configuration, report it, and keep expanding the rest. */
    SKIP,
    /** Abort the whole run. */
    FAIL,
  }

  private final Config delegate;

  public ExpansionConfig(Config delegate) {
    this.delegate = delegate;
  }

  public static ExpansionConfig of() {
    return new ExpansionConfig(new Config());
  }

  public int getThreads() {
    return checkPositive(
        EXPANSION_SECTION,
        "threads",
        delegate.getLong(EXPANSION_SECTION, "threads"),
        DEFAULT_THREADS);
  }

  public UnresolvedReferencePolicy getUnresolvedReferencePolicy() {
    return delegate
        .getEnum(EXPANSION_SECTION, "unresolved_reference", UnresolvedReferencePolicy.class)
        .orElse(UnresolvedReferencePolicy.SKIP);
  }

  public boolean shouldStripQuotes() {
    return delegate.getBooleanValue(PARSER_SECTION, "strip_quotes", true);
  }

  public int getMaxIncludeDepth() {
    return checkPositive(
        PARSER_SECTION,
        "max_include_depth",
        delegate.getLong(PARSER_SECTION, "max_include_depth"),
        DEFAULT_MAX_INCLUDE_DEPTH);
  }

  private static int checkPositive(
      String section, String field, Optional<Long> value, long defaultValue) {
    long result = value.orElse(defaultValue);
    if (result < 1 || result > Integer.MAX_VALUE) {
      throw new HumanReadableException(
          "%s:%s must be a positive integer (was %d)", section, field, result);
    }
    return (int) result;
  }
}
