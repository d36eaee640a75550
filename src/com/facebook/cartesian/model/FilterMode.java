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

package com.facebook.cartesian.model;

import java.util.Optional;

/** Whether a filter keeps the paths its expression matches, or drops them. */
public enum FilterMode {
  ONLY("only"),
  NO("no"),
  ;

  private final String keyword;

  FilterMode(String keyword) {
    this.keyword = keyword;
  }

  /** @return whether a path passes a filter of this mode given its expression's match result. */
  public boolean passes(boolean expressionMatches) {
    return this == ONLY ? expressionMatches : !expressionMatches;
  }

  public static Optional<FilterMode> fromKeyword(String keyword) {
    for (FilterMode mode : values()) {
      if (mode.keyword.equals(keyword)) {
        return Optional.of(mode);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return keyword;
  }
}
