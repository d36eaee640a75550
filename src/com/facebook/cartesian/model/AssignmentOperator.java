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
import javax.annotation.Nullable;

/** Operators that may appear between a key and its value. */
public enum AssignmentOperator {
  /** Overwrites the value, creating the key if absent. */
  SET("="),
  /** Appends to the existing value; an absent key counts as the empty string. */
  APPEND("+="),
  /** Prepends to the existing value; an absent key counts as the empty string. */
  PREPEND("<="),
  ;

  private final String token;

  AssignmentOperator(String token) {
    this.token = token;
  }

  public String apply(@Nullable String existing, String value) {
    String current = existing == null ? "" : existing;
    switch (this) {
      case SET:
        return value;
      case APPEND:
        return current + value;
      case PREPEND:
        return value + current;
      default:
        throw new IllegalStateException("operator=" + this);
    }
  }

  public static Optional<AssignmentOperator> fromToken(String token) {
    for (AssignmentOperator operator : values()) {
      if (operator.token.equals(token)) {
        return Optional.of(operator);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return token;
  }
}
