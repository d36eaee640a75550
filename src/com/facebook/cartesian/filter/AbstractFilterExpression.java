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

package com.facebook.cartesian.filter;

import com.facebook.cartesian.util.immutables.CartesianStyleTuple;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Set;
import org.immutables.value.Value;

/** A disjunction of {@link FilterChain}s: matches when any alternative matches. */
@Value.Immutable
@CartesianStyleTuple
abstract class AbstractFilterExpression {

  /** Scan and parse the specified filter expression. */
  public static FilterExpression parse(String expression) throws FilterExpressionException {
    return FilterParser.parse(expression);
  }

  /** The expression as written. */
  @Value.Auxiliary
  public abstract String getText();

  public abstract ImmutableList<FilterChain> getAlternatives();

  public boolean matches(List<String> path) {
    for (FilterChain alternative : getAlternatives()) {
      if (alternative.matches(path)) {
        return true;
      }
    }
    return false;
  }

  /** @return whether any alternative only refers to names found in {@code shortnames}. */
  public boolean canMatchWithin(Set<String> shortnames) {
    for (FilterChain alternative : getAlternatives()) {
      if (alternative.canMatchWithin(shortnames)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return Joiner.on(", ").join(getAlternatives());
  }
}
