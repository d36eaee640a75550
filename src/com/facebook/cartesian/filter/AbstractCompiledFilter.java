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

import com.facebook.cartesian.model.FilterMode;
import com.facebook.cartesian.model.FilterStatement;
import com.facebook.cartesian.util.immutables.CartesianStyleTuple;
import java.util.List;
import java.util.Set;
import org.immutables.value.Value;

/** A filter statement with its expression parsed, ready to be evaluated against paths. */
@Value.Immutable
@CartesianStyleTuple
abstract class AbstractCompiledFilter {

  public abstract FilterMode getMode();

  public abstract FilterExpression getExpression();

  public static CompiledFilter compile(FilterStatement statement)
      throws FilterExpressionException {
    FilterExpression expression = FilterExpression.parse(statement.getExpression());
    return CompiledFilter.of(statement.getMode(), expression);
  }

  /** @return whether a complete path survives this filter. */
  public boolean passes(List<String> path) {
    return getMode().passes(getExpression().matches(path));
  }

  /**
   * Decides, from a prefix of the path, whether every completion of it is rejected. Paths only
   * grow at the end, so a match found in the prefix persists, and a name missing from the whole
   * tree can never be selected.
   */
  public boolean rejectsAllExtensionsOf(List<String> prefix, Set<String> allShortnames) {
    switch (getMode()) {
      case NO:
        return getExpression().matches(prefix);
      case ONLY:
        return !getExpression().canMatchWithin(allShortnames);
      default:
        throw new IllegalStateException("mode=" + getMode());
    }
  }

  @Override
  public String toString() {
    return getMode() + " " + getExpression();
  }
}
