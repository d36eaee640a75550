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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Set;
import org.immutables.value.Value;

/**
 * A conjunction of shortnames joined by dots. A single term matches when the name occurs anywhere
 * on the path. {@code a.b} requires {@code b} to be selected right after {@code a}; {@code a..b}
 * requires {@code b} somewhere after {@code a}.
 */
@Value.Immutable
@CartesianStyleTuple
abstract class AbstractFilterChain {

  enum Link {
    ADJACENT("."),
    FOLLOWED(".."),
    ;

    private final String token;

    Link(String token) {
      this.token = token;
    }

    @Override
    public String toString() {
      return token;
    }
  }

  public abstract ImmutableList<String> getTerms();

  /** Link between term {@code i} and term {@code i + 1}. */
  public abstract ImmutableList<Link> getLinks();

  @Value.Check
  protected void check() {
    Preconditions.checkState(!getTerms().isEmpty());
    Preconditions.checkState(getLinks().size() == getTerms().size() - 1);
  }

  public boolean matches(List<String> path) {
    String first = getTerms().get(0);
    for (int start = 0; start < path.size(); start++) {
      if (path.get(start).equals(first) && matchesFrom(path, 1, start)) {
        return true;
      }
    }
    return false;
  }

  private boolean matchesFrom(List<String> path, int term, int previous) {
    if (term == getTerms().size()) {
      return true;
    }
    String name = getTerms().get(term);
    if (getLinks().get(term - 1) == Link.ADJACENT) {
      int next = previous + 1;
      return next < path.size() && path.get(next).equals(name) && matchesFrom(path, term + 1, next);
    }
    for (int next = previous + 1; next < path.size(); next++) {
      if (path.get(next).equals(name) && matchesFrom(path, term + 1, next)) {
        return true;
      }
    }
    return false;
  }

  /** @return false if some term names a case that does not exist anywhere in {@code shortnames}. */
  public boolean canMatchWithin(Set<String> shortnames) {
    return shortnames.containsAll(getTerms());
  }

  @Override
  public String toString() {
    StringBuilder result = new StringBuilder(getTerms().get(0));
    for (int i = 1; i < getTerms().size(); i++) {
      result.append(getLinks().get(i - 1)).append(getTerms().get(i));
    }
    return result.toString();
  }
}
