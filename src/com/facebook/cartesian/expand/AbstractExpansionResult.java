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

package com.facebook.cartesian.expand;

import com.facebook.cartesian.model.Configuration;
import com.facebook.cartesian.util.immutables.CartesianStyleImmutable;
import com.google.common.collect.ImmutableList;
import org.immutables.value.Value;

/** Outcome of one expansion run, in declaration order. */
@Value.Immutable
@CartesianStyleImmutable
abstract class AbstractExpansionResult {

  public abstract ImmutableList<Configuration> getConfigurations();

  public abstract ImmutableList<ResolutionFailure> getFailures();

  /** Number of candidate paths, partial or complete, rejected by a filter. */
  public abstract long getPrunedCount();

  public boolean hasFailures() {
    return !getFailures().isEmpty();
  }
}
