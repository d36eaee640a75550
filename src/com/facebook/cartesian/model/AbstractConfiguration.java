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

import com.facebook.cartesian.util.immutables.CartesianStyleTuple;
import com.google.common.collect.ImmutableMap;
import org.immutables.value.Value;

/**
 * One surviving path through the variant tree: its dotted name and the parameters resolved along
 * it. Holds no reference back to the tree it came from.
 */
@Value.Immutable
@CartesianStyleTuple
abstract class AbstractConfiguration {

  public abstract String getName();

  public abstract ImmutableMap<String, String> getParams();

  @Override
  public String toString() {
    return getName();
  }
}
