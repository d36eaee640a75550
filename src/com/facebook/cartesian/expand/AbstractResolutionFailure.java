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

import com.facebook.cartesian.resolve.ResolutionException;
import com.facebook.cartesian.util.immutables.CartesianStyleTuple;
import org.immutables.value.Value;

/** A path that survived filtering but whose parameters could not be resolved. */
@Value.Immutable
@CartesianStyleTuple
abstract class AbstractResolutionFailure {

  /** Name the configuration would have had. */
  public abstract String getName();

  @Value.Auxiliary
  public abstract ResolutionException getCause();

  @Value.Derived
  public String getKey() {
    return getCause().getKey();
  }

  @Value.Derived
  public String getReference() {
    return getCause().getReference();
  }

  @Override
  public String toString() {
    return getName() + ": " + getCause().getHumanReadableErrorMessage();
  }
}
