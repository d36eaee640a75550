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
import com.google.common.collect.ImmutableList;
import org.immutables.value.Value;

/** A {@code variants:} block: one axis whose cases are mutually exclusive alternatives. */
@Value.Immutable
@CartesianStyleTuple
abstract class AbstractVariantsBlock extends Statement {

  public abstract ImmutableList<VariantCase> getCases();

  @Override
  public <R, E extends Exception> R accept(Visitor<R, E> visitor) throws E {
    return visitor.visitVariantsBlock((VariantsBlock) this);
  }
}
