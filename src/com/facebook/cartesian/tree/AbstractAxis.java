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

package com.facebook.cartesian.tree;

import com.facebook.cartesian.model.VariantsBlock;
import com.facebook.cartesian.util.immutables.CartesianStyleTuple;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Entry of the {@link VariantTree} axis arena. Parents are referred to by index, so walking up from
 * an axis never needs a reference cycle.
 */
@Value.Immutable
@CartesianStyleTuple
abstract class AbstractAxis {

  public static final int NO_PARENT = -1;

  /** Position in declaration order, which is also the position in the arena. */
  public abstract int getIndex();

  /** Index of the axis owning the case this axis is nested in, or {@link #NO_PARENT}. */
  public abstract int getParentIndex();

  /** Shortname of the case this axis is nested in; absent for top level axes. */
  public abstract Optional<String> getOwningCase();

  @Value.Auxiliary
  public abstract VariantsBlock getBlock();

  public boolean isTopLevel() {
    return getParentIndex() == NO_PARENT;
  }

  public int getCaseCount() {
    return getBlock().getCases().size();
  }
}
