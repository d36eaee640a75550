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

import com.facebook.cartesian.filter.CompiledFilter;
import com.facebook.cartesian.model.FilterStatement;
import com.facebook.cartesian.model.Scope;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.math.BigInteger;
import java.util.Optional;

/**
 * A validated scope tree together with the indexes expansion needs: every filter compiled, every
 * shortname in the tree, and the arena of axes in declaration order.
 */
public class VariantTree {

  private final Scope root;
  private final ImmutableList<Axis> axes;
  private final ImmutableSet<String> allShortnames;
  private final ImmutableMap<FilterStatement, CompiledFilter> filters;
  private final ImmutableList<CompiledFilter> globalFilters;
  private final BigInteger combinationCount;

  VariantTree(
      Scope root,
      ImmutableList<Axis> axes,
      ImmutableSet<String> allShortnames,
      ImmutableMap<FilterStatement, CompiledFilter> filters,
      ImmutableList<CompiledFilter> globalFilters,
      BigInteger combinationCount) {
    this.root = root;
    this.axes = axes;
    this.allShortnames = allShortnames;
    this.filters = filters;
    this.globalFilters = globalFilters;
    this.combinationCount = combinationCount;
  }

  public Scope getRoot() {
    return root;
  }

  public ImmutableList<Axis> getAxes() {
    return axes;
  }

  public Axis getAxis(int index) {
    return axes.get(index);
  }

  public Optional<Axis> getParent(Axis axis) {
    return axis.isTopLevel() ? Optional.empty() : Optional.of(axes.get(axis.getParentIndex()));
  }

  public ImmutableSet<String> getAllShortnames() {
    return allShortnames;
  }

  public CompiledFilter getCompiledFilter(FilterStatement statement) {
    CompiledFilter filter = filters.get(statement);
    Preconditions.checkArgument(filter != null, "Filter '%s' is not part of this tree", statement);
    return filter;
  }

  /** Filters given outside the document, applied to every path. */
  public ImmutableList<CompiledFilter> getGlobalFilters() {
    return globalFilters;
  }

  /** Number of complete paths before any filter is applied. */
  public BigInteger getCombinationCount() {
    return combinationCount;
  }

  /** Product of the case counts of every axis; never smaller than {@link #getCombinationCount}. */
  public BigInteger getAxisCaseProduct() {
    BigInteger product = BigInteger.ONE;
    for (Axis axis : axes) {
      product = product.multiply(BigInteger.valueOf(axis.getCaseCount()));
    }
    return product;
  }
}
