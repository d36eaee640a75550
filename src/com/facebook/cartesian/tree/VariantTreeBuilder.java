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

import static com.google.common.base.Throwables.throwIfInstanceOf;

import com.facebook.cartesian.filter.CompiledFilter;
import com.facebook.cartesian.filter.FilterExpressionException;
import com.facebook.cartesian.log.Logger;
import com.facebook.cartesian.model.Assignment;
import com.facebook.cartesian.model.FilterStatement;
import com.facebook.cartesian.model.Scope;
import com.facebook.cartesian.model.Statement;
import com.facebook.cartesian.model.VariantCase;
import com.facebook.cartesian.model.VariantsBlock;
import com.facebook.cartesian.util.CartesianException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a parsed {@link Scope} and indexes it into a {@link VariantTree}. Nothing is exposed
 * unless the whole tree is valid.
 */
public class VariantTreeBuilder {
  private static final Logger LOG = Logger.get(VariantTreeBuilder.class);

  private final List<Axis> axes = new ArrayList<>();
  private final Set<String> allShortnames = new LinkedHashSet<>();
  private final Map<FilterStatement, CompiledFilter> filters = new LinkedHashMap<>();

  private VariantTreeBuilder() {}

  public static VariantTree build(Scope root)
      throws StructureException, FilterExpressionException {
    return build(root, ImmutableList.of());
  }

  /**
   * @param extraFilters filters that apply to every path as if declared at the end of the root
   *     scope; they are compiled with the tree's own so that they are validated up front
   */
  public static VariantTree build(Scope root, ImmutableList<FilterStatement> extraFilters)
      throws StructureException, FilterExpressionException {
    VariantTreeBuilder builder = new VariantTreeBuilder();
    BigInteger combinations;
    try {
      combinations = builder.visitScope(root, Axis.NO_PARENT, Optional.empty(), "");
    } catch (CartesianException e) {
      throwIfInstanceOf(e, StructureException.class);
      throwIfInstanceOf(e, FilterExpressionException.class);
      throw new IllegalStateException("Unexpected error while validating the tree", e);
    }
    ImmutableList.Builder<CompiledFilter> globalFilters = ImmutableList.builder();
    for (FilterStatement filter : extraFilters) {
      globalFilters.add(CompiledFilter.compile(filter));
    }
    VariantTree tree =
        new VariantTree(
            root,
            ImmutableList.copyOf(builder.axes),
            ImmutableSet.copyOf(builder.allShortnames),
            ImmutableMap.copyOf(builder.filters),
            globalFilters.build(),
            combinations);
    LOG.debug(
        "Built tree with %d axes, %d shortnames, %d filters and %s unfiltered combinations",
        tree.getAxes().size(),
        tree.getAllShortnames().size(),
        builder.filters.size(),
        combinations);
    return tree;
  }

  /** @return the number of complete paths through {@code scope}. */
  private BigInteger visitScope(
      Scope scope, int parentIndex, Optional<String> owningCase, String location)
      throws CartesianException {
    BigInteger combinations = BigInteger.ONE;
    for (Statement statement : scope.getStatements()) {
      BigInteger factor =
          statement.accept(
              new Statement.Visitor<BigInteger, CartesianException>() {
                @Override
                public BigInteger visitAssignment(Assignment assignment) {
                  return BigInteger.ONE;
                }

                @Override
                public BigInteger visitVariantsBlock(VariantsBlock block)
                    throws CartesianException {
                  return visitBlock(block, parentIndex, owningCase, location);
                }

                @Override
                public BigInteger visitFilter(FilterStatement filter)
                    throws FilterExpressionException {
                  compile(filter);
                  return BigInteger.ONE;
                }
              });
      combinations = combinations.multiply(factor);
    }
    return combinations;
  }

  private BigInteger visitBlock(
      VariantsBlock block, int parentIndex, Optional<String> owningCase, String location)
      throws CartesianException {
    String where = location.isEmpty() ? "at the top level" : "under " + location;
    if (block.getCases().isEmpty()) {
      throw new StructureException("variants block %s has no cases", where);
    }
    int index = axes.size();
    axes.add(Axis.of(index, parentIndex, owningCase, block));

    Set<String> seen = new HashSet<>();
    BigInteger combinations = BigInteger.ZERO;
    for (VariantCase variantCase : block.getCases()) {
      String shortname = variantCase.getShortname();
      if (!seen.add(shortname)) {
        throw new StructureException(
            "duplicate case '%s' in variants block %s", shortname, where);
      }
      allShortnames.add(shortname);
      String caseLocation = location.isEmpty() ? shortname : location + "." + shortname;
      combinations =
          combinations.add(
              visitScope(variantCase.getBody(), index, Optional.of(shortname), caseLocation));
    }
    return combinations;
  }

  private void compile(FilterStatement filter) throws FilterExpressionException {
    if (!filters.containsKey(filter)) {
      filters.put(filter, CompiledFilter.compile(filter));
    }
  }
}
