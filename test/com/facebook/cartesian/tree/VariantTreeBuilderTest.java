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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.facebook.cartesian.filter.FilterExpressionException;
import com.facebook.cartesian.model.FilterMode;
import com.facebook.cartesian.model.FilterStatement;
import com.facebook.cartesian.parser.BlockParser;
import com.facebook.cartesian.parser.ParseException;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.Optional;
import org.junit.Test;

public class VariantTreeBuilderTest {

  private static VariantTree build(String... lines) throws Exception {
    return VariantTreeBuilder.build(BlockParser.parse(Joiner.on('\n').join(lines)));
  }

  @Test
  public void recordsAxesInDeclarationOrderWithTheirParents() throws Exception {
    VariantTree tree =
        build(
            "variants:",
            "    - a:",
            "        variants:",
            "            - a1:",
            "            - a2:",
            "    - b:",
            "variants:",
            "    - x:",
            "    - y:",
            "    - z:");

    assertEquals(3, tree.getAxes().size());
    Axis outer = tree.getAxis(0);
    Axis nested = tree.getAxis(1);
    Axis sibling = tree.getAxis(2);

    assertTrue(outer.isTopLevel());
    assertEquals(Optional.empty(), tree.getParent(outer));
    assertFalse(nested.isTopLevel());
    assertEquals(Optional.of(outer), tree.getParent(nested));
    assertEquals(Optional.of("a"), nested.getOwningCase());
    assertTrue(sibling.isTopLevel());
    assertEquals(3, sibling.getCaseCount());

    assertThat(tree.getAllShortnames(), containsInAnyOrder("a", "a1", "a2", "b", "x", "y", "z"));
  }

  @Test
  public void countsCombinationsAcrossSiblingAndNestedAxes() throws Exception {
    VariantTree tree =
        build(
            "variants:",
            "    - a:",
            "        variants:",
            "            - a1:",
            "            - a2:",
            "    - b:",
            "variants:",
            "    - x:",
            "    - y:",
            "    - z:");

    // (2 + 1) * 3
    assertEquals(BigInteger.valueOf(9), tree.getCombinationCount());
    assertEquals(BigInteger.valueOf(12), tree.getAxisCaseProduct());
  }

  @Test
  public void treeWithoutAxesHasOneCombination() throws Exception {
    VariantTree tree = build("a = 1");
    assertEquals(BigInteger.ONE, tree.getCombinationCount());
    assertTrue(tree.getAxes().isEmpty());
  }

  @Test
  public void duplicateShortnamesInOneBlockAreRejected() {
    StructureException e =
        assertThrows(
            StructureException.class,
            () ->
                build(
                    "variants:",
                    "    - a:",
                    "        variants:",
                    "            - dup:",
                    "            - dup:"));
    assertThat(e.getMessage(), equalTo("duplicate case 'dup' in variants block under a"));
  }

  @Test
  public void silentAndPlainCasesShareOneNamespace() {
    assertThrows(StructureException.class, () -> build("variants:", "  - @a:", "  - a:"));
  }

  @Test
  public void theSameShortnameMayAppearInDifferentBlocks() throws Exception {
    VariantTree tree =
        build("variants:", "  - a:", "variants:", "  - b:", "    variants:", "      - a:");
    assertEquals(3, tree.getAxes().size());
  }

  @Test
  public void emptyVariantsBlockIsRejected() {
    StructureException e =
        assertThrows(StructureException.class, () -> build("x = 1", "variants:", "y = 2"));
    assertThat(e.getMessage(), containsString("has no cases"));
  }

  @Test
  public void malformedFilterIsRejectedBeforeExpansion() {
    FilterExpressionException e =
        assertThrows(
            FilterExpressionException.class,
            () -> build("variants:", "    - a:", "        only a..", "    - b:"));
    assertThat(e.getExpression(), equalTo("a.."));
  }

  @Test
  public void globalFiltersAreCompiledUpFront() throws ParseException {
    ImmutableList<FilterStatement> extra =
        ImmutableList.of(FilterStatement.of(FilterMode.ONLY, "a,"));
    assertThrows(
        FilterExpressionException.class,
        () -> VariantTreeBuilder.build(BlockParser.parse("variants:\n  - a:\n"), extra));
  }

  @Test
  public void everyFilterOfTheTreeIsCompiled() throws Exception {
    VariantTree tree = build("only a", "variants:", "    - a:", "        no b");
    FilterStatement statement = FilterStatement.of(FilterMode.NO, "b");
    assertEquals(FilterMode.NO, tree.getCompiledFilter(statement).getMode());
    assertThrows(
        IllegalArgumentException.class,
        () -> tree.getCompiledFilter(FilterStatement.of(FilterMode.NO, "unknown")));
  }
}
