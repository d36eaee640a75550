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

package com.facebook.cartesian.parser;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.facebook.cartesian.model.Assignment;
import com.facebook.cartesian.model.AssignmentOperator;
import com.facebook.cartesian.model.FilterMode;
import com.facebook.cartesian.model.FilterStatement;
import com.facebook.cartesian.model.Scope;
import com.facebook.cartesian.model.VariantCase;
import com.facebook.cartesian.model.VariantsBlock;
import com.facebook.cartesian.testutil.TestDataHelper;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import org.junit.Test;

public class BlockParserTest {

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  @Test
  public void parsesAssignmentsWithEveryOperator() throws ParseException {
    Scope scope = BlockParser.parse(lines("a = 1", "a += 2", "a <= 0", "b=x"));

    assertEquals(4, scope.getStatements().size());
    assertEquals(
        Assignment.of("a", AssignmentOperator.SET, "1"), scope.getStatements().get(0));
    assertEquals(
        Assignment.of("a", AssignmentOperator.APPEND, "2"), scope.getStatements().get(1));
    assertEquals(
        Assignment.of("a", AssignmentOperator.PREPEND, "0"), scope.getStatements().get(2));
    assertEquals(Assignment.of("b", AssignmentOperator.SET, "x"), scope.getStatements().get(3));
  }

  @Test
  public void valueKeepsEverythingAfterTheFirstEquals() throws ParseException {
    Scope scope = BlockParser.parse("cmd = a=b == c\n");
    assertEquals(
        Assignment.of("cmd", AssignmentOperator.SET, "a=b == c"), scope.getStatements().get(0));
  }

  @Test
  public void stripsOneMatchingPairOfQuotes() throws ParseException {
    Scope scope =
        BlockParser.parse(lines("a = 'root'", "b = \"x\"", "c = 'it''s'", "d = 'open", "e = ''"));

    assertThat(valueOf(scope, 0), equalTo("root"));
    assertThat(valueOf(scope, 1), equalTo("x"));
    assertThat(valueOf(scope, 2), equalTo("it''s"));
    assertThat(valueOf(scope, 3), equalTo("'open"));
    assertThat(valueOf(scope, 4), equalTo(""));
  }

  @Test
  public void quotesAreKeptWhenStrippingIsDisabled() throws ParseException {
    BlockParser parser =
        new BlockParser(
            IncludeResolver.unsupported(), false, BlockParser.DEFAULT_MAX_INCLUDE_DEPTH);
    Scope scope = parser.parse(SourceText.of("test", "a = 'root'\n"));
    assertThat(valueOf(scope, 0), equalTo("'root'"));
  }

  @Test
  public void blankLinesAndCommentsAreIgnored() throws ParseException {
    Scope scope = BlockParser.parse(lines("", "# comment", "   ", "a = 1", "    # indented"));
    assertEquals(1, scope.getStatements().size());
  }

  @Test
  public void parsesFilters() throws ParseException {
    Scope scope = BlockParser.parse(lines("only a.b, c", "no x..y"));

    assertEquals(FilterStatement.of(FilterMode.ONLY, "a.b, c"), scope.getStatements().get(0));
    assertEquals(FilterStatement.of(FilterMode.NO, "x..y"), scope.getStatements().get(1));
  }

  @Test
  public void keysNamedLikeFilterKeywordsAreAssignments() throws ParseException {
    Scope scope = BlockParser.parse(lines("only = 1", "no += 2"));
    assertThat(scope.getStatements().get(0), instanceOf(Assignment.class));
    assertThat(scope.getStatements().get(1), instanceOf(Assignment.class));
  }

  @Test
  public void filterWithoutExpressionIsAnError() {
    ParseException e = assertThrows(ParseException.class, () -> BlockParser.parse("only\n"));
    assertThat(e.getMessage(), containsString("needs a filter expression"));
  }

  @Test
  public void parsesNestedVariants() throws ParseException {
    Scope scope =
        BlockParser.parse(
            lines(
                "x = 0",
                "variants:",
                "    - a:",
                "        x = 1",
                "        variants:",
                "            - a1:",
                "            - a2:",
                "                y = 2",
                "    - b:",
                "x += !"));

    assertEquals(3, scope.getStatements().size());
    VariantsBlock block = (VariantsBlock) scope.getStatements().get(1);
    assertEquals(2, block.getCases().size());

    VariantCase a = block.getCases().get(0);
    assertEquals("a", a.getShortname());
    assertFalse(a.isSilent());
    assertEquals(2, a.getBody().getStatements().size());
    VariantsBlock nested = (VariantsBlock) a.getBody().getStatements().get(1);
    assertEquals("a1", nested.getCases().get(0).getShortname());
    assertTrue(nested.getCases().get(0).getBody().getStatements().isEmpty());
    assertEquals(1, nested.getCases().get(1).getBody().getStatements().size());

    VariantCase b = block.getCases().get(1);
    assertEquals("b", b.getShortname());
    assertTrue(b.getBody().getStatements().isEmpty());

    assertEquals(
        Assignment.of("x", AssignmentOperator.APPEND, "!"), scope.getStatements().get(2));
  }

  @Test
  public void siblingVariantsBlocksAreSeparateStatements() throws ParseException {
    Scope scope =
        BlockParser.parse(lines("variants:", "  - a:", "  - b:", "variants:", "  - c:"));
    assertEquals(2, scope.getStatements().size());
    assertThat(scope.getStatements().get(0), instanceOf(VariantsBlock.class));
    assertThat(scope.getStatements().get(1), instanceOf(VariantsBlock.class));
  }

  @Test
  public void parsesSilentCases() throws ParseException {
    Scope scope = BlockParser.parse(lines("variants:", "    - @hidden:", "    - shown:"));
    VariantsBlock block = (VariantsBlock) scope.getStatements().get(0);
    assertEquals("hidden", block.getCases().get(0).getShortname());
    assertTrue(block.getCases().get(0).isSilent());
    assertFalse(block.getCases().get(1).isSilent());
  }

  @Test
  public void tabsAdvanceToTheNextMultipleOfEight() throws ParseException {
    Scope scope = BlockParser.parse(lines("variants:", "\t- a:", "\t\tx = 1", "        - b:"));
    VariantsBlock block = (VariantsBlock) scope.getStatements().get(0);
    assertEquals(2, block.getCases().size());
    assertEquals(1, block.getCases().get(0).getBody().getStatements().size());
  }

  @Test
  public void caseHeaderOutsideVariantsIsAnError() {
    ParseException e =
        assertThrows(ParseException.class, () -> BlockParser.parse(lines("a = 1", "- b:")));
    assertThat(e.getLineNumber(), is(2));
    assertThat(e.getMessage(), containsString("outside of a variants block"));
  }

  @Test
  public void keysMayStartWithADash() throws ParseException {
    Scope scope = BlockParser.parse("-x = 1\n");
    assertEquals(Assignment.of("-x", AssignmentOperator.SET, "1"), scope.getStatements().get(0));
  }

  @Test
  public void dashLineThatIsNotACaseHeaderIsUnrecognized() {
    ParseException e = assertThrows(ParseException.class, () -> BlockParser.parse("- b\n"));
    assertThat(e.getMessage(), containsString("unrecognized statement '- b'"));
  }

  @Test
  public void unexpectedIndentIsAnError() {
    ParseException e =
        assertThrows(ParseException.class, () -> BlockParser.parse(lines("a = 1", "  b = 2")));
    assertThat(e.getSource(), equalTo("<string>"));
    assertThat(e.getLineNumber(), is(2));
  }

  @Test
  public void dedentToAnUnknownLevelIsAnError() {
    ParseException e =
        assertThrows(
            ParseException.class,
            () ->
                BlockParser.parse(
                    lines("variants:", "    - a:", "        x = 1", "      y = 2")));
    assertThat(e.getLineNumber(), is(4));
  }

  @Test
  public void variantsBodyMustHoldCaseHeaders() {
    ParseException e =
        assertThrows(
            ParseException.class, () -> BlockParser.parse(lines("variants:", "    x = 1")));
    assertThat(e.getMessage(), containsString("expected a case header"));
  }

  @Test
  public void unrecognizedStatementIsAnError() {
    ParseException e =
        assertThrows(ParseException.class, () -> BlockParser.parse("just words\n"));
    assertThat(e.getMessage(), containsString("<string>:1:"));
  }

  @Test
  public void invalidKeyIsAnError() {
    assertThrows(ParseException.class, () -> BlockParser.parse("bad key = 1\n"));
  }

  @Test
  public void includeIsRejectedWithoutAFile() {
    ParseException e =
        assertThrows(ParseException.class, () -> BlockParser.parse("include other.cfg\n"));
    assertThat(e.getMessage(), containsString("unable to include other.cfg"));
  }

  @Test
  public void includeSplicesLinesAtTheIncludeIndentation() throws ParseException {
    Map<String, String> files =
        ImmutableMap.of(
            "main", lines("variants:", "    include cases"),
            "cases", lines("- a:", "    x = 1", "- b:"));
    BlockParser parser =
        new BlockParser(
            (source, path) -> SourceText.of(path, files.get(path)),
            true,
            BlockParser.DEFAULT_MAX_INCLUDE_DEPTH);

    Scope scope = parser.parse(SourceText.of("main", files.get("main")));

    VariantsBlock block = (VariantsBlock) scope.getStatements().get(0);
    assertEquals(2, block.getCases().size());
    assertEquals(1, block.getCases().get(0).getBody().getStatements().size());
  }

  @Test
  public void includeCycleIsAnError() {
    Map<String, String> files =
        ImmutableMap.of("one", "include two\n", "two", "a = 1\ninclude one\n");
    BlockParser parser =
        new BlockParser(
            (source, path) -> SourceText.of(path, files.get(path)),
            true,
            BlockParser.DEFAULT_MAX_INCLUDE_DEPTH);

    ParseException e =
        assertThrows(
            ParseException.class, () -> parser.parse(SourceText.of("one", files.get("one"))));
    assertThat(e.getSource(), equalTo("two"));
    assertThat(e.getLineNumber(), is(2));
    assertThat(e.getMessage(), containsString("include cycle"));
  }

  @Test
  public void includeDepthIsLimited() {
    BlockParser parser =
        new BlockParser(
            (source, path) -> SourceText.of(path + "x", "include " + path + "x\n"), true, 3);

    ParseException e =
        assertThrows(ParseException.class, () -> parser.parse(SourceText.of("f", "include f\n")));
    assertThat(e.getMessage(), containsString("maximum include depth of 3"));
  }

  @Test
  public void includesResolveRelativeToTheIncludingFile() throws Exception {
    Path main = TestDataHelper.getTestDataFile(this, "main.cfg");
    BlockParser parser =
        new BlockParser(new FileIncludeResolver(), true, BlockParser.DEFAULT_MAX_INCLUDE_DEPTH);

    Scope scope = parser.parseFile(main);

    assertEquals(2, scope.getStatements().size());
    VariantsBlock block = (VariantsBlock) scope.getStatements().get(1);
    assertEquals("small", block.getCases().get(0).getShortname());
    assertEquals("large", block.getCases().get(1).getShortname());
  }

  @Test
  public void missingFileIsReported() {
    Path missing = TestDataHelper.getTestDataFile(this, "missing.cfg");
    BlockParser parser =
        new BlockParser(new FileIncludeResolver(), true, BlockParser.DEFAULT_MAX_INCLUDE_DEPTH);
    assertThrows(NoSuchFileException.class, () -> parser.parseFile(missing));
  }

  private static String valueOf(Scope scope, int index) {
    return ((Assignment) scope.getStatements().get(index)).getValue();
  }
}
