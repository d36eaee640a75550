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

import com.facebook.cartesian.log.Logger;
import com.facebook.cartesian.model.Assignment;
import com.facebook.cartesian.model.AssignmentOperator;
import com.facebook.cartesian.model.FilterMode;
import com.facebook.cartesian.model.FilterStatement;
import com.facebook.cartesian.model.Scope;
import com.facebook.cartesian.model.Statement;
import com.facebook.cartesian.model.VariantCase;
import com.facebook.cartesian.model.VariantsBlock;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses indentation structured text into a {@link Scope}.
 *
 * <pre>
 * scope      ::= statement*                      (all at the same indentation)
 * statement  ::= 'variants:' case+               (cases one level deeper)
 *              | ('only' | 'no') EXPRESSION
 *              | KEY ('=' | '+=' | '&lt;=') VALUE
 * case       ::= '-' ['@'] NAME ':' scope?       (body one level deeper than the header)
 * </pre>
 *
 * <p>Blank lines and lines starting with {@code #} are ignored. {@code include PATH} lines are
 * replaced by the lines of the named file before any of the above is applied.
 */
public class BlockParser {
  private static final Logger LOG = Logger.get(BlockParser.class);

  public static final int DEFAULT_MAX_INCLUDE_DEPTH = 16;

  private static final String VARIANTS_HEADER = "variants:";
  private static final Pattern CASE_HEADER =
      Pattern.compile("^-\\s*(@?)([A-Za-z0-9_\\-]+)\\s*:$");
  private static final Pattern FILTER = Pattern.compile("^(only|no)\\s++(?![+<]?=)(.*)$");
  private static final Pattern KEY = Pattern.compile("^[A-Za-z0-9_.\\-]+$");

  private final IncludeResolver includeResolver;
  private final boolean stripQuotes;
  private final int maxIncludeDepth;

  public BlockParser(IncludeResolver includeResolver, boolean stripQuotes, int maxIncludeDepth) {
    this.includeResolver = includeResolver;
    this.stripQuotes = stripQuotes;
    this.maxIncludeDepth = maxIncludeDepth;
  }

  /** Parses text that has no file behind it, with default settings. */
  public static Scope parse(String text) throws ParseException {
    return new BlockParser(IncludeResolver.unsupported(), true, DEFAULT_MAX_INCLUDE_DEPTH)
        .parse(SourceText.of("<string>", text));
  }

  public Scope parseFile(Path path) throws IOException, ParseException {
    return parse(FileIncludeResolver.read(path));
  }

  public Scope parse(SourceText source) throws ParseException {
    ImmutableList<SourceLine> lines = SourceLines.read(source, includeResolver, maxIncludeDepth);
    LOG.debug("Read %d significant lines from %s", lines.size(), source.getName());
    return new Cursor(lines).parseDocument();
  }

  /** Position within the lines of one parse. */
  private class Cursor {
    private final ImmutableList<SourceLine> lines;
    private int position = 0;

    Cursor(ImmutableList<SourceLine> lines) {
      this.lines = lines;
    }

    Scope parseDocument() throws ParseException {
      if (lines.isEmpty()) {
        return Scope.empty();
      }
      Scope root = parseScope(lines.get(0).getIndent());
      if (position < lines.size()) {
        SourceLine line = lines.get(position);
        throw new ParseException(
            line,
            "indentation of %d does not match any open scope (document starts at %d)",
            line.getIndent(),
            lines.get(0).getIndent());
      }
      return root;
    }

    private Scope parseScope(int indent) throws ParseException {
      ImmutableList.Builder<Statement> statements = ImmutableList.builder();
      while (position < lines.size()) {
        SourceLine line = lines.get(position);
        if (line.getIndent() < indent) {
          break;
        }
        if (line.getIndent() > indent) {
          throw new ParseException(
              line,
              "unexpected indentation of %d, the enclosing scope is at %d",
              line.getIndent(),
              indent);
        }
        position++;
        statements.add(parseStatement(line));
      }
      return Scope.of(statements.build());
    }

    private Statement parseStatement(SourceLine line) throws ParseException {
      String text = line.getText();
      if (text.equals(VARIANTS_HEADER)) {
        return parseVariantsBlock(line);
      }
      if (CASE_HEADER.matcher(text).matches()) {
        throw new ParseException(line, "case header '%s' outside of a variants block", text);
      }
      if (FilterMode.fromKeyword(text).isPresent()) {
        throw new ParseException(line, "'%s' needs a filter expression", text);
      }
      Matcher filter = FILTER.matcher(text);
      if (filter.matches()) {
        FilterMode mode = FilterMode.fromKeyword(filter.group(1)).get();
        return FilterStatement.of(mode, filter.group(2).trim());
      }
      return parseAssignment(line);
    }

    private VariantsBlock parseVariantsBlock(SourceLine header) throws ParseException {
      ImmutableList.Builder<VariantCase> cases = ImmutableList.builder();
      if (position >= lines.size() || lines.get(position).getIndent() <= header.getIndent()) {
        // Reported as a structural problem once the tree is validated.
        return VariantsBlock.of(cases.build());
      }
      int caseIndent = lines.get(position).getIndent();
      while (position < lines.size()) {
        SourceLine line = lines.get(position);
        if (line.getIndent() <= header.getIndent()) {
          break;
        }
        if (line.getIndent() != caseIndent) {
          throw new ParseException(
              line,
              "indentation of %d does not match the cases of the variants block at %s",
              line.getIndent(),
              header);
        }
        Matcher matcher = CASE_HEADER.matcher(line.getText());
        if (!matcher.matches()) {
          throw new ParseException(
              line, "expected a case header '- name:' but found '%s'", line.getText());
        }
        position++;
        Scope body = Scope.empty();
        if (position < lines.size() && lines.get(position).getIndent() > caseIndent) {
          body = parseScope(lines.get(position).getIndent());
        }
        cases.add(VariantCase.of(matcher.group(2), !matcher.group(1).isEmpty(), body));
      }
      return VariantsBlock.of(cases.build());
    }

    private Assignment parseAssignment(SourceLine line) throws ParseException {
      String text = line.getText();
      int equals = text.indexOf('=');
      if (equals < 0) {
        throw new ParseException(line, "unrecognized statement '%s'", text);
      }
      int operatorStart = equals;
      if (equals > 0 && (text.charAt(equals - 1) == '+' || text.charAt(equals - 1) == '<')) {
        operatorStart = equals - 1;
      }
      AssignmentOperator operator =
          AssignmentOperator.fromToken(text.substring(operatorStart, equals + 1)).get();
      String key = text.substring(0, operatorStart).trim();
      if (!KEY.matcher(key).matches()) {
        throw new ParseException(line, "invalid parameter name '%s'", key);
      }
      String value = text.substring(equals + 1).trim();
      return Assignment.of(key, operator, stripQuotes ? unquote(value) : value);
    }
  }

  /** Removes one pair of matching single or double quotes surrounding the whole value. */
  static String unquote(String value) {
    if (value.length() >= 2) {
      char first = value.charAt(0);
      if ((first == '\'' || first == '"') && value.charAt(value.length() - 1) == first) {
        return value.substring(1, value.length() - 1);
      }
    }
    return value;
  }
}
