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

package com.facebook.cartesian.filter;

import com.facebook.cartesian.filter.Lexer.Token;
import com.facebook.cartesian.filter.Lexer.TokenKind;
import com.google.common.collect.ImmutableList;

/**
 * LL(1) recursive descent parser for filter expressions.
 *
 * <pre>
 * expr  ::= chain ( ( ',' | whitespace ) chain )*
 * chain ::= WORD ( ( '.' | '..' ) WORD )*
 * </pre>
 *
 * <p>Dots bind tighter than commas, so {@code a.b, c} is {@code (a.b), c}.
 */
final class FilterParser {

  private final String expression;
  private final ImmutableList<Token> tokens;
  private int index = 0;

  private FilterParser(String expression, ImmutableList<Token> tokens) {
    this.expression = expression;
    this.tokens = tokens;
  }

  static FilterExpression parse(String expression) throws FilterExpressionException {
    FilterParser parser = new FilterParser(expression, Lexer.scan(expression));
    return parser.parseExpression();
  }

  private Token token() {
    return tokens.get(index);
  }

  private FilterExpression parseExpression() throws FilterExpressionException {
    ImmutableList.Builder<FilterChain> alternatives = ImmutableList.builder();
    alternatives.add(parseChain());
    while (token().kind != TokenKind.EOF) {
      if (token().kind == TokenKind.COMMA) {
        index++;
      } else if (token().kind != TokenKind.WORD) {
        throw syntaxError("expected ',' or a name");
      }
      // Otherwise two names separated only by whitespace, an alternative as well.
      alternatives.add(parseChain());
    }
    return FilterExpression.of(expression, alternatives.build());
  }

  private FilterChain parseChain() throws FilterExpressionException {
    ImmutableList.Builder<String> terms = ImmutableList.builder();
    ImmutableList.Builder<FilterChain.Link> links = ImmutableList.builder();
    terms.add(consumeWord());
    while (true) {
      TokenKind kind = token().kind;
      if (kind == TokenKind.DOT) {
        links.add(FilterChain.Link.ADJACENT);
      } else if (kind == TokenKind.DOUBLE_DOT) {
        links.add(FilterChain.Link.FOLLOWED);
      } else {
        break;
      }
      index++;
      terms.add(consumeWord());
    }
    return FilterChain.of(terms.build(), links.build());
  }

  private String consumeWord() throws FilterExpressionException {
    Token current = token();
    if (current.kind != TokenKind.WORD) {
      throw syntaxError("expected a name");
    }
    index++;
    return current.word;
  }

  private FilterExpressionException syntaxError(String expected) {
    Token current = token();
    if (current.kind == TokenKind.EOF) {
      return new FilterExpressionException(expression, "premature end of input, %s", expected);
    }
    return new FilterExpressionException(
        expression, "%s at offset %d, found '%s'", expected, current.position, current);
  }
}
