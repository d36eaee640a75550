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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** Tokenizer for filter expressions. */
final class Lexer {

  enum TokenKind {
    WORD("word"),
    DOT("."),
    DOUBLE_DOT(".."),
    COMMA(","),
    EOF("EOF");

    private final String prettyName;

    TokenKind(String prettyName) {
      this.prettyName = prettyName;
    }

    @Override
    public String toString() {
      return prettyName;
    }
  }

  static final class Token {
    final TokenKind kind;
    @Nullable final String word;
    /** Offset of the first character of the token. */
    final int position;

    Token(TokenKind kind, int position) {
      this(kind, null, position);
    }

    Token(TokenKind kind, @Nullable String word, int position) {
      this.kind = kind;
      this.word = word;
      this.position = position;
    }

    @Override
    public String toString() {
      return kind == TokenKind.WORD ? word : kind.toString();
    }
  }

  private final String input;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
  private int pos = 0;

  private Lexer(String input) {
    this.input = input;
  }

  /** Scans the whole expression; the last token is always {@link TokenKind#EOF}. */
  static ImmutableList<Token> scan(String input) throws FilterExpressionException {
    Lexer lexer = new Lexer(input);
    lexer.tokenize();
    return lexer.tokens.build();
  }

  private void tokenize() throws FilterExpressionException {
    while (pos < input.length()) {
      char c = input.charAt(pos);
      if (Character.isWhitespace(c)) {
        pos++;
      } else if (c == ',') {
        tokens.add(new Token(TokenKind.COMMA, pos++));
      } else if (c == '.') {
        if (pos + 1 < input.length() && input.charAt(pos + 1) == '.') {
          tokens.add(new Token(TokenKind.DOUBLE_DOT, pos));
          pos += 2;
        } else {
          tokens.add(new Token(TokenKind.DOT, pos++));
        }
      } else if (isWordChar(c)) {
        int start = pos;
        while (pos < input.length() && isWordChar(input.charAt(pos))) {
          pos++;
        }
        tokens.add(new Token(TokenKind.WORD, input.substring(start, pos), start));
      } else {
        throw new FilterExpressionException(
            input, "unexpected character '%s' at offset %d", c, pos);
      }
    }
    tokens.add(new Token(TokenKind.EOF, pos));
  }

  private static boolean isWordChar(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9')
        || c == '_'
        || c == '-';
  }
}
