// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.optmodel.parsing;

import com.google.common.collect.ImmutableList;
import com.google.optmodel.ModelException;
import com.google.optmodel.model.ScalarValue;
import com.google.optmodel.parsing.ExpressionLexer.Kind;
import com.google.optmodel.parsing.ExpressionLexer.Token;
import java.util.Optional;

/**
 * Reads literal data: scalars, lists {@code [1, 2]} or {@code {1, 2}}, matrices
 * {@code [[1, 2], [3, 4]]}, tuples {@code <1, "a">} and sets of tuples {@code {<1, "a">, ...}}.
 */
final class LiteralParser {
  private final String text;
  private final ImmutableList<Token> input;
  private int pos;

  private LiteralParser(String text) {
    this.text = text;
    this.input = ExpressionLexer.tokenize(text);
  }

  /** Returns the value of a single literal, or empty if {@code text} is not one. */
  static Optional<ScalarValue> tryScalar(String text) {
    LiteralParser parser = new LiteralParser(text);
    Optional<ScalarValue> value = parser.scalarOrEmpty();
    if (value.isPresent() && !parser.peek().is(Kind.EOF)) {
      return Optional.empty();
    }
    return value;
  }

  /** Reads {@code [a, b, ...]} or {@code {a, b, ...}}. */
  static ImmutableList<ScalarValue> list(String text) {
    LiteralParser parser = new LiteralParser(text);
    ImmutableList<ScalarValue> values = parser.values();
    parser.expectEnd();
    return values;
  }

  /** Reads {@code [[a, b], [c, d]]}, one inner list per row. */
  static ImmutableList<ImmutableList<ScalarValue>> matrix(String text) {
    LiteralParser parser = new LiteralParser(text);
    ImmutableList.Builder<ImmutableList<ScalarValue>> rows = ImmutableList.builder();
    parser.expect(Kind.LBRACKET);
    if (!parser.accept(Kind.RBRACKET)) {
      do {
        rows.add(parser.values());
      } while (parser.accept(Kind.COMMA));
      parser.expect(Kind.RBRACKET);
    }
    parser.expectEnd();
    return rows.build();
  }

  /** Reads a single tuple {@code <a, b, ...>}. */
  static ImmutableList<ScalarValue> tuple(String text) {
    LiteralParser parser = new LiteralParser(text);
    ImmutableList<ScalarValue> values = parser.tupleValues();
    parser.expectEnd();
    return values;
  }

  /** Reads {@code {<a, b>, <c, d>}}. */
  static ImmutableList<ImmutableList<ScalarValue>> tuples(String text) {
    LiteralParser parser = new LiteralParser(text);
    ImmutableList.Builder<ImmutableList<ScalarValue>> tuples = ImmutableList.builder();
    parser.expect(Kind.LBRACE);
    if (!parser.accept(Kind.RBRACE)) {
      do {
        tuples.add(parser.tupleValues());
      } while (parser.accept(Kind.COMMA));
      parser.expect(Kind.RBRACE);
    }
    parser.expectEnd();
    return tuples.build();
  }

  private ImmutableList<ScalarValue> values() {
    Kind close;
    if (accept(Kind.LBRACKET)) {
      close = Kind.RBRACKET;
    } else if (accept(Kind.LBRACE)) {
      close = Kind.RBRACE;
    } else {
      throw error("expected '[' or '{' but found " + peek());
    }
    ImmutableList.Builder<ScalarValue> values = ImmutableList.builder();
    if (accept(close)) {
      return values.build();
    }
    do {
      values.add(scalar());
    } while (accept(Kind.COMMA));
    expect(close);
    return values.build();
  }

  private ImmutableList<ScalarValue> tupleValues() {
    expect(Kind.LT);
    ImmutableList.Builder<ScalarValue> values = ImmutableList.builder();
    do {
      values.add(scalar());
    } while (accept(Kind.COMMA));
    expect(Kind.GT);
    return values.build();
  }

  private ScalarValue scalar() {
    Optional<ScalarValue> value = scalarOrEmpty();
    if (value.isEmpty()) {
      throw error("expected a literal but found " + peek());
    }
    return value.get();
  }

  private Optional<ScalarValue> scalarOrEmpty() {
    boolean negative = false;
    if (peek().is(Kind.MINUS) && input.get(pos + 1).is(Kind.NUMBER)) {
      pos++;
      negative = true;
    }
    Token token = peek();
    switch (token.kind()) {
      case NUMBER:
        pos++;
        return Optional.of(ScalarValue.parseLiteral(negative ? "-" + token.text() : token.text()));
      case STRING:
        pos++;
        return Optional.of(ScalarValue.ofString(token.text()));
      case IDENT:
        if (token.text().equals("true") || token.text().equals("false")) {
          pos++;
          return Optional.of(ScalarValue.ofBool(Boolean.parseBoolean(token.text())));
        }
        return Optional.empty();
      default:
        return Optional.empty();
    }
  }

  private Token peek() {
    return input.get(pos);
  }

  private boolean accept(Kind kind) {
    if (peek().is(kind)) {
      pos++;
      return true;
    }
    return false;
  }

  private void expect(Kind kind) {
    if (!accept(kind)) {
      throw error("unexpected " + peek());
    }
  }

  private void expectEnd() {
    if (!peek().is(Kind.EOF)) {
      throw error("unexpected " + peek());
    }
  }

  private ModelException error(String message) {
    return new ModelException.MalformedExpression(
        "literal", message + " in \"" + text + "\"");
  }
}
