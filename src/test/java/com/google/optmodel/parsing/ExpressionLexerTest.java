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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.optmodel.ModelException;
import com.google.optmodel.parsing.ExpressionLexer.Kind;
import com.google.optmodel.parsing.ExpressionLexer.Token;
import org.junit.jupiter.api.Test;

public final class ExpressionLexerTest {
  private static ImmutableList<Kind> kinds(String text) {
    final ImmutableList.Builder<Kind> kinds = ImmutableList.builder();
    for (Token token : ExpressionLexer.tokenize(text)) {
      kinds.add(token.kind());
    }
    return kinds.build();
  }

  @Test
  public void testRangeIsNotADecimal() {
    assertThat(kinds("1..n"))
        .containsExactly(Kind.NUMBER, Kind.DOTDOT, Kind.IDENT, Kind.EOF)
        .inOrder();
    final ImmutableList<Token> tokens = ExpressionLexer.tokenize("2.5e-1 * x");
    assertEquals("2.5e-1", tokens.get(0).text());
  }

  @Test
  public void testOperators() {
    assertThat(kinds("a <= b != c && !d || e == f >= g = h"))
        .containsExactly(
            Kind.IDENT, Kind.LE, Kind.IDENT, Kind.NE, Kind.IDENT, Kind.AND, Kind.NOT, Kind.IDENT,
            Kind.OR, Kind.IDENT, Kind.EQ, Kind.IDENT, Kind.GE, Kind.IDENT, Kind.ASSIGN, Kind.IDENT,
            Kind.EOF)
        .inOrder();
  }

  @Test
  public void testStringsAndPlaceholders() {
    final ImmutableList<Token> tokens = ExpressionLexer.tokenize("__ITEM3__ == \"a b\"");
    assertEquals(Kind.PLACEHOLDER, tokens.get(0).kind());
    assertEquals(Kind.STRING, tokens.get(2).kind());
    assertEquals("a b", tokens.get(2).text());
    assertEquals(10, tokens.get(1).offset());
  }

  @Test
  public void testErrors() {
    assertThrows(
        ModelException.MalformedExpression.class, () -> ExpressionLexer.tokenize("\"open"));
    final ModelException e =
        assertThrows(
            ModelException.MalformedExpression.class, () -> ExpressionLexer.tokenize("a # b"));
    assertThat(e).hasMessageThat().contains("'#'");
    assertThrows(
        ModelException.MalformedExpression.class, () -> ExpressionLexer.tokenize("a & b"));
  }
}
