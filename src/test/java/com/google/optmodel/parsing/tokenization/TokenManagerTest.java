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

package com.google.optmodel.parsing.tokenization;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.optmodel.ModelException;
import com.google.optmodel.expr.ConstantExpression;
import com.google.optmodel.expr.Expression;
import com.google.optmodel.expr.ParameterExpression;
import org.junit.jupiter.api.Test;

public final class TokenManagerTest {
  @Test
  public void testCounterIsSharedAcrossKinds() {
    final TokenManager tokens = new TokenManager();
    assertEquals("__ITEM0__", tokens.register(TokenManager.Kind.ITEM, ConstantExpression.ONE));
    assertEquals(
        "__PARAM1__", tokens.register(TokenManager.Kind.PARAM, new ParameterExpression("n")));
    assertEquals(
        "__TUPLE_ITER2__", tokens.register(TokenManager.Kind.TUPLE_ITER, ConstantExpression.ZERO));
    assertEquals(3, tokens.size());
  }

  @Test
  public void testGet() {
    final TokenManager tokens = new TokenManager();
    final Expression n = new ParameterExpression("n");
    final String placeholder = tokens.register(TokenManager.Kind.PARAM, n);
    assertThat(tokens.get(placeholder)).isSameInstanceAs(n);
    assertTrue(tokens.contains(placeholder));
    final ModelException.NotFound e =
        assertThrows(ModelException.NotFound.class, () -> tokens.get("__PARAM7__"));
    assertThat(e).hasMessageThat().contains("__PARAM7__");
  }

  @Test
  public void testClearResetsCounter() {
    final TokenManager tokens = new TokenManager();
    tokens.register(TokenManager.Kind.TUPLE, ConstantExpression.ONE);
    tokens.registerFlattenedVariable("x1");
    assertTrue(tokens.isFlattenedVariable("x1"));
    tokens.clear();
    assertEquals(0, tokens.size());
    assertFalse(tokens.isFlattenedVariable("x1"));
    assertEquals("__TUPLE0__", tokens.register(TokenManager.Kind.TUPLE, ConstantExpression.ONE));
  }

  @Test
  public void testIsPlaceholder() {
    assertTrue(TokenManager.isPlaceholder("__ITEM12__"));
    assertTrue(TokenManager.isPlaceholder("__TUPLE_ITER0__"));
    assertFalse(TokenManager.isPlaceholder("__ITEM__"));
    assertFalse(TokenManager.isPlaceholder("__other1__"));
    assertFalse(TokenManager.isPlaceholder("x1"));
  }
}
