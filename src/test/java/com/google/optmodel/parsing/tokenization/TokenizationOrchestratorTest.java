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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.optmodel.ModelException;
import com.google.optmodel.ModelManager;
import com.google.optmodel.expr.IndexedParameterExpression;
import com.google.optmodel.expr.ItemFieldAccessExpression;
import com.google.optmodel.expr.IteratorTupleFieldAccessExpression;
import com.google.optmodel.expr.ParameterExpression;
import com.google.optmodel.expr.TupleFieldAccessExpression;
import com.google.optmodel.model.IndexSet;
import com.google.optmodel.model.IndexedVariable;
import com.google.optmodel.model.Parameter;
import com.google.optmodel.model.ScalarValue;
import com.google.optmodel.model.TupleInstance;
import com.google.optmodel.model.TupleSchema;
import com.google.optmodel.model.TupleSet;
import com.google.optmodel.model.ValueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public final class TokenizationOrchestratorTest {
  private ModelManager manager;
  private TokenManager tokens;
  private TokenizationOrchestrator orchestrator;

  @BeforeEach
  public void setUp() {
    manager = new ModelManager();
    manager.addIndexSet(new IndexSet("I", 1, 5));
    manager.addIndexSet(new IndexSet("J", 1, 2));
    manager.addParameter(Parameter.indexed("a", ValueType.INT, ImmutableList.of("I"), false));
    final Parameter n = Parameter.scalar("n", ValueType.INT, false);
    n.setValue(ScalarValue.ofInt(3));
    manager.addParameter(n);
    manager.addVariable(
        new IndexedVariable("x", ValueType.FLOAT, ImmutableList.of("I"), null, null));
    manager.addVariable(
        new IndexedVariable("y", ValueType.FLOAT, ImmutableList.of("I", "J"), null, null));
    final TupleSchema arc =
        new TupleSchema("Arc")
            .addField("id", ValueType.INT, true)
            .addField("cost", ValueType.FLOAT, false);
    manager.addTupleSchema(arc);
    final TupleSet arcs = new TupleSet("Arcs", "Arc", false);
    arcs.addInstance(
        TupleInstance.of(arc, ImmutableList.of(ScalarValue.ofInt(1), ScalarValue.ofFloat(2))));
    arcs.addInstance(
        TupleInstance.of(arc, ImmutableList.of(ScalarValue.ofInt(2), ScalarValue.ofFloat(4))));
    manager.addTupleSet(arcs);
    tokens = new TokenManager();
    orchestrator = TokenizationOrchestrator.createDefault();
  }

  private String tokenize(String text) {
    return orchestrator.tokenize(text, tokens, manager);
  }

  @Test
  public void testStrategiesRunInPriorityOrder() {
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    for (TokenizationStrategy strategy : orchestrator.getStrategies()) {
      names.add(strategy.name());
    }
    assertThat(names.build())
        .containsExactly(
            "ItemExpressionTokenizer",
            "TupleFieldAccessTokenizer",
            "TwoDimensionalIndexTokenizer",
            "SingleDimensionalIndexTokenizer",
            "ScalarParameterTokenizer")
        .inOrder();
  }

  @Test
  public void testFlattensLiteralVariableIndices() {
    assertEquals("x2 + 3 * y1_2", tokenize("x[2] + 3 * y[1, 2]"));
    assertTrue(tokens.isFlattenedVariable("x2"));
    assertTrue(tokens.isFlattenedVariable("y1_2"));
    assertEquals(0, tokens.size());
  }

  @Test
  public void testReplacesParameters() {
    assertEquals("__PARAM0__ * x1 <= __PARAM1__", tokenize("a[4] * x[1] <= n"));
    final IndexedParameterExpression indexed =
        (IndexedParameterExpression) tokens.get("__PARAM0__");
    assertEquals("a", indexed.getName());
    assertThat(tokens.get("__PARAM1__")).isInstanceOf(ParameterExpression.class);
  }

  @Test
  public void testRejectsIndicesOutsideTheirSet() {
    assertThrows(ModelException.OutOfRange.class, () -> tokenize("x[0] >= 1"));
    final ModelException.OutOfRange e =
        assertThrows(ModelException.OutOfRange.class, () -> tokenize("a[6] * x[1] >= 1"));
    assertThat(e).hasMessageThat().contains("out of range");
  }

  @Test
  public void testRejectsIndicesPastIntRange() {
    final ModelException.OutOfRange e =
        assertThrows(ModelException.OutOfRange.class, () -> tokenize("x[99999999999] <= 1"));
    assertThat(e).hasMessageThat().contains("99999999999");
    assertThrows(ModelException.OutOfRange.class, () -> tokenize("y[1, 99999999999] <= 1"));
    assertThrows(ModelException.OutOfRange.class, () -> tokenize("Arcs[99999999999].cost"));
    assertEquals(0, tokens.size());
  }

  @Test
  public void testRejectsWrongDimension() {
    assertThrows(ModelException.MalformedExpression.class, () -> tokenize("y[1] >= 0"));
  }

  @Test
  public void testLeavesUnknownNamesAndIteratorsAlone() {
    assertEquals("z[1] + w + a[i] + x[i]", tokenize("z[1] + w + a[i] + x[i]"));
    assertEquals("sum(i in 1..__PARAM0__) x[i]", tokenize("sum(i in 1..n) x[i]"));
  }

  @Test
  public void testSkipsStringLiteralsAndFieldNames() {
    assertEquals("\"n\" == p.n", tokenize("\"n\" == p.n"));
  }

  @Test
  public void testTupleFieldAccess() {
    assertEquals("__TUPLE0__ + __TUPLE_ITER1__", tokenize("Arcs[2].cost + Arcs[p].cost"));
    final TupleFieldAccessExpression literal =
        (TupleFieldAccessExpression) tokens.get("__TUPLE0__");
    assertEquals(2, literal.getIndex());
    assertThat(tokens.get("__TUPLE_ITER1__"))
        .isInstanceOf(IteratorTupleFieldAccessExpression.class);
    assertThrows(ModelException.OutOfRange.class, () -> tokenize("Arcs[3].cost"));
    assertThrows(ModelException.NotFound.class, () -> tokenize("Arcs[1].length"));
  }

  @Test
  public void testItemExpressions() {
    assertEquals("__ITEM0__ * x1", tokenize("item(Arcs, 2).cost * x[1]"));
    final ItemFieldAccessExpression item = (ItemFieldAccessExpression) tokens.get("__ITEM0__");
    assertEquals("cost", item.getFieldName());
    assertEquals(4.0, item.evaluate(manager), 0.0);
    assertThrows(ModelException.TupleSetNotFound.class, () -> tokenize("item(Edges, 1).cost"));
    assertThrows(
        ModelException.KeyArityMismatch.class, () -> tokenize("item(Arcs, <1, 2>).cost"));
  }
}
