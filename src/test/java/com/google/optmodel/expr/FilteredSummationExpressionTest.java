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

package com.google.optmodel.expr;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.optmodel.ModelException;
import com.google.optmodel.ModelManager;
import com.google.optmodel.model.IndexSet;
import com.google.optmodel.model.IndexedVariable;
import com.google.optmodel.model.Parameter;
import com.google.optmodel.model.ScalarValue;
import com.google.optmodel.model.ValueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public final class FilteredSummationExpressionTest {
  private ModelManager manager;

  @BeforeEach
  public void setUp() {
    manager = new ModelManager();
    manager.addIndexSet(new IndexSet("I", 1, 4));
    final Parameter cost =
        Parameter.indexed("cost", ValueType.FLOAT, ImmutableList.of("I"), false);
    cost.setIndexedValue(ImmutableList.of(1), ScalarValue.ofFloat(10));
    cost.setIndexedValue(ImmutableList.of(2), ScalarValue.ofFloat(20));
    cost.setIndexedValue(ImmutableList.of(3), ScalarValue.ofFloat(30));
    manager.addParameter(cost);
    manager.addVariable(
        new IndexedVariable("x", ValueType.FLOAT, ImmutableList.of("I"), 0.0, null));
  }

  private static Expression costOf(String iterator) {
    return new IndexedParameterExpression(
        "cost", ImmutableList.of(new ParameterExpression(iterator)));
  }

  @Test
  public void testSkipsCombinationsWithMissingData() {
    final Expression sum =
        new FilteredSummationExpression(
            ImmutableList.of(IteratorSpec.overSet("i", "I")), null, costOf("i"));
    assertEquals(60.0, sum.evaluate(manager), 1e-9);
  }

  @Test
  public void testIteratorShadowsParameterWhenSimplified() {
    final Parameter i = Parameter.scalar("i", ValueType.INT, false);
    i.setValue(ScalarValue.ofInt(7));
    manager.addParameter(i);
    final Expression sum =
        new FilteredSummationExpression(
            ImmutableList.of(IteratorSpec.overSet("i", "I")), null, new ParameterExpression("i"));
    assertEquals(10.0, sum.evaluate(manager), 0.0);
    assertEquals(10.0, sum.simplify(manager).evaluate(manager), 0.0);
  }

  @Test
  public void testFilter() {
    final Expression i = new ParameterExpression("i");
    final Expression sum =
        new FilteredSummationExpression(
            ImmutableList.of(
                IteratorSpec.overRange("i", new ConstantExpression(1), new ConstantExpression(4))),
            new ComparisonExpression(
                ComparisonExpression.Operator.GREATER_THAN, i, new ConstantExpression(2)),
            i);
    assertEquals(7.0, sum.evaluate(manager), 0.0);
  }

  @Test
  public void testNestedRangeReadsOuterIterator() {
    final Expression sum =
        new FilteredSummationExpression(
            ImmutableList.of(
                IteratorSpec.overSet("i", "I"),
                IteratorSpec.overRange(
                    "j", new ConstantExpression(1), new ParameterExpression("i"))),
            null,
            ConstantExpression.ONE);
    // 1 + 2 + 3 + 4 pairs.
    assertEquals(10.0, sum.evaluate(manager), 0.0);
  }

  @Test
  public void testUndeclaredSetIsNotSkipped() {
    final Expression sum =
        new FilteredSummationExpression(
            ImmutableList.of(IteratorSpec.overSet("i", "UndeclaredSet")), null, costOf("i"));
    final ModelException.NotFound e =
        assertThrows(ModelException.NotFound.class, () -> sum.evaluate(manager));
    assertThat(e).hasMessageThat().contains("UndeclaredSet");
  }

  @Test
  public void testTypeErrorsPropagate() {
    final Expression sum =
        new FilteredSummationExpression(
            ImmutableList.of(IteratorSpec.overSet("i", "I")), null, new VariableExpression("y"));
    assertThrows(ModelException.NotNumeric.class, () -> sum.evaluate(manager));
  }

  @Test
  public void testBindingsAreReleasedAfterFailure() {
    final EvaluationContext context = EvaluationContext.of(manager);
    final Expression sum =
        new FilteredSummationExpression(
            ImmutableList.of(IteratorSpec.overSet("i", "I")), null, new VariableExpression("y"));
    assertThrows(ModelException.NotNumeric.class, () -> sum.evaluate(context));
    assertEquals(0, context.depth());
  }

  @Test
  public void testLinearize() {
    final Expression sum =
        new FilteredSummationExpression(
            ImmutableList.of(IteratorSpec.overSet("i", "I")),
            null,
            BinaryExpression.multiply(
                costOf("i"),
                new IndexedVariableExpression(
                    "x", ImmutableList.of(new ParameterExpression("i")))));
    final LinearForm form = sum.linearize(EvaluationContext.of(manager)).simplify();
    assertThat(form.getCoefficients().keySet()).containsExactly("x1", "x2", "x3").inOrder();
    assertEquals(20.0, form.getCoefficients().get("x2").evaluate(manager), 1e-9);
    assertEquals(0.0, form.getOffset().evaluate(manager), 0.0);
  }
}
