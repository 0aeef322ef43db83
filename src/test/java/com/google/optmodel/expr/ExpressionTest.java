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
import com.google.optmodel.model.Parameter;
import com.google.optmodel.model.ScalarValue;
import com.google.optmodel.model.ValueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public final class ExpressionTest {
  private ModelManager manager;

  @BeforeEach
  public void setUp() {
    manager = new ModelManager();
    manager.addIndexSet(new IndexSet("I", 1, 3));
    final Parameter capacity = Parameter.scalar("capacity", ValueType.FLOAT, false);
    capacity.setValue(ScalarValue.ofFloat(12.5));
    manager.addParameter(capacity);
    final Parameter city = Parameter.scalar("city", ValueType.STRING, false);
    city.setValue(ScalarValue.ofString("Paris"));
    manager.addParameter(city);
    manager.addParameter(Parameter.scalar("unset", ValueType.INT, true));
  }

  private static Expression constant(double value) {
    return new ConstantExpression(value);
  }

  @Test
  public void testArithmetic() {
    final Expression e =
        BinaryExpression.subtract(
            BinaryExpression.multiply(constant(2), constant(3)),
            BinaryExpression.divide(constant(8), constant(4)));
    assertEquals(4.0, e.evaluate(manager), 0.0);
    assertEquals(-4.0, UnaryExpression.negate(e).evaluate(manager), 0.0);
  }

  @Test
  public void testSimplifyThenEvaluateMatchesEvaluate() {
    final ImmutableList<Expression> trees =
        ImmutableList.of(
            BinaryExpression.add(
                BinaryExpression.multiply(constant(2), constant(3)),
                UnaryExpression.negate(constant(4))),
            new ConditionalExpression(
                new ComparisonExpression(
                    ComparisonExpression.Operator.LESS_THAN, constant(1), constant(2)),
                constant(10),
                constant(20)),
            new LogicalExpression(
                LogicalExpression.Operator.OR,
                constant(0),
                new UnaryExpression(UnaryExpression.Operator.NOT, constant(0))),
            BinaryExpression.divide(new ParameterExpression("capacity"), constant(5)));
    for (Expression tree : trees) {
      assertEquals(tree.evaluate(manager), tree.simplify().evaluate(manager), 1e-12);
      assertEquals(tree.evaluate(manager), tree.simplify(manager).evaluate(manager), 1e-12);
    }
  }

  @Test
  public void testSimplifyIsIdempotent() {
    final Expression parameter = new ParameterExpression("capacity");
    final Expression e =
        BinaryExpression.multiply(
            BinaryExpression.add(parameter, ConstantExpression.ZERO), ConstantExpression.ONE);
    final Expression once = e.simplify();
    assertThat(once).isSameInstanceAs(parameter);
    assertThat(once.simplify()).isSameInstanceAs(once);

    final Expression folded = BinaryExpression.add(constant(1), constant(2)).simplify();
    assertThat(folded).isInstanceOf(ConstantExpression.class);
    assertThat(folded.simplify()).isSameInstanceAs(folded);
  }

  @Test
  public void testSimplifyFoldsParametersGivenManager() {
    final Expression e =
        BinaryExpression.multiply(new ParameterExpression("capacity"), constant(2));
    assertThat(e.simplify()).isSameInstanceAs(e);
    final Expression folded = e.simplify(manager);
    assertThat(Expressions.literalValue(folded).getAsDouble()).isEqualTo(25.0);
  }

  @Test
  public void testConditionalUsesEpsilon() {
    final Expression tiny = new ConditionalExpression(constant(1e-11), constant(1), constant(2));
    final Expression small = new ConditionalExpression(constant(1e-9), constant(1), constant(2));
    assertEquals(2.0, tiny.evaluate(manager), 0.0);
    assertEquals(1.0, small.evaluate(manager), 0.0);
    assertEquals(2.0, Expressions.literalValue(tiny.simplify()).getAsDouble(), 0.0);
  }

  @Test
  public void testStringComparison() {
    final Expression same =
        new ComparisonExpression(
            ComparisonExpression.Operator.EQUAL,
            new ParameterExpression("city"),
            new StringConstantExpression("Paris"));
    assertEquals(1.0, same.evaluate(manager), 0.0);
    final Expression mixed =
        new ComparisonExpression(
            ComparisonExpression.Operator.EQUAL,
            new ParameterExpression("city"),
            constant(1));
    assertThrows(ModelException.TypeMismatch.class, () -> mixed.evaluate(manager));
  }

  @Test
  public void testNonNumericNodesFail() {
    final Expression item =
        new ItemFunctionExpression("Arcs", new TupleKeyExpression(constant(1)));
    final Expression key = new CompositeKeyExpression(ImmutableList.of(constant(1), constant(2)));
    assertThrows(ModelException.NotNumeric.class, () -> item.evaluate(manager));
    assertThrows(ModelException.NotNumeric.class, () -> key.evaluate(manager));
    assertThrows(
        ModelException.NotNumeric.class, () -> new VariableExpression("x").evaluate(manager));
    assertThrows(
        ModelException.TypeMismatch.class,
        () -> new ParameterExpression("city").evaluate(manager));
  }

  @Test
  public void testParameterLookupErrors() {
    assertThrows(
        ModelException.NotFound.class, () -> new ParameterExpression("nope").evaluate(manager));
    assertThrows(
        ModelException.MissingValue.class,
        () -> new ParameterExpression("unset").evaluate(manager));
  }

  @Test
  public void testIteratorBindingIsReleased() {
    final EvaluationContext context = EvaluationContext.of(manager);
    final Expression i = new ParameterExpression("i");
    context.push("i", Binding.ofInt(2));
    try {
      assertEquals(2.0, i.evaluate(context), 0.0);
      assertThat(i.substitute(context)).isInstanceOf(ConstantExpression.class);
    } finally {
      context.pop();
    }
    assertEquals(0, context.depth());
    assertThrows(ModelException.NotFound.class, () -> i.evaluate(context));
  }

  @Test
  public void testLinearizeRejectsProductOfVariables() {
    final Expression product =
        BinaryExpression.multiply(new VariableExpression("x"), new VariableExpression("y"));
    assertThrows(
        ModelException.NonLinearTerm.class,
        () -> product.linearize(EvaluationContext.of(manager)));
  }

  @Test
  public void testLinearizeSumsDuplicateVariables() {
    final Expression e =
        BinaryExpression.add(
            BinaryExpression.multiply(constant(2), new VariableExpression("x")),
            BinaryExpression.subtract(
                new VariableExpression("x"),
                BinaryExpression.divide(new VariableExpression("y"), constant(4))));
    final LinearForm form = e.linearize(EvaluationContext.of(manager)).simplify();
    assertThat(form.getCoefficients().keySet()).containsExactly("x", "y").inOrder();
    assertEquals(3.0, form.getCoefficients().get("x").evaluate(manager), 1e-12);
    assertEquals(-0.25, form.getCoefficients().get("y").evaluate(manager), 1e-12);
    assertEquals(0.0, form.getOffset().evaluate(manager), 0.0);
  }
}
