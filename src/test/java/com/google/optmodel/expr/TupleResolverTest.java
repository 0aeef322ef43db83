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
import com.google.optmodel.model.ScalarValue;
import com.google.optmodel.model.TupleInstance;
import com.google.optmodel.model.TupleSchema;
import com.google.optmodel.model.TupleSet;
import com.google.optmodel.model.ValueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public final class TupleResolverTest {
  private ModelManager manager;
  private TupleSchema arc;

  @BeforeEach
  public void setUp() {
    manager = new ModelManager();
    arc =
        new TupleSchema("Arc")
            .addField("from", ValueType.STRING, true)
            .addField("to", ValueType.STRING, true)
            .addField("cost", ValueType.FLOAT, false);
    manager.addTupleSchema(arc);
    final TupleSet arcs = new TupleSet("Arcs", "Arc", false);
    arcs.addInstance(arcOf("A", "B", 3.5));
    arcs.addInstance(arcOf("B", "C", 1.25));
    manager.addTupleSet(arcs);
    manager.addIndexSet(new IndexSet("R", 5, 6));
    final TupleSet routes = new TupleSet("Routes", "Arc", "R", false);
    routes.addInstance(arcOf("A", "B", 7));
    routes.addInstance(arcOf("B", "C", 8));
    manager.addTupleSet(routes);
  }

  private TupleInstance arcOf(String from, String to, double cost) {
    return TupleInstance.of(
        arc,
        ImmutableList.of(
            ScalarValue.ofString(from), ScalarValue.ofString(to), ScalarValue.ofFloat(cost)));
  }

  private static ItemFunctionExpression item(String tupleSet, String... key) {
    final ImmutableList.Builder<Expression> parts = ImmutableList.builder();
    for (String part : key) {
      parts.add(new StringConstantExpression(part));
    }
    final ImmutableList<Expression> keyParts = parts.build();
    return new ItemFunctionExpression(
        tupleSet,
        keyParts.size() == 1
            ? new TupleKeyExpression(keyParts.get(0))
            : new CompositeKeyExpression(keyParts));
  }

  @Test
  public void testResolveIsDeterministic() {
    final EvaluationContext context = EvaluationContext.of(manager);
    final TupleInstance first = TupleResolver.resolve(item("Arcs", "A", "B"), context);
    final TupleInstance second = TupleResolver.resolve(item("Arcs", "A", "B"), context);
    assertThat(second).isSameInstanceAs(first);
    assertThat(first.getOwner()).isEqualTo("Arcs");
  }

  @Test
  public void testKeyMatchingIgnoresCase() {
    final TupleInstance found =
        TupleResolver.resolve(item("Arcs", "b", "c"), EvaluationContext.of(manager));
    assertEquals(1.25, found.getValue("cost").asDouble(), 0.0);
  }

  @Test
  public void testFieldAccess() {
    final Expression cost = new ItemFieldAccessExpression(item("Arcs", "A", "B"), "cost");
    assertEquals(3.5, cost.evaluate(manager), 0.0);
    final Expression to = new ItemFieldAccessExpression(item("Arcs", "A", "B"), "to");
    assertThat(to.evaluateScalar(EvaluationContext.of(manager)).asString()).isEqualTo("B");
  }

  @Test
  public void testResolveErrors() {
    final EvaluationContext context = EvaluationContext.of(manager);
    assertThrows(
        ModelException.KeyArityMismatch.class,
        () -> TupleResolver.resolve(item("Arcs", "A"), context));
    final ModelException.NoMatch noMatch =
        assertThrows(
            ModelException.NoMatch.class,
            () -> TupleResolver.resolve(item("Arcs", "A", "C"), context));
    assertThat(noMatch).hasMessageThat().contains("Arcs");
    assertThrows(
        ModelException.TupleSetNotFound.class,
        () -> TupleResolver.resolve(item("Edges", "A", "B"), context));
    assertThrows(
        ModelException.NotFound.class,
        () -> new ItemFieldAccessExpression(item("Arcs", "A", "B"), "length").evaluate(manager));
  }

  @Test
  public void testInstanceAtUsesBackingIndexSet() {
    assertEquals(
        8.0, new TupleFieldAccessExpression("Routes", 6, "cost").evaluate(manager), 0.0);
    assertEquals(
        1.25, new TupleFieldAccessExpression("Arcs", 2, "cost").evaluate(manager), 0.0);
    assertThrows(
        ModelException.OutOfRange.class,
        () -> new TupleFieldAccessExpression("Arcs", 3, "cost").evaluate(manager));
  }

  @Test
  public void testDynamicAccessNeedsTupleBinding() {
    final EvaluationContext context = EvaluationContext.of(manager);
    final Expression cost = new DynamicTupleFieldAccessExpression("p", "cost");
    double total = 0;
    for (Binding binding : DomainResolver.resolveSet("Arcs", manager)) {
      context.push("p", binding);
      try {
        total += cost.evaluate(context);
      } finally {
        context.pop();
      }
    }
    assertEquals(4.75, total, 1e-12);

    context.push("p", Binding.ofInt(1));
    try {
      assertThrows(ModelException.MalformedExpression.class, () -> cost.evaluate(context));
    } finally {
      context.pop();
    }
  }
}
