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
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.optmodel.ModelException;
import com.google.optmodel.ModelManager;
import com.google.optmodel.model.IndexSet;
import com.google.optmodel.model.IndexedEquationTemplate;
import com.google.optmodel.model.IndexedVariable;
import com.google.optmodel.model.ObjectiveSense;
import com.google.optmodel.model.ObjectiveTemplate;
import com.google.optmodel.model.Parameter;
import com.google.optmodel.model.RelationalOperator;
import com.google.optmodel.model.Statement;
import com.google.optmodel.model.TupleSet;
import com.google.optmodel.parsing.tokenization.TokenManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public final class StatementParserTest {
  private ModelManager manager;
  private StatementParser parser;
  private int line;

  @BeforeEach
  public void setUp() {
    manager = new ModelManager();
    parser = new StatementParser(manager, new TokenManager());
    line = 0;
  }

  private void parse(String... statements) {
    for (String statement : statements) {
      parser.parse(Statement.create(statement, ++line));
    }
  }

  @Test
  public void testDeclarations() {
    parse(
        "int n = 3;",
        "range I = 1..n;",
        "float c[I] = [1.5, 2, 3];",
        "{string} Cities = {\"Paris\", \"Rome\"};",
        "dvar float+ x[I];",
        "dvar int y in 0..10;");
    final IndexSet range = manager.getIndexSet("I");
    assertEquals(1, range.getStart());
    assertEquals(3, range.getEnd());
    assertEquals(2.0, manager.getParameter("c").getIndexedValue(2).asDouble(), 0.0);
    assertThat(manager.getPrimitiveSet("Cities").size()).isEqualTo(2);
    final IndexedVariable x = manager.getVariable("x");
    assertEquals(0.0, x.getLowerBound(), 0.0);
    assertNull(x.getUpperBound());
    assertEquals(10.0, manager.getVariable("y").getUpperBound(), 0.0);
    assertThat(manager.getVariable("y").isIntegral()).isTrue();
  }

  @Test
  public void testTuples() {
    parse(
        "tuple Arc { key int id; float cost; }",
        "{Arc} Arcs = {<1, 2.5>, <2, 4>};",
        "Arc best = <2, 4>;");
    assertThat(manager.getTupleSchema("Arc").getKeyFields()).containsExactly("id");
    final TupleSet arcs = manager.getTupleSet("Arcs");
    assertEquals(2, arcs.size());
    assertEquals(2.5, arcs.get(0).getValue("cost").asDouble(), 0.0);
    final Parameter best = manager.getParameter("best");
    assertEquals(4.0, best.getTupleValue().getValue("cost").asDouble(), 0.0);
    assertThrows(
        ModelException.SchemaNotFound.class, () -> parse("{Route} Routes = {<1>};"));
  }

  @Test
  public void testConstraints() {
    parse(
        "range I = 1..3;",
        "float c[I] = [1, 2, 3];",
        "dvar float x[I];",
        "budget: c[1] * x[1] + x[2] <= 10;",
        "forall(i in I : i > 1) cap: x[i] <= c[i];",
        "floor[i in I]: x[i] >= 0;",
        "x[3] == 2 * x[1];");
    assertThat(manager.getTemplates()).hasSize(4);
    final IndexedEquationTemplate budget = manager.getTemplates().get(0);
    assertEquals("budget", budget.getLabel());
    assertThat(budget.isIndexed()).isFalse();
    assertEquals(RelationalOperator.LESS_OR_EQUAL, budget.getOperator());
    final IndexedEquationTemplate cap = manager.getTemplates().get(1);
    assertEquals("cap", cap.getLabel());
    assertThat(cap.getIterators()).hasSize(1);
    assertNotNull(cap.getFilter());
    assertEquals(5, cap.getLineNumber());
    assertEquals("floor", manager.getTemplates().get(2).getLabel());
    assertEquals(RelationalOperator.GREATER_OR_EQUAL, manager.getTemplates().get(2).getOperator());
    assertNull(manager.getTemplates().get(3).getLabel());
    assertEquals(IndexedEquationTemplate.State.UNEXPANDED, budget.getState());
  }

  @Test
  public void testObjectiveAndDecisionExpression() {
    parse(
        "range I = 1..3;",
        "float c[I] = [1, 2, 3];",
        "dvar float x[I];",
        "dexpr float total = sum(i in I) c[i] * x[i];",
        "maximize profit: total;");
    assertNotNull(manager.getDecisionExpression("total"));
    final ObjectiveTemplate objective = manager.getObjectiveTemplate();
    assertEquals("profit", objective.getName());
    assertEquals(ObjectiveSense.MAXIMIZE, objective.getSense());
    assertThrows(
        ModelException.DuplicateDeclaration.class, () -> parse("minimize sum(i in I) x[i];"));
  }

  @Test
  public void testObjectiveWithoutName() {
    parse("range I = 1..3;", "dvar float x[I];", "minimize sum(i in I) x[i];");
    assertEquals("obj", manager.getObjectiveTemplate().getName());
    assertEquals(ObjectiveSense.MINIMIZE, manager.getObjectiveTemplate().getSense());
  }

  @Test
  public void testExternalData() {
    parse("range I = 1..3;", "float d[I] = ...;", "{int} S = ...;");
    assertThat(manager.getUnresolvedExternals()).containsExactly("d", "S");
    parse("d = [4, 5, 6];", "S = {2, 4};");
    assertThat(manager.getUnresolvedExternals()).isEmpty();
    final Parameter d = manager.getParameter("d");
    assertEquals(6.0, d.getIndexedValue(3).asDouble(), 0.0);
  }

  @Test
  public void testTwoDimensionalData() {
    parse(
        "range I = 1..2;",
        "range J = 1..3;",
        "int demand[I][J] = [[1, 2, 3], [4, 5, 6]];");
    assertEquals(6.0, manager.getParameter("demand").getIndexedValue(2, 3).asDouble(), 0.0);
    assertThrows(
        ModelException.MalformedExpression.class,
        () -> parse("int bad[I, J] = [[1, 2, 3], [4, 5]];"));
  }

  @Test
  public void testErrors() {
    parse("range I = 1..3;", "dvar float x[I];", "int m = 1;");
    assertThrows(ModelException.DuplicateDeclaration.class, () -> parse("int m = 2;"));
    assertThrows(ModelException.NotFound.class, () -> parse("float e[K] = [1];"));
    assertThrows(ModelException.MalformedExpression.class, () -> parse("float f[I] = [1, 2];"));
    assertThrows(ModelException.MalformedExpression.class, () -> parse("x[1] != 2;"));
    assertThrows(ModelException.MalformedExpression.class, () -> parse("x[1] + 2;"));
    assertThrows(ModelException.MalformedExpression.class, () -> parse("dvar string s;"));
    assertThrows(
        ModelException.MalformedExpression.class,
        () -> parse("forall(i in I, j in I, k in I) x[i] <= 1;"));
    final ModelException e =
        assertThrows(ModelException.MalformedExpression.class, () -> parse("x[1] = 2;"));
    assertThat(e).hasMessageThat().contains("Use '=='");
  }
}
