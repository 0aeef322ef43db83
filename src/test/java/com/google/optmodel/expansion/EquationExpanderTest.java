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

package com.google.optmodel.expansion;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.optmodel.ModelManager;
import com.google.optmodel.ParseSessionResult;
import com.google.optmodel.model.IndexedEquationTemplate;
import com.google.optmodel.model.LinearEquation;
import com.google.optmodel.model.Objective;
import com.google.optmodel.model.Parameter;
import com.google.optmodel.model.RelationalOperator;
import com.google.optmodel.model.ScalarValue;
import com.google.optmodel.model.Statement;
import com.google.optmodel.parsing.StatementParser;
import com.google.optmodel.parsing.tokenization.TokenManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public final class EquationExpanderTest {
  private ModelManager manager;
  private StatementParser parser;
  private ParseSessionResult result;
  private int line;

  @BeforeEach
  public void setUp() {
    manager = new ModelManager();
    parser = new StatementParser(manager, new TokenManager());
    result = new ParseSessionResult();
    line = 0;
    parse("range I = 1..3;", "float cost[I] = [10, 20, 30];", "dvar float+ x[I];");
  }

  private void parse(String... statements) {
    for (String statement : statements) {
      parser.parse(Statement.create(statement, ++line));
    }
  }

  private IndexedEquationTemplate lastTemplate() {
    return manager.getTemplates().get(manager.getTemplates().size() - 1);
  }

  @Test
  public void testExpandSummation() {
    parse("spend: sum(i in I) cost[i] * x[i] <= 100;");
    final ImmutableList<LinearEquation> equations =
        new EquationExpander(manager).expand(lastTemplate(), result);
    assertThat(equations).hasSize(1);
    final LinearEquation spend = equations.get(0);
    assertThat(spend.evaluateCoefficients(manager))
        .containsExactly("x1", 10.0, "x2", 20.0, "x3", 30.0)
        .inOrder();
    assertEquals(100.0, spend.evaluateConstant(manager), 1e-9);
    assertEquals(RelationalOperator.LESS_OR_EQUAL, spend.getOperator());
    assertEquals("spend", spend.getFullIdentifier());
    assertNull(spend.getIndex());
    assertEquals(IndexedEquationTemplate.State.EXPANDED, lastTemplate().getState());
    assertThat(manager.getEquations()).containsExactly(spend);
  }

  @Test
  public void testTwoIteratorsExpandOuterFirst() {
    parse("range J = 1..3;", "range K = 1..2;", "dvar float y[K][J];");
    parse("forall(k in K, j in J) order: y[k][j] <= k + j;");
    final ImmutableList<LinearEquation> equations =
        new EquationExpander(manager).expand(lastTemplate(), result);
    assertThat(equations).hasSize(6);
    assertEquals("order[1,1]", equations.get(0).getFullIdentifier());
    assertEquals("order[1,2]", equations.get(1).getFullIdentifier());
    final LinearEquation last = equations.get(5);
    assertEquals("order[2,3]", last.getFullIdentifier());
    assertEquals("order", last.getBaseName());
    assertEquals(2, (int) last.getIndex());
    assertEquals(3, (int) last.getSecondIndex());
    assertThat(last.evaluateCoefficients(manager)).containsExactly("y2_3", 1.0);
    assertEquals(5.0, last.evaluateConstant(manager), 0.0);
  }

  @Test
  public void testFilterSkipsCombinations() {
    parse("forall(i in I : i != 2) upper: x[i] <= cost[i];");
    final ImmutableList<LinearEquation> equations =
        new EquationExpander(manager).expand(lastTemplate(), result);
    assertThat(equations).hasSize(2);
    assertEquals("upper[3]", equations.get(1).getFullIdentifier());
    assertEquals(30.0, equations.get(1).evaluateConstant(manager), 0.0);
    assertThat(result.getWarnings()).isEmpty();
  }

  @Test
  public void testMissingDataSkipsOneCombination() {
    parse("float d[I] = ...;");
    final Parameter d = manager.getParameter("d");
    d.setIndexedValue(ImmutableList.of(1), ScalarValue.ofFloat(5));
    d.setIndexedValue(ImmutableList.of(3), ScalarValue.ofFloat(7));
    parse("forall(i in I) demand: x[i] >= d[i];");
    final ImmutableList<LinearEquation> equations =
        new EquationExpander(manager).expand(lastTemplate(), result);
    assertThat(equations).hasSize(2);
    assertEquals("demand[3]", equations.get(1).getFullIdentifier());
    assertThat(result.getWarnings()).hasSize(1);
    assertThat(result.getWarnings().get(0).message()).contains("demand");
    assertThat(result.hasErrors()).isFalse();
    assertEquals(IndexedEquationTemplate.State.EXPANDED, lastTemplate().getState());
  }

  @Test
  public void testStructuralErrorFailsWholeTemplate() {
    parse("forall(i in I) square: x[i] * x[i] <= 1;");
    final IndexedEquationTemplate template = lastTemplate();
    assertThat(new EquationExpander(manager).expand(template, result)).isEmpty();
    assertEquals(IndexedEquationTemplate.State.FAILED, template.getState());
    assertThat(template.getError()).contains("non-linear");
    assertThat(result.getErrors()).hasSize(1);
    assertEquals(template.getLineNumber(), result.getErrors().get(0).lineNumber());
    assertThat(manager.getEquations()).isEmpty();
  }

  @Test
  public void testMissingDataFailsUnindexedTemplate() {
    parse("float d[I] = ...;");
    manager.getParameter("d").setIndexedValue(ImmutableList.of(1), ScalarValue.ofFloat(5));
    parse("limit: x[1] <= d[2];");
    assertThat(new EquationExpander(manager).expand(lastTemplate(), result)).isEmpty();
    assertEquals(IndexedEquationTemplate.State.FAILED, lastTemplate().getState());
    assertThat(result.getErrors().get(0).message()).contains("has no value");
  }

  @Test
  public void testZeroCoefficients() {
    parse("mix: 0 * x[1] + x[2] <= 4;");
    final LinearEquation dropped =
        new EquationExpander(manager).expand(lastTemplate(), result).get(0);
    assertThat(dropped.getCoefficients().keySet()).containsExactly("x2");

    parse("mix2: 0 * x[1] + x[2] <= 4;");
    final ExpansionParameters keep =
        ExpansionParameters.builder().setDropZeroCoefficients(false).build();
    final LinearEquation kept =
        new EquationExpander(manager, keep).expand(lastTemplate(), result).get(0);
    assertThat(kept.evaluateCoefficients(manager))
        .containsExactly("x1", 0.0, "x2", 1.0)
        .inOrder();
  }

  @Test
  public void testExpandAll() {
    parse(
        "forall(i in I) upper: x[i] <= cost[i];",
        "total: sum(i in I) x[i] >= 1;",
        "minimize spend: sum(i in I) cost[i] * x[i] + 5;");
    final EquationExpander expander = new EquationExpander(manager);
    expander.expandAll(result);
    assertThat(manager.getEquations()).hasSize(4);
    final Objective objective = manager.getObjective();
    assertEquals("spend", objective.getName());
    final ImmutableMap<String, Double> coefficients = objective.evaluateCoefficients(manager);
    assertThat(coefficients).containsExactly("x1", 10.0, "x2", 20.0, "x3", 30.0).inOrder();
    assertEquals(5.0, objective.evaluateConstant(manager), 0.0);

    expander.expandAll(result);
    assertThat(manager.getEquations()).hasSize(4);
  }

  @Test
  public void testTemplateExpandsOnce() {
    parse("forall(i in I) upper: x[i] <= cost[i];");
    final IndexedEquationTemplate expanded = lastTemplate();
    final EquationExpander expander = new EquationExpander(manager);
    assertThat(expander.expand(expanded, result)).hasSize(3);
    final IllegalStateException again =
        assertThrows(IllegalStateException.class, () -> expander.expand(expanded, result));
    assertThat(again).hasMessageThat().contains("EXPANDED");
    assertThat(manager.getEquations()).hasSize(3);

    parse("forall(i in I) square: x[i] * x[i] <= 1;");
    final IndexedEquationTemplate failed = lastTemplate();
    assertThat(expander.expand(failed, result)).isEmpty();
    assertThrows(IllegalStateException.class, () -> expander.expand(failed, result));
    assertEquals(IndexedEquationTemplate.State.FAILED, failed.getState());
    assertThat(result.getErrors()).hasSize(1);
  }

  @Test
  public void testExpandAllTwiceAddsNothing() {
    parse(
        "forall(i in I) upper: x[i] <= cost[i];",
        "forall(i in I) square: x[i] * x[i] <= 1;",
        "minimize spend: sum(i in I) x[i];");
    final EquationExpander expander = new EquationExpander(manager);
    expander.expandAll(result);
    final ImmutableList<LinearEquation> first = manager.getEquations();
    final Objective objective = manager.getObjective();
    expander.expandAll(result);
    assertThat(manager.getEquations()).containsExactlyElementsIn(first).inOrder();
    assertThat(manager.getObjective()).isSameInstanceAs(objective);
    assertThat(result.getErrors()).hasSize(1);
  }

  @Test
  public void testExpandAllNeedsExternalData() {
    parse("float d[I] = ...;", "forall(i in I) demand: x[i] >= d[i];");
    final IllegalStateException e =
        assertThrows(
            IllegalStateException.class, () -> new EquationExpander(manager).expandAll(result));
    assertThat(e).hasMessageThat().contains("d");
    assertEquals(IndexedEquationTemplate.State.UNEXPANDED, lastTemplate().getState());
  }
}
