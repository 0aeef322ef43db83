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

package com.google.optmodel;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.optmodel.model.LinearEquation;
import com.google.optmodel.model.RelationalOperator;
import com.google.optmodel.model.Statement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public final class ModelParsingServiceTest {
  private ModelParsingService service;

  @BeforeEach
  public void setUp() {
    service = new ModelParsingService();
  }

  private static ImmutableList<Statement> statements(String... texts) {
    final ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    for (int i = 0; i < texts.length; ++i) {
      statements.add(Statement.create(texts[i], i + 1));
    }
    return statements.build();
  }

  @Test
  public void testBudgetConstraint() {
    final ParseSessionResult result =
        service.parse(
            statements(
                "range I=1..2;",
                "float a[I]=...;",
                "a=[2,3];",
                "var float x[I];",
                "budget: sum(i in I) a[i]*x[i] == 5;"));
    assertThat(result.getErrorMessages()).isEmpty();
    assertEquals(5, result.getSuccessCount());
    service.expandAllTemplates();
    final ImmutableList<LinearEquation> equations = service.getManager().getEquations();
    assertThat(equations).hasSize(1);
    final LinearEquation budget = equations.get(0);
    assertThat(budget.evaluateCoefficients(service.getManager()))
        .containsExactly("x1", 2.0, "x2", 3.0)
        .inOrder();
    assertEquals(5.0, budget.evaluateConstant(service.getManager()), 0.0);
    assertEquals(RelationalOperator.EQUAL, budget.getOperator());
  }

  @Test
  public void testUndeclaredSetIsReported() {
    final ParseSessionResult result =
        service.parse(statements("dvar float x;", "sum(i in UndeclaredSet) x == 1;"));
    assertThat(result.getErrors()).hasSize(1);
    final ParseSessionResult.Entry error = result.getErrors().get(0);
    assertEquals(2, error.lineNumber());
    assertThat(error.message()).contains("UndeclaredSet");
    assertThat(error.message()).contains("not found");
    service.expandAllTemplates();
    assertThat(service.getManager().getEquations()).isEmpty();
  }

  @Test
  public void testParsingContinuesAfterError() {
    final ParseSessionResult result =
        service.parse(statements("range I = 1..3;", "int n = ;", "dvar float x[I];"));
    assertEquals(2, result.getSuccessCount());
    assertThat(result.getErrorMessages()).hasSize(1);
    assertThat(result.getErrorMessages().get(0)).startsWith("Line 2: ");
    assertThat(service.getManager().getVariable("x")).isNotNull();
  }

  @Test
  public void testOversizedIndexIsReportedOnItsLine() {
    final ParseSessionResult result =
        service.parse(
            statements(
                "range I=1..2;",
                "var float x[I];",
                "c: x[99999999999] <= 1;",
                "d: x[2] <= 1;"));
    assertThat(result.getErrors()).hasSize(1);
    assertEquals(3, result.getErrors().get(0).lineNumber());
    assertThat(result.getErrors().get(0).message()).contains("out of range");
    assertEquals(3, result.getSuccessCount());
  }

  @Test
  public void testInvalidDeclarationIsReportedOnItsLine() {
    final ParseSessionResult result =
        service.parse(statements("range I = 1..2;", "{bool} flags;", "int n = 1;"));
    assertThat(result.getErrors()).hasSize(1);
    assertEquals(2, result.getErrors().get(0).lineNumber());
    assertThat(result.getErrors().get(0).message())
        .isEqualTo("parse: unsupported element type BOOL for set flags");
    assertThat(service.getManager().getParameter("n")).isNotNull();
  }

  @Test
  public void testIteratorsShadowScalarParameters() {
    final ParseSessionResult result =
        service.parse(
            statements(
                "range I = 1..3;",
                "int i = 7;",
                "int n = 7;",
                "var float x[I];",
                "total: sum(i in I) i * x[i] <= 10;",
                "forall(n in I) cap: x[n] <= n;",
                "floor[i in I]: x[i] >= i + 1;",
                "minimize sum(i in I) x[i];"));
    assertThat(result.getErrorMessages()).isEmpty();
    service.expandAllTemplates();
    final ModelManager manager = service.getManager();
    final ImmutableList<LinearEquation> equations = manager.getEquations();
    assertThat(equations).hasSize(7);

    final LinearEquation total = equations.get(0);
    assertThat(total.evaluateCoefficients(manager))
        .containsExactly("x1", 1.0, "x2", 2.0, "x3", 3.0)
        .inOrder();
    assertEquals(10.0, total.evaluateConstant(manager), 0.0);

    final LinearEquation cap = equations.get(3);
    assertEquals("cap[3]", cap.getFullIdentifier());
    assertEquals(3.0, cap.evaluateConstant(manager), 0.0);

    final LinearEquation floor = equations.get(5);
    assertEquals("floor[2]", floor.getFullIdentifier());
    assertThat(floor.evaluateCoefficients(manager)).containsExactly("x2", 1.0);
    assertEquals(3.0, floor.evaluateConstant(manager), 0.0);
  }

  @Test
  public void testExpansionWaitsForExternalData() {
    service.parse(
        statements(
            "range I = 1..2;",
            "float cap[I] = ...;",
            "dvar float x[I];",
            "forall(i in I) limit: x[i] <= cap[i];",
            "maximize sum(i in I) x[i];"));
    assertThrows(IllegalStateException.class, () -> service.expandAllTemplates());
    assertThrows(IllegalStateException.class, () -> service.buildModel());

    service.parse(statements("cap = [4, 6];"));
    service.expandAllTemplates();
    final LinearModel model = service.buildModel();
    assertThat(model.getEquations()).hasSize(2);
    assertEquals("obj", model.getObjective().getName());
    assertEquals(6.0, model.getEquations().get(1).evaluateConstant(service.getManager()), 0.0);
  }

  @Test
  public void testBuildModelNeedsObjective() {
    service.parse(statements("dvar float x;", "x >= 1;"));
    service.expandAllTemplates();
    final IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> service.buildModel());
    assertThat(e).hasMessageThat().contains("objective");
  }

  @Test
  public void testReportAndClear() {
    service.parse(statements("range I = 1..2;", "bogus statement;"));
    final String report = service.generateReport();
    assertThat(report).contains("ERROR Line 2");
    assertThat(report).contains("I");

    service.clear();
    assertThat(service.getResult().hasErrors()).isFalse();
    assertEquals(0, service.getTokenManager().size());
    assertThat(service.getManager().getIndexSet("I")).isNull();
  }
}
