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

package com.google.optmodel.model;

import com.google.common.collect.ImmutableMap;
import com.google.optmodel.ModelManager;
import com.google.optmodel.expr.Expression;
import java.util.Map;

/** The expanded objective: a sense, coefficient expressions and a constant term. */
public final class Objective {
  private final String name;
  private final ObjectiveSense sense;
  private final ImmutableMap<String, Expression> coefficients;
  private final Expression constant;

  public Objective(
      String name,
      ObjectiveSense sense,
      Map<String, Expression> coefficients,
      Expression constant) {
    this.name = name;
    this.sense = sense;
    this.coefficients = ImmutableMap.copyOf(coefficients);
    this.constant = constant;
  }

  /** Name of the objective, or null. */
  public String getName() {
    return name;
  }

  public ObjectiveSense getSense() {
    return sense;
  }

  public ImmutableMap<String, Expression> getCoefficients() {
    return coefficients;
  }

  public Expression getConstant() {
    return constant;
  }

  public ImmutableMap<String, Double> evaluateCoefficients(ModelManager manager) {
    ImmutableMap.Builder<String, Double> values = ImmutableMap.builder();
    for (Map.Entry<String, Expression> term : coefficients.entrySet()) {
      values.put(term.getKey(), term.getValue().evaluate(manager));
    }
    return values.buildOrThrow();
  }

  public double evaluateConstant(ModelManager manager) {
    return constant.evaluate(manager);
  }

  @Override
  public String toString() {
    StringBuilder sb =
        new StringBuilder(sense == ObjectiveSense.MINIMIZE ? "minimize " : "maximize ");
    if (name != null) {
      sb.append(name).append(": ");
    }
    for (Map.Entry<String, Expression> term : coefficients.entrySet()) {
      sb.append(term.getValue()).append('*').append(term.getKey()).append(" + ");
    }
    return sb.append(constant).toString();
  }
}
