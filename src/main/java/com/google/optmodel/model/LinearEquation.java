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

/**
 * A concrete linear constraint {@code sum(coefficient * variable) op constant}.
 *
 * <p>Coefficients and the constant are expressions evaluated on demand, so data changed after
 * expansion is still reflected when the model is exported.
 */
public final class LinearEquation {
  private final String label;
  private final String baseName;
  private final Integer index;
  private final Integer secondIndex;
  private final RelationalOperator op;
  private final ImmutableMap<String, Expression> coefficients;
  private final Expression constant;

  /**
   * Creates an equation.
   *
   * @param label the label, or null for an unnamed constraint
   * @param baseName the name of the indexed family, or null
   * @param index the first index value, or null
   * @param secondIndex the second index value, or null
   */
  public LinearEquation(
      String label,
      String baseName,
      Integer index,
      Integer secondIndex,
      RelationalOperator op,
      Map<String, Expression> coefficients,
      Expression constant) {
    this.label = label;
    this.baseName = baseName;
    this.index = index;
    this.secondIndex = secondIndex;
    this.op = op;
    this.coefficients = ImmutableMap.copyOf(coefficients);
    this.constant = constant;
  }

  public String getLabel() {
    return label;
  }

  public String getBaseName() {
    return baseName;
  }

  public Integer getIndex() {
    return index;
  }

  public Integer getSecondIndex() {
    return secondIndex;
  }

  public RelationalOperator getOperator() {
    return op;
  }

  public boolean isInequality() {
    return op.isInequality();
  }

  /** Variable name to coefficient expression, in order of first appearance. */
  public ImmutableMap<String, Expression> getCoefficients() {
    return coefficients;
  }

  /** Right-hand side. */
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

  /** Returns {@code label}, {@code base[i]} or {@code base[i,j]}; null for an unnamed equation. */
  public String getFullIdentifier() {
    String name = baseName != null ? baseName : label;
    if (name == null || index == null) {
      return name;
    }
    if (secondIndex == null) {
      return name + "[" + index + "]";
    }
    return name + "[" + index + "," + secondIndex + "]";
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    String identifier = getFullIdentifier();
    if (identifier != null) {
      sb.append(identifier).append(": ");
    }
    boolean first = true;
    for (Map.Entry<String, Expression> term : coefficients.entrySet()) {
      if (!first) {
        sb.append(" + ");
      }
      sb.append(term.getValue()).append('*').append(term.getKey());
      first = false;
    }
    if (first) {
      sb.append('0');
    }
    return sb.append(' ').append(op.symbol()).append(' ').append(constant).toString();
  }
}
