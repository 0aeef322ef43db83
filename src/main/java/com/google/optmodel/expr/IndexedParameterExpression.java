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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.optmodel.ModelException;
import com.google.optmodel.ModelManager;
import com.google.optmodel.model.Parameter;
import com.google.optmodel.model.ScalarValue;
import java.util.List;

/** An element of a parameter table, {@code cost[i]} or {@code dist[i,j]}. */
public final class IndexedParameterExpression extends Expression {
  private final String name;
  private final ImmutableList<Expression> indices;

  public IndexedParameterExpression(String name, List<Expression> indices) {
    checkArgument(
        indices.size() == 1 || indices.size() == 2, "%s needs one or two indices", name);
    this.name = name;
    this.indices = ImmutableList.copyOf(indices);
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Expression> getIndices() {
    return indices;
  }

  @Override
  public ImmutableList<Expression> children() {
    return indices;
  }

  @Override
  public double evaluate(EvaluationContext context) {
    return evaluateScalar(context).asDouble();
  }

  @Override
  public ScalarValue evaluateScalar(EvaluationContext context) {
    ModelManager manager = context.getManager();
    Parameter parameter = manager.getParameter(name);
    if (parameter == null) {
      throw new ModelException.NotFound("evaluate", "Parameter", name);
    }
    if (parameter.getDimension() != indices.size()) {
      throw new ModelException.MalformedExpression(
          "evaluate",
          "parameter '"
              + name
              + "' has "
              + parameter.getDimension()
              + " index(es), got "
              + indices.size());
    }
    int[] values = new int[indices.size()];
    for (int i = 0; i < values.length; ++i) {
      values[i] = indices.get(i).evaluateIndex(context);
      manager.checkIndex(name, parameter.getIndexSetNames().get(i), values[i]);
    }
    return parameter.getIndexedValue(values);
  }

  @Override
  public boolean isConstant() {
    return Expressions.allConstant(indices);
  }

  @Override
  public Expression simplify(ModelManager manager) {
    ImmutableList<Expression> simplified = Expressions.simplifyAll(indices, manager);
    if (manager != null) {
      Parameter parameter = manager.getParameter(name);
      if (parameter != null
          && parameter.getDimension() == simplified.size()
          && literalIndices(simplified) != null) {
        ScalarValue value = parameter.findIndexedValue(literalIndices(simplified));
        if (value != null && value.isNumeric()) {
          return new ConstantExpression(value.asDouble());
        }
      }
    }
    return Expressions.sameNodes(simplified, indices)
        ? this
        : new IndexedParameterExpression(name, simplified);
  }

  private static int[] literalIndices(List<Expression> expressions) {
    int[] values = new int[expressions.size()];
    for (int i = 0; i < values.length; ++i) {
      if (!Expressions.literalValue(expressions.get(i)).isPresent()) {
        return null;
      }
      double value = Expressions.literalValue(expressions.get(i)).getAsDouble();
      if (value != Math.rint(value)) {
        return null;
      }
      values[i] = (int) value;
    }
    return values;
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    ImmutableList<Expression> substituted = Expressions.substituteAll(indices, context);
    return Expressions.sameNodes(substituted, indices)
        ? this
        : new IndexedParameterExpression(name, substituted);
  }

  @Override
  public String toString() {
    return name + "[" + Expressions.join(indices) + "]";
  }
}
