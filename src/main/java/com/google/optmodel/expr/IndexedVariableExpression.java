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
import com.google.optmodel.model.IndexedVariable;
import java.util.ArrayList;
import java.util.List;

/** An element of an indexed decision variable, {@code x[i]} or {@code x[i,j]}. */
public final class IndexedVariableExpression extends Expression {
  private final String baseName;
  private final ImmutableList<Expression> indices;

  public IndexedVariableExpression(String baseName, List<Expression> indices) {
    checkArgument(
        indices.size() == 1 || indices.size() == 2, "%s needs one or two indices", baseName);
    this.baseName = baseName;
    this.indices = ImmutableList.copyOf(indices);
  }

  public String getBaseName() {
    return baseName;
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
    throw new ModelException.NotNumeric("evaluate", "decision variable " + this);
  }

  @Override
  public boolean isConstant() {
    return false;
  }

  @Override
  public boolean isDecisionDependent() {
    return true;
  }

  /** Returns the flattened name under the bindings of {@code context}, such as {@code x1_2}. */
  public String resolveName(EvaluationContext context) {
    ModelManager manager = context.getManager();
    IndexedVariable variable = manager.getVariable(baseName);
    if (variable == null) {
      throw new ModelException.NotFound("linearize", "Variable", baseName);
    }
    if (variable.getDimension() != indices.size()) {
      throw new ModelException.MalformedExpression(
          "linearize",
          "variable '"
              + baseName
              + "' has "
              + variable.getDimension()
              + " index(es), got "
              + indices.size());
    }
    List<Integer> values = new ArrayList<>();
    for (int i = 0; i < indices.size(); ++i) {
      int value = indices.get(i).evaluateIndex(context);
      manager.checkIndex(baseName, variable.getIndexSetNames().get(i), value);
      values.add(value);
    }
    return variable.flattenedName(values);
  }

  @Override
  public Expression simplify(ModelManager manager) {
    ImmutableList<Expression> simplified = Expressions.simplifyAll(indices, manager);
    return Expressions.sameNodes(simplified, indices)
        ? this
        : new IndexedVariableExpression(baseName, simplified);
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    ImmutableList<Expression> substituted = Expressions.substituteAll(indices, context);
    return Expressions.sameNodes(substituted, indices)
        ? this
        : new IndexedVariableExpression(baseName, substituted);
  }

  @Override
  public LinearForm linearize(EvaluationContext context) {
    return LinearForm.variable(resolveName(context));
  }

  @Override
  public String toString() {
    return baseName + "[" + Expressions.join(indices) + "]";
  }
}
