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

import com.google.common.collect.ImmutableList;
import com.google.optmodel.ModelException;
import com.google.optmodel.ModelManager;
import com.google.optmodel.model.DecisionExpression;

/** A use of a decision expression, {@code total} or {@code load[m]}. */
public final class DecisionExpressionReference extends Expression {
  private final String name;
  private final Expression index;

  /**
   * Creates a reference.
   *
   * @param index the index of a reference to an indexed decision expression, or null
   */
  public DecisionExpressionReference(String name, Expression index) {
    this.name = name;
    this.index = index;
  }

  public String getName() {
    return name;
  }

  @Override
  public ImmutableList<Expression> children() {
    return index == null ? ImmutableList.of() : ImmutableList.of(index);
  }

  @Override
  public boolean isDecisionDependent() {
    return true;
  }

  @Override
  public boolean isConstant() {
    return false;
  }

  @Override
  public double evaluate(EvaluationContext context) {
    DecisionExpression dexpr = lookup(context.getManager());
    if (!dexpr.isIndexed()) {
      return dexpr.getBody().evaluate(context);
    }
    bindIndex(dexpr, context);
    try {
      return dexpr.getBody().evaluate(context);
    } finally {
      context.pop();
    }
  }

  @Override
  public LinearForm linearize(EvaluationContext context) {
    DecisionExpression dexpr = lookup(context.getManager());
    if (!dexpr.isIndexed()) {
      return dexpr.getBody().linearize(context);
    }
    bindIndex(dexpr, context);
    try {
      return dexpr.getBody().linearize(context);
    } finally {
      context.pop();
    }
  }

  private DecisionExpression lookup(ModelManager manager) {
    DecisionExpression dexpr = manager.getDecisionExpression(name);
    if (dexpr == null) {
      throw new ModelException.NotFound("linearize", "Decision expression", name);
    }
    if (dexpr.isIndexed() != (index != null)) {
      throw new ModelException.MalformedExpression(
          "linearize",
          dexpr.isIndexed()
              ? "decision expression '" + name + "' needs an index"
              : "decision expression '" + name + "' is not indexed");
    }
    return dexpr;
  }

  private void bindIndex(DecisionExpression dexpr, EvaluationContext context) {
    IteratorSpec spec = dexpr.getIndex();
    int value = index.evaluateIndex(context);
    if (spec.setName().isPresent()) {
      context.getManager().checkIndex(name, spec.setName().get(), value);
    }
    context.push(spec.variable(), Binding.ofInt(value));
  }

  @Override
  public Expression simplify(ModelManager manager) {
    if (index == null) {
      return this;
    }
    Expression simplified = index.simplify(manager);
    return simplified == index ? this : new DecisionExpressionReference(name, simplified);
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    if (index == null) {
      return this;
    }
    Expression substituted = index.substitute(context);
    return substituted == index ? this : new DecisionExpressionReference(name, substituted);
  }

  @Override
  public String toString() {
    return index == null ? name : name + "[" + index + "]";
  }
}
