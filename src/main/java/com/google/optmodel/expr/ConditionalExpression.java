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
import java.util.OptionalDouble;

/**
 * {@code cond ? a : b}, also written {@code if (cond) {a} else {b}}. The condition holds when its
 * absolute value exceeds {@link Expression#EPSILON}.
 */
public final class ConditionalExpression extends Expression {
  private final Expression condition;
  private final Expression trueBranch;
  private final Expression falseBranch;

  public ConditionalExpression(
      Expression condition, Expression trueBranch, Expression falseBranch) {
    this.condition = condition;
    this.trueBranch = trueBranch;
    this.falseBranch = falseBranch;
  }

  public Expression getCondition() {
    return condition;
  }

  public Expression getTrueBranch() {
    return trueBranch;
  }

  public Expression getFalseBranch() {
    return falseBranch;
  }

  @Override
  public ImmutableList<Expression> children() {
    return ImmutableList.of(condition, trueBranch, falseBranch);
  }

  @Override
  public double evaluate(EvaluationContext context) {
    return Expressions.isTrue(condition.evaluate(context))
        ? trueBranch.evaluate(context)
        : falseBranch.evaluate(context);
  }

  @Override
  public boolean isConstant() {
    return condition.isConstant() && trueBranch.isConstant() && falseBranch.isConstant();
  }

  @Override
  public Expression simplify(ModelManager manager) {
    Expression c = condition.simplify(manager);
    OptionalDouble value = Expressions.literalValue(c);
    if (value.isPresent()) {
      return Expressions.isTrue(value.getAsDouble())
          ? trueBranch.simplify(manager)
          : falseBranch.simplify(manager);
    }
    Expression t = trueBranch.simplify(manager);
    Expression f = falseBranch.simplify(manager);
    return c == condition && t == trueBranch && f == falseBranch
        ? this
        : new ConditionalExpression(c, t, f);
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    Expression c = condition.substitute(context);
    Expression t = trueBranch.substitute(context);
    Expression f = falseBranch.substitute(context);
    return c == condition && t == trueBranch && f == falseBranch
        ? this
        : new ConditionalExpression(c, t, f);
  }

  /** Picks the branch now; the condition must not depend on decision variables. */
  @Override
  public LinearForm linearize(EvaluationContext context) {
    if (!isDecisionDependent()) {
      return super.linearize(context);
    }
    if (condition.isDecisionDependent()) {
      throw new ModelException.NonLinearTerm("linearize", condition.toString());
    }
    return Expressions.isTrue(condition.evaluate(context))
        ? trueBranch.linearize(context)
        : falseBranch.linearize(context);
  }

  @Override
  public String toString() {
    return "(" + condition + " ? " + trueBranch + " : " + falseBranch + ")";
  }
}
