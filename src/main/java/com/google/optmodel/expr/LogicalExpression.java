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
import com.google.optmodel.ModelManager;
import java.util.OptionalDouble;

/** Short-circuit conjunction or disjunction, evaluating to 1 or 0. */
public final class LogicalExpression extends Expression {
  /** Logical operators. */
  public enum Operator {
    AND("&&"),
    OR("||");

    private final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }
  }

  private final Operator op;
  private final Expression left;
  private final Expression right;

  public LogicalExpression(Operator op, Expression left, Expression right) {
    this.op = op;
    this.left = left;
    this.right = right;
  }

  public Operator getOperator() {
    return op;
  }

  @Override
  public ImmutableList<Expression> children() {
    return ImmutableList.of(left, right);
  }

  @Override
  public double evaluate(EvaluationContext context) {
    boolean l = Expressions.isTrue(left.evaluate(context));
    if (op == Operator.AND && !l) {
      return 0.0;
    }
    if (op == Operator.OR && l) {
      return 1.0;
    }
    return Expressions.fromBoolean(Expressions.isTrue(right.evaluate(context)));
  }

  @Override
  public boolean isConstant() {
    return left.isConstant() && right.isConstant();
  }

  @Override
  public Expression simplify(ModelManager manager) {
    Expression l = left.simplify(manager);
    Expression r = right.simplify(manager);
    OptionalDouble lv = Expressions.literalValue(l);
    if (lv.isPresent()) {
      boolean value = Expressions.isTrue(lv.getAsDouble());
      if (op == Operator.AND && !value) {
        return ConstantExpression.ZERO;
      }
      if (op == Operator.OR && value) {
        return ConstantExpression.ONE;
      }
      OptionalDouble rv = Expressions.literalValue(r);
      if (rv.isPresent()) {
        return new ConstantExpression(
            Expressions.fromBoolean(Expressions.isTrue(rv.getAsDouble())));
      }
    }
    return l == left && r == right ? this : new LogicalExpression(op, l, r);
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    Expression l = left.substitute(context);
    Expression r = right.substitute(context);
    return l == left && r == right ? this : new LogicalExpression(op, l, r);
  }

  @Override
  public String toString() {
    return "(" + left + " " + op.symbol + " " + right + ")";
  }
}
