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
import com.google.optmodel.model.RelationalOperator;
import com.google.optmodel.model.ScalarValue;
import java.util.OptionalDouble;

/**
 * A comparison evaluating to 1 or 0. Numbers are equal within {@link Expression#EPSILON}; strings
 * compare exactly and order lexicographically.
 */
public final class ComparisonExpression extends Expression {
  /** Comparison operators. */
  public enum Operator {
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS_THAN("<"),
    LESS_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }

    /** The matching relation of a linear equation, or null for {@code !=}. */
    public RelationalOperator toRelationalOperator() {
      return RelationalOperator.fromSymbol(symbol);
    }

    boolean test(int comparison) {
      switch (this) {
        case EQUAL:
          return comparison == 0;
        case NOT_EQUAL:
          return comparison != 0;
        case LESS_THAN:
          return comparison < 0;
        case LESS_OR_EQUAL:
          return comparison <= 0;
        case GREATER_THAN:
          return comparison > 0;
        case GREATER_OR_EQUAL:
          return comparison >= 0;
      }
      throw new IllegalStateException("unknown operator " + this);
    }
  }

  private final Operator op;
  private final Expression left;
  private final Expression right;

  public ComparisonExpression(Operator op, Expression left, Expression right) {
    this.op = op;
    this.left = left;
    this.right = right;
  }

  public Operator getOperator() {
    return op;
  }

  public Expression getLeft() {
    return left;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  public ImmutableList<Expression> children() {
    return ImmutableList.of(left, right);
  }

  @Override
  public double evaluate(EvaluationContext context) {
    ScalarValue l = left.evaluateScalar(context);
    ScalarValue r = right.evaluateScalar(context);
    return Expressions.fromBoolean(op.test(compare(l, r)));
  }

  private static int compare(ScalarValue l, ScalarValue r) {
    if (l.isNumeric() && r.isNumeric()) {
      return compareNumbers(l.asDouble(), r.asDouble());
    }
    if (l.isNumeric() || r.isNumeric()) {
      throw new ModelException.TypeMismatch("evaluate", "cannot compare " + l + " with " + r);
    }
    return Integer.signum(l.asString().compareTo(r.asString()));
  }

  private static int compareNumbers(double l, double r) {
    if (Math.abs(l - r) < EPSILON) {
      return 0;
    }
    return l < r ? -1 : 1;
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
    OptionalDouble rv = Expressions.literalValue(r);
    if (lv.isPresent() && rv.isPresent()) {
      return new ConstantExpression(
          Expressions.fromBoolean(
              op.test(compareNumbers(lv.getAsDouble(), rv.getAsDouble()))));
    }
    return l == left && r == right ? this : new ComparisonExpression(op, l, r);
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    Expression l = left.substitute(context);
    Expression r = right.substitute(context);
    return l == left && r == right ? this : new ComparisonExpression(op, l, r);
  }

  @Override
  public String toString() {
    return left + " " + op.symbol() + " " + right;
  }
}
