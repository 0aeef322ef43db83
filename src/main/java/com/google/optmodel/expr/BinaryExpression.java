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

/** Arithmetic on two operands. */
public final class BinaryExpression extends Expression {
  /** Arithmetic operators. */
  public enum Operator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }

    double apply(double left, double right) {
      switch (this) {
        case ADD:
          return left + right;
        case SUBTRACT:
          return left - right;
        case MULTIPLY:
          return left * right;
        case DIVIDE:
          return left / right;
      }
      throw new IllegalStateException("unknown operator " + this);
    }
  }

  private final Operator op;
  private final Expression left;
  private final Expression right;

  public BinaryExpression(Operator op, Expression left, Expression right) {
    this.op = op;
    this.left = left;
    this.right = right;
  }

  public static BinaryExpression add(Expression left, Expression right) {
    return new BinaryExpression(Operator.ADD, left, right);
  }

  public static BinaryExpression subtract(Expression left, Expression right) {
    return new BinaryExpression(Operator.SUBTRACT, left, right);
  }

  public static BinaryExpression multiply(Expression left, Expression right) {
    return new BinaryExpression(Operator.MULTIPLY, left, right);
  }

  public static BinaryExpression divide(Expression left, Expression right) {
    return new BinaryExpression(Operator.DIVIDE, left, right);
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
    return op.apply(left.evaluate(context), right.evaluate(context));
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
      return new ConstantExpression(op.apply(lv.getAsDouble(), rv.getAsDouble()));
    }
    switch (op) {
      case ADD:
        if (isLiteral(lv, 0)) {
          return r;
        }
        if (isLiteral(rv, 0)) {
          return l;
        }
        break;
      case SUBTRACT:
        if (isLiteral(rv, 0)) {
          return l;
        }
        break;
      case MULTIPLY:
        if (isLiteral(lv, 0) || isLiteral(rv, 0)) {
          return ConstantExpression.ZERO;
        }
        if (isLiteral(lv, 1)) {
          return r;
        }
        if (isLiteral(rv, 1)) {
          return l;
        }
        break;
      case DIVIDE:
        if (isLiteral(rv, 1)) {
          return l;
        }
        break;
    }
    return l == left && r == right ? this : new BinaryExpression(op, l, r);
  }

  private static boolean isLiteral(OptionalDouble value, double expected) {
    return value.isPresent() && value.getAsDouble() == expected;
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    Expression l = left.substitute(context);
    Expression r = right.substitute(context);
    return l == left && r == right ? this : new BinaryExpression(op, l, r);
  }

  @Override
  public LinearForm linearize(EvaluationContext context) {
    if (!isDecisionDependent()) {
      return super.linearize(context);
    }
    LinearForm l = left.linearize(context);
    LinearForm r = right.linearize(context);
    switch (op) {
      case ADD:
        return l.plus(r);
      case SUBTRACT:
        return l.minus(r);
      case MULTIPLY:
        if (l.hasVariables() && r.hasVariables()) {
          throw new ModelException.NonLinearTerm("linearize", toString());
        }
        return l.hasVariables() ? l.times(r.getOffset()) : r.times(l.getOffset());
      case DIVIDE:
        if (r.hasVariables()) {
          throw new ModelException.NonLinearTerm("linearize", toString());
        }
        return l.dividedBy(r.getOffset());
    }
    throw new IllegalStateException("unknown operator " + op);
  }

  @Override
  public String toString() {
    return "(" + left + " " + op.symbol() + " " + right + ")";
  }
}
