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

/** Negation or logical not. */
public final class UnaryExpression extends Expression {
  /** Unary operators. */
  public enum Operator {
    NEGATE("-"),
    NOT("!");

    private final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    double apply(double value) {
      return this == NEGATE ? -value : Expressions.fromBoolean(!Expressions.isTrue(value));
    }
  }

  private final Operator op;
  private final Expression operand;

  public UnaryExpression(Operator op, Expression operand) {
    this.op = op;
    this.operand = operand;
  }

  public static UnaryExpression negate(Expression operand) {
    return new UnaryExpression(Operator.NEGATE, operand);
  }

  public Operator getOperator() {
    return op;
  }

  public Expression getOperand() {
    return operand;
  }

  @Override
  public ImmutableList<Expression> children() {
    return ImmutableList.of(operand);
  }

  @Override
  public double evaluate(EvaluationContext context) {
    return op.apply(operand.evaluate(context));
  }

  @Override
  public boolean isConstant() {
    return operand.isConstant();
  }

  @Override
  public Expression simplify(ModelManager manager) {
    Expression simplified = operand.simplify(manager);
    OptionalDouble value = Expressions.literalValue(simplified);
    if (value.isPresent()) {
      return new ConstantExpression(op.apply(value.getAsDouble()));
    }
    return simplified == operand ? this : new UnaryExpression(op, simplified);
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    Expression substituted = operand.substitute(context);
    return substituted == operand ? this : new UnaryExpression(op, substituted);
  }

  @Override
  public LinearForm linearize(EvaluationContext context) {
    if (op == Operator.NEGATE && isDecisionDependent()) {
      return operand.linearize(context).negate();
    }
    return super.linearize(context);
  }

  @Override
  public String toString() {
    return op.symbol + operand;
  }
}
