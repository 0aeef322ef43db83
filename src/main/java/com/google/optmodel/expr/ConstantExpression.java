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

import com.google.optmodel.ModelManager;

/** A numeric literal. */
public final class ConstantExpression extends Expression {
  public static final ConstantExpression ZERO = new ConstantExpression(0.0);
  public static final ConstantExpression ONE = new ConstantExpression(1.0);

  private final double value;

  public ConstantExpression(double value) {
    this.value = value;
  }

  public double getValue() {
    return value;
  }

  @Override
  public double evaluate(EvaluationContext context) {
    return value;
  }

  @Override
  public boolean isConstant() {
    return true;
  }

  @Override
  public Expression simplify(ModelManager manager) {
    return this;
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    return this;
  }

  @Override
  public String toString() {
    return Expressions.format(value);
  }
}
