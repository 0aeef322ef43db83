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

import com.google.optmodel.ModelException;
import com.google.optmodel.ModelManager;

/** A scalar decision variable, such as {@code y} or the flattened {@code x3}. */
public final class VariableExpression extends Expression {
  private final String name;

  public VariableExpression(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Override
  public double evaluate(EvaluationContext context) {
    throw new ModelException.NotNumeric("evaluate", "decision variable '" + name + "'");
  }

  @Override
  public boolean isConstant() {
    return false;
  }

  @Override
  public boolean isDecisionDependent() {
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
  public LinearForm linearize(EvaluationContext context) {
    return LinearForm.variable(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
