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
import com.google.optmodel.model.ScalarValue;

/** A quoted string literal, used in keys and comparisons. */
public final class StringConstantExpression extends Expression {
  private final String value;

  public StringConstantExpression(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  @Override
  public double evaluate(EvaluationContext context) {
    throw new ModelException.TypeMismatch(
        "evaluate", "string literal " + this + " used as a number");
  }

  @Override
  public ScalarValue evaluateScalar(EvaluationContext context) {
    return ScalarValue.ofString(value);
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
    return "\"" + value + "\"";
  }
}
