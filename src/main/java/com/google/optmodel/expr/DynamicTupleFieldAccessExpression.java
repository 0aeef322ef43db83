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
import com.google.optmodel.model.ScalarValue;
import java.util.Optional;

/**
 * A field of a tuple-valued name, {@code p.cost}, where {@code p} iterates over a tuple set or is
 * a tuple parameter.
 */
public final class DynamicTupleFieldAccessExpression extends Expression {
  private final String variable;
  private final String fieldName;

  public DynamicTupleFieldAccessExpression(String variable, String fieldName) {
    this.variable = variable;
    this.fieldName = fieldName;
  }

  public String getVariable() {
    return variable;
  }

  public String getFieldName() {
    return fieldName;
  }

  @Override
  public double evaluate(EvaluationContext context) {
    return evaluateScalar(context).asDouble();
  }

  @Override
  public ScalarValue evaluateScalar(EvaluationContext context) {
    return TupleResolver.resolveDynamic(variable, context).getValue(fieldName);
  }

  @Override
  public boolean isConstant() {
    return false;
  }

  @Override
  public Expression simplify(ModelManager manager) {
    return this;
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    Optional<Binding> binding = context.lookup(variable);
    if (binding.isPresent() && binding.get().isTuple()) {
      return new TupleFieldAccessExpression(
          binding.get().getTupleSetName(), binding.get().getIndex(), fieldName);
    }
    return this;
  }

  @Override
  public String toString() {
    return variable + "." + fieldName;
  }
}
