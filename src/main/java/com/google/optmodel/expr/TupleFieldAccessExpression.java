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

/**
 * A field of the tuple at a fixed index, {@code Products[2].cost}. The tuple is read at each
 * evaluation, so later changes to the data are seen.
 */
public final class TupleFieldAccessExpression extends Expression {
  private final String tupleSetName;
  private final int index;
  private final String fieldName;

  public TupleFieldAccessExpression(String tupleSetName, int index, String fieldName) {
    this.tupleSetName = tupleSetName;
    this.index = index;
    this.fieldName = fieldName;
  }

  public String getTupleSetName() {
    return tupleSetName;
  }

  public int getIndex() {
    return index;
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
    return TupleResolver.instanceAt(context.getManager(), tupleSetName, index).getValue(fieldName);
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
    return tupleSetName + "[" + index + "]." + fieldName;
  }
}
