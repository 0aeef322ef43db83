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

/** A field of the tuple selected by an iterator, {@code Products[i].cost}. */
public final class IteratorTupleFieldAccessExpression extends Expression {
  private final String tupleSetName;
  private final String iterator;
  private final String fieldName;

  public IteratorTupleFieldAccessExpression(
      String tupleSetName, String iterator, String fieldName) {
    this.tupleSetName = tupleSetName;
    this.iterator = iterator;
    this.fieldName = fieldName;
  }

  public String getTupleSetName() {
    return tupleSetName;
  }

  public String getIterator() {
    return iterator;
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
    Optional<Binding> binding = context.lookup(iterator);
    if (binding.isPresent()
        && binding.get().isTuple()
        && binding.get().getTupleSetName().equals(tupleSetName)) {
      return binding.get().getTuple().getValue(fieldName);
    }
    // Otherwise the iterator, or a scalar parameter of that name, holds an index value.
    int index = new ParameterExpression(iterator).evaluateIndex(context);
    return TupleResolver.instanceAt(context.getManager(), tupleSetName, index).getValue(fieldName);
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
    Optional<Binding> binding = context.lookup(iterator);
    if (!binding.isPresent()) {
      return this;
    }
    if (!binding.get().isTuple() && !binding.get().getValue().isNumeric()) {
      return this;
    }
    return new TupleFieldAccessExpression(tupleSetName, binding.get().getIndex(), fieldName);
  }

  @Override
  public String toString() {
    return tupleSetName + "[" + iterator + "]." + fieldName;
  }
}
