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
import com.google.optmodel.model.ScalarValue;

/** A single-part key in angle brackets, {@code <i>}. Reads as its inner value. */
public final class TupleKeyExpression extends Expression {
  private final Expression inner;

  public TupleKeyExpression(Expression inner) {
    this.inner = inner;
  }

  public Expression getInner() {
    return inner;
  }

  @Override
  public ImmutableList<Expression> children() {
    return ImmutableList.of(inner);
  }

  @Override
  public ImmutableList<Expression> keyParts() {
    return ImmutableList.of(inner);
  }

  @Override
  public double evaluate(EvaluationContext context) {
    return inner.evaluate(context);
  }

  @Override
  public ScalarValue evaluateScalar(EvaluationContext context) {
    return inner.evaluateScalar(context);
  }

  @Override
  public int evaluateIndex(EvaluationContext context) {
    return inner.evaluateIndex(context);
  }

  @Override
  public boolean isConstant() {
    return inner.isConstant();
  }

  @Override
  public Expression simplify(ModelManager manager) {
    Expression simplified = inner.simplify(manager);
    return simplified == inner ? this : new TupleKeyExpression(simplified);
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    Expression substituted = inner.substitute(context);
    return substituted == inner ? this : new TupleKeyExpression(substituted);
  }

  @Override
  public String toString() {
    return "<" + inner + ">";
  }
}
