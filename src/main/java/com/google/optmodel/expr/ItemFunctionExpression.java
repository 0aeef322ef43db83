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
import com.google.optmodel.model.TupleInstance;

/** The tuple of a set matching a key, {@code item(Arcs, <"a", "b">)}. Tuple-valued. */
public final class ItemFunctionExpression extends Expression {
  private final String tupleSetName;
  private final Expression key;

  public ItemFunctionExpression(String tupleSetName, Expression key) {
    this.tupleSetName = tupleSetName;
    this.key = key;
  }

  public String getTupleSetName() {
    return tupleSetName;
  }

  public Expression getKey() {
    return key;
  }

  /** Finds the matching tuple under the bindings of {@code context}. */
  public TupleInstance resolve(EvaluationContext context) {
    return TupleResolver.resolve(this, context);
  }

  @Override
  public ImmutableList<Expression> children() {
    return ImmutableList.of(key);
  }

  @Override
  public double evaluate(EvaluationContext context) {
    throw new ModelException.NotNumeric("evaluate", "tuple " + this);
  }

  @Override
  public boolean isConstant() {
    return key.isConstant();
  }

  @Override
  public Expression simplify(ModelManager manager) {
    Expression simplified = key.simplify(manager);
    return simplified == key ? this : new ItemFunctionExpression(tupleSetName, simplified);
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    Expression substituted = key.substitute(context);
    return substituted == key ? this : new ItemFunctionExpression(tupleSetName, substituted);
  }

  @Override
  public String toString() {
    return "item(" + tupleSetName + ", " + key + ")";
  }
}
