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

/** A field of the tuple found by {@code item()}, {@code item(Arcs, <"a", "b">).cost}. */
public final class ItemFieldAccessExpression extends Expression {
  private final ItemFunctionExpression item;
  private final String fieldName;

  public ItemFieldAccessExpression(ItemFunctionExpression item, String fieldName) {
    this.item = item;
    this.fieldName = fieldName;
  }

  public ItemFunctionExpression getItem() {
    return item;
  }

  public String getFieldName() {
    return fieldName;
  }

  @Override
  public ImmutableList<Expression> children() {
    return ImmutableList.of(item);
  }

  @Override
  public double evaluate(EvaluationContext context) {
    return evaluateScalar(context).asDouble();
  }

  @Override
  public ScalarValue evaluateScalar(EvaluationContext context) {
    return item.resolve(context).getValue(fieldName);
  }

  @Override
  public boolean isConstant() {
    return item.isConstant();
  }

  @Override
  public Expression simplify(ModelManager manager) {
    Expression simplified = item.simplify(manager);
    return simplified == item
        ? this
        : new ItemFieldAccessExpression((ItemFunctionExpression) simplified, fieldName);
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    Expression substituted = item.substitute(context);
    return substituted == item
        ? this
        : new ItemFieldAccessExpression((ItemFunctionExpression) substituted, fieldName);
  }

  @Override
  public String toString() {
    return item + "." + fieldName;
  }
}
