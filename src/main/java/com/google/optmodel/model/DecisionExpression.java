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

package com.google.optmodel.model;

import com.google.optmodel.expr.Expression;
import com.google.optmodel.expr.IteratorSpec;

/**
 * A named expression over decision variables, {@code dexpr float total = sum(i in I) x[i]}, or
 * indexed by one iterator, {@code dexpr float load[m in M] = ...}. References are inlined when
 * constraints are linearized.
 */
public final class DecisionExpression {
  private final String name;
  private final ValueType type;
  private final IteratorSpec index;
  private final Expression body;

  /**
   * Creates a decision expression.
   *
   * @param index the iterator of an indexed decision expression, or null
   */
  public DecisionExpression(String name, ValueType type, IteratorSpec index, Expression body) {
    this.name = name;
    this.type = type;
    this.index = index;
    this.body = body;
  }

  public String getName() {
    return name;
  }

  public ValueType getType() {
    return type;
  }

  public boolean isIndexed() {
    return index != null;
  }

  /** Iterator of an indexed decision expression, or null. */
  public IteratorSpec getIndex() {
    return index;
  }

  public Expression getBody() {
    return body;
  }

  @Override
  public String toString() {
    return "dexpr " + name + (index == null ? "" : "[" + index + "]") + " = " + body;
  }
}
