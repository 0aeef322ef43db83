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
import java.util.Locale;

/** A {@code minimize} or {@code maximize} statement awaiting linearization. */
public final class ObjectiveTemplate {
  private final String name;
  private final ObjectiveSense sense;
  private final Expression expression;
  private final int lineNumber;

  public ObjectiveTemplate(
      String name, ObjectiveSense sense, Expression expression, int lineNumber) {
    this.name = name;
    this.sense = sense;
    this.expression = expression;
    this.lineNumber = lineNumber;
  }

  /** Name of the objective, or null. */
  public String getName() {
    return name;
  }

  public ObjectiveSense getSense() {
    return sense;
  }

  public Expression getExpression() {
    return expression;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  @Override
  public String toString() {
    return sense.name().toLowerCase(Locale.ROOT) + " " + expression;
  }
}
