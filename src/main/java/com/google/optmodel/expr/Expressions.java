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
import java.util.List;
import java.util.OptionalDouble;

/** Static helpers shared by expression nodes. */
public final class Expressions {
  private Expressions() {}

  /** Boolean reading of a number. */
  public static boolean isTrue(double value) {
    return Math.abs(value) > Expression.EPSILON;
  }

  public static double fromBoolean(boolean value) {
    return value ? 1.0 : 0.0;
  }

  /** Renders a number without a trailing {@code .0} when it is integral. */
  public static String format(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  /** Returns the value of a literal constant node, or empty for any other node. */
  public static OptionalDouble literalValue(Expression expression) {
    if (expression instanceof ConstantExpression) {
      return OptionalDouble.of(((ConstantExpression) expression).getValue());
    }
    return OptionalDouble.empty();
  }

  /**
   * Evaluates {@code expression}, returning empty when the data it reads is missing for the
   * current bindings. Structural and numeric type errors propagate.
   */
  public static OptionalDouble tryEvaluate(Expression expression, EvaluationContext context) {
    try {
      return OptionalDouble.of(expression.evaluate(context));
    } catch (ModelException.ValueResolution e) {
      return OptionalDouble.empty();
    }
  }

  static ImmutableList<Expression> substituteAll(
      List<Expression> expressions, EvaluationContext context) {
    ImmutableList.Builder<Expression> result = ImmutableList.builder();
    for (Expression expression : expressions) {
      result.add(expression.substitute(context));
    }
    return result.build();
  }

  static ImmutableList<Expression> simplifyAll(
      List<Expression> expressions, ModelManager manager) {
    ImmutableList.Builder<Expression> result = ImmutableList.builder();
    for (Expression expression : expressions) {
      result.add(expression.simplify(manager));
    }
    return result.build();
  }

  /** Returns true if both lists hold the same nodes. */
  static boolean sameNodes(List<Expression> left, List<Expression> right) {
    if (left.size() != right.size()) {
      return false;
    }
    for (int i = 0; i < left.size(); ++i) {
      if (left.get(i) != right.get(i)) {
        return false;
      }
    }
    return true;
  }

  static boolean allConstant(List<Expression> expressions) {
    for (Expression expression : expressions) {
      if (!expression.isConstant()) {
        return false;
      }
    }
    return true;
  }

  static String join(List<Expression> expressions) {
    StringBuilder sb = new StringBuilder();
    for (Expression expression : expressions) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(expression);
    }
    return sb.toString();
  }
}
