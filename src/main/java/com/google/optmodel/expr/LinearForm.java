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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A linear expression (sum (ai * xi) + b) whose coefficients and offset are expressions, so that
 * data is read when the model is exported rather than when it is expanded.
 */
public final class LinearForm {
  private static final LinearForm ZERO =
      new LinearForm(ImmutableMap.of(), ConstantExpression.ZERO);

  private final ImmutableMap<String, Expression> coefficients;
  private final Expression offset;

  private LinearForm(ImmutableMap<String, Expression> coefficients, Expression offset) {
    this.coefficients = coefficients;
    this.offset = offset;
  }

  /** Returns a builder */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static LinearForm zero() {
    return ZERO;
  }

  /** Shortcut for newBuilder().add(offset).build() */
  public static LinearForm constant(Expression offset) {
    return new LinearForm(ImmutableMap.of(), offset);
  }

  /** Shortcut for newBuilder().addTerm(name, 1).build() */
  public static LinearForm variable(String name) {
    return new LinearForm(ImmutableMap.of(name, ConstantExpression.ONE), ConstantExpression.ZERO);
  }

  /** Variable name to coefficient, in order of first appearance. */
  public ImmutableMap<String, Expression> getCoefficients() {
    return coefficients;
  }

  public Expression getOffset() {
    return offset;
  }

  public boolean hasVariables() {
    return !coefficients.isEmpty();
  }

  public LinearForm plus(LinearForm other) {
    return newBuilder().addForm(this).addForm(other).build();
  }

  public LinearForm minus(LinearForm other) {
    return newBuilder().addForm(this).addForm(other.negate()).build();
  }

  public LinearForm negate() {
    Builder builder = newBuilder();
    for (Map.Entry<String, Expression> term : coefficients.entrySet()) {
      builder.addTerm(term.getKey(), UnaryExpression.negate(term.getValue()));
    }
    return builder.add(UnaryExpression.negate(offset)).build();
  }

  /** Multiplies every coefficient and the offset by {@code factor}. */
  public LinearForm times(Expression factor) {
    Builder builder = newBuilder();
    for (Map.Entry<String, Expression> term : coefficients.entrySet()) {
      builder.addTerm(term.getKey(), BinaryExpression.multiply(factor, term.getValue()));
    }
    return builder.add(BinaryExpression.multiply(factor, offset)).build();
  }

  /** Divides every coefficient and the offset by {@code divisor}. */
  public LinearForm dividedBy(Expression divisor) {
    Builder builder = newBuilder();
    for (Map.Entry<String, Expression> term : coefficients.entrySet()) {
      builder.addTerm(term.getKey(), BinaryExpression.divide(term.getValue(), divisor));
    }
    return builder.add(BinaryExpression.divide(offset, divisor)).build();
  }

  /**
   * Evaluates every coefficient and the offset once, so that missing data surfaces as an exception
   * now rather than at export time.
   */
  public void validate(EvaluationContext context) {
    for (Expression coefficient : coefficients.values()) {
      coefficient.evaluate(context);
    }
    offset.evaluate(context);
  }

  /** Folds literal constants in every coefficient and in the offset. */
  public LinearForm simplify() {
    Builder builder = newBuilder();
    for (Map.Entry<String, Expression> term : coefficients.entrySet()) {
      builder.addTerm(term.getKey(), term.getValue().simplify());
    }
    return builder.add(offset.simplify()).build();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, Expression> term : coefficients.entrySet()) {
      if (sb.length() > 0) {
        sb.append(" + ");
      }
      sb.append(term.getValue()).append(" * ").append(term.getKey());
    }
    if (sb.length() > 0) {
      sb.append(" + ");
    }
    return sb.append(offset).toString();
  }

  /** Builder class for the LinearForm container. */
  public static final class Builder {
    private final Map<String, Expression> coefficients = new LinkedHashMap<>();
    private Expression offset = ConstantExpression.ZERO;

    private Builder() {}

    /** Adds a term; coefficients of a variable seen before are summed. */
    public Builder addTerm(String variable, Expression coefficient) {
      coefficients.merge(variable, coefficient, BinaryExpression::add);
      return this;
    }

    public Builder add(Expression constant) {
      offset = BinaryExpression.add(offset, constant);
      return this;
    }

    public Builder addForm(LinearForm form) {
      for (Map.Entry<String, Expression> term : form.coefficients.entrySet()) {
        addTerm(term.getKey(), term.getValue());
      }
      return add(form.offset);
    }

    public LinearForm build() {
      return new LinearForm(ImmutableMap.copyOf(coefficients), offset.simplify());
    }
  }
}
