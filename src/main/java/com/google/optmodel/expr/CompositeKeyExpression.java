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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.optmodel.ModelException;
import com.google.optmodel.ModelManager;
import java.util.List;

/** A multi-part key, {@code <"a", i, 3>}. Tuple-valued. */
public final class CompositeKeyExpression extends Expression {
  private final ImmutableList<Expression> parts;

  public CompositeKeyExpression(List<Expression> parts) {
    checkArgument(parts.size() >= 2, "a composite key needs at least two parts");
    this.parts = ImmutableList.copyOf(parts);
  }

  public ImmutableList<Expression> getParts() {
    return parts;
  }

  @Override
  public ImmutableList<Expression> children() {
    return parts;
  }

  @Override
  public ImmutableList<Expression> keyParts() {
    return parts;
  }

  @Override
  public double evaluate(EvaluationContext context) {
    throw new ModelException.NotNumeric("evaluate", "composite key " + this);
  }

  @Override
  public boolean isConstant() {
    return Expressions.allConstant(parts);
  }

  @Override
  public Expression simplify(ModelManager manager) {
    ImmutableList<Expression> simplified = Expressions.simplifyAll(parts, manager);
    return Expressions.sameNodes(simplified, parts) ? this : new CompositeKeyExpression(simplified);
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    ImmutableList<Expression> substituted = Expressions.substituteAll(parts, context);
    return Expressions.sameNodes(substituted, parts)
        ? this
        : new CompositeKeyExpression(substituted);
  }

  @Override
  public String toString() {
    return "<" + Expressions.join(parts) + ">";
  }
}
