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
import com.google.optmodel.model.ScalarValue;

/**
 * Node of an immutable expression tree.
 *
 * <p>Nodes are evaluated against an {@link EvaluationContext}, which resolves bound iterators
 * before falling back to the declarations of a {@link ModelManager}. Expressions that mention
 * decision variables are not evaluated but linearized into a {@link LinearForm}.
 */
public abstract class Expression {
  /** Values closer to zero than this are false in a boolean context. */
  public static final double EPSILON = 1e-10;

  /** Evaluates this expression as a number. */
  public abstract double evaluate(EvaluationContext context);

  /** Evaluates this expression with no iterator bound. */
  public final double evaluate(ModelManager manager) {
    return evaluate(EvaluationContext.of(manager));
  }

  /**
   * Evaluates this expression as a scalar value. Nodes that may produce strings override this;
   * others return their numeric value.
   */
  public ScalarValue evaluateScalar(EvaluationContext context) {
    return ScalarValue.ofNumber(evaluate(context));
  }

  /** Evaluates this expression as an integer index value. */
  public int evaluateIndex(EvaluationContext context) {
    return evaluateScalar(context).asIndex();
  }

  /** Returns true if this expression can be evaluated without any iterator bound. */
  public abstract boolean isConstant();

  /**
   * Folds constant sub-expressions bottom-up. Returns {@code this} when nothing changes.
   *
   * @param manager declarations used to fold scalar parameters, or null to fold only literals
   */
  public abstract Expression simplify(ModelManager manager);

  /** Folds literal constants only. */
  public final Expression simplify() {
    return simplify(null);
  }

  /**
   * Replaces the iterators bound in {@code context} by constants, so that the result no longer
   * depends on the bindings. Iterator-indexed tuple accesses become fixed-index accesses.
   */
  public abstract Expression substitute(EvaluationContext context);

  /** Direct sub-expressions. */
  public ImmutableList<Expression> children() {
    return ImmutableList.of();
  }

  /** Returns true if this expression mentions a decision variable or decision expression. */
  public boolean isDecisionDependent() {
    for (Expression child : children()) {
      if (child.isDecisionDependent()) {
        return true;
      }
    }
    return false;
  }

  /** Parts of this expression when used as a tuple key. */
  public ImmutableList<Expression> keyParts() {
    return ImmutableList.of(this);
  }

  /**
   * Rewrites this expression as a sum of coefficient times variable terms plus a constant, under
   * the bindings of {@code context}.
   */
  public LinearForm linearize(EvaluationContext context) {
    if (isDecisionDependent()) {
      throw new ModelException.NonLinearTerm("linearize", toString());
    }
    return LinearForm.constant(substitute(context));
  }

  @Override
  public abstract String toString();
}
