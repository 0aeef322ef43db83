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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.optmodel.expr.Expression;
import com.google.optmodel.expr.IteratorSpec;
import java.util.List;

/**
 * A constraint as written, before its iterators are expanded. A template without iterators stands
 * for a single plain equation.
 *
 * <p>A template is expanded at most once: {@code UNEXPANDED -> EXPANDING -> EXPANDED}, or {@code
 * FAILED} with an error message.
 */
public final class IndexedEquationTemplate {
  /** Expansion state. */
  public enum State {
    UNEXPANDED,
    EXPANDING,
    EXPANDED,
    FAILED
  }

  private final String label;
  private final ImmutableList<IteratorSpec> iterators;
  private final Expression filter;
  private final RelationalOperator op;
  private final Expression lhs;
  private final Expression rhs;
  private final int lineNumber;

  private State state = State.UNEXPANDED;
  private String error;

  /**
   * Creates a template.
   *
   * @param label the constraint name, or null
   * @param iterators zero to two iterators
   * @param filter the filter on iterator combinations, or null
   */
  public IndexedEquationTemplate(
      String label,
      List<IteratorSpec> iterators,
      Expression filter,
      RelationalOperator op,
      Expression lhs,
      Expression rhs,
      int lineNumber) {
    checkArgument(iterators.size() <= 2, "at most two iterators are supported");
    this.label = label;
    this.iterators = ImmutableList.copyOf(iterators);
    this.filter = filter;
    this.op = op;
    this.lhs = lhs;
    this.rhs = rhs;
    this.lineNumber = lineNumber;
  }

  /** Name of the constraint, or null. */
  public String getLabel() {
    return label;
  }

  public boolean isIndexed() {
    return !iterators.isEmpty();
  }

  public ImmutableList<IteratorSpec> getIterators() {
    return iterators;
  }

  /** Filter on iterator combinations, or null. */
  public Expression getFilter() {
    return filter;
  }

  public RelationalOperator getOperator() {
    return op;
  }

  public Expression getLhs() {
    return lhs;
  }

  public Expression getRhs() {
    return rhs;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public State getState() {
    return state;
  }

  /** Error attached to a failed template, or null. */
  public String getError() {
    return error;
  }

  public void beginExpansion() {
    checkState(state == State.UNEXPANDED, "template at line %s is already %s", lineNumber, state);
    state = State.EXPANDING;
  }

  public void markExpanded() {
    checkState(state == State.EXPANDING, "template at line %s is %s", lineNumber, state);
    state = State.EXPANDED;
  }

  public void markFailed(String message) {
    checkState(state == State.EXPANDING, "template at line %s is %s", lineNumber, state);
    state = State.FAILED;
    error = message;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (isIndexed()) {
      sb.append("forall(");
      for (int i = 0; i < iterators.size(); ++i) {
        sb.append(i > 0 ? ", " : "").append(iterators.get(i));
      }
      if (filter != null) {
        sb.append(" : ").append(filter);
      }
      sb.append(") ");
    }
    if (label != null) {
      sb.append(label).append(": ");
    }
    return sb.append(lhs).append(' ').append(op.symbol()).append(' ').append(rhs).toString();
  }
}
