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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * {@code sum(i in I, j in J : filter) body}.
 *
 * <p>Iterators are enumerated outer first. A combination is skipped when the filter is false, or
 * when the filter or the body reads data that is missing for that combination. Undeclared sets and
 * type errors are not skipped.
 */
public final class FilteredSummationExpression extends Expression {
  private final ImmutableList<IteratorSpec> iterators;
  private final Expression filter;
  private final Expression body;

  /**
   * Creates a summation.
   *
   * @param filter the filter, or null to keep every combination
   */
  public FilteredSummationExpression(
      List<IteratorSpec> iterators, Expression filter, Expression body) {
    checkArgument(!iterators.isEmpty(), "a summation needs at least one iterator");
    this.iterators = ImmutableList.copyOf(iterators);
    this.filter = filter;
    this.body = body;
  }

  public ImmutableList<IteratorSpec> getIterators() {
    return iterators;
  }

  /** The filter, or null. */
  public Expression getFilter() {
    return filter;
  }

  public Expression getBody() {
    return body;
  }

  @Override
  public ImmutableList<Expression> children() {
    return filter == null ? ImmutableList.of(body) : ImmutableList.of(filter, body);
  }

  @Override
  public double evaluate(EvaluationContext context) {
    double[] total = {0.0};
    forEachCombination(
        0,
        context,
        () -> {
          if (acceptsCombination(context)) {
            OptionalDouble term = Expressions.tryEvaluate(body, context);
            if (term.isPresent()) {
              total[0] += term.getAsDouble();
            }
          }
        });
    return total[0];
  }

  @Override
  public LinearForm linearize(EvaluationContext context) {
    LinearForm.Builder builder = LinearForm.newBuilder();
    forEachCombination(
        0,
        context,
        () -> {
          if (acceptsCombination(context)) {
            tryLinearizeBody(context).ifPresent(builder::addForm);
          }
        });
    return builder.build();
  }

  /** Linearizes the body, or returns empty when the data it reads is missing. */
  private Optional<LinearForm> tryLinearizeBody(EvaluationContext context) {
    try {
      LinearForm term = body.linearize(context);
      term.validate(context);
      return Optional.of(term);
    } catch (ModelException.ValueResolution e) {
      return Optional.empty();
    }
  }

  private boolean acceptsCombination(EvaluationContext context) {
    if (filter == null) {
      return true;
    }
    OptionalDouble value = Expressions.tryEvaluate(filter, context);
    return value.isPresent() && Expressions.isTrue(value.getAsDouble());
  }

  private void forEachCombination(int depth, EvaluationContext context, Runnable action) {
    if (depth == iterators.size()) {
      action.run();
      return;
    }
    IteratorSpec spec = iterators.get(depth);
    for (Binding binding : DomainResolver.resolve(spec, context)) {
      context.push(spec.variable(), binding);
      try {
        forEachCombination(depth + 1, context, action);
      } finally {
        context.pop();
      }
    }
  }

  @Override
  public boolean isConstant() {
    return false;
  }

  @Override
  public Expression simplify(ModelManager manager) {
    // Declared values must not be folded into names that an iterator shadows.
    ModelManager inner = shadowsParameter(manager) ? null : manager;
    Expression f = filter == null ? null : filter.simplify(inner);
    Expression b = body.simplify(inner);
    return f == filter && b == body ? this : new FilteredSummationExpression(iterators, f, b);
  }

  private boolean shadowsParameter(ModelManager manager) {
    if (manager == null) {
      return false;
    }
    for (IteratorSpec spec : iterators) {
      if (manager.getParameter(spec.variable()) != null) {
        return true;
      }
    }
    return false;
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    List<IteratorSpec> specs = new ArrayList<>();
    List<String> names = new ArrayList<>();
    for (IteratorSpec spec : iterators) {
      // Later ranges may refer to earlier iterators of this summation.
      context.mask(names);
      try {
        specs.add(spec.substitute(context));
      } finally {
        context.pop();
      }
      names.add(spec.variable());
    }
    context.mask(names);
    try {
      Expression f = filter == null ? null : filter.substitute(context);
      Expression b = body.substitute(context);
      return new FilteredSummationExpression(specs, f, b);
    } finally {
      context.pop();
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("sum(");
    for (int i = 0; i < iterators.size(); ++i) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(iterators.get(i));
    }
    if (filter != null) {
      sb.append(" : ").append(filter);
    }
    return sb.append(") ").append(body).toString();
  }
}
