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

package com.google.optmodel.expansion;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.optmodel.ModelException;
import com.google.optmodel.ModelManager;
import com.google.optmodel.ParseSessionResult;
import com.google.optmodel.expr.Binding;
import com.google.optmodel.expr.DomainResolver;
import com.google.optmodel.expr.EvaluationContext;
import com.google.optmodel.expr.Expression;
import com.google.optmodel.expr.Expressions;
import com.google.optmodel.expr.IteratorSpec;
import com.google.optmodel.expr.LinearForm;
import com.google.optmodel.expr.UnaryExpression;
import com.google.optmodel.model.IndexedEquationTemplate;
import com.google.optmodel.model.LinearEquation;
import com.google.optmodel.model.Objective;
import com.google.optmodel.model.ObjectiveTemplate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.logging.Logger;

/**
 * Turns equation templates into concrete linear equations.
 *
 * <p>For each template the iterator domains are enumerated outer first. Each combination is bound
 * in an {@link EvaluationContext}, the filter is checked, and {@code lhs - rhs} is linearized into
 * coefficient expressions plus a constant. Missing data for one combination skips that combination
 * with a warning. Any other error fails the whole template and none of its equations are kept.
 */
public final class EquationExpander {
  private static final Logger logger = Logger.getLogger(EquationExpander.class.getName());

  private final ModelManager manager;
  private final ExpansionParameters parameters;

  public EquationExpander(ModelManager manager, ExpansionParameters parameters) {
    this.manager = manager;
    this.parameters = parameters;
  }

  public EquationExpander(ModelManager manager) {
    this(manager, ExpansionParameters.getDefault());
  }

  /**
   * Expands every unexpanded template, then the objective.
   *
   * @throws IllegalStateException if an external parameter or set has no value yet
   */
  public void expandAll(ParseSessionResult result) {
    ImmutableList<String> unresolved = manager.getUnresolvedExternals();
    checkState(
        unresolved.isEmpty(),
        "cannot expand templates, external data is missing for %s",
        unresolved);
    int before = manager.getEquations().size();
    for (IndexedEquationTemplate template : manager.getTemplates()) {
      if (template.getState() == IndexedEquationTemplate.State.UNEXPANDED) {
        expand(template, result);
      }
    }
    if (manager.getObjectiveTemplate() != null && manager.getObjective() == null) {
      expandObjective(manager.getObjectiveTemplate(), result);
    }
    logger.info(
        "Expanded "
            + manager.getTemplates().size()
            + " template(s) into "
            + (manager.getEquations().size() - before)
            + " equation(s)");
  }

  /**
   * Expands one template and registers its equations with the manager.
   *
   * @return the equations produced, empty if the template failed
   */
  public ImmutableList<LinearEquation> expand(
      IndexedEquationTemplate template, ParseSessionResult result) {
    template.beginExpansion();
    EvaluationContext context = EvaluationContext.of(manager);
    List<LinearEquation> equations = new ArrayList<>();
    try {
      expandCombinations(template, 0, new ArrayList<>(), context, equations, result);
    } catch (ModelException e) {
      template.markFailed(e.getMessage());
      result.addError(template.getLineNumber(), e.getMessage());
      logger.warning("Template at line " + template.getLineNumber() + " failed: " + e.getMessage());
      return ImmutableList.of();
    }
    for (LinearEquation equation : equations) {
      manager.addEquation(equation);
    }
    template.markExpanded();
    logger.fine(
        "Template at line " + template.getLineNumber() + " produced " + equations.size()
            + " equation(s)");
    return ImmutableList.copyOf(equations);
  }

  private void expandCombinations(
      IndexedEquationTemplate template,
      int depth,
      List<Binding> bound,
      EvaluationContext context,
      List<LinearEquation> equations,
      ParseSessionResult result) {
    if (depth == template.getIterators().size()) {
      expandCombination(template, bound, context, equations, result);
      return;
    }
    IteratorSpec spec = template.getIterators().get(depth);
    for (Binding binding : resolveDomain(spec, context)) {
      context.push(spec.variable(), binding);
      bound.add(binding);
      try {
        expandCombinations(template, depth + 1, bound, context, equations, result);
      } finally {
        bound.remove(bound.size() - 1);
        context.pop();
      }
    }
  }

  /** A domain that cannot be enumerated fails the template, whatever the cause. */
  private static ImmutableList<Binding> resolveDomain(
      IteratorSpec spec, EvaluationContext context) {
    try {
      return DomainResolver.resolve(spec, context);
    } catch (ModelException.ValueResolution e) {
      throw new ModelException.MalformedExpression(
          "expand", "cannot enumerate '" + spec + "': " + e.getMessage());
    }
  }

  private void expandCombination(
      IndexedEquationTemplate template,
      List<Binding> bound,
      EvaluationContext context,
      List<LinearEquation> equations,
      ParseSessionResult result) {
    try {
      if (template.getFilter() != null
          && !Expressions.isTrue(template.getFilter().evaluate(context))) {
        return;
      }
      LinearForm form =
          template.getLhs().linearize(context).minus(template.getRhs().linearize(context));
      form.validate(context);
      equations.add(toEquation(template, bound, form));
    } catch (ModelException.ValueResolution e) {
      if (!template.isIndexed()) {
        throw e;
      }
      String message = "skipped " + describe(template, context) + ": " + e.getMessage();
      result.addWarning(template.getLineNumber(), message);
      logger.warning("Line " + template.getLineNumber() + ": " + message);
    }
  }

  private LinearEquation toEquation(
      IndexedEquationTemplate template, List<Binding> bound, LinearForm form) {
    LinearForm simplified = form.simplify();
    Expression constant = UnaryExpression.negate(simplified.getOffset()).simplify();
    String label = template.getLabel();
    return new LinearEquation(
        label,
        template.isIndexed() ? label : null,
        bound.size() > 0 ? bound.get(0).getIndex() : null,
        bound.size() > 1 ? bound.get(1).getIndex() : null,
        template.getOperator(),
        nonZeroCoefficients(simplified),
        constant);
  }

  private Map<String, Expression> nonZeroCoefficients(LinearForm form) {
    Map<String, Expression> coefficients = new LinkedHashMap<>();
    for (Map.Entry<String, Expression> term : form.getCoefficients().entrySet()) {
      OptionalDouble value = Expressions.literalValue(term.getValue());
      if (parameters.dropZeroCoefficients()
          && value.isPresent()
          && Math.abs(value.getAsDouble()) < parameters.zeroTolerance()) {
        continue;
      }
      coefficients.put(term.getKey(), term.getValue());
    }
    return coefficients;
  }

  /**
   * Linearizes the objective and registers it with the manager. A failure is recorded as an error
   * and leaves the model without objective.
   */
  public Objective expandObjective(ObjectiveTemplate template, ParseSessionResult result) {
    EvaluationContext context = EvaluationContext.of(manager);
    try {
      LinearForm form = template.getExpression().linearize(context);
      form.validate(context);
      LinearForm simplified = form.simplify();
      Objective objective =
          new Objective(
              template.getName(),
              template.getSense(),
              nonZeroCoefficients(simplified),
              simplified.getOffset());
      manager.setObjective(objective);
      return objective;
    } catch (ModelException e) {
      result.addError(template.getLineNumber(), e.getMessage());
      logger.warning(
          "Objective at line " + template.getLineNumber() + " failed: " + e.getMessage());
      return null;
    }
  }

  private static String describe(IndexedEquationTemplate template, EvaluationContext context) {
    String name = template.getLabel() != null ? template.getLabel() : "constraint";
    return name + " " + context.bindings();
  }
}
