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

import com.google.optmodel.ModelException;
import com.google.optmodel.ModelManager;
import com.google.optmodel.model.Parameter;
import com.google.optmodel.model.ScalarValue;
import java.util.Optional;

/**
 * A bare name: a bound iterator or a scalar parameter. Bindings of the evaluation context are
 * checked before the declared parameters.
 */
public final class ParameterExpression extends Expression {
  private final String name;

  public ParameterExpression(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Override
  public double evaluate(EvaluationContext context) {
    return evaluateScalar(context).asDouble();
  }

  @Override
  public ScalarValue evaluateScalar(EvaluationContext context) {
    Optional<Binding> binding = context.lookup(name);
    if (binding.isPresent()) {
      if (binding.get().isTuple()) {
        throw new ModelException.NotNumeric("evaluate", "tuple iterator '" + name + "'");
      }
      return binding.get().getValue();
    }
    return lookupParameter(context.getManager()).getValue();
  }

  @Override
  public int evaluateIndex(EvaluationContext context) {
    Optional<Binding> binding = context.lookup(name);
    if (binding.isPresent() && binding.get().isTuple()) {
      return binding.get().getIndex();
    }
    return super.evaluateIndex(context);
  }

  private Parameter lookupParameter(ModelManager manager) {
    Parameter parameter = manager.getParameter(name);
    if (parameter == null) {
      throw new ModelException.NotFound("evaluate", "Parameter", name);
    }
    if (!parameter.isScalar()) {
      throw new ModelException.MalformedExpression(
          "evaluate",
          "parameter '" + name + "' needs " + parameter.getDimension() + " index(es)");
    }
    if (parameter.isTuple()) {
      throw new ModelException.NotNumeric("evaluate", "tuple parameter '" + name + "'");
    }
    return parameter;
  }

  @Override
  public boolean isConstant() {
    return false;
  }

  @Override
  public Expression simplify(ModelManager manager) {
    if (manager == null) {
      return this;
    }
    Parameter parameter = manager.getParameter(name);
    if (parameter != null
        && parameter.isScalar()
        && !parameter.isTuple()
        && parameter.hasValue()
        && parameter.getValue().isNumeric()) {
      return new ConstantExpression(parameter.getValue().asDouble());
    }
    return this;
  }

  @Override
  public Expression substitute(EvaluationContext context) {
    Optional<Binding> binding = context.lookup(name);
    if (!binding.isPresent()) {
      return this;
    }
    if (binding.get().isTuple()) {
      // A tuple iterator can only survive substitution as an index, as in cost[p].
      return new ConstantExpression(binding.get().getIndex());
    }
    ScalarValue value = binding.get().getValue();
    if (value.isNumeric()) {
      return new ConstantExpression(value.asDouble());
    }
    return new StringConstantExpression(value.asString());
  }

  @Override
  public String toString() {
    return name;
  }
}
