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

package com.google.optmodel;

import com.google.common.collect.ImmutableList;
import com.google.optmodel.model.DecisionExpression;
import com.google.optmodel.model.IndexSet;
import com.google.optmodel.model.IndexedEquationTemplate;
import com.google.optmodel.model.IndexedVariable;
import com.google.optmodel.model.LinearEquation;
import com.google.optmodel.model.Objective;
import com.google.optmodel.model.ObjectiveTemplate;
import com.google.optmodel.model.Parameter;
import com.google.optmodel.model.PrimitiveSet;
import com.google.optmodel.model.ScalarValue;
import com.google.optmodel.model.TupleSchema;
import com.google.optmodel.model.TupleSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Symbol environment of one model: every declaration, the equation templates, and the equations
 * produced by their expansion.
 *
 * <p>Lookups return null for undeclared names. All names share one namespace. Not thread-safe; a
 * manager belongs to a single parse session.
 */
public final class ModelManager {
  private final Map<String, IndexSet> indexSets = new LinkedHashMap<>();
  private final Map<String, PrimitiveSet> primitiveSets = new LinkedHashMap<>();
  private final Map<String, Parameter> parameters = new LinkedHashMap<>();
  private final Map<String, TupleSchema> tupleSchemas = new LinkedHashMap<>();
  private final Map<String, TupleSet> tupleSets = new LinkedHashMap<>();
  private final Map<String, IndexedVariable> variables = new LinkedHashMap<>();
  private final Map<String, DecisionExpression> decisionExpressions = new LinkedHashMap<>();
  private final List<IndexedEquationTemplate> templates = new ArrayList<>();
  private final List<LinearEquation> equations = new ArrayList<>();
  private ObjectiveTemplate objectiveTemplate;
  private Objective objective;

  // Declarations.

  public void addIndexSet(IndexSet indexSet) {
    checkUndeclared("Index set", indexSet.getName());
    indexSets.put(indexSet.getName(), indexSet);
  }

  public void addPrimitiveSet(PrimitiveSet primitiveSet) {
    checkUndeclared("Set", primitiveSet.getName());
    primitiveSets.put(primitiveSet.getName(), primitiveSet);
  }

  public void addParameter(Parameter parameter) {
    checkUndeclared("Parameter", parameter.getName());
    parameters.put(parameter.getName(), parameter);
  }

  public void addTupleSchema(TupleSchema schema) {
    if (tupleSchemas.containsKey(schema.getName())) {
      throw new ModelException.DuplicateDeclaration("declare", "Tuple schema", schema.getName());
    }
    tupleSchemas.put(schema.getName(), schema);
  }

  public void addTupleSet(TupleSet tupleSet) {
    checkUndeclared("Tuple set", tupleSet.getName());
    if (!tupleSchemas.containsKey(tupleSet.getSchemaName())) {
      throw new ModelException.SchemaNotFound("declare", tupleSet.getSchemaName());
    }
    tupleSets.put(tupleSet.getName(), tupleSet);
  }

  public void addVariable(IndexedVariable variable) {
    checkUndeclared("Variable", variable.getBaseName());
    variables.put(variable.getBaseName(), variable);
  }

  public void addDecisionExpression(DecisionExpression dexpr) {
    checkUndeclared("Decision expression", dexpr.getName());
    decisionExpressions.put(dexpr.getName(), dexpr);
  }

  public void addTemplate(IndexedEquationTemplate template) {
    templates.add(template);
  }

  public void setObjectiveTemplate(ObjectiveTemplate template) {
    if (objectiveTemplate != null) {
      throw new ModelException.DuplicateDeclaration("declare", "Objective", "objective");
    }
    objectiveTemplate = template;
  }

  /** Called by the expansion engine only. */
  public void addEquation(LinearEquation equation) {
    equations.add(equation);
  }

  /** Called by the expansion engine only. */
  public void setObjective(Objective objective) {
    this.objective = objective;
  }

  private void checkUndeclared(String kind, String name) {
    if (isDeclared(name)) {
      throw new ModelException.DuplicateDeclaration("declare", kind, name);
    }
  }

  /** Returns true if {@code name} names a set, parameter, variable or decision expression. */
  public boolean isDeclared(String name) {
    return indexSets.containsKey(name)
        || primitiveSets.containsKey(name)
        || parameters.containsKey(name)
        || tupleSets.containsKey(name)
        || variables.containsKey(name)
        || decisionExpressions.containsKey(name);
  }

  /** Returns true if {@code name} is an index set, a primitive set or a tuple set. */
  public boolean isSet(String name) {
    return indexSets.containsKey(name)
        || primitiveSets.containsKey(name)
        || tupleSets.containsKey(name);
  }

  // Lookups.

  public IndexSet getIndexSet(String name) {
    return indexSets.get(name);
  }

  public PrimitiveSet getPrimitiveSet(String name) {
    return primitiveSets.get(name);
  }

  public Parameter getParameter(String name) {
    return parameters.get(name);
  }

  public TupleSchema getTupleSchema(String name) {
    return tupleSchemas.get(name);
  }

  public TupleSet getTupleSet(String name) {
    return tupleSets.get(name);
  }

  public IndexedVariable getVariable(String name) {
    return variables.get(name);
  }

  public DecisionExpression getDecisionExpression(String name) {
    return decisionExpressions.get(name);
  }

  public ImmutableList<IndexSet> getIndexSets() {
    return ImmutableList.copyOf(indexSets.values());
  }

  public ImmutableList<PrimitiveSet> getPrimitiveSets() {
    return ImmutableList.copyOf(primitiveSets.values());
  }

  public ImmutableList<Parameter> getParameters() {
    return ImmutableList.copyOf(parameters.values());
  }

  public ImmutableList<TupleSchema> getTupleSchemas() {
    return ImmutableList.copyOf(tupleSchemas.values());
  }

  public ImmutableList<TupleSet> getTupleSets() {
    return ImmutableList.copyOf(tupleSets.values());
  }

  public ImmutableList<IndexedVariable> getVariables() {
    return ImmutableList.copyOf(variables.values());
  }

  public ImmutableList<DecisionExpression> getDecisionExpressions() {
    return ImmutableList.copyOf(decisionExpressions.values());
  }

  public ImmutableList<IndexedEquationTemplate> getTemplates() {
    return ImmutableList.copyOf(templates);
  }

  public ImmutableList<LinearEquation> getEquations() {
    return ImmutableList.copyOf(equations);
  }

  /** The declared objective, or null. */
  public ObjectiveTemplate getObjectiveTemplate() {
    return objectiveTemplate;
  }

  /** The expanded objective, or null. */
  public Objective getObjective() {
    return objective;
  }

  /**
   * Checks that {@code value} belongs to the set {@code setName} indexing {@code symbol}. Index
   * sets and integer primitive sets check membership; tuple sets accept the index values of their
   * tuples.
   */
  public void checkIndex(String symbol, String setName, int value) {
    IndexSet indexSet = indexSets.get(setName);
    if (indexSet != null) {
      if (!indexSet.contains(value)) {
        throw new ModelException.OutOfRange(
            "index",
            symbol,
            Integer.toString(value),
            indexSet.getStart() + ".." + indexSet.getEnd());
      }
      return;
    }
    PrimitiveSet primitiveSet = primitiveSets.get(setName);
    if (primitiveSet != null) {
      if (!primitiveSet.contains(ScalarValue.ofInt(value))) {
        throw new ModelException.OutOfRange(
            "index", symbol, Integer.toString(value), setName + " " + primitiveSet.values());
      }
      return;
    }
    TupleSet tupleSet = tupleSets.get(setName);
    if (tupleSet != null) {
      int first = 1;
      if (tupleSet.getIndexSetName() != null && indexSets.containsKey(tupleSet.getIndexSetName())) {
        first = indexSets.get(tupleSet.getIndexSetName()).getStart();
      }
      if (value < first || value >= first + tupleSet.size()) {
        throw new ModelException.OutOfRange(
            "index",
            symbol,
            Integer.toString(value),
            first + ".." + (first + tupleSet.size() - 1));
      }
      return;
    }
    throw new ModelException.NotFound("index", "Set", setName);
  }

  /** Names of external parameters and sets that have not received a value. */
  public ImmutableList<String> getUnresolvedExternals() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Parameter parameter : parameters.values()) {
      if (parameter.isExternal() && !parameter.hasValue()) {
        names.add(parameter.getName());
      }
    }
    for (PrimitiveSet set : primitiveSets.values()) {
      if (!set.hasValue()) {
        names.add(set.getName());
      }
    }
    for (TupleSet set : tupleSets.values()) {
      if (!set.hasValue()) {
        names.add(set.getName());
      }
    }
    return names.build();
  }

  /** Removes every declaration, template and equation. */
  public void clear() {
    indexSets.clear();
    primitiveSets.clear();
    parameters.clear();
    tupleSchemas.clear();
    tupleSets.clear();
    variables.clear();
    decisionExpressions.clear();
    templates.clear();
    equations.clear();
    objectiveTemplate = null;
    objective = null;
  }

  /** Returns a multi-line summary of the declarations and the expansion results. */
  public String generateReport() {
    StringBuilder sb = new StringBuilder();
    sb.append("Index sets: ").append(indexSets.size()).append('\n');
    for (IndexSet indexSet : indexSets.values()) {
      sb.append("  ").append(indexSet).append('\n');
    }
    sb.append("Sets: ").append(primitiveSets.size()).append('\n');
    for (PrimitiveSet set : primitiveSets.values()) {
      sb.append("  ").append(set).append('\n');
    }
    sb.append("Tuple schemas: ").append(tupleSchemas.size()).append('\n');
    for (TupleSchema schema : tupleSchemas.values()) {
      sb.append("  ").append(schema).append('\n');
    }
    sb.append("Tuple sets: ").append(tupleSets.size()).append('\n');
    for (TupleSet set : tupleSets.values()) {
      sb.append("  ").append(set).append('\n');
    }
    sb.append("Parameters: ").append(parameters.size()).append('\n');
    for (Parameter parameter : parameters.values()) {
      sb.append("  ").append(parameter).append('\n');
    }
    sb.append("Variables: ").append(variables.size()).append('\n');
    for (IndexedVariable variable : variables.values()) {
      sb.append("  ").append(variable).append('\n');
    }
    sb.append("Decision expressions: ").append(decisionExpressions.size()).append('\n');
    int failed = 0;
    for (IndexedEquationTemplate template : templates) {
      if (template.getState() == IndexedEquationTemplate.State.FAILED) {
        failed++;
      }
    }
    sb.append("Templates: ")
        .append(templates.size())
        .append(" (")
        .append(failed)
        .append(" failed)\n");
    sb.append("Equations: ").append(equations.size()).append('\n');
    for (LinearEquation equation : equations) {
      sb.append("  ").append(equation).append('\n');
    }
    sb.append("Objective: ").append(objective != null ? objective : "none").append('\n');
    return sb.toString();
  }
}
