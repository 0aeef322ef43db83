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
import com.google.optmodel.model.IndexSet;
import com.google.optmodel.model.Parameter;
import com.google.optmodel.model.ScalarValue;
import com.google.optmodel.model.TupleInstance;
import com.google.optmodel.model.TupleSchema;
import com.google.optmodel.model.TupleSet;
import java.util.List;
import java.util.Optional;

/**
 * Finds tuples: by key for {@code item()}, by index for {@code Set[i].field}, and by binding for
 * {@code p.field}.
 *
 * <p>Key lookup compares the key fields of each tuple, in declaration order, with {@link
 * ScalarValue#keyEquals}; the first match wins. Resolution is deterministic, so the same key always
 * yields the same instance.
 */
public final class TupleResolver {
  private TupleResolver() {}

  /** Resolves {@code item(set, key)} under the bindings of {@code context}. */
  public static TupleInstance resolve(ItemFunctionExpression item, EvaluationContext context) {
    ModelManager manager = context.getManager();
    TupleSet tupleSet = lookupTupleSet(manager, item.getTupleSetName());
    TupleSchema schema = lookupSchema(manager, tupleSet);
    return findByKey(tupleSet, schema, resolveKey(item.getKey(), context));
  }

  /** Evaluates each part of a key to a scalar value. */
  public static ImmutableList<ScalarValue> resolveKey(Expression key, EvaluationContext context) {
    ImmutableList.Builder<ScalarValue> values = ImmutableList.builder();
    for (Expression part : key.keyParts()) {
      if (part.keyParts().size() > 1) {
        throw new ModelException.MalformedExpression("resolve", "nested composite key " + key);
      }
      values.add(part.evaluateScalar(context));
    }
    return values.build();
  }

  /** Returns the first tuple of {@code tupleSet} whose key fields equal {@code key}. */
  public static TupleInstance findByKey(
      TupleSet tupleSet, TupleSchema schema, List<ScalarValue> key) {
    ImmutableList<String> keyFields = schema.getKeyFields();
    if (key.size() != keyFields.size()) {
      throw new ModelException.KeyArityMismatch(
          "resolve", tupleSet.getName(), key.size(), keyFields);
    }
    for (int position = 0; position < tupleSet.size(); ++position) {
      TupleInstance candidate = tupleSet.get(position);
      if (matches(candidate, keyFields, key)) {
        return candidate;
      }
    }
    throw new ModelException.NoMatch("resolve", tupleSet.getName(), renderKey(key));
  }

  private static boolean matches(
      TupleInstance candidate, List<String> keyFields, List<ScalarValue> key) {
    for (int i = 0; i < keyFields.size(); ++i) {
      ScalarValue value = candidate.findValue(keyFields.get(i));
      if (value == null || !value.keyEquals(key.get(i))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the tuple of {@code tupleSetName} at {@code index}. With a backing index set the index
   * is a value of that set; otherwise it is a 1-based position.
   */
  public static TupleInstance instanceAt(ModelManager manager, String tupleSetName, int index) {
    TupleSet tupleSet = lookupTupleSet(manager, tupleSetName);
    int position;
    if (tupleSet.getIndexSetName() != null) {
      IndexSet indexSet = manager.getIndexSet(tupleSet.getIndexSetName());
      if (indexSet == null) {
        throw new ModelException.NotFound("resolve", "Index set", tupleSet.getIndexSetName());
      }
      position = indexSet.getPosition(index);
    } else {
      position = index - 1;
    }
    if (position < 0 || position >= tupleSet.size()) {
      throw new ModelException.OutOfRange(
          "resolve", tupleSetName, Integer.toString(index), "of " + tupleSet.size() + " tuples");
    }
    return tupleSet.get(position);
  }

  /**
   * Resolves the tuple named by {@code variable} in {@code p.field}: a tuple bound in the context
   * first, then a tuple-valued parameter.
   *
   * <p>An iterator bound to an integer is rejected. Which tuple set it would index is ambiguous;
   * {@code Set[i].field} names the set explicitly.
   */
  public static TupleInstance resolveDynamic(String variable, EvaluationContext context) {
    Optional<Binding> binding = context.lookup(variable);
    if (binding.isPresent()) {
      if (binding.get().isTuple()) {
        return binding.get().getTuple();
      }
      throw new ModelException.MalformedExpression(
          "resolve",
          "'"
              + variable
              + "' is bound to "
              + binding.get().getValue()
              + ", not to a tuple; write Set["
              + variable
              + "].field to select a tuple by position");
    }
    Parameter parameter = context.getManager().getParameter(variable);
    if (parameter == null) {
      throw new ModelException.NotFound("resolve", "Tuple", variable);
    }
    if (!parameter.isTuple()) {
      throw new ModelException.MalformedExpression(
          "resolve", "parameter '" + variable + "' does not hold a tuple");
    }
    return parameter.getTupleValue();
  }

  static TupleSet lookupTupleSet(ModelManager manager, String name) {
    TupleSet tupleSet = manager.getTupleSet(name);
    if (tupleSet == null) {
      throw new ModelException.TupleSetNotFound("resolve", name);
    }
    return tupleSet;
  }

  static TupleSchema lookupSchema(ModelManager manager, TupleSet tupleSet) {
    TupleSchema schema = manager.getTupleSchema(tupleSet.getSchemaName());
    if (schema == null) {
      throw new ModelException.SchemaNotFound("resolve", tupleSet.getSchemaName());
    }
    return schema;
  }

  private static String renderKey(List<ScalarValue> key) {
    StringBuilder sb = new StringBuilder("<");
    for (int i = 0; i < key.size(); ++i) {
      if (i > 0) {
        sb.append(", ");
      }
      ScalarValue value = key.get(i);
      sb.append(value.kind() == ScalarValue.Kind.STRING ? "\"" + value + "\"" : value.toString());
    }
    return sb.append('>').toString();
  }
}
