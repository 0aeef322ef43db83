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
import com.google.common.primitives.Ints;
import com.google.optmodel.ModelException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A named data value: a scalar, or a table indexed by one or two sets.
 *
 * <p>External parameters are declared with {@code = ...} and receive their values from the data
 * loader. Tuple-typed parameters hold a whole {@link TupleInstance}.
 */
public final class Parameter {
  private final String name;
  private final ValueType type;
  private final String schemaName;
  private final ImmutableList<String> indexSetNames;
  private final boolean external;

  private ScalarValue value;
  private TupleInstance tupleValue;
  private final Map<List<Integer>, ScalarValue> indexedValues = new HashMap<>();

  private Parameter(
      String name,
      ValueType type,
      String schemaName,
      List<String> indexSetNames,
      boolean external) {
    checkArgument(!name.isEmpty(), "empty parameter name");
    checkArgument(indexSetNames.size() <= 2, "parameter %s has more than two dimensions", name);
    checkArgument(
        type != ValueType.TUPLE || indexSetNames.isEmpty(),
        "tuple parameter %s cannot be indexed",
        name);
    this.name = name;
    this.type = type;
    this.schemaName = schemaName;
    this.indexSetNames = ImmutableList.copyOf(indexSetNames);
    this.external = external;
  }

  /** Creates a scalar parameter. */
  public static Parameter scalar(String name, ValueType type, boolean external) {
    return new Parameter(name, type, null, ImmutableList.of(), external);
  }

  /** Creates a parameter indexed by one or two index sets. */
  public static Parameter indexed(
      String name, ValueType type, List<String> indexSetNames, boolean external) {
    checkArgument(!indexSetNames.isEmpty(), "indexed parameter %s needs an index set", name);
    return new Parameter(name, type, null, indexSetNames, external);
  }

  /** Creates a parameter holding one tuple of the given schema. */
  public static Parameter tuple(String name, String schemaName, boolean external) {
    return new Parameter(name, ValueType.TUPLE, schemaName, ImmutableList.of(), external);
  }

  public String getName() {
    return name;
  }

  public ValueType getType() {
    return type;
  }

  /** Schema of a tuple-typed parameter, or null. */
  public String getSchemaName() {
    return schemaName;
  }

  public ImmutableList<String> getIndexSetNames() {
    return indexSetNames;
  }

  public int getDimension() {
    return indexSetNames.size();
  }

  public boolean isScalar() {
    return indexSetNames.isEmpty();
  }

  public boolean isExternal() {
    return external;
  }

  public boolean isTuple() {
    return type == ValueType.TUPLE;
  }

  public boolean hasValue() {
    if (isTuple()) {
      return tupleValue != null;
    }
    return isScalar() ? value != null : !indexedValues.isEmpty();
  }

  public void setValue(ScalarValue newValue) {
    checkState(isScalar() && !isTuple(), "%s is not a scalar parameter", name);
    value = type.coerce(newValue);
  }

  /** Returns the value of a scalar parameter, failing with {@code MissingValue} when unset. */
  public ScalarValue getValue() {
    checkState(isScalar() && !isTuple(), "%s is not a scalar parameter", name);
    if (value == null) {
      throw new ModelException.MissingValue("getValue", name);
    }
    return value;
  }

  public void setTupleValue(TupleInstance instance) {
    checkState(isTuple(), "%s is not a tuple parameter", name);
    checkArgument(
        instance.getSchema().getName().equals(schemaName),
        "tuple of schema %s assigned to %s of schema %s",
        instance.getSchema().getName(),
        name,
        schemaName);
    tupleValue = instance;
  }

  public TupleInstance getTupleValue() {
    checkState(isTuple(), "%s is not a tuple parameter", name);
    if (tupleValue == null) {
      throw new ModelException.MissingValue("getTupleValue", name);
    }
    return tupleValue;
  }

  /** Stores the value at the given index values, one per dimension. */
  public void setIndexedValue(List<Integer> indices, ScalarValue newValue) {
    checkDimension(indices.size());
    indexedValues.put(ImmutableList.copyOf(indices), type.coerce(newValue));
  }

  /** Returns the value at the given index values, failing with {@code MissingValue}. */
  public ScalarValue getIndexedValue(int... indices) {
    checkDimension(indices.length);
    ScalarValue stored = indexedValues.get(Ints.asList(indices));
    if (stored == null) {
      throw new ModelException.MissingValue("getIndexedValue", name + Ints.asList(indices));
    }
    return stored;
  }

  /** Returns the value at the given index values, or null when none was stored. */
  public ScalarValue findIndexedValue(int... indices) {
    checkDimension(indices.length);
    return indexedValues.get(Ints.asList(indices));
  }

  private void checkDimension(int count) {
    if (count != indexSetNames.size()) {
      throw new ModelException.MalformedExpression(
          "index",
          "parameter '" + name + "' has " + indexSetNames.size() + " index(es), got " + count);
    }
  }

  @Override
  public String toString() {
    String typeName = isTuple() ? schemaName : type.name().toLowerCase(Locale.ROOT);
    StringBuilder sb = new StringBuilder(typeName).append(' ').append(name);
    if (!isScalar()) {
      sb.append('[').append(String.join(",", indexSetNames)).append(']');
    }
    if (external) {
      sb.append(" = ...");
    }
    return sb.toString();
  }
}
