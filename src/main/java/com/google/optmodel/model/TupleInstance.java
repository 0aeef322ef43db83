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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import com.google.optmodel.ModelException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** One record of a tuple set. Field values change only through {@link #setValue}. */
public final class TupleInstance {
  private final TupleSchema schema;
  private final Map<String, ScalarValue> values = new LinkedHashMap<>();
  private String owner;

  public TupleInstance(TupleSchema schema) {
    this.schema = checkNotNull(schema);
  }

  /** Builds an instance from values given in schema field order, as in {@code <1, "a", 2.5>}. */
  public static TupleInstance of(TupleSchema schema, List<ScalarValue> fieldValues) {
    List<String> fieldNames = schema.getFieldNames();
    if (fieldValues.size() != fieldNames.size()) {
      throw new ModelException.MalformedExpression(
          "TupleInstance.of",
          "tuple of schema '"
              + schema.getName()
              + "' needs "
              + fieldNames.size()
              + " values, got "
              + fieldValues.size());
    }
    TupleInstance instance = new TupleInstance(schema);
    for (int i = 0; i < fieldNames.size(); ++i) {
      instance.setValue(fieldNames.get(i), fieldValues.get(i));
    }
    return instance;
  }

  public TupleSchema getSchema() {
    return schema;
  }

  /** Name of the tuple set holding this instance, or null while unowned. */
  public String getOwner() {
    return owner;
  }

  void setOwner(String tupleSetName) {
    checkState(owner == null, "tuple already belongs to %s", owner);
    owner = tupleSetName;
  }

  /** Sets a field, coercing the value to the declared field type. */
  public void setValue(String field, ScalarValue value) {
    values.put(field, schema.getFieldType(field).coerce(value));
  }

  /**
   * Returns the value of a field. Fails with {@code NotFound} for a field the schema lacks and
   * with {@code MissingValue} for a declared field that was never set.
   */
  public ScalarValue getValue(String field) {
    if (!schema.hasField(field)) {
      throw new ModelException.NotFound("getValue", "Field", schema.getName() + "." + field);
    }
    ScalarValue value = values.get(field);
    if (value == null) {
      throw new ModelException.MissingValue("getValue", schema.getName() + "." + field);
    }
    return value;
  }

  /** Returns the value of a field, or null when it was never set. */
  public ScalarValue findValue(String field) {
    return values.get(field);
  }

  public ImmutableMap<String, ScalarValue> getValues() {
    return ImmutableMap.copyOf(values);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("<");
    String separator = "";
    for (String field : schema.getFieldNames()) {
      sb.append(separator);
      ScalarValue value = values.get(field);
      if (value == null) {
        sb.append('?');
      } else if (value.kind() == ScalarValue.Kind.STRING) {
        sb.append('"').append(value).append('"');
      } else {
        sb.append(value);
      }
      separator = ", ";
    }
    return sb.append('>').toString();
  }
}
