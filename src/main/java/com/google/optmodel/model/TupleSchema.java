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

import com.google.common.collect.ImmutableList;
import com.google.optmodel.ModelException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A named record type. Fields are ordered; the key fields, in declaration order, form the
 * composite key used by {@code item()}. A schema without key fields is keyed by all its fields.
 */
public final class TupleSchema {
  private final String name;
  private final Map<String, ValueType> fields = new LinkedHashMap<>();
  private final List<String> keyFields = new ArrayList<>();

  public TupleSchema(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  /** Appends a field. */
  public TupleSchema addField(String fieldName, ValueType type, boolean isKey) {
    checkArgument(type != ValueType.TUPLE, "nested tuple field %s in %s", fieldName, name);
    if (fields.containsKey(fieldName)) {
      throw new ModelException.DuplicateDeclaration("addField", "Field", name + "." + fieldName);
    }
    fields.put(fieldName, type);
    if (isKey) {
      keyFields.add(fieldName);
    }
    return this;
  }

  public boolean hasField(String fieldName) {
    return fields.containsKey(fieldName);
  }

  /** Returns the type of a field, failing with {@code NotFound} if the schema lacks it. */
  public ValueType getFieldType(String fieldName) {
    ValueType type = fields.get(fieldName);
    if (type == null) {
      throw new ModelException.NotFound("getFieldType", "Field", name + "." + fieldName);
    }
    return type;
  }

  public ImmutableList<String> getFieldNames() {
    return ImmutableList.copyOf(fields.keySet());
  }

  public boolean hasDeclaredKeys() {
    return !keyFields.isEmpty();
  }

  /** Fields compared by a composite key, in key order. */
  public ImmutableList<String> getKeyFields() {
    return keyFields.isEmpty() ? getFieldNames() : ImmutableList.copyOf(keyFields);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("tuple ").append(name).append(" {");
    for (Map.Entry<String, ValueType> field : fields.entrySet()) {
      sb.append(' ');
      if (keyFields.contains(field.getKey())) {
        sb.append("key ");
      }
      sb.append(field.getValue().name().toLowerCase(Locale.ROOT))
          .append(' ')
          .append(field.getKey())
          .append(';');
    }
    return sb.append(" }").toString();
  }
}
