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
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** A named ordered set of distinct int, float or string values, such as {@code {string} Cities}. */
public final class PrimitiveSet {
  private final String name;
  private final ValueType elementType;
  private final boolean external;
  private final List<ScalarValue> elements = new ArrayList<>();

  public PrimitiveSet(String name, ValueType elementType, boolean external) {
    checkArgument(
        elementType == ValueType.INT
            || elementType == ValueType.FLOAT
            || elementType == ValueType.STRING,
        "unsupported element type %s for set %s",
        elementType,
        name);
    this.name = name;
    this.elementType = elementType;
    this.external = external;
  }

  public String getName() {
    return name;
  }

  public ValueType getElementType() {
    return elementType;
  }

  public boolean isExternal() {
    return external;
  }

  /** An external set has a value once data has been loaded into it. */
  public boolean hasValue() {
    return !external || !elements.isEmpty();
  }

  /** Adds a value, coerced to the element type. Returns false if it was already present. */
  public boolean add(ScalarValue value) {
    ScalarValue element = elementType.coerce(value);
    if (contains(element)) {
      return false;
    }
    elements.add(element);
    return true;
  }

  public boolean contains(ScalarValue value) {
    for (ScalarValue element : elements) {
      if (element.keyEquals(value)) {
        return true;
      }
    }
    return false;
  }

  public ImmutableList<ScalarValue> values() {
    return ImmutableList.copyOf(elements);
  }

  public int size() {
    return elements.size();
  }

  @Override
  public String toString() {
    return "{" + elementType.name().toLowerCase(Locale.ROOT) + "} " + name + " = " + elements;
  }
}
