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

import com.google.optmodel.ModelException;
import java.util.Locale;

/** Declared type of a parameter, a set element, a tuple field or a decision variable. */
public enum ValueType {
  INT,
  FLOAT,
  STRING,
  BOOL,
  /** Only valid for parameters holding a whole tuple. */
  TUPLE;

  /** Parses a type keyword of the modelling language, or returns null if it is not one. */
  public static ValueType fromKeyword(String keyword) {
    switch (keyword.toLowerCase(Locale.ROOT)) {
      case "int":
      case "int+":
        return INT;
      case "float":
      case "float+":
      case "num":
        return FLOAT;
      case "string":
        return STRING;
      case "bool":
      case "boolean":
        return BOOL;
      default:
        return null;
    }
  }

  public boolean isNumeric() {
    return this == INT || this == FLOAT || this == BOOL;
  }

  /**
   * Converts a literal to this type. Integers widen to floats, integral floats narrow to integers
   * and anything renders as a string.
   */
  public ScalarValue coerce(ScalarValue value) {
    switch (this) {
      case INT:
        if (value.kind() == ScalarValue.Kind.INT) {
          return value;
        }
        if (value.kind() == ScalarValue.Kind.FLOAT
            && value.asDouble() == Math.rint(value.asDouble())) {
          return ScalarValue.ofInt((long) value.asDouble());
        }
        break;
      case FLOAT:
        if (value.kind() == ScalarValue.Kind.FLOAT) {
          return value;
        }
        if (value.kind() == ScalarValue.Kind.INT) {
          return ScalarValue.ofFloat(value.asDouble());
        }
        break;
      case STRING:
        return value.kind() == ScalarValue.Kind.STRING
            ? value
            : ScalarValue.ofString(value.toString());
      case BOOL:
        if (value.kind() == ScalarValue.Kind.BOOL) {
          return value;
        }
        if (value.kind() == ScalarValue.Kind.INT) {
          return ScalarValue.ofBool(value.asDouble() != 0);
        }
        break;
      case TUPLE:
        break;
    }
    throw new ModelException.TypeMismatch(
        "coerce", "cannot use " + value + " as a value of type " + name().toLowerCase(Locale.ROOT));
  }
}
