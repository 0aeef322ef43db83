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

import com.google.common.primitives.Doubles;
import com.google.common.primitives.Longs;
import com.google.optmodel.ModelException;
import java.util.Objects;

/**
 * A single data value: an integer, a float, a string or a boolean.
 *
 * <p>Values arrive with whatever type their source syntax gave them, so key comparison goes through
 * {@link #keyEquals}, which also accepts {@code 1}, {@code "1"} and {@code 1.0} as the same key.
 */
public final class ScalarValue {
  /** Tolerance used by numeric key comparison. */
  public static final double KEY_TOLERANCE = 1e-10;

  /** The variant held by a value. */
  public enum Kind {
    INT,
    FLOAT,
    STRING,
    BOOL
  }

  private final Kind kind;
  private final double number;
  private final String text;

  private ScalarValue(Kind kind, double number, String text) {
    this.kind = kind;
    this.number = number;
    this.text = text;
  }

  public static ScalarValue ofInt(long value) {
    return new ScalarValue(Kind.INT, value, null);
  }

  public static ScalarValue ofFloat(double value) {
    return new ScalarValue(Kind.FLOAT, value, null);
  }

  public static ScalarValue ofString(String value) {
    return new ScalarValue(Kind.STRING, 0.0, checkNotNull(value));
  }

  public static ScalarValue ofBool(boolean value) {
    return new ScalarValue(Kind.BOOL, value ? 1.0 : 0.0, null);
  }

  /** Returns an integer value when {@code value} is integral, a float value otherwise. */
  public static ScalarValue ofNumber(double value) {
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return ofInt((long) value);
    }
    return ofFloat(value);
  }

  /**
   * Parses a literal as written in a model: a quoted string, {@code true}/{@code false}, an integer
   * or a float. Any other text is taken as an unquoted string.
   */
  public static ScalarValue parseLiteral(String literal) {
    String s = literal.trim();
    if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
      return ofString(s.substring(1, s.length() - 1));
    }
    if (s.equals("true") || s.equals("false")) {
      return ofBool(Boolean.parseBoolean(s));
    }
    Long asLong = Longs.tryParse(s);
    if (asLong != null) {
      return ofInt(asLong);
    }
    Double asDouble = Doubles.tryParse(s);
    if (asDouble != null) {
      return ofFloat(asDouble);
    }
    return ofString(s);
  }

  public Kind kind() {
    return kind;
  }

  public boolean isNumeric() {
    return kind != Kind.STRING;
  }

  /** Numeric view of this value; booleans read as 1 and 0. */
  public double asDouble() {
    if (kind == Kind.STRING) {
      throw new ModelException.TypeMismatch(
          "asDouble", "string value \"" + text + "\" is not numeric");
    }
    return number;
  }

  /** Integer view of this value, used for indices. */
  public int asIndex() {
    double value = asDouble();
    if (value != Math.rint(value)) {
      throw new ModelException.TypeMismatch("asIndex", "index " + this + " is not an integer");
    }
    return (int) value;
  }

  public String asString() {
    return toString();
  }

  /**
   * Compares two key values: by value first, then by case-insensitive comparison of their
   * renderings, then numerically within {@link #KEY_TOLERANCE} when both sides read as numbers.
   */
  public boolean keyEquals(ScalarValue other) {
    if (equals(other)) {
      return true;
    }
    if (toString().equalsIgnoreCase(other.toString())) {
      return true;
    }
    Double left = numericKey();
    Double right = other.numericKey();
    return left != null && right != null && Math.abs(left - right) < KEY_TOLERANCE;
  }

  private Double numericKey() {
    switch (kind) {
      case INT:
      case FLOAT:
        return number;
      case STRING:
        return Doubles.tryParse(text.trim());
      case BOOL:
        return null;
    }
    return null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ScalarValue)) {
      return false;
    }
    ScalarValue that = (ScalarValue) o;
    return kind == that.kind
        && Double.compare(number, that.number) == 0
        && Objects.equals(text, that.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, number, text);
  }

  @Override
  public String toString() {
    switch (kind) {
      case INT:
        return Long.toString((long) number);
      case FLOAT:
        return Double.toString(number);
      case STRING:
        return text;
      case BOOL:
        return number != 0 ? "true" : "false";
    }
    return "";
  }
}
