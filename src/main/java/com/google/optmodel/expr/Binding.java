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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.optmodel.model.ScalarValue;
import com.google.optmodel.model.TupleInstance;

/**
 * Value bound to an iterator: a scalar, or a tuple of a tuple set.
 *
 * <p>Every binding carries an integer index. It is the value itself for integer bindings, the
 * index value of the tuple for tuple bindings, and the 1-based position in the domain otherwise.
 */
public final class Binding {
  private final ScalarValue value;
  private final String tupleSetName;
  private final TupleInstance tuple;
  private final int index;

  private Binding(ScalarValue value, String tupleSetName, TupleInstance tuple, int index) {
    this.value = value;
    this.tupleSetName = tupleSetName;
    this.tuple = tuple;
    this.index = index;
  }

  public static Binding ofInt(int value) {
    return new Binding(ScalarValue.ofInt(value), null, null, value);
  }

  /** Binds a value found at the 1-based {@code position} of its domain. */
  public static Binding ofValue(ScalarValue value, int position) {
    checkNotNull(value);
    if (value.kind() == ScalarValue.Kind.INT) {
      return ofInt((int) value.asDouble());
    }
    return new Binding(value, null, null, position);
  }

  public static Binding ofTuple(String tupleSetName, int index, TupleInstance tuple) {
    return new Binding(null, checkNotNull(tupleSetName), checkNotNull(tuple), index);
  }

  public boolean isTuple() {
    return tuple != null;
  }

  public ScalarValue getValue() {
    checkState(!isTuple(), "tuple binding has no scalar value");
    return value;
  }

  public TupleInstance getTuple() {
    checkState(isTuple(), "scalar binding has no tuple");
    return tuple;
  }

  public String getTupleSetName() {
    checkState(isTuple(), "scalar binding has no tuple set");
    return tupleSetName;
  }

  public int getIndex() {
    return index;
  }

  @Override
  public String toString() {
    return isTuple() ? tupleSetName + "[" + index + "]=" + tuple : value.toString();
  }
}
