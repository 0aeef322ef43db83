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
import com.google.optmodel.model.PrimitiveSet;
import com.google.optmodel.model.ScalarValue;
import com.google.optmodel.model.TupleSet;

/** Enumerates the values an iterator takes, in declaration order. */
public final class DomainResolver {
  private DomainResolver() {}

  /**
   * Returns the bindings of {@code spec}: the values of a range, of a declared index set or
   * primitive set, or the tuples of a tuple set.
   */
  public static ImmutableList<Binding> resolve(IteratorSpec spec, EvaluationContext context) {
    if (spec.setName().isPresent()) {
      return resolveSet(spec.setName().get(), context.getManager());
    }
    int lower = spec.lower().get().evaluateIndex(context);
    int upper = spec.upper().get().evaluateIndex(context);
    ImmutableList.Builder<Binding> bindings = ImmutableList.builder();
    for (int value = lower; value <= upper; ++value) {
      bindings.add(Binding.ofInt(value));
    }
    return bindings.build();
  }

  /** Returns the bindings of a declared set, failing with {@code NotFound} if there is none. */
  public static ImmutableList<Binding> resolveSet(String setName, ModelManager manager) {
    ImmutableList.Builder<Binding> bindings = ImmutableList.builder();
    IndexSet indexSet = manager.getIndexSet(setName);
    if (indexSet != null) {
      for (int value : indexSet.values()) {
        bindings.add(Binding.ofInt(value));
      }
      return bindings.build();
    }
    PrimitiveSet primitiveSet = manager.getPrimitiveSet(setName);
    if (primitiveSet != null) {
      if (!primitiveSet.hasValue()) {
        throw new ModelException.MissingValue("resolveSet", setName);
      }
      int position = 1;
      for (ScalarValue value : primitiveSet.values()) {
        bindings.add(Binding.ofValue(value, position++));
      }
      return bindings.build();
    }
    TupleSet tupleSet = manager.getTupleSet(setName);
    if (tupleSet != null) {
      if (!tupleSet.hasValue()) {
        throw new ModelException.MissingValue("resolveSet", setName);
      }
      int first = 1;
      if (tupleSet.getIndexSetName() != null) {
        IndexSet backing = manager.getIndexSet(tupleSet.getIndexSetName());
        if (backing == null) {
          throw new ModelException.NotFound("resolveSet", "Index set", tupleSet.getIndexSetName());
        }
        first = backing.getStart();
      }
      for (int position = 0; position < tupleSet.size(); ++position) {
        bindings.add(Binding.ofTuple(setName, first + position, tupleSet.get(position)));
      }
      return bindings.build();
    }
    throw new ModelException.NotFound("resolveSet", "Set", setName);
  }
}
