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

import com.google.auto.value.AutoValue;
import java.util.Optional;

/** An iterator and its domain: {@code i in I} or {@code i in lo..hi}. */
@AutoValue
public abstract class IteratorSpec {
  public abstract String variable();

  /** Declared index set, primitive set or tuple set iterated over. */
  public abstract Optional<String> setName();

  public abstract Optional<Expression> lower();

  public abstract Optional<Expression> upper();

  public static IteratorSpec overSet(String variable, String setName) {
    return new AutoValue_IteratorSpec(
        variable, Optional.of(setName), Optional.empty(), Optional.empty());
  }

  public static IteratorSpec overRange(String variable, Expression lower, Expression upper) {
    return new AutoValue_IteratorSpec(
        variable, Optional.empty(), Optional.of(lower), Optional.of(upper));
  }

  /** Substitutes the bindings of {@code context} in the range bounds. */
  public IteratorSpec substitute(EvaluationContext context) {
    if (setName().isPresent()) {
      return this;
    }
    return overRange(
        variable(), lower().get().substitute(context), upper().get().substitute(context));
  }

  @Override
  public final String toString() {
    if (setName().isPresent()) {
      return variable() + " in " + setName().get();
    }
    return variable() + " in " + lower().get() + ".." + upper().get();
  }
}
