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
import java.util.List;
import java.util.Locale;

/**
 * A decision variable declaration, scalar or indexed by one or two sets. Expansion flattens
 * {@code x[3]} to {@code x3} and {@code x[1,2]} to {@code x1_2}.
 */
public final class IndexedVariable {
  private final String baseName;
  private final ValueType type;
  private final ImmutableList<String> indexSetNames;
  private final Double lowerBound;
  private final Double upperBound;

  /**
   * Creates a variable declaration.
   *
   * @param baseName the declared name
   * @param type one of {@code FLOAT}, {@code INT} or {@code BOOL}
   * @param indexSetNames zero to two index set names
   * @param lowerBound lower bound, or null when unbounded
   * @param upperBound upper bound, or null when unbounded
   */
  public IndexedVariable(
      String baseName,
      ValueType type,
      List<String> indexSetNames,
      Double lowerBound,
      Double upperBound) {
    checkArgument(
        type == ValueType.FLOAT || type == ValueType.INT || type == ValueType.BOOL,
        "invalid variable type %s for %s",
        type,
        baseName);
    checkArgument(indexSetNames.size() <= 2, "variable %s has more than two dimensions", baseName);
    this.baseName = baseName;
    this.type = type;
    this.indexSetNames = ImmutableList.copyOf(indexSetNames);
    if (type == ValueType.BOOL) {
      this.lowerBound = lowerBound == null ? 0.0 : lowerBound;
      this.upperBound = upperBound == null ? 1.0 : upperBound;
    } else {
      this.lowerBound = lowerBound;
      this.upperBound = upperBound;
    }
  }

  public String getBaseName() {
    return baseName;
  }

  public ValueType getType() {
    return type;
  }

  public boolean isIntegral() {
    return type != ValueType.FLOAT;
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

  /** Lower bound, or null when unbounded. */
  public Double getLowerBound() {
    return lowerBound;
  }

  /** Upper bound, or null when unbounded. */
  public Double getUpperBound() {
    return upperBound;
  }

  /** Name of one scalar variable of this declaration, such as {@code x1_2}. */
  public String flattenedName(List<Integer> indices) {
    checkArgument(
        indices.size() == indexSetNames.size(),
        "variable %s has %s index(es), got %s",
        baseName,
        indexSetNames.size(),
        indices.size());
    return flattenedName(baseName, indices);
  }

  /** Joins a base name and index values the way expanded variables are named. */
  public static String flattenedName(String baseName, List<Integer> indices) {
    StringBuilder sb = new StringBuilder(baseName);
    String separator = "";
    for (int index : indices) {
      sb.append(separator).append(index);
      separator = "_";
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    StringBuilder sb =
        new StringBuilder("dvar ")
            .append(type.name().toLowerCase(Locale.ROOT))
            .append(' ')
            .append(baseName);
    if (!isScalar()) {
      sb.append('[').append(String.join(",", indexSetNames)).append(']');
    }
    if (lowerBound != null || upperBound != null) {
      sb.append(" in ")
          .append(lowerBound == null ? "-infinity" : lowerBound)
          .append("..")
          .append(upperBound == null ? "infinity" : upperBound);
    }
    return sb.toString();
  }
}
