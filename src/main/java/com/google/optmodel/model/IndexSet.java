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

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import com.google.optmodel.ModelException;

/** A named inclusive integer range {@code start..end}. */
public final class IndexSet {
  private final String name;
  private final int start;
  private final int end;

  public IndexSet(String name, int start, int end) {
    checkArgument(!name.isEmpty(), "empty index set name");
    this.name = name;
    this.start = start;
    this.end = end;
  }

  public String getName() {
    return name;
  }

  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  /** Number of values; 0 when {@code end < start}. */
  public int size() {
    return end < start ? 0 : end - start + 1;
  }

  public boolean contains(int value) {
    return value >= start && value <= end;
  }

  /** Values in ascending order. */
  public ImmutableList<Integer> values() {
    if (end < start) {
      return ImmutableList.of();
    }
    return ContiguousSet.create(Range.closed(start, end), DiscreteDomain.integers()).asList();
  }

  /** Returns the zero-based position of {@code value} within the range. */
  public int getPosition(int value) {
    if (!contains(value)) {
      throw new ModelException.OutOfRange(
          "getPosition", name, Integer.toString(value), start + ".." + end);
    }
    return value - start;
  }

  @Override
  public String toString() {
    return "range " + name + " = " + start + ".." + end;
  }
}
