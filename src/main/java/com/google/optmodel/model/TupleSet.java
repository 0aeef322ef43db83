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

/**
 * An ordered collection of tuples of one schema. When a backing index set is given, the tuple
 * for index value {@code v} is the one at position {@code v - start}; otherwise positions are
 * 1-based.
 */
public final class TupleSet {
  private final String name;
  private final String schemaName;
  private final String indexSetName;
  private final boolean external;
  private final List<TupleInstance> instances = new ArrayList<>();

  public TupleSet(String name, String schemaName, String indexSetName, boolean external) {
    this.name = name;
    this.schemaName = schemaName;
    this.indexSetName = indexSetName;
    this.external = external;
  }

  public TupleSet(String name, String schemaName, boolean external) {
    this(name, schemaName, null, external);
  }

  public String getName() {
    return name;
  }

  public String getSchemaName() {
    return schemaName;
  }

  /** Name of the backing index set, or null. */
  public String getIndexSetName() {
    return indexSetName;
  }

  public boolean isExternal() {
    return external;
  }

  public boolean hasValue() {
    return !external || !instances.isEmpty();
  }

  /** Appends an instance; each instance belongs to exactly one tuple set. */
  public void addInstance(TupleInstance instance) {
    checkArgument(
        instance.getSchema().getName().equals(schemaName),
        "tuple of schema %s added to set %s of schema %s",
        instance.getSchema().getName(),
        name,
        schemaName);
    instance.setOwner(name);
    instances.add(instance);
  }

  public int size() {
    return instances.size();
  }

  /** Returns the instance at a zero-based position. */
  public TupleInstance get(int position) {
    return instances.get(position);
  }

  public ImmutableList<TupleInstance> getInstances() {
    return ImmutableList.copyOf(instances);
  }

  @Override
  public String toString() {
    return "{" + schemaName + "} " + name + " (" + instances.size() + " tuples)";
  }
}
