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

import com.google.common.collect.ImmutableMap;
import com.google.optmodel.ModelManager;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Iterator bindings layered over a {@link ModelManager}.
 *
 * <p>Frames are pushed and popped around each binding; lookups search the innermost frame first.
 * The manager itself is never modified. A context is owned by one expansion call and is not
 * thread-safe.
 */
public final class EvaluationContext {
  private final ModelManager manager;
  // Absent values mask outer bindings of the same name.
  private final Deque<Map<String, Optional<Binding>>> frames = new ArrayDeque<>();

  private EvaluationContext(ModelManager manager) {
    this.manager = checkNotNull(manager);
  }

  public static EvaluationContext of(ModelManager manager) {
    return new EvaluationContext(manager);
  }

  public ModelManager getManager() {
    return manager;
  }

  /** Pushes a frame binding {@code name}. Must be matched by {@link #pop}. */
  public void push(String name, Binding binding) {
    Map<String, Optional<Binding>> frame = new HashMap<>();
    frame.put(name, Optional.of(binding));
    frames.push(frame);
  }

  /** Pushes a frame in which {@code names} are unbound. Must be matched by {@link #pop}. */
  public void mask(Collection<String> names) {
    Map<String, Optional<Binding>> frame = new HashMap<>();
    for (String name : names) {
      frame.put(name, Optional.empty());
    }
    frames.push(frame);
  }

  public void pop() {
    checkState(!frames.isEmpty(), "no frame to pop");
    frames.pop();
  }

  /** Returns the innermost binding of {@code name}. */
  public Optional<Binding> lookup(String name) {
    for (Map<String, Optional<Binding>> frame : frames) {
      Optional<Binding> binding = frame.get(name);
      if (binding != null) {
        return binding;
      }
    }
    return Optional.empty();
  }

  public boolean isBound(String name) {
    return lookup(name).isPresent();
  }

  public int depth() {
    return frames.size();
  }

  /** Visible bindings, outermost first. */
  public ImmutableMap<String, Binding> bindings() {
    Map<String, Binding> visible = new LinkedHashMap<>();
    for (Iterator<Map<String, Optional<Binding>>> it = frames.descendingIterator();
        it.hasNext(); ) {
      for (Map.Entry<String, Optional<Binding>> entry : it.next().entrySet()) {
        visible.remove(entry.getKey());
        entry.getValue().ifPresent(binding -> visible.put(entry.getKey(), binding));
      }
    }
    return ImmutableMap.copyOf(visible);
  }

  @Override
  public String toString() {
    return bindings().toString();
  }
}
