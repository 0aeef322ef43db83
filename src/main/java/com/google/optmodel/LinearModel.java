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

package com.google.optmodel;

import com.google.common.collect.ImmutableList;
import com.google.optmodel.model.IndexedVariable;
import com.google.optmodel.model.LinearEquation;
import com.google.optmodel.model.Objective;

/**
 * The flattened model handed to an exporter. Coefficients stay expressions; evaluate them against
 * {@link #getManager()} to read the current data.
 */
public final class LinearModel {
  private final ModelManager manager;
  private final ImmutableList<LinearEquation> equations;
  private final Objective objective;
  private final ImmutableList<IndexedVariable> variables;

  LinearModel(ModelManager manager) {
    this.manager = manager;
    this.equations = manager.getEquations();
    this.objective = manager.getObjective();
    this.variables = manager.getVariables();
  }

  public ModelManager getManager() {
    return manager;
  }

  public ImmutableList<LinearEquation> getEquations() {
    return equations;
  }

  public Objective getObjective() {
    return objective;
  }

  public ImmutableList<IndexedVariable> getVariables() {
    return variables;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder().append(objective).append('\n');
    for (LinearEquation equation : equations) {
      sb.append(equation).append('\n');
    }
    return sb.toString();
  }
}
