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

package com.google.optmodel.parsing.tokenization;

import com.google.common.collect.ImmutableList;
import com.google.optmodel.ModelManager;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs tokenization strategies in ascending priority, feeding the output of each into the next.
 */
public final class TokenizationOrchestrator {
  private static final Logger logger = Logger.getLogger(TokenizationOrchestrator.class.getName());

  private final ImmutableList<TokenizationStrategy> strategies;

  public TokenizationOrchestrator(List<TokenizationStrategy> strategies) {
    this.strategies =
        ImmutableList.sortedCopyOf(
            Comparator.comparingInt(TokenizationStrategy::priority), strategies);
  }

  /** Returns an orchestrator running the five standard strategies. */
  public static TokenizationOrchestrator createDefault() {
    return new TokenizationOrchestrator(
        ImmutableList.of(
            new ItemExpressionTokenizer(),
            new TupleFieldAccessTokenizer(),
            new TwoDimensionalIndexTokenizer(),
            new SingleDimensionalIndexTokenizer(),
            new ScalarParameterTokenizer()));
  }

  public ImmutableList<TokenizationStrategy> getStrategies() {
    return strategies;
  }

  public String tokenize(String text, TokenManager tokens, ModelManager manager) {
    String current = text;
    for (TokenizationStrategy strategy : strategies) {
      String next = strategy.tokenize(current, tokens, manager);
      if (logger.isLoggable(Level.FINEST) && !next.equals(current)) {
        logger.finest(strategy.name() + ": " + current + " -> " + next);
      }
      current = next;
    }
    return current;
  }
}
