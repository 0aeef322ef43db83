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

import com.google.optmodel.ModelManager;

/**
 * One rewriting pass of the tokenization pipeline. A strategy replaces the constructs it
 * recognizes by placeholders registered in a {@link TokenManager}.
 */
public interface TokenizationStrategy {
  /**
   * Rewrites {@code text}, replacing every validated match by a placeholder.
   *
   * @throws com.google.optmodel.ModelException.Structural if a match is recognizably invalid
   */
  String tokenize(String text, TokenManager tokens, ModelManager manager);

  /** Strategies run in ascending priority. */
  int priority();

  /** Name used in log messages. */
  String name();
}
