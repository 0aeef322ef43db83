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
import com.google.optmodel.model.IndexSet;
import com.google.optmodel.model.PrimitiveSet;
import com.google.optmodel.model.TupleSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Base class for strategies made of a single regular expression pass. */
abstract class RegexTokenizationStrategy implements TokenizationStrategy {
  /**
   * Matches when the identifier that follows is not a field name, as in {@code t.name}. A range
   * such as {@code 1..n} is not a field access.
   */
  static final String NOT_AFTER_FIELD_DOT = "(?<!\\w)(?<![^.]\\.)";

  private final Pattern pattern;
  private final int priority;

  RegexTokenizationStrategy(Pattern pattern, int priority) {
    this.pattern = pattern;
    this.priority = priority;
  }

  /**
   * Returns the text replacing the current match of {@code matcher}, or null to leave it
   * untouched.
   */
  abstract String replace(Matcher matcher, TokenManager tokens, ModelManager manager);

  @Override
  public final String tokenize(String text, TokenManager tokens, ModelManager manager) {
    Matcher matcher = pattern.matcher(text);
    StringBuffer sb = new StringBuffer();
    while (matcher.find()) {
      String replacement = replace(matcher, tokens, manager);
      matcher.appendReplacement(
          sb, Matcher.quoteReplacement(replacement != null ? replacement : matcher.group()));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  @Override
  public final int priority() {
    return priority;
  }

  @Override
  public String name() {
    return getClass().getSimpleName();
  }

  /**
   * Checks a literal index of {@code symbol} against the set indexing it. Sets still waiting for
   * their external data are checked at evaluation time instead.
   */
  static void checkIndex(ModelManager manager, String symbol, String setName, int value) {
    PrimitiveSet primitiveSet = manager.getPrimitiveSet(setName);
    if (primitiveSet != null && !primitiveSet.hasValue()) {
      return;
    }
    TupleSet tupleSet = manager.getTupleSet(setName);
    if (tupleSet != null && !tupleSet.hasValue()) {
      return;
    }
    IndexSet indexSet = manager.getIndexSet(setName);
    if (indexSet == null && primitiveSet == null && tupleSet == null) {
      return;
    }
    manager.checkIndex(symbol, setName, value);
  }
}
