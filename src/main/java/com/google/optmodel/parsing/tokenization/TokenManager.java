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

import com.google.optmodel.ModelException;
import com.google.optmodel.expr.Expression;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Registry of the placeholders written by the tokenization strategies.
 *
 * <p>Each placeholder has the form {@code __KIND<N>__}, for instance {@code __ITEM0__} or
 * {@code __TUPLE_ITER3__}. The counter is shared by all kinds, starts at zero and only goes back to
 * zero on {@link #clear()}, so placeholders stay unique within a session.
 */
public final class TokenManager {
  /** Kind of construct a placeholder stands for. */
  public enum Kind {
    ITEM,
    TUPLE,
    TUPLE_ITER,
    PARAM
  }

  private static final Pattern PLACEHOLDER =
      Pattern.compile("__(?:ITEM|TUPLE_ITER|TUPLE|PARAM)\\d+__");

  private final Map<String, Expression> expressions = new LinkedHashMap<>();
  private final Set<String> flattenedVariables = new HashSet<>();
  private int counter;

  /** Registers {@code expression} and returns the placeholder standing for it. */
  public String register(Kind kind, Expression expression) {
    String placeholder = "__" + kind.name() + counter++ + "__";
    expressions.put(placeholder, expression);
    return placeholder;
  }

  /** Returns the expression registered for {@code placeholder}. */
  public Expression get(String placeholder) {
    Expression expression = expressions.get(placeholder);
    if (expression == null) {
      throw new ModelException.NotFound("token", "Placeholder", placeholder);
    }
    return expression;
  }

  public boolean contains(String placeholder) {
    return expressions.containsKey(placeholder);
  }

  /** Records a variable name produced by flattening {@code x[1]} into {@code x1}. */
  public void registerFlattenedVariable(String name) {
    flattenedVariables.add(name);
  }

  public boolean isFlattenedVariable(String name) {
    return flattenedVariables.contains(name);
  }

  public int size() {
    return expressions.size();
  }

  public void clear() {
    expressions.clear();
    flattenedVariables.clear();
    counter = 0;
  }

  public static boolean isPlaceholder(String text) {
    return PLACEHOLDER.matcher(text).matches();
  }
}
