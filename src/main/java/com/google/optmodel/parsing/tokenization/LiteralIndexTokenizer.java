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
import com.google.common.primitives.Ints;
import com.google.optmodel.ModelException;
import com.google.optmodel.ModelManager;
import com.google.optmodel.expr.ConstantExpression;
import com.google.optmodel.expr.Expression;
import com.google.optmodel.expr.IndexedParameterExpression;
import com.google.optmodel.model.IndexedVariable;
import com.google.optmodel.model.Parameter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces a parameter or variable indexed by integer literals. Parameters become
 * {@code __PARAM<N>__}; variables are flattened into their expanded name, such as {@code x1_2}.
 * Other names are left to the parser.
 */
abstract class LiteralIndexTokenizer extends RegexTokenizationStrategy {
  LiteralIndexTokenizer(Pattern pattern, int priority) {
    super(pattern, priority);
  }

  /** The literal index values of the current match, outer first. */
  abstract ImmutableList<Integer> indices(Matcher matcher);

  @Override
  final String replace(Matcher matcher, TokenManager tokens, ModelManager manager) {
    String name = matcher.group(1);
    ImmutableList<Integer> indices = indices(matcher);
    Parameter parameter = manager.getParameter(name);
    if (parameter != null && !parameter.isTuple()) {
      checkIndices(manager, name, parameter.getIndexSetNames(), indices);
      List<Expression> constants = new ArrayList<>();
      for (int index : indices) {
        constants.add(new ConstantExpression(index));
      }
      return tokens.register(
          TokenManager.Kind.PARAM, new IndexedParameterExpression(name, constants));
    }
    IndexedVariable variable = manager.getVariable(name);
    if (variable != null) {
      checkIndices(manager, name, variable.getIndexSetNames(), indices);
      String flattened = variable.flattenedName(indices);
      tokens.registerFlattenedVariable(flattened);
      return flattened;
    }
    return null;
  }

  /** Parses the digits of a literal index; values past the int range are out of range. */
  static int parseIndex(Matcher matcher, int group) {
    Integer value = Ints.tryParse(matcher.group(group));
    if (value == null) {
      throw new ModelException.OutOfRange(
          "tokenize", matcher.group(1), matcher.group(group), "of int");
    }
    return value;
  }

  private static void checkIndices(
      ModelManager manager, String name, List<String> setNames, List<Integer> indices) {
    if (setNames.size() != indices.size()) {
      throw new ModelException.MalformedExpression(
          "tokenize",
          "'" + name + "' has " + setNames.size() + " index(es), got " + indices.size());
    }
    for (int i = 0; i < indices.size(); i++) {
      checkIndex(manager, name, setNames.get(i), indices.get(i));
    }
  }
}
