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
import com.google.optmodel.expr.ParameterExpression;
import com.google.optmodel.model.Parameter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces bare identifiers naming a declared scalar parameter by {@code __PARAM<N>__}.
 * Identifiers followed by an index, a call or a field access are skipped, and so are string
 * literals.
 */
public final class ScalarParameterTokenizer extends RegexTokenizationStrategy {
  public static final int PRIORITY = 5;

  private static final Pattern SCALAR =
      Pattern.compile(
          "(\"[^\"]*\")|"
              + NOT_AFTER_FIELD_DOT
              + "([A-Za-z]\\w*)\\b(?!\\s*(?:[\\[(]|\\.(?!\\.)))");

  public ScalarParameterTokenizer() {
    super(SCALAR, PRIORITY);
  }

  @Override
  String replace(Matcher matcher, TokenManager tokens, ModelManager manager) {
    if (matcher.group(1) != null) {
      return null;
    }
    String name = matcher.group(2);
    Parameter parameter = manager.getParameter(name);
    if (parameter == null || !parameter.isScalar() || parameter.isTuple()) {
      return null;
    }
    return tokens.register(TokenManager.Kind.PARAM, new ParameterExpression(name));
  }
}
