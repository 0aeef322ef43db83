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

import com.google.common.primitives.Ints;
import com.google.optmodel.ModelException;
import com.google.optmodel.ModelManager;
import com.google.optmodel.expr.IteratorTupleFieldAccessExpression;
import com.google.optmodel.expr.TupleFieldAccessExpression;
import com.google.optmodel.model.TupleSchema;
import com.google.optmodel.model.TupleSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces tuple field accesses on a declared tuple set. {@code set[3].field} becomes
 * {@code __TUPLE<N>__} and {@code set[p].field}, indexed by an iterator, becomes
 * {@code __TUPLE_ITER<N>__}.
 */
public final class TupleFieldAccessTokenizer extends RegexTokenizationStrategy {
  public static final int PRIORITY = 2;

  private static final Pattern TUPLE_ACCESS =
      Pattern.compile(
          NOT_AFTER_FIELD_DOT
              + "([A-Za-z]\\w*)\\s*\\[\\s*(\\w+)\\s*\\]\\s*\\.\\s*([A-Za-z]\\w*)");

  private static final Pattern DIGITS = Pattern.compile("\\d+");

  public TupleFieldAccessTokenizer() {
    super(TUPLE_ACCESS, PRIORITY);
  }

  @Override
  String replace(Matcher matcher, TokenManager tokens, ModelManager manager) {
    String setName = matcher.group(1);
    String index = matcher.group(2);
    String field = matcher.group(3);
    TupleSet tupleSet = manager.getTupleSet(setName);
    if (tupleSet == null) {
      return null;
    }
    TupleSchema schema = manager.getTupleSchema(tupleSet.getSchemaName());
    if (schema == null) {
      throw new ModelException.SchemaNotFound("tokenize", tupleSet.getSchemaName());
    }
    if (!schema.hasField(field)) {
      throw new ModelException.NotFound("tokenize", "Field", schema.getName() + "." + field);
    }
    if (Character.isDigit(index.charAt(0))) {
      // An identifier starting with a digit, such as 1a, is not ours to report.
      if (!DIGITS.matcher(index).matches()) {
        return null;
      }
      Integer value = Ints.tryParse(index);
      if (value == null) {
        throw new ModelException.OutOfRange("tokenize", setName, index, "of int");
      }
      checkIndex(manager, setName, setName, value);
      return tokens.register(
          TokenManager.Kind.TUPLE, new TupleFieldAccessExpression(setName, value, field));
    }
    return tokens.register(
        TokenManager.Kind.TUPLE_ITER,
        new IteratorTupleFieldAccessExpression(setName, index, field));
  }
}
