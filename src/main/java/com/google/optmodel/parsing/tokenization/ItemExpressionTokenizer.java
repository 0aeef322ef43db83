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
import com.google.optmodel.ModelManager;
import com.google.optmodel.expr.Expression;
import com.google.optmodel.expr.ItemFieldAccessExpression;
import com.google.optmodel.expr.ItemFunctionExpression;
import com.google.optmodel.model.TupleSchema;
import com.google.optmodel.model.TupleSet;
import com.google.optmodel.parsing.ExpressionParser;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code item(set, key)} and {@code item(set, key).field} by {@code __ITEM<N>__}.
 *
 * <p>Runs first: the angle brackets and parentheses of an item call would otherwise be taken apart
 * by the index tokenizers. The key is either a composite key {@code <a, b>} or a single
 * expression without parentheses.
 */
public final class ItemExpressionTokenizer extends RegexTokenizationStrategy {
  public static final int PRIORITY = 1;

  private static final Pattern ITEM =
      Pattern.compile(
          "\\bitem\\s*\\(\\s*([A-Za-z]\\w*)\\s*,\\s*(<[^>]*>|[^()<>]+?)\\s*\\)"
              + "(?:\\s*\\.\\s*([A-Za-z]\\w*))?");

  public ItemExpressionTokenizer() {
    super(ITEM, PRIORITY);
  }

  @Override
  String replace(Matcher matcher, TokenManager tokens, ModelManager manager) {
    String setName = matcher.group(1);
    String keyText = matcher.group(2).trim();
    String field = matcher.group(3);
    TupleSet tupleSet = manager.getTupleSet(setName);
    if (tupleSet == null) {
      throw new ModelException.TupleSetNotFound("tokenize", setName);
    }
    TupleSchema schema = manager.getTupleSchema(tupleSet.getSchemaName());
    if (schema == null) {
      throw new ModelException.SchemaNotFound("tokenize", tupleSet.getSchemaName());
    }
    Expression key = ExpressionParser.lenient(manager, tokens).parse(keyText);
    if (schema.hasDeclaredKeys() && keyText.startsWith("<")) {
      int parts = key.keyParts().size();
      if (parts != schema.getKeyFields().size()) {
        throw new ModelException.KeyArityMismatch(
            "tokenize", setName, parts, schema.getKeyFields());
      }
    }
    ItemFunctionExpression item = new ItemFunctionExpression(setName, key);
    if (field == null) {
      return tokens.register(TokenManager.Kind.ITEM, item);
    }
    if (!schema.hasField(field)) {
      throw new ModelException.NotFound("tokenize", "Field", schema.getName() + "." + field);
    }
    return tokens.register(TokenManager.Kind.ITEM, new ItemFieldAccessExpression(item, field));
  }
}
