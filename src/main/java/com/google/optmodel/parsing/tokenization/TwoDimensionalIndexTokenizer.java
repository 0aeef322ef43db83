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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Replaces {@code name[i,j]} with integer literals {@code i} and {@code j}. */
public final class TwoDimensionalIndexTokenizer extends LiteralIndexTokenizer {
  public static final int PRIORITY = 3;

  private static final Pattern INDEX_2D =
      Pattern.compile(
          NOT_AFTER_FIELD_DOT + "([A-Za-z]\\w*)\\s*\\[\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\]");

  public TwoDimensionalIndexTokenizer() {
    super(INDEX_2D, PRIORITY);
  }

  @Override
  ImmutableList<Integer> indices(Matcher matcher) {
    return ImmutableList.of(parseIndex(matcher, 2), parseIndex(matcher, 3));
  }
}
