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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a parse session: errors and warnings tagged with their line number, and the number of
 * statements processed successfully.
 */
public final class ParseSessionResult {
  /** One message attached to a line. */
  @AutoValue
  public abstract static class Entry {
    public abstract int lineNumber();

    public abstract String message();

    public static Entry create(int lineNumber, String message) {
      return new AutoValue_ParseSessionResult_Entry(lineNumber, message);
    }

    @Override
    public final String toString() {
      return "Line " + lineNumber() + ": " + message();
    }
  }

  private final List<Entry> errors = new ArrayList<>();
  private final List<Entry> warnings = new ArrayList<>();
  private int successCount;

  public void addError(int lineNumber, String message) {
    errors.add(Entry.create(lineNumber, message));
  }

  public void addWarning(int lineNumber, String message) {
    warnings.add(Entry.create(lineNumber, message));
  }

  public void incrementSuccess() {
    successCount++;
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public ImmutableList<Entry> getErrors() {
    return ImmutableList.copyOf(errors);
  }

  public ImmutableList<Entry> getWarnings() {
    return ImmutableList.copyOf(warnings);
  }

  public int getSuccessCount() {
    return successCount;
  }

  void clear() {
    errors.clear();
    warnings.clear();
    successCount = 0;
  }

  /** Errors rendered as {@code Line N: message}. */
  public ImmutableList<String> getErrorMessages() {
    ImmutableList.Builder<String> messages = ImmutableList.builder();
    for (Entry entry : errors) {
      messages.add(entry.toString());
    }
    return messages.build();
  }

  @Override
  public String toString() {
    return successCount
        + " statement(s) processed, "
        + errors.size()
        + " error(s), "
        + warnings.size()
        + " warning(s)";
  }
}
