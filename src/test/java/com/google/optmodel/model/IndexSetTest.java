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

package com.google.optmodel.model;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.optmodel.ModelException;
import com.google.optmodel.ModelManager;
import org.junit.jupiter.api.Test;

public final class IndexSetTest {
  @Test
  public void testValues() {
    final IndexSet set = new IndexSet("I", 1, 5);
    assertEquals(5, set.size());
    assertThat(set.values()).containsExactly(1, 2, 3, 4, 5).inOrder();
    assertEquals(2, set.getPosition(3));
  }

  @Test
  public void testEmptyRange() {
    final IndexSet set = new IndexSet("E", 3, 2);
    assertEquals(0, set.size());
    assertThat(set.values()).isEmpty();
  }

  @Test
  public void testBoundariesAreRejected() {
    final IndexSet set = new IndexSet("I", 1, 5);
    assertThat(set.contains(0)).isFalse();
    assertThat(set.contains(6)).isFalse();
    assertThrows(ModelException.OutOfRange.class, () -> set.getPosition(0));
    final ModelException e =
        assertThrows(ModelException.OutOfRange.class, () -> set.getPosition(6));
    assertThat(e).hasMessageThat().contains("out of range");
  }

  @Test
  public void testManagerChecksIndexAgainstSet() {
    final ModelManager manager = new ModelManager();
    manager.addIndexSet(new IndexSet("I", 1, 5));
    manager.checkIndex("x", "I", 1);
    manager.checkIndex("x", "I", 5);
    assertThrows(ModelException.OutOfRange.class, () -> manager.checkIndex("x", "I", 0));
    assertThrows(ModelException.OutOfRange.class, () -> manager.checkIndex("x", "I", 6));
    assertThrows(ModelException.NotFound.class, () -> manager.checkIndex("x", "J", 1));
  }
}
