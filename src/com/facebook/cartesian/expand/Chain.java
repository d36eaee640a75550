/*
 * Copyright (c) Facebook, Inc. and its affiliates.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.facebook.cartesian.expand;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Persistent singly linked list. Prepending shares the tail, so every branch of the expansion can
 * extend what its parent accumulated without copying it and without seeing its siblings' additions.
 */
final class Chain<T> {
  private static final Chain<Object> EMPTY = new Chain<>(null, null, 0);

  @Nullable private final T head;
  @Nullable private final Chain<T> tail;
  private final int size;

  private Chain(@Nullable T head, @Nullable Chain<T> tail, int size) {
    this.head = head;
    this.tail = tail;
    this.size = size;
  }

  @SuppressWarnings("unchecked")
  static <T> Chain<T> empty() {
    return (Chain<T>) EMPTY;
  }

  Chain<T> prepend(T value) {
    return new Chain<>(Preconditions.checkNotNull(value), this, size + 1);
  }

  boolean isEmpty() {
    return size == 0;
  }

  int size() {
    return size;
  }

  T head() {
    Preconditions.checkState(!isEmpty(), "empty chain has no head");
    return head;
  }

  Chain<T> tail() {
    Preconditions.checkState(!isEmpty(), "empty chain has no tail");
    return tail;
  }

  /** @return the elements oldest first, i.e. in the order they were prepended. */
  ImmutableList<T> toInsertionOrder() {
    ImmutableList.Builder<T> reversed = ImmutableList.builderWithExpectedSize(size);
    for (Chain<T> current = this; !current.isEmpty(); current = current.tail) {
      reversed.add(current.head);
    }
    return reversed.build().reverse();
  }
}
