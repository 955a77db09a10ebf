/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.internal.collect;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Insertion-ordered collection that never holds more than {@code capacity} entries. Adding to a
 * full buffer evicts the oldest entry and counts it as dropped.
 *
 * <p>Not thread-safe: callers guard access with the lock of the trace that owns the span.
 */
public final class RingBuffer<E> {
  final int capacity;
  final ArrayDeque<E> entries;
  int dropped;

  public RingBuffer(int capacity) {
    if (capacity < 0) throw new IllegalArgumentException("capacity < 0");
    this.capacity = capacity;
    this.entries = new ArrayDeque<>(Math.min(capacity, 16));
  }

  public void add(E entry) {
    if (entry == null) throw new NullPointerException("entry == null");
    if (capacity == 0) { // nothing can be retained, so the new entry is the one dropped
      dropped++;
      return;
    }
    if (entries.size() == capacity) {
      entries.removeFirst();
      dropped++;
    }
    entries.addLast(entry);
  }

  public int size() {
    return entries.size();
  }

  public int capacity() {
    return capacity;
  }

  /** Count of entries evicted or rejected since creation. */
  public int dropped() {
    return dropped;
  }

  /** Returns an unmodifiable copy, oldest first. */
  public List<E> toList() {
    if (entries.isEmpty()) return Collections.emptyList();
    return Collections.unmodifiableList(new ArrayList<>(entries));
  }

  @Override public String toString() {
    return "RingBuffer{capacity=" + capacity + ", size=" + entries.size() + ", dropped=" + dropped
      + "}";
  }
}
