/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.internal.handler;

import census.RootSpan;
import census.handler.SpanEventListener;
import census.internal.Platform;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static census.internal.Throwables.propagateIfFatal;

/**
 * Insertion-ordered set of listeners, compared by identity.
 *
 * <p>This logs exceptions instead of raising an error, as the supplied listener could have bugs.
 */
public final class SpanEventListeners {
  // notifications vastly outnumber registrations
  final CopyOnWriteArrayList<SpanEventListener> listeners = new CopyOnWriteArrayList<>();

  /** Returns false if the same instance was already registered. */
  public synchronized boolean add(SpanEventListener listener) {
    if (listener == null) throw new NullPointerException("listener == null");
    if (indexOf(listener) != -1) return false;
    return listeners.add(listener);
  }

  public synchronized boolean remove(SpanEventListener listener) {
    if (listener == null) throw new NullPointerException("listener == null");
    int i = indexOf(listener);
    if (i == -1) return false;
    listeners.remove(i);
    return true;
  }

  public void clear() {
    listeners.clear();
  }

  public boolean isEmpty() {
    return listeners.isEmpty();
  }

  /** Returns a copy in registration order. */
  public List<SpanEventListener> toList() {
    return Collections.unmodifiableList(new ArrayList<>(listeners));
  }

  public void onStartSpan(RootSpan root) {
    for (SpanEventListener listener : listeners) {
      try {
        listener.onStartSpan(root);
      } catch (Throwable t) {
        propagateIfFatal(t);
        Platform.get().log("error handling start {0}", root, t);
      }
    }
  }

  public void onEndSpan(RootSpan root) {
    for (SpanEventListener listener : listeners) {
      try {
        listener.onEndSpan(root);
      } catch (Throwable t) {
        propagateIfFatal(t);
        Platform.get().log("error handling end {0}", root, t);
      }
    }
  }

  // by identity, not equals
  int indexOf(SpanEventListener listener) {
    int i = 0;
    for (SpanEventListener next : listeners) {
      if (next == listener) return i;
      i++;
    }
    return -1;
  }

  @Override public String toString() {
    return listeners.toString();
  }
}
