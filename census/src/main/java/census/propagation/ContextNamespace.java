/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.propagation;

import census.Span;
import census.internal.Nullable;
import java.util.Collections;
import java.util.Map;
import java.util.WeakHashMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A named store of ambient spans, one entry per thread of execution. Namespaces live in a
 * process-wide registry so that independent components asking for the same name share a store.
 *
 * <p>Each user {@link #acquire(String) acquires} the namespace and later {@link
 * #release(ContextNamespace) releases} it. The last release destroys it. Once destroyed, a
 * namespace holds nothing and ignores writes. Acquiring the name again creates a fresh namespace.
 *
 * <p>Bindings are keyed weakly by thread, so a thread that dies while bound does not pin its span.
 */
public final class ContextNamespace {
  static final ConcurrentMap<String, ContextNamespace> NAMESPACES = new ConcurrentHashMap<>();

  /** Returns the live namespace with this name, creating it if needed, and counts a new user. */
  public static ContextNamespace acquire(String name) {
    if (name == null) throw new NullPointerException("name == null");
    return NAMESPACES.compute(name, (key, namespace) -> {
      if (namespace == null) namespace = new ContextNamespace(key);
      namespace.users++;
      return namespace;
    });
  }

  /** Drops one user of the namespace, destroying it when none remain. */
  public static void release(ContextNamespace namespace) {
    if (namespace == null) throw new NullPointerException("namespace == null");
    NAMESPACES.computeIfPresent(namespace.name, (key, current) -> {
      if (current != namespace) return current; // already destroyed and replaced
      if (--current.users > 0) return current;
      current.clear();
      return null;
    });
  }

  /** Returns the live namespace with this name, or null if there isn't one. */
  @Nullable public static ContextNamespace get(String name) {
    if (name == null) throw new NullPointerException("name == null");
    return NAMESPACES.get(name);
  }

  /** Removes the namespace from the registry and drops all of its bindings, whatever its users. */
  public static void destroy(String name) {
    if (name == null) throw new NullPointerException("name == null");
    ContextNamespace namespace = NAMESPACES.remove(name);
    if (namespace != null) namespace.clear();
  }

  final String name;
  final Map<Thread, Span> values = Collections.synchronizedMap(new WeakHashMap<>());
  volatile boolean active = true;
  int users; // guarded by NAMESPACES

  ContextNamespace(String name) {
    this.name = name;
  }

  public String name() {
    return name;
  }

  public boolean isActive() {
    return active;
  }

  /** Returns the span bound for the calling thread. */
  @Nullable public Span get() {
    if (!active) return null;
    return values.get(Thread.currentThread());
  }

  /** Binds the span for the calling thread, or removes the binding when null. */
  public void set(@Nullable Span span) {
    if (!active) return;
    Thread key = Thread.currentThread();
    if (span == null) {
      values.remove(key);
    } else {
      values.put(key, span);
    }
  }

  /** Count of live threads with a binding. */
  public int size() {
    return values.size();
  }

  void clear() {
    active = false;
    values.clear();
  }

  @Override public String toString() {
    return "ContextNamespace{name=" + name + ", active=" + active + "}";
  }
}
