/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.propagation;

import census.Span;
import census.internal.Nullable;

/**
 * Ambient span propagation backed by a thread local. This is the preferred backend.
 *
 * <h3>Design notes</h3>
 *
 * <p>Each instance owns its thread local, so two tracers never see each other's spans. Releasing the
 * reference on {@link #disable()} drops every binding at once; a later {@link #enable()} starts
 * from an empty store.
 */
public class ThreadLocalCurrentContext extends CurrentContext { // not final for subclassing
  public static CurrentContext create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    boolean inheritable;

    Builder() {
    }

    /**
     * When true, threads started while a span is bound begin with that span. This can be a
     * problem in scenarios such as thread pool expansion, leading to data being recorded in the
     * wrong span. Prefer the executor decorators on {@link CurrentContext}. Defaults to false.
     */
    public Builder inheritable(boolean inheritable) {
      this.inheritable = inheritable;
      return this;
    }

    public ThreadLocalCurrentContext build() {
      return new ThreadLocalCurrentContext(this);
    }
  }

  final boolean inheritable;
  @SuppressWarnings("ThreadLocalUsage") // intentional: to support multiple Tracer instances
  volatile ThreadLocal<Span> local;

  ThreadLocalCurrentContext(Builder builder) {
    inheritable = builder.inheritable;
    local = newThreadLocal();
  }

  ThreadLocal<Span> newThreadLocal() {
    return inheritable ? new InheritableThreadLocal<>() : new ThreadLocal<>();
  }

  /**
   * Removes any span leaked on the calling thread. This is generally only useful in tests.
   */
  public void clear() {
    ThreadLocal<Span> local = this.local;
    if (local != null) local.remove();
  }

  @Override public boolean isEnabled() {
    return local != null;
  }

  @Override public synchronized void enable() {
    if (local == null) local = newThreadLocal();
  }

  @Override public synchronized void disable() {
    local = null;
  }

  @Override public @Nullable Span get() {
    ThreadLocal<Span> local = this.local;
    return local != null ? local.get() : null;
  }

  @Override public Scope newScope(@Nullable Span span) {
    ThreadLocal<Span> local = this.local;
    if (local == null) return Scope.NOOP;
    final Span previous = local.get();
    local.set(span);
    return previous != null ? new RevertToPreviousScope(local, previous)
      : new RevertToNullScope(local);
  }

  @Override public String toString() {
    return "ThreadLocalCurrentContext{inheritable=" + inheritable + "}";
  }

  static final class RevertToNullScope implements Scope {
    final ThreadLocal<Span> local;

    RevertToNullScope(ThreadLocal<Span> local) {
      this.local = local;
    }

    @Override public void close() {
      local.remove();
    }
  }

  static final class RevertToPreviousScope implements Scope {
    final ThreadLocal<Span> local;
    final Span previous;

    RevertToPreviousScope(ThreadLocal<Span> local, Span previous) {
      this.local = local;
      this.previous = previous;
    }

    @Override public void close() {
      local.set(previous);
    }
  }
}
