/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.propagation;

import census.Span;
import census.internal.Nullable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ambient span propagation backed by a named {@link ContextNamespace}. This is the fallback used
 * when the runtime does not support thread locals, and can be forced with the system property
 * {@code census.currentContext=namespace}.
 *
 * <p>Instances from {@link #create()} each own a namespace, so two tracers never see each other's
 * spans. Instances created with the same namespace name share bindings. {@link #disable()} only
 * releases this instance's use of the namespace: it is destroyed once its last user disables.
 */
public final class NamespaceCurrentContext extends CurrentContext {
  public static final String DEFAULT_NAMESPACE = "census.io";
  static final AtomicInteger INSTANCE_IDS = new AtomicInteger();

  /** Returns an instance bound to a namespace nothing else uses. */
  public static CurrentContext create() {
    return create(DEFAULT_NAMESPACE + "." + INSTANCE_IDS.incrementAndGet());
  }

  /** Returns an instance sharing bindings with every other instance of the same name. */
  public static CurrentContext create(String namespaceName) {
    if (namespaceName == null) throw new NullPointerException("namespaceName == null");
    return new NamespaceCurrentContext(namespaceName);
  }

  final String namespaceName;
  volatile ContextNamespace namespace;

  NamespaceCurrentContext(String namespaceName) {
    this.namespaceName = namespaceName;
    this.namespace = ContextNamespace.acquire(namespaceName);
  }

  @Nullable ContextNamespace activeNamespace() {
    ContextNamespace namespace = this.namespace;
    return namespace != null && namespace.isActive() ? namespace : null;
  }

  @Override public boolean isEnabled() {
    return activeNamespace() != null;
  }

  @Override public synchronized void enable() {
    if (activeNamespace() == null) namespace = ContextNamespace.acquire(namespaceName);
  }

  @Override public synchronized void disable() {
    ContextNamespace namespace = this.namespace;
    if (namespace == null) return;
    this.namespace = null;
    ContextNamespace.release(namespace);
  }

  @Override public @Nullable Span get() {
    ContextNamespace namespace = activeNamespace();
    return namespace != null ? namespace.get() : null;
  }

  @Override public Scope newScope(@Nullable Span span) {
    ContextNamespace namespace = activeNamespace();
    if (namespace == null) return Scope.NOOP;
    final Span previous = namespace.get();
    namespace.set(span);
    return new RevertScope(namespace, previous);
  }

  @Override public String toString() {
    return "NamespaceCurrentContext{namespace=" + namespaceName + "}";
  }

  static final class RevertScope implements Scope {
    final ContextNamespace namespace;
    @Nullable final Span previous;

    RevertScope(ContextNamespace namespace, @Nullable Span previous) {
      this.namespace = namespace;
      this.previous = previous;
    }

    @Override public void close() {
      namespace.set(previous);
    }
  }
}
