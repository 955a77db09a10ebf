/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.propagation;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class NamespaceCurrentContextTest extends CurrentContextTest {
  static final AtomicInteger NAMESPACE_IDS = new AtomicInteger();

  // a unique namespace per instance, as instances with the same name share bindings
  String namespaceName;

  @Override protected CurrentContext newCurrentContext() {
    String name = "test." + NAMESPACE_IDS.incrementAndGet();
    if (namespaceName == null) namespaceName = name; // the instance under test
    return NamespaceCurrentContext.create(name);
  }

  @Test void create_registersNamespace() {
    ContextNamespace namespace = ContextNamespace.get(namespaceName);

    assertThat(namespace).isNotNull();
    assertThat(namespace.isActive()).isTrue();
    assertThat(namespace.name()).isEqualTo(namespaceName);
  }

  @Test void create_defaultNamespaceIsPerInstance() {
    NamespaceCurrentContext first = (NamespaceCurrentContext) NamespaceCurrentContext.create();
    NamespaceCurrentContext second = (NamespaceCurrentContext) NamespaceCurrentContext.create();
    try {
      assertThat(first.namespaceName)
        .startsWith(NamespaceCurrentContext.DEFAULT_NAMESPACE)
        .isNotEqualTo(second.namespaceName);
    } finally {
      first.disable();
      second.disable();
    }
  }

  @Test void sameName_sharesBindings() {
    CurrentContext other = NamespaceCurrentContext.create(namespaceName);
    try {
      try (CurrentContext.Scope scope = currentContext.newScope(span1)) {
        assertThat(other.get()).isSameAs(span1);
      }
      assertThat(other.get()).isNull();
    } finally {
      other.disable();
    }
  }

  @Test void sameName_destroyedWhenLastUserDisables() {
    CurrentContext other = NamespaceCurrentContext.create(namespaceName);
    ContextNamespace namespace = ContextNamespace.get(namespaceName);
    try (CurrentContext.Scope scope = other.newScope(span1)) {
      currentContext.disable();

      assertThat(ContextNamespace.get(namespaceName)).isSameAs(namespace);
      assertThat(other.get()).isSameAs(span1);
      assertThat(currentContext.get()).isNull();
    }

    other.disable();

    assertThat(ContextNamespace.get(namespaceName)).isNull();
    assertThat(namespace.isActive()).isFalse();
  }

  @Test void differentName_isolated() {
    CurrentContext other = NamespaceCurrentContext.create(namespaceName + ".other");
    try {
      try (CurrentContext.Scope scope = currentContext.newScope(span1)) {
        assertThat(other.get()).isNull();
      }
    } finally {
      other.disable();
    }
  }

  @Test void disable_destroysNamespace() {
    ContextNamespace namespace = ContextNamespace.get(namespaceName);
    currentContext.newScope(span1); // leaked on purpose

    currentContext.disable();

    assertThat(ContextNamespace.get(namespaceName)).isNull();
    assertThat(namespace.isActive()).isFalse();
    assertThat(namespace.size()).isZero();
  }

  @Test void enable_createsFreshNamespace() {
    ContextNamespace destroyed = ContextNamespace.get(namespaceName);
    currentContext.disable();

    currentContext.enable();

    assertThat(ContextNamespace.get(namespaceName))
      .isNotNull()
      .isNotSameAs(destroyed);
  }

  @Test void scopeClosedAfterDestroy_isHarmless() {
    CurrentContext.Scope scope = currentContext.newScope(span1);
    currentContext.disable();
    currentContext.enable();

    scope.close();

    assertThat(currentContext.get()).isNull();
  }

  @Test void bindingsArePerThread() throws Exception {
    ContextNamespace namespace = ContextNamespace.get(namespaceName);
    AtomicInteger sizeInThread = new AtomicInteger();
    try (CurrentContext.Scope scope = currentContext.newScope(span1)) {
      Thread thread = new Thread(() -> {
        try (CurrentContext.Scope inner = currentContext.newScope(span2)) {
          sizeInThread.set(namespace.size());
        }
      });
      thread.start();
      thread.join();

      assertThat(sizeInThread).hasValue(2);
      assertThat(currentContext.get()).isSameAs(span1);
      assertThat(namespace.size()).isEqualTo(1);
    }
    assertThat(namespace.size()).isZero();
  }

  @Test void deadThreadReleasesBinding() throws Exception {
    ContextNamespace namespace = ContextNamespace.get(namespaceName);
    Thread thread = new Thread(() -> currentContext.newScope(span1)); // leaked on purpose
    thread.start();
    thread.join();
    thread = null;

    await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
      System.gc();
      assertThat(namespace.size()).isZero();
    });
  }
}
