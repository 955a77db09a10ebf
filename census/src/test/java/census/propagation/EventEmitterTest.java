/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.propagation;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventEmitterTest {
  EventEmitter<String> emitter = EventEmitter.create();
  List<String> events = new ArrayList<>();

  @Test void emit_noListeners() {
    assertThat(emitter.emit("a")).isFalse();
  }

  @Test void emit_inRegistrationOrder() {
    emitter.addListener(e -> events.add("1:" + e)).addListener(e -> events.add("2:" + e));

    assertThat(emitter.emit("a")).isTrue();

    assertThat(events).containsExactly("1:a", "2:a");
    assertThat(emitter.listenerCount()).isEqualTo(2);
  }

  @Test void removeListener() {
    Consumer<String> listener = events::add;
    emitter.addListener(listener);

    assertThat(emitter.removeListener(listener)).isTrue();
    assertThat(emitter.removeListener(listener)).isFalse();
    emitter.emit("a");

    assertThat(events).isEmpty();
  }

  @Test void emit_listenerFailurePropagates() {
    emitter.addListener(e -> {
      throw new IllegalStateException(e);
    });
    emitter.addListener(events::add);

    assertThatThrownBy(() -> emitter.emit("boom"))
      .isInstanceOf(IllegalStateException.class)
      .hasMessage("boom");
    assertThat(events).isEmpty();
  }

  @Test void addListener_null() {
    assertThatThrownBy(() -> emitter.addListener(null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("listener == null");
  }

  @Test void addListener_acceptsSupertypeListener() {
    List<Object> objects = new ArrayList<>();
    Consumer<Object> listener = objects::add;

    emitter.addListener(listener);
    emitter.emit("a");

    assertThat(objects).containsExactly("a");
  }
}
