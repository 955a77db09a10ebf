/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.propagation;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * A source of events that invokes its listeners in registration order on the emitting thread.
 *
 * <p>By default a listener sees whatever span is current when the event is emitted. After {@link
 * CurrentContext#patchEmitterToPropagateContext(EventEmitter)}, listeners added later see the span
 * that was current when they were added.
 *
 * @param <E> the event type
 */
public final class EventEmitter<E> {

  public static <E> EventEmitter<E> create() {
    return new EventEmitter<>();
  }

  final List<Registration<E>> registrations = new CopyOnWriteArrayList<>();
  final CopyOnWriteArrayList<CurrentContext> contexts = new CopyOnWriteArrayList<>();

  EventEmitter() {
  }

  public EventEmitter<E> addListener(Consumer<? super E> listener) {
    if (listener == null) throw new NullPointerException("listener == null");
    Consumer<E> bound = listener::accept;
    for (CurrentContext context : contexts) {
      bound = context.bindWithCurrentContext(bound);
    }
    registrations.add(new Registration<>(listener, bound));
    return this;
  }

  /** Removes the first registration of this listener. Returns false if it wasn't registered. */
  public boolean removeListener(Consumer<? super E> listener) {
    if (listener == null) throw new NullPointerException("listener == null");
    for (Registration<E> registration : registrations) {
      if (registration.listener == listener) return registrations.remove(registration);
    }
    return false;
  }

  /**
   * Invokes each listener with the event. A throwing listener propagates to the caller, and the
   * remaining listeners are not invoked.
   *
   * @return true if there was at least one listener
   */
  public boolean emit(E event) {
    boolean hadListeners = false;
    for (Registration<E> registration : registrations) {
      registration.bound.accept(event);
      hadListeners = true;
    }
    return hadListeners;
  }

  public int listenerCount() {
    return registrations.size();
  }

  void bindListenersWith(CurrentContext context) {
    contexts.addIfAbsent(context);
  }

  @Override public String toString() {
    return "EventEmitter{listeners=" + registrations.size() + "}";
  }

  static final class Registration<E> {
    final Consumer<? super E> listener;
    final Consumer<E> bound;

    Registration(Consumer<? super E> listener, Consumer<E> bound) {
      this.listener = listener;
      this.bound = bound;
    }
  }
}
