/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

import census.handler.SpanEventListener;
import census.internal.Nullable;
import census.internal.Platform;
import census.internal.handler.SpanEventListeners;
import census.internal.recorder.TickClock;
import census.propagation.CurrentContext;
import census.propagation.SpanContext;
import java.io.Closeable;
import java.util.List;
import java.util.function.Function;

/**
 * Creates spans and keeps track of the current one.
 *
 * <p>A tracer does nothing until {@link #start(TracingConfig) started}: before that, and after
 * {@link #stop()}, every span it returns is a no-op. Starting installs the sampler, trace limits
 * and listeners of the configuration.
 *
 * <p>Example usage, in an inbound request handler:
 * <pre>{@code
 * String result = tracer.startRootSpan("get", root -> {
 *   try {
 *     return backend.call(); // may call tracer.startChildSpan(..)
 *   } finally {
 *     root.end();
 *   }
 * });
 * }</pre>
 *
 * <p>Only roots are reported: listeners hear about a trace when its root starts and ends. A
 * listener that throws is logged and skipped.
 *
 * @see Span
 * @see CurrentContext
 */
public final class Tracer {

  /** Returns a stopped tracer using the context backend this runtime supports. */
  public static Tracer create() {
    return new Tracer(CurrentContext.create());
  }

  public static Tracer create(CurrentContext currentContext) {
    if (currentContext == null) throw new NullPointerException("currentContext == null");
    return new Tracer(currentContext);
  }

  final CurrentContext currentContext;
  final SpanEventListeners listeners = new SpanEventListeners();
  volatile TracingConfig config; // null when stopped

  Tracer(CurrentContext currentContext) {
    this.currentContext = currentContext;
  }

  /**
   * Installs the configuration, registers its listeners and enables the context layer. Starting an
   * active tracer replaces its configuration, unregistering the listeners the previous one added.
   */
  public Tracer start(TracingConfig config) {
    if (config == null) throw new NullPointerException("config == null");
    synchronized (this) {
      TracingConfig previous = this.config;
      if (previous != null) {
        for (SpanEventListener listener : previous.spanEventListeners()) {
          listeners.remove(listener);
        }
      }
      for (SpanEventListener listener : config.spanEventListeners()) {
        listeners.add(listener);
      }
      currentContext.enable();
      this.config = config;
    }
    Platform.get().log("started tracer with {0}", config, null);
    return this;
  }

  /**
   * Stops recording: new spans are no-ops, listeners are removed and the context layer releases
   * its bindings. Spans already recording still end normally, but nobody is notified.
   */
  public void stop() {
    boolean wasActive;
    synchronized (this) {
      wasActive = config != null;
      config = null;
      listeners.clear();
      currentContext.disable();
    }
    if (wasActive) Platform.get().log("stopped tracer", null);
  }

  public boolean isActive() {
    return config != null;
  }

  /** The configuration installed by {@link #start(TracingConfig)}, or null when stopped. */
  @Nullable public TracingConfig config() {
    return config;
  }

  public CurrentContext currentContext() {
    return currentContext;
  }

  /** Like {@link #startRootSpan(SpanOptions, Function)} with only a name. */
  public <T> T startRootSpan(String name, Function<Span, T> fn) {
    if (name == null) throw new NullPointerException("name == null");
    return startRootSpan(SpanOptions.create(name), fn);
  }

  /**
   * Starts a root span, makes it current while {@code fn} runs, and returns what {@code fn}
   * returns. The caller ends the root: it stays running after this returns.
   *
   * <p>The root is a no-op when the tracer is stopped or the trace is not sampled. A remote parent
   * in the options that was sampled keeps its decision, otherwise the sampler decides.
   */
  public <T> T startRootSpan(SpanOptions options, Function<Span, T> fn) {
    if (options == null) throw new NullPointerException("options == null");
    if (fn == null) throw new NullPointerException("fn == null");
    Span root = newRootSpan(options);
    return currentContext.runWithContext(() -> fn.apply(root), root);
  }

  Span newRootSpan(SpanOptions options) {
    TracingConfig config = this.config;
    SpanContext remoteParent = options.parentContext();
    Platform platform = Platform.get();
    long traceIdHigh, traceId;
    if (remoteParent != null) {
      traceIdHigh = remoteParent.traceIdHigh();
      traceId = remoteParent.traceId();
    } else {
      traceIdHigh = platform.nextTraceIdHigh();
      traceId = nextId(platform);
    }

    boolean sampled;
    if (config == null) {
      platform.log("tracer is stopped; starting a no-op span for {0}", options, null);
      sampled = false;
    } else if (remoteParent != null && remoteParent.sampled()) {
      sampled = true;
    } else {
      sampled = config.sampler().isSampled(traceId);
    }

    if (!sampled) {
      return new NoopSpan(SpanContext.newBuilder()
        .traceIdHigh(traceIdHigh)
        .traceId(traceId)
        .spanId(remoteParent != null ? nextId(platform) : traceId)
        .sampled(false)
        .traceState(remoteParent != null ? remoteParent.traceState() : null)
        .build());
    }

    TraceArena arena = new TraceArena(this, TickClock.create(config.clock()),
      config.traceParams(), config.maximumLabelValueSize());
    RootSpan root = arena.newRoot(remoteParent, traceIdHigh, traceId, options);
    root.start();
    return root;
  }

  static long nextId(Platform platform) {
    long id;
    do {
      id = platform.randomLong();
    } while (id == 0L);
    return id;
  }

  /** Like {@link #startChildSpan(SpanOptions)} with only a name. */
  public Span startChildSpan(String name) {
    if (name == null) return startChildSpan(SpanOptions.newBuilder().build());
    return startChildSpan(SpanOptions.create(name));
  }

  /**
   * Starts a child of the {@link #currentSpan() current span}. With no current span, this logs and
   * returns an unsampled no-op span.
   */
  public Span startChildSpan(SpanOptions options) {
    Span parent = currentSpan();
    if (parent == null) {
      Platform platform = Platform.get();
      platform.log("no current span to parent {0}", options, null);
      long traceId = nextId(platform);
      return new NoopSpan(SpanContext.newBuilder()
        .traceIdHigh(platform.nextTraceIdHigh())
        .traceId(traceId)
        .spanId(traceId)
        .sampled(false)
        .build());
    }
    return parent.startChildSpan(options);
  }

  /** Returns the current span, or null if there is none. */
  @Nullable public Span currentSpan() {
    return currentContext.get();
  }

  /** Returns the root of the current trace, or null if there is no recorded current span. */
  @Nullable public RootSpan currentRootSpan() {
    Span current = currentContext.get();
    return current instanceof RealSpan ? ((RealSpan) current).root() : null;
  }

  /**
   * Makes the given span current until the result is closed. Use this to carry a span into
   * callbacks that don't run inside {@link #startRootSpan(SpanOptions, Function)}.
   *
   * <p>Ex.
   * <pre>{@code
   * try (SpanInScope ws = tracer.withSpanInScope(span)) {
   *   return inboundRequest.invoke();
   * }
   * }</pre>
   *
   * @param span span to place into scope or null to clear the scope
   */
  public SpanInScope withSpanInScope(@Nullable Span span) {
    return new SpanInScope(currentContext.newScope(span));
  }

  /** A span remains in the scope it was bound to until close is called. */
  public static final class SpanInScope implements Closeable {
    final CurrentContext.Scope scope;

    SpanInScope(CurrentContext.Scope scope) {
      this.scope = scope;
    }

    /** No exceptions are thrown when unbinding a span scope. */
    @Override public void close() {
      scope.close();
    }

    @Override public String toString() {
      return scope.toString();
    }
  }

  /** Adds the listener unless the same instance is already registered. */
  public void registerSpanEventListener(SpanEventListener listener) {
    if (listener == null) throw new NullPointerException("listener == null");
    listeners.add(listener);
  }

  public void unregisterSpanEventListener(SpanEventListener listener) {
    if (listener == null) throw new NullPointerException("listener == null");
    listeners.remove(listener);
  }

  /** Registered listeners in registration order. */
  public List<SpanEventListener> spanEventListeners() {
    return listeners.toList();
  }

  void onStartSpan(RealSpan span) {
    if (!isActive() || !span.isRootSpan()) return;
    listeners.onStartSpan((RootSpan) span);
  }

  void onEndSpan(RealSpan span) {
    if (!isActive() || !span.isRootSpan()) return;
    listeners.onEndSpan((RootSpan) span);
  }

  @Override public String toString() {
    return "Tracer{active=" + isActive() + ", currentContext=" + currentContext
      + ", listeners=" + listeners + "}";
  }
}
