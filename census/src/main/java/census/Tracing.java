/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

import census.handler.Exporter;
import census.handler.LoggingExporter;
import census.internal.Nullable;
import census.propagation.CurrentContext;
import java.io.Closeable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * This provides utilities needed for trace instrumentation. For example, a {@link Tracer} and the
 * exporter that receives finished traces.
 *
 * <p>Instances are held by the host application and passed to instrumentation. {@link #current()}
 * is a convenience for code that cannot be handed an instance.
 *
 * <p>This type can be extended so that the object graph can be built differently or overridden,
 * for example via spring or when mocking.
 */
public class Tracing implements Closeable {
  static final AtomicReference<Tracing> CURRENT = new AtomicReference<>();

  public static Tracing create() {
    return new Tracing(Tracer.create());
  }

  public static Tracing create(CurrentContext currentContext) {
    return new Tracing(Tracer.create(currentContext));
  }

  /**
   * Returns the most recently started tracing component, or null if none is active.
   *
   * <p>Prefer passing an instance through your object graph. This exists for code that cannot be
   * given one.
   */
  @Nullable public static Tracing current() {
    return CURRENT.get();
  }

  /** Returns the tracer of {@link #current()}, or null if none is active. */
  @Nullable public static Tracer currentTracer() {
    Tracing tracing = current();
    return tracing != null ? tracing.tracer() : null;
  }

  final Tracer tracer;
  // guarded by this
  TracingConfig config;
  Exporter exporter;
  LoggingExporter ownedExporter;

  protected Tracing(Tracer tracer) {
    if (tracer == null) throw new NullPointerException("tracer == null");
    this.tracer = tracer;
  }

  /**
   * Starts the tracer and registers the configured exporter. When the configuration has none,
   * finished traces are logged by a {@link LoggingExporter} sized by the buffer settings of the
   * configuration. Starting again first stops the current session.
   */
  public Tracing start(TracingConfig config) {
    if (config == null) throw new NullPointerException("config == null");
    synchronized (this) {
      if (this.config != null) stop();
      this.config = config;
      tracer.start(config);
      Exporter exporter = config.exporter();
      if (exporter == null) {
        exporter = ownedExporter = LoggingExporter.newBuilder()
          .bufferSize(config.bufferSize())
          .bufferTimeout(config.bufferTimeoutMillis(), TimeUnit.MILLISECONDS)
          .build();
      }
      registerExporter(exporter);
    }
    CURRENT.set(this);
    return this;
  }

  /**
   * Stops the tracer and unregisters the exporter. A logging exporter created by {@link
   * #start(TracingConfig)} is flushed and closed. Exporters supplied by the caller are left open.
   */
  public void stop() {
    LoggingExporter toClose;
    synchronized (this) {
      registerExporter(null);
      tracer.stop();
      config = null;
      toClose = ownedExporter;
      ownedExporter = null;
    }
    if (toClose != null) toClose.close();
    CURRENT.compareAndSet(this, null);
  }

  public boolean isActive() {
    return tracer.isActive();
  }

  /** All tracing commands start with a {@link Span}. Use a tracer to create spans. */
  public Tracer tracer() {
    return tracer;
  }

  /** The configuration passed to {@link #start(TracingConfig)}, or null when stopped. */
  @Nullable public synchronized TracingConfig config() {
    return config;
  }

  /** The exporter currently receiving traces, or null if there is none. */
  @Nullable public synchronized Exporter exporter() {
    return exporter;
  }

  /**
   * Replaces the exporter receiving finished traces. Passing null unregisters the current exporter
   * and leaves the slot empty, which turns off export.
   */
  public synchronized void registerExporter(@Nullable Exporter exporter) {
    if (this.exporter != null) tracer.unregisterSpanEventListener(this.exporter);
    this.exporter = exporter;
    if (exporter != null) tracer.registerSpanEventListener(exporter);
  }

  /** Unregisters the exporter if it is the current one. */
  public synchronized void unregisterExporter(Exporter exporter) {
    if (exporter == null) throw new NullPointerException("exporter == null");
    if (this.exporter != exporter) return;
    tracer.unregisterSpanEventListener(exporter);
    this.exporter = null;
  }

  /** Same as {@link #stop()}. */
  @Override public void close() {
    stop();
  }

  @Override public String toString() {
    return "Tracing{tracer=" + tracer + "}";
  }
}
