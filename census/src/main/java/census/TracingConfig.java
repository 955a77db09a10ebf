/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

import census.handler.Exporter;
import census.handler.SpanEventListener;
import census.internal.Nullable;
import census.internal.Platform;
import census.sampler.Sampler;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Settings read by {@link Tracer#start(TracingConfig)} and {@link Tracing#start(TracingConfig)}.
 * Invalid values fail at build time, never on the span path.
 */
public final class TracingConfig {
  public static final float DEFAULT_SAMPLING_RATE = 0.0001f;
  public static final int DEFAULT_BUFFER_SIZE = 100;
  public static final long DEFAULT_BUFFER_TIMEOUT_MILLIS = 20_000L;
  public static final int DEFAULT_MAXIMUM_LABEL_VALUE_SIZE = 150;

  public static final TracingConfig DEFAULT = newBuilder().build();

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static final class Builder {
    float samplingRate = DEFAULT_SAMPLING_RATE;
    Sampler sampler;
    int bufferSize = DEFAULT_BUFFER_SIZE;
    long bufferTimeoutMillis = DEFAULT_BUFFER_TIMEOUT_MILLIS;
    int maximumLabelValueSize = DEFAULT_MAXIMUM_LABEL_VALUE_SIZE;
    TraceParams traceParams = TraceParams.DEFAULT;
    Clock clock;
    Exporter exporter;
    final LinkedHashSet<SpanEventListener> listeners = new LinkedHashSet<>();

    Builder() {
    }

    Builder(TracingConfig source) {
      samplingRate = source.samplingRate;
      sampler = source.samplerOverride;
      bufferSize = source.bufferSize;
      bufferTimeoutMillis = source.bufferTimeoutMillis;
      maximumLabelValueSize = source.maximumLabelValueSize;
      traceParams = source.traceParams;
      clock = source.clockOverride;
      exporter = source.exporter;
      listeners.addAll(source.listeners);
    }

    /**
     * Fraction of new traces to record: zero, or between 0.0001 and 1 inclusive. Defaults to
     * 0.0001. Ignored when {@link #sampler(Sampler)} is set.
     */
    public Builder samplingRate(float samplingRate) {
      if (samplingRate < 0.0f || samplingRate > 1.0f
        || (samplingRate > 0.0f && samplingRate < 0.0001f)) {
        throw new IllegalArgumentException(
          "samplingRate should be 0 or between 0.0001 and 1: was " + samplingRate);
      }
      this.samplingRate = samplingRate;
      return this;
    }

    public Builder sampler(Sampler sampler) {
      if (sampler == null) throw new NullPointerException("sampler == null");
      this.sampler = sampler;
      return this;
    }

    /** Count of finished traces that triggers an immediate flush. Defaults to 100. */
    public Builder bufferSize(int bufferSize) {
      if (bufferSize < 1) throw new IllegalArgumentException("bufferSize < 1");
      this.bufferSize = bufferSize;
      return this;
    }

    /** How long a partial batch waits before it is flushed. Defaults to 20 seconds. */
    public Builder bufferTimeout(long bufferTimeout, TimeUnit unit) {
      if (unit == null) throw new NullPointerException("unit == null");
      if (bufferTimeout < 0) throw new IllegalArgumentException("bufferTimeout < 0");
      this.bufferTimeoutMillis = unit.toMillis(bufferTimeout);
      return this;
    }

    /** String attribute values longer than this are truncated. Defaults to 150. */
    public Builder maximumLabelValueSize(int maximumLabelValueSize) {
      if (maximumLabelValueSize < 1) {
        throw new IllegalArgumentException("maximumLabelValueSize < 1");
      }
      this.maximumLabelValueSize = maximumLabelValueSize;
      return this;
    }

    public Builder traceParams(TraceParams traceParams) {
      if (traceParams == null) throw new NullPointerException("traceParams == null");
      this.traceParams = traceParams;
      return this;
    }

    /** Wall clock read when a trace begins. Defaults to the platform clock. */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    /**
     * The exporter {@link Tracing} registers on start. When unset, {@link Tracing} logs finished
     * traces instead.
     */
    public Builder exporter(@Nullable Exporter exporter) {
      this.exporter = exporter;
      return this;
    }

    /** Listeners registered on start, in the order added. Duplicates are ignored. */
    public Builder addSpanEventListener(SpanEventListener listener) {
      if (listener == null) throw new NullPointerException("listener == null");
      listeners.add(listener);
      return this;
    }

    public TracingConfig build() {
      return new TracingConfig(this);
    }
  }

  final float samplingRate;
  @Nullable final Sampler samplerOverride;
  final Sampler sampler;
  final int bufferSize;
  final long bufferTimeoutMillis;
  final int maximumLabelValueSize;
  final TraceParams traceParams;
  @Nullable final Clock clockOverride;
  final Clock clock;
  @Nullable final Exporter exporter;
  final List<SpanEventListener> listeners;

  TracingConfig(Builder builder) {
    samplingRate = builder.samplingRate;
    samplerOverride = builder.sampler;
    sampler = builder.sampler != null ? builder.sampler : Sampler.create(builder.samplingRate);
    bufferSize = builder.bufferSize;
    bufferTimeoutMillis = builder.bufferTimeoutMillis;
    maximumLabelValueSize = builder.maximumLabelValueSize;
    traceParams = builder.traceParams;
    clockOverride = builder.clock;
    clock = builder.clock != null ? builder.clock : Platform.get().clock();
    exporter = builder.exporter;
    listeners = Collections.unmodifiableList(new ArrayList<>(builder.listeners));
  }

  public float samplingRate() {
    return samplingRate;
  }

  /** The configured sampler, or one derived from {@link #samplingRate()}. */
  public Sampler sampler() {
    return sampler;
  }

  public int bufferSize() {
    return bufferSize;
  }

  public long bufferTimeoutMillis() {
    return bufferTimeoutMillis;
  }

  public int maximumLabelValueSize() {
    return maximumLabelValueSize;
  }

  public TraceParams traceParams() {
    return traceParams;
  }

  public Clock clock() {
    return clock;
  }

  @Nullable public Exporter exporter() {
    return exporter;
  }

  public List<SpanEventListener> spanEventListeners() {
    return listeners;
  }

  @Override public String toString() {
    return "TracingConfig{sampler=" + sampler
      + ", bufferSize=" + bufferSize
      + ", bufferTimeoutMillis=" + bufferTimeoutMillis
      + ", maximumLabelValueSize=" + maximumLabelValueSize
      + ", traceParams=" + traceParams
      + (exporter != null ? ", exporter=" + exporter : "")
      + "}";
  }
}
