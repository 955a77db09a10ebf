/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

import census.handler.LoggingExporter;
import census.handler.RecordingExporter;
import census.propagation.ThreadLocalCurrentContext;
import census.sampler.Sampler;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TracingTest {
  RecordingExporter exporter = RecordingExporter.create();
  Tracing tracing = Tracing.create(ThreadLocalCurrentContext.create());

  @AfterEach void close() {
    tracing.close();
    Tracing.CURRENT.set(null);
  }

  @Test void current_nullWhenNotStarted() {
    assertThat(Tracing.current()).isNull();
    assertThat(Tracing.currentTracer()).isNull();
  }

  @Test void current_mostRecentlyStarted() {
    Tracing other = Tracing.create(ThreadLocalCurrentContext.create());
    try {
      tracing.start(TracingConfig.newBuilder().exporter(exporter).build());
      other.start(TracingConfig.newBuilder().exporter(exporter).build());

      assertThat(Tracing.current()).isSameAs(other);
      assertThat(Tracing.currentTracer()).isSameAs(other.tracer());
    } finally {
      other.close();
    }
  }

  @Test void current_clearedOnStop() {
    tracing.start(TracingConfig.newBuilder().exporter(exporter).build());

    tracing.stop();

    assertThat(Tracing.current()).isNull();
    assertThat(tracing.isActive()).isFalse();
    assertThat(tracing.config()).isNull();
  }

  /** Stopping an older instance must not clear a newer one. */
  @Test void current_stopOfOtherInstanceLeavesCurrent() {
    Tracing other = Tracing.create(ThreadLocalCurrentContext.create());
    try {
      other.start(TracingConfig.newBuilder().exporter(exporter).build());
      tracing.start(TracingConfig.newBuilder().exporter(exporter).build());

      other.stop();

      assertThat(Tracing.current()).isSameAs(tracing);
    } finally {
      other.close();
    }
  }

  @Test void start_registersConfiguredExporter() {
    tracing.start(TracingConfig.newBuilder().exporter(exporter).build());

    assertThat(tracing.exporter()).isSameAs(exporter);
    assertThat(tracing.tracer().spanEventListeners()).containsExactly(exporter);
  }

  @Test void start_defaultsToLoggingExporter() {
    tracing.start(TracingConfig.newBuilder()
      .bufferSize(7)
      .bufferTimeout(3, TimeUnit.SECONDS)
      .build());

    assertThat(tracing.exporter()).isInstanceOf(LoggingExporter.class);
    LoggingExporter logging = (LoggingExporter) tracing.exporter();
    assertThat(logging.buffer().bufferSize()).isEqualTo(7);
    assertThat(logging.buffer().bufferTimeoutMillis()).isEqualTo(3000L);
  }

  @Test void stop_closesDefaultExporter() {
    tracing.start(TracingConfig.DEFAULT);
    LoggingExporter logging = (LoggingExporter) tracing.exporter();

    tracing.stop();

    assertThat(logging).extracting("buffer.closed").isEqualTo(true);
    assertThat(tracing.exporter()).isNull();
  }

  @Test void stop_leavesSuppliedExporterOpen() {
    RecordingExporter buffered = RecordingExporter.buffered(10, 1000L);
    try {
      tracing.start(TracingConfig.newBuilder().exporter(buffered).build());

      tracing.stop();

      assertThat(buffered.buffer()).extracting("closed").isEqualTo(false);
    } finally {
      buffered.close();
    }
  }

  @Test void start_againReplacesSession() {
    tracing.start(TracingConfig.DEFAULT);
    LoggingExporter first = (LoggingExporter) tracing.exporter();

    TracingConfig config = TracingConfig.newBuilder().exporter(exporter).build();
    tracing.start(config);

    assertThat(first).extracting("buffer.closed").isEqualTo(true);
    assertThat(tracing.config()).isSameAs(config);
    assertThat(tracing.tracer().spanEventListeners()).containsExactly(exporter);
  }

  @Test void registerExporter_replaces() {
    tracing.start(TracingConfig.newBuilder().exporter(exporter).build());
    RecordingExporter replacement = RecordingExporter.create();

    tracing.registerExporter(replacement);

    assertThat(tracing.exporter()).isSameAs(replacement);
    assertThat(tracing.tracer().spanEventListeners()).containsExactly(replacement);
  }

  @Test void registerExporter_nullTurnsOffExport() {
    tracing.start(TracingConfig.newBuilder()
      .sampler(Sampler.ALWAYS_SAMPLE)
      .exporter(exporter)
      .build());

    tracing.registerExporter(null);
    tracing.tracer().startRootSpan("get", root -> {
      root.end();
      return null;
    });

    assertThat(tracing.exporter()).isNull();
    assertThat(exporter.ended()).isEmpty();
  }

  @Test void unregisterExporter_onlyCurrent() {
    tracing.start(TracingConfig.newBuilder().exporter(exporter).build());

    tracing.unregisterExporter(RecordingExporter.create());
    assertThat(tracing.exporter()).isSameAs(exporter);

    tracing.unregisterExporter(exporter);
    assertThat(tracing.exporter()).isNull();
    assertThat(tracing.tracer().spanEventListeners()).isEmpty();
  }

  @Test void unregisterExporter_null() {
    assertThatThrownBy(() -> tracing.unregisterExporter(null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("exporter == null");
  }

  @Test void exportsEndedRoots() {
    tracing.start(TracingConfig.newBuilder()
      .sampler(Sampler.ALWAYS_SAMPLE)
      .exporter(exporter)
      .build());

    RootSpan root = tracing.tracer().startRootSpan("get", span -> {
      span.end();
      return (RootSpan) span;
    });

    assertThat(exporter.ended()).containsExactly(root);
  }
}
