/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

import census.handler.RecordingExporter;
import census.propagation.CurrentContext;
import census.propagation.ThreadLocalCurrentContext;
import census.sampler.Sampler;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/** Traces a request with sequential and asynchronous work, through to the exporter. */
class EndToEndTest {
  RecordingExporter exporter = RecordingExporter.buffered(100, 50L);
  CurrentContext currentContext = ThreadLocalCurrentContext.create();
  Tracing tracing = Tracing.create(currentContext).start(TracingConfig.newBuilder()
    .sampler(Sampler.ALWAYS_SAMPLE)
    .exporter(exporter)
    .build());
  Tracer tracer = tracing.tracer();
  ScheduledExecutorService scheduler =
    currentContext.scheduledExecutorService(Executors.newSingleThreadScheduledExecutor());

  @AfterEach void close() {
    scheduler.shutdownNow();
    tracing.close();
    exporter.close();
    Tracing.CURRENT.set(null);
  }

  @Test void sequentialChildren() {
    RootSpan root = tracer.startRootSpan("main", span -> {
      for (int i = 0; i < 10; i++) {
        doWork(i);
      }
      span.end();
      return (RootSpan) span;
    });

    await().atMost(5, TimeUnit.SECONDS).until(() -> !exporter.published().isEmpty());

    assertThat(exporter.published()).containsExactly(List.of(root));
    assertThat(root.children()).hasSize(10)
      .extracting(RealSpan::name).containsOnly("doWork");
    assertThat(root.children()).allMatch(RealSpan::ended);
    assertThat(root.children()).extracting(child -> child.attributes().get("iteration"))
      .containsExactly(0L, 1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L);

    long childTime = 0L;
    for (RealSpan child : root.children()) {
      childTime += child.durationMicros();
    }
    assertThat(root.durationMicros()).isGreaterThanOrEqualTo(childTime);
  }

  void doWork(int i) {
    Span span = tracer.startChildSpan("doWork");
    try (Tracer.SpanInScope ws = tracer.withSpanInScope(span)) {
      span.addAttribute("iteration", (long) i);
      Thread.sleep(1L);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      span.end();
    }
  }

  /** A timer set inside the root still sees it after the root function returned. */
  @Test void continuationAfterSuspension() throws Exception {
    CompletableFuture<Span> seen = new CompletableFuture<>();

    RootSpan root = tracer.startRootSpan("main", span -> {
      scheduler.schedule(() -> {
        Span child = tracer.startChildSpan("later");
        seen.complete(tracer.currentSpan());
        child.end();
        span.end();
      }, 10L, TimeUnit.MILLISECONDS);
      return (RootSpan) span;
    });

    assertThat(seen.get(5, TimeUnit.SECONDS)).isSameAs(root);
    assertThat(tracer.currentSpan()).isNull();

    await().atMost(5, TimeUnit.SECONDS).until(() -> !exporter.published().isEmpty());

    assertThat(exporter.published()).containsExactly(List.of(root));
    assertThat(root.children()).extracting(RealSpan::name).containsExactly("later");
  }

  @Test void concurrentTracesAreIsolated() throws Exception {
    CompletableFuture<RootSpan> other = CompletableFuture.supplyAsync(
      () -> tracer.startRootSpan("other", span -> {
        tracer.startChildSpan("otherChild").end();
        span.end();
        return (RootSpan) span;
      }));

    RootSpan root = tracer.startRootSpan("main", span -> {
      tracer.startChildSpan("mainChild").end();
      span.end();
      return (RootSpan) span;
    });
    RootSpan otherRoot = other.get(5, TimeUnit.SECONDS);

    assertThat(root.context().traceId()).isNotEqualTo(otherRoot.context().traceId());
    assertThat(root.children()).extracting(RealSpan::name).containsExactly("mainChild");
    assertThat(otherRoot.children()).extracting(RealSpan::name).containsExactly("otherChild");

    await().atMost(5, TimeUnit.SECONDS)
      .until(() -> exporter.published().stream().mapToInt(List::size).sum() == 2);
  }
}
