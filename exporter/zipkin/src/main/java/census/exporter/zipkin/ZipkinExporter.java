/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.exporter.zipkin;

import census.RealSpan;
import census.RootSpan;
import census.handler.Exporter;
import census.handler.ExporterBuffer;
import java.io.Closeable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import zipkin2.Span;
import zipkin2.reporter.Reporter;

import static census.internal.Throwables.propagateIfFatal;

/**
 * Reports finished traces as Zipkin v2 spans, one per recorded span.
 *
 * <p>Ex.
 * <pre>{@code
 * sender = URLConnectionSender.create("http://localhost:9411/api/v2/spans");
 * reporter = AsyncReporter.create(sender);
 * exporter = ZipkinExporter.newBuilder(reporter).localServiceName("frontend").build();
 * tracing.start(TracingConfig.newBuilder().exporter(exporter).build());
 * }</pre>
 *
 * <p>Spans the reporter rejects are kept and retried before the next batch. At most {@code
 * maxRetryBatches} failed batches are kept, oldest dropped first.
 */
public final class ZipkinExporter implements Exporter, Closeable {
  static final Logger logger = Logger.getLogger(ZipkinExporter.class.getName());

  public static ZipkinExporter create(Reporter<Span> reporter) {
    return newBuilder(reporter).build();
  }

  public static Builder newBuilder(Reporter<Span> reporter) {
    return new Builder(reporter);
  }

  public static final class Builder {
    final Reporter<Span> reporter;
    String localServiceName = "unknown";
    int bufferSize = 100;
    long bufferTimeoutMillis = 20_000L;
    int maxRetryBatches = 10;
    ScheduledExecutorService scheduler;

    Builder(Reporter<Span> reporter) {
      if (reporter == null) throw new NullPointerException("reporter == null");
      this.reporter = reporter;
    }

    /** Label of this node in the service graph, such as "favstar". Defaults to "unknown". */
    public Builder localServiceName(String localServiceName) {
      if (localServiceName == null || localServiceName.isEmpty()) {
        throw new IllegalArgumentException(localServiceName + " is not a valid serviceName");
      }
      this.localServiceName = localServiceName;
      return this;
    }

    /** @see ExporterBuffer.Builder#bufferSize(int) */
    public Builder bufferSize(int bufferSize) {
      if (bufferSize < 1) throw new IllegalArgumentException("bufferSize < 1");
      this.bufferSize = bufferSize;
      return this;
    }

    /** @see ExporterBuffer.Builder#bufferTimeout(long, TimeUnit) */
    public Builder bufferTimeout(long bufferTimeout, TimeUnit unit) {
      if (unit == null) throw new NullPointerException("unit == null");
      if (bufferTimeout < 0) throw new IllegalArgumentException("bufferTimeout < 0");
      this.bufferTimeoutMillis = unit.toMillis(bufferTimeout);
      return this;
    }

    /** Failed batches kept for another attempt. Zero disables retries. Defaults to 10. */
    public Builder maxRetryBatches(int maxRetryBatches) {
      if (maxRetryBatches < 0) throw new IllegalArgumentException("maxRetryBatches < 0");
      this.maxRetryBatches = maxRetryBatches;
      return this;
    }

    /** @see ExporterBuffer.Builder#scheduler(ScheduledExecutorService) */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      if (scheduler == null) throw new NullPointerException("scheduler == null");
      this.scheduler = scheduler;
      return this;
    }

    public ZipkinExporter build() {
      return new ZipkinExporter(this);
    }
  }

  final Reporter<Span> reporter;
  final SpanConverter converter;
  final int maxRetryBatches;
  final ExporterBuffer buffer;
  // guarded by this
  final ArrayDeque<List<Span>> retries = new ArrayDeque<>();
  int droppedBatches;

  ZipkinExporter(Builder builder) {
    reporter = builder.reporter;
    converter = new SpanConverter(builder.localServiceName);
    maxRetryBatches = builder.maxRetryBatches;
    ExporterBuffer.Builder buffer = ExporterBuffer.newBuilder(this)
      .bufferSize(builder.bufferSize)
      .bufferTimeout(builder.bufferTimeoutMillis, TimeUnit.MILLISECONDS);
    if (builder.scheduler != null) buffer.scheduler(builder.scheduler);
    this.buffer = buffer.build();
  }

  @Override public void onStartSpan(RootSpan root) {
  }

  @Override public void onEndSpan(RootSpan root) {
    buffer.addToBuffer(root);
  }

  /**
   * Reports any batches that failed before, then the given traces. Spans the reporter rejects are
   * kept for the next call instead of raising an error.
   */
  @Override public synchronized void publish(List<RootSpan> roots) {
    while (!retries.isEmpty()) {
      List<Span> remaining = report(retries.peekFirst());
      if (!remaining.isEmpty()) {
        retries.pollFirst();
        retries.addFirst(new ArrayList<>(remaining));
        keepForRetry(convert(roots));
        return;
      }
      retries.pollFirst();
    }
    List<Span> remaining = report(convert(roots));
    if (!remaining.isEmpty()) keepForRetry(remaining);
  }

  List<Span> convert(List<RootSpan> roots) {
    List<Span> result = new ArrayList<>();
    for (RootSpan root : roots) {
      result.add(converter.convert(root));
      for (RealSpan descendant : root.allDescendants()) {
        result.add(converter.convert(descendant));
      }
    }
    return result;
  }

  /** Returns the spans not reported, starting with the one that failed. */
  List<Span> report(List<Span> spans) {
    for (int i = 0, length = spans.size(); i < length; i++) {
      try {
        reporter.report(spans.get(i));
      } catch (Throwable t) {
        propagateIfFatal(t);
        logger.log(Level.FINE, "error reporting span " + spans.get(i).id(), t);
        return spans.subList(i, length);
      }
    }
    return Collections.emptyList();
  }

  // guarded by this
  void keepForRetry(List<Span> spans) {
    if (spans.isEmpty()) return;
    if (maxRetryBatches == 0) {
      droppedBatches++;
      logger.fine("dropped " + spans.size() + " spans as retries are disabled");
      return;
    }
    if (retries.size() == maxRetryBatches) {
      List<Span> dropped = retries.pollFirst();
      droppedBatches++;
      logger.warning("retry queue full; dropped " + dropped.size() + " spans");
    }
    retries.addLast(new ArrayList<>(spans));
  }

  /** Count of failed batches waiting for another attempt. */
  public synchronized int pendingRetries() {
    return retries.size();
  }

  /** Count of failed batches given up on. */
  public synchronized int droppedBatches() {
    return droppedBatches;
  }

  public ExporterBuffer buffer() {
    return buffer;
  }

  /** Reports anything still buffered and stops the flush timer. The reporter is not closed. */
  @Override public void close() {
    buffer.close();
  }

  @Override public String toString() {
    return "ZipkinExporter{" + reporter + "}";
  }
}
