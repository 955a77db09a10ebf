/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.handler;

import census.RealSpan;
import census.RootSpan;
import java.io.Closeable;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs each finished trace at INFO, one line per span. This is what {@link census.Tracing} uses
 * when no exporter is configured.
 */
public final class LoggingExporter implements Exporter, Closeable {

  public static LoggingExporter create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    int bufferSize = 100;
    long bufferTimeoutMillis = 20_000L;
    Logger logger = Logger.getLogger(LoggingExporter.class.getName());

    Builder() {
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

    public Builder logger(Logger logger) {
      if (logger == null) throw new NullPointerException("logger == null");
      this.logger = logger;
      return this;
    }

    public LoggingExporter build() {
      return new LoggingExporter(this);
    }
  }

  final Logger logger;
  final ExporterBuffer buffer;

  LoggingExporter(Builder builder) {
    logger = builder.logger;
    buffer = ExporterBuffer.newBuilder(this)
      .bufferSize(builder.bufferSize)
      .bufferTimeout(builder.bufferTimeoutMillis, TimeUnit.MILLISECONDS)
      .build();
  }

  @Override public void onStartSpan(RootSpan root) {
  }

  @Override public void onEndSpan(RootSpan root) {
    buffer.addToBuffer(root);
  }

  @Override public void publish(List<RootSpan> roots) {
    if (!logger.isLoggable(Level.INFO)) return;
    for (RootSpan root : roots) {
      logger.info(root.toString());
      for (RealSpan descendant : root.allDescendants()) {
        logger.info(descendant.toString());
      }
    }
  }

  public ExporterBuffer buffer() {
    return buffer;
  }

  /** Logs anything still buffered and stops the flush timer. */
  @Override public void close() {
    buffer.close();
  }

  @Override public String toString() {
    return "LoggingExporter{name=" + logger.getName() + "}";
  }
}
