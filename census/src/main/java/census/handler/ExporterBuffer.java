/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.handler;

import census.RootSpan;
import census.internal.Platform;
import java.io.Closeable;
import java.io.Flushable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static census.internal.Throwables.propagateIfFatal;

/**
 * Batches finished traces between "the root ended" and "the exporter published it".
 *
 * <p>A batch is published when either of these happens first:
 * <ul>
 *   <li>The queue reaches {@code bufferSize}. This publishes on the calling thread and cancels
 *   any pending timer.</li>
 *   <li>{@code bufferTimeout} elapses after the first trace of the batch was added. This publishes
 *   on the scheduler thread, even if only one trace is queued.</li>
 * </ul>
 *
 * <p>The queue is emptied before {@link Exporter#publish(List)} is called, and a failed publish is
 * logged, not retried.
 */
public final class ExporterBuffer implements Flushable, Closeable {
  static final String THREAD_NAME = "census-exporter-buffer";

  public static Builder newBuilder(Exporter exporter) {
    return new Builder(exporter);
  }

  public static final class Builder {
    final Exporter exporter;
    int bufferSize = 100;
    long bufferTimeoutNanos = TimeUnit.SECONDS.toNanos(20);
    ScheduledExecutorService scheduler;

    Builder(Exporter exporter) {
      if (exporter == null) throw new NullPointerException("exporter == null");
      this.exporter = exporter;
    }

    /** Count of traces that triggers an immediate flush. Default 100. */
    public Builder bufferSize(int bufferSize) {
      if (bufferSize < 1) throw new IllegalArgumentException("bufferSize < 1");
      this.bufferSize = bufferSize;
      return this;
    }

    /** How long a partial batch waits before it is flushed. Default 20 seconds. */
    public Builder bufferTimeout(long bufferTimeout, TimeUnit unit) {
      if (unit == null) throw new NullPointerException("unit == null");
      if (bufferTimeout < 0) throw new IllegalArgumentException("bufferTimeout < 0");
      this.bufferTimeoutNanos = unit.toNanos(bufferTimeout);
      return this;
    }

    /**
     * Runs the flush timer. When unset, the buffer starts a daemon thread named
     * "census-exporter-buffer" and shuts it down on {@link ExporterBuffer#close()}. A supplied
     * scheduler is never shut down by the buffer.
     */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      if (scheduler == null) throw new NullPointerException("scheduler == null");
      this.scheduler = scheduler;
      return this;
    }

    public ExporterBuffer build() {
      return new ExporterBuffer(this);
    }
  }

  final Exporter exporter;
  final int bufferSize;
  final long bufferTimeoutNanos;
  final ScheduledExecutorService scheduler;
  final boolean ownsScheduler;

  final Object lock = new Object();
  // guarded by lock
  ArrayList<RootSpan> queue = new ArrayList<>();
  ScheduledFuture<?> pendingFlush;
  long timerGeneration;
  boolean closed;

  ExporterBuffer(Builder builder) {
    exporter = builder.exporter;
    bufferSize = builder.bufferSize;
    bufferTimeoutNanos = builder.bufferTimeoutNanos;
    ownsScheduler = builder.scheduler == null;
    scheduler = ownsScheduler ? newScheduler() : builder.scheduler;
  }

  static ScheduledExecutorService newScheduler() {
    ScheduledThreadPoolExecutor result = new ScheduledThreadPoolExecutor(1, r -> {
      Thread thread = new Thread(r, THREAD_NAME);
      thread.setDaemon(true);
      return thread;
    });
    result.setRemoveOnCancelPolicy(true);
    return result;
  }

  /**
   * Queues a finished trace. Publishes now if the queue is full, otherwise makes sure a flush is
   * scheduled.
   */
  public void addToBuffer(RootSpan root) {
    if (root == null) return;
    List<RootSpan> batch = null;
    synchronized (lock) {
      if (closed) {
        Platform.get().log("dropping {0} as the buffer is closed", root, null);
        return;
      }
      queue.add(root);
      if (queue.size() >= bufferSize) {
        cancelPendingFlush();
        batch = drain();
      } else if (pendingFlush == null) {
        batch = scheduleFlush();
      }
    }
    if (batch != null) publish(batch);
  }

  /** Publishes everything queued on the calling thread and cancels any pending timer. */
  @Override public void flush() {
    List<RootSpan> batch;
    synchronized (lock) {
      cancelPendingFlush();
      batch = drain();
    }
    if (!batch.isEmpty()) publish(batch);
  }

  /** Publishes anything queued, then stops accepting traces. */
  @Override public void close() {
    synchronized (lock) {
      if (closed) return;
      closed = true;
    }
    flush();
    if (ownsScheduler) scheduler.shutdownNow();
  }

  /** Returns a copy of the traces waiting to be published. */
  public List<RootSpan> queue() {
    synchronized (lock) {
      return Collections.unmodifiableList(new ArrayList<>(queue));
    }
  }

  public boolean hasPendingFlush() {
    synchronized (lock) {
      return pendingFlush != null;
    }
  }

  public int bufferSize() {
    return bufferSize;
  }

  public long bufferTimeoutMillis() {
    return TimeUnit.NANOSECONDS.toMillis(bufferTimeoutNanos);
  }

  // guarded by lock. Returns a batch to publish now if the timer could not be scheduled.
  List<RootSpan> scheduleFlush() {
    final long generation = ++timerGeneration;
    try {
      pendingFlush =
        scheduler.schedule(() -> onTimeout(generation), bufferTimeoutNanos, TimeUnit.NANOSECONDS);
      return null;
    } catch (RejectedExecutionException e) {
      Platform.get().log("could not schedule a flush; flushing now", e);
      return drain();
    }
  }

  void onTimeout(long generation) {
    List<RootSpan> batch;
    synchronized (lock) {
      if (generation != timerGeneration || pendingFlush == null) return; // superseded
      pendingFlush = null;
      batch = drain();
    }
    if (!batch.isEmpty()) publish(batch);
  }

  // guarded by lock
  void cancelPendingFlush() {
    timerGeneration++;
    if (pendingFlush == null) return;
    pendingFlush.cancel(false);
    pendingFlush = null;
  }

  // guarded by lock
  List<RootSpan> drain() {
    if (queue.isEmpty()) return Collections.emptyList();
    List<RootSpan> batch = queue;
    queue = new ArrayList<>();
    return batch;
  }

  void publish(List<RootSpan> batch) {
    try {
      exporter.publish(Collections.unmodifiableList(batch));
    } catch (Throwable t) {
      propagateIfFatal(t);
      Platform.get().log("error publishing {0} traces", batch.size(), t);
    }
  }

  @Override public String toString() {
    return "ExporterBuffer{exporter=" + exporter + ", bufferSize=" + bufferSize
      + ", bufferTimeoutMillis=" + bufferTimeoutMillis() + "}";
  }
}
