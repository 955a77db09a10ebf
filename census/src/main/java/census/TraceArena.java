/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

import census.internal.Nullable;
import census.internal.Platform;
import census.internal.recorder.TickClock;
import census.propagation.SpanContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Every recording span of one trace, keyed by span ID in creation order. Spans refer to their
 * parent and children by ID and resolve them here, so the tree holds no reference cycles and the
 * whole trace is released together once exported.
 *
 * <p>This instance is also the lock guarding every span of the trace.
 */
final class TraceArena {
  final Tracer tracer;
  final TickClock clock;
  final TraceParams traceParams;
  final int maximumLabelValueSize;
  // guarded by this
  final LinkedHashMap<Long, RealSpan> spans = new LinkedHashMap<>();
  long remoteParentId;
  RootSpan root;

  TraceArena(Tracer tracer, TickClock clock, TraceParams traceParams, int maximumLabelValueSize) {
    this.tracer = tracer;
    this.clock = clock;
    this.traceParams = traceParams;
    this.maximumLabelValueSize = maximumLabelValueSize;
  }

  /** Creates the unstarted root. The new trace joins the remote parent's trace when present. */
  synchronized RootSpan newRoot(@Nullable SpanContext remoteParent, long traceIdHigh, long traceId,
    SpanOptions options) {
    if (root != null) throw new IllegalStateException("root already created");
    if (remoteParent != null) remoteParentId = remoteParent.spanId();
    SpanContext context = SpanContext.newBuilder()
      .traceIdHigh(traceIdHigh)
      .traceId(traceId)
      .spanId(nextSpanId())
      .sampled(true)
      .traceState(remoteParent != null ? remoteParent.traceState() : null)
      .build();
    root = new RootSpan(this, context, remoteParent, options);
    spans.put(context.spanId(), root);
    return root;
  }

  /** Creates an unstarted child. Callers hold the lock and add the ID to the parent. */
  RealSpan newChild(RealSpan parent, SpanOptions options) {
    SpanContext context = parent.context.toBuilder().spanId(nextSpanId()).build();
    RealSpan child = new RealSpan(this, context, parent.context.spanId(), options);
    spans.put(context.spanId(), child);
    return child;
  }

  // guarded by this
  long nextSpanId() {
    Platform platform = Platform.get();
    long spanId;
    do {
      spanId = platform.randomLong();
    } while (spanId == 0L || spanId == remoteParentId || spans.containsKey(spanId));
    return spanId;
  }

  @Nullable synchronized RealSpan get(long spanId) {
    return spans.get(spanId);
  }

  synchronized List<RealSpan> spans() {
    return new ArrayList<>(spans.values());
  }

  synchronized int size() {
    return spans.size();
  }

  @Override public String toString() {
    return "TraceArena{root=" + (root != null ? root.context : null) + "}";
  }
}
