/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

import census.internal.Nullable;
import census.propagation.SpanContext;

/**
 * The first recorded span of a trace in this process. It has no local parent, though it may
 * continue a trace from a {@link #remoteParent() remote parent}. Listeners receive roots, and reach
 * the rest of the trace through {@link #children()} and {@link #allDescendants()}.
 */
public final class RootSpan extends RealSpan {
  @Nullable final SpanContext remoteParent;

  RootSpan(TraceArena arena, SpanContext context, @Nullable SpanContext remoteParent,
    SpanOptions options) {
    super(arena, context, remoteParent != null ? remoteParent.spanId() : 0L, options);
    this.remoteParent = remoteParent;
  }

  @Override public RootSpan root() {
    return this;
  }

  @Override public boolean isRootSpan() {
    return true;
  }

  /** Context of the parent in another process this trace continues, or null for a new trace. */
  @Nullable public SpanContext remoteParent() {
    return remoteParent;
  }

  /** Limits applied to every span of this trace, fixed when the root was created. */
  public TraceParams traceParams() {
    return arena.traceParams;
  }

  /** Count of recorded spans in this trace, including the root. */
  public int spanCount() {
    return arena.size();
  }
}
