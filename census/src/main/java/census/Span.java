/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

import census.internal.Nullable;
import census.propagation.SpanContext;
import java.util.Collections;
import java.util.Map;

/**
 * Used to model the latency of an operation.
 *
 * <p>Spans are created with {@link Tracer#startRootSpan} or {@link #startChildSpan}, and are
 * started by then. Call {@link #end()} exactly once when the operation completes.
 *
 * <p>Nothing here throws to the caller. Misuse, such as ending twice or adding data to an ended
 * span, is logged and ignored. A span of an unsampled trace is a no-op implementation that records
 * nothing but still carries the trace identity.
 *
 * <p>For example, to time a unit of work inside the current trace:
 * <pre>{@code
 * Span span = tracer.startChildSpan("encode");
 * try {
 *   return encoder.encode();
 * } catch (RuntimeException e) {
 *   span.setStatus(CanonicalCode.INTERNAL, e.getMessage());
 *   throw e;
 * } finally {
 *   span.end();
 * }
 * }</pre>
 */
public abstract class Span {
  public enum Kind {
    UNSPECIFIED,
    /** The span handles a request from a remote client. */
    SERVER,
    /** The span covers a request to a remote server. */
    CLIENT
  }

  /**
   * When true, no recording is done and nothing is reported to listeners. However, this span
   * should still be placed in scope so that children carry the same trace and sampling decision.
   */
  public abstract boolean isNoop();

  /**
   * Returns the trace ID, span ID and sampling decision of this span. Never null, even for no-op
   * spans.
   */
  public abstract SpanContext context();

  /** Lower-hex trace ID, 32 characters long when 128-bit, otherwise 16. */
  public String traceId() {
    return context().traceIdString();
  }

  /** Lower-hex span ID, 16 characters long. */
  public String id() {
    return context().spanIdString();
  }

  /**
   * Creates, starts and returns a child of this span. If this span isn't started or has already
   * ended, this logs and returns a no-op span in the same trace.
   */
  public abstract Span startChildSpan(SpanOptions options);

  /** Like {@link #startChildSpan(SpanOptions)} with only a name. */
  public Span startChildSpan(String name) {
    if (name == null) return startChildSpan(SpanOptions.newBuilder().build());
    return startChildSpan(SpanOptions.create(name));
  }

  /** Sets the operation name. */
  public abstract Span name(String name);

  /** Sets the kind, or role, of this span in a remote call. */
  public abstract Span kind(Kind kind);

  /**
   * Sets a string attribute, replacing any value with the same key. Values longer than the
   * configured maximum label size are truncated.
   */
  public abstract Span addAttribute(String key, String value);

  public abstract Span addAttribute(String key, long value);

  public abstract Span addAttribute(String key, double value);

  public abstract Span addAttribute(String key, boolean value);

  /** Records an event at the current time of the trace. */
  public Span addAnnotation(String description) {
    return addAnnotation(description, Collections.<String, Object>emptyMap());
  }

  /** Records an event with attributes at the current time of the trace. */
  public abstract Span addAnnotation(String description, Map<String, ?> attributes);

  /**
   * Records an event with attributes at the given time.
   *
   * @param timestamp epoch microseconds
   */
  public abstract Span addAnnotation(String description, Map<String, ?> attributes,
    long timestamp);

  /** Records a pointer to another span, identified by lower-hex IDs. */
  public Span addLink(String traceId, String spanId, Link.Type type) {
    return addLink(traceId, spanId, type, Collections.<String, Object>emptyMap());
  }

  public abstract Span addLink(String traceId, String spanId, Link.Type type,
    Map<String, ?> attributes);

  /** Records a message at the current time of the trace, with unknown sizes. */
  public Span addMessageEvent(MessageEvent.Type type, long id) {
    return addMessageEvent(type, id, 0L, 0L, 0L);
  }

  /**
   * Records a message sent or received in this span.
   *
   * @param timestamp epoch microseconds, or zero to read the trace clock
   */
  public abstract Span addMessageEvent(MessageEvent.Type type, long id, long timestamp,
    long uncompressedSize, long compressedSize);

  public Span setStatus(CanonicalCode code) {
    return setStatus(code, null);
  }

  public abstract Span setStatus(CanonicalCode code, @Nullable String message);

  /**
   * Moves an unstarted span to started. Spans returned by the tracer are already started, so
   * calling this again is a logged no-op.
   */
  public abstract Span start();

  /**
   * Reports the span complete. Any child that was started but not ended is {@link #truncate()
   * truncated} first. Calling this again has no effect.
   */
  public abstract void end();

  /** Forces the span to end, even though the work it represents may not be complete. */
  public abstract void truncate();

  Span() { // intentionally hidden constructor
  }
}
