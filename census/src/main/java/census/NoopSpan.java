/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

import census.internal.Platform;
import census.propagation.SpanContext;
import java.util.Map;

final class NoopSpan extends Span {

  /** A new span ID in the parent's trace, keeping its sampling decision. */
  static NoopSpan childOf(SpanContext parent) {
    Platform platform = Platform.get();
    long spanId;
    do {
      spanId = platform.randomLong();
    } while (spanId == 0L || spanId == parent.spanId());
    return new NoopSpan(parent.toBuilder().spanId(spanId).build());
  }

  final SpanContext context;

  NoopSpan(SpanContext context) {
    this.context = context;
  }

  @Override public boolean isNoop() {
    return true;
  }

  @Override public SpanContext context() {
    return context;
  }

  @Override public Span startChildSpan(SpanOptions options) {
    return childOf(context);
  }

  @Override public Span name(String name) {
    return this;
  }

  @Override public Span kind(Kind kind) {
    return this;
  }

  @Override public Span addAttribute(String key, String value) {
    return this;
  }

  @Override public Span addAttribute(String key, long value) {
    return this;
  }

  @Override public Span addAttribute(String key, double value) {
    return this;
  }

  @Override public Span addAttribute(String key, boolean value) {
    return this;
  }

  @Override public Span addAnnotation(String description, Map<String, ?> attributes) {
    return this;
  }

  @Override
  public Span addAnnotation(String description, Map<String, ?> attributes, long timestamp) {
    return this;
  }

  @Override public Span addLink(String traceId, String spanId, Link.Type type,
    Map<String, ?> attributes) {
    return this;
  }

  @Override public Span addMessageEvent(MessageEvent.Type type, long id, long timestamp,
    long uncompressedSize, long compressedSize) {
    return this;
  }

  @Override public Span setStatus(CanonicalCode code, String message) {
    return this;
  }

  @Override public Span start() {
    return this;
  }

  @Override public void end() {
  }

  @Override public void truncate() {
  }

  @Override public String toString() {
    return "NoopSpan(" + context + ")";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof NoopSpan)) return false;
    return context.equals(((NoopSpan) o).context);
  }

  @Override public int hashCode() {
    return context.hashCode();
  }
}
