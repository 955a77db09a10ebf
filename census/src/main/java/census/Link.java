/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A pointer from one span to another, possibly in a different trace. */
public final class Link {
  public enum Type {
    UNSPECIFIED,
    /** The linked span is a child of the current span. */
    CHILD_LINKED_SPAN,
    /** The linked span is a parent of the current span. */
    PARENT_LINKED_SPAN
  }

  public static Link create(String traceId, String spanId, Type type, Map<String, ?> attributes) {
    if (traceId == null) throw new NullPointerException("traceId == null");
    if (spanId == null) throw new NullPointerException("spanId == null");
    if (type == null) throw new NullPointerException("type == null");
    if (attributes == null) throw new NullPointerException("attributes == null");
    return new Link(traceId, spanId, type, attributes.isEmpty()
      ? Collections.<String, Object>emptyMap()
      : Collections.<String, Object>unmodifiableMap(new LinkedHashMap<>(attributes)));
  }

  final String traceId, spanId;
  final Type type;
  final Map<String, Object> attributes;

  Link(String traceId, String spanId, Type type, Map<String, Object> attributes) {
    this.traceId = traceId;
    this.spanId = spanId;
    this.type = type;
    this.attributes = attributes;
  }

  /** Lower-hex trace ID of the linked span. */
  public String traceId() {
    return traceId;
  }

  /** Lower-hex span ID of the linked span. */
  public String spanId() {
    return spanId;
  }

  public Type type() {
    return type;
  }

  public Map<String, Object> attributes() {
    return attributes;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Link)) return false;
    Link that = (Link) o;
    return traceId.equals(that.traceId)
      && spanId.equals(that.spanId)
      && type == that.type
      && attributes.equals(that.attributes);
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= traceId.hashCode();
    h *= 1000003;
    h ^= spanId.hashCode();
    h *= 1000003;
    h ^= type.hashCode();
    h *= 1000003;
    h ^= attributes.hashCode();
    return h;
  }

  @Override public String toString() {
    return "Link{traceId=" + traceId + ", spanId=" + spanId + ", type=" + type
      + (attributes.isEmpty() ? "" : ", attributes=" + attributes) + "}";
  }
}
