/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A timestamped description of an event in the life of a span. */
public final class Annotation {
  public static Annotation create(long timestamp, String description,
    Map<String, ?> attributes) {
    if (description == null) throw new NullPointerException("description == null");
    if (attributes == null) throw new NullPointerException("attributes == null");
    return new Annotation(timestamp, description, attributes.isEmpty()
      ? Collections.<String, Object>emptyMap()
      : Collections.<String, Object>unmodifiableMap(new LinkedHashMap<>(attributes)));
  }

  final long timestamp;
  final String description;
  final Map<String, Object> attributes;

  Annotation(long timestamp, String description, Map<String, Object> attributes) {
    this.timestamp = timestamp;
    this.description = description;
    this.attributes = attributes;
  }

  /** Epoch microseconds read from the trace clock. */
  public long timestamp() {
    return timestamp;
  }

  public String description() {
    return description;
  }

  public Map<String, Object> attributes() {
    return attributes;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Annotation)) return false;
    Annotation that = (Annotation) o;
    return timestamp == that.timestamp
      && description.equals(that.description)
      && attributes.equals(that.attributes);
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= (int) ((timestamp >>> 32) ^ timestamp);
    h *= 1000003;
    h ^= description.hashCode();
    h *= 1000003;
    h ^= attributes.hashCode();
    return h;
  }

  @Override public String toString() {
    return "Annotation{timestamp=" + timestamp + ", description=" + description
      + (attributes.isEmpty() ? "" : ", attributes=" + attributes) + "}";
  }
}
