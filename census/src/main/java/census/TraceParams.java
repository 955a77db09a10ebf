/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

/**
 * Limits on the bounded collections of each span. A root takes a snapshot of these when it is
 * created and every descendant reads the root's copy.
 */
public final class TraceParams {
  public static final TraceParams DEFAULT = newBuilder().build();

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static final class Builder {
    int maxAttributesPerSpan = 32,
      maxAnnotationsPerSpan = 32,
      maxLinksPerSpan = 32,
      maxMessageEventsPerSpan = 128;

    Builder() {
    }

    Builder(TraceParams source) {
      maxAttributesPerSpan = source.maxAttributesPerSpan;
      maxAnnotationsPerSpan = source.maxAnnotationsPerSpan;
      maxLinksPerSpan = source.maxLinksPerSpan;
      maxMessageEventsPerSpan = source.maxMessageEventsPerSpan;
    }

    /** Defaults to 32. When exceeded, the oldest attribute key is evicted. */
    public Builder maxAttributesPerSpan(int maxAttributesPerSpan) {
      this.maxAttributesPerSpan = checkNotNegative(maxAttributesPerSpan, "maxAttributesPerSpan");
      return this;
    }

    /** Defaults to 32. When exceeded, the oldest annotation is evicted. */
    public Builder maxAnnotationsPerSpan(int maxAnnotationsPerSpan) {
      this.maxAnnotationsPerSpan = checkNotNegative(maxAnnotationsPerSpan, "maxAnnotationsPerSpan");
      return this;
    }

    /** Defaults to 32. When exceeded, the oldest link is evicted. */
    public Builder maxLinksPerSpan(int maxLinksPerSpan) {
      this.maxLinksPerSpan = checkNotNegative(maxLinksPerSpan, "maxLinksPerSpan");
      return this;
    }

    /** Defaults to 128. When exceeded, the oldest message event is evicted. */
    public Builder maxMessageEventsPerSpan(int maxMessageEventsPerSpan) {
      this.maxMessageEventsPerSpan =
        checkNotNegative(maxMessageEventsPerSpan, "maxMessageEventsPerSpan");
      return this;
    }

    public TraceParams build() {
      return new TraceParams(this);
    }
  }

  static int checkNotNegative(int value, String name) {
    if (value < 0) throw new IllegalArgumentException(name + " < 0");
    return value;
  }

  final int maxAttributesPerSpan, maxAnnotationsPerSpan, maxLinksPerSpan, maxMessageEventsPerSpan;

  TraceParams(Builder builder) {
    maxAttributesPerSpan = builder.maxAttributesPerSpan;
    maxAnnotationsPerSpan = builder.maxAnnotationsPerSpan;
    maxLinksPerSpan = builder.maxLinksPerSpan;
    maxMessageEventsPerSpan = builder.maxMessageEventsPerSpan;
  }

  public int maxAttributesPerSpan() {
    return maxAttributesPerSpan;
  }

  public int maxAnnotationsPerSpan() {
    return maxAnnotationsPerSpan;
  }

  public int maxLinksPerSpan() {
    return maxLinksPerSpan;
  }

  public int maxMessageEventsPerSpan() {
    return maxMessageEventsPerSpan;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceParams)) return false;
    TraceParams that = (TraceParams) o;
    return maxAttributesPerSpan == that.maxAttributesPerSpan
      && maxAnnotationsPerSpan == that.maxAnnotationsPerSpan
      && maxLinksPerSpan == that.maxLinksPerSpan
      && maxMessageEventsPerSpan == that.maxMessageEventsPerSpan;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= maxAttributesPerSpan;
    h *= 1000003;
    h ^= maxAnnotationsPerSpan;
    h *= 1000003;
    h ^= maxLinksPerSpan;
    h *= 1000003;
    h ^= maxMessageEventsPerSpan;
    return h;
  }

  @Override public String toString() {
    return "TraceParams{maxAttributesPerSpan=" + maxAttributesPerSpan
      + ", maxAnnotationsPerSpan=" + maxAnnotationsPerSpan
      + ", maxLinksPerSpan=" + maxLinksPerSpan
      + ", maxMessageEventsPerSpan=" + maxMessageEventsPerSpan + "}";
  }
}
