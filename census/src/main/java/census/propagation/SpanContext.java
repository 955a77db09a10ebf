/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.propagation;

import census.internal.HexCodec;
import census.internal.Nullable;

import static census.internal.HexCodec.lowerHexToHighBits;
import static census.internal.HexCodec.lowerHexToUnsignedLong;

/**
 * Immutable identity of a span plus the sampling decision of its trace.
 *
 * <p>The trace ID is 128-bit when {@link #traceIdHigh()} is set, otherwise 64-bit. The trace state
 * is opaque vendor data carried from a remote parent and never interpreted here.
 */
public final class SpanContext {

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static final class Builder {
    long traceIdHigh, traceId, spanId;
    boolean sampled;
    String traceState;

    Builder() {
    }

    Builder(SpanContext context) {
      traceIdHigh = context.traceIdHigh;
      traceId = context.traceId;
      spanId = context.spanId;
      sampled = context.sampled;
      traceState = context.traceState;
    }

    /** @see SpanContext#traceIdHigh() */
    public Builder traceIdHigh(long traceIdHigh) {
      this.traceIdHigh = traceIdHigh;
      return this;
    }

    /** @see SpanContext#traceId() */
    public Builder traceId(long traceId) {
      this.traceId = traceId;
      return this;
    }

    /**
     * Parses a 16 or 32 character lower-hex trace ID, such as one read from a request header.
     *
     * @throws NumberFormatException if the input isn't lower-hex or is all zeros
     */
    public Builder traceId(String traceIdString) {
      if (traceIdString == null) throw new NullPointerException("traceIdString == null");
      this.traceIdHigh = lowerHexToHighBits(traceIdString);
      this.traceId = lowerHexToUnsignedLong(traceIdString);
      return this;
    }

    /** @see SpanContext#spanId() */
    public Builder spanId(long spanId) {
      this.spanId = spanId;
      return this;
    }

    /**
     * Parses a 1 to 16 character lower-hex span ID.
     *
     * @throws NumberFormatException if the input isn't lower-hex or is all zeros
     */
    public Builder spanId(String spanIdString) {
      if (spanIdString == null) throw new NullPointerException("spanIdString == null");
      if (spanIdString.length() > 16) {
        throw new NumberFormatException(spanIdString + " should be at most 16 characters");
      }
      this.spanId = lowerHexToUnsignedLong(spanIdString);
      return this;
    }

    /** @see SpanContext#sampled() */
    public Builder sampled(boolean sampled) {
      this.sampled = sampled;
      return this;
    }

    /** @see SpanContext#traceState() */
    public Builder traceState(@Nullable String traceState) {
      this.traceState = traceState;
      return this;
    }

    public SpanContext build() {
      String missing = "";
      if (traceId == 0L) missing += " traceId";
      if (spanId == 0L) missing += " spanId";
      if (!"".equals(missing)) throw new IllegalArgumentException("Missing:" + missing);
      return new SpanContext(this);
    }
  }

  final long traceIdHigh, traceId, spanId;
  final boolean sampled;
  @Nullable final String traceState;

  SpanContext(Builder builder) {
    traceIdHigh = builder.traceIdHigh;
    traceId = builder.traceId;
    spanId = builder.spanId;
    sampled = builder.sampled;
    traceState = builder.traceState;
  }

  /** When non-zero, the trace containing this span uses 128-bit trace identifiers. */
  public long traceIdHigh() {
    return traceIdHigh;
  }

  /** Unique 8-byte identifier for a trace, set on all spans within it. */
  public long traceId() {
    return traceId;
  }

  /** Unique 8-byte identifier of this span within a trace. */
  public long spanId() {
    return spanId;
  }

  /** True when the trace this span belongs to is recorded and exported. */
  public boolean sampled() {
    return sampled;
  }

  @Nullable public String traceState() {
    return traceState;
  }

  /** Returns the hex representation of the span's trace ID */
  public String traceIdString() {
    return HexCodec.toLowerHex(traceIdHigh, traceId);
  }

  /** Returns the hex representation of the span's ID */
  public String spanIdString() {
    return HexCodec.toLowerHex(spanId);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SpanContext)) return false;
    SpanContext that = (SpanContext) o;
    return traceIdHigh == that.traceIdHigh
      && traceId == that.traceId
      && spanId == that.spanId
      && sampled == that.sampled
      && (traceState == null ? that.traceState == null : traceState.equals(that.traceState));
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= (int) ((traceIdHigh >>> 32) ^ traceIdHigh);
    h *= 1000003;
    h ^= (int) ((traceId >>> 32) ^ traceId);
    h *= 1000003;
    h ^= (int) ((spanId >>> 32) ^ spanId);
    h *= 1000003;
    h ^= sampled ? 1231 : 1237;
    h *= 1000003;
    h ^= traceState == null ? 0 : traceState.hashCode();
    return h;
  }

  /** Returns {@code $traceId/$spanId} */
  @Override public String toString() {
    return traceIdString() + "/" + spanIdString();
  }
}
