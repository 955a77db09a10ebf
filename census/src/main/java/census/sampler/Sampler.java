/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.sampler;

/**
 * Decides once, when a root span is created, whether its trace is recorded. Descendants inherit
 * the decision and are never sampled again, so a trace is exported whole or not at all.
 *
 * <p>Implementations must be pure functions of the trace ID: the same ID always gets the same
 * answer.
 */
// abstract for factory-method support
public abstract class Sampler {

  public static final Sampler ALWAYS_SAMPLE = new Sampler() {
    @Override public boolean isSampled(long traceId) {
      return true;
    }

    @Override public String toString() {
      return "AlwaysSample";
    }
  };

  public static final Sampler NEVER_SAMPLE = new Sampler() {
    @Override public boolean isSampled(long traceId) {
      return false;
    }

    @Override public String toString() {
      return "NeverSample";
    }
  };

  /**
   * Returns true if the trace ID should be recorded.
   *
   * @param traceId the lower 64 bits of the trace ID to be decided on
   */
  public abstract boolean isSampled(long traceId);

  /**
   * Returns a sampler, given a rate expressed as a fraction of traces.
   *
   * @param rate 0 means never sample, 1 means always sample. Otherwise minimum sample rate is
   * 0.0001, or 0.01% of traces
   * @see BoundarySampler
   */
  public static Sampler create(float rate) {
    return BoundarySampler.create(rate);
  }
}
