/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

/**
 * Epoch microseconds used to anchor the clock of each new trace.
 *
 * <p>This should use the most precise value possible. For example, {@code gettimeofday} or
 * multiplying {@link System#currentTimeMillis} by 1000.
 *
 * <p>Only roots read this clock. Every other timestamp in a trace is derived from the root's
 * reading plus elapsed monotonic time, so children never start before their parent.
 */
// @FunctionalInterface. Do not add methods as it will break API!
public interface Clock {

  long currentTimeMicroseconds();
}
