/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.internal.recorder;

import census.Clock;
import census.internal.Platform;

/**
 * One clock per trace: the wall-clock reading at root creation plus elapsed monotonic time. All
 * spans of a trace share it, so a child's start is the parent's current time and not a fresh
 * wall-clock read.
 */
public final class TickClock implements Clock {
  /** Reads the wall clock once and ticks forward from there. */
  public static TickClock create(Clock wallClock) {
    if (wallClock == null) throw new NullPointerException("wallClock == null");
    Platform platform = Platform.get();
    return new TickClock(platform, wallClock.currentTimeMicroseconds(), platform.nanoTime());
  }

  final Platform platform;
  final long baseEpochMicros;
  final long baseTickNanos;

  TickClock(Platform platform, long baseEpochMicros, long baseTickNanos) {
    this.platform = platform;
    this.baseEpochMicros = baseEpochMicros;
    this.baseTickNanos = baseTickNanos;
  }

  @Override public long currentTimeMicroseconds() {
    return ((platform.nanoTime() - baseTickNanos) / 1000) + baseEpochMicros;
  }

  @Override public String toString() {
    return "TickClock{"
      + "baseEpochMicros=" + baseEpochMicros + ", "
      + "baseTickNanos=" + baseTickNanos
      + "}";
  }
}
