/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.internal;

import census.Clock;
import census.propagation.CurrentContext;
import census.propagation.NamespaceCurrentContext;
import census.propagation.ThreadLocalCurrentContext;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Access to platform-specific features.
 *
 * <p>Note: Logging is centralized here to avoid classloader problems.
 *
 * <p>Originally designed by OkHttp team, derived from {@code okhttp3.internal.platform.Platform}
 */
public abstract class Platform {
  /** Set to "threadlocal" or "namespace" to skip the capability probe. */
  public static final String CURRENT_CONTEXT_PROPERTY = "census.currentContext";

  private static final Logger LOG = Logger.getLogger(census.Tracer.class.getName());
  private static final Platform PLATFORM = findPlatform();

  public static Platform get() {
    return PLATFORM;
  }

  /** Like {@link Logger#log(Level, String)} at FINE, which keeps lifecycle noise out of logs */
  public void log(String msg, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LOG.log(Level.FINE, msg, thrown);
  }

  /** Like {@link Logger#log(Level, String, Object)}, except with a throwable arg */
  public void log(String msg, Object param1, @Nullable Throwable thrown) {
    log(Level.FINE, msg, param1, thrown);
  }

  /** Used for programmer errors that should be visible by default, such as ending unstarted spans */
  public void warn(String msg, Object param1) {
    log(Level.WARNING, msg, param1, null);
  }

  void log(Level level, String msg, Object param1, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(level)) return;
    LogRecord lr = new LogRecord(level, msg);
    Object[] params = {param1};
    lr.setParameters(params);
    lr.setLoggerName(LOG.getName());
    if (thrown != null) lr.setThrown(thrown);
    LOG.log(lr);
  }

  /** Attempt to match the host runtime to a capable Platform implementation. */
  static Platform findPlatform() {
    String configured = System.getProperty(CURRENT_CONTEXT_PROPERTY);
    if ("namespace".equals(configured)) return new NamespacePlatform();
    if ("threadlocal".equals(configured)) return new ThreadLocalPlatform();
    return supportsThreadLocals() ? new ThreadLocalPlatform() : new NamespacePlatform();
  }

  /**
   * Some hosts forbid thread-local state on their worker threads. Probe with a round-trip before
   * committing to the thread-local backend.
   */
  static boolean supportsThreadLocals() {
    try {
      ThreadLocal<Object> probe = new ThreadLocal<>();
      probe.set(Boolean.TRUE);
      boolean result = probe.get() == Boolean.TRUE;
      probe.remove();
      return result;
    } catch (RuntimeException e) {
      LOG.log(Level.FINE, "thread locals unavailable; falling back to a context namespace", e);
      return false;
    }
  }

  /**
   * Returns a new instance of the ambient context backend chosen for this runtime. The choice is
   * made once, when this class initializes.
   */
  public abstract CurrentContext newCurrentContext();

  /**
   * This uses a pseudo-random number generator to provision IDs. This optimizes speed over full
   * coverage of 64-bits.
   */
  public long randomLong() {
    return ThreadLocalRandom.current().nextLong();
  }

  /**
   * Returns the high 8-bytes for 128-bit trace IDs.
   *
   * <p>The upper 4-bytes are epoch seconds and the lower 4-bytes are random. This makes it
   * convertible to Amazon X-Ray trace ID format v1.
   */
  public long nextTraceIdHigh() {
    return nextTraceIdHigh(ThreadLocalRandom.current().nextInt());
  }

  static long nextTraceIdHigh(int random) {
    long epochSeconds = System.currentTimeMillis() / 1000;
    return (epochSeconds & 0xffffffffL) << 32
      | (random & 0xffffffffL);
  }

  /** Monotonic time source used to tick trace clocks forward. */
  public long nanoTime() {
    return System.nanoTime();
  }

  public Clock clock() {
    return new Clock() {
      // we could use jdk.internal.misc.VM to do this more efficiently, but it is internal
      @Override public long currentTimeMicroseconds() {
        java.time.Instant instant = java.time.Clock.systemUTC().instant();
        return (instant.getEpochSecond() * 1000000) + (instant.getNano() / 1000);
      }

      @Override public String toString() {
        return "Clock.systemUTC().instant()";
      }
    };
  }

  static final class ThreadLocalPlatform extends Platform {
    @Override public CurrentContext newCurrentContext() {
      return ThreadLocalCurrentContext.create();
    }

    @Override public String toString() {
      return "ThreadLocalPlatform{}";
    }
  }

  static final class NamespacePlatform extends Platform {
    @Override public CurrentContext newCurrentContext() {
      return NamespaceCurrentContext.create();
    }

    @Override public String toString() {
      return "NamespacePlatform{}";
    }
  }
}
