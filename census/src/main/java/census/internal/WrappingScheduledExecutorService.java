/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.internal;

import java.util.concurrent.Callable;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/** Like {@link WrappingExecutorService}, but also wraps delayed and periodic tasks. */
public abstract class WrappingScheduledExecutorService extends WrappingExecutorService
  implements ScheduledExecutorService {

  protected WrappingScheduledExecutorService() {
  }

  @Override protected abstract ScheduledExecutorService delegate();

  @Override public ScheduledFuture<?> schedule(Runnable task, long delay, TimeUnit unit) {
    return delegate().schedule(wrap(task), delay, unit);
  }

  @Override public <V> ScheduledFuture<V> schedule(Callable<V> task, long delay, TimeUnit unit) {
    return delegate().schedule(wrap(task), delay, unit);
  }

  @Override public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, long initialDelay,
    long period, TimeUnit unit) {
    return delegate().scheduleAtFixedRate(wrap(task), initialDelay, period, unit);
  }

  @Override public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, long initialDelay,
    long delay, TimeUnit unit) {
    return delegate().scheduleWithFixedDelay(wrap(task), initialDelay, delay, unit);
  }
}
