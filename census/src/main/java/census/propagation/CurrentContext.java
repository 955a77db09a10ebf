/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.propagation;

import census.Span;
import census.internal.Nullable;
import census.internal.Platform;
import census.internal.WrappingExecutorService;
import census.internal.WrappingScheduledExecutorService;
import java.io.Closeable;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Holds the ambient span: the span code can reach without being handed it, including code that
 * resumes after an asynchronous hop.
 *
 * <p>There are two backends, {@link ThreadLocalCurrentContext} and {@link
 * NamespaceCurrentContext}. {@link #create()} picks one once, based on what the runtime supports.
 * Callers cannot tell which one is active.
 *
 * <p>Work handed to another thread does not see the ambient span unless it is bound first. Use
 * {@link #bindWithCurrentContext(Runnable)} or one of the executor decorators, such as {@link
 * #scheduledExecutorService(ScheduledExecutorService)}, to capture the span at scheduling time.
 *
 * <h3>Design</h3>
 *
 * This design was inspired by com.google.instrumentation.trace.ContextUtils and
 * com.google.inject.servlet.RequestScoper
 */
public abstract class CurrentContext {

  /** Returns a new instance of the backend this runtime supports. */
  public static CurrentContext create() {
    return Platform.get().newCurrentContext();
  }

  /** False after {@link #disable()}, until {@link #enable()}. */
  public abstract boolean isEnabled();

  /** Allocates the backing store if it was released. Calling this when enabled has no effect. */
  public abstract void enable();

  /**
   * Releases the backing store. Until {@link #enable()}, {@link #get()} returns null and new scopes
   * bind nothing. Calling this when disabled has no effect.
   */
  public abstract void disable();

  /** Returns the span bound to the current execution, or null if there isn't one. */
  public abstract @Nullable Span get();

  /**
   * Makes the span current until the returned object is closed. It is a programming error to drop
   * or never close the result. Using try-with-resources is preferred for this reason.
   *
   * <p>Scopes nest: closing restores whatever was current before, including nothing.
   *
   * @param span span to place into scope or null to clear the scope
   */
  public abstract Scope newScope(@Nullable Span span);

  /**
   * Like {@link #newScope(Span)}, except returns {@link Scope#NOOP} if the given span is already in
   * scope. This is used by wrappers, which usually have no current span when invoked.
   *
   * @param span span to place into scope or null to clear the scope
   * @return a new scope object or {@link Scope#NOOP} if the input is already the case
   */
  public Scope maybeScope(@Nullable Span span) {
    Span current = get();
    if (span == null) {
      if (current == null) return Scope.NOOP;
      return newScope(null);
    }
    return span.equals(current) ? Scope.NOOP : newScope(span);
  }

  /**
   * Runs the supplier with the span current and returns its result. The previous binding is
   * restored on return, even when the supplier throws.
   *
   * <p>Continuations scheduled inside through a wrapped executor, or bound with {@link
   * #bindWithCurrentContext(Runnable)}, see the span even when they run after this returns.
   */
  public <T> T runWithContext(Supplier<T> fn, @Nullable Span span) {
    if (fn == null) throw new NullPointerException("fn == null");
    try (Scope scope = newScope(span)) {
      return fn.get();
    }
  }

  /** A span remains in the scope it was bound to until close is called. */
  public interface Scope extends Closeable {
    /**
     * Returned when {@link CurrentContext#maybeScope(Span)} detected scope redundancy, or when the
     * context is disabled.
     */
    Scope NOOP = new Scope() {
      @Override public void close() {
      }

      @Override public String toString() {
        return "NoopScope";
      }
    };

    /** No exceptions are thrown when unbinding a span scope. */
    @Override void close();
  }

  /** Wraps the input so that it executes with the same span as now. */
  public <C> Callable<C> bindWithCurrentContext(Callable<C> task) {
    if (task == null) throw new NullPointerException("task == null");
    final Span invocationContext = get();
    class CurrentContextCallable implements Callable<C> {
      @Override public C call() throws Exception {
        try (Scope scope = maybeScope(invocationContext)) {
          return task.call();
        }
      }
    }
    return new CurrentContextCallable();
  }

  /** Wraps the input so that it executes with the same span as now. */
  public Runnable bindWithCurrentContext(Runnable task) {
    if (task == null) throw new NullPointerException("task == null");
    final Span invocationContext = get();
    class CurrentContextRunnable implements Runnable {
      @Override public void run() {
        try (Scope scope = maybeScope(invocationContext)) {
          task.run();
        }
      }
    }
    return new CurrentContextRunnable();
  }

  /** Wraps the callback so that each event is handled with the same span as now. */
  public <E> Consumer<E> bindWithCurrentContext(Consumer<E> listener) {
    if (listener == null) throw new NullPointerException("listener == null");
    final Span invocationContext = get();
    class CurrentContextConsumer implements Consumer<E> {
      @Override public void accept(E event) {
        try (Scope scope = maybeScope(invocationContext)) {
          listener.accept(event);
        }
      }
    }
    return new CurrentContextConsumer();
  }

  /**
   * Makes listeners added to the emitter from now on run with the span that was current when they
   * were added, not the one current when the event is emitted. Patching the same emitter twice has
   * no further effect.
   */
  public <E> EventEmitter<E> patchEmitterToPropagateContext(EventEmitter<E> emitter) {
    if (emitter == null) throw new NullPointerException("emitter == null");
    emitter.bindListenersWith(this);
    return emitter;
  }

  /**
   * Decorates the input such that the {@link #get() current span} at the time a task is scheduled
   * is made current when the task is executed.
   */
  public Executor executor(Executor delegate) {
    if (delegate == null) throw new NullPointerException("delegate == null");
    class CurrentContextExecutor implements Executor {
      @Override public void execute(Runnable task) {
        delegate.execute(CurrentContext.this.bindWithCurrentContext(task));
      }
    }
    return new CurrentContextExecutor();
  }

  /**
   * Decorates the input such that the {@link #get() current span} at the time a task is scheduled
   * is made current when the task is executed.
   */
  public ExecutorService executorService(ExecutorService delegate) {
    if (delegate == null) throw new NullPointerException("delegate == null");
    class CurrentContextExecutorService extends WrappingExecutorService {

      @Override protected ExecutorService delegate() {
        return delegate;
      }

      @Override protected <C> Callable<C> wrap(Callable<C> task) {
        return CurrentContext.this.bindWithCurrentContext(task);
      }

      @Override protected Runnable wrap(Runnable task) {
        return CurrentContext.this.bindWithCurrentContext(task);
      }
    }
    return new CurrentContextExecutorService();
  }

  /**
   * Like {@link #executorService(ExecutorService)}, but also covers delayed and periodic tasks.
   * This is how timers see the span that was current when they were set.
   */
  public ScheduledExecutorService scheduledExecutorService(ScheduledExecutorService delegate) {
    if (delegate == null) throw new NullPointerException("delegate == null");
    class CurrentContextScheduledExecutorService extends WrappingScheduledExecutorService {

      @Override protected ScheduledExecutorService delegate() {
        return delegate;
      }

      @Override protected <C> Callable<C> wrap(Callable<C> task) {
        return CurrentContext.this.bindWithCurrentContext(task);
      }

      @Override protected Runnable wrap(Runnable task) {
        return CurrentContext.this.bindWithCurrentContext(task);
      }
    }
    return new CurrentContextScheduledExecutorService();
  }
}
