package com.scylladb.admin;

import com.scylladb.admin.errors.RequestCancelledException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cancellable scope of one inbound request, shared by every remote call made on its behalf.
 *
 * <p>A context has an optional deadline and can be cancelled explicitly. Child contexts created
 * with {@link #newChild()} inherit the deadline and are cancelled together with their parent, but
 * cancelling a child never affects the parent. This lets a fan-out abandon its own branches without
 * touching the rest of the request.
 *
 * <p>Deadlines are not enforced by a timer. Code that blocks on behalf of a context is expected to
 * bound its wait with {@link #remaining()} and to call {@link #cancel()} when the time is up.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * try (RequestContext ctx = RequestContext.withTimeout(Duration.ofSeconds(10))) {
 *   List<Tablet> tablets = admin.getTablets(ctx, Collections.emptyList());
 * }
 * }</pre>
 *
 * <p>Thread-safe.
 *
 * @since 1.0.0
 */
public final class RequestContext implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RequestContext.class.getName());

  private final RequestContext parent;
  private final boolean hasDeadline;
  private final long deadlineNanos;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
  private final Runnable parentListener;

  private RequestContext(RequestContext parent, boolean hasDeadline, long deadlineNanos) {
    this.parent = parent;
    this.hasDeadline = hasDeadline;
    this.deadlineNanos = deadlineNanos;
    if (parent != null) {
      this.parentListener = this::cancel;
      parent.addCancelListener(parentListener);
    } else {
      this.parentListener = null;
    }
  }

  /**
   * Creates a root context with no deadline.
   *
   * @return a new context
   */
  public static RequestContext background() {
    return new RequestContext(null, false, 0L);
  }

  /**
   * Creates a root context that expires after the given timeout.
   *
   * @param timeout the time budget of the request; must be positive
   * @return a new context
   * @throws IllegalArgumentException if timeout is null or not positive
   */
  public static RequestContext withTimeout(Duration timeout) {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive, but was: " + timeout);
    }
    return new RequestContext(null, true, System.nanoTime() + timeout.toNanos());
  }

  /**
   * Creates a child context with the same deadline. The child is cancelled when this context is
   * cancelled. Close the child when done with it to detach it from this context.
   *
   * @return a new child context
   */
  public RequestContext newChild() {
    return new RequestContext(this, hasDeadline, deadlineNanos);
  }

  /**
   * Cancels this context and all of its children. Registered cancel listeners run on the calling
   * thread. Calling this more than once has no further effect.
   */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    for (Runnable listener : listeners) {
      try {
        listener.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "cancel listener failed", e);
      }
    }
  }

  /**
   * Returns whether this context was cancelled or its deadline has passed.
   *
   * @return true if no further work should be started for this context
   */
  public boolean isDone() {
    return cancelled.get() || isDeadlineExceeded();
  }

  /**
   * Returns whether {@link #cancel()} was called on this context or one of its ancestors.
   *
   * @return true if cancelled
   */
  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Returns whether the deadline of this context has passed.
   *
   * @return true if the context has a deadline and it is in the past
   */
  public boolean isDeadlineExceeded() {
    return hasDeadline && System.nanoTime() - deadlineNanos >= 0;
  }

  /**
   * Returns whether this context has a deadline.
   *
   * @return true if a deadline is set
   */
  public boolean hasDeadline() {
    return hasDeadline;
  }

  /**
   * Returns the time left until the deadline.
   *
   * @return the remaining time, {@link Duration#ZERO} if the deadline passed, or {@code null} if
   *     this context has no deadline
   */
  public Duration remaining() {
    if (!hasDeadline) {
      return null;
    }
    long left = deadlineNanos - System.nanoTime();
    return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
  }

  /**
   * Returns the time left until the deadline in the given unit, or {@code Long.MAX_VALUE} when
   * there is no deadline.
   *
   * @param unit the unit of the result
   * @return remaining time, never negative
   */
  public long remaining(TimeUnit unit) {
    if (!hasDeadline) {
      return Long.MAX_VALUE;
    }
    return unit.convert(Math.max(0L, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
  }

  /**
   * Throws if this context is done.
   *
   * @throws RequestCancelledException if the context was cancelled or its deadline passed
   */
  public void checkActive() throws RequestCancelledException {
    if (cancelled.get()) {
      throw new RequestCancelledException(isDeadlineExceeded());
    }
    if (isDeadlineExceeded()) {
      throw new RequestCancelledException(true);
    }
  }

  /**
   * Registers a listener invoked once when this context is cancelled. If the context is already
   * cancelled the listener runs immediately.
   *
   * @param listener the callback
   */
  public void addCancelListener(Runnable listener) {
    listeners.add(listener);
    if (cancelled.get() && listeners.remove(listener)) {
      listener.run();
    }
  }

  /**
   * Removes a listener added with {@link #addCancelListener(Runnable)}.
   *
   * @param listener the callback to remove
   */
  public void removeCancelListener(Runnable listener) {
    listeners.remove(listener);
  }

  /** Detaches this context from its parent. Does not cancel it. */
  @Override
  public void close() {
    if (parent != null) {
      parent.removeCancelListener(parentListener);
    }
  }
}
