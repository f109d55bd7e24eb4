package com.scylladb.admin.internal;

import com.scylladb.admin.FanOutPolicy;
import com.scylladb.admin.RequestContext;
import com.scylladb.admin.errors.AdminException;
import com.scylladb.admin.errors.RequestCancelledException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one task per work item concurrently and merges the results, or the failures, into a single
 * outcome.
 *
 * <p>Every call follows the same contract:
 *
 * <ol>
 *   <li>One task is submitted per item. All tasks share a child of the caller's {@link
 *       RequestContext}, so cancelling the request reaches every outstanding remote call.
 *   <li>Partial results are appended to one list under a lock. No ordering is guaranteed.
 *   <li>Failures are recorded in an {@link ErrorRecorder}. A failure does not cancel siblings
 *       unless the policy is {@link FanOutPolicy#FAIL_FAST}.
 *   <li>The caller blocks on a completion barrier until every task has finished.
 *   <li>If anything failed, the call throws the combined failure and the partial results are
 *       dropped. Otherwise the merged results are returned.
 * </ol>
 *
 * <p>Fan-outs nest: a task may run another fan-out with the context it was given. A nested failure
 * is flattened into the outer failure.
 *
 * <p>The executor must be able to run nested fan-outs without starving; a bounded pool smaller than
 * the nesting width can deadlock. The default executor in {@link com.scylladb.admin.AdminConfig} is
 * an unbounded cached pool.
 *
 * <p>Thread-safe. One instance is shared by all requests.
 *
 * @since 1.0.0
 */
public final class FanOut {
  private static final Logger logger = Logger.getLogger(FanOut.class.getName());

  private final ExecutorService executor;
  private final FanOutPolicy policy;

  /**
   * Work applied to one item of a {@link #gather} call.
   *
   * @param <T> the item type
   * @param <R> the result element type
   */
  @FunctionalInterface
  public interface Branch<T, R> {
    /**
     * Produces the partial result for one item.
     *
     * @param ctx the shared context of the fan-out
     * @param item the item
     * @return elements to merge into the result; null or empty to contribute nothing
     * @throws Exception on failure; the failure is recorded and fails the whole fan-out
     */
    Collection<? extends R> run(RequestContext ctx, T item) throws Exception;
  }

  /** A unit of work in a {@link #runAll} call, usually writing its own {@link ResultSlot}. */
  @FunctionalInterface
  public interface Step {
    /**
     * Runs the step.
     *
     * @param ctx the shared context of the fan-out
     * @throws Exception on failure; the failure is recorded and fails the whole fan-out
     */
    void run(RequestContext ctx) throws Exception;
  }

  /**
   * Creates a fan-out runner.
   *
   * @param executor the executor running the tasks
   * @param policy what to do with siblings after a failure
   */
  public FanOut(ExecutorService executor, FanOutPolicy policy) {
    if (executor == null) {
      throw new IllegalArgumentException("executor cannot be null");
    }
    this.executor = executor;
    this.policy = policy != null ? policy : FanOutPolicy.RUN_TO_COMPLETION;
  }

  /**
   * Returns the policy applied after a branch failure.
   *
   * @return the policy
   */
  public FanOutPolicy getPolicy() {
    return policy;
  }

  /**
   * Applies the branch to every item concurrently and merges the partial results.
   *
   * @param ctx the request context
   * @param items the work items; an empty collection returns an empty list without running anything
   * @param branch the per-item work
   * @param <T> the item type
   * @param <R> the result element type
   * @return all partial results, in no particular order
   * @throws AdminException the combined failure if any branch failed
   */
  public <T, R> List<R> gather(
      RequestContext ctx, Collection<? extends T> items, Branch<T, R> branch)
      throws AdminException {
    List<R> results = new ArrayList<>();
    Object lock = new Object();
    List<Step> steps = new ArrayList<>(items.size());
    for (T item : items) {
      steps.add(
          scope -> {
            Collection<? extends R> partial = branch.run(scope, item);
            if (partial == null || partial.isEmpty()) {
              return;
            }
            synchronized (lock) {
              results.addAll(partial);
            }
          });
    }
    runAll(ctx, steps);
    return results;
  }

  /**
   * Runs every step concurrently and waits for all of them.
   *
   * @param ctx the request context
   * @param steps the steps to run
   * @throws AdminException the combined failure if any step failed, or {@link
   *     RequestCancelledException} if the request was already done or the calling thread was
   *     interrupted
   */
  public void runAll(RequestContext ctx, List<? extends Step> steps) throws AdminException {
    if (steps.isEmpty()) {
      return;
    }
    ctx.checkActive();

    ErrorRecorder errors = new ErrorRecorder();
    AtomicBoolean failed = new AtomicBoolean(false);
    CountDownLatch done = new CountDownLatch(steps.size());
    List<StepTask> tasks = new ArrayList<>(steps.size());

    try (RequestContext scope = ctx.newChild()) {
      for (Step step : steps) {
        tasks.add(new StepTask(step, scope, errors, failed, done));
      }
      Runnable interruptAll =
          () -> {
            for (StepTask task : tasks) {
              task.interrupt();
            }
          };
      scope.addCancelListener(interruptAll);

      for (StepTask task : tasks) {
        try {
          executor.execute(task);
        } catch (RejectedExecutionException e) {
          task.reject(e);
        }
      }

      boolean deadlineExceeded = false;
      try {
        if (scope.hasDeadline()) {
          if (!done.await(scope.remaining(TimeUnit.NANOSECONDS), TimeUnit.NANOSECONDS)) {
            deadlineExceeded = true;
            logger.log(Level.FINE, "Deadline exceeded, cancelling outstanding fan-out tasks");
            scope.cancel();
            done.await();
          }
        } else {
          done.await();
        }
      } catch (InterruptedException e) {
        scope.cancel();
        awaitUninterruptibly(done);
        Thread.currentThread().interrupt();
        throw new RequestCancelledException(false);
      } finally {
        scope.removeCancelListener(interruptAll);
      }

      if (deadlineExceeded && !hasCancellation(errors)) {
        errors.record(new RequestCancelledException(true));
      }
    }

    if (errors.hasErrors()) {
      throw errors.toException();
    }
  }

  private static boolean hasCancellation(ErrorRecorder errors) {
    for (Throwable error : errors.getErrors()) {
      if (error instanceof RequestCancelledException) {
        return true;
      }
    }
    return false;
  }

  private static void awaitUninterruptibly(CountDownLatch latch) {
    boolean interrupted = false;
    while (true) {
      try {
        latch.await();
        break;
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  /** Runs one step and always releases the barrier, whatever happens to the step. */
  private final class StepTask implements Runnable {
    private final Step step;
    private final RequestContext scope;
    private final ErrorRecorder errors;
    private final AtomicBoolean failed;
    private final CountDownLatch done;
    private Thread runner;

    StepTask(
        Step step,
        RequestContext scope,
        ErrorRecorder errors,
        AtomicBoolean failed,
        CountDownLatch done) {
      this.step = step;
      this.scope = scope;
      this.errors = errors;
      this.failed = failed;
      this.done = done;
    }

    @Override
    public void run() {
      synchronized (this) {
        runner = Thread.currentThread();
      }
      try {
        scope.checkActive();
        step.run(scope);
      } catch (InterruptedException e) {
        fail(new RequestCancelledException(scope.isDeadlineExceeded()));
      } catch (Exception e) {
        fail(e);
      } finally {
        synchronized (this) {
          runner = null;
        }
        // An interrupt aimed at this step must not leak into the next task on this thread.
        Thread.interrupted();
        done.countDown();
      }
    }

    void reject(RejectedExecutionException e) {
      fail(e);
      done.countDown();
    }

    synchronized void interrupt() {
      if (runner != null) {
        runner.interrupt();
      }
    }

    private void fail(Exception e) {
      boolean first = failed.compareAndSet(false, true);
      if (policy == FanOutPolicy.FAIL_FAST) {
        if (!first) {
          logger.log(Level.FINE, "Dropping failure after fail-fast cancellation: " + e);
          return;
        }
        errors.record(e);
        scope.cancel();
        return;
      }
      logger.log(Level.FINE, "Fan-out branch failed: " + e);
      errors.record(e);
    }
  }
}
