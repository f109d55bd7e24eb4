package com.scylladb.admin.internal;

import com.scylladb.admin.errors.AggregateException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects failures from concurrent branches of a fan-out.
 *
 * <p>Failures are kept in recording order. An {@link AggregateException} recorded here is
 * flattened into its individual causes, so nested fan-outs surface their leaf failures exactly like
 * direct ones. Once an error is recorded the recorder stays in the failed state.
 *
 * <p>Thread-safe.
 *
 * @since 1.0.0
 */
public final class ErrorRecorder {
  private final List<Throwable> errors = new ArrayList<>();

  /**
   * Records a failure.
   *
   * @param error the failure; ignored if null
   */
  public void record(Throwable error) {
    if (error == null) {
      return;
    }
    synchronized (errors) {
      if (error instanceof AggregateException) {
        errors.addAll(((AggregateException) error).getErrors());
      } else {
        errors.add(error);
      }
    }
  }

  /**
   * Returns whether any failure was recorded.
   *
   * @return true if at least one failure was recorded
   */
  public boolean hasErrors() {
    synchronized (errors) {
      return !errors.isEmpty();
    }
  }

  /**
   * Returns a snapshot of the recorded failures.
   *
   * @return unmodifiable list of failures in recording order
   */
  public List<Throwable> getErrors() {
    synchronized (errors) {
      return Collections.unmodifiableList(new ArrayList<>(errors));
    }
  }

  /**
   * Combines the recorded failures into one exception.
   *
   * @return the combined failure
   * @throws IllegalStateException if nothing was recorded
   */
  public AggregateException toException() {
    List<Throwable> snapshot = getErrors();
    if (snapshot.isEmpty()) {
      throw new IllegalStateException("no errors recorded");
    }
    return new AggregateException(snapshot);
  }
}
