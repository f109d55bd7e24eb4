package com.scylladb.admin.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single failure standing for every failure observed across the branches of one fan-out.
 *
 * <p>The message joins the messages of all causes with {@code "; "}. Each cause is also attached
 * as a suppressed exception so that stack traces are preserved in logs.
 *
 * @since 1.0.0
 */
public class AggregateException extends AdminException {
  private final List<Throwable> errors;

  /**
   * Constructs a new AggregateException.
   *
   * @param errors the individual failures, in the order they were recorded; must not be empty
   */
  public AggregateException(List<? extends Throwable> errors) {
    super(ErrorKind.AGGREGATE, joinMessages(errors));
    if (errors.isEmpty()) {
      throw new IllegalArgumentException("errors cannot be empty");
    }
    this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    for (Throwable error : this.errors) {
      addSuppressed(error);
    }
  }

  /**
   * Returns the individual failures.
   *
   * @return unmodifiable list of failures, never empty
   */
  public List<Throwable> getErrors() {
    return errors;
  }

  /**
   * Returns whether any of the individual failures is of the given kind.
   *
   * @param kind the kind to look for
   * @return true if at least one cause is an {@link AdminException} of that kind
   */
  public boolean hasErrorOfKind(ErrorKind kind) {
    for (Throwable error : errors) {
      if (error instanceof AdminException && ((AdminException) error).getKind() == kind) {
        return true;
      }
    }
    return false;
  }

  private static String joinMessages(List<? extends Throwable> errors) {
    List<String> messages = new ArrayList<>(errors.size());
    for (Throwable error : errors) {
      messages.add(String.valueOf(error.getMessage()));
    }
    return String.join("; ", messages);
  }
}
