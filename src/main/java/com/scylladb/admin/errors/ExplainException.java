package com.scylladb.admin.errors;

/** Thrown by an explain engine that cannot load its input or plan a query. */
public class ExplainException extends AdminException {
  /**
   * Constructs a new ExplainException.
   *
   * @param message the detail message
   */
  public ExplainException(String message) {
    super(ErrorKind.REMOTE, message);
  }

  /**
   * Constructs a new ExplainException with a cause.
   *
   * @param message the detail message
   * @param cause the underlying failure
   */
  public ExplainException(String message, Throwable cause) {
    super(ErrorKind.REMOTE, message, cause);
  }
}
