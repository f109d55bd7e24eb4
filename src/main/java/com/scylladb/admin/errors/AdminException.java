package com.scylladb.admin.errors;

/**
 * Base class of every failure returned by the admin API.
 *
 * <p>Each subclass reports a fixed {@link ErrorKind}, so callers can distinguish an absent tablet
 * from an ambiguous one, or a bad request from a remote failure, without looking at the message.
 *
 * @since 1.0.0
 */
public abstract class AdminException extends Exception {
  private final ErrorKind kind;

  /**
   * Constructs a new AdminException.
   *
   * @param kind the failure classification
   * @param message the detail message
   */
  protected AdminException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  /**
   * Constructs a new AdminException with a cause.
   *
   * @param kind the failure classification
   * @param message the detail message
   * @param cause the underlying failure
   */
  protected AdminException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /**
   * Returns the classification of this failure.
   *
   * @return the error kind, never null
   */
  public ErrorKind getKind() {
    return kind;
  }
}
