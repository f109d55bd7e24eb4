package com.scylladb.admin.errors;

/** Thrown when a request is cancelled by its caller or runs past its deadline. */
public class RequestCancelledException extends AdminException {
  private final boolean deadlineExceeded;

  /**
   * Constructs a new RequestCancelledException.
   *
   * @param deadlineExceeded true if the deadline passed, false for an explicit cancellation
   */
  public RequestCancelledException(boolean deadlineExceeded) {
    super(ErrorKind.CANCELLED, deadlineExceeded ? "deadline exceeded" : "request cancelled");
    this.deadlineExceeded = deadlineExceeded;
  }

  /**
   * Returns whether the request ran out of time rather than being cancelled.
   *
   * @return true if the deadline passed
   */
  public boolean isDeadlineExceeded() {
    return deadlineExceeded;
  }
}
