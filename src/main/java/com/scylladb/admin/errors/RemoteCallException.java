package com.scylladb.admin.errors;

/**
 * Thrown by remote cluster clients when a call fails in transport or is answered with an error.
 *
 * @since 1.0.0
 */
public class RemoteCallException extends AdminException {
  /** Status value used when the failure happened before any response was received. */
  public static final int NO_STATUS = -1;

  private final String operation;
  private final int status;

  /**
   * Constructs a new RemoteCallException for an error response.
   *
   * @param operation the remote operation, e.g. {@code "GET http://host/keyspaces"}
   * @param status the response status code
   * @param message the detail message
   */
  public RemoteCallException(String operation, int status, String message) {
    super(ErrorKind.REMOTE, operation + " failed with status " + status + ": " + message);
    this.operation = operation;
    this.status = status;
  }

  /**
   * Constructs a new RemoteCallException for a transport failure.
   *
   * @param operation the remote operation
   * @param cause the underlying failure
   */
  public RemoteCallException(String operation, Throwable cause) {
    super(ErrorKind.REMOTE, operation + " failed: " + cause.getMessage(), cause);
    this.operation = operation;
    this.status = NO_STATUS;
  }

  /**
   * Returns the remote operation that failed.
   *
   * @return operation description
   */
  public String getOperation() {
    return operation;
  }

  /**
   * Returns the response status, or {@link #NO_STATUS} when no response was received.
   *
   * @return the status code
   */
  public int getStatus() {
    return status;
  }
}
