package com.scylladb.admin.errors;

/** Thrown when a required request field is missing. One instance names one field. */
public class InvalidRequestException extends AdminException {
  /** Prefix shared by every invalid request message. */
  public static final String PREFIX = "Invalid request";

  /**
   * Constructs a new InvalidRequestException.
   *
   * @param reason what is wrong with the request, e.g. {@code "SQL query is required"}
   */
  public InvalidRequestException(String reason) {
    super(ErrorKind.INVALID_REQUEST, PREFIX + ": " + reason);
  }
}
