package com.scylladb.admin.errors;

/**
 * Classifies every failure surfaced by the admin API so that callers can branch on the kind of
 * failure instead of parsing messages.
 *
 * @since 1.0.0
 */
public enum ErrorKind {
  /** A required request field was missing or malformed. */
  INVALID_REQUEST,
  /** A single-cluster operation named a cluster id that is not configured. */
  UNSUPPORTED_CLUSTER,
  /** A unique-result lookup matched nothing. */
  NOT_FOUND,
  /** A unique-result lookup matched more than one item. */
  AMBIGUOUS,
  /** A remote response was missing an expected entry. */
  MISSING_ARTIFACT,
  /** A remote call failed, or the explain engine rejected its input. */
  REMOTE,
  /** One or more branches of a concurrent fan-out failed. */
  AGGREGATE,
  /** The request was cancelled or its deadline passed. */
  CANCELLED
}
