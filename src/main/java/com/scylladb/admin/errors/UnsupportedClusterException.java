package com.scylladb.admin.errors;

/** Thrown when a single-cluster operation names a cluster id that is not configured. */
public class UnsupportedClusterException extends AdminException {
  private final String clusterId;

  /**
   * Constructs a new UnsupportedClusterException.
   *
   * @param clusterId the unknown cluster id
   */
  public UnsupportedClusterException(String clusterId) {
    super(ErrorKind.UNSUPPORTED_CLUSTER, "unsupported cluster: " + clusterId);
    this.clusterId = clusterId;
  }

  /**
   * Returns the cluster id that was requested.
   *
   * @return the unknown cluster id
   */
  public String getClusterId() {
    return clusterId;
  }
}
