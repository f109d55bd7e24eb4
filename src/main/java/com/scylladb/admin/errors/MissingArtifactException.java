package com.scylladb.admin.errors;

/** Thrown when a remote response lacks an entry the caller needs, such as a keyspace key. */
public class MissingArtifactException extends AdminException {
  private final String artifact;

  /**
   * Constructs a new MissingArtifactException.
   *
   * @param artifact the kind of artifact that is missing, e.g. {@code "SrvVSchema"}
   * @param detail what was looked for, e.g. {@code "keyspace commerce"}
   */
  public MissingArtifactException(String artifact, String detail) {
    super(ErrorKind.MISSING_ARTIFACT, artifact + " not found: " + detail);
    this.artifact = artifact;
  }

  /**
   * Returns the kind of artifact that is missing.
   *
   * @return the artifact name
   */
  public String getArtifact() {
    return artifact;
  }
}
