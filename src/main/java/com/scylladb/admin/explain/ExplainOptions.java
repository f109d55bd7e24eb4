package com.scylladb.admin.explain;

/**
 * Options handed to {@link ExplainEngine#init}.
 *
 * <p>Example:
 *
 * <pre>{@code
 * ExplainOptions options = ExplainOptions.builder().withNormalize(true).build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ExplainOptions {
  /** Default replication mode. */
  public static final String DEFAULT_REPLICATION_MODE = "ROW";

  private final String replicationMode;
  private final boolean normalize;
  private final boolean strictDdl;

  private ExplainOptions(Builder builder) {
    this.replicationMode = builder.replicationMode;
    this.normalize = builder.normalize;
    this.strictDdl = builder.strictDdl;
  }

  /**
   * Returns options with every default.
   *
   * @return default options
   */
  public static ExplainOptions defaults() {
    return builder().build();
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the binary log replication mode the planner assumes, {@code ROW} or {@code STATEMENT}.
   *
   * @return the replication mode
   */
  public String getReplicationMode() {
    return replicationMode;
  }

  /**
   * Returns whether literals are normalized into bind variables before planning.
   *
   * @return true to normalize
   */
  public boolean isNormalize() {
    return normalize;
  }

  /**
   * Returns whether schema DDL the planner cannot parse is an error rather than ignored.
   *
   * @return true for strict DDL parsing
   */
  public boolean isStrictDdl() {
    return strictDdl;
  }

  @Override
  public String toString() {
    return "ExplainOptions{replicationMode="
        + replicationMode
        + ", normalize="
        + normalize
        + ", strictDdl="
        + strictDdl
        + "}";
  }

  /** Builder for {@link ExplainOptions}. */
  public static final class Builder {
    private String replicationMode = DEFAULT_REPLICATION_MODE;
    private boolean normalize = false;
    private boolean strictDdl = false;

    private Builder() {}

    /**
     * Sets the replication mode.
     *
     * <p>Default: {@link ExplainOptions#DEFAULT_REPLICATION_MODE}
     *
     * @param replicationMode {@code ROW} or {@code STATEMENT}
     * @return this builder instance
     */
    public Builder withReplicationMode(String replicationMode) {
      this.replicationMode = replicationMode;
      return this;
    }

    /**
     * Sets whether literals are normalized.
     *
     * @param normalize true to normalize
     * @return this builder instance
     */
    public Builder withNormalize(boolean normalize) {
      this.normalize = normalize;
      return this;
    }

    /**
     * Sets strict DDL parsing.
     *
     * @param strictDdl true for strict parsing
     * @return this builder instance
     */
    public Builder withStrictDdl(boolean strictDdl) {
      this.strictDdl = strictDdl;
      return this;
    }

    /**
     * Builds and returns an {@link ExplainOptions} instance.
     *
     * @return a new {@link ExplainOptions} instance
     * @throws IllegalArgumentException if the replication mode is not {@code ROW} or {@code
     *     STATEMENT}
     */
    public ExplainOptions build() {
      if (!"ROW".equals(replicationMode) && !"STATEMENT".equals(replicationMode)) {
        throw new IllegalArgumentException(
            "replicationMode must be ROW or STATEMENT, but was: " + replicationMode);
      }
      return new ExplainOptions(this);
    }
  }
}
