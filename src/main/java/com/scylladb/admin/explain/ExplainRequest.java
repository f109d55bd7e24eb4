package com.scylladb.admin.explain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/** A query to explain against the routing metadata of one keyspace in one cluster. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ExplainRequest {
  private final String cluster;
  private final String keyspace;
  private final String sql;

  @JsonCreator
  public ExplainRequest(
      @JsonProperty("cluster") String cluster,
      @JsonProperty("keyspace") String keyspace,
      @JsonProperty("sql") String sql) {
    this.cluster = cluster;
    this.keyspace = keyspace;
    this.sql = sql;
  }

  @JsonProperty("cluster")
  public String getCluster() {
    return cluster;
  }

  @JsonProperty("keyspace")
  public String getKeyspace() {
    return keyspace;
  }

  @JsonProperty("sql")
  public String getSql() {
    return sql;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ExplainRequest)) {
      return false;
    }
    ExplainRequest other = (ExplainRequest) obj;
    return Objects.equals(cluster, other.cluster)
        && Objects.equals(keyspace, other.keyspace)
        && Objects.equals(sql, other.sql);
  }

  @Override
  public int hashCode() {
    return Objects.hash(cluster, keyspace, sql);
  }

  @Override
  public String toString() {
    return "ExplainRequest{cluster='"
        + cluster
        + "', keyspace='"
        + keyspace
        + "', sql='"
        + sql
        + "'}";
  }
}
