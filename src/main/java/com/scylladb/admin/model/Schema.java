package com.scylladb.admin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated schema of one keyspace in one cluster.
 *
 * <p>Only produced for keyspaces with at least one table definition.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Schema {
  private final ClusterInfo cluster;
  private final String keyspace;
  private final List<TableDefinition> tableDefinitions;

  @JsonCreator
  public Schema(
      @JsonProperty("cluster") ClusterInfo cluster,
      @JsonProperty("keyspace") String keyspace,
      @JsonProperty("tableDefinitions") List<TableDefinition> tableDefinitions) {
    this.cluster = cluster;
    this.keyspace = keyspace;
    this.tableDefinitions =
        tableDefinitions != null
            ? Collections.unmodifiableList(new ArrayList<>(tableDefinitions))
            : Collections.<TableDefinition>emptyList();
  }

  @JsonProperty("cluster")
  public ClusterInfo getCluster() {
    return cluster;
  }

  @JsonProperty("keyspace")
  public String getKeyspace() {
    return keyspace;
  }

  @JsonProperty("tableDefinitions")
  public List<TableDefinition> getTableDefinitions() {
    return tableDefinitions;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Schema)) {
      return false;
    }
    Schema other = (Schema) obj;
    return Objects.equals(cluster, other.cluster)
        && Objects.equals(keyspace, other.keyspace)
        && tableDefinitions.equals(other.tableDefinitions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(cluster, keyspace, tableDefinitions);
  }

  @Override
  public String toString() {
    return "Schema{cluster="
        + cluster
        + ", keyspace='"
        + keyspace
        + "', tables="
        + tableDefinitions.size()
        + "}";
  }
}
