package com.scylladb.admin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** A query gateway found through a cluster's discovery endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Gate {
  private final String cell;
  private final String hostname;
  private final List<String> keyspaces;
  private final String pool;
  private final ClusterInfo cluster;

  @JsonCreator
  public Gate(
      @JsonProperty("cell") String cell,
      @JsonProperty("hostname") String hostname,
      @JsonProperty("keyspaces") List<String> keyspaces,
      @JsonProperty("pool") String pool,
      @JsonProperty("cluster") ClusterInfo cluster) {
    this.cell = cell;
    this.hostname = hostname;
    this.keyspaces =
        keyspaces != null
            ? Collections.unmodifiableList(new ArrayList<>(keyspaces))
            : Collections.<String>emptyList();
    this.pool = pool;
    this.cluster = cluster;
  }

  /**
   * Returns a copy of this gate attributed to the given cluster.
   *
   * @param cluster the owning cluster
   * @return a new gate
   */
  public Gate withCluster(ClusterInfo cluster) {
    return new Gate(cell, hostname, keyspaces, pool, cluster);
  }

  @JsonProperty("cell")
  public String getCell() {
    return cell;
  }

  @JsonProperty("hostname")
  public String getHostname() {
    return hostname;
  }

  @JsonProperty("keyspaces")
  public List<String> getKeyspaces() {
    return keyspaces;
  }

  @JsonProperty("pool")
  public String getPool() {
    return pool;
  }

  @JsonProperty("cluster")
  public ClusterInfo getCluster() {
    return cluster;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Gate)) {
      return false;
    }
    Gate other = (Gate) obj;
    return Objects.equals(cell, other.cell)
        && Objects.equals(hostname, other.hostname)
        && keyspaces.equals(other.keyspaces)
        && Objects.equals(pool, other.pool)
        && Objects.equals(cluster, other.cluster);
  }

  @Override
  public int hashCode() {
    return Objects.hash(cell, hostname, keyspaces, pool, cluster);
  }

  @Override
  public String toString() {
    return "Gate{hostname='"
        + hostname
        + "', cell='"
        + cell
        + "', pool='"
        + pool
        + "', keyspaces="
        + keyspaces
        + ", cluster="
        + cluster
        + "}";
  }
}
