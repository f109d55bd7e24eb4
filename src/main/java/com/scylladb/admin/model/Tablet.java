package com.scylladb.admin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/** A tablet (one database node of a shard) together with its reported serving state. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Tablet {
  private final ClusterInfo cluster;
  private final String hostname;
  private final String keyspace;
  private final String shard;
  private final TabletType type;
  private final TabletAlias alias;
  private final ServingState state;

  @JsonCreator
  public Tablet(
      @JsonProperty("cluster") ClusterInfo cluster,
      @JsonProperty("hostname") String hostname,
      @JsonProperty("keyspace") String keyspace,
      @JsonProperty("shard") String shard,
      @JsonProperty("type") TabletType type,
      @JsonProperty("alias") TabletAlias alias,
      @JsonProperty("state") ServingState state) {
    this.cluster = cluster;
    this.hostname = hostname;
    this.keyspace = keyspace;
    this.shard = shard;
    this.type = type != null ? type : TabletType.UNKNOWN;
    this.alias = alias;
    this.state = state != null ? state : ServingState.UNKNOWN;
  }

  /**
   * Returns a copy of this tablet attributed to the given cluster.
   *
   * @param cluster the owning cluster
   * @return a new tablet
   */
  public Tablet withCluster(ClusterInfo cluster) {
    return new Tablet(cluster, hostname, keyspace, shard, type, alias, state);
  }

  /**
   * Returns whether the tablet reports itself as serving.
   *
   * @return true if the state is {@link ServingState#SERVING}
   */
  @JsonIgnore
  public boolean isServing() {
    return state == ServingState.SERVING;
  }

  @JsonProperty("cluster")
  public ClusterInfo getCluster() {
    return cluster;
  }

  @JsonProperty("hostname")
  public String getHostname() {
    return hostname;
  }

  @JsonProperty("keyspace")
  public String getKeyspace() {
    return keyspace;
  }

  @JsonProperty("shard")
  public String getShard() {
    return shard;
  }

  @JsonProperty("type")
  public TabletType getType() {
    return type;
  }

  @JsonProperty("alias")
  public TabletAlias getAlias() {
    return alias;
  }

  @JsonProperty("state")
  public ServingState getState() {
    return state;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Tablet)) {
      return false;
    }
    Tablet other = (Tablet) obj;
    return Objects.equals(cluster, other.cluster)
        && Objects.equals(hostname, other.hostname)
        && Objects.equals(keyspace, other.keyspace)
        && Objects.equals(shard, other.shard)
        && type == other.type
        && Objects.equals(alias, other.alias)
        && state == other.state;
  }

  @Override
  public int hashCode() {
    return Objects.hash(cluster, hostname, keyspace, shard, type, alias, state);
  }

  @Override
  public String toString() {
    return "Tablet{alias="
        + alias
        + ", hostname='"
        + hostname
        + "', keyspace='"
        + keyspace
        + "', shard='"
        + shard
        + "', type="
        + type
        + ", state="
        + state
        + "}";
  }
}
