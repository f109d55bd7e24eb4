package com.scylladb.admin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Aggregated view of a keyspace: the owning cluster, the keyspace record and its shards. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Keyspace {
  private final ClusterInfo cluster;
  private final KeyspaceDescriptor keyspace;
  private final List<Shard> shards;

  @JsonCreator
  public Keyspace(
      @JsonProperty("cluster") ClusterInfo cluster,
      @JsonProperty("keyspace") KeyspaceDescriptor keyspace,
      @JsonProperty("shards") List<Shard> shards) {
    this.cluster = cluster;
    this.keyspace = keyspace;
    this.shards =
        shards != null
            ? Collections.unmodifiableList(new ArrayList<>(shards))
            : Collections.<Shard>emptyList();
  }

  @JsonProperty("cluster")
  public ClusterInfo getCluster() {
    return cluster;
  }

  @JsonProperty("keyspace")
  public KeyspaceDescriptor getKeyspace() {
    return keyspace;
  }

  @JsonProperty("shards")
  public List<Shard> getShards() {
    return shards;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Keyspace)) {
      return false;
    }
    Keyspace other = (Keyspace) obj;
    return Objects.equals(cluster, other.cluster)
        && Objects.equals(keyspace, other.keyspace)
        && shards.equals(other.shards);
  }

  @Override
  public int hashCode() {
    return Objects.hash(cluster, keyspace, shards);
  }

  @Override
  public String toString() {
    return "Keyspace{cluster=" + cluster + ", keyspace=" + keyspace + ", shards=" + shards + "}";
  }
}
