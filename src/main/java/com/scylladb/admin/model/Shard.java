package com.scylladb.admin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/** A shard of a keyspace, as returned by the control plane's shard listing. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Shard {
  private final String keyspace;
  private final String name;
  private final ShardRecord shard;

  @JsonCreator
  public Shard(
      @JsonProperty("keyspace") String keyspace,
      @JsonProperty("name") String name,
      @JsonProperty("shard") ShardRecord shard) {
    this.keyspace = keyspace;
    this.name = name;
    this.shard = shard;
  }

  @JsonProperty("keyspace")
  public String getKeyspace() {
    return keyspace;
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("shard")
  public ShardRecord getShard() {
    return shard;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Shard)) {
      return false;
    }
    Shard other = (Shard) obj;
    return Objects.equals(keyspace, other.keyspace)
        && Objects.equals(name, other.name)
        && Objects.equals(shard, other.shard);
  }

  @Override
  public int hashCode() {
    return Objects.hash(keyspace, name, shard);
  }

  @Override
  public String toString() {
    return "Shard{" + keyspace + "/" + name + "}";
  }
}
