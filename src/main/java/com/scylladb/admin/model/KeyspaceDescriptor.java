package com.scylladb.admin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/** Keyspace record as reported by a cluster's control plane. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class KeyspaceDescriptor {
  private final String name;
  private final String keyspaceType;
  private final String shardingColumnName;
  private final String shardingColumnType;
  private final String durabilityPolicy;

  @JsonCreator
  public KeyspaceDescriptor(
      @JsonProperty("name") String name,
      @JsonProperty("keyspaceType") String keyspaceType,
      @JsonProperty("shardingColumnName") String shardingColumnName,
      @JsonProperty("shardingColumnType") String shardingColumnType,
      @JsonProperty("durabilityPolicy") String durabilityPolicy) {
    this.name = name;
    this.keyspaceType = keyspaceType;
    this.shardingColumnName = shardingColumnName;
    this.shardingColumnType = shardingColumnType;
    this.durabilityPolicy = durabilityPolicy;
  }

  /**
   * Creates a descriptor carrying only a name.
   *
   * @param name the keyspace name
   * @return a new descriptor
   */
  public static KeyspaceDescriptor named(String name) {
    return new KeyspaceDescriptor(name, null, null, null, null);
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("keyspaceType")
  public String getKeyspaceType() {
    return keyspaceType;
  }

  @JsonProperty("shardingColumnName")
  public String getShardingColumnName() {
    return shardingColumnName;
  }

  @JsonProperty("shardingColumnType")
  public String getShardingColumnType() {
    return shardingColumnType;
  }

  @JsonProperty("durabilityPolicy")
  public String getDurabilityPolicy() {
    return durabilityPolicy;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof KeyspaceDescriptor)) {
      return false;
    }
    KeyspaceDescriptor other = (KeyspaceDescriptor) obj;
    return Objects.equals(name, other.name)
        && Objects.equals(keyspaceType, other.keyspaceType)
        && Objects.equals(shardingColumnName, other.shardingColumnName)
        && Objects.equals(shardingColumnType, other.shardingColumnType)
        && Objects.equals(durabilityPolicy, other.durabilityPolicy);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        name, keyspaceType, shardingColumnName, shardingColumnType, durabilityPolicy);
  }

  @Override
  public String toString() {
    return "KeyspaceDescriptor{name='" + name + "', keyspaceType='" + keyspaceType + "'}";
  }
}
