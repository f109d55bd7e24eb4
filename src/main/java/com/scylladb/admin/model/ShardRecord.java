package com.scylladb.admin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/** Topology record of one shard: its primary, key range and serving flag. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ShardRecord {
  private final TabletAlias primaryAlias;
  private final KeyRange keyRange;
  private final boolean primaryServing;

  @JsonCreator
  public ShardRecord(
      @JsonProperty("primaryAlias") TabletAlias primaryAlias,
      @JsonProperty("keyRange") KeyRange keyRange,
      @JsonProperty("isPrimaryServing") boolean primaryServing) {
    this.primaryAlias = primaryAlias;
    this.keyRange = keyRange;
    this.primaryServing = primaryServing;
  }

  @JsonProperty("primaryAlias")
  public TabletAlias getPrimaryAlias() {
    return primaryAlias;
  }

  @JsonProperty("keyRange")
  public KeyRange getKeyRange() {
    return keyRange;
  }

  @JsonProperty("isPrimaryServing")
  public boolean isPrimaryServing() {
    return primaryServing;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ShardRecord)) {
      return false;
    }
    ShardRecord other = (ShardRecord) obj;
    return primaryServing == other.primaryServing
        && Objects.equals(primaryAlias, other.primaryAlias)
        && Objects.equals(keyRange, other.keyRange);
  }

  @Override
  public int hashCode() {
    return Objects.hash(primaryAlias, keyRange, primaryServing);
  }

  @Override
  public String toString() {
    return "ShardRecord{primaryAlias="
        + primaryAlias
        + ", keyRange="
        + keyRange
        + ", primaryServing="
        + primaryServing
        + "}";
  }
}
