package com.scylladb.admin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Detached reference to a cluster, carried by every aggregated item.
 *
 * <p>Holds only the id and display name, so results stay valid independently of the cluster
 * objects and clients that produced them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ClusterInfo {
  private final String id;
  private final String name;

  @JsonCreator
  public ClusterInfo(@JsonProperty("id") String id, @JsonProperty("name") String name) {
    this.id = id;
    this.name = name;
  }

  @JsonProperty("id")
  public String getId() {
    return id;
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ClusterInfo)) {
      return false;
    }
    ClusterInfo other = (ClusterInfo) obj;
    return Objects.equals(id, other.id) && Objects.equals(name, other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, name);
  }

  @Override
  public String toString() {
    return "ClusterInfo{id='" + id + "', name='" + name + "'}";
  }
}
