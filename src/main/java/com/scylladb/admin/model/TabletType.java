package com.scylladb.admin.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/** Role of a tablet within its shard. */
public enum TabletType {
  PRIMARY,
  REPLICA,
  RDONLY,
  BATCH,
  SPARE,
  EXPERIMENTAL,
  BACKUP,
  RESTORE,
  DRAINED,
  @JsonEnumDefaultValue
  UNKNOWN;

  /**
   * Returns whether tablets of this type take part in the serving graph, i.e. can be routed
   * queries by a gateway.
   *
   * @return true for primary, replica, read-only and batch tablets
   */
  public boolean isInServingGraph() {
    switch (this) {
      case PRIMARY:
      case REPLICA:
      case RDONLY:
      case BATCH:
        return true;
      default:
        return false;
    }
  }
}
