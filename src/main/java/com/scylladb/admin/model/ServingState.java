package com.scylladb.admin.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/** Whether a tablet currently answers queries. */
public enum ServingState {
  SERVING,
  NOT_SERVING,
  @JsonEnumDefaultValue
  UNKNOWN
}
