package com.scylladb.admin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/** Hex encoded key range of a shard. Empty bounds mean unbounded. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class KeyRange {
  private final String start;
  private final String end;

  @JsonCreator
  public KeyRange(@JsonProperty("start") String start, @JsonProperty("end") String end) {
    this.start = start != null ? start : "";
    this.end = end != null ? end : "";
  }

  @JsonProperty("start")
  public String getStart() {
    return start;
  }

  @JsonProperty("end")
  public String getEnd() {
    return end;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof KeyRange)) {
      return false;
    }
    KeyRange other = (KeyRange) obj;
    return start.equals(other.start) && end.equals(other.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return start + "-" + end;
  }
}
