package com.scylladb.admin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Globally unique tablet identity: the cell it lives in plus a numeric uid.
 *
 * <p>The string form is {@code <cell>-<uid>} with the uid zero padded to ten digits, for example
 * {@code zone1-0000000100}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TabletAlias {
  private final String cell;
  private final long uid;

  @JsonCreator
  public TabletAlias(@JsonProperty("cell") String cell, @JsonProperty("uid") long uid) {
    if (cell == null || cell.isEmpty()) {
      throw new IllegalArgumentException("cell cannot be null or empty");
    }
    if (uid < 0) {
      throw new IllegalArgumentException("uid must be non-negative, but was: " + uid);
    }
    this.cell = cell;
    this.uid = uid;
  }

  /**
   * Parses the {@code <cell>-<uid>} form. The cell may itself contain dashes; the uid is taken
   * after the last one.
   *
   * @param alias the string form
   * @return the parsed alias
   * @throws IllegalArgumentException if the string is malformed
   */
  public static TabletAlias parse(String alias) {
    if (alias == null) {
      throw new IllegalArgumentException("alias cannot be null");
    }
    int dash = alias.lastIndexOf('-');
    if (dash <= 0 || dash == alias.length() - 1) {
      throw new IllegalArgumentException("invalid tablet alias: " + alias);
    }
    try {
      return new TabletAlias(alias.substring(0, dash), Long.parseLong(alias.substring(dash + 1)));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid tablet alias: " + alias, e);
    }
  }

  @JsonProperty("cell")
  public String getCell() {
    return cell;
  }

  @JsonProperty("uid")
  public long getUid() {
    return uid;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TabletAlias)) {
      return false;
    }
    TabletAlias other = (TabletAlias) obj;
    return uid == other.uid && cell.equals(other.cell);
  }

  @Override
  public int hashCode() {
    return Objects.hash(cell, uid);
  }

  @Override
  public String toString() {
    return String.format("%s-%010d", cell, uid);
  }
}
