package com.scylladb.admin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Schema of the database served by one tablet, as returned by the control plane. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TabletSchema {
  private final String databaseSchema;
  private final List<TableDefinition> tableDefinitions;

  @JsonCreator
  public TabletSchema(
      @JsonProperty("databaseSchema") String databaseSchema,
      @JsonProperty("tableDefinitions") List<TableDefinition> tableDefinitions) {
    this.databaseSchema = databaseSchema;
    this.tableDefinitions =
        tableDefinitions != null
            ? Collections.unmodifiableList(new ArrayList<>(tableDefinitions))
            : Collections.<TableDefinition>emptyList();
  }

  @JsonProperty("databaseSchema")
  public String getDatabaseSchema() {
    return databaseSchema;
  }

  /**
   * Returns the table definitions in the order the tablet reported them.
   *
   * @return unmodifiable list, empty when the database has no tables
   */
  @JsonProperty("tableDefinitions")
  public List<TableDefinition> getTableDefinitions() {
    return tableDefinitions;
  }

  @Override
  public String toString() {
    return "TabletSchema{tables=" + tableDefinitions.size() + "}";
  }
}
