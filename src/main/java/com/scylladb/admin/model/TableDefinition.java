package com.scylladb.admin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** One table of a tablet's schema. {@link #getSchema()} holds the CREATE statement. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TableDefinition {
  private final String name;
  private final String schema;
  private final List<String> columns;
  private final List<String> primaryKeyColumns;
  private final String type;
  private final long dataLength;
  private final long rowCount;

  @JsonCreator
  public TableDefinition(
      @JsonProperty("name") String name,
      @JsonProperty("schema") String schema,
      @JsonProperty("columns") List<String> columns,
      @JsonProperty("primaryKeyColumns") List<String> primaryKeyColumns,
      @JsonProperty("type") String type,
      @JsonProperty("dataLength") long dataLength,
      @JsonProperty("rowCount") long rowCount) {
    this.name = name;
    this.schema = schema;
    this.columns = copyOf(columns);
    this.primaryKeyColumns = copyOf(primaryKeyColumns);
    this.type = type;
    this.dataLength = dataLength;
    this.rowCount = rowCount;
  }

  /**
   * Creates a definition with only a name and its DDL.
   *
   * @param name the table name
   * @param schema the CREATE statement
   * @return a new definition
   */
  public static TableDefinition of(String name, String schema) {
    return new TableDefinition(name, schema, null, null, "BASE TABLE", 0L, 0L);
  }

  private static List<String> copyOf(List<String> values) {
    return values != null
        ? Collections.unmodifiableList(new ArrayList<>(values))
        : Collections.<String>emptyList();
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("schema")
  public String getSchema() {
    return schema;
  }

  @JsonProperty("columns")
  public List<String> getColumns() {
    return columns;
  }

  @JsonProperty("primaryKeyColumns")
  public List<String> getPrimaryKeyColumns() {
    return primaryKeyColumns;
  }

  @JsonProperty("type")
  public String getType() {
    return type;
  }

  @JsonProperty("dataLength")
  public long getDataLength() {
    return dataLength;
  }

  @JsonProperty("rowCount")
  public long getRowCount() {
    return rowCount;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TableDefinition)) {
      return false;
    }
    TableDefinition other = (TableDefinition) obj;
    return dataLength == other.dataLength
        && rowCount == other.rowCount
        && Objects.equals(name, other.name)
        && Objects.equals(schema, other.schema)
        && columns.equals(other.columns)
        && primaryKeyColumns.equals(other.primaryKeyColumns)
        && Objects.equals(type, other.type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, schema, columns, primaryKeyColumns, type, dataLength, rowCount);
  }

  @Override
  public String toString() {
    return "TableDefinition{name='" + name + "'}";
  }
}
