package com.scylladb.admin.explain;

/**
 * The three serialized artifacts an {@link ExplainEngine} is initialized with.
 *
 * <ul>
 *   <li>vschema: {@code {"<keyspace>": <vschema>}}
 *   <li>schema: the DDL of every table, joined by {@code ;}
 *   <li>shard map: {@code {"<keyspace>": {"<shard>": <shard>, ...}}}
 * </ul>
 *
 * @since 1.0.0
 */
public final class ExplainInput {
  private final String vschema;
  private final String schema;
  private final String shardMap;

  public ExplainInput(String vschema, String schema, String shardMap) {
    this.vschema = vschema;
    this.schema = schema;
    this.shardMap = shardMap;
  }

  public String getVSchema() {
    return vschema;
  }

  public String getSchema() {
    return schema;
  }

  public String getShardMap() {
    return shardMap;
  }

  @Override
  public String toString() {
    return "ExplainInput{vschema="
        + vschema
        + ", schema="
        + schema
        + ", shardMap="
        + shardMap
        + "}";
  }
}
