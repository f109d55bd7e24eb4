package com.scylladb.admin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routing metadata served to gateways in one cell, keyed by keyspace. The per-keyspace vschema
 * documents are kept as opaque JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ServingVSchema {
  private final Map<String, JsonNode> keyspaces;

  @JsonCreator
  public ServingVSchema(@JsonProperty("keyspaces") Map<String, JsonNode> keyspaces) {
    this.keyspaces =
        keyspaces != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(keyspaces))
            : Collections.<String, JsonNode>emptyMap();
  }

  @JsonProperty("keyspaces")
  public Map<String, JsonNode> getKeyspaces() {
    return keyspaces;
  }

  /**
   * Returns the vschema of one keyspace.
   *
   * @param keyspace the keyspace name
   * @return the vschema document, or {@code null} if the keyspace is absent
   */
  public JsonNode getKeyspace(String keyspace) {
    return keyspaces.get(keyspace);
  }

  @Override
  public String toString() {
    return "ServingVSchema{keyspaces=" + keyspaces.keySet() + "}";
  }
}
