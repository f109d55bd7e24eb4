package com.scylladb.admin.cluster;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.scylladb.admin.internal.Json;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads cluster configurations from JSON.
 *
 * <p>Accepted documents are either an object with a {@code clusters} array or a bare array:
 *
 * <pre>{@code
 * {
 *   "clusters": [
 *     {"id": "prod", "name": "Production",
 *      "discovery": "http://discovery.prod:15000", "vtctld": "http://vtctld.prod:15000/api"}
 *   ]
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ClusterConfigLoader {

  private ClusterConfigLoader() {}

  /**
   * Reads cluster configurations from a file.
   *
   * @param path the JSON file
   * @return the configurations in file order
   * @throws IOException if the file cannot be read or is not valid JSON
   * @throws IllegalArgumentException if an entry is not a valid cluster configuration
   */
  public static List<ClusterConfig> load(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return load(in);
    }
  }

  /**
   * Reads cluster configurations from a stream.
   *
   * @param in the JSON input; not closed
   * @return the configurations in document order
   * @throws IOException if the input is not valid JSON
   * @throws IllegalArgumentException if an entry is not a valid cluster configuration
   */
  public static List<ClusterConfig> load(InputStream in) throws IOException {
    JsonNode root = Json.MAPPER.readTree(in);
    JsonNode entries = root != null && root.isObject() ? root.get("clusters") : root;
    if (entries == null || !entries.isArray()) {
      throw new IllegalArgumentException(
          "cluster configuration must be an array or an object with a \"clusters\" array");
    }
    List<ClusterConfig> configs = new ArrayList<>(entries.size());
    for (JsonNode entry : entries) {
      try {
        configs.add(Json.MAPPER.treeToValue(entry, ClusterConfig.class));
      } catch (ValueInstantiationException e) {
        // The builder's own validation message is more useful than Jackson's wrapper.
        Throwable cause = e.getCause();
        if (cause instanceof IllegalArgumentException) {
          throw (IllegalArgumentException) cause;
        }
        throw e;
      }
    }
    return configs;
  }
}
