package com.scylladb.admin.explain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scylladb.admin.RequestContext;
import com.scylladb.admin.client.ControlPlaneClient;
import com.scylladb.admin.cluster.Cluster;
import com.scylladb.admin.cluster.ClusterRegistry;
import com.scylladb.admin.errors.AdminException;
import com.scylladb.admin.errors.ExplainException;
import com.scylladb.admin.errors.InvalidRequestException;
import com.scylladb.admin.errors.MissingArtifactException;
import com.scylladb.admin.errors.UnsupportedClusterException;
import com.scylladb.admin.internal.FanOut;
import com.scylladb.admin.internal.Json;
import com.scylladb.admin.internal.ResultSlot;
import com.scylladb.admin.model.ServingVSchema;
import com.scylladb.admin.model.Shard;
import com.scylladb.admin.model.ShardRecord;
import com.scylladb.admin.model.TableDefinition;
import com.scylladb.admin.model.Tablet;
import com.scylladb.admin.model.TabletSchema;
import com.scylladb.admin.tablet.TabletPredicates;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Gathers the routing metadata an {@link ExplainEngine} needs for one keyspace.
 *
 * <p>A serving replica of the keyspace is picked first. The schema, serving vschema and shard map
 * are then fetched concurrently, each by its own step writing its own {@link ResultSlot}. Any step
 * failure fails the whole assembly.
 *
 * @since 1.0.0
 */
public class ExplainRequestAssembler {
  private static final Logger logger = Logger.getLogger(ExplainRequestAssembler.class.getName());

  /** Artifact name used when the serving vschema lacks the keyspace. */
  public static final String SRV_VSCHEMA = "SrvVSchema";

  private final ClusterRegistry registry;
  private final FanOut fanOut;

  /**
   * Creates an assembler.
   *
   * @param registry the configured clusters
   * @param fanOut the fan-out runner for the three fetches
   */
  public ExplainRequestAssembler(ClusterRegistry registry, FanOut fanOut) {
    this.registry = registry;
    this.fanOut = fanOut;
  }

  /**
   * Validates the request and assembles the engine input.
   *
   * @param ctx the request context
   * @param request the explain request
   * @return the engine input
   * @throws InvalidRequestException if the cluster id, keyspace or SQL is empty
   * @throws UnsupportedClusterException if the cluster id is not configured
   * @throws com.scylladb.admin.errors.TabletNotFoundException if the keyspace has no serving
   *     replica
   * @throws AdminException if any remote fetch fails, or the serving vschema lacks the keyspace
   */
  public ExplainInput assemble(RequestContext ctx, ExplainRequest request) throws AdminException {
    validate(request);

    Cluster cluster = registry.get(request.getCluster());
    if (cluster == null) {
      throw new UnsupportedClusterException(request.getCluster());
    }

    String keyspace = request.getKeyspace();
    Tablet tablet = cluster.findTablet(ctx, TabletPredicates.servingReplica(keyspace));
    logger.log(
        Level.FINE,
        "Explaining against tablet " + tablet.getAlias() + " of cluster " + cluster.getId());

    ControlPlaneClient controlPlane = cluster.getControlPlane();
    controlPlane.dial(ctx);

    ResultSlot<String> schema = new ResultSlot<>("schema");
    ResultSlot<String> vschema = new ResultSlot<>("vschema");
    ResultSlot<String> shardMap = new ResultSlot<>("shardMap");

    fanOut.runAll(
        ctx,
        Arrays.<FanOut.Step>asList(
            scope -> schema.set(joinDdl(controlPlane.getSchema(scope, tablet.getAlias()))),
            scope -> {
              ServingVSchema srv =
                  controlPlane.getServingVSchema(scope, tablet.getAlias().getCell());
              JsonNode fragment = srv.getKeyspace(keyspace);
              if (fragment == null) {
                throw new MissingArtifactException(SRV_VSCHEMA, "keyspace " + keyspace);
              }
              vschema.set(wrap(keyspace, fragment));
            },
            scope -> {
              Map<String, ShardRecord> shards = new LinkedHashMap<>();
              for (Shard shard : controlPlane.findShards(scope, keyspace)) {
                shards.put(shard.getName(), shard.getShard());
              }
              shardMap.set(wrap(keyspace, Json.MAPPER.valueToTree(shards)));
            }));

    return new ExplainInput(vschema.get(), schema.get(), shardMap.get());
  }

  private static void validate(ExplainRequest request) throws InvalidRequestException {
    if (isEmpty(request.getCluster())) {
      throw new InvalidRequestException("cluster ID is required");
    }
    if (isEmpty(request.getKeyspace())) {
      throw new InvalidRequestException("keyspace name is required");
    }
    if (isEmpty(request.getSql())) {
      throw new InvalidRequestException("SQL query is required");
    }
  }

  private static boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }

  static String joinDdl(TabletSchema schema) {
    List<String> statements = new ArrayList<>(schema.getTableDefinitions().size());
    for (TableDefinition table : schema.getTableDefinitions()) {
      statements.add(table.getSchema() != null ? table.getSchema() : "");
    }
    return String.join(";", statements);
  }

  private static String wrap(String keyspace, JsonNode value) throws AdminException {
    ObjectNode root = Json.MAPPER.createObjectNode();
    root.set(keyspace, value);
    try {
      return Json.MAPPER.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new ExplainException("cannot serialize metadata of keyspace " + keyspace, e);
    }
  }
}
