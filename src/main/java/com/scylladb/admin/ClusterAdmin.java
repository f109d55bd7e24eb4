package com.scylladb.admin;

import com.scylladb.admin.cluster.Cluster;
import com.scylladb.admin.cluster.ClusterConfig;
import com.scylladb.admin.cluster.ClusterRegistry;
import com.scylladb.admin.errors.AdminException;
import com.scylladb.admin.errors.ExplainException;
import com.scylladb.admin.explain.ExplainEngine;
import com.scylladb.admin.explain.ExplainInput;
import com.scylladb.admin.explain.ExplainPlan;
import com.scylladb.admin.explain.ExplainRequest;
import com.scylladb.admin.explain.ExplainRequestAssembler;
import com.scylladb.admin.internal.FanOut;
import com.scylladb.admin.model.ClusterInfo;
import com.scylladb.admin.model.Gate;
import com.scylladb.admin.model.Keyspace;
import com.scylladb.admin.model.KeyspaceDescriptor;
import com.scylladb.admin.model.Schema;
import com.scylladb.admin.model.Shard;
import com.scylladb.admin.model.Tablet;
import com.scylladb.admin.schema.SchemaDiscovery;
import com.scylladb.admin.tablet.TabletPredicates;
import com.scylladb.admin.tablet.TabletResolver;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Federated administration API over a fixed set of clusters.
 *
 * <p>Every list operation takes an optional cluster id filter, queries the selected clusters
 * concurrently and merges their answers. The operation either returns the complete merged result or
 * throws; results of the clusters that did succeed are never returned alongside a failure. Unknown
 * cluster ids in a filter are ignored.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * try (ClusterAdmin admin =
 *     ClusterAdmin.builder()
 *         .withClusterConfigs(ClusterConfigLoader.load(Paths.get("clusters.json")))
 *         .build()) {
 *   List<Tablet> tablets = admin.getTablets(Collections.singletonList("prod"));
 * }
 * }</pre>
 *
 * <p>Thread-safe.
 *
 * @since 1.0.0
 */
public class ClusterAdmin implements Closeable {
  private static final Logger logger = Logger.getLogger(ClusterAdmin.class.getName());

  private final ClusterRegistry registry;
  private final AdminConfig config;
  private final FanOut fanOut;
  private final SchemaDiscovery schemaDiscovery;
  private final TabletResolver tabletResolver;
  private final ExplainRequestAssembler explainAssembler;

  ClusterAdmin(ClusterRegistry registry, AdminConfig config) {
    this.registry = registry;
    this.config = config;
    this.fanOut = new FanOut(config.getExecutor(), config.getFanOutPolicy());
    this.schemaDiscovery = new SchemaDiscovery(fanOut);
    this.tabletResolver = new TabletResolver(registry, fanOut);
    this.explainAssembler = new ExplainRequestAssembler(registry, fanOut);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  public ClusterRegistry getRegistry() {
    return registry;
  }

  public AdminConfig getConfig() {
    return config;
  }

  /**
   * Lists every configured cluster.
   *
   * @return cluster references sorted by id
   */
  public List<ClusterInfo> getClusters() {
    List<ClusterInfo> clusters = new ArrayList<>();
    for (Cluster cluster : registry.getClusters()) {
      clusters.add(cluster.toInfo());
    }
    return clusters;
  }

  /**
   * Lists the query gateways of the selected clusters.
   *
   * @param ctx the request context
   * @param clusterIds cluster filter; null or empty selects every cluster
   * @return the gateways, each attributed to its cluster, in no particular order
   * @throws AdminException if discovery fails in any selected cluster
   */
  public List<Gate> getGates(RequestContext ctx, Collection<String> clusterIds)
      throws AdminException {
    return fanOut.<Cluster, Gate>gather(
        ctx,
        select(clusterIds),
        (scope, cluster) -> {
          ClusterInfo info = cluster.toInfo();
          List<Gate> gates = new ArrayList<>();
          for (Gate gate : cluster.getDiscovery().discoverGates(scope, Collections.emptyList())) {
            gates.add(gate.withCluster(info));
          }
          return gates;
        });
  }

  /**
   * Lists the keyspaces of the selected clusters together with their shards.
   *
   * @param ctx the request context
   * @param clusterIds cluster filter; null or empty selects every cluster
   * @return the keyspaces, in no particular order
   * @throws AdminException if listing keyspaces or shards fails anywhere
   */
  public List<Keyspace> getKeyspaces(RequestContext ctx, Collection<String> clusterIds)
      throws AdminException {
    return fanOut.<Cluster, Keyspace>gather(
        ctx,
        select(clusterIds),
        (scope, cluster) -> {
          cluster.getControlPlane().dial(scope);
          List<KeyspaceDescriptor> descriptors = cluster.getControlPlane().listKeyspaces(scope);
          ClusterInfo info = cluster.toInfo();
          return fanOut.<KeyspaceDescriptor, Keyspace>gather(
              scope,
              descriptors,
              (inner, descriptor) -> {
                List<Shard> shards =
                    cluster.getControlPlane().findShards(inner, descriptor.getName());
                return Collections.singletonList(new Keyspace(info, descriptor, shards));
              });
        });
  }

  /**
   * Lists the table schemas of the selected clusters. Keyspaces without a serving tablet or
   * without tables are left out.
   *
   * @param ctx the request context
   * @param clusterIds cluster filter; null or empty selects every cluster
   * @return one schema per non-empty keyspace, in no particular order
   * @throws AdminException if any remote call fails
   */
  public List<Schema> getSchemas(RequestContext ctx, Collection<String> clusterIds)
      throws AdminException {
    return fanOut.<Cluster, Schema>gather(
        ctx,
        select(clusterIds),
        (scope, cluster) -> schemaDiscovery.discover(scope, cluster, cluster.getTablets(scope)));
  }

  /**
   * Lists the tablets of the selected clusters.
   *
   * @param ctx the request context
   * @param clusterIds cluster filter; null or empty selects every cluster
   * @return the tablets, each attributed to its cluster, in no particular order
   * @throws AdminException if listing tablets fails in any selected cluster
   */
  public List<Tablet> getTablets(RequestContext ctx, Collection<String> clusterIds)
      throws AdminException {
    return fanOut.<Cluster, Tablet>gather(
        ctx, select(clusterIds), (scope, cluster) -> cluster.getTablets(scope));
  }

  /**
   * Returns the tablet with the given hostname.
   *
   * @param ctx the request context
   * @param hostname the tablet hostname
   * @param clusterIds cluster filter; null or empty searches every cluster
   * @return the tablet
   * @throws com.scylladb.admin.errors.TabletNotFoundException if no tablet has the hostname
   * @throws com.scylladb.admin.errors.AmbiguousTabletException if several tablets have it
   * @throws AdminException if listing tablets fails in any selected cluster
   */
  public Tablet getTablet(RequestContext ctx, String hostname, Collection<String> clusterIds)
      throws AdminException {
    return tabletResolver.findTablet(ctx, clusterIds, TabletPredicates.hostname(hostname));
  }

  /**
   * Explains how a query would be routed in a keyspace.
   *
   * @param ctx the request context
   * @param request the cluster, keyspace and SQL
   * @return the rendered plans
   * @throws com.scylladb.admin.errors.InvalidRequestException if a request field is empty
   * @throws com.scylladb.admin.errors.UnsupportedClusterException if the cluster is unknown
   * @throws ExplainException if no engine is configured or the engine fails
   * @throws AdminException if gathering the routing metadata fails
   */
  public String explain(RequestContext ctx, ExplainRequest request) throws AdminException {
    ExplainInput input = explainAssembler.assemble(ctx, request);

    Supplier<? extends ExplainEngine> engines = config.getExplainEngineSupplier();
    if (engines == null) {
      throw new ExplainException("no explain engine configured");
    }
    ExplainEngine engine = engines.get();
    try {
      engine.init(input, config.getExplainOptions());
      List<ExplainPlan> plans = engine.run(request.getSql());
      return engine.render(plans);
    } catch (RuntimeException e) {
      throw new ExplainException("explain engine failed: " + e.getMessage(), e);
    }
  }

  /**
   * Same as {@link #getGates(RequestContext, Collection)} with the configured request timeout.
   *
   * @param clusterIds cluster filter
   * @return the gateways
   * @throws AdminException on failure
   */
  public List<Gate> getGates(Collection<String> clusterIds) throws AdminException {
    try (RequestContext ctx = newRequestContext()) {
      return getGates(ctx, clusterIds);
    }
  }

  /**
   * Same as {@link #getKeyspaces(RequestContext, Collection)} with the configured request timeout.
   *
   * @param clusterIds cluster filter
   * @return the keyspaces
   * @throws AdminException on failure
   */
  public List<Keyspace> getKeyspaces(Collection<String> clusterIds) throws AdminException {
    try (RequestContext ctx = newRequestContext()) {
      return getKeyspaces(ctx, clusterIds);
    }
  }

  /**
   * Same as {@link #getSchemas(RequestContext, Collection)} with the configured request timeout.
   *
   * @param clusterIds cluster filter
   * @return the schemas
   * @throws AdminException on failure
   */
  public List<Schema> getSchemas(Collection<String> clusterIds) throws AdminException {
    try (RequestContext ctx = newRequestContext()) {
      return getSchemas(ctx, clusterIds);
    }
  }

  /**
   * Same as {@link #getTablets(RequestContext, Collection)} with the configured request timeout.
   *
   * @param clusterIds cluster filter
   * @return the tablets
   * @throws AdminException on failure
   */
  public List<Tablet> getTablets(Collection<String> clusterIds) throws AdminException {
    try (RequestContext ctx = newRequestContext()) {
      return getTablets(ctx, clusterIds);
    }
  }

  /**
   * Same as {@link #getTablet(RequestContext, String, Collection)} with the configured request
   * timeout.
   *
   * @param hostname the tablet hostname
   * @param clusterIds cluster filter
   * @return the tablet
   * @throws AdminException on failure
   */
  public Tablet getTablet(String hostname, Collection<String> clusterIds) throws AdminException {
    try (RequestContext ctx = newRequestContext()) {
      return getTablet(ctx, hostname, clusterIds);
    }
  }

  /**
   * Same as {@link #explain(RequestContext, ExplainRequest)} with the configured request timeout.
   *
   * @param request the explain request
   * @return the rendered plans
   * @throws AdminException on failure
   */
  public String explain(ExplainRequest request) throws AdminException {
    try (RequestContext ctx = newRequestContext()) {
      return explain(ctx, request);
    }
  }

  private RequestContext newRequestContext() {
    return RequestContext.withTimeout(config.getRequestTimeout());
  }

  private List<Cluster> select(Collection<String> clusterIds) {
    List<Cluster> clusters = registry.resolve(clusterIds).getClusters();
    logger.log(Level.FINE, "Request addresses clusters " + clusters);
    return clusters;
  }

  /**
   * Closes every cluster client, and the executor if it was supplied in the configuration.
   * Failures closing one cluster do not stop the others from being closed.
   */
  @Override
  public void close() throws IOException {
    IOException failure = null;
    for (Cluster cluster : registry.getClusters()) {
      try {
        cluster.close();
      } catch (IOException e) {
        logger.log(Level.WARNING, "Failed to close cluster " + cluster.getId(), e);
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (!config.isSharedExecutor()) {
      config.getExecutor().shutdown();
    }
    if (failure != null) {
      throw failure;
    }
  }

  /** Builder for {@link ClusterAdmin}. */
  public static final class Builder {
    private final List<Cluster> clusters = new ArrayList<>();
    private AdminConfig config;

    private Builder() {}

    /**
     * Adds a cluster.
     *
     * @param cluster the cluster
     * @return this builder instance
     */
    public Builder addCluster(Cluster cluster) {
      this.clusters.add(cluster);
      return this;
    }

    /**
     * Adds clusters.
     *
     * @param clusters the clusters, in configuration order
     * @return this builder instance
     */
    public Builder withClusters(List<Cluster> clusters) {
      this.clusters.addAll(clusters);
      return this;
    }

    /**
     * Adds HTTP backed clusters built from configurations.
     *
     * @param configs the cluster configurations, in configuration order
     * @return this builder instance
     */
    public Builder withClusterConfigs(List<ClusterConfig> configs) {
      for (ClusterConfig clusterConfig : configs) {
        this.clusters.add(Cluster.connect(clusterConfig));
      }
      return this;
    }

    /**
     * Sets the configuration.
     *
     * <p>Default: {@code AdminConfig.builder().build()}
     *
     * @param config the configuration
     * @return this builder instance
     */
    public Builder withConfig(AdminConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Builds and returns a {@link ClusterAdmin} instance.
     *
     * @return a new {@link ClusterAdmin} instance
     * @throws IllegalArgumentException if two clusters share an id; the added clusters are closed
     */
    public ClusterAdmin build() {
      AdminConfig effective = config != null ? config : AdminConfig.builder().build();
      ClusterRegistry registry;
      try {
        registry = new ClusterRegistry(clusters);
      } catch (IllegalArgumentException e) {
        closeQuietly(clusters, e);
        throw e;
      }
      ClusterAdmin admin = new ClusterAdmin(registry, effective);
      logger.log(Level.INFO, "Cluster admin serving " + clusters.size() + " cluster(s)");
      return admin;
    }

    private static void closeQuietly(List<Cluster> clusters, IllegalArgumentException failure) {
      for (Cluster cluster : clusters) {
        try {
          cluster.close();
        } catch (IOException e) {
          logger.log(Level.WARNING, "Failed to close cluster " + cluster.getId(), e);
          failure.addSuppressed(e);
        }
      }
    }
  }
}
