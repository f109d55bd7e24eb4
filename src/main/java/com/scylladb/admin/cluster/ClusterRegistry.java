package com.scylladb.admin.cluster;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The fixed set of clusters known to the service.
 *
 * <p>Built once at startup and never modified, so it is read by concurrent requests without
 * locking.
 *
 * @since 1.0.0
 */
public final class ClusterRegistry {
  private static final Logger logger = Logger.getLogger(ClusterRegistry.class.getName());

  private final List<Cluster> sorted;
  private final Map<String, Cluster> byId;

  /**
   * Creates a registry.
   *
   * @param clusters the configured clusters, in configuration order
   * @throws IllegalArgumentException if two clusters share an id
   */
  public ClusterRegistry(List<Cluster> clusters) {
    Map<String, Cluster> index = new LinkedHashMap<>();
    for (Cluster cluster : clusters) {
      if (index.put(cluster.getId(), cluster) != null) {
        throw new IllegalArgumentException("duplicate cluster id: " + cluster.getId());
      }
    }
    List<Cluster> ordered = new ArrayList<>(index.values());
    ordered.sort(Comparator.comparing(Cluster::getId));
    this.sorted = Collections.unmodifiableList(ordered);
    this.byId = Collections.unmodifiableMap(index);
  }

  /**
   * Returns every cluster, sorted by id.
   *
   * @return unmodifiable list of clusters
   */
  public List<Cluster> getClusters() {
    return sorted;
  }

  /**
   * Returns the cluster with the given id.
   *
   * @param id the cluster id
   * @return the cluster, or null if the id is not configured
   */
  public Cluster get(String id) {
    return id != null ? byId.get(id) : null;
  }

  /**
   * Selects the clusters a request addresses.
   *
   * <p>A null or empty filter selects every cluster, sorted by id, together with every configured
   * id in configuration order. Otherwise the known clusters are returned in the caller's order and
   * unknown ids are dropped; the returned ids echo the caller's filter.
   *
   * @param ids the requested cluster ids, may be null
   * @return the selected clusters and the ids to report in diagnostics
   */
  public Resolution resolve(Collection<String> ids) {
    if (ids == null || ids.isEmpty()) {
      return new Resolution(sorted, new ArrayList<>(byId.keySet()));
    }
    List<Cluster> selected = new ArrayList<>(ids.size());
    for (String id : ids) {
      Cluster cluster = byId.get(id);
      if (cluster == null) {
        logger.log(Level.FINE, "Ignoring unknown cluster id: " + id);
        continue;
      }
      selected.add(cluster);
    }
    return new Resolution(selected, new ArrayList<>(ids));
  }

  /** The result of {@link #resolve}. */
  public static final class Resolution {
    private final List<Cluster> clusters;
    private final List<String> ids;

    Resolution(List<Cluster> clusters, List<String> ids) {
      this.clusters = Collections.unmodifiableList(new ArrayList<>(clusters));
      this.ids = Collections.unmodifiableList(ids);
    }

    /**
     * Returns the selected clusters.
     *
     * @return the clusters, possibly empty
     */
    public List<Cluster> getClusters() {
      return clusters;
    }

    /**
     * Returns the ids reported as the search scope.
     *
     * @return the configured ids for an unfiltered request, else the caller's ids
     */
    public List<String> getIds() {
      return ids;
    }
  }
}
