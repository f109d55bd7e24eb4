package com.scylladb.admin.tablet;

import com.scylladb.admin.RequestContext;
import com.scylladb.admin.cluster.Cluster;
import com.scylladb.admin.cluster.ClusterRegistry;
import com.scylladb.admin.errors.AdminException;
import com.scylladb.admin.errors.AmbiguousTabletException;
import com.scylladb.admin.errors.TabletNotFoundException;
import com.scylladb.admin.internal.FanOut;
import com.scylladb.admin.model.Tablet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds the single tablet matching a predicate across a set of clusters.
 *
 * <p>Tablets are listed concurrently per cluster and scanned sequentially within each cluster.
 * Every match is collected, so the outcome distinguishes an absent tablet ({@link
 * TabletNotFoundException}) from an ambiguous one ({@link AmbiguousTabletException}). Both carry
 * the searched cluster ids.
 *
 * @since 1.0.0
 */
public class TabletResolver {
  private static final Logger logger = Logger.getLogger(TabletResolver.class.getName());

  private final ClusterRegistry registry;
  private final FanOut fanOut;

  /**
   * Creates a resolver.
   *
   * @param registry the configured clusters
   * @param fanOut the fan-out runner
   */
  public TabletResolver(ClusterRegistry registry, FanOut fanOut) {
    this.registry = registry;
    this.fanOut = fanOut;
  }

  /**
   * Returns the only tablet matching the predicate.
   *
   * @param ctx the request context
   * @param clusterIds the clusters to search; null or empty searches every cluster
   * @param predicate the match condition; its {@code toString()} names the target in errors
   * @return the matching tablet, attributed to its cluster
   * @throws TabletNotFoundException if nothing matches
   * @throws AmbiguousTabletException if more than one tablet matches
   * @throws AdminException if listing tablets fails in any cluster
   */
  public Tablet findTablet(
      RequestContext ctx, Collection<String> clusterIds, Predicate<Tablet> predicate)
      throws AdminException {
    ClusterRegistry.Resolution resolution = registry.resolve(clusterIds);
    List<Tablet> matches =
        fanOut.<Cluster, Tablet>gather(
            ctx,
            resolution.getClusters(),
            (scope, cluster) -> {
              List<Tablet> found = new ArrayList<>();
              for (Tablet tablet : cluster.getTablets(scope)) {
                if (predicate.test(tablet)) {
                  found.add(tablet);
                }
              }
              return found;
            });

    switch (matches.size()) {
      case 0:
        throw new TabletNotFoundException(String.valueOf(predicate), resolution.getIds());
      case 1:
        return matches.get(0);
      default:
        logger.log(
            Level.FINE, matches.size() + " tablets match " + predicate + ": " + matches);
        throw new AmbiguousTabletException(
            String.valueOf(predicate), matches.size(), resolution.getIds());
    }
  }
}
