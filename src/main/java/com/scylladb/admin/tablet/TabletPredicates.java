package com.scylladb.admin.tablet;

import com.scylladb.admin.model.Tablet;
import com.scylladb.admin.model.TabletType;
import java.util.function.Predicate;

/**
 * Common tablet match conditions. Each predicate describes itself in {@code toString()}, which is
 * used as the lookup target in not-found and ambiguous errors.
 *
 * @since 1.0.0
 */
public final class TabletPredicates {

  private TabletPredicates() {}

  /**
   * Matches the tablet with the given hostname.
   *
   * @param hostname the hostname
   * @return the predicate
   */
  public static Predicate<Tablet> hostname(String hostname) {
    return new Described(
        hostname, tablet -> hostname != null && hostname.equals(tablet.getHostname()));
  }

  /**
   * Matches a tablet of the keyspace that can answer reads for query planning: it is part of the
   * serving graph, is not the primary and reports itself as serving.
   *
   * @param keyspace the keyspace
   * @return the predicate
   */
  public static Predicate<Tablet> servingReplica(String keyspace) {
    return new Described(
        "serving non-primary tablet in keyspace " + keyspace,
        tablet ->
            keyspace.equals(tablet.getKeyspace())
                && tablet.getType().isInServingGraph()
                && tablet.getType() != TabletType.PRIMARY
                && tablet.isServing());
  }

  private static final class Described implements Predicate<Tablet> {
    private final String description;
    private final Predicate<Tablet> delegate;

    Described(String description, Predicate<Tablet> delegate) {
      this.description = description;
      this.delegate = delegate;
    }

    @Override
    public boolean test(Tablet tablet) {
      return delegate.test(tablet);
    }

    @Override
    public String toString() {
      return description;
    }
  }
}
