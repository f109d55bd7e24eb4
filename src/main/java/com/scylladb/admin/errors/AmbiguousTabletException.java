package com.scylladb.admin.errors;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a lookup that must yield a single tablet matches several. Carries the cluster ids
 * that were searched and the number of matches.
 *
 * @since 1.0.0
 */
public class AmbiguousTabletException extends AdminException {
  private final List<String> searchedClusters;
  private final int matches;

  /**
   * Constructs a new AmbiguousTabletException.
   *
   * @param target description of what was looked up, e.g. a hostname
   * @param matches how many tablets matched
   * @param searchedClusters the cluster ids in the search scope
   */
  public AmbiguousTabletException(String target, int matches, List<String> searchedClusters) {
    super(
        ErrorKind.AMBIGUOUS,
        "multiple tablets found: "
            + target
            + " ("
            + matches
            + " matches), searched clusters = "
            + searchedClusters);
    this.matches = matches;
    this.searchedClusters = Collections.unmodifiableList(searchedClusters);
  }

  /**
   * Returns the cluster ids that were searched.
   *
   * @return unmodifiable list of cluster ids
   */
  public List<String> getSearchedClusters() {
    return searchedClusters;
  }

  /**
   * Returns the number of tablets that matched.
   *
   * @return match count, at least 2
   */
  public int getMatches() {
    return matches;
  }
}
