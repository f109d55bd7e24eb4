package com.scylladb.admin.errors;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a tablet lookup matches no tablet. Carries the cluster ids that were searched.
 *
 * @since 1.0.0
 */
public class TabletNotFoundException extends AdminException {
  private final List<String> searchedClusters;

  /**
   * Constructs a new TabletNotFoundException.
   *
   * @param target description of what was looked up, e.g. a hostname
   * @param searchedClusters the cluster ids in the search scope
   */
  public TabletNotFoundException(String target, List<String> searchedClusters) {
    super(
        ErrorKind.NOT_FOUND,
        "no such tablet: " + target + ", searched clusters = " + searchedClusters);
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
}
