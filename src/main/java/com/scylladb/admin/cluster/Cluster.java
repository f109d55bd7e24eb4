package com.scylladb.admin.cluster;

import com.scylladb.admin.RequestContext;
import com.scylladb.admin.client.ControlPlaneClient;
import com.scylladb.admin.client.DiscoveryClient;
import com.scylladb.admin.client.HttpControlPlaneClient;
import com.scylladb.admin.client.HttpDiscoveryClient;
import com.scylladb.admin.client.JsonHttpTransport;
import com.scylladb.admin.errors.AdminException;
import com.scylladb.admin.errors.TabletNotFoundException;
import com.scylladb.admin.model.ClusterInfo;
import com.scylladb.admin.model.Tablet;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * One backend cluster: its identity and the two remote clients that reach it.
 *
 * <p>Immutable. The clients are shared by all concurrent requests and must be thread-safe.
 *
 * @since 1.0.0
 */
public final class Cluster implements Closeable {
  private final String id;
  private final String name;
  private final DiscoveryClient discovery;
  private final ControlPlaneClient controlPlane;

  /**
   * Creates a cluster.
   *
   * @param id unique cluster id
   * @param name display name
   * @param discovery client for the discovery service
   * @param controlPlane client for the control plane
   */
  public Cluster(
      String id, String name, DiscoveryClient discovery, ControlPlaneClient controlPlane) {
    if (id == null || id.isEmpty()) {
      throw new IllegalArgumentException("cluster id cannot be null or empty");
    }
    if (discovery == null || controlPlane == null) {
      throw new IllegalArgumentException("clients of cluster " + id + " cannot be null");
    }
    this.id = id;
    this.name = name != null ? name : id;
    this.discovery = discovery;
    this.controlPlane = controlPlane;
  }

  /**
   * Creates a cluster backed by the HTTP clients described by the configuration.
   *
   * @param config the cluster configuration
   * @return a new cluster; close it to release its connection pools
   */
  public static Cluster connect(ClusterConfig config) {
    JsonHttpTransport discoveryTransport =
        new JsonHttpTransport(
            config.getDiscoveryEndpoint(),
            config.getConnectTimeoutMillis(),
            config.getSocketTimeoutMillis(),
            config.getMaxConnections());
    JsonHttpTransport controlPlaneTransport =
        new JsonHttpTransport(
            config.getControlPlaneEndpoint(),
            config.getConnectTimeoutMillis(),
            config.getSocketTimeoutMillis(),
            config.getMaxConnections());
    return new Cluster(
        config.getId(),
        config.getName(),
        new HttpDiscoveryClient(discoveryTransport),
        new HttpControlPlaneClient(controlPlaneTransport));
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public DiscoveryClient getDiscovery() {
    return discovery;
  }

  public ControlPlaneClient getControlPlane() {
    return controlPlane;
  }

  /**
   * Returns the detached reference stamped on aggregated items.
   *
   * @return a new {@link ClusterInfo}
   */
  public ClusterInfo toInfo() {
    return new ClusterInfo(id, name);
  }

  /**
   * Lists every tablet of the cluster, each attributed to this cluster.
   *
   * @param ctx the request context
   * @return the tablets in the order the control plane reported them
   * @throws AdminException if the control plane call fails
   */
  public List<Tablet> getTablets(RequestContext ctx) throws AdminException {
    List<Tablet> reported = controlPlane.listTablets(ctx);
    ClusterInfo info = toInfo();
    List<Tablet> tablets = new ArrayList<>(reported.size());
    for (Tablet tablet : reported) {
      tablets.add(tablet.withCluster(info));
    }
    return tablets;
  }

  /**
   * Returns the first tablet of this cluster matching the predicate.
   *
   * @param ctx the request context
   * @param predicate the match condition
   * @return the first match in listing order
   * @throws TabletNotFoundException if no tablet matches
   * @throws AdminException if the control plane call fails
   */
  public Tablet findTablet(RequestContext ctx, Predicate<Tablet> predicate)
      throws AdminException {
    for (Tablet tablet : getTablets(ctx)) {
      if (predicate.test(tablet)) {
        return tablet;
      }
    }
    throw new TabletNotFoundException(String.valueOf(predicate), Collections.singletonList(id));
  }

  /** Closes both remote clients. */
  @Override
  public void close() throws IOException {
    try {
      discovery.close();
    } finally {
      controlPlane.close();
    }
  }

  @Override
  public String toString() {
    return "Cluster{id='" + id + "', name='" + name + "'}";
  }
}
