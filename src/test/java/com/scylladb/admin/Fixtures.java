package com.scylladb.admin;

import static org.mockito.Mockito.mock;

import com.scylladb.admin.client.ControlPlaneClient;
import com.scylladb.admin.client.DiscoveryClient;
import com.scylladb.admin.cluster.Cluster;
import com.scylladb.admin.model.ServingState;
import com.scylladb.admin.model.Tablet;
import com.scylladb.admin.model.TabletAlias;
import com.scylladb.admin.model.TabletType;

/** Builders for the objects most tests need. */
public final class Fixtures {

  private Fixtures() {}

  public static Tablet tablet(
      String hostname, String keyspace, TabletType type, ServingState state, long uid) {
    return new Tablet(
        null, hostname, keyspace, "-", type, new TabletAlias("zone1", uid), state);
  }

  public static Tablet servingReplica(String hostname, String keyspace, long uid) {
    return tablet(hostname, keyspace, TabletType.REPLICA, ServingState.SERVING, uid);
  }

  public static Cluster cluster(String id, ControlPlaneClient controlPlane) {
    return new Cluster(id, id + "-name", mock(DiscoveryClient.class), controlPlane);
  }

  public static Cluster cluster(
      String id, DiscoveryClient discovery, ControlPlaneClient controlPlane) {
    return new Cluster(id, id + "-name", discovery, controlPlane);
  }
}
