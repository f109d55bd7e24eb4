package com.scylladb.admin.client;

import com.scylladb.admin.RequestContext;
import com.scylladb.admin.errors.AdminException;
import com.scylladb.admin.errors.RemoteCallException;
import com.scylladb.admin.model.Gate;
import java.io.Closeable;
import java.util.List;

/**
 * Discovery endpoint of one cluster: finds the query gateways the cluster runs.
 *
 * <p>Implementations must be safe for concurrent use and should abandon in-flight calls when the
 * request context is cancelled.
 *
 * @since 1.0.0
 */
public interface DiscoveryClient extends Closeable {

  /**
   * Lists the gateways of the cluster.
   *
   * @param ctx the request context
   * @param cells restricts the result to gateways in these cells; empty for all cells
   * @return the gateways, not yet attributed to a cluster
   * @throws RemoteCallException if the discovery call fails
   * @throws AdminException if the request context is done
   */
  List<Gate> discoverGates(RequestContext ctx, List<String> cells) throws AdminException;
}
