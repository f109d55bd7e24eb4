package com.scylladb.admin.client;

import com.scylladb.admin.RequestContext;
import com.scylladb.admin.errors.AdminException;
import com.scylladb.admin.errors.RemoteCallException;
import com.scylladb.admin.model.KeyspaceDescriptor;
import com.scylladb.admin.model.ServingVSchema;
import com.scylladb.admin.model.Shard;
import com.scylladb.admin.model.Tablet;
import com.scylladb.admin.model.TabletAlias;
import com.scylladb.admin.model.TabletSchema;
import java.io.Closeable;
import java.util.List;

/**
 * Control-plane endpoint of one cluster: topology and schema queries.
 *
 * <p>Every call may fail independently. Implementations must be safe for concurrent use and should
 * abandon in-flight calls when the request context is cancelled.
 *
 * @since 1.0.0
 */
public interface ControlPlaneClient extends Closeable {

  /**
   * Makes sure a connection to the control plane is established. Cheap once connected; callers
   * invoke it before each batch of calls.
   *
   * @param ctx the request context
   * @throws RemoteCallException if the control plane cannot be reached
   * @throws AdminException if the request context is done
   */
  void dial(RequestContext ctx) throws AdminException;

  /**
   * Lists every keyspace of the cluster.
   *
   * @param ctx the request context
   * @return keyspace records
   * @throws RemoteCallException if the call fails
   * @throws AdminException if the request context is done
   */
  List<KeyspaceDescriptor> listKeyspaces(RequestContext ctx) throws AdminException;

  /**
   * Lists every shard of a keyspace.
   *
   * @param ctx the request context
   * @param keyspace the keyspace name
   * @return shards of the keyspace
   * @throws RemoteCallException if the call fails
   * @throws AdminException if the request context is done
   */
  List<Shard> findShards(RequestContext ctx, String keyspace) throws AdminException;

  /**
   * Reads the schema of the database served by a tablet.
   *
   * @param ctx the request context
   * @param alias the tablet to ask
   * @return the schema, possibly without table definitions
   * @throws RemoteCallException if the call fails
   * @throws AdminException if the request context is done
   */
  TabletSchema getSchema(RequestContext ctx, TabletAlias alias) throws AdminException;

  /**
   * Reads the serving vschema of a cell.
   *
   * @param ctx the request context
   * @param cell the cell name
   * @return the serving vschema
   * @throws RemoteCallException if the call fails
   * @throws AdminException if the request context is done
   */
  ServingVSchema getServingVSchema(RequestContext ctx, String cell) throws AdminException;

  /**
   * Lists every tablet of the cluster with its serving state.
   *
   * @param ctx the request context
   * @return the tablets, not yet attributed to a cluster
   * @throws RemoteCallException if the call fails
   * @throws AdminException if the request context is done
   */
  List<Tablet> listTablets(RequestContext ctx) throws AdminException;
}
