package com.scylladb.admin.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.scylladb.admin.RequestContext;
import com.scylladb.admin.errors.AdminException;
import com.scylladb.admin.model.KeyspaceDescriptor;
import com.scylladb.admin.model.ServingVSchema;
import com.scylladb.admin.model.Shard;
import com.scylladb.admin.model.Tablet;
import com.scylladb.admin.model.TabletAlias;
import com.scylladb.admin.model.TabletSchema;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ControlPlaneClient} backed by the cluster's HTTP control-plane endpoint.
 *
 * <p>Endpoints, relative to the configured base URI:
 *
 * <ul>
 *   <li>{@code GET /health}: reachability check performed by the first {@link #dial}
 *   <li>{@code GET /keyspaces}: JSON array of keyspace records
 *   <li>{@code GET /keyspaces/{keyspace}/shards}: JSON array of shards
 *   <li>{@code GET /tablets/{alias}/schema}: schema of one tablet
 *   <li>{@code GET /srvvschema/{cell}}: serving vschema of a cell
 *   <li>{@code GET /tablets}: JSON array of tablets
 * </ul>
 *
 * @since 1.0.0
 */
public class HttpControlPlaneClient implements ControlPlaneClient {
  private static final Logger logger = Logger.getLogger(HttpControlPlaneClient.class.getName());

  private static final TypeReference<List<KeyspaceDescriptor>> KEYSPACES =
      new TypeReference<List<KeyspaceDescriptor>>() {};
  private static final TypeReference<List<Shard>> SHARDS = new TypeReference<List<Shard>>() {};
  private static final TypeReference<TabletSchema> SCHEMA = new TypeReference<TabletSchema>() {};
  private static final TypeReference<ServingVSchema> SRV_VSCHEMA =
      new TypeReference<ServingVSchema>() {};
  private static final TypeReference<List<Tablet>> TABLETS = new TypeReference<List<Tablet>>() {};

  private final JsonHttpTransport transport;
  private final AtomicBoolean dialed = new AtomicBoolean(false);

  /**
   * Creates a client over the given transport.
   *
   * @param transport the transport to the control-plane endpoint
   */
  public HttpControlPlaneClient(JsonHttpTransport transport) {
    this.transport = transport;
  }

  /** {@inheritDoc} */
  @Override
  public void dial(RequestContext ctx) throws AdminException {
    if (dialed.get()) {
      return;
    }
    transport.ping(ctx, transport.resolve("health"));
    if (dialed.compareAndSet(false, true)) {
      logger.log(Level.FINE, "Connected to control plane at " + transport.getBaseUri());
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<KeyspaceDescriptor> listKeyspaces(RequestContext ctx) throws AdminException {
    return orEmpty(transport.get(ctx, transport.resolve("keyspaces"), KEYSPACES));
  }

  /** {@inheritDoc} */
  @Override
  public List<Shard> findShards(RequestContext ctx, String keyspace) throws AdminException {
    return orEmpty(transport.get(ctx, transport.resolve("keyspaces", keyspace, "shards"), SHARDS));
  }

  /** {@inheritDoc} */
  @Override
  public TabletSchema getSchema(RequestContext ctx, TabletAlias alias) throws AdminException {
    TabletSchema schema =
        transport.get(ctx, transport.resolve("tablets", alias.toString(), "schema"), SCHEMA);
    return schema != null ? schema : new TabletSchema(null, null);
  }

  /** {@inheritDoc} */
  @Override
  public ServingVSchema getServingVSchema(RequestContext ctx, String cell)
      throws AdminException {
    ServingVSchema vschema =
        transport.get(ctx, transport.resolve("srvvschema", cell), SRV_VSCHEMA);
    return vschema != null ? vschema : new ServingVSchema(null);
  }

  /** {@inheritDoc} */
  @Override
  public List<Tablet> listTablets(RequestContext ctx) throws AdminException {
    return orEmpty(transport.get(ctx, transport.resolve("tablets"), TABLETS));
  }

  private static <T> List<T> orEmpty(List<T> values) {
    return values != null ? values : Collections.<T>emptyList();
  }

  /** {@inheritDoc} */
  @Override
  public void close() throws IOException {
    transport.close();
  }

  @Override
  public String toString() {
    return "HttpControlPlaneClient{" + transport.getBaseUri() + "}";
  }
}
