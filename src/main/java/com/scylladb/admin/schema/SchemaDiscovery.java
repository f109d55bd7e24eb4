package com.scylladb.admin.schema;

import com.scylladb.admin.RequestContext;
import com.scylladb.admin.cluster.Cluster;
import com.scylladb.admin.errors.AdminException;
import com.scylladb.admin.internal.FanOut;
import com.scylladb.admin.model.ClusterInfo;
import com.scylladb.admin.model.KeyspaceDescriptor;
import com.scylladb.admin.model.Schema;
import com.scylladb.admin.model.Tablet;
import com.scylladb.admin.model.TabletSchema;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Collects the table schemas of one cluster, one keyspace at a time.
 *
 * <p>For every keyspace the schema is read from a serving tablet of that keyspace, chosen from a
 * tablet list fetched beforehand. When several tablets qualify the last one in list order wins.
 * Keyspaces without a serving tablet, and keyspaces whose schema has no tables, are left out of
 * the result.
 *
 * @since 1.0.0
 */
public class SchemaDiscovery {
  private static final Logger logger = Logger.getLogger(SchemaDiscovery.class.getName());

  private final FanOut fanOut;

  /**
   * Creates a schema discovery pipeline.
   *
   * @param fanOut the fan-out runner used for the per-keyspace branches
   */
  public SchemaDiscovery(FanOut fanOut) {
    this.fanOut = fanOut;
  }

  /**
   * Returns the non-empty keyspace schemas of the cluster.
   *
   * @param ctx the request context
   * @param cluster the cluster
   * @param tablets the cluster's tablets, in listing order
   * @return one schema per keyspace with at least one table, in no particular order
   * @throws AdminException if listing keyspaces or fetching any schema fails
   */
  public List<Schema> discover(RequestContext ctx, Cluster cluster, List<Tablet> tablets)
      throws AdminException {
    cluster.getControlPlane().dial(ctx);
    List<KeyspaceDescriptor> keyspaces = cluster.getControlPlane().listKeyspaces(ctx);
    ClusterInfo info = cluster.toInfo();

    return fanOut.<KeyspaceDescriptor, Schema>gather(
        ctx,
        keyspaces,
        (scope, keyspace) -> {
          Tablet tablet = selectServingTablet(keyspace.getName(), tablets);
          if (tablet == null) {
            logger.log(
                Level.FINE,
                "No serving tablet for keyspace "
                    + keyspace.getName()
                    + " in cluster "
                    + cluster.getId()
                    + ", skipping");
            return Collections.emptyList();
          }

          TabletSchema schema = cluster.getControlPlane().getSchema(scope, tablet.getAlias());
          if (schema.getTableDefinitions().isEmpty()) {
            logger.log(
                Level.FINE,
                "Keyspace " + keyspace.getName() + " in cluster " + cluster.getId() + " is empty");
            return Collections.emptyList();
          }
          return Collections.singletonList(
              new Schema(info, keyspace.getName(), schema.getTableDefinitions()));
        });
  }

  /**
   * Returns the last serving tablet of the keyspace.
   *
   * @param keyspace the keyspace name
   * @param tablets candidate tablets in listing order
   * @return the selected tablet, or null if none is serving
   */
  static Tablet selectServingTablet(String keyspace, List<Tablet> tablets) {
    Tablet selected = null;
    for (Tablet tablet : tablets) {
      if (keyspace.equals(tablet.getKeyspace()) && tablet.isServing()) {
        selected = tablet;
      }
    }
    return selected;
  }
}
