package com.scylladb.admin.schema;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scylladb.admin.Fixtures;
import com.scylladb.admin.FanOutPolicy;
import com.scylladb.admin.RequestContext;
import com.scylladb.admin.client.ControlPlaneClient;
import com.scylladb.admin.cluster.Cluster;
import com.scylladb.admin.errors.AggregateException;
import com.scylladb.admin.errors.RemoteCallException;
import com.scylladb.admin.internal.FanOut;
import com.scylladb.admin.model.ClusterInfo;
import com.scylladb.admin.model.KeyspaceDescriptor;
import com.scylladb.admin.model.Schema;
import com.scylladb.admin.model.ServingState;
import com.scylladb.admin.model.TableDefinition;
import com.scylladb.admin.model.Tablet;
import com.scylladb.admin.model.TabletAlias;
import com.scylladb.admin.model.TabletSchema;
import com.scylladb.admin.model.TabletType;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class SchemaDiscoveryTest {

  private ExecutorService executor;
  private SchemaDiscovery discovery;
  private ControlPlaneClient controlPlane;
  private Cluster cluster;

  @Before
  public void setUp() {
    executor = Executors.newCachedThreadPool();
    discovery = new SchemaDiscovery(new FanOut(executor, FanOutPolicy.RUN_TO_COMPLETION));
    controlPlane = mock(ControlPlaneClient.class);
    cluster = Fixtures.cluster("c1", controlPlane);
  }

  @After
  public void tearDown() {
    executor.shutdownNow();
  }

  private static TabletSchema schemaOf(TableDefinition... tables) {
    return new TabletSchema("", Arrays.asList(tables));
  }

  @Test(timeout = 5000)
  public void testSchemaPerKeyspace() throws Exception {
    when(controlPlane.listKeyspaces(any()))
        .thenReturn(Collections.singletonList(KeyspaceDescriptor.named("ks1")));
    when(controlPlane.getSchema(any(), eq(new TabletAlias("zone1", 1))))
        .thenReturn(
            schemaOf(
                TableDefinition.of("t1", "CREATE TABLE t1 (id int)"),
                TableDefinition.of("t2", "CREATE TABLE t2 (id int)")));

    List<Schema> schemas =
        discovery.discover(
            RequestContext.background(),
            cluster,
            Collections.singletonList(Fixtures.servingReplica("h1", "ks1", 1)));

    assertEquals(1, schemas.size());
    Schema schema = schemas.get(0);
    assertEquals(new ClusterInfo("c1", "c1-name"), schema.getCluster());
    assertEquals("ks1", schema.getKeyspace());
    assertEquals(2, schema.getTableDefinitions().size());
    verify(controlPlane).dial(any());
  }

  @Test(timeout = 5000)
  public void testLastServingTabletWins() throws Exception {
    when(controlPlane.listKeyspaces(any()))
        .thenReturn(Collections.singletonList(KeyspaceDescriptor.named("ks1")));
    when(controlPlane.getSchema(any(), any()))
        .thenReturn(schemaOf(TableDefinition.of("t1", "CREATE TABLE t1 (id int)")));
    List<Tablet> tablets =
        Arrays.asList(
            Fixtures.servingReplica("first", "ks1", 1),
            Fixtures.tablet("down", "ks1", TabletType.REPLICA, ServingState.NOT_SERVING, 2),
            Fixtures.servingReplica("last", "ks1", 3),
            Fixtures.servingReplica("other-ks", "ks2", 4),
            Fixtures.tablet("after", "ks1", TabletType.RDONLY, ServingState.NOT_SERVING, 5));

    discovery.discover(RequestContext.background(), cluster, tablets);

    verify(controlPlane).getSchema(any(), eq(new TabletAlias("zone1", 3)));
    verify(controlPlane, never()).getSchema(any(), eq(new TabletAlias("zone1", 1)));
  }

  @Test
  public void testSelectServingTabletReturnsNullWithoutServingTablet() {
    List<Tablet> tablets =
        Collections.singletonList(
            Fixtures.tablet("h1", "ks1", TabletType.REPLICA, ServingState.NOT_SERVING, 1));
    assertNull(SchemaDiscovery.selectServingTablet("ks1", tablets));
  }

  @Test(timeout = 5000)
  public void testKeyspaceWithoutServingTabletIsSkipped() throws Exception {
    when(controlPlane.listKeyspaces(any()))
        .thenReturn(
            Arrays.asList(KeyspaceDescriptor.named("ks1"), KeyspaceDescriptor.named("ks2")));
    when(controlPlane.getSchema(any(), any()))
        .thenReturn(schemaOf(TableDefinition.of("t1", "CREATE TABLE t1 (id int)")));

    List<Schema> schemas =
        discovery.discover(
            RequestContext.background(),
            cluster,
            Collections.singletonList(Fixtures.servingReplica("h1", "ks1", 1)));

    assertEquals(1, schemas.size());
    assertEquals("ks1", schemas.get(0).getKeyspace());
  }

  @Test(timeout = 5000)
  public void testEmptySchemaIsSkipped() throws Exception {
    when(controlPlane.listKeyspaces(any()))
        .thenReturn(Collections.singletonList(KeyspaceDescriptor.named("ks1")));
    when(controlPlane.getSchema(any(), any())).thenReturn(schemaOf());

    List<Schema> schemas =
        discovery.discover(
            RequestContext.background(),
            cluster,
            Collections.singletonList(Fixtures.servingReplica("h1", "ks1", 1)));

    assertTrue(schemas.isEmpty());
  }

  @Test(timeout = 5000)
  public void testNoKeyspacesYieldsNoSchemas() throws Exception {
    when(controlPlane.listKeyspaces(any())).thenReturn(Collections.<KeyspaceDescriptor>emptyList());

    assertTrue(
        discovery
            .discover(RequestContext.background(), cluster, Collections.<Tablet>emptyList())
            .isEmpty());
  }

  @Test(timeout = 5000)
  public void testSchemaFailureFailsTheCluster() throws Exception {
    when(controlPlane.listKeyspaces(any()))
        .thenReturn(
            Arrays.asList(KeyspaceDescriptor.named("ks1"), KeyspaceDescriptor.named("ks2")));
    when(controlPlane.getSchema(any(), eq(new TabletAlias("zone1", 1))))
        .thenReturn(schemaOf(TableDefinition.of("t1", "CREATE TABLE t1 (id int)")));
    when(controlPlane.getSchema(any(), eq(new TabletAlias("zone1", 2))))
        .thenThrow(new RemoteCallException("GET schema", 500, "boom"));

    try {
      discovery.discover(
          RequestContext.background(),
          cluster,
          Arrays.asList(
              Fixtures.servingReplica("h1", "ks1", 1), Fixtures.servingReplica("h2", "ks2", 2)));
      fail("Expected AggregateException");
    } catch (AggregateException e) {
      assertEquals(1, e.getErrors().size());
      assertTrue(e.getMessage().contains("boom"));
    }
  }

  @Test(expected = RemoteCallException.class)
  public void testListKeyspacesFailurePropagates() throws Exception {
    when(controlPlane.listKeyspaces(any()))
        .thenThrow(new RemoteCallException("GET /keyspaces", 503, "down"));
    discovery.discover(RequestContext.background(), cluster, Collections.<Tablet>emptyList());
  }
}
