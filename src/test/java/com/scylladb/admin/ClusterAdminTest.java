package com.scylladb.admin;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.scylladb.admin.client.ControlPlaneClient;
import com.scylladb.admin.client.DiscoveryClient;
import com.scylladb.admin.errors.AggregateException;
import com.scylladb.admin.errors.ErrorKind;
import com.scylladb.admin.errors.ExplainException;
import com.scylladb.admin.errors.RemoteCallException;
import com.scylladb.admin.errors.TabletNotFoundException;
import com.scylladb.admin.explain.ExplainRequest;
import com.scylladb.admin.explain.RecordingExplainEngine;
import com.scylladb.admin.internal.Json;
import com.scylladb.admin.model.ClusterInfo;
import com.scylladb.admin.model.Gate;
import com.scylladb.admin.model.Keyspace;
import com.scylladb.admin.model.KeyspaceDescriptor;
import com.scylladb.admin.model.Schema;
import com.scylladb.admin.model.ServingVSchema;
import com.scylladb.admin.model.Shard;
import com.scylladb.admin.model.ShardRecord;
import com.scylladb.admin.model.TableDefinition;
import com.scylladb.admin.model.Tablet;
import com.scylladb.admin.model.TabletSchema;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class ClusterAdminTest {

  private ExecutorService executor;
  private DiscoveryClient discovery1;
  private DiscoveryClient discovery2;
  private ControlPlaneClient cp1;
  private ControlPlaneClient cp2;
  private ClusterAdmin admin;

  @Before
  public void setUp() throws Exception {
    executor = Executors.newCachedThreadPool();
    discovery1 = mock(DiscoveryClient.class);
    discovery2 = mock(DiscoveryClient.class);
    cp1 = mock(ControlPlaneClient.class);
    cp2 = mock(ControlPlaneClient.class);

    // c1 has keyspace ks1 with two tables; c2 has no keyspaces at all.
    when(cp1.listKeyspaces(any()))
        .thenReturn(Collections.singletonList(KeyspaceDescriptor.named("ks1")));
    when(cp1.listTablets(any()))
        .thenReturn(Collections.singletonList(Fixtures.servingReplica("c1-replica", "ks1", 1)));
    when(cp1.getSchema(any(), any()))
        .thenReturn(
            new TabletSchema(
                "",
                Arrays.asList(
                    TableDefinition.of("t1", "CREATE TABLE t1 (id int)"),
                    TableDefinition.of("t2", "CREATE TABLE t2 (id int)"))));
    when(cp1.findShards(any(), eq("ks1")))
        .thenReturn(
            Collections.singletonList(
                new Shard("ks1", "-", new ShardRecord(null, null, true))));
    when(cp2.listKeyspaces(any())).thenReturn(Collections.<KeyspaceDescriptor>emptyList());
    when(cp2.listTablets(any()))
        .thenReturn(Collections.singletonList(Fixtures.servingReplica("c2-replica", "ks9", 2)));

    admin =
        ClusterAdmin.builder()
            .addCluster(Fixtures.cluster("c2", discovery2, cp2))
            .addCluster(Fixtures.cluster("c1", discovery1, cp1))
            .withConfig(
                AdminConfig.builder()
                    .withExecutor(executor)
                    .withRequestTimeout(Duration.ofSeconds(5))
                    .withExplainEngineSupplier(RecordingExplainEngine::new)
                    .build())
            .build();
  }

  @After
  public void tearDown() throws Exception {
    admin.close();
  }

  @Test
  public void testGetClustersIsSortedById() {
    assertEquals(
        Arrays.asList(new ClusterInfo("c1", "c1-name"), new ClusterInfo("c2", "c2-name")),
        admin.getClusters());
  }

  @Test(timeout = 5000)
  public void testGetGatesStampsEachCluster() throws Exception {
    when(discovery1.discoverGates(any(), any()))
        .thenReturn(
            Collections.singletonList(
                new Gate("zone1", "gate-1", Collections.<String>emptyList(), "p", null)));
    when(discovery2.discoverGates(any(), any()))
        .thenReturn(
            Collections.singletonList(
                new Gate("zone2", "gate-2", Collections.<String>emptyList(), "p", null)));

    List<Gate> gates = admin.getGates(Collections.<String>emptyList());

    assertEquals(2, gates.size());
    for (Gate gate : gates) {
      String expected = gate.getHostname().equals("gate-1") ? "c1" : "c2";
      assertEquals(expected, gate.getCluster().getId());
    }
  }

  @Test(timeout = 5000)
  public void testUnknownClusterIdsQueryNothing() throws Exception {
    assertTrue(admin.getGates(Collections.singletonList("nope")).isEmpty());
    assertTrue(admin.getTablets(Collections.singletonList("nope")).isEmpty());
    verifyNoInteractions(discovery1, discovery2, cp1, cp2);
  }

  @Test(timeout = 5000)
  public void testGetKeyspacesIncludesShards() throws Exception {
    List<Keyspace> keyspaces = admin.getKeyspaces(Collections.<String>emptyList());

    assertEquals(1, keyspaces.size());
    Keyspace keyspace = keyspaces.get(0);
    assertEquals("c1", keyspace.getCluster().getId());
    assertEquals("ks1", keyspace.getKeyspace().getName());
    assertEquals(1, keyspace.getShards().size());
    verify(cp1).dial(any());
    verify(cp2).dial(any());
  }

  @Test(timeout = 5000)
  public void testGetSchemasAcrossClusters() throws Exception {
    List<Schema> schemas = admin.getSchemas(Collections.<String>emptyList());

    assertEquals(1, schemas.size());
    assertEquals("ks1", schemas.get(0).getKeyspace());
    assertEquals(2, schemas.get(0).getTableDefinitions().size());
  }

  @Test(timeout = 5000)
  public void testClusterWithoutKeyspacesHasNoSchemas() throws Exception {
    assertTrue(admin.getSchemas(Collections.singletonList("c2")).isEmpty());
  }

  @Test(timeout = 5000)
  public void testOneFailingClusterFailsTheWholeList() throws Exception {
    when(cp2.listTablets(any())).thenThrow(new RemoteCallException("GET /tablets", 500, "down"));
    try {
      admin.getTablets(Collections.<String>emptyList());
      fail("Expected AggregateException");
    } catch (AggregateException e) {
      assertEquals(1, e.getErrors().size());
      assertTrue(e.hasErrorOfKind(ErrorKind.REMOTE));
    }
    // The healthy cluster was still queried.
    verify(cp1).listTablets(any());
  }

  @Test(timeout = 5000)
  public void testGetTablets() throws Exception {
    List<Tablet> tablets = admin.getTablets(RequestContext.background(), null);
    HashSet<String> hosts = new HashSet<>();
    for (Tablet tablet : tablets) {
      hosts.add(tablet.getHostname());
    }
    assertEquals(new HashSet<>(Arrays.asList("c1-replica", "c2-replica")), hosts);
  }

  @Test(timeout = 5000)
  public void testGetTabletByHostname() throws Exception {
    Tablet tablet = admin.getTablet("c2-replica", null);
    assertEquals("c2", tablet.getCluster().getId());
  }

  @Test(timeout = 5000)
  public void testGetTabletNotFound() throws Exception {
    try {
      admin.getTablet("ghost", Arrays.asList("c1", "c2"));
      fail("Expected TabletNotFoundException");
    } catch (TabletNotFoundException e) {
      assertEquals(Arrays.asList("c1", "c2"), e.getSearchedClusters());
    }
  }

  @Test(timeout = 5000)
  public void testExplainRunsTheEngine() throws Exception {
    stubExplainMetadata();

    String plan = admin.explain(new ExplainRequest("c1", "ks1", "select 1; select 2"));

    assertEquals("select 1 => Route ROW\nselect 2 => Route ROW\n", plan);
    assertEquals(
        "CREATE TABLE t1 (id int);CREATE TABLE t2 (id int)",
        RecordingExplainEngine.lastInput.getSchema());
  }

  @Test(timeout = 5000)
  public void testExplainEngineFailure() throws Exception {
    stubExplainMetadata();
    try {
      admin.explain(new ExplainRequest("c1", "ks1", "bogus query"));
      fail("Expected ExplainException");
    } catch (ExplainException e) {
      assertTrue(e.getMessage().contains("syntax error"));
    }
  }

  @Test(timeout = 5000)
  public void testExplainWithoutEngine() throws Exception {
    stubExplainMetadata();
    try (ClusterAdmin noEngine =
        ClusterAdmin.builder().addCluster(Fixtures.cluster("c1", discovery1, cp1)).build()) {
      noEngine.explain(new ExplainRequest("c1", "ks1", "select 1"));
      fail("Expected ExplainException");
    } catch (ExplainException e) {
      assertEquals("no explain engine configured", e.getMessage());
    }
  }

  private void stubExplainMetadata() throws Exception {
    when(cp1.getServingVSchema(any(), eq("zone1")))
        .thenReturn(
            new ServingVSchema(
                Collections.<String, JsonNode>singletonMap(
                    "ks1", Json.MAPPER.readTree("{\"sharded\": false}"))));
  }

  @Test
  public void testDuplicateClusterIdsCloseTheAddedClusters() throws Exception {
    ControlPlaneClient first = mock(ControlPlaneClient.class);
    ControlPlaneClient second = mock(ControlPlaneClient.class);
    DiscoveryClient firstDiscovery = mock(DiscoveryClient.class);
    try {
      ClusterAdmin.builder()
          .addCluster(Fixtures.cluster("c1", firstDiscovery, first))
          .addCluster(Fixtures.cluster("c1", second))
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertEquals("duplicate cluster id: c1", e.getMessage());
    }
    verify(first).close();
    verify(firstDiscovery).close();
    verify(second).close();
  }

  @Test(timeout = 5000)
  public void testRepeatedReadsAreSetEqual() throws Exception {
    HashSet<Tablet> firstTablets = new HashSet<>(admin.getTablets(null));
    HashSet<Tablet> secondTablets = new HashSet<>(admin.getTablets(null));
    assertEquals(2, firstTablets.size());
    assertEquals(firstTablets, secondTablets);

    HashSet<Schema> firstSchemas = new HashSet<>(admin.getSchemas(null));
    HashSet<Schema> secondSchemas = new HashSet<>(admin.getSchemas(null));
    assertEquals(1, firstSchemas.size());
    assertEquals(firstSchemas, secondSchemas);
  }

  @Test
  public void testCloseClosesClustersAndOwnedExecutor() throws Exception {
    ExecutorService owned = Executors.newSingleThreadExecutor();
    ControlPlaneClient controlPlane = mock(ControlPlaneClient.class);
    DiscoveryClient disc = mock(DiscoveryClient.class);
    ClusterAdmin closing =
        ClusterAdmin.builder()
            .addCluster(Fixtures.cluster("c1", disc, controlPlane))
            .withConfig(AdminConfig.builder().withExecutor(owned).build())
            .build();

    closing.close();

    verify(disc).close();
    verify(controlPlane).close();
    assertTrue(owned.isShutdown());
  }
}
