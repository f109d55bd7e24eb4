package com.scylladb.admin.client;

import static org.junit.Assert.*;

import com.scylladb.admin.RequestContext;
import com.scylladb.admin.errors.RemoteCallException;
import com.scylladb.admin.errors.RequestCancelledException;
import com.scylladb.admin.model.KeyspaceDescriptor;
import com.scylladb.admin.model.ServingState;
import com.scylladb.admin.model.ServingVSchema;
import com.scylladb.admin.model.Shard;
import com.scylladb.admin.model.Tablet;
import com.scylladb.admin.model.TabletAlias;
import com.scylladb.admin.model.TabletSchema;
import com.scylladb.admin.model.TabletType;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests {@link HttpControlPlaneClient} against an in-process HTTP server. Each test registers the
 * bodies it needs by request path.
 */
public class HttpControlPlaneClientTest {

  private HttpServer server;
  private ExecutorService serverExecutor;
  private HttpControlPlaneClient client;
  private JsonHttpTransport transport;
  private final Map<String, String> bodies = new ConcurrentHashMap<>();
  private final Map<String, Integer> statuses = new ConcurrentHashMap<>();
  private final List<String> requested = new CopyOnWriteArrayList<>();
  private volatile long delayMillis = 0;

  @Before
  public void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/",
        exchange -> {
          String path = exchange.getRequestURI().getRawPath();
          requested.add(path);
          if (delayMillis > 0) {
            try {
              Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
          }
          String body = bodies.getOrDefault(path, "not found");
          int status = statuses.getOrDefault(path, bodies.containsKey(path) ? 200 : 404);
          byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
          try {
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
              os.write(bytes);
            }
          } catch (IOException e) {
            // client went away
          }
        });
    serverExecutor = Executors.newCachedThreadPool();
    server.setExecutor(serverExecutor);
    server.start();

    URI base = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/api");
    transport = new JsonHttpTransport(base, 1000, 2000, 2);
    client = new HttpControlPlaneClient(transport);
  }

  @After
  public void tearDown() throws IOException {
    client.close();
    if (server != null) {
      server.stop(0);
    }
    serverExecutor.shutdownNow();
  }

  @Test(timeout = 5000)
  public void testDialPingsHealthOnce() throws Exception {
    bodies.put("/api/health", "ok");
    client.dial(RequestContext.background());
    client.dial(RequestContext.background());

    assertEquals(1, requested.size());
    assertEquals("/api/health", requested.get(0));
  }

  @Test(timeout = 5000)
  public void testDialFailureIsRemoteError() throws Exception {
    statuses.put("/api/health", 503);
    bodies.put("/api/health", "unavailable");
    try {
      client.dial(RequestContext.background());
      fail("Expected RemoteCallException");
    } catch (RemoteCallException e) {
      assertEquals(503, e.getStatus());
      assertTrue(e.getMessage().contains("unavailable"));
    }
  }

  @Test(timeout = 5000)
  public void testListKeyspaces() throws Exception {
    bodies.put(
        "/api/keyspaces",
        "[{\"name\": \"commerce\", \"keyspaceType\": \"NORMAL\", \"unknownField\": 1},"
            + " {\"name\": \"customer\"}]");

    List<KeyspaceDescriptor> keyspaces = client.listKeyspaces(RequestContext.background());

    assertEquals(2, keyspaces.size());
    assertEquals("commerce", keyspaces.get(0).getName());
    assertEquals("NORMAL", keyspaces.get(0).getKeyspaceType());
  }

  @Test(timeout = 5000)
  public void testNullBodyBecomesEmptyList() throws Exception {
    bodies.put("/api/tablets", "null");
    assertTrue(client.listTablets(RequestContext.background()).isEmpty());
  }

  @Test(timeout = 5000)
  public void testFindShardsEncodesKeyspace() throws Exception {
    bodies.put(
        "/api/keyspaces/commerce/shards",
        "[{\"keyspace\": \"commerce\", \"name\": \"-80\","
            + " \"shard\": {\"keyRange\": {\"end\": \"80\"}, \"isPrimaryServing\": true}}]");

    List<Shard> shards = client.findShards(RequestContext.background(), "commerce");

    assertEquals(1, shards.size());
    assertEquals("-80", shards.get(0).getName());
    assertTrue(shards.get(0).getShard().isPrimaryServing());
    assertEquals("80", shards.get(0).getShard().getKeyRange().getEnd());
  }

  @Test(timeout = 5000)
  public void testGetSchemaUsesAliasInPath() throws Exception {
    bodies.put(
        "/api/tablets/zone1-0000000100/schema",
        "{\"databaseSchema\": \"CREATE DATABASE x\", \"tableDefinitions\": ["
            + "{\"name\": \"t1\", \"schema\": \"CREATE TABLE t1 (id int)\"}]}");

    TabletSchema schema =
        client.getSchema(RequestContext.background(), new TabletAlias("zone1", 100));

    assertEquals(1, schema.getTableDefinitions().size());
    assertEquals("CREATE TABLE t1 (id int)", schema.getTableDefinitions().get(0).getSchema());
  }

  @Test(timeout = 5000)
  public void testGetServingVSchemaKeepsOpaqueJson() throws Exception {
    bodies.put(
        "/api/srvvschema/zone1",
        "{\"keyspaces\": {\"commerce\": {\"sharded\": true, \"tables\": {\"t\": {}}}}}");

    ServingVSchema vschema = client.getServingVSchema(RequestContext.background(), "zone1");

    assertTrue(vschema.getKeyspace("commerce").get("sharded").asBoolean());
    assertNull(vschema.getKeyspace("customer"));
  }

  @Test(timeout = 5000)
  public void testListTablets() throws Exception {
    bodies.put(
        "/api/tablets",
        "[{\"hostname\": \"h1\", \"keyspace\": \"commerce\", \"shard\": \"-\","
            + " \"type\": \"REPLICA\", \"alias\": {\"cell\": \"zone1\", \"uid\": 101},"
            + " \"state\": \"SERVING\"}]");

    List<Tablet> tablets = client.listTablets(RequestContext.background());

    assertEquals(1, tablets.size());
    Tablet tablet = tablets.get(0);
    assertEquals("h1", tablet.getHostname());
    assertEquals(TabletType.REPLICA, tablet.getType());
    assertEquals(ServingState.SERVING, tablet.getState());
    assertEquals(new TabletAlias("zone1", 101), tablet.getAlias());
    assertNull(tablet.getCluster());
  }

  @Test(timeout = 5000)
  public void testMalformedBodyIsRemoteError() throws Exception {
    bodies.put("/api/keyspaces", "{not json");
    try {
      client.listKeyspaces(RequestContext.background());
      fail("Expected RemoteCallException");
    } catch (RemoteCallException e) {
      assertEquals(RemoteCallException.NO_STATUS, e.getStatus());
    }
  }

  @Test(timeout = 5000)
  public void testDeadlineAbortsSlowCall() throws Exception {
    delayMillis = 2000;
    bodies.put("/api/tablets", "[]");
    RequestContext ctx = RequestContext.withTimeout(Duration.ofMillis(200));
    try {
      client.listTablets(ctx);
      fail("Expected RequestCancelledException");
    } catch (RequestCancelledException e) {
      assertTrue(e.isDeadlineExceeded());
    }
  }

  @Test(timeout = 5000)
  public void testCancelledContextMakesNoCall() throws Exception {
    RequestContext ctx = RequestContext.background();
    ctx.cancel();
    try {
      client.listTablets(ctx);
      fail("Expected RequestCancelledException");
    } catch (RequestCancelledException e) {
      assertFalse(e.isDeadlineExceeded());
    }
    assertTrue(requested.isEmpty());
  }

  /** With a pool of two connections a single leaked connection per error would block quickly. */
  @Test(timeout = 10000)
  public void testNoConnectionLeakOnErrorStatuses() throws Exception {
    AtomicInteger failures = new AtomicInteger();
    statuses.put("/api/keyspaces", 500);
    bodies.put("/api/keyspaces", "internal error");
    for (int i = 0; i < 10; i++) {
      try {
        client.listKeyspaces(RequestContext.background());
      } catch (RemoteCallException e) {
        failures.incrementAndGet();
      }
    }
    assertEquals(10, failures.get());
    assertEquals(0, transport.getConnectionPoolStats().getLeased());
  }
}
