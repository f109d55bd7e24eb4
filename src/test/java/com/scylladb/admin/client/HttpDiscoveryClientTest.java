package com.scylladb.admin.client;

import static org.junit.Assert.*;

import com.scylladb.admin.RequestContext;
import com.scylladb.admin.errors.RemoteCallException;
import com.scylladb.admin.model.Gate;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class HttpDiscoveryClientTest {

  private HttpServer server;
  private HttpDiscoveryClient client;
  private volatile int responseCode = 200;
  private volatile String responseBody = "[]";
  private volatile String lastQuery;

  @Before
  public void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/gates",
        exchange -> {
          lastQuery = exchange.getRequestURI().getRawQuery();
          byte[] body = responseBody.getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(responseCode, body.length);
          try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
          }
        });
    server.start();
    URI base = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    client = new HttpDiscoveryClient(new JsonHttpTransport(base, 1000, 1000, 1));
  }

  @After
  public void tearDown() throws IOException {
    client.close();
    if (server != null) {
      server.stop(0);
    }
  }

  @Test(timeout = 5000)
  public void testDiscoverGates() throws Exception {
    responseBody =
        "[{\"cell\": \"zone1\", \"hostname\": \"gate-1\", \"keyspaces\": [\"commerce\"],"
            + " \"pool\": \"pool1\"}]";

    List<Gate> gates = client.discoverGates(RequestContext.background(), null);

    assertEquals(1, gates.size());
    assertEquals("gate-1", gates.get(0).getHostname());
    assertEquals(Collections.singletonList("commerce"), gates.get(0).getKeyspaces());
    assertNull(lastQuery);
  }

  @Test(timeout = 5000)
  public void testCellsAreSentAsRepeatedParameter() throws Exception {
    client.discoverGates(RequestContext.background(), Arrays.asList("zone1", "zone2"));
    assertEquals("cell=zone1&cell=zone2", lastQuery);
  }

  @Test(timeout = 5000)
  public void testErrorStatus() throws Exception {
    responseCode = 502;
    responseBody = "bad gateway";
    try {
      client.discoverGates(RequestContext.background(), null);
      fail("Expected RemoteCallException");
    } catch (RemoteCallException e) {
      assertEquals(502, e.getStatus());
      assertTrue(e.getOperation().startsWith("GET "));
    }
  }
}
