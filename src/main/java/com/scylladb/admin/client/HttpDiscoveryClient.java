package com.scylladb.admin.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.scylladb.admin.RequestContext;
import com.scylladb.admin.errors.AdminException;
import com.scylladb.admin.model.Gate;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * {@link DiscoveryClient} backed by the cluster's HTTP discovery endpoint.
 *
 * <p>Gateways are listed with {@code GET /gates}, optionally filtered by repeated {@code cell}
 * query parameters. The response is a JSON array of gate objects.
 *
 * @since 1.0.0
 */
public class HttpDiscoveryClient implements DiscoveryClient {
  private static final TypeReference<List<Gate>> GATES = new TypeReference<List<Gate>>() {};

  private final JsonHttpTransport transport;

  /**
   * Creates a client over the given transport.
   *
   * @param transport the transport to the discovery endpoint
   */
  public HttpDiscoveryClient(JsonHttpTransport transport) {
    this.transport = transport;
  }

  /** {@inheritDoc} */
  @Override
  public List<Gate> discoverGates(RequestContext ctx, List<String> cells) throws AdminException {
    Map<String, List<String>> query =
        cells == null || cells.isEmpty()
            ? Collections.<String, List<String>>emptyMap()
            : Collections.singletonMap("cell", cells);
    List<Gate> gates = transport.get(ctx, transport.resolve(List.of("gates"), query), GATES);
    return gates != null ? gates : Collections.<Gate>emptyList();
  }

  /** {@inheritDoc} */
  @Override
  public void close() throws IOException {
    transport.close();
  }

  @Override
  public String toString() {
    return "HttpDiscoveryClient{" + transport.getBaseUri() + "}";
  }
}
