package com.scylladb.admin.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.scylladb.admin.RequestContext;
import com.scylladb.admin.errors.AdminException;
import com.scylladb.admin.errors.RemoteCallException;
import com.scylladb.admin.errors.RequestCancelledException;
import com.scylladb.admin.internal.Json;
import java.io.Closeable;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.pool.PoolStats;
import org.apache.http.util.EntityUtils;

/**
 * Issues JSON GET requests against one remote endpoint over a pooled Apache HttpClient.
 *
 * <p>Each call is bounded by the request context: connect and socket timeouts are capped by the
 * time left until the deadline, and cancelling the context aborts the in-flight request. The
 * response entity is always consumed so that the pooled connection is returned, also for error
 * statuses.
 *
 * <p>Thread-safe.
 *
 * @since 1.0.0
 */
public class JsonHttpTransport implements Closeable {
  private static final Logger logger = Logger.getLogger(JsonHttpTransport.class.getName());

  /** Longest response body excerpt included in error messages. */
  static final int MAX_ERROR_BODY_CHARS = 512;

  private final URI baseUri;
  private final int connectTimeoutMillis;
  private final int socketTimeoutMillis;
  private final PoolingHttpClientConnectionManager connectionManager;
  private final CloseableHttpClient httpClient;

  /**
   * Creates a transport for the given endpoint.
   *
   * @param baseUri the endpoint; request paths are appended to its path
   * @param connectTimeoutMillis connect timeout in milliseconds
   * @param socketTimeoutMillis socket read timeout in milliseconds
   * @param maxConnections size of the connection pool
   */
  public JsonHttpTransport(
      URI baseUri, int connectTimeoutMillis, int socketTimeoutMillis, int maxConnections) {
    if (baseUri == null) {
      throw new IllegalArgumentException("baseUri cannot be null");
    }
    this.baseUri = baseUri;
    this.connectTimeoutMillis = connectTimeoutMillis;
    this.socketTimeoutMillis = socketTimeoutMillis;
    this.connectionManager = new PoolingHttpClientConnectionManager();
    this.connectionManager.setMaxTotal(maxConnections);
    this.connectionManager.setDefaultMaxPerRoute(maxConnections);
    this.httpClient = HttpClients.custom().setConnectionManager(connectionManager).build();
  }

  /**
   * Returns the endpoint this transport talks to.
   *
   * @return the base URI
   */
  public URI getBaseUri() {
    return baseUri;
  }

  /**
   * Builds a request URI below the base URI. Segments are percent-encoded.
   *
   * @param segments path segments appended to the base path
   * @param query query parameters, each name may repeat; may be empty
   * @return the request URI
   */
  public URI resolve(List<String> segments, Map<String, List<String>> query) {
    try {
      URIBuilder builder = new URIBuilder(baseUri);
      List<String> path = new ArrayList<>();
      for (String segment : builder.getPathSegments()) {
        if (!segment.isEmpty()) {
          path.add(segment);
        }
      }
      path.addAll(segments);
      builder.setPathSegments(path);
      for (Map.Entry<String, List<String>> param : query.entrySet()) {
        for (String value : param.getValue()) {
          builder.addParameter(param.getKey(), value);
        }
      }
      return builder.build();
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid request path " + segments + " for " + baseUri, e);
    }
  }

  /**
   * Builds a request URI below the base URI without query parameters.
   *
   * @param segments path segments appended to the base path
   * @return the request URI
   */
  public URI resolve(String... segments) {
    List<String> path = new ArrayList<>();
    Collections.addAll(path, segments);
    return resolve(path, Collections.<String, List<String>>emptyMap());
  }

  /**
   * Performs a GET request and maps the JSON response body.
   *
   * @param ctx the request context
   * @param uri the request URI
   * @param type the expected response type
   * @param <T> the response type
   * @return the mapped response body
   * @throws RemoteCallException on transport failure, non-200 status or malformed body
   * @throws RequestCancelledException if the context is done before or during the call
   */
  public <T> T get(RequestContext ctx, URI uri, TypeReference<T> type) throws AdminException {
    String body = fetch(ctx, uri);
    try {
      return Json.MAPPER.readValue(body, type);
    } catch (JsonProcessingException e) {
      throw new RemoteCallException("GET " + uri, e);
    }
  }

  /**
   * Performs a GET request and only checks that it succeeds. The body is discarded.
   *
   * @param ctx the request context
   * @param uri the request URI
   * @throws RemoteCallException on transport failure or non-200 status
   * @throws RequestCancelledException if the context is done before or during the call
   */
  public void ping(RequestContext ctx, URI uri) throws AdminException {
    fetch(ctx, uri);
  }

  private String fetch(RequestContext ctx, URI uri) throws AdminException {
    String operation = "GET " + uri;
    ctx.checkActive();

    HttpGet request = new HttpGet(uri);
    request.setConfig(requestConfig(ctx));
    Runnable abort = request::abort;
    ctx.addCancelListener(abort);
    try (CloseableHttpResponse response = httpClient.execute(request)) {
      int status = response.getStatusLine().getStatusCode();
      HttpEntity entity = response.getEntity();
      String body = entity != null ? EntityUtils.toString(entity, StandardCharsets.UTF_8) : "";
      if (status != HttpURLConnection.HTTP_OK) {
        throw new RemoteCallException(operation, status, excerpt(body));
      }
      logger.log(Level.FINEST, operation + " returned " + body.length() + " chars");
      return body;
    } catch (IOException e) {
      if (ctx.isDone()) {
        throw new RequestCancelledException(ctx.isDeadlineExceeded());
      }
      throw new RemoteCallException(operation, e);
    } finally {
      ctx.removeCancelListener(abort);
    }
  }

  private RequestConfig requestConfig(RequestContext ctx) {
    int connectTimeout = connectTimeoutMillis;
    int socketTimeout = socketTimeoutMillis;
    if (ctx.hasDeadline()) {
      long left = Math.max(1L, ctx.remaining(TimeUnit.MILLISECONDS));
      connectTimeout = (int) Math.min(connectTimeout, left);
      socketTimeout = (int) Math.min(socketTimeout, left);
    }
    return RequestConfig.custom()
        .setConnectTimeout(connectTimeout)
        .setConnectionRequestTimeout(connectTimeout)
        .setSocketTimeout(socketTimeout)
        .build();
  }

  private static String excerpt(String body) {
    String trimmed = body.trim();
    if (trimmed.length() <= MAX_ERROR_BODY_CHARS) {
      return trimmed;
    }
    return trimmed.substring(0, MAX_ERROR_BODY_CHARS) + "...";
  }

  /**
   * Returns statistics of the connection pool, for diagnostics and tests.
   *
   * @return the pool statistics
   */
  public PoolStats getConnectionPoolStats() {
    return connectionManager.getTotalStats();
  }

  /** Releases pooled connections. */
  @Override
  public void close() throws IOException {
    httpClient.close();
  }
}
