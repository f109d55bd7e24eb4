package com.scylladb.admin.cluster;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.net.URI;
import java.util.Objects;

/**
 * Configuration of one backend cluster: its identity and the endpoints used to reach it.
 *
 * <p>Instances are created with {@link #builder()}, parsed from the command line form with {@link
 * #parse(String)}, or read from JSON with {@link ClusterConfigLoader}.
 *
 * <p>Example:
 *
 * <pre>{@code
 * ClusterConfig config = ClusterConfig.builder()
 *     .withId("prod")
 *     .withName("Production")
 *     .withDiscoveryEndpoint(URI.create("http://discovery.prod:15000"))
 *     .withControlPlaneEndpoint(URI.create("http://vtctld.prod:15000/api"))
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ClusterConfig {
  /** Default connect timeout in milliseconds. */
  public static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 5000;

  /** Default socket read timeout in milliseconds. */
  public static final int DEFAULT_SOCKET_TIMEOUT_MILLIS = 30000;

  /** Default number of pooled connections per endpoint. */
  public static final int DEFAULT_MAX_CONNECTIONS = 20;

  private final String id;
  private final String name;
  private final URI discoveryEndpoint;
  private final URI controlPlaneEndpoint;
  private final int connectTimeoutMillis;
  private final int socketTimeoutMillis;
  private final int maxConnections;

  private ClusterConfig(Builder builder) {
    this.id = builder.id;
    this.name = builder.name != null && !builder.name.isEmpty() ? builder.name : builder.id;
    this.discoveryEndpoint = builder.discoveryEndpoint;
    this.controlPlaneEndpoint = builder.controlPlaneEndpoint;
    this.connectTimeoutMillis = builder.connectTimeoutMillis;
    this.socketTimeoutMillis = builder.socketTimeoutMillis;
    this.maxConnections = builder.maxConnections;
  }

  @JsonCreator
  static ClusterConfig fromJson(
      @JsonProperty("id") String id,
      @JsonProperty("name") String name,
      @JsonProperty("discovery") URI discovery,
      @JsonProperty("vtctld") URI controlPlane,
      @JsonProperty("connectTimeoutMillis") Integer connectTimeoutMillis,
      @JsonProperty("socketTimeoutMillis") Integer socketTimeoutMillis,
      @JsonProperty("maxConnections") Integer maxConnections) {
    Builder builder =
        builder()
            .withId(id)
            .withName(name)
            .withDiscoveryEndpoint(discovery)
            .withControlPlaneEndpoint(controlPlane);
    if (connectTimeoutMillis != null) {
      builder.withConnectTimeoutMillis(connectTimeoutMillis);
    }
    if (socketTimeoutMillis != null) {
      builder.withSocketTimeoutMillis(socketTimeoutMillis);
    }
    if (maxConnections != null) {
      builder.withMaxConnections(maxConnections);
    }
    return builder.build();
  }

  /**
   * Parses the command line form {@code key=value[,key=value...]}.
   *
   * <p>Recognized keys: {@code id}, {@code name}, {@code discovery}, {@code vtctld}, {@code
   * connect-timeout-ms}, {@code socket-timeout-ms} and {@code max-connections}. Unknown keys are
   * rejected.
   *
   * @param spec the flag value, e.g. {@code id=c1,name=one,discovery=http://d:1,vtctld=http://v:2}
   * @return the parsed configuration
   * @throws IllegalArgumentException if the value is malformed or the result is invalid
   */
  public static ClusterConfig parse(String spec) {
    if (spec == null || spec.trim().isEmpty()) {
      throw new IllegalArgumentException("cluster spec cannot be null or empty");
    }
    Builder builder = builder();
    for (String pair : spec.split(",")) {
      String trimmed = pair.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int eq = trimmed.indexOf('=');
      if (eq <= 0) {
        throw new IllegalArgumentException("expected key=value in cluster spec, got: " + trimmed);
      }
      String key = trimmed.substring(0, eq).trim();
      String value = trimmed.substring(eq + 1).trim();
      switch (key) {
        case "id":
          builder.withId(value);
          break;
        case "name":
          builder.withName(value);
          break;
        case "discovery":
          builder.withDiscoveryEndpoint(toUri(key, value));
          break;
        case "vtctld":
          builder.withControlPlaneEndpoint(toUri(key, value));
          break;
        case "connect-timeout-ms":
          builder.withConnectTimeoutMillis(toInt(key, value));
          break;
        case "socket-timeout-ms":
          builder.withSocketTimeoutMillis(toInt(key, value));
          break;
        case "max-connections":
          builder.withMaxConnections(toInt(key, value));
          break;
        default:
          throw new IllegalArgumentException("unknown key in cluster spec: " + key);
      }
    }
    return builder.build();
  }

  private static URI toUri(String key, String value) {
    try {
      return URI.create(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("invalid URI for " + key + ": " + value, e);
    }
  }

  private static int toInt(String key, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid number for " + key + ": " + value, e);
    }
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  @JsonProperty("id")
  public String getId() {
    return id;
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("discovery")
  public URI getDiscoveryEndpoint() {
    return discoveryEndpoint;
  }

  @JsonProperty("vtctld")
  public URI getControlPlaneEndpoint() {
    return controlPlaneEndpoint;
  }

  @JsonProperty("connectTimeoutMillis")
  public int getConnectTimeoutMillis() {
    return connectTimeoutMillis;
  }

  @JsonProperty("socketTimeoutMillis")
  public int getSocketTimeoutMillis() {
    return socketTimeoutMillis;
  }

  @JsonProperty("maxConnections")
  public int getMaxConnections() {
    return maxConnections;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ClusterConfig)) {
      return false;
    }
    ClusterConfig other = (ClusterConfig) obj;
    return connectTimeoutMillis == other.connectTimeoutMillis
        && socketTimeoutMillis == other.socketTimeoutMillis
        && maxConnections == other.maxConnections
        && id.equals(other.id)
        && name.equals(other.name)
        && discoveryEndpoint.equals(other.discoveryEndpoint)
        && controlPlaneEndpoint.equals(other.controlPlaneEndpoint);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        id,
        name,
        discoveryEndpoint,
        controlPlaneEndpoint,
        connectTimeoutMillis,
        socketTimeoutMillis,
        maxConnections);
  }

  @Override
  public String toString() {
    return "ClusterConfig{id='"
        + id
        + "', name='"
        + name
        + "', discovery="
        + discoveryEndpoint
        + ", vtctld="
        + controlPlaneEndpoint
        + "}";
  }

  /** Builder for {@link ClusterConfig}. */
  public static final class Builder {
    private String id;
    private String name;
    private URI discoveryEndpoint;
    private URI controlPlaneEndpoint;
    private int connectTimeoutMillis = DEFAULT_CONNECT_TIMEOUT_MILLIS;
    private int socketTimeoutMillis = DEFAULT_SOCKET_TIMEOUT_MILLIS;
    private int maxConnections = DEFAULT_MAX_CONNECTIONS;

    private Builder() {}

    /**
     * Sets the unique cluster id.
     *
     * @param id the id, must not be empty
     * @return this builder instance
     */
    public Builder withId(String id) {
      this.id = id;
      return this;
    }

    /**
     * Sets the display name. Defaults to the id.
     *
     * @param name the display name
     * @return this builder instance
     */
    public Builder withName(String name) {
      this.name = name;
      return this;
    }

    /**
     * Sets the discovery endpoint used to list gateways.
     *
     * @param endpoint an http or https URI
     * @return this builder instance
     */
    public Builder withDiscoveryEndpoint(URI endpoint) {
      this.discoveryEndpoint = endpoint;
      return this;
    }

    /**
     * Sets the control-plane endpoint used for topology and schema queries.
     *
     * @param endpoint an http or https URI
     * @return this builder instance
     */
    public Builder withControlPlaneEndpoint(URI endpoint) {
      this.controlPlaneEndpoint = endpoint;
      return this;
    }

    /**
     * Sets the connect timeout.
     *
     * <p>Default: {@link ClusterConfig#DEFAULT_CONNECT_TIMEOUT_MILLIS}
     *
     * @param millis timeout in milliseconds, must be positive
     * @return this builder instance
     */
    public Builder withConnectTimeoutMillis(int millis) {
      this.connectTimeoutMillis = millis;
      return this;
    }

    /**
     * Sets the socket read timeout.
     *
     * <p>Default: {@link ClusterConfig#DEFAULT_SOCKET_TIMEOUT_MILLIS}
     *
     * @param millis timeout in milliseconds, must be positive
     * @return this builder instance
     */
    public Builder withSocketTimeoutMillis(int millis) {
      this.socketTimeoutMillis = millis;
      return this;
    }

    /**
     * Sets the connection pool size of each endpoint.
     *
     * <p>Default: {@link ClusterConfig#DEFAULT_MAX_CONNECTIONS}
     *
     * @param maxConnections pool size, must be positive
     * @return this builder instance
     */
    public Builder withMaxConnections(int maxConnections) {
      this.maxConnections = maxConnections;
      return this;
    }

    /**
     * Builds and returns a {@link ClusterConfig} instance.
     *
     * @return a new {@link ClusterConfig} instance
     * @throws IllegalArgumentException if the id is empty, an endpoint is missing or not http(s),
     *     or a numeric setting is not positive
     */
    public ClusterConfig build() {
      if (id == null || id.isEmpty()) {
        throw new IllegalArgumentException("cluster id cannot be null or empty");
      }
      validateEndpoint("discovery", discoveryEndpoint);
      validateEndpoint("vtctld", controlPlaneEndpoint);
      if (connectTimeoutMillis <= 0) {
        throw new IllegalArgumentException(
            "connectTimeoutMillis must be positive, but was: " + connectTimeoutMillis);
      }
      if (socketTimeoutMillis <= 0) {
        throw new IllegalArgumentException(
            "socketTimeoutMillis must be positive, but was: " + socketTimeoutMillis);
      }
      if (maxConnections <= 0) {
        throw new IllegalArgumentException(
            "maxConnections must be positive, but was: " + maxConnections);
      }
      return new ClusterConfig(this);
    }

    private void validateEndpoint(String key, URI endpoint) {
      if (endpoint == null) {
        throw new IllegalArgumentException(key + " endpoint is required for cluster " + id);
      }
      String scheme = endpoint.getScheme();
      if (!"http".equals(scheme) && !"https".equals(scheme)) {
        throw new IllegalArgumentException(
            key + " endpoint of cluster " + id + " must be http or https, but was: " + endpoint);
      }
      if (endpoint.getHost() == null) {
        throw new IllegalArgumentException(
            key + " endpoint of cluster " + id + " has no host: " + endpoint);
      }
    }
  }
}
