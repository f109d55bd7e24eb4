package com.scylladb.admin;

import com.scylladb.admin.explain.ExplainEngine;
import com.scylladb.admin.explain.ExplainOptions;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Configuration for {@link ClusterAdmin}.
 *
 * <p>Example:
 *
 * <pre>{@code
 * AdminConfig config = AdminConfig.builder()
 *     .withRequestTimeout(Duration.ofSeconds(10))
 *     .withFanOutPolicy(FanOutPolicy.FAIL_FAST)
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class AdminConfig {
  /** Default timeout of requests made through the overloads without a {@link RequestContext}. */
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  /** Default fan-out policy. */
  public static final FanOutPolicy DEFAULT_FAN_OUT_POLICY = FanOutPolicy.RUN_TO_COMPLETION;

  private static final ExecutorService SHARED_EXECUTOR =
      Executors.newCachedThreadPool(new DaemonThreadFactory());

  private final ExecutorService executor;
  private final boolean sharedExecutor;
  private final FanOutPolicy fanOutPolicy;
  private final Duration requestTimeout;
  private final ExplainOptions explainOptions;
  private final Supplier<? extends ExplainEngine> explainEngineSupplier;

  private AdminConfig(Builder builder) {
    this.sharedExecutor = builder.executor == null;
    this.executor = sharedExecutor ? SHARED_EXECUTOR : builder.executor;
    this.fanOutPolicy = builder.fanOutPolicy;
    this.requestTimeout = builder.requestTimeout;
    this.explainOptions = builder.explainOptions;
    this.explainEngineSupplier = builder.explainEngineSupplier;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the executor running fan-out branches.
   *
   * @return the executor
   */
  public ExecutorService getExecutor() {
    return executor;
  }

  /**
   * Returns whether the executor is the process-wide default pool, which is never shut down.
   *
   * @return true for the default pool
   */
  public boolean isSharedExecutor() {
    return sharedExecutor;
  }

  public FanOutPolicy getFanOutPolicy() {
    return fanOutPolicy;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public ExplainOptions getExplainOptions() {
    return explainOptions;
  }

  /**
   * Returns the source of explain engines, one per request.
   *
   * @return the supplier, or null if explain is not available
   */
  public Supplier<? extends ExplainEngine> getExplainEngineSupplier() {
    return explainEngineSupplier;
  }

  @Override
  public String toString() {
    return "AdminConfig{fanOutPolicy="
        + fanOutPolicy
        + ", requestTimeout="
        + requestTimeout
        + ", sharedExecutor="
        + sharedExecutor
        + ", explainOptions="
        + explainOptions
        + "}";
  }

  private static final class DaemonThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread thread = new Thread(r, "cluster-admin-fanout-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }

  /** Builder for {@link AdminConfig}. */
  public static final class Builder {
    private ExecutorService executor;
    private FanOutPolicy fanOutPolicy = DEFAULT_FAN_OUT_POLICY;
    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    private ExplainOptions explainOptions = ExplainOptions.defaults();
    private Supplier<? extends ExplainEngine> explainEngineSupplier;

    private Builder() {}

    /**
     * Sets the executor running fan-out branches. The executor is shut down when the {@link
     * ClusterAdmin} is closed.
     *
     * <p>Branches may start nested fan-outs on the same executor, so a bounded pool must be larger
     * than the widest nesting or requests can deadlock.
     *
     * <p>Default: a shared, unbounded pool of daemon threads
     *
     * @param executor the executor
     * @return this builder instance
     */
    public Builder withExecutor(ExecutorService executor) {
      this.executor = executor;
      return this;
    }

    /**
     * Sets what happens to sibling branches after a failure.
     *
     * <p>Default: {@link FanOutPolicy#RUN_TO_COMPLETION}
     *
     * @param fanOutPolicy the policy
     * @return this builder instance
     */
    public Builder withFanOutPolicy(FanOutPolicy fanOutPolicy) {
      this.fanOutPolicy = fanOutPolicy;
      return this;
    }

    /**
     * Sets the timeout of requests made without an explicit {@link RequestContext}.
     *
     * <p>Default: {@link AdminConfig#DEFAULT_REQUEST_TIMEOUT}
     *
     * @param requestTimeout a positive duration
     * @return this builder instance
     */
    public Builder withRequestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    /**
     * Sets the options explain engines are initialized with.
     *
     * @param explainOptions the options
     * @return this builder instance
     */
    public Builder withExplainOptions(ExplainOptions explainOptions) {
      this.explainOptions = explainOptions;
      return this;
    }

    /**
     * Sets the source of explain engines. A new engine is requested for every explain call.
     *
     * @param explainEngineSupplier the supplier
     * @return this builder instance
     */
    public Builder withExplainEngineSupplier(
        Supplier<? extends ExplainEngine> explainEngineSupplier) {
      this.explainEngineSupplier = explainEngineSupplier;
      return this;
    }

    /**
     * Builds and returns an {@link AdminConfig} instance.
     *
     * @return a new {@link AdminConfig} instance
     * @throws IllegalArgumentException if the fan-out policy, timeout or explain options are
     *     invalid
     */
    public AdminConfig build() {
      if (fanOutPolicy == null) {
        throw new IllegalArgumentException("fanOutPolicy cannot be null");
      }
      if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
        throw new IllegalArgumentException(
            "requestTimeout must be positive, but was: " + requestTimeout);
      }
      if (explainOptions == null) {
        throw new IllegalArgumentException("explainOptions cannot be null");
      }
      return new AdminConfig(this);
    }
  }
}
