package com.segmentcache.server;

import com.segmentcache.server.interfaces.ConcurrentRefreshPolicy;
import com.segmentcache.server.subsystems.ComponentConfigurer;
import com.segmentcache.server.subsystems.LoggingConfiguration;
import com.segmentcache.server.subsystems.MemberSetStore;
import com.segmentcache.server.subsystems.SegmentSources;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * This class exposes advanced configuration options for the {@link SegmentsClient}. Instances of
 * this class must be constructed with a {@link com.segmentcache.server.SegmentsConfig.Builder}.
 */
public final class SegmentsConfig {
  /**
   * The default value for {@link Builder#versionRetention(Duration)}: 10 seconds.
   */
  public static final Duration DEFAULT_VERSION_RETENTION = Duration.ofSeconds(10);

  /**
   * The default value for {@link Builder#refreshThreads(int)}.
   */
  public static final int DEFAULT_REFRESH_THREADS = 4;

  static final SegmentsConfig DEFAULT = new Builder().build();

  final ComponentConfigurer<LoggingConfiguration> logging;
  final ComponentConfigurer<SegmentSources> sources;
  final ComponentConfigurer<MemberSetStore> store;
  final ConcurrentRefreshPolicy concurrentRefreshPolicy;
  final Duration refreshTimeout;
  final int refreshThreads;
  final Duration versionRetention;

  SegmentsConfig(Builder builder) {
    this.logging = builder.logging == null ? Components.logging() : builder.logging;
    this.sources = builder.sources == null ? Components.sources() : builder.sources;
    this.store = builder.store == null ? Components.inMemoryStore() : builder.store;
    this.concurrentRefreshPolicy = builder.concurrentRefreshPolicy;
    this.refreshTimeout = builder.refreshTimeout;
    this.refreshThreads = builder.refreshThreads;
    this.versionRetention = builder.versionRetention;
  }

  /**
   * A <a href="http://en.wikipedia.org/wiki/Builder_pattern">builder</a> that helps construct
   * {@link com.segmentcache.server.SegmentsConfig} objects. Builder calls can be chained, enabling the
   * following pattern:
   * <pre>
   * SegmentsConfig config = new SegmentsConfig.Builder()
   *      .store(Redis.memberSetStore())
   *      .refreshTimeout(Duration.ofMinutes(5))
   *      .build()
   * </pre>
   */
  public static class Builder {
    private ComponentConfigurer<LoggingConfiguration> logging = null;
    private ComponentConfigurer<SegmentSources> sources = null;
    private ComponentConfigurer<MemberSetStore> store = null;
    private ConcurrentRefreshPolicy concurrentRefreshPolicy = ConcurrentRefreshPolicy.JOIN_IN_FLIGHT;
    private Duration refreshTimeout = null;
    private int refreshThreads = DEFAULT_REFRESH_THREADS;
    private Duration versionRetention = DEFAULT_VERSION_RETENTION;

    /**
     * Creates a builder with all configuration parameters set to the default
     */
    public Builder() {
    }

    /**
     * Creates a {@link SegmentsConfig.Builder} from the provided {@link SegmentsConfig}
     *
     * @param config to be used to initialize the builder
     * @return the builder
     */
    public static Builder fromConfig(SegmentsConfig config) {
      Builder newBuilder = new Builder();
      newBuilder.logging = config.logging;
      newBuilder.sources = config.sources;
      newBuilder.store = config.store;
      newBuilder.concurrentRefreshPolicy = config.concurrentRefreshPolicy;
      newBuilder.refreshTimeout = config.refreshTimeout;
      newBuilder.refreshThreads = config.refreshThreads;
      newBuilder.versionRetention = config.versionRetention;
      return newBuilder;
    }

    /**
     * Sets the client's logging configuration, using a factory object. This object is normally a
     * configuration builder obtained from {@link Components#logging()}, which has methods for
     * setting individual logging-related properties.
     *
     * @param logging the logging configuration factory
     * @return the builder
     */
    public Builder logging(ComponentConfigurer<LoggingConfiguration> logging) {
      this.logging = logging;
      return this;
    }

    /**
     * Sets the data sources that segment definitions are evaluated against. This object is
     * normally a configuration builder obtained from {@link Components#sources()}.
     * <p>
     * If not set, there are no SQL connections and no managers, so only static list definitions can
     * be refreshed.
     *
     * @param sources the sources factory
     * @return the builder
     */
    public Builder sources(ComponentConfigurer<SegmentSources> sources) {
      this.sources = sources;
      return this;
    }

    /**
     * Sets the implementation of the member set store to be used for holding materialized segments.
     * The default is {@link Components#inMemoryStore()}; for a shared store use
     * {@link com.segmentcache.server.integrations.Redis#memberSetStore()}.
     *
     * @param store the store factory
     * @return the builder
     */
    public Builder store(ComponentConfigurer<MemberSetStore> store) {
      this.store = store;
      return this;
    }

    /**
     * Sets what happens when a refresh is requested for a segment that is already being refreshed.
     * The default is {@link ConcurrentRefreshPolicy#JOIN_IN_FLIGHT}.
     *
     * @param policy the policy
     * @return the builder
     */
    public Builder concurrentRefreshPolicy(ConcurrentRefreshPolicy policy) {
      this.concurrentRefreshPolicy = policy == null ? ConcurrentRefreshPolicy.JOIN_IN_FLIGHT : policy;
      return this;
    }

    /**
     * Sets the maximum time that {@link SegmentsClient#refresh(String)} will wait. If it is
     * exceeded, the refresh is cancelled, the previous member set stays current, and a
     * {@link RefreshException} is thrown. A null or non-positive value means no limit, which is the
     * default.
     *
     * @param refreshTimeout the timeout, or null
     * @return the builder
     */
    public Builder refreshTimeout(Duration refreshTimeout) {
      this.refreshTimeout = refreshTimeout == null || refreshTimeout.isZero() || refreshTimeout.isNegative() ?
          null : refreshTimeout;
      return this;
    }

    /**
     * Sets the number of worker threads that refreshes run on. Refreshes of different segments run
     * in parallel up to this limit. The default is {@link #DEFAULT_REFRESH_THREADS}.
     *
     * @param refreshThreads the thread count; must be at least 1
     * @return the builder
     */
    public Builder refreshThreads(int refreshThreads) {
      checkArgument(refreshThreads > 0, "refreshThreads must be positive");
      this.refreshThreads = refreshThreads;
      return this;
    }

    /**
     * Sets how long a superseded member set version is kept after a newer one is promoted, so that
     * readers which already started using it can finish. The default is
     * {@link #DEFAULT_VERSION_RETENTION}.
     *
     * @param versionRetention the grace period; null restores the default
     * @return the builder
     */
    public Builder versionRetention(Duration versionRetention) {
      this.versionRetention = versionRetention == null || versionRetention.isNegative() ?
          DEFAULT_VERSION_RETENTION : versionRetention;
      return this;
    }

    /**
     * Builds the configured {@link SegmentsConfig} object.
     *
     * @return the {@link SegmentsConfig} configured by this builder
     */
    public SegmentsConfig build() {
      return new SegmentsConfig(this);
    }
  }
}
