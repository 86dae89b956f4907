package com.segmentcache.server;

import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.Logs;
import com.segmentcache.server.ComponentsImpl.InMemoryStoreFactory;
import com.segmentcache.server.ComponentsImpl.LoggingConfigurationBuilderImpl;
import com.segmentcache.server.ComponentsImpl.SegmentSourcesBuilderImpl;
import com.segmentcache.server.integrations.LoggingConfigurationBuilder;
import com.segmentcache.server.integrations.SegmentSourcesBuilder;
import com.segmentcache.server.subsystems.ComponentConfigurer;
import com.segmentcache.server.subsystems.MemberSetStore;

/**
 * Provides configurable factories for the standard implementations of the segment cache's
 * component interfaces.
 * <p>
 * Some of the configuration options in {@link SegmentsConfig.Builder} affect the entire client, but
 * others are specific to one component, such as where member sets are stored. For the latter, the
 * standard way to specify a configuration is to call one of the static methods in
 * {@link Components} (such as {@link #sources()}), apply any desired configuration change to the
 * object that that method returns (such as {@link SegmentSourcesBuilder#manager(String, Object)}),
 * and then use the corresponding method in {@link SegmentsConfig.Builder} (such as
 * {@link SegmentsConfig.Builder#sources(ComponentConfigurer)}) to use that configured component.
 */
public abstract class Components {
  private Components() {}

  /**
   * Returns a configuration object for using the default in-memory implementation of a member set
   * store.
   * <p>
   * Since it is the default, you do not normally need to call this method, unless you need to
   * create a client whose store must be in-memory even if another store was previously configured.
   * Member sets held in memory are lost when the client is closed.
   *
   * @return a factory object
   * @see SegmentsConfig.Builder#store(ComponentConfigurer)
   * @see com.segmentcache.server.integrations.Redis#memberSetStore()
   */
  public static ComponentConfigurer<MemberSetStore> inMemoryStore() {
    return InMemoryStoreFactory.INSTANCE;
  }

  /**
   * Returns a configuration builder for the data sources that segment definitions are evaluated
   * against: named SQL connections and named manager objects.
   * <pre><code>
   *     SegmentsConfig config = new SegmentsConfig.Builder()
   *         .sources(
   *              Components.sources()
   *                  .sql("default", dataSource)
   *                  .manager("users", userManager)
   *         )
   *         .build();
   * </code></pre>
   *
   * @return a configuration builder
   * @see SegmentsConfig.Builder#sources(ComponentConfigurer)
   */
  public static SegmentSourcesBuilder sources() {
    return new SegmentSourcesBuilderImpl();
  }

  /**
   * Returns a configuration builder for the client's logging configuration.
   * <p>
   * Passing this to {@link SegmentsConfig.Builder#logging(ComponentConfigurer)},
   * after setting any desired properties on the builder, applies this configuration to the client.
   * <pre><code>
   *     SegmentsConfig config = new SegmentsConfig.Builder()
   *         .logging(
   *              Components.logging()
   *                  .level(LDLogLevel.DEBUG)
   *         )
   *         .build();
   * </code></pre>
   *
   * @return a configuration builder
   * @see SegmentsConfig.Builder#logging(ComponentConfigurer)
   */
  public static LoggingConfigurationBuilder logging() {
    return new LoggingConfigurationBuilderImpl();
  }

  /**
   * Returns a configuration builder for the client's logging configuration, specifying the
   * implementation of logging to use.
   * <p>
   * This is a shortcut for <code>Components.logging().adapter(logAdapter)</code>. The
   * <a href="https://github.com/launchdarkly/java-logging"><code>com.launchdarkly.logging</code></a>
   * API defines the {@link LDLogAdapter} interface to specify where log output should be sent. By
   * default, it is set to {@link com.launchdarkly.logging.LDSLF4J#adapter()} if SLF4J is in the
   * classpath, and to {@link Logs#toConsole()} otherwise.
   *
   * @param logAdapter the log adapter
   * @return a configuration builder
   * @see LoggingConfigurationBuilder#adapter(LDLogAdapter)
   */
  public static LoggingConfigurationBuilder logging(LDLogAdapter logAdapter) {
    return logging().adapter(logAdapter);
  }

  /**
   * Returns a configuration builder that turns off logging.
   * <p>
   * It is equivalent to <code>Components.logging(com.launchdarkly.logging.Logs.none())</code>.
   *
   * @return a configuration builder
   */
  public static LoggingConfigurationBuilder noLogging() {
    return logging().adapter(Logs.none());
  }
}
