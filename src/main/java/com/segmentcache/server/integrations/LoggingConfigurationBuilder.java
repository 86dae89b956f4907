package com.segmentcache.server.integrations;

import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.segmentcache.server.Components;
import com.segmentcache.server.subsystems.ComponentConfigurer;
import com.segmentcache.server.subsystems.LoggingConfiguration;

/**
 * Contains methods for configuring the library's logging behavior.
 * <p>
 * If you want to set non-default values for any of these properties, create a builder with
 * {@link Components#logging()}, change its properties with the methods of this class, and pass it
 * to {@link com.segmentcache.server.SegmentsConfig.Builder#logging(ComponentConfigurer)}:
 * <pre><code>
 *     SegmentsConfig config = new SegmentsConfig.Builder()
 *         .logging(
 *           Components.logging()
 *             .baseLoggerName("segments")
 *             .level(LDLogLevel.DEBUG)
 *          )
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#logging()}.
 */
public abstract class LoggingConfigurationBuilder implements ComponentConfigurer<LoggingConfiguration> {
  protected String baseName = null;
  protected LDLogAdapter logAdapter = null;
  protected LDLogLevel minimumLevel = null;

  /**
   * Specifies the implementation of logging to use.
   * <p>
   * The <code>com.launchdarkly.logging</code> API defines the {@link LDLogAdapter} interface to
   * specify where log output should be sent. If no adapter is specified, the library uses SLF4J if
   * it is present in the classpath, and otherwise {@link com.launchdarkly.logging.Logs#toConsole()}.
   *
   * @param logAdapter an {@link LDLogAdapter} for the desired logging implementation
   * @return the builder
   */
  public LoggingConfigurationBuilder adapter(LDLogAdapter logAdapter) {
    this.logAdapter = logAdapter;
    return this;
  }

  /**
   * Specifies a custom base logger name.
   * <p>
   * By default, the library uses a base logger name of <code>com.segmentcache.server.SegmentsClient</code>.
   * Messages are logged either under this name, or with a suffix to indicate what general area of
   * functionality is involved:
   * <ul>
   * <li> <code>.Refresh</code>: refresh outcomes and version garbage collection. </li>
   * <li> <code>.Source</code>: evaluation of segment definitions against SQL connections and managers. </li>
   * <li> <code>.Store</code>: the member set store, such as Redis connection messages. </li>
   * </ul>
   *
   * @param name the base logger name
   * @return the builder
   */
  public LoggingConfigurationBuilder baseLoggerName(String name) {
    this.baseName = name;
    return this;
  }

  /**
   * Specifies the lowest level of logging to enable.
   * <p>
   * This only applies to adapters that do not have their own level configuration, such as the
   * console adapter. The default is {@link LDLogLevel#INFO}.
   *
   * @param minimumLevel the lowest level of logging to enable
   * @return the builder
   */
  public LoggingConfigurationBuilder level(LDLogLevel minimumLevel) {
    this.minimumLevel = minimumLevel;
    return this;
  }
}
