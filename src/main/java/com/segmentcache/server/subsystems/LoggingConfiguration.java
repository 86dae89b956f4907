package com.segmentcache.server.subsystems;

import com.launchdarkly.logging.LDLogAdapter;
import com.segmentcache.server.integrations.LoggingConfigurationBuilder;

/**
 * Encapsulates the library's general logging configuration.
 * <p>
 * Use {@link LoggingConfigurationBuilder} to construct an instance.
 */
public final class LoggingConfiguration {
  private final String baseLoggerName;
  private final LDLogAdapter logAdapter;

  /**
   * Creates an instance.
   *
   * @param baseLoggerName see {@link #getBaseLoggerName()}
   * @param logAdapter see {@link #getLogAdapter()}
   */
  public LoggingConfiguration(String baseLoggerName, LDLogAdapter logAdapter) {
    this.baseLoggerName = baseLoggerName;
    this.logAdapter = logAdapter;
  }

  /**
   * Returns the configured base logger name.
   * @return the logger name
   */
  public String getBaseLoggerName() {
    return baseLoggerName;
  }

  /**
   * Returns the configured logging adapter.
   * @return the logging adapter
   */
  public LDLogAdapter getLogAdapter() {
    return logAdapter;
  }
}
