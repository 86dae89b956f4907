package com.segmentcache.server.subsystems;

import com.launchdarkly.logging.LDLogger;

/**
 * Context information provided by the {@link com.segmentcache.server.SegmentsClient} when creating
 * components.
 * <p>
 * This is passed as a parameter to {@link ComponentConfigurer#build(ClientContext)}. Component
 * implementations should use {@link #getBaseLogger()} rather than creating their own loggers, so
 * that all output respects the application's logging configuration.
 */
public class ClientContext {
  private final LDLogger baseLogger;

  /**
   * Creates an instance.
   *
   * @param logging the logging configuration; if null, logging is disabled
   */
  public ClientContext(LoggingConfiguration logging) {
    this.baseLogger = logging == null ? LDLogger.none() :
      LDLogger.withAdapter(logging.getLogAdapter(), logging.getBaseLoggerName());
  }

  /**
   * The base logger for the client. Components normally call {@link LDLogger#subLogger(String)} on
   * this to get a logger for their own area of functionality.
   *
   * @return the base logger
   */
  public LDLogger getBaseLogger() {
    return baseLogger;
  }
}
