package com.segmentcache.server.integrations;

import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogCapture;
import com.launchdarkly.logging.Logs;
import com.segmentcache.server.Components;
import com.segmentcache.server.SegmentsClient;
import com.segmentcache.server.subsystems.ClientContext;
import com.segmentcache.server.subsystems.LoggingConfiguration;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;

@SuppressWarnings("javadoc")
public class LoggingConfigurationBuilderTest {
  private static final ClientContext BASIC_CONTEXT = new ClientContext(null);

  @Test
  public void testDefaults() {
    LoggingConfiguration c = Components.logging().build(BASIC_CONTEXT);
    assertEquals(SegmentsClient.class.getName(), c.getBaseLoggerName());
    assertNotNull(c.getLogAdapter());
  }

  @Test
  public void canSetBaseLoggerName() {
    LoggingConfiguration c = Components.logging().baseLoggerName("segments").build(BASIC_CONTEXT);
    assertEquals("segments", c.getBaseLoggerName());
  }

  @Test
  public void canSetLogAdapterAndLevel() {
    LogCapture logSink = Logs.capture();
    LoggingConfiguration c = Components.logging()
        .adapter(logSink)
        .level(LDLogLevel.WARN)
        .build(BASIC_CONTEXT);
    LDLogger logger = LDLogger.withAdapter(c.getLogAdapter(), "");
    logger.debug("message 1");
    logger.info("message 2");
    logger.warn("message 3");
    logger.error("message 4");
    assertThat(logSink.getMessageStrings(), contains("WARN:message 3", "ERROR:message 4"));
  }

  @Test
  public void defaultLevelIsInfo() {
    LogCapture logSink = Logs.capture();
    LoggingConfiguration c = Components.logging(logSink).build(BASIC_CONTEXT);
    LDLogger logger = LDLogger.withAdapter(c.getLogAdapter(), "");
    logger.debug("message 1");
    logger.info("message 2");
    logger.warn("message 3");
    logger.error("message 4");
    assertThat(logSink.getMessageStrings(), contains("INFO:message 2", "WARN:message 3", "ERROR:message 4"));
  }

  @Test
  public void contextUsesConfiguredBaseName() {
    LogCapture logSink = Logs.capture();
    LoggingConfiguration c = Components.logging(logSink).baseLoggerName("base").build(BASIC_CONTEXT);
    new ClientContext(c).getBaseLogger().subLogger("Store").info("hello");
    assertEquals("base.Store", logSink.getMessages().get(0).getLoggerName());
  }
}
