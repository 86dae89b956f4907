package com.segmentcache.server;

import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.LDSLF4J;
import com.launchdarkly.logging.Logs;
import com.segmentcache.server.integrations.LoggingConfigurationBuilder;
import com.segmentcache.server.integrations.SegmentSourcesBuilder;
import com.segmentcache.server.subsystems.ClientContext;
import com.segmentcache.server.subsystems.ComponentConfigurer;
import com.segmentcache.server.subsystems.LoggingConfiguration;
import com.segmentcache.server.subsystems.MemberSetStore;
import com.segmentcache.server.subsystems.SegmentSources;

/**
 * This class contains the package-private implementations of component factories and builders whose
 * public factory methods are in {@link Components}.
 */
abstract class ComponentsImpl {
  private ComponentsImpl() {}

  static final class InMemoryStoreFactory implements ComponentConfigurer<MemberSetStore> {
    static final InMemoryStoreFactory INSTANCE = new InMemoryStoreFactory();

    @Override
    public MemberSetStore build(ClientContext context) {
      return new InMemoryMemberSetStore();
    }
  }

  static final class SegmentSourcesBuilderImpl extends SegmentSourcesBuilder {
    @Override
    public SegmentSources build(ClientContext context) {
      if (!sqlConnections.isEmpty() && !sqlConnections.containsKey(execConnection)) {
        context.getBaseLogger().subLogger(Loggers.SOURCE_LOGGER_NAME).warn(
            "Raw query connection \"{}\" is not one of the configured SQL connections {}",
            execConnection, sqlConnections.keySet());
      }
      return new SegmentSources(sqlConnections, managers, execConnection);
    }
  }

  static final class LoggingConfigurationBuilderImpl extends LoggingConfigurationBuilder {
    @Override
    public LoggingConfiguration build(ClientContext clientContext) {
      LDLogAdapter adapter = logAdapter == null ? getDefaultLogAdapter() : logAdapter;
      LDLogAdapter filteredAdapter = Logs.level(adapter,
          minimumLevel == null ? LDLogLevel.INFO : minimumLevel);
      // If the adapter is for a framework like SLF4J that has its own external configuration
      // system, then calling Logs.level here has no effect and filteredAdapter will be just the
      // same as adapter.
      String name = baseName == null ? Loggers.BASE_LOGGER_NAME : baseName;
      return new LoggingConfiguration(name, filteredAdapter);
    }

    private static LDLogAdapter getDefaultLogAdapter() {
      // If SLF4J is present in the classpath, use that by default; otherwise use the console.
      try {
        Class.forName("org.slf4j.LoggerFactory");
        return LDSLF4J.adapter();
      } catch (ClassNotFoundException e) {
        return Logs.toConsole();
      }
    }
  }
}
