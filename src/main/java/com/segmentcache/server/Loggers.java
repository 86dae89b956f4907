package com.segmentcache.server;

/**
 * Static logger names to be shared by implementation code in the main {@code com.segmentcache.server}
 * package.
 * <p>
 * Messages are logged under the base name of the {@link SegmentsClient} class, or with one of these
 * suffixes to show the area of functionality. Code in other packages such as
 * {@code com.segmentcache.server.integrations} cannot use these package-private fields, but should
 * still use equivalent logger names as appropriate.
 */
abstract class Loggers {
  private Loggers() {}

  static final String BASE_LOGGER_NAME = SegmentsClient.class.getName();
  static final String REFRESH_LOGGER_NAME = "Refresh";
  static final String SOURCE_LOGGER_NAME = "Source";
}
