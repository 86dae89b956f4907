package com.segmentcache.server.subsystems;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

import javax.sql.DataSource;

/**
 * The data sources that segment definitions are evaluated against.
 * <p>
 * Raw query definitions run on the SQL connection named by {@link #getExecConnection()}; manager
 * lookup definitions call methods on the objects registered in {@link #getManagers()}.
 * Use {@link com.segmentcache.server.integrations.SegmentSourcesBuilder} to construct an instance.
 */
public final class SegmentSources {
  private final Map<String, DataSource> sqlConnections;
  private final Map<String, Object> managers;
  private final String execConnection;

  /**
   * Creates an instance.
   *
   * @param sqlConnections named SQL connections
   * @param managers named lookup managers
   * @param execConnection the name of the connection used for raw queries
   */
  public SegmentSources(Map<String, DataSource> sqlConnections, Map<String, Object> managers,
      String execConnection) {
    this.sqlConnections = sqlConnections == null ? ImmutableMap.of() : ImmutableMap.copyOf(sqlConnections);
    this.managers = managers == null ? ImmutableMap.of() : ImmutableMap.copyOf(managers);
    this.execConnection = execConnection;
  }

  /**
   * Returns the named SQL connections.
   * @return an immutable map
   */
  public Map<String, DataSource> getSqlConnections() {
    return sqlConnections;
  }

  /**
   * Returns the named lookup managers.
   * @return an immutable map
   */
  public Map<String, Object> getManagers() {
    return managers;
  }

  /**
   * Returns the name of the connection that raw queries are executed on. This should normally be a
   * read-only replica.
   * @return the connection name
   */
  public String getExecConnection() {
    return execConnection;
  }

  /**
   * Returns the connection that raw queries are executed on.
   * @return the data source, or null if no connection has that name
   */
  public DataSource getExecDataSource() {
    return sqlConnections.get(execConnection);
  }
}
