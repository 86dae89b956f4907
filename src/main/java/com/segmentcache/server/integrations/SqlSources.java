package com.segmentcache.server.integrations;

import org.apache.ibatis.datasource.pooled.PooledDataSource;

import javax.sql.DataSource;

/**
 * Factory methods for SQL connections used by raw query definitions.
 */
public abstract class SqlSources {
  private SqlSources() {}

  /**
   * Returns a pooled JDBC data source.
   * <p>
   * Connections are reused across refreshes. Pass the result to
   * {@link SegmentSourcesBuilder#sql(String, DataSource)}.
   *
   * @param driver the JDBC driver class name
   * @param url the JDBC URL
   * @param username the database user
   * @param password the database password
   * @return a pooled data source
   */
  public static DataSource pooled(String driver, String url, String username, String password) {
    return new PooledDataSource(driver, url, username, password);
  }

  /**
   * Returns a pooled JDBC data source with a limit on the number of open connections.
   *
   * @param driver the JDBC driver class name
   * @param url the JDBC URL
   * @param username the database user
   * @param password the database password
   * @param maxActiveConnections the maximum number of connections in use at once
   * @return a pooled data source
   */
  public static DataSource pooled(String driver, String url, String username, String password,
      int maxActiveConnections) {
    PooledDataSource ds = new PooledDataSource(driver, url, username, password);
    ds.setPoolMaximumActiveConnections(maxActiveConnections);
    return ds;
  }
}
