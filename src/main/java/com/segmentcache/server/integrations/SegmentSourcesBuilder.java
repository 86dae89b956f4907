package com.segmentcache.server.integrations;

import com.segmentcache.server.Components;
import com.segmentcache.server.subsystems.ComponentConfigurer;
import com.segmentcache.server.subsystems.SegmentSources;

import java.util.LinkedHashMap;
import java.util.Map;

import javax.sql.DataSource;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Contains methods for configuring the data sources that segment definitions are evaluated against.
 * <p>
 * Obtain an instance with {@link Components#sources()} and pass it to
 * {@link com.segmentcache.server.SegmentsConfig.Builder#sources(ComponentConfigurer)}:
 * <pre><code>
 *     SegmentsConfig config = new SegmentsConfig.Builder()
 *         .sources(
 *           Components.sources()
 *             .sql("default", primaryDataSource)
 *             .sql("replica", SqlSources.pooled(driver, replicaUrl, user, password))
 *             .execConnection("replica")
 *             .manager("users", userManager)
 *          )
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#sources()}.
 */
public abstract class SegmentSourcesBuilder implements ComponentConfigurer<SegmentSources> {
  /**
   * The default value for {@link #execConnection(String)}: {@code "default"}.
   */
  public static final String DEFAULT_EXEC_CONNECTION = "default";

  protected final Map<String, DataSource> sqlConnections = new LinkedHashMap<>();
  protected final Map<String, Object> managers = new LinkedHashMap<>();
  protected String execConnection = DEFAULT_EXEC_CONNECTION;

  /**
   * Registers a named SQL connection.
   * <p>
   * Raw query definitions are only ever executed on the connection selected by
   * {@link #execConnection(String)}. The data source should be pooled; see
   * {@link SqlSources#pooled(String, String, String, String)}.
   *
   * @param name the connection name
   * @param dataSource the JDBC data source
   * @return the builder
   */
  public SegmentSourcesBuilder sql(String name, DataSource dataSource) {
    sqlConnections.put(checkNotNull(name), checkNotNull(dataSource));
    return this;
  }

  /**
   * Registers a named manager object for manager lookup definitions.
   * <p>
   * A definition such as {@code managerLookup("users", "findByPlan", "gold")} calls the public
   * method {@code findByPlan} on the object registered as {@code "users"}. The method may return an
   * {@link Iterable}, a {@link java.util.stream.Stream}, an {@link java.util.Iterator} or an array,
   * of identifiers or of objects that have identifiers.
   *
   * @param name the manager name
   * @param manager the manager object
   * @return the builder
   */
  public SegmentSourcesBuilder manager(String name, Object manager) {
    managers.put(checkNotNull(name), checkNotNull(manager));
    return this;
  }

  /**
   * Selects the SQL connection that raw query definitions are executed on.
   * <p>
   * It is highly recommended that this be a read-only connection, since the queries are executed
   * verbatim. The default is {@link #DEFAULT_EXEC_CONNECTION}.
   *
   * @param name the connection name
   * @return the builder
   */
  public SegmentSourcesBuilder execConnection(String name) {
    this.execConnection = name == null ? DEFAULT_EXEC_CONNECTION : name;
    return this;
  }
}
