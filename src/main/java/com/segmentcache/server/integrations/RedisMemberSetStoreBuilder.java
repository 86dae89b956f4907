package com.segmentcache.server.integrations;

import com.segmentcache.server.subsystems.ClientContext;
import com.segmentcache.server.subsystems.ComponentConfigurer;
import com.segmentcache.server.subsystems.MemberSetStore;

import java.net.URI;
import java.time.Duration;

import static com.google.common.base.Preconditions.checkNotNull;

import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Protocol;

/**
 * Settings for the Redis member set store, obtained from {@link Redis#memberSetStore()}.
 * <p>
 * Each segment's versions, current-version pointer and version counter live under keys that start
 * with {@code PREFIX:SEGMENT_KEY:}, so several clients, or several independent caches, can share one
 * Redis database as long as each cache has its own {@link #prefix(String)}. Clients that share a
 * prefix share segments: a version promoted by one is what the others read.
 *
 * <pre><code>
 *     SegmentsConfig config = new SegmentsConfig.Builder()
 *         .store(Redis.memberSetStore().uri(URI.create("redis://cache-host")).prefix("billing"))
 *         .build();
 * </code></pre>
 */
public final class RedisMemberSetStoreBuilder implements ComponentConfigurer<MemberSetStore> {
  /**
   * The default Redis URI: {@code redis://localhost:6379}
   */
  public static final URI DEFAULT_URI = URI.create("redis://localhost:6379");

  /**
   * The default key prefix.
   */
  public static final String DEFAULT_PREFIX = "segments";

  URI uri = DEFAULT_URI;
  String prefix = DEFAULT_PREFIX;
  Duration connectTimeout = Duration.ofMillis(Protocol.DEFAULT_TIMEOUT);
  Duration socketTimeout = Duration.ofMillis(Protocol.DEFAULT_TIMEOUT);
  Integer database = null;
  String password = null;
  boolean tls = false;
  JedisPoolConfig poolConfig = null;

  RedisMemberSetStoreBuilder() {
  }

  /**
   * Selects the Redis database. Overrides a database number given in the URI.
   *
   * @param database the database number, or null to use the URI's
   * @return the builder
   */
  public RedisMemberSetStoreBuilder database(Integer database) {
    this.database = database;
    return this;
  }

  /**
   * Sets the AUTH password. Overrides a password given in the URI.
   *
   * @param password the password
   * @return the builder
   */
  public RedisMemberSetStoreBuilder password(String password) {
    this.password = password;
    return this;
  }

  /**
   * Connects over TLS even if the URI scheme is {@code redis:}.
   *
   * @param tls true to use TLS
   * @return the builder
   */
  public RedisMemberSetStoreBuilder tls(boolean tls) {
    this.tls = tls;
    return this;
  }

  /**
   * Sets the Redis URI.
   *
   * @param redisUri the URI
   * @return the builder
   */
  public RedisMemberSetStoreBuilder uri(URI redisUri) {
    this.uri = checkNotNull(redisUri);
    return this;
  }

  /**
   * Sets the prefix of every key this store writes. An empty or null prefix means {@link #DEFAULT_PREFIX}.
   *
   * @param prefix the key prefix
   * @return the builder
   */
  public RedisMemberSetStoreBuilder prefix(String prefix) {
    this.prefix = prefix;
    return this;
  }

  /**
   * Replaces the Jedis pool settings.
   *
   * @param poolConfig the pool configuration
   * @return the builder
   */
  public RedisMemberSetStoreBuilder poolConfig(JedisPoolConfig poolConfig) {
    this.poolConfig = poolConfig;
    return this;
  }

  /**
   * Sets the connect timeout. Null restores the default.
   *
   * @param connectTimeout the timeout
   * @return the builder
   */
  public RedisMemberSetStoreBuilder connectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout == null ? Duration.ofMillis(Protocol.DEFAULT_TIMEOUT) : connectTimeout;
    return this;
  }

  /**
   * Sets the socket read timeout. This bounds every store call, including the upload of a new
   * version's members. Null restores the default.
   *
   * @param socketTimeout the timeout
   * @return the builder
   */
  public RedisMemberSetStoreBuilder socketTimeout(Duration socketTimeout) {
    this.socketTimeout = socketTimeout == null ? Duration.ofMillis(Protocol.DEFAULT_TIMEOUT) : socketTimeout;
    return this;
  }

  @Override
  public MemberSetStore build(ClientContext context) {
    return new RedisMemberSetStoreImpl(this, context.getBaseLogger().subLogger("Store"));
  }
}
