package com.segmentcache.server.integrations;

import org.junit.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Protocol;

@SuppressWarnings("javadoc")
public class RedisMemberSetStoreBuilderTest {
  @Test
  public void testDefaultValues() {
    RedisMemberSetStoreBuilder conf = Redis.memberSetStore();
    assertEquals(URI.create("redis://localhost:6379"), conf.uri);
    assertEquals(RedisMemberSetStoreBuilder.DEFAULT_URI, conf.uri);
    assertNull(conf.database);
    assertNull(conf.password);
    assertFalse(conf.tls);
    assertEquals(Duration.ofMillis(Protocol.DEFAULT_TIMEOUT), conf.connectTimeout);
    assertEquals(Duration.ofMillis(Protocol.DEFAULT_TIMEOUT), conf.socketTimeout);
    assertEquals("segments", conf.prefix);
    assertNull(conf.poolConfig);
  }

  @Test
  public void testUriConfigured() {
    URI uri = URI.create("redis://other:9999");
    RedisMemberSetStoreBuilder conf = Redis.memberSetStore().uri(uri);
    assertEquals(uri, conf.uri);
  }

  @Test(expected = NullPointerException.class)
  public void uriCannotBeNull() {
    Redis.memberSetStore().uri(null);
  }

  @Test
  public void testDatabaseConfigured() {
    RedisMemberSetStoreBuilder conf = Redis.memberSetStore().database(3);
    assertEquals(Integer.valueOf(3), conf.database);
  }

  @Test
  public void testPasswordConfigured() {
    RedisMemberSetStoreBuilder conf = Redis.memberSetStore().password("secret");
    assertEquals("secret", conf.password);
  }

  @Test
  public void testTlsConfigured() {
    RedisMemberSetStoreBuilder conf = Redis.memberSetStore().tls(true);
    assertTrue(conf.tls);
  }

  @Test
  public void testPrefixConfigured() {
    RedisMemberSetStoreBuilder conf = Redis.memberSetStore().prefix("app1");
    assertEquals("app1", conf.prefix);
  }

  @Test
  public void testTimeoutsConfigured() {
    RedisMemberSetStoreBuilder conf = Redis.memberSetStore()
        .connectTimeout(Duration.ofSeconds(1))
        .socketTimeout(Duration.ofSeconds(2));
    assertEquals(Duration.ofSeconds(1), conf.connectTimeout);
    assertEquals(Duration.ofSeconds(2), conf.socketTimeout);
  }

  @Test
  public void nullTimeoutsRestoreDefaults() {
    RedisMemberSetStoreBuilder conf = Redis.memberSetStore()
        .connectTimeout(Duration.ofSeconds(1))
        .connectTimeout(null)
        .socketTimeout(null);
    assertEquals(Duration.ofMillis(Protocol.DEFAULT_TIMEOUT), conf.connectTimeout);
    assertEquals(Duration.ofMillis(Protocol.DEFAULT_TIMEOUT), conf.socketTimeout);
  }

  @Test
  public void testPoolConfigConfigured() {
    JedisPoolConfig poolConfig = new JedisPoolConfig();
    RedisMemberSetStoreBuilder conf = Redis.memberSetStore().poolConfig(poolConfig);
    assertSame(poolConfig, conf.poolConfig);
  }
}
