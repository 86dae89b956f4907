package com.segmentcache.server.integrations;

/**
 * Integration between the segment cache and Redis.
 */
public abstract class Redis {
  /**
   * Returns a builder object for creating a Redis-backed member set store.
   * <p>
   * This object can be modified with {@link RedisMemberSetStoreBuilder} methods for any desired
   * custom Redis options. Then, pass it to
   * {@link com.segmentcache.server.SegmentsConfig.Builder#store(com.segmentcache.server.subsystems.ComponentConfigurer)}.
   * For example:
   *
   * <pre><code>
   *     SegmentsConfig config = new SegmentsConfig.Builder()
   *         .store(Redis.memberSetStore().uri(URI.create("redis://my-redis-host")))
   *         .build();
   * </code></pre>
   *
   * @return a store configuration object
   */
  public static RedisMemberSetStoreBuilder memberSetStore() {
    return new RedisMemberSetStoreBuilder();
  }

  private Redis() {}
}
