package com.segmentcache.server;

import com.segmentcache.server.interfaces.ConcurrentRefreshPolicy;
import com.segmentcache.server.subsystems.ComponentConfigurer;
import com.segmentcache.server.subsystems.MemberSetStore;
import com.segmentcache.server.subsystems.SegmentSources;

import org.junit.Test;

import java.time.Duration;

import static com.segmentcache.server.TestComponents.specificComponent;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

@SuppressWarnings("javadoc")
public class SegmentsConfigTest {
  @Test
  public void defaults() {
    SegmentsConfig config = new SegmentsConfig.Builder().build();
    assertNotNull(config.logging);
    assertThat(config.sources, instanceOf(ComponentsImpl.SegmentSourcesBuilderImpl.class));
    assertSame(Components.inMemoryStore(), config.store);
    assertEquals(ConcurrentRefreshPolicy.JOIN_IN_FLIGHT, config.concurrentRefreshPolicy);
    assertNull(config.refreshTimeout);
    assertEquals(SegmentsConfig.DEFAULT_REFRESH_THREADS, config.refreshThreads);
    assertEquals(SegmentsConfig.DEFAULT_VERSION_RETENTION, config.versionRetention);
  }

  @Test
  public void sourcesAndStore() {
    ComponentConfigurer<SegmentSources> sources = Components.sources().manager("m", new Object());
    ComponentConfigurer<MemberSetStore> store = specificComponent(new InMemoryMemberSetStore());
    SegmentsConfig config = new SegmentsConfig.Builder().sources(sources).store(store).build();
    assertSame(sources, config.sources);
    assertSame(store, config.store);
  }

  @Test
  public void concurrentRefreshPolicy() {
    assertEquals(ConcurrentRefreshPolicy.FAIL_FAST, new SegmentsConfig.Builder()
        .concurrentRefreshPolicy(ConcurrentRefreshPolicy.FAIL_FAST).build().concurrentRefreshPolicy);
    assertEquals(ConcurrentRefreshPolicy.JOIN_IN_FLIGHT, new SegmentsConfig.Builder()
        .concurrentRefreshPolicy(ConcurrentRefreshPolicy.FAIL_FAST).concurrentRefreshPolicy(null)
        .build().concurrentRefreshPolicy);
  }

  @Test
  public void refreshTimeout() {
    assertEquals(Duration.ofSeconds(30),
        new SegmentsConfig.Builder().refreshTimeout(Duration.ofSeconds(30)).build().refreshTimeout);
    assertNull(new SegmentsConfig.Builder().refreshTimeout(Duration.ZERO).build().refreshTimeout);
    assertNull(new SegmentsConfig.Builder().refreshTimeout(Duration.ofSeconds(-1)).build().refreshTimeout);
    assertNull(new SegmentsConfig.Builder().refreshTimeout(null).build().refreshTimeout);
  }

  @Test
  public void refreshThreads() {
    assertEquals(1, new SegmentsConfig.Builder().refreshThreads(1).build().refreshThreads);
  }

  @Test(expected = IllegalArgumentException.class)
  public void refreshThreadsMustBePositive() {
    new SegmentsConfig.Builder().refreshThreads(0);
  }

  @Test
  public void versionRetention() {
    assertEquals(Duration.ZERO, new SegmentsConfig.Builder().versionRetention(Duration.ZERO).build().versionRetention);
    assertEquals(SegmentsConfig.DEFAULT_VERSION_RETENTION,
        new SegmentsConfig.Builder().versionRetention(Duration.ofSeconds(-5)).build().versionRetention);
    assertEquals(SegmentsConfig.DEFAULT_VERSION_RETENTION,
        new SegmentsConfig.Builder().versionRetention(null).build().versionRetention);
  }

  @Test
  public void fromConfigCopiesEverything() {
    SegmentsConfig original = new SegmentsConfig.Builder()
        .concurrentRefreshPolicy(ConcurrentRefreshPolicy.FAIL_FAST)
        .refreshTimeout(Duration.ofSeconds(5))
        .refreshThreads(2)
        .versionRetention(Duration.ofSeconds(1))
        .build();
    SegmentsConfig copy = SegmentsConfig.Builder.fromConfig(original).build();
    assertSame(original.logging, copy.logging);
    assertSame(original.sources, copy.sources);
    assertSame(original.store, copy.store);
    assertEquals(original.concurrentRefreshPolicy, copy.concurrentRefreshPolicy);
    assertEquals(original.refreshTimeout, copy.refreshTimeout);
    assertEquals(original.refreshThreads, copy.refreshThreads);
    assertEquals(original.versionRetention, copy.versionRetention);
  }
}
