package com.segmentcache.server;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.Logs;
import com.segmentcache.server.interfaces.SegmentMember;
import com.segmentcache.server.subsystems.ComponentConfigurer;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static java.util.concurrent.Executors.newSingleThreadScheduledExecutor;

@SuppressWarnings("javadoc")
public class TestComponents {
  public static ScheduledExecutorService sharedExecutor = newSingleThreadScheduledExecutor(
      new ThreadFactoryBuilder().setNameFormat("TestComponents-sharedExecutor-%d").build());

  public static LDLogger nullLogger = LDLogger.withAdapter(Logs.none(), "");

  public static <T> ComponentConfigurer<T> specificComponent(final T instance) {
    return context -> instance;
  }

  /**
   * A manager whose lookups block until the test releases them, so that a refresh can be held in
   * the middle of evaluation.
   */
  public static class GatedManager {
    public final BlockingQueue<String> started = new LinkedBlockingQueue<>();
    public final AtomicInteger calls = new AtomicInteger();
    private final AtomicReference<List<String>> nextResult = new AtomicReference<>(ImmutableList.of());
    private final CountDownLatch gate = new CountDownLatch(1);

    public void willReturn(String... members) {
      nextResult.set(ImmutableList.copyOf(members));
    }

    public void release() {
      gate.countDown();
    }

    public List<String> members(String label) throws InterruptedException {
      calls.incrementAndGet();
      started.add(label);
      if (!gate.await(10, TimeUnit.SECONDS)) {
        throw new IllegalStateException("test never released the gate");
      }
      return nextResult.get();
    }
  }

  /**
   * A manager with a variety of lookup methods and result shapes.
   */
  public static class UserManager {
    public List<String> byPlan(String plan) {
      return plan.equals("gold") ? ImmutableList.of("1", "2", "3") : ImmutableList.of("4");
    }

    public List<Long> olderThan(int age) {
      return age >= 30 ? ImmutableList.of(10L, 11L) : ImmutableList.of(10L, 11L, 12L);
    }

    public Stream<User> activeUsers() {
      return Stream.of(new User("a"), new User("b"));
    }

    public Account[] accounts() {
      return new Account[] { new Account(7), new Account(8) };
    }

    public Iterable<Member> members() {
      return ImmutableList.of(new Member("m1"), new Member("m2"));
    }

    public List<Object> broken() {
      return ImmutableList.of(new Object());
    }

    public List<String> nothing() {
      return null;
    }

    public String notACollection() {
      return "x";
    }

    public List<String> fails() {
      throw new IllegalStateException("lookup exploded");
    }
  }

  public static class User {
    private final String id;

    public User(String id) {
      this.id = id;
    }

    public String getId() {
      return id;
    }
  }

  public static class Account {
    public final long id;

    public Account(long id) {
      this.id = id;
    }
  }

  public static class Member implements SegmentMember {
    private final String key;

    public Member(String key) {
      this.key = key;
    }

    @Override
    public String getSegmentMemberId() {
      return key;
    }
  }
}
