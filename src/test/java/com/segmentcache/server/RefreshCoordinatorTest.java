package com.segmentcache.server;

import com.segmentcache.server.interfaces.ConcurrentRefreshPolicy;
import com.segmentcache.server.interfaces.RefreshResult;

import org.junit.After;
import org.junit.Test;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.launchdarkly.testhelpers.ConcurrentHelpers.assertFutureIsCompleted;
import static com.launchdarkly.testhelpers.ConcurrentHelpers.awaitValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class RefreshCoordinatorTest extends BaseTest {
  private final ExecutorService executor = Executors.newCachedThreadPool();

  @After
  public void shutdown() {
    executor.shutdownNow();
  }

  private RefreshCoordinator coordinator(ConcurrentRefreshPolicy policy) {
    return new RefreshCoordinator(policy, executor, testLogger);
  }

  private static RefreshResult result(String segmentId, long version) {
    return new RefreshResult(segmentId, version, 0, Duration.ZERO);
  }

  /**
   * A task that reports when it starts and then waits to be released.
   */
  private static final class BlockingTask implements RefreshCoordinator.RefreshTask {
    final BlockingQueue<RefreshCoordinator.RefreshFuture> started = new LinkedBlockingQueue<>();
    final CountDownLatch release = new CountDownLatch(1);
    final AtomicInteger runs = new AtomicInteger();
    private final RefreshResult result;

    BlockingTask(RefreshResult result) {
      this.result = result;
    }

    @Override
    public RefreshResult run(RefreshCoordinator.RefreshFuture future) throws RefreshException {
      runs.incrementAndGet();
      started.add(future);
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        throw new RefreshException(result.getSegmentId(), "interrupted", e);
      }
      return result;
    }
  }

  @Test
  public void completedRefreshReleasesSlot() throws Exception {
    RefreshCoordinator c = coordinator(ConcurrentRefreshPolicy.JOIN_IN_FLIGHT);
    CompletableFuture<RefreshResult> f = c.submit("s", future -> result("s", 1));

    assertEquals(result("s", 1), f.get(1, TimeUnit.SECONDS));
    assertFalse(c.isInFlight("s"));
  }

  @Test
  public void secondRequestJoinsInFlightRefresh() throws Exception {
    RefreshCoordinator c = coordinator(ConcurrentRefreshPolicy.JOIN_IN_FLIGHT);
    BlockingTask task = new BlockingTask(result("s", 3));
    CompletableFuture<RefreshResult> first = c.submit("s", task);
    awaitValue(task.started, 1, TimeUnit.SECONDS);

    CompletableFuture<RefreshResult> second = c.submit("s", future -> {
      fail("joining caller should not start its own refresh");
      return null;
    });
    assertTrue(c.isInFlight("s"));

    task.release.countDown();
    assertEquals(result("s", 3), first.get(1, TimeUnit.SECONDS));
    assertEquals(result("s", 3), second.get(1, TimeUnit.SECONDS));
    assertEquals(1, task.runs.get());
  }

  @Test
  public void cancellingJoinedFutureDoesNotCancelRefresh() throws Exception {
    RefreshCoordinator c = coordinator(ConcurrentRefreshPolicy.JOIN_IN_FLIGHT);
    BlockingTask task = new BlockingTask(result("s", 1));
    CompletableFuture<RefreshResult> first = c.submit("s", task);
    awaitValue(task.started, 1, TimeUnit.SECONDS);

    CompletableFuture<RefreshResult> joined = c.submit("s", task);
    assertTrue(joined.cancel(true));

    task.release.countDown();
    assertEquals(result("s", 1), first.get(1, TimeUnit.SECONDS));
  }

  @Test
  public void failFastRejectsSecondRequest() throws Exception {
    RefreshCoordinator c = coordinator(ConcurrentRefreshPolicy.FAIL_FAST);
    BlockingTask task = new BlockingTask(result("s", 1));
    CompletableFuture<RefreshResult> first = c.submit("s", task);
    awaitValue(task.started, 1, TimeUnit.SECONDS);

    try {
      c.submit("s", task);
      fail("expected RefreshAlreadyInProgressException");
    } catch (RefreshAlreadyInProgressException e) {
      assertEquals("s", e.getSegmentId());
    }

    task.release.countDown();
    first.get(1, TimeUnit.SECONDS);
    assertEquals(1, task.runs.get());
  }

  @Test
  public void differentSegmentsRunInParallel() throws Exception {
    RefreshCoordinator c = coordinator(ConcurrentRefreshPolicy.FAIL_FAST);
    BlockingTask a = new BlockingTask(result("a", 1));
    BlockingTask b = new BlockingTask(result("b", 1));
    CompletableFuture<RefreshResult> fa = c.submit("a", a);
    CompletableFuture<RefreshResult> fb = c.submit("b", b);

    awaitValue(a.started, 1, TimeUnit.SECONDS);
    awaitValue(b.started, 1, TimeUnit.SECONDS);

    a.release.countDown();
    b.release.countDown();
    assertFutureIsCompleted(fa, 1, TimeUnit.SECONDS);
    assertFutureIsCompleted(fb, 1, TimeUnit.SECONDS);
  }

  @Test
  public void failedRefreshReleasesSlot() throws Exception {
    RefreshCoordinator c = coordinator(ConcurrentRefreshPolicy.FAIL_FAST);
    RefreshException error = new RefreshException("s", "bad", null);
    CompletableFuture<RefreshResult> f = c.submit("s", future -> {
      throw error;
    });

    try {
      f.get(1, TimeUnit.SECONDS);
      fail("expected ExecutionException");
    } catch (ExecutionException e) {
      assertThat(e.getCause(), sameInstance(error));
    }
    assertFalse(c.isInFlight("s"));
    assertEquals(result("s", 2), c.submit("s", future -> result("s", 2)).get(1, TimeUnit.SECONDS));
  }

  @Test
  public void cancelReleasesSlotAndBlocksCommit() throws Exception {
    RefreshCoordinator c = coordinator(ConcurrentRefreshPolicy.FAIL_FAST);
    BlockingTask task = new BlockingTask(result("s", 1));
    CompletableFuture<RefreshResult> f = c.submit("s", task);
    RefreshCoordinator.RefreshFuture running = awaitValue(task.started, 1, TimeUnit.SECONDS);

    assertTrue(f.cancel(true));
    assertFalse(c.isInFlight("s"));
    assertFalse(running.beginCommit());

    // a new refresh can start while the abandoned one is still running
    assertEquals(result("s", 2), c.submit("s", future -> result("s", 2)).get(1, TimeUnit.SECONDS));
    task.release.countDown();
  }

  @Test
  public void cannotCancelOnceCommitting() throws Exception {
    RefreshCoordinator c = coordinator(ConcurrentRefreshPolicy.FAIL_FAST);
    CountDownLatch committed = new CountDownLatch(1);
    CountDownLatch finish = new CountDownLatch(1);
    CompletableFuture<RefreshResult> f = c.submit("s", future -> {
      assertTrue(future.beginCommit());
      committed.countDown();
      try {
        finish.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        throw new RefreshException("s", "interrupted", e);
      }
      return result("s", 1);
    });
    assertTrue(committed.await(1, TimeUnit.SECONDS));

    assertFalse(f.cancel(true));
    assertTrue(c.isInFlight("s"));

    finish.countDown();
    assertEquals(result("s", 1), f.get(1, TimeUnit.SECONDS));
  }

  @Test
  public void cancelAllCancelsEveryRefresh() throws Exception {
    RefreshCoordinator c = coordinator(ConcurrentRefreshPolicy.FAIL_FAST);
    BlockingTask a = new BlockingTask(result("a", 1));
    BlockingTask b = new BlockingTask(result("b", 1));
    CompletableFuture<RefreshResult> fa = c.submit("a", a);
    CompletableFuture<RefreshResult> fb = c.submit("b", b);

    c.cancelAll();

    assertThat(fa.isCancelled(), is(true));
    assertThat(fb.isCancelled(), is(true));
    assertFalse(c.isInFlight("a"));
    assertFalse(c.isInFlight("b"));
    a.release.countDown();
    b.release.countDown();
  }

  @Test
  public void cancelBySegmentIdOnlyCancelsThatSegment() throws Exception {
    RefreshCoordinator c = coordinator(ConcurrentRefreshPolicy.FAIL_FAST);
    BlockingTask a = new BlockingTask(result("a", 1));
    BlockingTask b = new BlockingTask(result("b", 1));
    CompletableFuture<RefreshResult> fa = c.submit("a", a);
    CompletableFuture<RefreshResult> fb = c.submit("b", b);
    awaitValue(a.started, 1, TimeUnit.SECONDS);

    assertTrue(c.cancel("a"));
    assertFalse(c.cancel("a"));
    assertFalse(c.cancel("nothing"));

    assertThat(fa.isCancelled(), is(true));
    assertFalse(c.isInFlight("a"));
    assertTrue(c.isInFlight("b"));
    a.release.countDown();
    b.release.countDown();
    assertEquals(result("b", 1), fb.get(1, TimeUnit.SECONDS));
  }

  @Test
  public void submitAfterExecutorShutdownFails() throws Exception {
    executor.shutdown();
    RefreshCoordinator c = coordinator(ConcurrentRefreshPolicy.FAIL_FAST);
    CompletableFuture<RefreshResult> f = c.submit("s", future -> result("s", 1));

    try {
      f.get(1, TimeUnit.SECONDS);
      fail("expected ExecutionException");
    } catch (ExecutionException e) {
      assertThat(e.getCause(), instanceOf(RefreshException.class));
    }
    assertFalse(c.isInFlight("s"));
  }
}
