package com.segmentcache.server;

import com.launchdarkly.logging.LDLogger;
import com.segmentcache.server.interfaces.ConcurrentRefreshPolicy;
import com.segmentcache.server.interfaces.RefreshResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Ensures that at most one refresh per segment is in flight. Refreshes of different segments never
 * wait for each other.
 * <p>
 * The slot for a segment is taken by {@link #submit(String, RefreshTask)} and released as soon as
 * the refresh completes, fails or is cancelled, before anyone waiting on it is woken up.
 */
final class RefreshCoordinator {
  private final ConcurrentHashMap<String, RefreshFuture> inFlight = new ConcurrentHashMap<>();
  private final ConcurrentRefreshPolicy policy;
  private final ExecutorService executor;
  private final LDLogger logger;

  /**
   * The work of one refresh. It must call {@link RefreshFuture#beginCommit()} immediately before
   * making its result visible, and give up if that returns false.
   */
  interface RefreshTask {
    RefreshResult run(RefreshFuture future) throws RefreshException;
  }

  RefreshCoordinator(ConcurrentRefreshPolicy policy, ExecutorService executor, LDLogger logger) {
    this.policy = policy;
    this.executor = executor;
    this.logger = logger;
  }

  /**
   * Starts a refresh of the segment on the executor, unless one is already in flight.
   * <p>
   * If one is in flight, then under {@link ConcurrentRefreshPolicy#JOIN_IN_FLIGHT} the caller gets
   * a future that completes with the same outcome; cancelling that future only stops the caller
   * from waiting. Under {@link ConcurrentRefreshPolicy#FAIL_FAST} this throws instead.
   *
   * @param segmentId the segment key
   * @param task the refresh work
   * @return a future for the outcome
   * @throws RefreshAlreadyInProgressException under the fail-fast policy, if a refresh is in flight
   */
  CompletableFuture<RefreshResult> submit(String segmentId, RefreshTask task)
      throws RefreshAlreadyInProgressException {
    RefreshFuture mine = new RefreshFuture(segmentId);
    RefreshFuture existing = inFlight.putIfAbsent(segmentId, mine);
    if (existing != null) {
      if (policy == ConcurrentRefreshPolicy.FAIL_FAST) {
        logger.debug("Rejecting refresh of segment \"{}\" because one is already in progress", segmentId);
        throw new RefreshAlreadyInProgressException(segmentId);
      }
      logger.debug("Joining refresh of segment \"{}\" that is already in progress", segmentId);
      return existing.thenApply(r -> r);
    }

    try {
      executor.execute(() -> {
        RefreshResult result;
        try {
          result = task.run(mine);
        } catch (Exception e) {
          mine.release();
          mine.completeExceptionally(e);
          return;
        }
        mine.release();
        mine.complete(result);
      });
    } catch (RejectedExecutionException e) {
      mine.release();
      mine.completeExceptionally(new RefreshException(segmentId, "client is closed", e));
    }
    return mine;
  }

  /**
   * Cancels the in-flight refresh of one segment, if there is one and it has not begun to commit.
   */
  boolean cancel(String segmentId) {
    RefreshFuture f = inFlight.get(segmentId);
    return f != null && f.cancel(true);
  }

  void cancelAll() {
    for (RefreshFuture f: inFlight.values()) {
      f.cancel(true);
    }
  }

  boolean isInFlight(String segmentId) {
    return inFlight.containsKey(segmentId);
  }

  /**
   * The future for a refresh that this coordinator started. Cancelling it succeeds only until the
   * refresh begins to commit its result, so a cancelled refresh is never made visible.
   */
  final class RefreshFuture extends CompletableFuture<RefreshResult> {
    private final String segmentId;
    private boolean committing; // guarded by this

    private RefreshFuture(String segmentId) {
      this.segmentId = segmentId;
    }

    /**
     * Marks the point of no return. After this, cancellation has no effect.
     *
     * @return false if the refresh was already cancelled
     */
    synchronized boolean beginCommit() {
      if (isDone()) {
        return false;
      }
      committing = true;
      return true;
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
      boolean cancelled;
      synchronized (this) {
        if (committing) {
          return false;
        }
        release();
        cancelled = super.cancel(mayInterruptIfRunning);
      }
      if (cancelled) {
        logger.debug("Refresh of segment \"{}\" was cancelled", segmentId);
      }
      return cancelled;
    }

    private void release() {
      inFlight.remove(segmentId, this);
    }
  }
}
