package com.segmentcache.server.interfaces;

/**
 * Determines what happens when a refresh is requested for a segment that is already being refreshed.
 *
 * @see com.segmentcache.server.SegmentsConfig.Builder#concurrentRefreshPolicy(ConcurrentRefreshPolicy)
 */
public enum ConcurrentRefreshPolicy {
  /**
   * The second caller waits for the refresh that is in progress and receives its result, or its
   * failure. This is the default.
   */
  JOIN_IN_FLIGHT,

  /**
   * The second caller immediately receives a
   * {@link com.segmentcache.server.RefreshAlreadyInProgressException}.
   */
  FAIL_FAST
}
