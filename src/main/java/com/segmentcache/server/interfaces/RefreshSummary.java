package com.segmentcache.server.interfaces;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * The outcome of refreshing every registered segment.
 *
 * @see SegmentsClientInterface#refreshAll()
 */
public final class RefreshSummary {
  private final List<RefreshResult> succeeded;
  private final Map<String, Exception> failed;
  private final Duration duration;

  /**
   * Creates an instance.
   *
   * @param succeeded results of the refreshes that succeeded
   * @param failed the errors of the refreshes that failed, by segment key
   * @param duration the total time taken
   */
  public RefreshSummary(List<RefreshResult> succeeded, Map<String, Exception> failed, Duration duration) {
    this.succeeded = ImmutableList.copyOf(succeeded);
    this.failed = ImmutableMap.copyOf(failed);
    this.duration = duration;
  }

  /**
   * Results of the refreshes that succeeded.
   * @return an immutable list
   */
  public List<RefreshResult> getSucceeded() {
    return succeeded;
  }

  /**
   * Errors of the refreshes that failed, keyed by segment.
   * @return an immutable map
   */
  public Map<String, Exception> getFailed() {
    return failed;
  }

  /**
   * The total time taken.
   * @return the duration
   */
  public Duration getDuration() {
    return duration;
  }

  @Override
  public String toString() {
    return "RefreshSummary(succeeded=" + succeeded.size() + ",failed=" + failed.keySet() + ")";
  }
}
