package com.segmentcache.server;

/**
 * Thrown by a refresh request when another refresh of the same segment is in progress and the
 * client is configured with {@link com.segmentcache.server.interfaces.ConcurrentRefreshPolicy#FAIL_FAST}.
 */
@SuppressWarnings("serial")
public class RefreshAlreadyInProgressException extends RefreshException {
  /**
   * Creates an instance.
   *
   * @param segmentId the segment key
   */
  public RefreshAlreadyInProgressException(String segmentId) {
    super(segmentId, "a refresh of segment \"" + segmentId + "\" is already in progress", null);
  }
}
