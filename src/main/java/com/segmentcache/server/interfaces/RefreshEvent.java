package com.segmentcache.server.interfaces;

/**
 * Parameter class used with {@link RefreshListener}.
 */
public final class RefreshEvent {
  private final String segmentId;
  private final RefreshResult result;
  private final Exception error;

  /**
   * Creates an instance.
   *
   * @param segmentId the segment key
   * @param result the result if the refresh succeeded, otherwise null
   * @param error the error if the refresh failed, otherwise null
   */
  public RefreshEvent(String segmentId, RefreshResult result, Exception error) {
    this.segmentId = segmentId;
    this.result = result;
    this.error = error;
  }

  /**
   * The segment key.
   * @return the segment key
   */
  public String getSegmentId() {
    return segmentId;
  }

  /**
   * True if the refresh promoted a new version.
   * @return true for success
   */
  public boolean isSuccess() {
    return error == null;
  }

  /**
   * The refresh result.
   * @return the result, or null if the refresh failed
   */
  public RefreshResult getResult() {
    return result;
  }

  /**
   * The refresh error.
   * @return the error, or null if the refresh succeeded
   */
  public Exception getError() {
    return error;
  }

  @Override
  public String toString() {
    return "RefreshEvent(" + segmentId + "," + (isSuccess() ? result : error) + ")";
  }
}
