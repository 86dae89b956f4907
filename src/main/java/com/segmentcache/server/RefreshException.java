package com.segmentcache.server;

/**
 * Indicates that a segment refresh did not complete. The previous member set, if any, is still
 * current.
 * <p>
 * The cause is normally a {@link com.segmentcache.server.subsystems.SourceException} (the definition
 * could not be evaluated), a {@link com.segmentcache.server.subsystems.StoreUnavailableException}
 * (the new member set could not be stored), or a {@link java.util.concurrent.TimeoutException}.
 */
@SuppressWarnings("serial")
public class RefreshException extends Exception {
  private final String segmentId;

  /**
   * Creates an instance.
   *
   * @param segmentId the segment key
   * @param message a description of the failure
   * @param cause the underlying error
   */
  public RefreshException(String segmentId, String message, Throwable cause) {
    super(message, cause);
    this.segmentId = segmentId;
  }

  /**
   * The key of the segment that failed to refresh.
   *
   * @return the segment key
   */
  public String getSegmentId() {
    return segmentId;
  }
}
