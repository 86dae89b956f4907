package com.segmentcache.server;

/**
 * Thrown when an operation names a segment that is not registered.
 * <p>
 * This is distinct from a segment that is registered but was never refreshed, which simply has no
 * members.
 */
@SuppressWarnings("serial")
public class UnknownSegmentException extends RuntimeException {
  private final String segmentId;

  /**
   * Creates an instance.
   *
   * @param segmentId the unknown segment key
   */
  public UnknownSegmentException(String segmentId) {
    super("unknown segment \"" + segmentId + "\"");
    this.segmentId = segmentId;
  }

  /**
   * The unknown segment key.
   *
   * @return the segment key
   */
  public String getSegmentId() {
    return segmentId;
  }
}
