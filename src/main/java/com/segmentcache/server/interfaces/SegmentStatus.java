package com.segmentcache.server.interfaces;

/**
 * The refresh state of a segment.
 */
public enum SegmentStatus {
  /**
   * No refresh has ever succeeded, so the segment has no members.
   */
  NEVER_REFRESHED,

  /**
   * A refresh is in progress. Readers still see the previous member set, if any.
   */
  REFRESHING,

  /**
   * The segment has a current member set.
   */
  READY
}
