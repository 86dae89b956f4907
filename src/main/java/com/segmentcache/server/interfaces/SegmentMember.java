package com.segmentcache.server.interfaces;

/**
 * An application entity, such as a user account, that can belong to segments.
 * <p>
 * Implementing this interface lets the entity ask about its own membership, and also lets manager
 * lookup methods return entities directly instead of bare identifiers.
 */
public interface SegmentMember {
  /**
   * Returns the identifier that segment member sets contain for this entity.
   *
   * @return the identifier
   */
  String getSegmentMemberId();

  /**
   * Tests whether this entity is in the current member set of a segment.
   *
   * @param client the segments client
   * @param segmentId the segment key
   * @return true if this entity is a member
   * @throws com.segmentcache.server.UnknownSegmentException if no such segment is registered
   */
  default boolean amIMemberOf(SegmentsClientInterface client, String segmentId) {
    return client.isMember(segmentId, getSegmentMemberId());
  }
}
