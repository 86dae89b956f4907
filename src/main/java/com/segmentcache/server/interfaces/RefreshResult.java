package com.segmentcache.server.interfaces;

import com.google.common.collect.ImmutableSet;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * The outcome of a successful refresh.
 * <p>
 * Besides the new version, the result says which identifiers entered and which left the segment
 * compared to the version that was current before it. On the first refresh of a segment every
 * member counts as added. If another process sharing the store promoted a newer version first, so
 * that this refresh's version never became current, both sets are empty.
 */
public final class RefreshResult {
  private final String segmentId;
  private final long version;
  private final long memberCount;
  private final Duration duration;
  private final Set<String> addedMembers;
  private final Set<String> removedMembers;

  /**
   * Creates an instance with no membership changes.
   *
   * @param segmentId the segment key
   * @param version the version that was promoted
   * @param memberCount the number of members in that version
   * @param duration how long the refresh took
   */
  public RefreshResult(String segmentId, long version, long memberCount, Duration duration) {
    this(segmentId, version, memberCount, duration, null, null);
  }

  /**
   * Creates an instance.
   *
   * @param segmentId the segment key
   * @param version the version that was promoted
   * @param memberCount the number of members in that version
   * @param duration how long the refresh took
   * @param addedMembers identifiers that are members now but were not before; null means none
   * @param removedMembers identifiers that were members before but are not now; null means none
   */
  public RefreshResult(String segmentId, long version, long memberCount, Duration duration,
      Set<String> addedMembers, Set<String> removedMembers) {
    this.segmentId = segmentId;
    this.version = version;
    this.memberCount = memberCount;
    this.duration = duration;
    this.addedMembers = addedMembers == null ? ImmutableSet.of() : ImmutableSet.copyOf(addedMembers);
    this.removedMembers = removedMembers == null ? ImmutableSet.of() : ImmutableSet.copyOf(removedMembers);
  }

  /**
   * The segment key.
   * @return the segment key
   */
  public String getSegmentId() {
    return segmentId;
  }

  /**
   * The version that is now current.
   * @return the version number
   */
  public long getVersion() {
    return version;
  }

  /**
   * The number of members in the new version.
   * @return the member count
   */
  public long getMemberCount() {
    return memberCount;
  }

  /**
   * The time between acquiring the refresh slot and promoting the new version.
   * @return the duration
   */
  public Duration getDuration() {
    return duration;
  }

  /**
   * Identifiers that entered the segment with this refresh.
   * @return an immutable set, possibly empty
   */
  public Set<String> getAddedMembers() {
    return addedMembers;
  }

  /**
   * Identifiers that left the segment with this refresh.
   * @return an immutable set, possibly empty
   */
  public Set<String> getRemovedMembers() {
    return removedMembers;
  }

  @Override
  public boolean equals(Object o) {
    if (o instanceof RefreshResult) {
      RefreshResult other = (RefreshResult)o;
      return segmentId.equals(other.segmentId) && version == other.version &&
          memberCount == other.memberCount && Objects.equals(duration, other.duration) &&
          addedMembers.equals(other.addedMembers) && removedMembers.equals(other.removedMembers);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(segmentId, version, memberCount, duration, addedMembers, removedMembers);
  }

  @Override
  public String toString() {
    return "RefreshResult(" + segmentId + ",version=" + version + ",members=" + memberCount +
        ",added=" + addedMembers.size() + ",removed=" + removedMembers.size() + ",duration=" + duration + ")";
  }
}
