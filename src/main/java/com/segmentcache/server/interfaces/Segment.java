package com.segmentcache.server.interfaces;

import java.time.Instant;
import java.util.Objects;

/**
 * An immutable snapshot of a segment's definition and refresh state.
 * <p>
 * Obtain instances from {@link SegmentsClientInterface#getSegment(String)}. The snapshot does not
 * change when the segment is later refreshed or redefined.
 */
public final class Segment {
  private final String id;
  private final SegmentDefinition definition;
  private final SegmentStatus status;
  private final Instant lastRefreshedAt;
  private final String definitionHash;
  private final long currentVersion;
  private final long memberCount;

  /**
   * Creates an instance.
   *
   * @param id the segment key
   * @param definition the current definition
   * @param status the refresh state
   * @param lastRefreshedAt when the current member set was written, or null
   * @param definitionHash hash of the definition that produced the current member set, or null
   * @param currentVersion the current member set version, or 0 if none
   * @param memberCount the number of members in the current version
   */
  public Segment(String id, SegmentDefinition definition, SegmentStatus status, Instant lastRefreshedAt,
      String definitionHash, long currentVersion, long memberCount) {
    this.id = id;
    this.definition = definition;
    this.status = status;
    this.lastRefreshedAt = lastRefreshedAt;
    this.definitionHash = definitionHash;
    this.currentVersion = currentVersion;
    this.memberCount = memberCount;
  }

  /**
   * The segment key.
   * @return the key
   */
  public String getId() {
    return id;
  }

  /**
   * The current definition. This may be newer than the definition that produced the current
   * member set; see {@link #isStale()}.
   * @return the definition
   */
  public SegmentDefinition getDefinition() {
    return definition;
  }

  /**
   * The refresh state.
   * @return the status
   */
  public SegmentStatus getStatus() {
    return status;
  }

  /**
   * When the current member set was written.
   * @return the timestamp, or null if the segment was never refreshed
   */
  public Instant getLastRefreshedAt() {
    return lastRefreshedAt;
  }

  /**
   * The content hash of the definition that produced the current member set.
   * @return the hash, or null if the segment was never refreshed
   */
  public String getDefinitionHash() {
    return definitionHash;
  }

  /**
   * The current member set version.
   * @return the version, or 0 if the segment was never refreshed
   */
  public long getCurrentVersion() {
    return currentVersion;
  }

  /**
   * The number of members in the current version.
   * @return the member count
   */
  public long getMemberCount() {
    return memberCount;
  }

  /**
   * True if the member set does not reflect the current definition, either because the segment was
   * never refreshed or because the definition changed after the last refresh.
   * @return true if a refresh is needed
   */
  public boolean isStale() {
    return definitionHash == null || !definitionHash.equals(definition.contentHash());
  }

  @Override
  public boolean equals(Object o) {
    if (o instanceof Segment) {
      Segment other = (Segment)o;
      return id.equals(other.id) && definition.equals(other.definition) && status == other.status &&
          Objects.equals(lastRefreshedAt, other.lastRefreshedAt) &&
          Objects.equals(definitionHash, other.definitionHash) &&
          currentVersion == other.currentVersion && memberCount == other.memberCount;
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, definition, status, lastRefreshedAt, definitionHash, currentVersion, memberCount);
  }

  @Override
  public String toString() {
    return "Segment(" + id + "," + definition.getKind() + "," + status + ",version=" + currentVersion + ")";
  }
}
