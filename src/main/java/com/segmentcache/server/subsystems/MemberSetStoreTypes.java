package com.segmentcache.server.subsystems;

import java.util.Objects;

/**
 * Types that are used by the {@link MemberSetStore} interface.
 */
public abstract class MemberSetStoreTypes {
  private MemberSetStoreTypes() {
  }

  /**
   * Metadata describing one stored version of a segment's member set.
   * <p>
   * Instances are immutable; so is the version they describe.
   */
  public static final class MemberSetVersion {
    private final String segmentId;
    private final long version;
    private final long memberCount;
    private final long createdAt;
    private final String definitionHash;

    /**
     * Creates an instance.
     *
     * @param segmentId the segment key
     * @param version the version number
     * @param memberCount number of members in this version
     * @param createdAt Unix millisecond timestamp of when the version was written
     * @param definitionHash content hash of the definition that produced this version
     */
    public MemberSetVersion(String segmentId, long version, long memberCount, long createdAt,
        String definitionHash) {
      this.segmentId = segmentId;
      this.version = version;
      this.memberCount = memberCount;
      this.createdAt = createdAt;
      this.definitionHash = definitionHash;
    }

    /**
     * The segment key.
     * @return the segment key
     */
    public String getSegmentId() {
      return segmentId;
    }

    /**
     * The version number.
     * @return the version
     */
    public long getVersion() {
      return version;
    }

    /**
     * The number of members.
     * @return the member count
     */
    public long getMemberCount() {
      return memberCount;
    }

    /**
     * The time the version was written.
     * @return Unix milliseconds
     */
    public long getCreatedAt() {
      return createdAt;
    }

    /**
     * The content hash of the definition that produced this version.
     * @return the hash string
     */
    public String getDefinitionHash() {
      return definitionHash;
    }

    @Override
    public boolean equals(Object o) {
      if (o instanceof MemberSetVersion) {
        MemberSetVersion other = (MemberSetVersion)o;
        return segmentId.equals(other.segmentId) && version == other.version &&
            memberCount == other.memberCount && createdAt == other.createdAt &&
            Objects.equals(definitionHash, other.definitionHash);
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Objects.hash(segmentId, version, memberCount, createdAt, definitionHash);
    }

    @Override
    public String toString() {
      return "MemberSetVersion(" + segmentId + "," + version + "," + memberCount + ")";
    }
  }
}
