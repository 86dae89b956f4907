package com.segmentcache.server.subsystems;

import com.segmentcache.server.interfaces.SetOperation;
import com.segmentcache.server.subsystems.MemberSetStoreTypes.MemberSetVersion;

import java.io.Closeable;
import java.util.List;
import java.util.Set;

/**
 * Interface for the store that holds the materialized member sets of all segments.
 * <p>
 * Each segment has any number of immutable <i>versions</i>, and at most one of them is the
 * <i>current</i> version. Writing a version never changes what readers see; only
 * {@link #promote(String, long)} does, and it must do so in a single step that all readers observe
 * at once. The resolver is the only writer; it never promotes a version it has not finished writing.
 * <p>
 * Implementations must be safe for concurrent use by multiple threads. Any failure to reach the
 * underlying database should be reported as a {@link StoreUnavailableException}.
 */
public interface MemberSetStore extends Closeable {
  /**
   * Persists a brand-new version of a segment's member set. The new version is not visible to
   * readers until it is promoted.
   *
   * @param segmentId the segment key
   * @param members the complete member set
   * @param definitionHash content hash of the definition that produced the members
   * @return the new version number, greater than any version previously written for the segment
   * @throws StoreUnavailableException if the store cannot be written
   */
  long writeNewVersion(String segmentId, Set<String> members, String definitionHash);

  /**
   * Atomically makes the given version the current one for the segment.
   * <p>
   * If the current version is already the same or newer, nothing changes and the method returns
   * false. This keeps visibility monotonic: once version N is current, no reader can see an older
   * version again.
   *
   * @param segmentId the segment key
   * @param version a version previously returned by {@link #writeNewVersion(String, Set, String)}
   * @return true if the pointer was moved
   * @throws StoreUnavailableException if the store cannot be written
   * @throws IllegalArgumentException if the version was never written
   */
  boolean promote(String segmentId, long version);

  /**
   * Returns metadata about the current version of a segment.
   *
   * @param segmentId the segment key
   * @return the current version, or null if no version was ever promoted
   * @throws StoreUnavailableException if the store cannot be read
   */
  MemberSetVersion getCurrentVersion(String segmentId);

  /**
   * Tests whether an identifier is in the current version of a segment's member set.
   *
   * @param segmentId the segment key
   * @param member the identifier
   * @return true if it is a member; false if it is not, or if no version was ever promoted
   * @throws StoreUnavailableException if the store cannot be read
   */
  boolean isMember(String segmentId, String member);

  /**
   * Returns all members of the current version of a segment.
   *
   * @param segmentId the segment key
   * @return the members; empty if no version was ever promoted
   * @throws StoreUnavailableException if the store cannot be read
   */
  Set<String> getMembers(String segmentId);

  /**
   * Combines the current versions of several segments. Segments with no current version count as
   * empty sets. Results are computed on every call and never cached.
   *
   * @param op the operation
   * @param segmentIds the segment keys; for {@link SetOperation#DIFFERENCE}, the first one is the
   *   set that the others are subtracted from
   * @return the combined set
   * @throws StoreUnavailableException if the store cannot be read
   */
  Set<String> setAlgebra(SetOperation op, List<String> segmentIds);

  /**
   * Deletes the superseded versions of a segment: every version older than {@code keepVersion}.
   * Newer versions may belong to a refresh that is still running and are left alone, and so is the
   * current version whatever its number. The caller is responsible for waiting until no reader can
   * still be using the versions being deleted.
   *
   * @param segmentId the segment key
   * @param keepVersion the version to retain
   * @throws StoreUnavailableException if the store cannot be written
   */
  void gc(String segmentId, long keepVersion);

  /**
   * Deletes a single version that was written but never promoted, such as the output of a cancelled
   * refresh. Discarding the current version is not allowed and is ignored.
   *
   * @param segmentId the segment key
   * @param version the abandoned version
   * @throws StoreUnavailableException if the store cannot be written
   */
  void discardVersion(String segmentId, long version);

  /**
   * Removes all versions of a segment and its current-version pointer.
   *
   * @param segmentId the segment key
   * @throws StoreUnavailableException if the store cannot be written
   */
  void deleteSegment(String segmentId);
}
