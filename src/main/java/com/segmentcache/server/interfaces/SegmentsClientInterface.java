package com.segmentcache.server.interfaces;

import com.segmentcache.server.RefreshException;
import com.segmentcache.server.UnknownSegmentException;
import com.segmentcache.server.subsystems.SourceException;

import java.io.Closeable;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Future;

/**
 * This interface defines the public methods of {@link com.segmentcache.server.SegmentsClient}.
 * <p>
 * Applications will normally interact directly with {@link com.segmentcache.server.SegmentsClient},
 * and must use its constructor to initialize the library, but being able to refer to it indirectly
 * via an interface may be helpful in test scenarios (mocking) or for some dependency injection
 * frameworks.
 * <p>
 * Every method that takes a segment key throws {@link UnknownSegmentException} if no segment is
 * registered under that key.
 */
public interface SegmentsClientInterface extends Closeable {
  /**
   * Registers a new segment. The segment has no members until it is refreshed.
   *
   * @param segmentId the segment key
   * @param definition how to compute the members
   * @return a snapshot of the new segment
   * @throws IllegalArgumentException if a segment with this key already exists
   */
  Segment createSegment(String segmentId, SegmentDefinition definition);

  /**
   * Registers a new segment under a generated key.
   *
   * @param definition how to compute the members
   * @return a snapshot of the new segment, including its key
   */
  Segment createSegment(SegmentDefinition definition);

  /**
   * Replaces a segment's definition. The current member set is not changed; the segment is marked
   * stale until the next refresh.
   *
   * @param segmentId the segment key
   * @param definition the new definition
   * @return a snapshot of the updated segment
   */
  Segment updateDefinition(String segmentId, SegmentDefinition definition);

  /**
   * Returns a snapshot of a segment.
   *
   * @param segmentId the segment key
   * @return the segment
   */
  Segment getSegment(String segmentId);

  /**
   * Returns snapshots of all registered segments.
   *
   * @return a list ordered by key
   */
  List<Segment> getSegments();

  /**
   * Unregisters a segment and deletes all of its stored member sets. A refresh of the segment that
   * is still in flight is cancelled, unless it is already promoting its result, in which case that
   * result is discarded.
   *
   * @param segmentId the segment key
   */
  void deleteSegment(String segmentId);

  /**
   * Re-evaluates a segment's definition and atomically replaces its member set.
   * <p>
   * If the refresh fails, the previous member set remains current and readers are not affected.
   * On success, {@link RefreshResult#getAddedMembers()} and {@link RefreshResult#getRemovedMembers()}
   * report how membership changed.
   *
   * @param segmentId the segment key
   * @return the refresh result
   * @throws RefreshException if the data source or the store failed, or the refresh timed out
   */
  RefreshResult refresh(String segmentId) throws RefreshException;

  /**
   * Starts a refresh on a worker thread.
   * <p>
   * Cancelling the returned future abandons the refresh: the new member set is never promoted. If
   * the refresh fails, {@link Future#get()} throws an {@link java.util.concurrent.ExecutionException}
   * whose cause is a {@link RefreshException}.
   *
   * @param segmentId the segment key
   * @return a future for the result
   */
  Future<RefreshResult> refreshAsync(String segmentId);

  /**
   * Refreshes every registered segment, one at a time. Failures are collected in the summary rather
   * than thrown.
   *
   * @return the outcome for each segment
   */
  RefreshSummary refreshAll();

  /**
   * Evaluates a definition against the configured sources without registering it or writing
   * anything to the store. Use this to check a definition before saving it.
   *
   * @param definition the definition to check
   * @return the number of distinct members it would produce now
   * @throws SourceException if the definition cannot be evaluated
   */
  int validateDefinition(SegmentDefinition definition) throws SourceException;

  /**
   * Tests whether an identifier is in a segment's current member set.
   *
   * @param segmentId the segment key
   * @param identifier the member identifier
   * @return true if it is a member; false if not, or if the segment was never refreshed
   */
  boolean isMember(String segmentId, String identifier);

  /**
   * Tests whether an application entity is in a segment's current member set.
   *
   * @param member the entity
   * @param segmentId the segment key
   * @return true if it is a member
   */
  boolean amIMemberOf(SegmentMember member, String segmentId);

  /**
   * Returns the current member set of a segment.
   *
   * @param segmentId the segment key
   * @return an immutable set; empty if the segment was never refreshed
   */
  Set<String> getMembers(String segmentId);

  /**
   * Returns the size of a segment's current member set.
   *
   * @param segmentId the segment key
   * @return the member count; 0 if the segment was never refreshed
   */
  long getMemberCount(String segmentId);

  /**
   * Returns the keys of all registered segments whose current member set contains an identifier.
   *
   * @param identifier the member identifier
   * @return an immutable set of segment keys
   */
  Set<String> getSegmentsFor(String identifier);

  /**
   * Combines the current member sets of several segments. A segment that was never refreshed counts
   * as an empty set.
   *
   * @param op the set operation
   * @param segmentIds the segment keys
   * @return an immutable set
   */
  Set<String> combine(SetOperation op, List<String> segmentIds);

  /**
   * Registers a listener to be notified of every refresh outcome.
   *
   * @param listener the listener
   */
  void registerRefreshListener(RefreshListener listener);

  /**
   * Unregisters a listener.
   *
   * @param listener the listener
   */
  void unregisterRefreshListener(RefreshListener listener);
}
