package com.segmentcache.server;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.segmentcache.server.RefreshCoordinator.RefreshFuture;
import com.segmentcache.server.interfaces.RefreshEvent;
import com.segmentcache.server.interfaces.RefreshListener;
import com.segmentcache.server.interfaces.RefreshResult;
import com.segmentcache.server.interfaces.RefreshSummary;
import com.segmentcache.server.interfaces.Segment;
import com.segmentcache.server.interfaces.SegmentDefinition;
import com.segmentcache.server.interfaces.SegmentStatus;
import com.segmentcache.server.interfaces.SetOperation;
import com.segmentcache.server.subsystems.MemberSetStore;
import com.segmentcache.server.subsystems.MemberSetStoreTypes.MemberSetVersion;
import com.segmentcache.server.subsystems.SourceException;
import com.segmentcache.server.subsystems.StoreUnavailableException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Keeps the registry of segment definitions and turns them into promoted member sets.
 * <p>
 * A refresh runs as: take the segment's slot in the {@link RefreshCoordinator}, evaluate the
 * definition, write a new version, promote it, release the slot. Readers only ever look at the
 * promoted version, so they are never blocked by and never see the intermediate state of a refresh.
 * <p>
 * Each registered segment is held in a {@link Registration}. Deleting a segment and creating it
 * again under the same key yields a new registration, so work started for the old one (an
 * in-flight refresh, a scheduled cleanup) can tell that it no longer applies.
 */
final class SegmentResolver {
  private final ConcurrentHashMap<String, Registration> registrations = new ConcurrentHashMap<>();
  private final SourceAdapter adapter;
  private final MemberSetStore store;
  private final RefreshCoordinator coordinator;
  private final EventBroadcasterImpl<RefreshListener, RefreshEvent> refreshEvents;
  private final ScheduledExecutorService sharedExecutor;
  private final Duration refreshTimeout;
  private final Duration versionRetention;
  private final LDLogger logger;

  SegmentResolver(
      SourceAdapter adapter,
      MemberSetStore store,
      RefreshCoordinator coordinator,
      EventBroadcasterImpl<RefreshListener, RefreshEvent> refreshEvents,
      ScheduledExecutorService sharedExecutor,
      Duration refreshTimeout,
      Duration versionRetention,
      LDLogger logger
      ) {
    this.adapter = adapter;
    this.store = store;
    this.coordinator = coordinator;
    this.refreshEvents = refreshEvents;
    this.sharedExecutor = sharedExecutor;
    this.refreshTimeout = refreshTimeout;
    this.versionRetention = versionRetention;
    this.logger = logger;
  }

  Segment createSegment(String segmentId, SegmentDefinition definition) {
    checkNotNull(segmentId, "segmentId must not be null");
    checkNotNull(definition, "definition must not be null");
    if (registrations.putIfAbsent(segmentId, new Registration(definition)) != null) {
      throw new IllegalArgumentException("segment \"" + segmentId + "\" already exists");
    }
    logger.debug("Created segment \"{}\" ({})", segmentId, definition.getKind());
    return snapshot(segmentId, definition);
  }

  Segment createSegment(SegmentDefinition definition) {
    return createSegment(UUID.randomUUID().toString(), definition);
  }

  Segment updateDefinition(String segmentId, SegmentDefinition definition) {
    checkNotNull(segmentId, "segmentId must not be null");
    checkNotNull(definition, "definition must not be null");
    Registration registration = registrations.get(segmentId);
    if (registration == null) {
      throw new UnknownSegmentException(segmentId);
    }
    registration.definition = definition;
    logger.debug("Updated definition of segment \"{}\"", segmentId);
    return snapshot(segmentId, definition);
  }

  Segment getSegment(String segmentId) {
    Registration registration = registrations.get(checkNotNull(segmentId));
    if (registration == null) {
      throw new UnknownSegmentException(segmentId);
    }
    return snapshot(segmentId, registration.definition);
  }

  List<Segment> getSegments() {
    ImmutableList.Builder<Segment> ret = ImmutableList.builder();
    for (String id: sortedIds()) {
      Registration registration = registrations.get(id);
      if (registration != null) { // may have been deleted since we listed the keys
        ret.add(snapshot(id, registration.definition));
      }
    }
    return ret.build();
  }

  void deleteSegment(String segmentId) {
    if (registrations.remove(checkNotNull(segmentId)) == null) {
      throw new UnknownSegmentException(segmentId);
    }
    if (coordinator.cancel(segmentId)) {
      logger.debug("Cancelled the in-flight refresh of deleted segment \"{}\"", segmentId);
    }
    store.deleteSegment(segmentId);
    logger.debug("Deleted segment \"{}\"", segmentId);
  }

  RefreshResult refresh(String segmentId) throws RefreshException {
    Future<RefreshResult> future = refreshAsync(segmentId);
    try {
      return refreshTimeout == null ? future.get() :
        future.get(refreshTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      if (!future.cancel(true)) {
        // it had already started promoting, so it is about to finish
        return awaitCommitted(segmentId, future);
      }
      logger.warn("Refresh of segment \"{}\" timed out after {}", segmentId, Util.describeDuration(refreshTimeout));
      throw new RefreshException(segmentId, "refresh timed out after " + Util.describeDuration(refreshTimeout), e);
    } catch (ExecutionException e) {
      throw unwrapFailure(segmentId, e);
    } catch (CancellationException e) {
      throw new RefreshException(segmentId, "refresh was cancelled", e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new RefreshException(segmentId, "interrupted while waiting for refresh", e);
    }
  }

  private RefreshResult awaitCommitted(String segmentId, Future<RefreshResult> future) throws RefreshException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      throw unwrapFailure(segmentId, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RefreshException(segmentId, "interrupted while waiting for refresh", e);
    }
  }

  private static RefreshException unwrapFailure(String segmentId, ExecutionException e) {
    Throwable cause = e.getCause();
    if (cause instanceof RefreshException) {
      return (RefreshException)cause;
    }
    if (cause instanceof UnknownSegmentException) {
      throw (UnknownSegmentException)cause;
    }
    return new RefreshException(segmentId, "refresh failed: " + cause, cause);
  }

  Future<RefreshResult> refreshAsync(String segmentId) {
    requireKnown(segmentId);
    try {
      return coordinator.submit(segmentId, future -> runRefresh(segmentId, registrations.get(segmentId), future));
    } catch (RefreshAlreadyInProgressException e) {
      CompletableFuture<RefreshResult> failed = new CompletableFuture<>();
      failed.completeExceptionally(e);
      return failed;
    }
  }

  RefreshSummary refreshAll() {
    long startNanos = System.nanoTime();
    List<RefreshResult> succeeded = new ArrayList<>();
    Map<String, Exception> failed = new LinkedHashMap<>();
    for (String id: sortedIds()) {
      try {
        succeeded.add(refresh(id));
      } catch (RefreshException | UnknownSegmentException e) {
        failed.put(id, e);
      }
    }
    Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
    RefreshSummary summary = new RefreshSummary(succeeded, failed, duration);
    if (failed.isEmpty()) {
      logger.info("Refreshed {} segment(s) in {}", succeeded.size(), Util.describeDuration(duration));
    } else {
      logger.warn("Refreshed {} segment(s) in {}; {} failed: {}", succeeded.size(),
          Util.describeDuration(duration), failed.size(), failed.keySet());
    }
    return summary;
  }

  int validate(SegmentDefinition definition) throws SourceException {
    checkNotNull(definition, "definition must not be null");
    int count = ImmutableSet.copyOf(adapter.evaluate(definition)).size();
    logger.debug("Validated {} definition with {} members", definition.getKind(), count);
    return count;
  }

  // Runs on a refresh worker thread.
  private RefreshResult runRefresh(String segmentId, Registration registration, RefreshFuture future)
      throws RefreshException {
    long startNanos = System.nanoTime();
    RefreshException failure;
    try {
      RefreshResult result = evaluateAndPromote(segmentId, registration, future, startNanos);
      logger.info("Refreshed segment \"{}\": version {} with {} members in {}", segmentId,
          result.getVersion(), result.getMemberCount(), Util.describeDuration(result.getDuration()));
      refreshEvents.broadcast(new RefreshEvent(segmentId, result, null));
      return result;
    } catch (CancellationException e) {
      logger.info("Refresh of segment \"{}\" was abandoned; the previous members remain current", segmentId);
      failure = new RefreshException(segmentId, "refresh was cancelled", e);
    } catch (SourceException e) {
      logger.warn("Refresh of segment \"{}\" failed, the previous members remain current: {}",
          segmentId, LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
      failure = new RefreshException(segmentId, "could not evaluate segment definition: " + e.getMessage(), e);
    } catch (StoreUnavailableException e) {
      logger.error("Refresh of segment \"{}\" failed, the previous members remain current: {}",
          segmentId, LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
      failure = new RefreshException(segmentId, "member set store is unavailable: " + e.getMessage(), e);
    } catch (UnknownSegmentException e) {
      logger.info("Segment \"{}\" was deleted during its refresh", segmentId);
      failure = new RefreshException(segmentId, "segment was deleted during refresh", e);
    } catch (RuntimeException e) {
      logger.error("Unexpected error while refreshing segment \"{}\": {}", segmentId, LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
      failure = new RefreshException(segmentId, "unexpected error: " + e, e);
    }
    refreshEvents.broadcast(new RefreshEvent(segmentId, null, failure));
    throw failure;
  }

  private RefreshResult evaluateAndPromote(String segmentId, Registration registration, RefreshFuture future,
      long startNanos) throws SourceException {
    if (registration == null || registrations.get(segmentId) != registration) {
      throw new UnknownSegmentException(segmentId);
    }
    SegmentDefinition definition = registration.definition;
    String hash = definition.contentHash();

    Set<String> members = ImmutableSet.copyOf(adapter.evaluate(definition));
    if (future.isCancelled()) {
      throw new CancellationException();
    }

    long version = store.writeNewVersion(segmentId, members, hash);
    if (!future.beginCommit()) {
      store.discardVersion(segmentId, version);
      throw new CancellationException();
    }

    Set<String> previous;
    boolean promoted;
    try {
      previous = store.getMembers(segmentId);
      promoted = store.promote(segmentId, version);
    } catch (StoreUnavailableException e) {
      discardAfterFailedPromote(segmentId, version);
      throw e;
    }

    Set<String> added = null, removed = null;
    if (promoted) {
      added = Sets.difference(members, previous);
      removed = Sets.difference(previous, members);
      scheduleGc(segmentId, registration, version);
    } else {
      // another process sharing the store promoted a newer version first
      logger.debug("Version {} of segment \"{}\" was superseded before it was promoted", version, segmentId);
      store.discardVersion(segmentId, version);
    }

    if (registrations.get(segmentId) != registration) {
      // deleted while committing; a segment created again under this key has no data of its own yet
      store.deleteSegment(segmentId);
      throw new UnknownSegmentException(segmentId);
    }
    return new RefreshResult(segmentId, version, members.size(), Duration.ofNanos(System.nanoTime() - startNanos),
        added, removed);
  }

  private void discardAfterFailedPromote(String segmentId, long version) {
    try {
      store.discardVersion(segmentId, version);
    } catch (RuntimeException e) {
      logger.warn("Could not discard unpromoted version {} of segment \"{}\": {}", version, segmentId,
          LogValues.exceptionSummary(e));
    }
  }

  private void scheduleGc(String segmentId, Registration registration, long keepVersion) {
    if (sharedExecutor.isShutdown()) {
      return;
    }
    try {
      sharedExecutor.schedule(() -> {
        if (registrations.get(segmentId) != registration) {
          return; // deleted since; versions of a new segment with this key are not ours to collect
        }
        try {
          store.gc(segmentId, keepVersion);
          logger.debug("Collected versions of segment \"{}\" older than {}", segmentId, keepVersion);
        } catch (RuntimeException e) {
          logger.warn("Could not clean up old versions of segment \"{}\": {}", segmentId, LogValues.exceptionSummary(e));
        }
      }, versionRetention.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.debug("Not collecting old versions of segment \"{}\" because the client is closing", segmentId);
    }
  }

  boolean isMember(String segmentId, String identifier) {
    requireKnown(segmentId);
    return store.isMember(segmentId, checkNotNull(identifier));
  }

  Set<String> getMembers(String segmentId) {
    requireKnown(segmentId);
    return store.getMembers(segmentId);
  }

  long getMemberCount(String segmentId) {
    requireKnown(segmentId);
    MemberSetVersion current = store.getCurrentVersion(segmentId);
    return current == null ? 0 : current.getMemberCount();
  }

  Set<String> getSegmentsFor(String identifier) {
    checkNotNull(identifier);
    ImmutableSet.Builder<String> ret = ImmutableSet.builder();
    for (String id: sortedIds()) {
      if (store.isMember(id, identifier)) {
        ret.add(id);
      }
    }
    return ret.build();
  }

  Set<String> combine(SetOperation op, List<String> segmentIds) {
    checkNotNull(op, "op must not be null");
    checkNotNull(segmentIds, "segmentIds must not be null");
    for (String id: segmentIds) {
      requireKnown(id);
    }
    return store.setAlgebra(op, ImmutableList.copyOf(segmentIds));
  }

  void registerRefreshListener(RefreshListener listener) {
    refreshEvents.register(checkNotNull(listener));
  }

  void unregisterRefreshListener(RefreshListener listener) {
    refreshEvents.unregister(listener);
  }

  void close() {
    coordinator.cancelAll();
  }

  private void requireKnown(String segmentId) {
    if (segmentId == null || !registrations.containsKey(segmentId)) {
      throw new UnknownSegmentException(segmentId);
    }
  }

  private Set<String> sortedIds() {
    return new TreeSet<>(registrations.keySet());
  }

  private Segment snapshot(String segmentId, SegmentDefinition definition) {
    MemberSetVersion current = store.getCurrentVersion(segmentId);
    SegmentStatus status = coordinator.isInFlight(segmentId) ? SegmentStatus.REFRESHING :
      current == null ? SegmentStatus.NEVER_REFRESHED : SegmentStatus.READY;
    if (current == null) {
      return new Segment(segmentId, definition, status, null, null, 0, 0);
    }
    return new Segment(segmentId, definition, status, Instant.ofEpochMilli(current.getCreatedAt()),
        current.getDefinitionHash(), current.getVersion(), current.getMemberCount());
  }

  private static final class Registration {
    volatile SegmentDefinition definition;

    Registration(SegmentDefinition definition) {
      this.definition = definition;
    }
  }
}
