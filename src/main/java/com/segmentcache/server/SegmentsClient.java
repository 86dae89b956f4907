package com.segmentcache.server;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.segmentcache.server.interfaces.RefreshListener;
import com.segmentcache.server.interfaces.RefreshResult;
import com.segmentcache.server.interfaces.RefreshSummary;
import com.segmentcache.server.interfaces.Segment;
import com.segmentcache.server.interfaces.SegmentDefinition;
import com.segmentcache.server.interfaces.SegmentMember;
import com.segmentcache.server.interfaces.SegmentsClientInterface;
import com.segmentcache.server.interfaces.SetOperation;
import com.segmentcache.server.subsystems.ClientContext;
import com.segmentcache.server.subsystems.LoggingConfiguration;
import com.segmentcache.server.subsystems.MemberSetStore;
import com.segmentcache.server.subsystems.SegmentSources;
import com.segmentcache.server.subsystems.SourceException;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A client for the segment membership cache. Applications should instantiate a single instance
 * for the lifetime of their application and share it between threads.
 * <p>
 * Segments are registered with {@link #createSegment(String, SegmentDefinition)}, materialized with
 * {@link #refresh(String)} and then queried with {@link #isMember(String, String)} and
 * {@link #combine(SetOperation, List)}. Queries always see the most recently promoted member set,
 * even while a refresh of the same segment is running.
 */
public final class SegmentsClient implements SegmentsClientInterface {
  private final MemberSetStore store;
  private final SegmentResolver resolver;
  private final ScheduledExecutorService sharedExecutor;
  private final ExecutorService refreshExecutor;
  private final LDLogger baseLogger;

  /**
   * Creates a new client instance with the default configuration: an in-memory store, and no SQL
   * connections or managers.
   */
  public SegmentsClient() {
    this(SegmentsConfig.DEFAULT);
  }

  /**
   * Creates a new client to connect to the configured sources and store.
   * <p>
   * This constructor does not refresh anything. Member sets that a persistent store already holds
   * for a segment become visible as soon as the segment is registered again.
   *
   * @param config a client configuration object
   * @throws NullPointerException if a non-nullable parameter was null
   */
  public SegmentsClient(SegmentsConfig config) {
    checkNotNull(config, "config must not be null");

    LoggingConfiguration logging = config.logging.build(new ClientContext(null));
    ClientContext context = new ClientContext(logging);
    this.baseLogger = context.getBaseLogger();

    this.sharedExecutor = createSharedExecutor();
    this.refreshExecutor = createRefreshExecutor(config);

    SegmentSources sources = config.sources.build(context);
    this.store = config.store.build(context);

    LDLogger refreshLogger = baseLogger.subLogger(Loggers.REFRESH_LOGGER_NAME);
    RefreshCoordinator coordinator = new RefreshCoordinator(config.concurrentRefreshPolicy,
        refreshExecutor, refreshLogger);
    this.resolver = new SegmentResolver(
        new SourceAdapter(sources, baseLogger.subLogger(Loggers.SOURCE_LOGGER_NAME)),
        store,
        coordinator,
        EventBroadcasterImpl.forRefreshEvents(sharedExecutor, baseLogger),
        sharedExecutor,
        config.refreshTimeout,
        config.versionRetention,
        refreshLogger
        );

    baseLogger.info("Started segment client with {} refresh thread(s), {} SQL connection(s) and {} manager(s)",
        config.refreshThreads, sources.getSqlConnections().size(), sources.getManagers().size());
  }

  @Override
  public Segment createSegment(String segmentId, SegmentDefinition definition) {
    return resolver.createSegment(segmentId, definition);
  }

  @Override
  public Segment createSegment(SegmentDefinition definition) {
    return resolver.createSegment(definition);
  }

  @Override
  public Segment updateDefinition(String segmentId, SegmentDefinition definition) {
    return resolver.updateDefinition(segmentId, definition);
  }

  @Override
  public Segment getSegment(String segmentId) {
    return resolver.getSegment(segmentId);
  }

  @Override
  public List<Segment> getSegments() {
    return resolver.getSegments();
  }

  @Override
  public void deleteSegment(String segmentId) {
    resolver.deleteSegment(segmentId);
  }

  @Override
  public RefreshResult refresh(String segmentId) throws RefreshException {
    return resolver.refresh(segmentId);
  }

  @Override
  public Future<RefreshResult> refreshAsync(String segmentId) {
    return resolver.refreshAsync(segmentId);
  }

  @Override
  public RefreshSummary refreshAll() {
    return resolver.refreshAll();
  }

  @Override
  public int validateDefinition(SegmentDefinition definition) throws SourceException {
    return resolver.validate(definition);
  }

  @Override
  public boolean isMember(String segmentId, String identifier) {
    return resolver.isMember(segmentId, identifier);
  }

  @Override
  public boolean amIMemberOf(SegmentMember member, String segmentId) {
    checkNotNull(member, "member must not be null");
    return resolver.isMember(segmentId, member.getSegmentMemberId());
  }

  @Override
  public Set<String> getMembers(String segmentId) {
    return resolver.getMembers(segmentId);
  }

  @Override
  public long getMemberCount(String segmentId) {
    return resolver.getMemberCount(segmentId);
  }

  @Override
  public Set<String> getSegmentsFor(String identifier) {
    return resolver.getSegmentsFor(identifier);
  }

  @Override
  public Set<String> combine(SetOperation op, List<String> segmentIds) {
    return resolver.combine(op, segmentIds);
  }

  @Override
  public void registerRefreshListener(RefreshListener listener) {
    resolver.registerRefreshListener(listener);
  }

  @Override
  public void unregisterRefreshListener(RefreshListener listener) {
    resolver.unregisterRefreshListener(listener);
  }

  /**
   * Closes the client. Refreshes that are still running are abandoned and never promoted, and
   * scheduled cleanup of old versions does not run.
   *
   * @throws IOException if the store could not be closed
   */
  @Override
  public void close() throws IOException {
    baseLogger.info("Closing segment client");
    this.resolver.close();
    this.refreshExecutor.shutdownNow();
    this.sharedExecutor.shutdownNow();
    try {
      this.store.close();
    } catch (IOException e) {
      baseLogger.warn("Unexpected error closing member set store: {}", LogValues.exceptionSummary(e));
      throw e;
    }
  }

  private ScheduledExecutorService createSharedExecutor() {
    ThreadFactory threadFactory = new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("Segments-tasks-%d")
        .setPriority(Thread.MIN_PRIORITY)
        .build();
    return Executors.newSingleThreadScheduledExecutor(threadFactory);
  }

  private static ExecutorService createRefreshExecutor(SegmentsConfig config) {
    ThreadFactory threadFactory = new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("Segments-refresh-%d")
        .build();
    return Executors.newFixedThreadPool(config.refreshThreads, threadFactory);
  }
}
