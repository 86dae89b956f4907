package com.segmentcache.server;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.segmentcache.server.interfaces.RefreshEvent;
import com.segmentcache.server.interfaces.RefreshListener;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.function.BiConsumer;

/**
 * A generic mechanism for registering event listeners and broadcasting events to them. Each
 * notification is submitted individually to the executor, so a slow or failing listener does not
 * delay the others or the thread that produced the event.
 *
 * @param <ListenerT> the listener interface class
 * @param <EventT> the event class
 */
class EventBroadcasterImpl<ListenerT, EventT> {
  private final CopyOnWriteArrayList<ListenerT> listeners = new CopyOnWriteArrayList<>();
  private final BiConsumer<ListenerT, EventT> broadcastAction;
  private final ExecutorService executor;
  private final LDLogger logger;

  /**
   * Creates an instance.
   *
   * @param broadcastAction a lambda that calls the appropriate listener method for an event
   * @param executor the executor to use for running notification tasks on a worker thread; if this
   *   is null (which should only be the case in test code) then broadcasting an event will be a no-op
   * @param logger logger for listener errors
   */
  EventBroadcasterImpl(
      BiConsumer<ListenerT, EventT> broadcastAction,
      ExecutorService executor,
      LDLogger logger
      ) {
    this.broadcastAction = broadcastAction;
    this.executor = executor;
    this.logger = logger;
  }

  static EventBroadcasterImpl<RefreshListener, RefreshEvent> forRefreshEvents(
      ExecutorService executor, LDLogger logger) {
    return new EventBroadcasterImpl<>(RefreshListener::onRefresh, executor, logger);
  }

  void register(ListenerT listener) {
    listeners.add(listener);
  }

  void unregister(ListenerT listener) {
    listeners.remove(listener);
  }

  boolean hasListeners() {
    return !listeners.isEmpty();
  }

  /**
   * Broadcasts an event to all available listeners.
   *
   * @param event the event to broadcast
   */
  void broadcast(EventT event) {
    if (executor == null || executor.isShutdown()) {
      return;
    }
    for (ListenerT l: listeners) {
      executor.execute(() -> {
        try {
          broadcastAction.accept(l, event);
        } catch (Exception e) {
          logger.warn("Unexpected error from listener ({}): {}", l.getClass(), LogValues.exceptionSummary(e));
          logger.debug("{}", LogValues.exceptionTrace(e));
        }
      });
    }
  }
}
