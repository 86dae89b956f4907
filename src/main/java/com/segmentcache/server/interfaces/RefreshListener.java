package com.segmentcache.server.interfaces;

/**
 * An event listener that is notified when a segment refresh finishes, successfully or not.
 * <p>
 * Notifications are delivered on a worker thread, never on the thread that called refresh.
 *
 * @see SegmentsClientInterface#registerRefreshListener(RefreshListener)
 */
public interface RefreshListener {
  /**
   * Called after each refresh attempt.
   *
   * @param event the refresh outcome
   */
  void onRefresh(RefreshEvent event);
}
