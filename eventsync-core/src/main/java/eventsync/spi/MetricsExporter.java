package eventsync.spi;

/**
 * Observability hook for exporting sync counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see eventsync.spi.MetricsExporter.Noop
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of pulled events that were stored.
   */
  void incrementEventsPulled(int count);

  /**
   * Increments the count of pulled events skipped as duplicates or filtered out.
   */
  void incrementEventsSkipped(int count);

  /**
   * Increments the count of pulled or received events that failed processing or storage.
   */
  void incrementEventsFailed(int count);

  /**
   * Increments the count of events delivered to the destination.
   */
  void incrementEventsSent(int count);

  /**
   * Increments the count of send operations that failed.
   */
  void incrementSendFailures();

  /**
   * Increments the count of records replayed successfully.
   */
  void incrementEventsReplayed(int count);

  /**
   * Increments the count of records whose replay handler failed.
   */
  void incrementReplayFailures(int count);

  /**
   * Records the time spent fetching from or posting to a peer.
   *
   * @param durationMs elapsed milliseconds (always non-negative)
   */
  default void recordFetchDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEventsPulled(int count) {
    }

    @Override
    public void incrementEventsSkipped(int count) {
    }

    @Override
    public void incrementEventsFailed(int count) {
    }

    @Override
    public void incrementEventsSent(int count) {
    }

    @Override
    public void incrementSendFailures() {
    }

    @Override
    public void incrementEventsReplayed(int count) {
    }

    @Override
    public void incrementReplayFailures(int count) {
    }
  }
}
