package eventsync.replay;

import eventsync.model.SyncedEvent;

/**
 * Applies one replayed event to the event-sourcing runtime.
 *
 * @param <T> the bound payload type
 */
@FunctionalInterface
public interface ReplayHandler<T> {

  /**
   * Applies the event.
   *
   * @param payload the bound payload
   * @param record  the stored record being replayed
   * @throws Exception if the event cannot be applied; the record stays pending
   */
  void handle(T payload, SyncedEvent record) throws Exception;
}
