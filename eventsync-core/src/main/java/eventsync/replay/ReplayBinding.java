package eventsync.replay;

import eventsync.model.SyncedEvent;

import java.util.Objects;

/**
 * An event type paired with the binder and handler that replay it.
 *
 * @param eventType the event type name
 * @param binder    binds the stored payload
 * @param handler   applies the bound payload
 * @param <T>       the bound payload type
 */
public record ReplayBinding<T>(String eventType, PayloadBinder<T> binder, ReplayHandler<T> handler) {

  public ReplayBinding {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(binder, "binder");
    Objects.requireNonNull(handler, "handler");
  }

  /**
   * Binds the payload and invokes the handler.
   *
   * @throws Exception if binding or the handler fails
   */
  public void invoke(EventPayload payload, SyncedEvent record) throws Exception {
    handler.handle(binder.bind(payload), record);
  }
}
