package eventsync.sync;

/**
 * A per-event failure inside an otherwise completed batch.
 *
 * @param eventId   the event identifier, {@code null} if the event had none
 * @param eventType the event type, {@code null} if the event had none
 * @param message   what went wrong
 */
public record SyncError(String eventId, String eventType, String message) {

  @Override
  public String toString() {
    return (eventId != null ? eventId : "<no id>") + ": " + message;
  }
}
