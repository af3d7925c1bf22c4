package eventsync.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A remote event that has been accepted for local storage.
 *
 * <p>Identity is the pair ({@link #eventId()}, {@link #sourceUrl()}); the store enforces it
 * with a unique constraint. {@link #replayedAt()} is the only attribute that changes after
 * creation, and it changes at most once.
 *
 * @param sequence   store-assigned row number, {@code null} until persisted; breaks ties
 *                   between records sharing a {@code syncedAt}
 * @param eventId    the event identifier (the peer's id, or a generated ULID)
 * @param sourceUrl  the peer URL, {@code null} for events of local origin
 * @param eventType  the event type name
 * @param eventData  the payload as JSON text
 * @param metadata   sync provenance
 * @param syncedAt   creation time of this record
 * @param replayedAt when the record was replayed, {@code null} while pending
 */
public record SyncedEvent(
    Long sequence,
    String eventId,
    String sourceUrl,
    String eventType,
    String eventData,
    SyncMetadata metadata,
    Instant syncedAt,
    Instant replayedAt
) {

  public SyncedEvent {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(syncedAt, "syncedAt");
    if (eventType.isEmpty()) {
      throw new IllegalArgumentException("eventType cannot be empty");
    }
    if (eventData == null) {
      eventData = "{}";
    }
  }

  public boolean isReplayed() {
    return replayedAt != null;
  }

  public SyncedEvent withSequence(long newSequence) {
    return new SyncedEvent(newSequence, eventId, sourceUrl, eventType, eventData,
        metadata, syncedAt, replayedAt);
  }

  public SyncedEvent withReplayedAt(Instant when) {
    return new SyncedEvent(sequence, eventId, sourceUrl, eventType, eventData,
        metadata, syncedAt, when);
  }

  /**
   * Timestamp sent over the wire as {@code created_at}: the peer's original timestamp when
   * known, otherwise the local creation time.
   */
  public String createdAtForWire() {
    if (metadata != null && metadata.originalCreatedAt() != null) {
      return metadata.originalCreatedAt();
    }
    return syncedAt.toString();
  }

  @Override
  public String toString() {
    return "SyncedEvent{eventId=" + eventId + ", eventType=" + eventType
        + ", sourceUrl=" + sourceUrl + ", replayed=" + isReplayed() + '}';
  }
}
