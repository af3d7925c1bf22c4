package eventsync.processor;

import com.github.f4b6a3.ulid.UlidCreator;
import eventsync.RawEvent;
import eventsync.filter.EventFilter;
import eventsync.model.SyncMetadata;
import eventsync.model.SyncedEvent;
import eventsync.util.JsonCodec;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Validates and normalizes inbound raw events into storable records.
 *
 * <p>The processor is pure with respect to storage: it never reads or writes the record
 * store and never throws for bad input. Events without an identifier receive a fresh
 * monotonic ULID.
 */
public final class EventProcessor {
  private final EventFilter filter;
  private final JsonCodec jsonCodec;
  private final Clock clock;

  public EventProcessor(EventFilter filter) {
    this(filter, JsonCodec.getDefault(), Clock.systemUTC());
  }

  public EventProcessor(EventFilter filter, JsonCodec jsonCodec, Clock clock) {
    this.filter = Objects.requireNonNull(filter, "filter");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ProcessingResult process(RawEvent raw, String sourceUrl) {
    return process(raw, sourceUrl, null);
  }

  /**
   * Processes one raw event.
   *
   * @param raw        the inbound event
   * @param sourceUrl  the peer it came from, {@code null} for local origin
   * @param sourceName the peer's name, may be {@code null}
   * @return {@link ProcessingResult.Accepted} with a new record, or {@link ProcessingResult.Rejected}
   */
  public ProcessingResult process(RawEvent raw, String sourceUrl, String sourceName) {
    if (raw == null || raw.type() == null || raw.type().isBlank()) {
      return new ProcessingResult.Rejected(RejectionReason.MISSING_TYPE, "Event type is required");
    }
    String type = raw.type();
    if (!filter.shouldInclude(type)) {
      return new ProcessingResult.Rejected(RejectionReason.FILTERED_OUT,
          "Event type '" + type + "' is filtered out");
    }

    Instant now = clock.instant();
    String eventId = raw.id() == null || raw.id().isBlank()
        ? UlidCreator.getMonotonicUlid().toString()
        : raw.id();
    String createdAt = raw.createdAt() == null || raw.createdAt().isBlank()
        ? now.toString()
        : raw.createdAt();

    SyncMetadata metadata = new SyncMetadata(true, sourceUrl, sourceName, eventId, createdAt,
        now.toString());
    SyncedEvent event = new SyncedEvent(null, eventId, sourceUrl, type,
        jsonCodec.toJson(raw.data()), metadata, now, null);
    return new ProcessingResult.Accepted(event);
  }

  public EventFilter filter() {
    return filter;
  }
}
