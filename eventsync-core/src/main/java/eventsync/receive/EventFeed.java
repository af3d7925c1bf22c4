package eventsync.receive;

import com.fasterxml.jackson.databind.node.ObjectNode;
import eventsync.RawEvent;
import eventsync.SyncConfig;
import eventsync.model.EventQuery;
import eventsync.model.SyncedEvent;
import eventsync.store.EventRecordRepository;
import eventsync.util.JsonCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Serving side of a pull: exports stored events, newest first, to an authenticated peer.
 */
public final class EventFeed {
  private final SyncConfig config;
  private final ApiKeyVerifier keyVerifier;
  private final EventRecordRepository repository;
  private final JsonCodec jsonCodec;

  public EventFeed(SyncConfig config, EventRecordRepository repository) {
    this(config, repository, JsonCodec.getDefault());
  }

  public EventFeed(SyncConfig config, EventRecordRepository repository, JsonCodec jsonCodec) {
    this.config = Objects.requireNonNull(config, "config");
    this.keyVerifier = new ApiKeyVerifier(config.receiveKey());
    this.repository = Objects.requireNonNull(repository, "repository");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Exports events.
   *
   * @param authorization the request's {@code Authorization} header
   * @param query         selection criteria
   * @return the feed payload
   * @throws SyncAuthenticationException if the bearer token is missing or wrong
   */
  public FeedResponse export(String authorization, FeedQuery query) {
    keyVerifier.verify(ApiKeyVerifier.bearerToken(authorization));
    Objects.requireNonNull(query, "query");

    List<SyncedEvent> records = repository.find(EventQuery.builder()
        .eventTypes(query.eventTypes())
        .since(query.since())
        .limit(query.limit())
        .order(EventQuery.Order.NEWEST_FIRST)
        .build());
    List<ObjectNode> events = new ArrayList<>(records.size());
    for (SyncedEvent record : records) {
      events.add(new RawEvent(record.eventId(), record.eventType(),
          jsonCodec.readTree(record.eventData()), record.createdAtForWire()).toJson());
    }
    return new FeedResponse(true, events.size(), events, config.appUrl(), config.appName());
  }
}
