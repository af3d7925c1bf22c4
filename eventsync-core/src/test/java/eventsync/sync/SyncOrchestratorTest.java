package eventsync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import eventsync.SyncConfig;
import eventsync.filter.EventFilter;
import eventsync.http.StubPeerClient;
import eventsync.model.Operation;
import eventsync.model.OperationLogEntry;
import eventsync.model.OperationStatus;
import eventsync.model.SyncMetadata;
import eventsync.model.SyncedEvent;
import eventsync.store.EventRecordRepository;
import eventsync.store.InMemoryOperationLogStore;
import eventsync.store.InMemorySyncedEventStore;
import eventsync.store.OperationLog;
import eventsync.store.SyncStatus;
import eventsync.store.TestConnections;
import eventsync.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyncOrchestratorTest {
  private static final String SOURCE = "https://source.test/api/event-sync";
  private static final String DESTINATION = "https://destination.test/api/event-sync/receive";

  private final InMemorySyncedEventStore eventStore = new InMemorySyncedEventStore();
  private final InMemoryOperationLogStore logStore = new InMemoryOperationLogStore();
  private final EventRecordRepository repository = new EventRecordRepository(
      TestConnections.dummyProvider(), eventStore,
      new OperationLog(TestConnections.dummyProvider(), logStore));
  private final StubPeerClient peer = new StubPeerClient();

  private SyncOrchestrator orchestrator(SyncConfig config) {
    return SyncOrchestrator.builder()
        .config(config)
        .repository(repository)
        .peerClient(peer)
        .build();
  }

  private static SyncConfig.Builder baseConfig() {
    return SyncConfig.builder()
        .sourceUrl(SOURCE)
        .sourceToken("pull-token")
        .destinationUrl(DESTINATION)
        .destinationKey("send-key")
        .appUrl("https://me.test")
        .appName("me");
  }

  private SyncOrchestrator orchestrator() {
    return orchestrator(baseConfig().build());
  }

  @Test
  void pullStoresEventAndLogsSuccess() {
    peer.respond(200, "{\"events\":[{\"id\":\"123-abc\",\"type\":\"user.created\","
        + "\"data\":{\"user_id\":1},\"created_at\":\"2024-01-01T00:00:00Z\"}]}");

    PullResult result = orchestrator().pull(PullRequest.builder().build());

    assertTrue(result.success());
    assertEquals(0, result.exitCode());
    assertEquals(1, result.processed());
    assertEquals(1, eventStore.rows().size());
    SyncedEvent stored = eventStore.rows().get(0);
    assertEquals("123-abc", stored.eventId());
    assertEquals(SOURCE, stored.sourceUrl());

    List<OperationLogEntry> logs = logStore.entries(Operation.PULL);
    assertEquals(1, logs.size());
    assertEquals(OperationStatus.SUCCESS, logs.get(0).status());
    assertEquals(1, logs.get(0).eventsCount());
  }

  @Test
  void pullKeepsSourceNameFromEnvelope() {
    peer.respond(200, "{\"events\":[{\"id\":\"e-1\",\"type\":\"user.created\",\"data\":{}}],"
        + "\"source_url\":\"https://crm.test\",\"source_name\":\"crm\"}");

    orchestrator().pull(PullRequest.builder().build());

    SyncedEvent stored = eventStore.rows().get(0);
    assertEquals("crm", stored.metadata().sourceName());
    assertEquals(SOURCE, stored.metadata().sourceUrl());
  }

  @Test
  void pullWithoutSourceNameLeavesItUnset() {
    peer.respond(200, "{\"data\":[{\"id\":\"e-1\",\"type\":\"user.created\",\"data\":{}}]}");

    orchestrator().pull(PullRequest.builder().build());

    assertNull(eventStore.rows().get(0).metadata().sourceName());
  }

  @Test
  void logEntriesUseInjectedClock() {
    Instant now = Instant.parse("2024-03-01T12:00:00Z");
    peer.respond(200, "{\"events\":[{\"id\":\"e-1\",\"type\":\"user.created\",\"data\":{}}]}");
    SyncOrchestrator orchestrator = SyncOrchestrator.builder()
        .config(baseConfig().build())
        .repository(repository)
        .peerClient(peer)
        .clock(Clock.fixed(now, ZoneOffset.UTC))
        .build();

    orchestrator.pull(PullRequest.builder().build());
    orchestrator.send(SendRequest.builder().build());

    assertEquals(now, eventStore.rows().get(0).syncedAt());
    assertEquals(now, logStore.entries(Operation.PULL).get(0).timestamp());
    assertEquals(now, logStore.entries(Operation.SEND).get(0).timestamp());
  }

  @Test
  void pullSendsBearerTokenAndQueryParameters() {
    orchestrator().pull(PullRequest.builder()
        .since(Instant.parse("2024-01-01T00:00:00Z"))
        .eventType("user.created")
        .eventType("post.created")
        .limit(25)
        .build());

    StubPeerClient.Call call = peer.lastCall();
    assertEquals("GET", call.method());
    assertEquals(SOURCE, call.url());
    assertEquals("Bearer pull-token", call.headers().get("Authorization"));
    assertEquals("2024-01-01T00:00:00Z", call.queryParams().get("since"));
    assertEquals("user.created,post.created", call.queryParams().get("event_type"));
    assertEquals("25", call.queryParams().get("limit"));
    assertEquals(Duration.ofSeconds(30), call.timeout());
  }

  @Test
  void pullDefaultsLimitToBatchSize() {
    orchestrator(baseConfig().batchSize(7).build()).pull(PullRequest.builder().build());

    assertEquals("7", peer.lastCall().queryParams().get("limit"));
    assertFalse(peer.lastCall().queryParams().containsKey("since"));
  }

  @Test
  void pullTwiceIsIdempotent() {
    peer.respond(200, "{\"events\":[{\"id\":\"e-1\",\"type\":\"user.created\",\"data\":{}}]}");
    SyncOrchestrator orchestrator = orchestrator();

    PullResult first = orchestrator.pull(PullRequest.builder().build());
    PullResult second = orchestrator.pull(PullRequest.builder().build());

    assertEquals(1, first.processed());
    assertEquals(0, second.processed());
    assertEquals(1, second.skipped());
    assertTrue(second.success());
    assertEquals(1, eventStore.rows().size());
  }

  @Test
  void unauthorizedResponseFailsWithStatusInMessage() {
    peer.respond(401, "{\"error\":\"Unauthorized\"}");

    PullResult result = orchestrator().pull(PullRequest.builder().build());

    assertFalse(result.success());
    assertEquals(1, result.exitCode());
    assertEquals(SyncFailure.REMOTE_STATUS, result.failure());
    assertTrue(result.message().contains("401"));
    assertTrue(eventStore.rows().isEmpty());
    List<OperationLogEntry> logs = logStore.entries(Operation.PULL);
    assertEquals(1, logs.size());
    assertEquals(OperationStatus.FAILED, logs.get(0).status());
    assertEquals(401, logs.get(0).details().get("status"));
  }

  @Test
  void includeListKeepsOnlyMatchingTypes() {
    peer.respond(200, "{\"events\":["
        + "{\"id\":\"1\",\"type\":\"user.created\",\"data\":{}},"
        + "{\"id\":\"2\",\"type\":\"post.created\",\"data\":{}}]}");
    SyncConfig config = baseConfig()
        .eventFilter(EventFilter.of(List.of("user.created"), List.of()))
        .build();

    PullResult result = orchestrator(config).pull(PullRequest.builder().build());

    assertEquals(1, result.processed());
    assertEquals(1, result.skipped());
    assertEquals(1, eventStore.rows().size());
    assertEquals("user.created", eventStore.rows().get(0).eventType());
  }

  @Test
  void requestedTypesAreEnforcedLocally() {
    peer.respond(200, "{\"events\":["
        + "{\"id\":\"1\",\"type\":\"user.created\"},"
        + "{\"id\":\"2\",\"type\":\"post.created\"}]}");

    PullResult result = orchestrator().pull(PullRequest.builder().eventType("user.created").build());

    assertEquals(1, result.processed());
    assertEquals(1, result.skipped());
  }

  @Test
  void missingTypeIsIsolatedError() {
    peer.respond(200, "{\"events\":["
        + "{\"id\":\"1\",\"type\":\"user.created\"},"
        + "{\"id\":\"2\"},"
        + "{\"id\":\"3\",\"type\":\"user.updated\"}]}");

    PullResult result = orchestrator().pull(PullRequest.builder().build());

    assertTrue(result.success());
    assertEquals(2, result.processed());
    assertEquals(1, result.errorCount());
    assertEquals("2", result.errors().get(0).eventId());
    assertEquals(2, eventStore.rows().size());
    assertEquals(1, logStore.entries(Operation.PULL).get(0).details().get("errors"));
  }

  @Test
  void nonObjectElementsAreCountedAsErrors() {
    peer.respond(200, "{\"events\":[42, {\"id\":\"1\",\"type\":\"a\"}]}");

    PullResult result = orchestrator().pull(PullRequest.builder().build());

    assertEquals(1, result.processed());
    assertEquals(1, result.errorCount());
  }

  @Test
  void allErrorsMakesPullFail() {
    peer.respond(200, "{\"events\":[{\"id\":\"1\"},{\"id\":\"2\",\"type\":\"\"}]}");

    PullResult result = orchestrator().pull(PullRequest.builder().build());

    assertFalse(result.success());
    assertEquals(SyncFailure.ALL_EVENTS_FAILED, result.failure());
    assertEquals(OperationStatus.FAILED, logStore.entries(Operation.PULL).get(0).status());
  }

  @Test
  void storageFailureIsCountedAndBatchContinues() {
    eventStore.failInsertsFor("broken");
    peer.respond(200, "{\"events\":["
        + "{\"id\":\"1\",\"type\":\"broken\"},"
        + "{\"id\":\"2\",\"type\":\"fine\"}]}");

    PullResult result = orchestrator().pull(PullRequest.builder().build());

    assertTrue(result.success());
    assertEquals(1, result.processed());
    assertEquals(1, result.errorCount());
    assertEquals(1, logStore.entries(Operation.STORE_EVENT).size());
  }

  @Test
  void dataEnvelopeIsEquivalentToEvents() {
    peer.respond(200, "{\"data\":[{\"id\":\"1\",\"type\":\"user.created\"}]}");

    PullResult result = orchestrator().pull(PullRequest.builder().build());

    assertEquals(1, result.processed());
  }

  @Test
  void emptyResponseSucceedsWithoutLogging() {
    peer.respond(200, "{\"events\":[]}");

    PullResult result = orchestrator().pull(PullRequest.builder().build());

    assertTrue(result.success());
    assertEquals(0, result.eventsCount());
    assertTrue(logStore.entries().isEmpty());
  }

  @Test
  void dryRunReturnsEventsWithoutSideEffects() {
    peer.respond(200, "{\"events\":["
        + "{\"id\":\"1\",\"type\":\"user.created\"},"
        + "{\"id\":\"2\",\"type\":\"post.created\"}]}");

    PullResult result = orchestrator().pull(PullRequest.builder().dryRun(true).build());

    assertTrue(result.success());
    assertEquals(2, result.eventsCount());
    assertEquals(2, result.events().size());
    assertEquals("user.created", result.events().get(0).type());
    assertTrue(eventStore.rows().isEmpty());
    assertTrue(logStore.entries().isEmpty());
  }

  @Test
  void breakdownCountsProcessedPerType() {
    peer.respond(200, "{\"events\":["
        + "{\"id\":\"1\",\"type\":\"a\"},{\"id\":\"2\",\"type\":\"a\"},{\"id\":\"3\",\"type\":\"b\"}]}");

    PullResult result = orchestrator().pull(PullRequest.builder().breakdown(true).build());

    assertEquals(2, result.typeBreakdown().get("a"));
    assertEquals(1, result.typeBreakdown().get("b"));
  }

  @Test
  void transportFailureIsLoggedAsError() {
    peer.fail("Connection refused");

    PullResult result = orchestrator().pull(PullRequest.builder().build());

    assertFalse(result.success());
    assertEquals(SyncFailure.TRANSPORT, result.failure());
    assertEquals(OperationStatus.ERROR, logStore.entries(Operation.PULL).get(0).status());
  }

  @Test
  void invalidBodyIsLoggedAsError() {
    peer.respond(200, "<html>not json</html>");

    PullResult result = orchestrator().pull(PullRequest.builder().build());

    assertFalse(result.success());
    assertEquals(SyncFailure.INVALID_RESPONSE, result.failure());
    assertEquals(OperationStatus.ERROR, logStore.entries(Operation.PULL).get(0).status());
  }

  @Test
  void pullWithoutSourceFailsBeforeIo() {
    SyncConfig config = SyncConfig.builder().build();

    PullResult result = orchestrator(config).pull(PullRequest.builder().build());

    assertFalse(result.success());
    assertEquals(SyncFailure.SOURCE_NOT_CONFIGURED, result.failure());
    assertTrue(peer.calls().isEmpty());
    assertTrue(logStore.entries().isEmpty());
  }

  @Test
  void sendWithoutDestinationFailsBeforeIo() {
    SyncConfig config = SyncConfig.builder().destinationUrl(DESTINATION).build();

    SendResult result = orchestrator(config).send(SendRequest.builder().build());

    assertFalse(result.success());
    assertEquals(SyncFailure.DESTINATION_NOT_CONFIGURED, result.failure());
    assertTrue(peer.calls().isEmpty());
  }

  @Test
  void sendWithNothingStoredMakesNoCall() {
    SendResult result = orchestrator().send(SendRequest.builder().build());

    assertTrue(result.success());
    assertEquals(0, result.eventsCount());
    assertTrue(peer.calls().isEmpty());
    assertTrue(logStore.entries().isEmpty());
  }

  @Test
  void sendPostsWireShapeWithKeyHeader() {
    Instant older = Instant.parse("2024-01-01T00:00:00Z");
    eventStore.add(new SyncedEvent(null, "e-2", null, "post.created", "{\"id\":2}", null,
        older.plusSeconds(60), null));
    eventStore.add(new SyncedEvent(null, "e-1", "https://x", "user.created", "{\"id\":1}",
        new SyncMetadata(true, "https://x", null, "e-1", "2023-12-31T00:00:00Z", null),
        older, null));
    peer.respond(200, "{\"success\":true}");

    SendResult result = orchestrator().send(SendRequest.builder().build());

    assertTrue(result.success());
    assertEquals(2, result.eventsCount());
    StubPeerClient.Call call = peer.lastCall();
    assertEquals("POST", call.method());
    assertEquals(DESTINATION, call.url());
    assertEquals("send-key", call.headers().get("X-Event-Sync-Key"));
    assertEquals("Bearer send-key", call.headers().get("Authorization"));

    JsonNode body = JsonCodec.getDefault().readTree(call.body());
    assertEquals("https://me.test", body.get("source_url").asText());
    assertEquals("me", body.get("source_name").asText());
    assertEquals(2, body.get("events").size());
    JsonNode first = body.get("events").get(0);
    assertEquals("e-1", first.get("id").asText());
    assertEquals("user.created", first.get("type").asText());
    assertEquals(1, first.get("data").get("id").asInt());
    assertEquals("2023-12-31T00:00:00Z", first.get("created_at").asText());

    OperationLogEntry log = logStore.entries(Operation.SEND).get(0);
    assertEquals(OperationStatus.SUCCESS, log.status());
    assertEquals(2, log.eventsCount());
  }

  @Test
  void sendFiltersByTypeAndLimit() {
    Instant t = Instant.parse("2024-01-01T00:00:00Z");
    eventStore.add(new SyncedEvent(null, "1", null, "a", "{}", null, t, null));
    eventStore.add(new SyncedEvent(null, "2", null, "b", "{}", null, t.plusSeconds(1), null));
    eventStore.add(new SyncedEvent(null, "3", null, "a", "{}", null, t.plusSeconds(2), null));

    SendResult result = orchestrator().send(SendRequest.builder().eventType("a").limit(1).build());

    assertEquals(1, result.eventsCount());
    JsonNode body = JsonCodec.getDefault().readTree(peer.lastCall().body());
    assertEquals("1", body.get("events").get(0).get("id").asText());
  }

  @Test
  void sendDryRunMakesNoCall() {
    eventStore.add(new SyncedEvent(null, "1", null, "a", "{}", null, Instant.now(), null));

    SendResult result = orchestrator().send(SendRequest.builder().dryRun(true).build());

    assertTrue(result.success());
    assertEquals(1, result.eventsCount());
    assertTrue(peer.calls().isEmpty());
    assertTrue(logStore.entries().isEmpty());
  }

  @Test
  void sendRejectedByDestinationIsLoggedAsFailed() {
    eventStore.add(new SyncedEvent(null, "1", null, "a", "{}", null, Instant.now(), null));
    peer.respond(403, "{\"error\":\"Unauthorized\"}");

    SendResult result = orchestrator().send(SendRequest.builder().build());

    assertFalse(result.success());
    assertEquals(403, result.response().statusCode());
    assertTrue(result.message().contains("403"));
    assertEquals(OperationStatus.FAILED, logStore.entries(Operation.SEND).get(0).status());
  }

  @Test
  void sendTransportFailureIsLoggedAsError() {
    eventStore.add(new SyncedEvent(null, "1", null, "a", "{}", null, Instant.now(), null));
    peer.fail("timeout");

    SendResult result = orchestrator().send(SendRequest.builder().build());

    assertFalse(result.success());
    assertEquals(SyncFailure.TRANSPORT, result.failure());
    assertEquals(OperationStatus.ERROR, logStore.entries(Operation.SEND).get(0).status());
  }

  @Test
  void statusReportsLastPullAndTotal() {
    peer.respond(200, "{\"events\":[{\"id\":\"1\",\"type\":\"a\"},{\"id\":\"2\",\"type\":\"b\"}]}");
    SyncOrchestrator orchestrator = orchestrator();
    orchestrator.pull(PullRequest.builder().build());

    SyncStatus status = orchestrator.status();

    assertEquals(2, status.totalSyncedEvents());
    assertEquals(2, status.lastPull().eventsCount());
  }
}
