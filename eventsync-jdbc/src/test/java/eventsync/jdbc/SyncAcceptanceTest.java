package eventsync.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import eventsync.SyncConfig;
import eventsync.filter.EventFilter;
import eventsync.http.HttpPeerClient;
import eventsync.jdbc.store.JdbcOperationLogStore;
import eventsync.jdbc.store.JdbcSyncedEventStores;
import eventsync.model.EventQuery;
import eventsync.model.Operation;
import eventsync.model.OperationLogEntry;
import eventsync.model.OperationStatus;
import eventsync.model.SyncedEvent;
import eventsync.receive.EventFeed;
import eventsync.receive.EventReceiver;
import eventsync.receive.FeedQuery;
import eventsync.receive.ReceiveRequest;
import eventsync.receive.SyncAuthenticationException;
import eventsync.replay.ReplayEngine;
import eventsync.replay.ReplayRegistry;
import eventsync.replay.ReplayRequest;
import eventsync.replay.ReplayResult;
import eventsync.spi.UnitOfWork;
import eventsync.store.EventRecordRepository;
import eventsync.store.OperationLog;
import eventsync.sync.PullRequest;
import eventsync.sync.PullResult;
import eventsync.sync.SendRequest;
import eventsync.sync.SendResult;
import eventsync.sync.SyncFailure;
import eventsync.sync.SyncOrchestrator;
import eventsync.util.JsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end sync between nodes backed by H2, talking HTTP through the real peer client.
 */
class SyncAcceptanceTest {
  private static final String USER_CREATED =
      "{\"id\":\"123\",\"type\":\"UserCreated\",\"data\":{\"name\":\"Ada\"},"
          + "\"created_at\":\"2024-01-01T00:00:00Z\"}";
  private static final String ORDER_PLACED =
      "{\"id\":\"456\",\"type\":\"OrderPlaced\",\"data\":{\"total\":42},"
          + "\"created_at\":\"2024-01-01T00:01:00Z\"}";

  private final JsonCodec codec = JsonCodec.getDefault();
  private final List<Node> nodes = new ArrayList<>();
  private HttpServer server;
  private String baseUrl;

  private final AtomicReference<Integer> scriptedStatus = new AtomicReference<>(200);
  private final AtomicReference<String> scriptedBody = new AtomicReference<>("{\"events\":[]}");
  private final List<Map<String, String>> scriptedRequests = new CopyOnWriteArrayList<>();

  private Node feedNode;
  private Node receiverNode;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/scripted", exchange -> {
      Map<String, String> request = new HashMap<>(query(exchange));
      request.put("Authorization", exchange.getRequestHeaders().getFirst("Authorization"));
      scriptedRequests.add(request);
      respond(exchange, scriptedStatus.get(), scriptedBody.get());
    });
    server.createContext("/feed", exchange -> {
      Map<String, String> params = query(exchange);
      try {
        EventFeed feed = new EventFeed(feedNode.config, feedNode.repository);
        respond(exchange, 200, codec.toJson(feed.export(
            exchange.getRequestHeaders().getFirst("Authorization"),
            FeedQuery.parse(params.get("since"), params.get("event_type"), params.get("limit")))));
      } catch (SyncAuthenticationException e) {
        respond(exchange, 401, "{\"error\":\"Unauthorized\"}");
      }
    });
    server.createContext("/receive", exchange -> {
      String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
      try {
        EventReceiver receiver = new EventReceiver(receiverNode.config, receiverNode.repository);
        JsonNode json = codec.readTree(body);
        respond(exchange, 200, codec.toJson(receiver.receive(
            exchange.getRequestHeaders().getFirst("X-Event-Sync-Key"),
            ReceiveRequest.fromJson(json))));
      } catch (SyncAuthenticationException e) {
        respond(exchange, 401, "{\"error\":\"Unauthorized\"}");
      }
    });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
    nodes.forEach(node -> node.dataSource.close());
  }

  @Test
  void pullStoresNewEventAndLogsOneSuccessEntry() {
    Node node = node(SyncConfig.builder()
        .sourceUrl(baseUrl + "/scripted")
        .sourceToken("abc")
        .build());
    scriptedBody.set("{\"events\":[" + USER_CREATED + "]}");

    PullResult result = node.orchestrator.pull(PullRequest.builder().build());

    assertTrue(result.success());
    assertEquals(1, result.processed());
    assertEquals("Bearer abc", scriptedRequests.get(0).get("Authorization"));
    assertEquals("100", scriptedRequests.get(0).get("limit"));

    List<SyncedEvent> stored = node.repository.find(EventQuery.builder().build());
    assertEquals(1, stored.size());
    SyncedEvent event = stored.get(0);
    assertEquals("123", event.eventId());
    assertEquals(baseUrl + "/scripted", event.sourceUrl());
    assertEquals("2024-01-01T00:00:00Z", event.metadata().originalCreatedAt());
    assertEquals("Ada", codec.readTree(event.eventData()).get("name").asText());

    List<OperationLogEntry> log = node.operationLog.recent(null, 10);
    assertEquals(1, log.size());
    assertEquals(Operation.PULL, log.get(0).operation());
    assertEquals(OperationStatus.SUCCESS, log.get(0).status());
    assertEquals(1, log.get(0).eventsCount());

    Map<String, Object> status = node.orchestrator.status().toMap();
    assertEquals(1L, status.get("total_synced_events"));
    assertNotNull(status.get("last_pull"));
  }

  @Test
  void unauthorizedPullStoresNothingAndLogsFailure() {
    Node node = node(SyncConfig.builder().sourceUrl(baseUrl + "/scripted").build());
    scriptedStatus.set(401);
    scriptedBody.set("{\"error\":\"Unauthorized\"}");

    PullResult result = node.orchestrator.pull(PullRequest.builder().build());

    assertFalse(result.success());
    assertEquals(SyncFailure.REMOTE_STATUS, result.failure());
    assertEquals("Failed to fetch events from source: HTTP 401", result.message());
    assertEquals(0, node.repository.count());

    OperationLogEntry entry = node.operationLog.recent(Operation.PULL, 1).get(0);
    assertEquals(OperationStatus.FAILED, entry.status());
    assertEquals(401, ((Number) entry.details().get("status")).intValue());
    assertTrue(node.operationLog.lastSuccessfulPull().isEmpty());
  }

  @Test
  void includeFilterSkipsOtherTypes() {
    Node node = node(SyncConfig.builder()
        .sourceUrl(baseUrl + "/scripted")
        .eventFilter(EventFilter.of(List.of("UserCreated"), List.of()))
        .build());
    scriptedBody.set("{\"events\":[" + USER_CREATED + "," + ORDER_PLACED + "]}");

    PullResult result = node.orchestrator.pull(PullRequest.builder().build());

    assertTrue(result.success());
    assertEquals(1, result.processed());
    assertEquals(1, result.skipped());
    assertEquals(1, node.repository.count());
  }

  @Test
  void repeatedPullIsIdempotent() {
    Node node = node(SyncConfig.builder().sourceUrl(baseUrl + "/scripted").build());
    scriptedBody.set("{\"events\":[" + USER_CREATED + "]}");

    node.orchestrator.pull(PullRequest.builder().build());
    PullResult second = node.orchestrator.pull(PullRequest.builder().build());

    assertTrue(second.success());
    assertEquals(0, second.processed());
    assertEquals(1, second.skipped());
    assertEquals(1, node.repository.count());
  }

  @Test
  void dataEnvelopeIsAccepted() {
    Node node = node(SyncConfig.builder().sourceUrl(baseUrl + "/scripted").build());
    scriptedBody.set("{\"data\":[" + ORDER_PLACED + "]}");

    PullResult result = node.orchestrator.pull(PullRequest.builder().build());

    assertTrue(result.success());
    assertTrue(node.repository.exists("456", baseUrl + "/scripted"));
  }

  @Test
  void eventsTravelFromFeedThroughPullAndSendToReceiver() {
    feedNode = node(SyncConfig.builder()
        .destinationKey("feed-key")
        .appUrl("http://node-a")
        .appName("node-a")
        .build());
    Node middle = node(SyncConfig.builder()
        .sourceUrl(baseUrl + "/feed")
        .sourceToken("feed-key")
        .destinationUrl(baseUrl + "/receive")
        .destinationKey("receiver-key")
        .appUrl("http://node-b")
        .appName("node-b")
        .build());
    receiverNode = node(SyncConfig.builder()
        .destinationKey("receiver-key")
        .appUrl("http://node-c")
        .build());

    Instant t0 = Instant.parse("2024-05-01T08:00:00Z");
    feedNode.repository.storeIfAbsent(
        new SyncedEvent(null, "a-1", null, "UserCreated", "{\"name\":\"Ada\"}", null, t0, null));
    feedNode.repository.storeIfAbsent(
        new SyncedEvent(null, "a-2", null, "OrderPlaced", "{\"total\":7}", null,
            t0.plusSeconds(1), null));

    PullResult pulled = middle.orchestrator.pull(PullRequest.builder().build());
    assertTrue(pulled.success());
    assertEquals(2, pulled.processed());
    assertEquals(2, middle.repository.count());

    SendResult sent = middle.orchestrator.send(SendRequest.builder().build());
    assertTrue(sent.success(), sent.message());
    assertEquals(2, sent.eventsCount());
    assertEquals(200, sent.response().statusCode());

    assertEquals(2, receiverNode.repository.count());
    assertTrue(receiverNode.repository.exists("a-1", "http://node-b"));
    SyncedEvent received = receiverNode.repository.find(
        EventQuery.builder().eventType("UserCreated").build()).get(0);
    assertEquals("node-b", received.metadata().sourceName());
    assertEquals(t0.toString(), received.metadata().originalCreatedAt());

    OperationLogEntry sendEntry = middle.operationLog.recent(Operation.SEND, 1).get(0);
    assertEquals(OperationStatus.SUCCESS, sendEntry.status());
    assertEquals(2, sendEntry.eventsCount());
  }

  @Test
  void feedRejectsWrongToken() {
    feedNode = node(SyncConfig.builder().destinationKey("feed-key").build());
    Node puller = node(SyncConfig.builder()
        .sourceUrl(baseUrl + "/feed")
        .sourceToken("wrong")
        .build());

    PullResult result = puller.orchestrator.pull(PullRequest.builder().build());

    assertFalse(result.success());
    assertEquals(SyncFailure.REMOTE_STATUS, result.failure());
  }

  @Test
  void replayMarksRecordsOnlyAfterCommit() {
    Node node = node(SyncConfig.builder().sourceUrl(baseUrl + "/scripted").build());
    scriptedBody.set("{\"events\":[" + USER_CREATED + "," + ORDER_PLACED + "]}");
    node.orchestrator.pull(PullRequest.builder().build());

    List<String> applied = new CopyOnWriteArrayList<>();
    ReplayRegistry registry = new ReplayRegistry()
        .register("UserCreated", (payload, event) -> applied.add(payload.getString("name", "")))
        .register("OrderPlaced", (payload, event) -> applied.add(event.eventId()));

    ReplayResult failed = engine(node, registry, () -> {
      throw new IllegalStateException("commit refused");
    }).replay(ReplayRequest.builder().build());

    assertFalse(failed.success());
    assertEquals(2, node.repository.find(EventQuery.builder().pendingReplayOnly().build()).size());
    assertEquals(OperationStatus.ERROR,
        node.operationLog.recent(Operation.REPLAY, 1).get(0).status());

    applied.clear();
    ReplayResult replayed = engine(node, registry, UnitOfWork.NOOP)
        .replay(ReplayRequest.builder().build());

    assertTrue(replayed.success());
    assertEquals(2, replayed.processed());
    assertEquals(List.of("Ada", "456"), applied);
    assertTrue(node.repository.find(EventQuery.builder().pendingReplayOnly().build()).isEmpty());

    ReplayResult again = engine(node, registry, UnitOfWork.NOOP)
        .replay(ReplayRequest.builder().build());
    assertEquals("No events to replay", again.message());
  }

  private ReplayEngine engine(Node node, ReplayRegistry registry, UnitOfWork unitOfWork) {
    return ReplayEngine.builder()
        .repository(node.repository)
        .registry(registry)
        .unitOfWork(unitOfWork)
        .build();
  }

  private Node node(SyncConfig config) {
    HikariConfig hikari = new HikariConfig();
    hikari.setJdbcUrl("jdbc:h2:mem:node_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    hikari.setMaximumPoolSize(4);
    Node node = new Node(config, new HikariDataSource(hikari));
    nodes.add(node);
    return node;
  }

  private static Map<String, String> query(HttpExchange exchange) {
    Map<String, String> params = new HashMap<>();
    String raw = exchange.getRequestURI().getRawQuery();
    if (raw == null) {
      return params;
    }
    for (String pair : raw.split("&")) {
      int eq = pair.indexOf('=');
      if (eq > 0) {
        params.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
            URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
      }
    }
    return params;
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    exchange.getResponseBody().write(bytes);
    exchange.close();
  }

  private static final class Node {
    final SyncConfig config;
    final HikariDataSource dataSource;
    final OperationLog operationLog;
    final EventRecordRepository repository;
    final SyncOrchestrator orchestrator;

    Node(SyncConfig config, HikariDataSource dataSource) {
      this.config = config;
      this.dataSource = dataSource;
      JdbcSchema.provision(dataSource);
      JdbcSchema.verify(dataSource);
      this.operationLog = new OperationLog(dataSource::getConnection, new JdbcOperationLogStore());
      this.repository = new EventRecordRepository(dataSource::getConnection,
          JdbcSyncedEventStores.detect(dataSource), operationLog);
      this.orchestrator = SyncOrchestrator.builder()
          .config(config)
          .repository(repository)
          .peerClient(new HttpPeerClient())
          .build();
    }
  }
}
