package eventsync.spring.boot;

import com.fasterxml.jackson.databind.JsonNode;
import eventsync.SyncConfig;
import eventsync.receive.EventFeed;
import eventsync.receive.EventReceiver;
import eventsync.receive.FeedQuery;
import eventsync.receive.FeedResponse;
import eventsync.receive.ReceiveRequest;
import eventsync.receive.ReceiveResponse;
import eventsync.receive.StatusReport;
import eventsync.receive.SyncAuthenticationException;
import eventsync.sync.SyncOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * HTTP surface of the bridge.
 *
 * <ul>
 *   <li>{@code GET <base>} - feed for peers that pull, bearer token required</li>
 *   <li>{@code POST <base>} - receive endpoint for peers that send, key in
 *       {@code X-Event-Sync-Key} or as bearer token</li>
 *   <li>{@code GET <base>/status} - liveness and identity</li>
 *   <li>{@code GET <base>/sync-status} - last successful pull and record count</li>
 * </ul>
 */
@RestController
@RequestMapping("${eventsync.web.base-path:/api/event-sync}")
public class EventSyncController {
  private static final Logger log = LoggerFactory.getLogger(EventSyncController.class);

  static final String KEY_HEADER = "X-Event-Sync-Key";
  private static final String BEARER_PREFIX = "Bearer ";

  private final SyncConfig config;
  private final EventFeed feed;
  private final EventReceiver receiver;
  private final SyncOrchestrator orchestrator;

  public EventSyncController(SyncConfig config, EventFeed feed, EventReceiver receiver,
      SyncOrchestrator orchestrator) {
    this.config = config;
    this.feed = feed;
    this.receiver = receiver;
    this.orchestrator = orchestrator;
  }

  @GetMapping
  public FeedResponse feed(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @RequestParam(value = "since", required = false) String since,
      @RequestParam(value = "event_type", required = false) String eventType,
      @RequestParam(value = "limit", required = false) String limit) {
    return feed.export(authorization, FeedQuery.parse(since, eventType, limit));
  }

  @PostMapping
  public ReceiveResponse receive(
      @RequestHeader(value = KEY_HEADER, required = false) String key,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @RequestBody JsonNode body) {
    return receiver.receive(key != null ? key : bearerToken(authorization),
        ReceiveRequest.fromJson(body));
  }

  @GetMapping("/status")
  public StatusReport status() {
    return StatusReport.of(config);
  }

  @GetMapping("/sync-status")
  public Map<String, Object> syncStatus() {
    return orchestrator.status().toMap();
  }

  @ExceptionHandler(SyncAuthenticationException.class)
  public ResponseEntity<Map<String, Object>> unauthorized(SyncAuthenticationException e) {
    log.warn("Rejected sync request: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "Unauthorized"));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> invalid(IllegalArgumentException e) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(Map.of("success", false, "error", String.valueOf(e.getMessage())));
  }

  private static String bearerToken(String authorization) {
    if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
      return null;
    }
    return authorization.substring(BEARER_PREFIX.length()).trim();
  }
}
