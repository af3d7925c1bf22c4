package eventsync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import eventsync.RawEvent;
import eventsync.SyncConfig;
import eventsync.http.PeerClient;
import eventsync.http.PeerResponse;
import eventsync.http.PeerTransportException;
import eventsync.model.EventQuery;
import eventsync.model.Operation;
import eventsync.model.OperationStatus;
import eventsync.model.SyncedEvent;
import eventsync.processor.EventProcessor;
import eventsync.processor.ProcessingResult;
import eventsync.spi.MetricsExporter;
import eventsync.store.EventRecordRepository;
import eventsync.store.OperationLog;
import eventsync.store.SyncStatus;
import eventsync.util.JsonCodec;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pulls events from the configured source and sends stored events to the configured
 * destination.
 *
 * <p>Both operations are blocking and single-threaded. They never throw for remote,
 * processing or storage failures: every outcome is reported in the returned result and,
 * unless it is a dry run or an empty batch, in one operation log entry.
 *
 * <pre>{@code
 * SyncOrchestrator orchestrator = SyncOrchestrator.builder()
 *     .config(config)
 *     .repository(repository)
 *     .peerClient(new HttpPeerClient())
 *     .build();
 *
 * PullResult result = orchestrator.pull(PullRequest.builder().limit(50).build());
 * }</pre>
 */
public final class SyncOrchestrator {
  private static final Logger logger = Logger.getLogger(SyncOrchestrator.class.getName());

  static final String KEY_HEADER = "X-Event-Sync-Key";

  private final SyncConfig config;
  private final EventRecordRepository repository;
  private final OperationLog operationLog;
  private final PeerClient peerClient;
  private final EventProcessor processor;
  private final MetricsExporter metrics;
  private final JsonCodec jsonCodec;
  private final Clock clock;

  private SyncOrchestrator(Builder builder) {
    this.config = Objects.requireNonNull(builder.config, "config");
    this.repository = Objects.requireNonNull(builder.repository, "repository");
    this.operationLog = repository.operationLog();
    this.peerClient = Objects.requireNonNull(builder.peerClient, "peerClient");
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.processor = builder.processor != null
        ? builder.processor
        : new EventProcessor(config.eventFilter(), jsonCodec, clock);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Fetches events from the source and stores the new ones.
   *
   * @param request pull parameters
   * @return the outcome
   */
  public PullResult pull(PullRequest request) {
    Objects.requireNonNull(request, "request");
    if (!config.hasSource()) {
      return PullResult.failed(SyncFailure.SOURCE_NOT_CONFIGURED,
          SyncFailure.SOURCE_NOT_CONFIGURED.description());
    }
    String sourceUrl = config.sourceUrl();
    int limit = request.limit() != null ? request.limit() : config.batchSize();

    Map<String, String> params = new LinkedHashMap<>();
    if (request.since() != null) {
      params.put("since", request.since().toString());
    }
    if (!request.eventTypes().isEmpty()) {
      params.put("event_type", String.join(",", request.eventTypes()));
    }
    params.put("limit", Integer.toString(limit));

    Map<String, String> headers = new LinkedHashMap<>();
    if (config.sourceToken() != null) {
      headers.put("Authorization", "Bearer " + config.sourceToken());
    }

    PeerResponse response;
    long start = System.nanoTime();
    try {
      response = peerClient.get(sourceUrl, params, headers, config.requestTimeout());
    } catch (PeerTransportException e) {
      logger.log(Level.SEVERE, "Failed to pull events from " + sourceUrl, e);
      log(Operation.PULL, OperationStatus.ERROR, 0,
          errorDetails(e.getMessage()));
      return PullResult.failed(SyncFailure.TRANSPORT, "Failed to pull events: " + e.getMessage());
    } finally {
      metrics.recordFetchDurationMs((System.nanoTime() - start) / 1_000_000);
    }

    if (!response.isSuccessful()) {
      logger.log(Level.WARNING, "Source " + sourceUrl + " returned HTTP " + response.statusCode());
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("status", response.statusCode());
      details.put("response", response.body());
      log(Operation.PULL, OperationStatus.FAILED, 0, details);
      return PullResult.failed(SyncFailure.REMOTE_STATUS,
          "Failed to fetch events from source: HTTP " + response.statusCode());
    }

    JsonNode root;
    ArrayNode elements;
    try {
      root = jsonCodec.readTree(response.body());
      elements = eventArray(root);
    } catch (IllegalArgumentException e) {
      logger.log(Level.SEVERE, "Unreadable response from " + sourceUrl, e);
      log(Operation.PULL, OperationStatus.ERROR, 0,
          errorDetails(e.getMessage()));
      return PullResult.failed(SyncFailure.INVALID_RESPONSE,
          "Invalid response from source: " + e.getMessage());
    }

    if (elements.isEmpty()) {
      return new PullResult(true, "No new events to sync", null, 0, 0, 0, null, null, null);
    }

    if (request.dryRun()) {
      List<RawEvent> events = new ArrayList<>();
      for (JsonNode element : elements) {
        if (element.isObject()) {
          events.add(RawEvent.fromJson(element));
        }
      }
      return new PullResult(true, "Dry run: " + elements.size() + " events would be synced",
          null, elements.size(), 0, 0, null, events, null);
    }

    return ingest(request, sourceUrl, sourceName(root), elements);
  }

  private PullResult ingest(PullRequest request, String sourceUrl, String sourceName,
      ArrayNode elements) {
    int processed = 0;
    int skipped = 0;
    List<SyncError> errors = new ArrayList<>();
    Map<String, Integer> breakdown = new LinkedHashMap<>();

    for (JsonNode element : elements) {
      RawEvent raw;
      try {
        raw = RawEvent.fromJson(element);
      } catch (IllegalArgumentException e) {
        errors.add(new SyncError(null, null, e.getMessage()));
        continue;
      }
      try {
        ProcessingResult result = processor.process(raw, sourceUrl, sourceName);
        if (result instanceof ProcessingResult.Rejected rejected) {
          if (rejected.isFilteredOut()) {
            skipped++;
          } else {
            errors.add(new SyncError(raw.id(), raw.type(), rejected.message()));
          }
          continue;
        }
        SyncedEvent event = ((ProcessingResult.Accepted) result).event();
        if (!request.eventTypes().isEmpty() && !request.eventTypes().contains(event.eventType())) {
          skipped++;
          continue;
        }
        if (repository.exists(event.eventId(), sourceUrl) || !repository.storeIfAbsent(event)) {
          skipped++;
          continue;
        }
        processed++;
        breakdown.merge(event.eventType(), 1, Integer::sum);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to process event " + raw.id(), e);
        errors.add(new SyncError(raw.id(), raw.type(), String.valueOf(e.getMessage())));
      }
    }

    boolean success = !(processed == 0 && !errors.isEmpty());
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("processed", processed);
    details.put("skipped", skipped);
    details.put("errors", errors.size());
    if (!errors.isEmpty()) {
      List<String> messages = new ArrayList<>(errors.size());
      errors.forEach(error -> messages.add(error.toString()));
      details.put("error_details", messages);
    }
    log(Operation.PULL,
        success ? OperationStatus.SUCCESS : OperationStatus.FAILED, processed, details);

    metrics.incrementEventsPulled(processed);
    metrics.incrementEventsSkipped(skipped);
    metrics.incrementEventsFailed(errors.size());

    String message = "Processed " + processed + " events, skipped " + skipped
        + ", errors " + errors.size();
    if (errors.isEmpty()) {
      logger.info("Pull from " + sourceUrl + ": " + message);
    } else {
      logger.warning("Pull from " + sourceUrl + ": " + message);
    }
    return new PullResult(success, message, success ? null : SyncFailure.ALL_EVENTS_FAILED,
        elements.size(), processed, skipped, errors, null,
        request.breakdown() ? breakdown : null);
  }

  /**
   * Sends stored events to the destination, oldest first.
   *
   * @param request send parameters
   * @return the outcome
   */
  public SendResult send(SendRequest request) {
    Objects.requireNonNull(request, "request");
    if (!config.hasDestination()) {
      return SendResult.failed(SyncFailure.DESTINATION_NOT_CONFIGURED,
          SyncFailure.DESTINATION_NOT_CONFIGURED.description(), 0, null);
    }
    int limit = request.limit() != null ? request.limit() : config.batchSize();

    List<SyncedEvent> events;
    try {
      events = repository.find(EventQuery.builder()
          .eventTypes(request.eventTypes())
          .since(request.since())
          .limit(limit)
          .order(EventQuery.Order.OLDEST_FIRST)
          .build());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to select events to send", e);
      log(Operation.SEND, OperationStatus.ERROR, 0, errorDetails(e.getMessage()));
      return SendResult.failed(SyncFailure.STORAGE,
          "Failed to select events: " + e.getMessage(), 0, null);
    }

    if (events.isEmpty()) {
      return new SendResult(true, "No events to send", null, 0, null);
    }
    if (request.dryRun()) {
      return new SendResult(true, "Dry run: " + events.size() + " events would be sent",
          null, events.size(), null);
    }

    String body = jsonCodec.toJson(sendEnvelope(events));
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(KEY_HEADER, config.destinationKey());
    headers.put("Authorization", "Bearer " + config.destinationKey());

    PeerResponse response;
    long start = System.nanoTime();
    try {
      response = peerClient.postJson(config.destinationUrl(), body, headers, config.requestTimeout());
    } catch (PeerTransportException e) {
      logger.log(Level.SEVERE, "Failed to send events to " + config.destinationUrl(), e);
      metrics.incrementSendFailures();
      log(Operation.SEND, OperationStatus.ERROR, events.size(),
          errorDetails(e.getMessage()));
      return SendResult.failed(SyncFailure.TRANSPORT, "Failed to send events: " + e.getMessage(),
          events.size(), null);
    } finally {
      metrics.recordFetchDurationMs((System.nanoTime() - start) / 1_000_000);
    }

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("status", response.statusCode());
    details.put("response", responseDetail(response.body()));
    if (!response.isSuccessful()) {
      logger.warning("Destination " + config.destinationUrl() + " returned HTTP "
          + response.statusCode());
      metrics.incrementSendFailures();
      log(Operation.SEND, OperationStatus.FAILED, events.size(), details);
      return SendResult.failed(SyncFailure.REMOTE_STATUS,
          "Failed to send events: HTTP " + response.statusCode(), events.size(), response);
    }

    log(Operation.SEND, OperationStatus.SUCCESS, events.size(), details);
    metrics.incrementEventsSent(events.size());
    logger.info("Sent " + events.size() + " events to " + config.destinationUrl());
    return new SendResult(true, "Successfully sent " + events.size() + " events", null,
        events.size(), response);
  }

  /**
   * Returns the sync summary: last successful pull and stored record count.
   */
  public SyncStatus status() {
    return new SyncStatus(operationLog.lastSuccessfulPull().orElse(null), repository.count());
  }

  public SyncConfig config() {
    return config;
  }

  private ObjectNode sendEnvelope(List<SyncedEvent> events) {
    ObjectNode envelope = jsonCodec.createObjectNode();
    ArrayNode array = envelope.putArray("events");
    for (SyncedEvent event : events) {
      RawEvent raw = new RawEvent(event.eventId(), event.eventType(),
          jsonCodec.readTree(event.eventData()), event.createdAtForWire());
      array.add(raw.toJson());
    }
    envelope.put("source_url", config.appUrl());
    envelope.put("source_name", config.appName());
    return envelope;
  }

  private ArrayNode eventArray(JsonNode root) {
    if (root.isMissingNode()) {
      return jsonCodec.createObjectNode().arrayNode();
    }
    if (!root.isObject()) {
      throw new IllegalArgumentException("Expected a JSON object but got " + root.getNodeType());
    }
    JsonNode events = root.has("events") ? root.get("events") : root.get("data");
    if (events == null || events.isNull()) {
      return jsonCodec.createObjectNode().arrayNode();
    }
    if (!events.isArray()) {
      throw new IllegalArgumentException("Expected an array of events but got "
          + events.getNodeType());
    }
    return (ArrayNode) events;
  }

  private static String sourceName(JsonNode root) {
    JsonNode name = root.path("source_name");
    return name.isTextual() && !name.asText().isBlank() ? name.asText() : null;
  }

  private Object responseDetail(String body) {
    try {
      JsonNode node = jsonCodec.readTree(body);
      return node.isMissingNode() ? body : node;
    } catch (IllegalArgumentException e) {
      return body;
    }
  }

  private void log(Operation operation, OperationStatus status, int eventsCount,
      Map<String, Object> details) {
    operationLog.record(operation, status, eventsCount, details, clock.instant());
  }

  private static Map<String, Object> errorDetails(String error) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("error", String.valueOf(error));
    return details;
  }

  /** Builder for {@link SyncOrchestrator}. */
  public static final class Builder {
    private SyncConfig config;
    private EventRecordRepository repository;
    private PeerClient peerClient;
    private EventProcessor processor;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private Clock clock;

    private Builder() {
    }

    public Builder config(SyncConfig config) {
      this.config = config;
      return this;
    }

    public Builder repository(EventRecordRepository repository) {
      this.repository = repository;
      return this;
    }

    public Builder peerClient(PeerClient peerClient) {
      this.peerClient = peerClient;
      return this;
    }

    /** Optional; defaults to a processor over the configured event filter. */
    public Builder processor(EventProcessor processor) {
      this.processor = processor;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public SyncOrchestrator build() {
      return new SyncOrchestrator(this);
    }
  }
}
