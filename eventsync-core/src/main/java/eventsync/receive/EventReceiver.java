package eventsync.receive;

import com.fasterxml.jackson.databind.JsonNode;
import eventsync.RawEvent;
import eventsync.SyncConfig;
import eventsync.model.SyncedEvent;
import eventsync.processor.EventProcessor;
import eventsync.processor.ProcessingResult;
import eventsync.spi.MetricsExporter;
import eventsync.store.EventRecordRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Receiving side of a send: authenticates the sender and stores each pushed event once.
 */
public final class EventReceiver {
  private static final Logger logger = Logger.getLogger(EventReceiver.class.getName());

  private final ApiKeyVerifier keyVerifier;
  private final EventProcessor processor;
  private final EventRecordRepository repository;
  private final MetricsExporter metrics;

  public EventReceiver(SyncConfig config, EventRecordRepository repository) {
    this(config, repository, new EventProcessor(config.eventFilter()), MetricsExporter.NOOP);
  }

  public EventReceiver(SyncConfig config, EventRecordRepository repository,
      EventProcessor processor, MetricsExporter metrics) {
    this.keyVerifier = new ApiKeyVerifier(Objects.requireNonNull(config, "config").receiveKey());
    this.repository = Objects.requireNonNull(repository, "repository");
    this.processor = Objects.requireNonNull(processor, "processor");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Processes a pushed batch.
   *
   * @param providedKey the key the sender presented
   * @param request     the pushed batch
   * @return per-event results
   * @throws SyncAuthenticationException if the key is missing or wrong
   * @throws IllegalArgumentException    if the batch is empty
   */
  public ReceiveResponse receive(String providedKey, ReceiveRequest request) {
    keyVerifier.verify(providedKey);
    Objects.requireNonNull(request, "request");
    if (request.events().isEmpty()) {
      throw new IllegalArgumentException("No events provided");
    }

    List<ReceivedEventResult> results = new ArrayList<>(request.events().size());
    int failed = 0;
    for (JsonNode element : request.events()) {
      ReceivedEventResult result = receiveOne(element, request.sourceUrl(), request.sourceName());
      if (!result.isProcessed()) {
        failed++;
      }
      results.add(result);
    }
    metrics.incrementEventsFailed(failed);
    logger.info("Received " + results.size() + " events from "
        + (request.sourceName() != null ? request.sourceName() : request.sourceUrl())
        + ", " + failed + " failed");
    return new ReceiveResponse(failed < results.size(), results);
  }

  private ReceivedEventResult receiveOne(JsonNode element, String sourceUrl, String sourceName) {
    RawEvent raw;
    try {
      raw = RawEvent.fromJson(element);
    } catch (IllegalArgumentException e) {
      return ReceivedEventResult.error(null, e.getMessage());
    }
    ProcessingResult result = processor.process(raw, sourceUrl, sourceName);
    if (result instanceof ProcessingResult.Rejected rejected) {
      return ReceivedEventResult.error(raw.id(), rejected.message());
    }
    SyncedEvent event = ((ProcessingResult.Accepted) result).event();
    try {
      if (repository.exists(event.eventId(), sourceUrl) || !repository.storeIfAbsent(event)) {
        return ReceivedEventResult.processed(event.eventId(), "Event already synced");
      }
      return ReceivedEventResult.processed(event.eventId(), "Event processed successfully");
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to store received event " + event.eventId(), e);
      return ReceivedEventResult.error(event.eventId(), String.valueOf(e.getMessage()));
    }
  }
}
