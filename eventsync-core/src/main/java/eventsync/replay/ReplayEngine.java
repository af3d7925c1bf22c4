package eventsync.replay;

import eventsync.model.EventQuery;
import eventsync.model.Operation;
import eventsync.model.OperationStatus;
import eventsync.model.SyncedEvent;
import eventsync.spi.MetricsExporter;
import eventsync.spi.UnitOfWork;
import eventsync.store.EventRecordRepository;
import eventsync.sync.SyncError;
import eventsync.util.JsonCodec;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies stored, not yet replayed records to the event-sourcing runtime.
 *
 * <p>Records are read oldest first by ({@code syncedAt}, {@code sequence}). For each batch
 * the engine invokes the registered handler of every record, commits the {@link UnitOfWork}
 * once, and only then marks the successfully handled records replayed, in one transaction.
 * A record whose handler failed, or whose type has no handler, stays pending; in
 * continue mode the cursor moves past it so the run still terminates.
 *
 * <p>A commit or marking failure reports the batch failed and stops the run; nothing from
 * that batch is marked.
 */
public final class ReplayEngine {
  private static final Logger logger = Logger.getLogger(ReplayEngine.class.getName());

  private final EventRecordRepository repository;
  private final ReplayRegistry registry;
  private final UnitOfWork unitOfWork;
  private final MetricsExporter metrics;
  private final JsonCodec jsonCodec;
  private final Clock clock;
  private final int defaultBatchSize;

  private ReplayEngine(Builder builder) {
    this.repository = Objects.requireNonNull(builder.repository, "repository");
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.unitOfWork = builder.unitOfWork != null ? builder.unitOfWork : UnitOfWork.NOOP;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.defaultBatchSize <= 0) {
      throw new IllegalArgumentException("defaultBatchSize must be > 0");
    }
    this.defaultBatchSize = builder.defaultBatchSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs a replay.
   *
   * @param request replay parameters
   * @return the outcome
   */
  public ReplayResult replay(ReplayRequest request) {
    Objects.requireNonNull(request, "request");
    int limit = request.limit() != null ? request.limit() : defaultBatchSize;

    int processed = 0;
    int skipped = 0;
    int batches = 0;
    int candidates = 0;
    List<SyncError> errors = new ArrayList<>();
    String failure = null;
    SyncedEvent cursor = null;

    while (true) {
      List<SyncedEvent> batch;
      try {
        batch = repository.find(pendingQuery(request, limit, cursor));
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to load events for replay", e);
        failure = "Failed to load events: " + e.getMessage();
        break;
      }
      if (batch.isEmpty()) {
        break;
      }
      candidates += batch.size();
      if (request.dryRun()) {
        break;
      }
      batches++;

      List<SyncedEvent> handled = new ArrayList<>(batch.size());
      for (SyncedEvent record : batch) {
        Optional<ReplayBinding<?>> binding = registry.resolve(record.eventType());
        if (binding.isEmpty()) {
          logger.warning("No replay handler registered for event type '" + record.eventType()
              + "', skipping event " + record.eventId());
          skipped++;
          continue;
        }
        try {
          binding.get().invoke(new EventPayload(jsonCodec.readTree(record.eventData())), record);
          handled.add(record);
        } catch (Exception e) {
          logger.log(Level.WARNING, "Failed to replay event " + record.eventId()
              + " (" + record.eventType() + ")", e);
          errors.add(new SyncError(record.eventId(), record.eventType(),
              String.valueOf(e.getMessage())));
        }
      }

      try {
        unitOfWork.commit();
      } catch (Exception e) {
        logger.log(Level.SEVERE, "Failed to commit replay batch " + batches, e);
        failure = "Failed to commit batch " + batches + ": " + e.getMessage();
        break;
      }
      try {
        repository.markReplayed(handled, clock.instant());
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to mark replay batch " + batches, e);
        failure = "Failed to mark batch " + batches + " replayed: " + e.getMessage();
        break;
      }
      processed += handled.size();
      metrics.incrementEventsReplayed(handled.size());

      if (!request.continueUntilExhausted()) {
        break;
      }
      cursor = batch.get(batch.size() - 1);
    }
    metrics.incrementReplayFailures(errors.size());

    if (request.dryRun()) {
      return new ReplayResult(failure == null,
          failure != null ? failure : "Dry run: " + candidates + " events would be replayed",
          0, 0, null, 0, candidates);
    }
    if (candidates == 0 && failure == null) {
      return new ReplayResult(true, "No events to replay", 0, 0, null, 0, 0);
    }

    boolean success = failure == null && !(processed == 0 && !errors.isEmpty());
    String message = failure != null
        ? failure
        : "Replayed " + processed + " events in " + batches + " batches, skipped " + skipped
            + ", errors " + errors.size();
    if (candidates > 0) {
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("processed", processed);
      details.put("skipped", skipped);
      details.put("errors", errors.size());
      details.put("batches", batches);
      if (failure != null) {
        details.put("error", failure);
      }
      repository.operationLog().record(Operation.REPLAY,
          success ? OperationStatus.SUCCESS
              : failure != null ? OperationStatus.ERROR : OperationStatus.FAILED,
          processed, details, clock.instant());
    }
    logger.info(message);
    return new ReplayResult(success, message, processed, skipped, errors, batches, candidates);
  }

  private static EventQuery pendingQuery(ReplayRequest request, int limit, SyncedEvent cursor) {
    EventQuery.Builder query = EventQuery.builder()
        .pendingReplayOnly()
        .eventTypes(request.eventTypes())
        .since(request.since())
        .limit(limit)
        .order(EventQuery.Order.OLDEST_FIRST);
    if (cursor != null) {
      query.after(cursor.syncedAt(), cursor.sequence() != null ? cursor.sequence() : 0L);
    }
    return query.build();
  }

  /** Builder for {@link ReplayEngine}. */
  public static final class Builder {
    private EventRecordRepository repository;
    private ReplayRegistry registry;
    private UnitOfWork unitOfWork;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private Clock clock;
    private int defaultBatchSize = EventQuery.DEFAULT_LIMIT;

    private Builder() {
    }

    public Builder repository(EventRecordRepository repository) {
      this.repository = repository;
      return this;
    }

    public Builder registry(ReplayRegistry registry) {
      this.registry = registry;
      return this;
    }

    /** Optional; defaults to {@link UnitOfWork#NOOP}. */
    public Builder unitOfWork(UnitOfWork unitOfWork) {
      this.unitOfWork = unitOfWork;
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

    public Builder defaultBatchSize(int defaultBatchSize) {
      this.defaultBatchSize = defaultBatchSize;
      return this;
    }

    public ReplayEngine build() {
      return new ReplayEngine(this);
    }
  }
}
