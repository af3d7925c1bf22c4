package eventsync.store;

import eventsync.model.EventQuery;
import eventsync.model.Operation;
import eventsync.model.OperationStatus;
import eventsync.model.SyncedEvent;
import eventsync.spi.ConnectionProvider;
import eventsync.spi.SyncedEventStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable record store of synced events, keyed by ({@code eventId}, {@code sourceUrl}).
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}. Every
 * single-row write runs on its own auto-commit connection; {@link #markReplayed} runs in
 * one transaction. Storage failures surface as {@link SyncStoreException}; a failed insert
 * is additionally written to the {@link OperationLog} as a {@code store_event/error} entry.
 */
public final class EventRecordRepository {
  private static final Logger logger = Logger.getLogger(EventRecordRepository.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SyncedEventStore eventStore;
  private final OperationLog operationLog;

  public EventRecordRepository(ConnectionProvider connectionProvider, SyncedEventStore eventStore,
      OperationLog operationLog) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    this.operationLog = Objects.requireNonNull(operationLog, "operationLog");
  }

  /**
   * Stores a record unless its identity is already present.
   *
   * @param event the record to store
   * @return {@code true} if stored, {@code false} if it already existed
   * @throws SyncStoreException if the write fails
   */
  public boolean storeIfAbsent(SyncedEvent event) {
    Objects.requireNonNull(event, "event");
    try (Connection conn = connectionProvider.getConnection()) {
      return eventStore.insertIfAbsent(conn, event);
    } catch (SQLException | SyncStoreException e) {
      logger.log(Level.SEVERE, "Failed to store event " + event.eventId()
          + " (" + event.eventType() + ")", e);
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("event_id", event.eventId());
      details.put("event_type", event.eventType());
      details.put("source_url", event.sourceUrl());
      details.put("error", String.valueOf(e.getMessage()));
      operationLog.record(Operation.STORE_EVENT, OperationStatus.ERROR, 1, details);
      if (e instanceof SyncStoreException) {
        throw (SyncStoreException) e;
      }
      throw new SyncStoreException("Failed to store event " + event.eventId(), e);
    }
  }

  public boolean exists(String eventId, String sourceUrl) {
    try (Connection conn = connectionProvider.getConnection()) {
      return eventStore.exists(conn, eventId, sourceUrl);
    } catch (SQLException e) {
      throw new SyncStoreException("Failed to look up event " + eventId, e);
    }
  }

  /**
   * Loads one record by its identity.
   *
   * @param sourceUrl the source, {@code null} for local origin
   */
  public Optional<SyncedEvent> find(String eventId, String sourceUrl) {
    Objects.requireNonNull(eventId, "eventId");
    try (Connection conn = connectionProvider.getConnection()) {
      return eventStore.findById(conn, eventId, sourceUrl);
    } catch (SQLException e) {
      throw new SyncStoreException("Failed to look up event " + eventId, e);
    }
  }

  /**
   * Selects records matching a query.
   */
  public List<SyncedEvent> find(EventQuery query) {
    Objects.requireNonNull(query, "query");
    try (Connection conn = connectionProvider.getConnection()) {
      return eventStore.select(conn, query);
    } catch (SQLException e) {
      throw new SyncStoreException("Failed to query events", e);
    }
  }

  /**
   * Marks records replayed in a single transaction.
   *
   * @param events persisted records (each with a sequence)
   * @param when   the replay timestamp
   * @return number of records transitioned
   * @throws SyncStoreException if the update fails; nothing is marked in that case
   */
  public int markReplayed(List<SyncedEvent> events, Instant when) {
    if (events.isEmpty()) {
      return 0;
    }
    List<Long> sequences = new ArrayList<>(events.size());
    for (SyncedEvent event : events) {
      if (event.sequence() == null) {
        throw new IllegalArgumentException("Event " + event.eventId() + " has not been persisted");
      }
      sequences.add(event.sequence());
    }
    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        int updated = eventStore.markReplayed(conn, sequences, when);
        conn.commit();
        return updated;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw new SyncStoreException("Failed to mark events replayed", e);
    }
  }

  public long count() {
    try (Connection conn = connectionProvider.getConnection()) {
      return eventStore.count(conn);
    } catch (SQLException e) {
      throw new SyncStoreException("Failed to count events", e);
    }
  }

  public OperationLog operationLog() {
    return operationLog;
  }
}
