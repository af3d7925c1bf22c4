package eventsync.store;

import eventsync.model.Operation;
import eventsync.model.OperationLogEntry;
import eventsync.model.OperationStatus;
import eventsync.spi.ConnectionProvider;
import eventsync.spi.OperationLogStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Facade over the append-only operation log. Manages connection lifecycle internally.
 *
 * <p>Writing an entry never fails the operation being logged: storage errors are logged
 * and the unsaved entry is returned.
 */
public final class OperationLog {
  private static final Logger logger = Logger.getLogger(OperationLog.class.getName());

  private final ConnectionProvider connectionProvider;
  private final OperationLogStore logStore;

  public OperationLog(ConnectionProvider connectionProvider, OperationLogStore logStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.logStore = Objects.requireNonNull(logStore, "logStore");
  }

  /**
   * Appends a new entry stamped with the current time.
   *
   * @return the stored entry, or the unsaved entry if storage failed
   */
  public OperationLogEntry record(Operation operation, OperationStatus status, int eventsCount,
      Map<String, Object> details) {
    return record(operation, status, eventsCount, details, Instant.now());
  }

  /**
   * Appends a new entry stamped with the caller's time.
   *
   * @return the stored entry, or the unsaved entry if storage failed
   */
  public OperationLogEntry record(Operation operation, OperationStatus status, int eventsCount,
      Map<String, Object> details, Instant timestamp) {
    OperationLogEntry entry = OperationLogEntry.of(operation, status, eventsCount, details,
        timestamp);
    try (Connection conn = connectionProvider.getConnection()) {
      return logStore.append(conn, entry);
    } catch (SQLException | SyncStoreException e) {
      logger.log(Level.SEVERE, "Failed to record operation log entry: " + entry.describe(), e);
      return entry;
    }
  }

  /**
   * Returns the most recent entries, newest first.
   *
   * @param operation optional operation filter ({@code null} for all)
   * @param limit     maximum number of entries
   */
  public List<OperationLogEntry> recent(Operation operation, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return logStore.recent(conn, operation, limit);
    } catch (SQLException e) {
      throw new SyncStoreException("Failed to read operation log", e);
    }
  }

  public Optional<OperationLogEntry> latest(Operation operation, OperationStatus status) {
    try (Connection conn = connectionProvider.getConnection()) {
      return logStore.latest(conn, operation, status);
    } catch (SQLException e) {
      throw new SyncStoreException("Failed to read operation log", e);
    }
  }

  public Optional<OperationLogEntry> lastSuccessfulPull() {
    return latest(Operation.PULL, OperationStatus.SUCCESS);
  }
}
