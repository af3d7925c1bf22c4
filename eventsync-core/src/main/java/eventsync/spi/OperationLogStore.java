package eventsync.spi;

import eventsync.model.Operation;
import eventsync.model.OperationLogEntry;
import eventsync.model.OperationStatus;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the append-only operation log.
 */
public interface OperationLogStore {

  /**
   * Appends an entry.
   *
   * @param conn  the JDBC connection
   * @param entry the entry; its {@code id} is ignored
   * @return the entry with its store-assigned id
   */
  OperationLogEntry append(Connection conn, OperationLogEntry entry);

  /**
   * Returns the most recent entries, newest first.
   *
   * @param conn      the JDBC connection
   * @param operation optional operation filter ({@code null} for all)
   * @param limit     maximum number of entries
   */
  List<OperationLogEntry> recent(Connection conn, Operation operation, int limit);

  /**
   * Returns the newest entry with the given operation and status.
   */
  Optional<OperationLogEntry> latest(Connection conn, Operation operation, OperationStatus status);
}
