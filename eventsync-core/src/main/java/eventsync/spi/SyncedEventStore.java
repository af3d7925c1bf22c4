package eventsync.spi;

import eventsync.model.EventQuery;
import eventsync.model.SyncedEvent;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for synced event records.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls transaction
 * boundaries. Implementations live in the {@code eventsync-jdbc} module and report storage
 * failures as unchecked exceptions.
 */
public interface SyncedEventStore {

  /**
   * Inserts a record unless one with the same ({@code eventId}, {@code sourceUrl}) exists.
   *
   * @param conn  the JDBC connection
   * @param event the record to persist; its {@code sequence} is ignored
   * @return {@code true} if a row was inserted, {@code false} if the key already existed
   */
  boolean insertIfAbsent(Connection conn, SyncedEvent event);

  /**
   * Tests whether a record with the given identity exists.
   *
   * @param conn      the JDBC connection
   * @param eventId   the event identifier
   * @param sourceUrl the source, {@code null} for local origin
   */
  boolean exists(Connection conn, String eventId, String sourceUrl);

  /**
   * Loads the record with the given identity.
   *
   * @param conn      the JDBC connection
   * @param eventId   the event identifier
   * @param sourceUrl the source, {@code null} for local origin
   * @return the record, or empty if none exists
   */
  Optional<SyncedEvent> findById(Connection conn, String eventId, String sourceUrl);

  /**
   * Selects records matching a query.
   *
   * @param conn  the JDBC connection
   * @param query selection criteria, ordering and limit
   * @return matching records, at most {@code query.limit()}
   */
  List<SyncedEvent> select(Connection conn, EventQuery query);

  /**
   * Stamps {@code replayed_at} on records that are not yet replayed. Already replayed
   * records keep their original timestamp.
   *
   * @param conn      the JDBC connection (typically within the replay transaction)
   * @param sequences the store-assigned sequences of the records
   * @param when      the replay timestamp
   * @return the number of rows updated
   */
  int markReplayed(Connection conn, Collection<Long> sequences, Instant when);

  /**
   * Counts all stored records.
   */
  long count(Connection conn);
}
