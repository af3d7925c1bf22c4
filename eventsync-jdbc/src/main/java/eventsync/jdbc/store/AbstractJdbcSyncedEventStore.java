package eventsync.jdbc.store;

import eventsync.jdbc.JdbcTemplate;
import eventsync.jdbc.TableNames;
import eventsync.model.EventQuery;
import eventsync.model.SyncMetadata;
import eventsync.model.SyncedEvent;
import eventsync.spi.SyncedEventStore;
import eventsync.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC store for synced events with standard SQL implementations.
 *
 * <p>The table column {@code id} holds the record's sequence. A {@code null} source URL is
 * stored as the empty string so that the ({@code event_id}, {@code source_url}) unique key
 * also covers events of local origin.
 *
 * <p>Subclasses override {@link #insertSql()} with a database-specific conflict-ignoring
 * insert. Register custom implementations via
 * {@code META-INF/services/eventsync.jdbc.store.AbstractJdbcSyncedEventStore}.
 *
 * @see JdbcSyncedEventStores
 */
public abstract class AbstractJdbcSyncedEventStore implements SyncedEventStore {
  protected static final String SELECT_COLUMNS =
      "id, event_id, source_url, event_type, event_data, sync_metadata, synced_at, replayed_at";
  protected static final String INSERT_COLUMNS =
      "event_id, source_url, event_type, event_data, sync_metadata, synced_at, replayed_at";

  private final String tableName;
  private final JsonCodec jsonCodec;

  protected AbstractJdbcSyncedEventStore() {
    this(TableNames.DEFAULT_EVENT_TABLE);
  }

  protected AbstractJdbcSyncedEventStore(String tableName) {
    this(tableName, JsonCodec.getDefault());
  }

  protected AbstractJdbcSyncedEventStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store bound to another table.
   */
  public abstract AbstractJdbcSyncedEventStore withTableName(String tableName);

  protected String tableName() {
    return tableName;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  /**
   * INSERT statement with the placeholders {@code event_id, source_url, event_type,
   * event_data, sync_metadata, synced_at, replayed_at}. The default is a plain insert whose
   * unique key violation is reported as "already present".
   */
  protected String insertSql() {
    return "INSERT INTO " + tableName() + " (" + INSERT_COLUMNS + ") VALUES (?,?,?,?,?,?,?)";
  }

  @Override
  public boolean insertIfAbsent(Connection conn, SyncedEvent event) {
    Objects.requireNonNull(event, "event");
    return JdbcTemplate.insertUnlessDuplicate(conn, insertSql(),
        event.eventId(),
        storedSourceUrl(event.sourceUrl()),
        event.eventType(),
        event.eventData(),
        event.metadata() == null ? null : jsonCodec.toJson(event.metadata()),
        timestamp(event.syncedAt()),
        event.replayedAt() == null ? null : timestamp(event.replayedAt()));
  }

  @Override
  public boolean exists(Connection conn, String eventId, String sourceUrl) {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE event_id=? AND source_url=?";
    return JdbcTemplate.queryForLong(conn, sql, eventId, storedSourceUrl(sourceUrl)) > 0;
  }

  @Override
  public Optional<SyncedEvent> findById(Connection conn, String eventId, String sourceUrl) {
    String sql = "SELECT " + SELECT_COLUMNS + " FROM " + tableName()
        + " WHERE event_id=? AND source_url=?";
    List<SyncedEvent> rows = JdbcTemplate.query(conn, sql, this::mapRow,
        eventId, storedSourceUrl(sourceUrl));
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<SyncedEvent> select(Connection conn, EventQuery query) {
    Objects.requireNonNull(query, "query");
    boolean newestFirst = query.order() == EventQuery.Order.NEWEST_FIRST;
    List<String> conditions = new ArrayList<>();
    List<Object> params = new ArrayList<>();

    if (!query.eventTypes().isEmpty()) {
      conditions.add("event_type IN (" + placeholders(query.eventTypes().size()) + ")");
      params.addAll(query.eventTypes());
    }
    if (query.since() != null) {
      conditions.add("synced_at >= ?");
      params.add(timestamp(query.since()));
    }
    if (Boolean.TRUE.equals(query.replayed())) {
      conditions.add("replayed_at IS NOT NULL");
    } else if (Boolean.FALSE.equals(query.replayed())) {
      conditions.add("replayed_at IS NULL");
    }
    if (query.afterSyncedAt() != null) {
      String cmp = newestFirst ? "<" : ">";
      conditions.add("(synced_at " + cmp + " ? OR (synced_at = ? AND id " + cmp + " ?))");
      Timestamp cursor = timestamp(query.afterSyncedAt());
      params.add(cursor);
      params.add(cursor);
      params.add(query.afterSequence());
    }

    String direction = newestFirst ? "DESC" : "ASC";
    StringBuilder sql = new StringBuilder("SELECT ").append(SELECT_COLUMNS)
        .append(" FROM ").append(tableName());
    if (!conditions.isEmpty()) {
      sql.append(" WHERE ").append(String.join(" AND ", conditions));
    }
    sql.append(" ORDER BY synced_at ").append(direction).append(", id ").append(direction)
        .append(" LIMIT ?");
    params.add(query.limit());
    return JdbcTemplate.query(conn, sql.toString(), this::mapRow, params.toArray());
  }

  @Override
  public int markReplayed(Connection conn, Collection<Long> sequences, Instant when) {
    Objects.requireNonNull(when, "when");
    if (sequences == null || sequences.isEmpty()) {
      return 0;
    }
    List<Object> params = new ArrayList<>(sequences.size() + 1);
    params.add(timestamp(when));
    params.addAll(sequences);
    String sql = "UPDATE " + tableName() + " SET replayed_at=?"
        + " WHERE replayed_at IS NULL AND id IN (" + placeholders(sequences.size()) + ")";
    return JdbcTemplate.update(conn, sql, params.toArray());
  }

  @Override
  public long count(Connection conn) {
    return JdbcTemplate.queryForLong(conn, "SELECT COUNT(*) FROM " + tableName());
  }

  protected SyncedEvent mapRow(ResultSet rs) throws SQLException {
    String sourceUrl = rs.getString("source_url");
    String metadataJson = rs.getString("sync_metadata");
    Timestamp replayedAt = rs.getTimestamp("replayed_at");
    return new SyncedEvent(
        rs.getLong("id"),
        rs.getString("event_id"),
        sourceUrl == null || sourceUrl.isEmpty() ? null : sourceUrl,
        rs.getString("event_type"),
        rs.getString("event_data"),
        metadataJson == null
            ? null
            : jsonCodec.treeToValue(jsonCodec.readTree(metadataJson), SyncMetadata.class),
        rs.getTimestamp("synced_at").toInstant(),
        replayedAt == null ? null : replayedAt.toInstant());
  }

  protected static String storedSourceUrl(String sourceUrl) {
    return sourceUrl == null ? "" : sourceUrl;
  }

  // Columns keep microseconds; truncating keeps cursors and stored values comparable.
  protected static Timestamp timestamp(Instant instant) {
    return Timestamp.from(instant.truncatedTo(ChronoUnit.MICROS));
  }

  private static String placeholders(int count) {
    return String.join(",", Collections.nCopies(count, "?"));
  }
}
