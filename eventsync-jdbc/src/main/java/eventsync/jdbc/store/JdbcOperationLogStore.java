package eventsync.jdbc.store;

import eventsync.jdbc.JdbcTemplate;
import eventsync.jdbc.TableNames;
import eventsync.model.Operation;
import eventsync.model.OperationLogEntry;
import eventsync.model.OperationStatus;
import eventsync.spi.OperationLogStore;
import eventsync.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Operation log backed by the {@code sync_log} table. The SQL is portable across H2, MySQL
 * and PostgreSQL.
 */
public final class JdbcOperationLogStore implements OperationLogStore {
  private static final String SELECT_COLUMNS =
      "id, operation, status, details, events_count, created_at";

  private final String tableName;
  private final JsonCodec jsonCodec;

  public JdbcOperationLogStore() {
    this(TableNames.DEFAULT_LOG_TABLE);
  }

  public JdbcOperationLogStore(String tableName) {
    this(tableName, JsonCodec.getDefault());
  }

  public JdbcOperationLogStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public OperationLogEntry append(Connection conn, OperationLogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    String sql = "INSERT INTO " + tableName
        + " (operation, status, details, events_count, created_at) VALUES (?,?,?,?,?)";
    long id = JdbcTemplate.insertReturningKey(conn, sql,
        entry.operation().code(),
        entry.status().code(),
        jsonCodec.toJson(entry.details()),
        entry.eventsCount(),
        Timestamp.from(entry.timestamp()));
    return new OperationLogEntry(id, entry.operation(), entry.status(), entry.details(),
        entry.eventsCount(), entry.timestamp());
  }

  @Override
  public List<OperationLogEntry> recent(Connection conn, Operation operation, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    if (operation == null) {
      String sql = "SELECT " + SELECT_COLUMNS + " FROM " + tableName
          + " ORDER BY id DESC LIMIT ?";
      return JdbcTemplate.query(conn, sql, this::mapRow, limit);
    }
    String sql = "SELECT " + SELECT_COLUMNS + " FROM " + tableName
        + " WHERE operation=? ORDER BY id DESC LIMIT ?";
    return JdbcTemplate.query(conn, sql, this::mapRow, operation.code(), limit);
  }

  @Override
  public Optional<OperationLogEntry> latest(Connection conn, Operation operation,
      OperationStatus status) {
    String sql = "SELECT " + SELECT_COLUMNS + " FROM " + tableName
        + " WHERE operation=? AND status=? ORDER BY id DESC LIMIT 1";
    return JdbcTemplate.query(conn, sql, this::mapRow, operation.code(), status.code())
        .stream()
        .findFirst();
  }

  private OperationLogEntry mapRow(ResultSet rs) throws SQLException {
    return new OperationLogEntry(
        rs.getLong("id"),
        Operation.fromCode(rs.getString("operation")),
        OperationStatus.fromCode(rs.getString("status")),
        jsonCodec.parseObject(rs.getString("details")),
        rs.getInt("events_count"),
        rs.getTimestamp("created_at").toInstant());
  }
}
