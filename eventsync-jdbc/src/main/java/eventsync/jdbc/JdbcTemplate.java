package eventsync.jdbc;

import eventsync.store.SyncStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper to reduce boilerplate in store implementations.
 *
 * <p>Every {@link SQLException} is rethrown as {@link SyncStoreException}.
 */
public final class JdbcTemplate {
  private static final String UNIQUE_VIOLATION_STATE = "23505";
  private static final String MYSQL_INTEGRITY_STATE = "23000";
  private static final int MYSQL_DUPLICATE_ENTRY = 1062;

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute UPDATE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new SyncStoreException("Failed to execute update", e);
    }
  }

  /**
   * Execute an INSERT that may collide with a unique key.
   *
   * @return {@code true} if a row was inserted, {@code false} if the statement inserted nothing
   *     or failed with a unique key violation
   */
  public static boolean insertUnlessDuplicate(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate() > 0;
    } catch (SQLException e) {
      if (isUniqueViolation(e)) {
        return false;
      }
      throw new SyncStoreException("Failed to execute insert", e);
    }
  }

  /** Execute INSERT, return the generated key of the first inserted row. */
  public static long insertReturningKey(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
      bindParams(ps, params);
      ps.executeUpdate();
      try (ResultSet keys = ps.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new SyncStoreException("Insert returned no generated key");
        }
        return keys.getLong(1);
      }
    } catch (SQLException e) {
      throw new SyncStoreException("Failed to execute insert", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new SyncStoreException("Failed to execute query", e);
    }
  }

  /** Execute a single-value SELECT such as {@code COUNT(*)}. */
  public static long queryForLong(Connection conn, String sql, Object... params) {
    List<Long> values = query(conn, sql, rs -> rs.getLong(1), params);
    return values.isEmpty() ? 0L : values.get(0);
  }

  /**
   * Tests whether an exception is a unique key violation: SQLState {@code 23505}, or
   * MySQL's {@code 23000} carrying vendor code 1062. NOT NULL, foreign key and check
   * violations do not match.
   */
  public static boolean isUniqueViolation(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      String state = current.getSQLState();
      if (UNIQUE_VIOLATION_STATE.equals(state)) {
        return true;
      }
      if (current.getErrorCode() == MYSQL_DUPLICATE_ENTRY
          && (state == null || MYSQL_INTEGRITY_STATE.equals(state))) {
        return true;
      }
    }
    return false;
  }

  static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
