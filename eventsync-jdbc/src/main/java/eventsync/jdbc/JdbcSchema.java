package eventsync.jdbc;

import eventsync.jdbc.store.JdbcSyncedEventStores;
import eventsync.store.SyncStoreException;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Provisions and verifies the {@code sync_event} and {@code sync_log} tables.
 *
 * <p>DDL scripts ship as classpath resources {@code /schema/<store-name>.sql} (for example
 * {@code /schema/postgresql.sql}); every statement is idempotent. Table names appear in the
 * scripts as {@code ${event_table}} and {@code ${log_table}} and are substituted after
 * validation, constraint and index names included. Provision once at
 * initialization, then {@link #verify} at startup: a missing table or column is fatal and is
 * never patched while the application runs.
 */
public final class JdbcSchema {
  private static final Logger logger = Logger.getLogger(JdbcSchema.class.getName());

  public static final List<String> EVENT_COLUMNS = List.of(
      "id", "event_id", "source_url", "event_type", "event_data", "sync_metadata",
      "synced_at", "replayed_at");
  public static final List<String> LOG_COLUMNS = List.of(
      "id", "operation", "status", "details", "events_count", "created_at");

  static final String EVENT_TABLE_PLACEHOLDER = "${event_table}";
  static final String LOG_TABLE_PLACEHOLDER = "${log_table}";

  private JdbcSchema() {}

  /**
   * Creates the default tables if absent, choosing the script from the data source's JDBC URL.
   */
  public static void provision(DataSource dataSource) {
    provision(dataSource, TableNames.DEFAULT_EVENT_TABLE, TableNames.DEFAULT_LOG_TABLE);
  }

  /**
   * Creates the named tables if absent, choosing the script from the data source's JDBC URL.
   */
  public static void provision(DataSource dataSource, String eventTable, String logTable) {
    try (Connection conn = dataSource.getConnection()) {
      String storeName = JdbcSyncedEventStores.detect(conn.getMetaData().getURL()).name();
      provision(conn, storeName, eventTable, logTable);
    } catch (SQLException e) {
      throw new SyncStoreException("Failed to provision sync schema", e);
    }
  }

  /**
   * Runs the DDL script of a store for the default tables.
   *
   * @param conn      the connection (auto-commit is respected)
   * @param storeName store name, e.g. {@code h2}, {@code mysql}, {@code postgresql}
   */
  public static void provision(Connection conn, String storeName) {
    provision(conn, storeName, TableNames.DEFAULT_EVENT_TABLE, TableNames.DEFAULT_LOG_TABLE);
  }

  /**
   * Runs the DDL script of a store for the given tables.
   *
   * @throws IllegalArgumentException if a table name is invalid or the store has no script
   */
  public static void provision(Connection conn, String storeName, String eventTable,
      String logTable) {
    String script = loadScript(storeName)
        .replace(EVENT_TABLE_PLACEHOLDER, TableNames.validate(eventTable))
        .replace(LOG_TABLE_PLACEHOLDER, TableNames.validate(logTable));
    try (Statement stmt = conn.createStatement()) {
      for (String sql : script.split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    } catch (SQLException e) {
      throw new SyncStoreException("Failed to provision sync schema for " + storeName, e);
    }
    logger.info("Provisioned sync tables " + eventTable + " and " + logTable + " for " + storeName);
  }

  /**
   * Verifies the default tables.
   *
   * @throws SchemaMismatchException if a table or column is missing
   */
  public static void verify(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      verify(conn, TableNames.DEFAULT_EVENT_TABLE, TableNames.DEFAULT_LOG_TABLE);
    } catch (SQLException e) {
      throw new SyncStoreException("Failed to verify sync schema", e);
    }
  }

  /**
   * Verifies that both tables exist with every required column.
   *
   * @throws SchemaMismatchException if a table or column is missing
   */
  public static void verify(Connection conn, String eventTable, String logTable) {
    verifyTable(conn, TableNames.validate(eventTable), EVENT_COLUMNS);
    verifyTable(conn, TableNames.validate(logTable), LOG_COLUMNS);
  }

  static void verifyTable(Connection conn, String table, List<String> required) {
    Set<String> present = columnsOf(conn, table);
    if (present.isEmpty()) {
      throw new SchemaMismatchException(table, List.of());
    }
    List<String> missing = new ArrayList<>();
    for (String column : required) {
      if (!present.contains(column)) {
        missing.add(column);
      }
    }
    if (!missing.isEmpty()) {
      throw new SchemaMismatchException(table, missing);
    }
  }

  private static Set<String> columnsOf(Connection conn, String table) {
    Set<String> columns = new LinkedHashSet<>();
    try {
      DatabaseMetaData metaData = conn.getMetaData();
      for (String candidate : new LinkedHashSet<>(List.of(
          table, table.toUpperCase(Locale.ROOT), table.toLowerCase(Locale.ROOT)))) {
        try (ResultSet rs = metaData.getColumns(conn.getCatalog(), null, candidate, null)) {
          while (rs.next()) {
            columns.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
          }
        }
        if (!columns.isEmpty()) {
          break;
        }
      }
    } catch (SQLException e) {
      throw new SyncStoreException("Failed to read metadata of table " + table, e);
    }
    return columns;
  }

  private static String loadScript(String storeName) {
    String resource = "/schema/" + storeName.toLowerCase(Locale.ROOT) + ".sql";
    try (InputStream in = JdbcSchema.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No schema script for store: " + storeName);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new SyncStoreException("Failed to read " + resource, e);
    }
  }
}
