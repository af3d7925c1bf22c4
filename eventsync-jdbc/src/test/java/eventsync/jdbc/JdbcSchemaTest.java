package eventsync.jdbc;

import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcSchemaTest {

  @Test
  void provisionDetectsStoreFromUrlAndVerifies() {
    DataSource ds = H2Databases.empty();

    JdbcSchema.provision(ds);

    assertDoesNotThrow(() -> JdbcSchema.verify(ds));
  }

  @Test
  void provisionIsIdempotent() throws Exception {
    DataSource ds = H2Databases.provisioned();

    try (Connection conn = ds.getConnection()) {
      assertDoesNotThrow(() -> JdbcSchema.provision(conn, "h2"));
      JdbcSchema.verify(conn, TableNames.DEFAULT_EVENT_TABLE, TableNames.DEFAULT_LOG_TABLE);
    }
  }

  @Test
  void missingTableIsReported() throws Exception {
    DataSource ds = H2Databases.empty();

    try (Connection conn = ds.getConnection()) {
      SchemaMismatchException e = assertThrows(SchemaMismatchException.class, () ->
          JdbcSchema.verify(conn, TableNames.DEFAULT_EVENT_TABLE, TableNames.DEFAULT_LOG_TABLE));
      assertEquals("sync_event", e.table());
      assertTrue(e.missingColumns().isEmpty());
    }
  }

  @Test
  void missingColumnIsReported() throws Exception {
    DataSource ds = H2Databases.provisioned();

    try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("CREATE TABLE legacy_event (id BIGINT PRIMARY KEY, event_id VARCHAR(255),"
          + " source_url VARCHAR(512), event_type VARCHAR(255), event_data CLOB,"
          + " synced_at TIMESTAMP)");

      SchemaMismatchException e = assertThrows(SchemaMismatchException.class, () ->
          JdbcSchema.verify(conn, "legacy_event", TableNames.DEFAULT_LOG_TABLE));
      assertEquals("legacy_event", e.table());
      assertEquals(List.of("sync_metadata", "replayed_at"), e.missingColumns());
    }
  }

  @Test
  void unknownStoreNameIsRejected() throws Exception {
    DataSource ds = H2Databases.empty();

    try (Connection conn = ds.getConnection()) {
      assertThrows(IllegalArgumentException.class, () -> JdbcSchema.provision(conn, "oracle"));
    }
  }

  @Test
  void provisionCreatesCustomTablesAlongsideDefaults() throws Exception {
    DataSource ds = H2Databases.provisioned();

    JdbcSchema.provision(ds, "app_sync_event", "app_sync_log");

    try (Connection conn = ds.getConnection()) {
      JdbcSchema.verify(conn, "app_sync_event", "app_sync_log");
      JdbcSchema.verify(conn, TableNames.DEFAULT_EVENT_TABLE, TableNames.DEFAULT_LOG_TABLE);
      assertDoesNotThrow(() -> JdbcSchema.provision(conn, "h2", "app_sync_event", "app_sync_log"));
    }
  }

  @Test
  void provisionRejectsInvalidTableName() throws Exception {
    DataSource ds = H2Databases.empty();

    try (Connection conn = ds.getConnection()) {
      assertThrows(IllegalArgumentException.class,
          () -> JdbcSchema.provision(conn, "h2", "events; DROP TABLE x", "app_sync_log"));
    }
  }
}
