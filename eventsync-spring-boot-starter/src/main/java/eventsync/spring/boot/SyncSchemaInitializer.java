package eventsync.spring.boot;

import eventsync.jdbc.JdbcSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provisions (optionally) and verifies the sync tables before the repositories are used.
 *
 * <p>A missing table or column fails application startup with
 * {@link eventsync.jdbc.SchemaMismatchException}.
 */
public class SyncSchemaInitializer implements InitializingBean {
  private static final Logger log = LoggerFactory.getLogger(SyncSchemaInitializer.class);

  private final DataSource dataSource;
  private final String storeName;
  private final EventSyncProperties.Schema schema;

  public SyncSchemaInitializer(DataSource dataSource, String storeName,
      EventSyncProperties.Schema schema) {
    this.dataSource = dataSource;
    this.storeName = storeName;
    this.schema = schema;
  }

  @Override
  public void afterPropertiesSet() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      if (schema.isProvision()) {
        JdbcSchema.provision(conn, storeName, schema.getEventTable(), schema.getLogTable());
      }
      if (schema.isVerify()) {
        JdbcSchema.verify(conn, schema.getEventTable(), schema.getLogTable());
        log.info("Verified sync tables {} and {}", schema.getEventTable(), schema.getLogTable());
      }
    }
  }
}
