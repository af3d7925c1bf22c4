package eventsync.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.UUID;

/**
 * Creates isolated in-memory H2 databases with the sync schema provisioned.
 */
public final class H2Databases {

  private H2Databases() {
  }

  public static JdbcDataSource empty() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:sync_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    return ds;
  }

  public static DataSource provisioned() throws SQLException {
    JdbcDataSource ds = empty();
    try (Connection conn = ds.getConnection()) {
      JdbcSchema.provision(conn, "h2");
    }
    return ds;
  }
}
