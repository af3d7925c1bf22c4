package eventsync.jdbc.store;

import eventsync.util.JsonCodec;

import java.util.List;

/**
 * MySQL store. Also compatible with MariaDB and TiDB.
 *
 * <p>Uses {@code INSERT IGNORE}, so a duplicate key yields zero affected rows instead of an
 * error. Note that {@code INSERT IGNORE} also downgrades data truncation errors to warnings.
 */
public final class MySqlSyncedEventStore extends AbstractJdbcSyncedEventStore {

  public MySqlSyncedEventStore() {
    super();
  }

  public MySqlSyncedEventStore(String tableName) {
    super(tableName);
  }

  public MySqlSyncedEventStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcSyncedEventStore withTableName(String tableName) {
    return new MySqlSyncedEventStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  protected String insertSql() {
    return "INSERT IGNORE INTO " + tableName() + " (" + INSERT_COLUMNS + ") VALUES (?,?,?,?,?,?,?)";
  }
}
