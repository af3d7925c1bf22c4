package eventsync.jdbc.store;

import eventsync.util.JsonCodec;

import java.util.List;

/**
 * PostgreSQL store.
 *
 * <p>Uses {@code ON CONFLICT DO NOTHING}: a duplicate never raises an error, so it does not
 * abort an enclosing transaction.
 */
public final class PostgresSyncedEventStore extends AbstractJdbcSyncedEventStore {

  public PostgresSyncedEventStore() {
    super();
  }

  public PostgresSyncedEventStore(String tableName) {
    super(tableName);
  }

  public PostgresSyncedEventStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcSyncedEventStore withTableName(String tableName) {
    return new PostgresSyncedEventStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String insertSql() {
    return "INSERT INTO " + tableName() + " (" + INSERT_COLUMNS + ") VALUES (?,?,?,?,?,?,?)"
        + " ON CONFLICT (event_id, source_url) DO NOTHING";
  }
}
