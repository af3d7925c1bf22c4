package eventsync.jdbc.store;

import eventsync.util.JsonCodec;

import java.util.List;

/**
 * H2 store. Relies on the unique key violation of a plain {@code INSERT}.
 */
public final class H2SyncedEventStore extends AbstractJdbcSyncedEventStore {

  public H2SyncedEventStore() {
    super();
  }

  public H2SyncedEventStore(String tableName) {
    super(tableName);
  }

  public H2SyncedEventStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcSyncedEventStore withTableName(String tableName) {
    return new H2SyncedEventStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
