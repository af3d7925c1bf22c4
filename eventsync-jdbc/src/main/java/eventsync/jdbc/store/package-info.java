/**
 * JDBC implementations of the synced event store and the operation log.
 *
 * <p>{@link eventsync.jdbc.store.JdbcSyncedEventStores} picks the synced event store that
 * matches a JDBC URL; the operation log SQL is shared by all supported databases.
 */
package eventsync.jdbc.store;
