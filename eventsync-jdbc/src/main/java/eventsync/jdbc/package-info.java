/**
 * JDBC persistence for the sync bridge: schema provisioning and verification plus a small
 * JDBC helper.
 *
 * <p>Store implementations live in {@link eventsync.jdbc.store}.
 */
package eventsync.jdbc;
