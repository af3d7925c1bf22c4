/**
 * Service provider interfaces: persistence, connections, the replay commit boundary
 * and metrics.
 *
 * <p>JDBC implementations of the stores live in the {@code eventsync-jdbc} module.
 */
package eventsync.spi;
