/**
 * Repository facades over the store SPIs: the event record store and the operation log.
 */
package eventsync.store;
