/**
 * Blocking HTTP transport to remote peers.
 */
package eventsync.http;
