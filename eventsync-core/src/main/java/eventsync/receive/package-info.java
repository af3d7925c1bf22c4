/**
 * Inbound side of the bridge: receiving pushed events, serving the pull feed and
 * reporting status.
 *
 * <p>These classes carry no HTTP server of their own; the Spring Boot starter exposes them
 * as REST endpoints.
 */
package eventsync.receive;
