/**
 * Spring Boot auto-configuration for the event sync bridge.
 *
 * <p>Add the starter and a {@code DataSource}; the bridge beans, the HTTP endpoints and,
 * when Micrometer is present, metrics are configured from {@code eventsync.*} properties.
 * Replay handlers are Spring beans annotated with {@link eventsync.spring.boot.ReplayListener}.
 */
package eventsync.spring.boot;
