package eventsync;

/**
 * Type-safe event type, typically implemented by an enum of the application's domain events.
 *
 * <pre>{@code
 * enum UserEvents implements EventType {
 *   USER_CREATED("user.created"),
 *   USER_RENAMED("user.renamed");
 *
 *   private final String typeName;
 *
 *   UserEvents(String typeName) { this.typeName = typeName; }
 *
 *   public String typeName() { return typeName; }
 * }
 * }</pre>
 *
 * <p>Used when registering replay handlers so that the wire name of an event is declared once.
 */
public interface EventType {

  /**
   * Returns the event type name as it appears on the wire and in storage.
   */
  String typeName();
}
