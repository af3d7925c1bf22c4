package eventsync.processor;

/**
 * Why the {@link EventProcessor} declined a raw event.
 */
public enum RejectionReason {
  /** The event carries no type, or an empty one. Counted as an error. */
  MISSING_TYPE,
  /** The event filter rejected the type. A control signal: the event is skipped. */
  FILTERED_OUT
}
