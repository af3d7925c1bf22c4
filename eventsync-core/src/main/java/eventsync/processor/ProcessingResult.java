package eventsync.processor;

import eventsync.model.SyncedEvent;

import java.util.Objects;

/**
 * Outcome of processing one raw event.
 *
 * <ul>
 *   <li>{@link Accepted} - a record ready to be stored</li>
 *   <li>{@link Rejected} - the event was declined, with a reason</li>
 * </ul>
 */
public sealed interface ProcessingResult {

  /**
   * The event passed validation and filtering.
   *
   * @param event the normalized record (not yet persisted)
   */
  record Accepted(SyncedEvent event) implements ProcessingResult {
    public Accepted {
      Objects.requireNonNull(event, "event");
    }
  }

  /**
   * The event was declined.
   *
   * @param reason  the rejection kind
   * @param message human-readable detail
   */
  record Rejected(RejectionReason reason, String message) implements ProcessingResult {
    public Rejected {
      Objects.requireNonNull(reason, "reason");
    }

    public boolean isFilteredOut() {
      return reason == RejectionReason.FILTERED_OUT;
    }
  }
}
