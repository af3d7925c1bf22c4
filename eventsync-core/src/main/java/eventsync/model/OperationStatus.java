package eventsync.model;

/**
 * Outcome recorded for an operation log entry.
 *
 * <ul>
 *   <li>{@link #SUCCESS} - the operation completed (possibly with per-event errors)</li>
 *   <li>{@link #FAILED} - the remote peer answered with a non-2xx status, or no event made progress</li>
 *   <li>{@link #ERROR} - a transport, parsing or storage exception occurred</li>
 * </ul>
 */
public enum OperationStatus {
  SUCCESS("success"),
  FAILED("failed"),
  ERROR("error");

  private final String code;

  OperationStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public boolean isFailure() {
    return this != SUCCESS;
  }

  public static OperationStatus fromCode(String code) {
    for (OperationStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown operation status code: " + code);
  }
}
