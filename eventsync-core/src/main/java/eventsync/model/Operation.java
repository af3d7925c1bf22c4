package eventsync.model;

/**
 * Kind of operation recorded in the operation log.
 *
 * <p>Each constant has a stable lowercase {@linkplain #code() code} that is what gets
 * persisted, so renaming a constant does not break existing rows.
 */
public enum Operation {
  PULL("pull"),
  SEND("send"),
  STORE_EVENT("store_event"),
  REPLAY("replay");

  private final String code;

  Operation(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Resolves an operation from its persisted code.
   *
   * @param code the stored code
   * @return the matching operation
   * @throws IllegalArgumentException if the code is unknown
   */
  public static Operation fromCode(String code) {
    for (Operation operation : values()) {
      if (operation.code.equals(code)) {
        return operation;
      }
    }
    throw new IllegalArgumentException("Unknown operation code: " + code);
  }
}
