package eventsync.replay;

/**
 * Binds a stored payload to the argument a {@link ReplayHandler} expects.
 *
 * <pre>{@code
 * PayloadBinder<UserCreated> binder = payload -> new UserCreated(
 *     payload.requireString("user_id"),
 *     payload.getString("name", "anonymous"));
 * }</pre>
 *
 * @param <T> the bound type
 */
@FunctionalInterface
public interface PayloadBinder<T> {

  /**
   * Binds the payload.
   *
   * @param payload the stored payload
   * @return the bound value
   * @throws IllegalArgumentException if a required field is missing or malformed
   */
  T bind(EventPayload payload);

  /**
   * Binder that passes the payload through unchanged.
   */
  static PayloadBinder<EventPayload> identity() {
    return payload -> payload;
  }
}
