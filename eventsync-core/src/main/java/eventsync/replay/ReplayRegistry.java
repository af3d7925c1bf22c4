package eventsync.replay;

import eventsync.EventType;
import eventsync.util.JsonCodec;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry mapping event types to the binding that replays them.
 *
 * <p>Populated at startup. Each type has at most one binding; registering a type twice
 * fails.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ReplayRegistry registry = new ReplayRegistry()
 *     .register("user.created",
 *         payload -> new UserCreated(payload.requireString("user_id"), payload.getString("name", "")),
 *         (event, record) -> users.apply(event))
 *     .register(UserEvents.USER_RENAMED, UserRenamed.class, (event, record) -> users.apply(event))
 *     .register("audit.logged", (payload, record) -> audit.write(payload.node()));
 * }</pre>
 */
public final class ReplayRegistry {
  private final Map<String, ReplayBinding<?>> bindings = new ConcurrentHashMap<>();
  private final JsonCodec jsonCodec;

  public ReplayRegistry() {
    this(JsonCodec.getDefault());
  }

  public ReplayRegistry(JsonCodec jsonCodec) {
    this.jsonCodec = jsonCodec;
  }

  /**
   * Registers a binder and handler for an event type.
   *
   * @throws IllegalStateException if the type is already registered
   */
  public <T> ReplayRegistry register(String eventType, PayloadBinder<T> binder,
      ReplayHandler<T> handler) {
    return add(new ReplayBinding<>(eventType, binder, handler));
  }

  public <T> ReplayRegistry register(EventType eventType, PayloadBinder<T> binder,
      ReplayHandler<T> handler) {
    return register(eventType.typeName(), binder, handler);
  }

  /**
   * Registers a handler whose payload class is bound with Jackson. Fields the class does
   * not declare are ignored.
   */
  public <T> ReplayRegistry register(String eventType, Class<T> payloadType,
      ReplayHandler<T> handler) {
    return register(eventType, payload -> jsonCodec.treeToValue(payload.node(), payloadType),
        handler);
  }

  public <T> ReplayRegistry register(EventType eventType, Class<T> payloadType,
      ReplayHandler<T> handler) {
    return register(eventType.typeName(), payloadType, handler);
  }

  /**
   * Registers a handler that receives the raw payload.
   */
  public ReplayRegistry register(String eventType, ReplayHandler<EventPayload> handler) {
    return register(eventType, PayloadBinder.identity(), handler);
  }

  /**
   * Adds a prepared binding.
   *
   * @throws IllegalStateException if the type is already registered
   */
  public ReplayRegistry add(ReplayBinding<?> binding) {
    ReplayBinding<?> existing = bindings.putIfAbsent(binding.eventType(), binding);
    if (existing != null) {
      throw new IllegalStateException("Replay handler already registered for event type '"
          + binding.eventType() + "'");
    }
    return this;
  }

  public Optional<ReplayBinding<?>> resolve(String eventType) {
    return Optional.ofNullable(bindings.get(eventType));
  }

  public boolean isRegistered(String eventType) {
    return bindings.containsKey(eventType);
  }

  /**
   * Returns the registered event types, sorted.
   */
  public Set<String> eventTypes() {
    return Collections.unmodifiableSet(new TreeSet<>(bindings.keySet()));
  }
}
