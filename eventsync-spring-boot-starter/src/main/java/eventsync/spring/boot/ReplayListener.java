package eventsync.spring.boot;

import eventsync.EventType;
import eventsync.replay.EventPayload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the replay handler of one event type.
 *
 * <p>The annotated bean must implement {@link eventsync.replay.ReplayHandler}. Its payload
 * argument is bound from the stored JSON: beans declaring {@code payloadType} receive an
 * instance of that class bound with Jackson, others receive the raw {@link EventPayload}.
 *
 * <pre>{@code
 * @Component
 * @ReplayListener(eventType = "user.created", payloadType = UserCreated.class)
 * public class UserCreatedReplay implements ReplayHandler<UserCreated> {
 *   public void handle(UserCreated event, SyncedEvent record) { ... }
 * }
 * }</pre>
 *
 * <p>{@code eventTypeClass} takes precedence over {@code eventType}; exactly one must be
 * given. An enum {@code eventTypeClass} contributes its first constant.
 *
 * @see ReplayListenerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ReplayListener {

    /**
     * Event type name (string-based).
     */
    String eventType() default "";

    /**
     * Event type class (type-safe). Takes precedence over {@link #eventType()}.
     * Must have a no-arg constructor (or be an enum).
     */
    Class<? extends EventType> eventTypeClass() default EventType.class;

    /**
     * Class the payload is bound to. Defaults to the raw {@link EventPayload}.
     */
    Class<?> payloadType() default EventPayload.class;
}
