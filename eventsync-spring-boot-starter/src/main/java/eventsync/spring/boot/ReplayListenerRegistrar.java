package eventsync.spring.boot;

import eventsync.EventType;
import eventsync.replay.EventPayload;
import eventsync.replay.PayloadBinder;
import eventsync.replay.ReplayHandler;
import eventsync.replay.ReplayRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link ReplayListener} and registers them in the
 * {@link ReplayRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see ReplayListener
 */
public class ReplayListenerRegistrar implements SmartInitializingSingleton {
    private static final Logger log = LoggerFactory.getLogger(ReplayListenerRegistrar.class);

    private final ListableBeanFactory beanFactory;
    private final ReplayRegistry registry;

    public ReplayListenerRegistrar(ListableBeanFactory beanFactory, ReplayRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(ReplayListener.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof ReplayHandler<?> handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @ReplayListener must implement ReplayHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation from getAnnotation
            ReplayListener annotation = AnnotationUtils.findAnnotation(bean.getClass(),
                    ReplayListener.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @ReplayListener annotation on " + bean.getClass().getName());
            }

            String eventType = resolveEventType(beanName, annotation);
            try {
                register(eventType, annotation.payloadType(), handler);
            } catch (IllegalStateException e) {
                throw new BeanCreationException(beanName, e.getMessage(), e);
            }
            log.debug("Registered replay handler {} for event type {}", beanName, eventType);
        }
    }

    // The handler's type argument is erased; payloadType stands in for it.
    @SuppressWarnings("unchecked")
    private <T> void register(String eventType, Class<T> payloadType, ReplayHandler<?> handler) {
        ReplayHandler<T> typed = (ReplayHandler<T>) handler;
        if (payloadType == EventPayload.class) {
            PayloadBinder<T> identity = payloadType::cast;
            registry.register(eventType, identity, typed);
        } else {
            registry.register(eventType, payloadType, typed);
        }
    }

    private String resolveEventType(String beanName, ReplayListener annotation) {
        Class<? extends EventType> eventTypeClass = annotation.eventTypeClass();
        if (eventTypeClass != EventType.class) {
            return instantiateAndGetName(beanName, eventTypeClass);
        }
        String eventType = annotation.eventType();
        if (eventType.isEmpty()) {
            throw new BeanCreationException(beanName,
                    "@ReplayListener must specify either eventType or eventTypeClass");
        }
        return eventType;
    }

    private String instantiateAndGetName(String beanName, Class<? extends EventType> clazz) {
        try {
            if (clazz.isEnum()) {
                EventType[] constants = clazz.getEnumConstants();
                if (constants == null || constants.length == 0) {
                    throw new BeanCreationException(beanName,
                            "@ReplayListener eventTypeClass enum " + clazz.getName() + " has no constants");
                }
                return constants[0].typeName();
            }
            return clazz.getDeclaredConstructor().newInstance().typeName();
        } catch (BeanCreationException e) {
            throw e;
        } catch (Exception e) {
            throw new BeanCreationException(beanName,
                    "Failed to instantiate @ReplayListener eventTypeClass: " + clazz.getName(), e);
        }
    }
}
