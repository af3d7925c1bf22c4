package eventsync.spring.boot;

import eventsync.SyncConfig;
import eventsync.receive.EventFeed;
import eventsync.receive.EventReceiver;
import eventsync.sync.SyncOrchestrator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exposes {@link EventSyncController} in servlet web applications unless
 * {@code eventsync.web.enabled=false}.
 */
@AutoConfiguration(after = EventSyncAutoConfiguration.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass(RestController.class)
@ConditionalOnBean(SyncOrchestrator.class)
@ConditionalOnProperty(prefix = "eventsync.web", name = "enabled", matchIfMissing = true)
public class EventSyncWebAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public EventSyncController eventSyncController(SyncConfig config, EventFeed eventFeed,
      EventReceiver eventReceiver, SyncOrchestrator syncOrchestrator) {
    return new EventSyncController(config, eventFeed, eventReceiver, syncOrchestrator);
  }
}
