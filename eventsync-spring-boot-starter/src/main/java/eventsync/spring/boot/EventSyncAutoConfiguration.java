package eventsync.spring.boot;

import eventsync.SyncConfig;
import eventsync.http.HttpPeerClient;
import eventsync.http.PeerClient;
import eventsync.jdbc.store.AbstractJdbcSyncedEventStore;
import eventsync.jdbc.store.JdbcOperationLogStore;
import eventsync.jdbc.store.JdbcSyncedEventStores;
import eventsync.processor.EventProcessor;
import eventsync.receive.EventFeed;
import eventsync.receive.EventReceiver;
import eventsync.replay.ReplayEngine;
import eventsync.replay.ReplayRegistry;
import eventsync.spi.ConnectionProvider;
import eventsync.spi.MetricsExporter;
import eventsync.spi.OperationLogStore;
import eventsync.spi.SyncedEventStore;
import eventsync.spi.UnitOfWork;
import eventsync.store.EventRecordRepository;
import eventsync.store.OperationLog;
import eventsync.sync.SyncOrchestrator;
import eventsync.util.JsonCodec;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.DependsOn;

import javax.sql.DataSource;

/**
 * Auto-configuration for the event sync bridge.
 *
 * <p>Wires the record store, operation log, orchestrator, replay engine, receiver and feed
 * from a {@link DataSource} and {@link EventSyncProperties}. The store matching the
 * data source's JDBC URL is detected automatically.
 *
 * @see EventSyncProperties
 * @see EventSyncMicrometerAutoConfiguration
 * @see EventSyncWebAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(SyncOrchestrator.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EventSyncProperties.class)
public class EventSyncAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public SyncConfig syncConfig(EventSyncProperties props) {
    return props.toSyncConfig();
  }

  @Bean
  @ConditionalOnMissingBean(SyncedEventStore.class)
  public AbstractJdbcSyncedEventStore syncedEventStore(DataSource dataSource,
      EventSyncProperties props) {
    AbstractJdbcSyncedEventStore detected = JdbcSyncedEventStores.detect(dataSource);
    return detected.withTableName(props.getSchema().getEventTable());
  }

  @Bean
  @ConditionalOnMissingBean(OperationLogStore.class)
  public JdbcOperationLogStore operationLogStore(EventSyncProperties props) {
    return new JdbcOperationLogStore(props.getSchema().getLogTable());
  }

  @Bean
  public SyncSchemaInitializer syncSchemaInitializer(DataSource dataSource,
      EventSyncProperties props) {
    String storeName = JdbcSyncedEventStores.detect(dataSource).name();
    return new SyncSchemaInitializer(dataSource, storeName, props.getSchema());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public ConnectionProvider syncConnectionProvider(DataSource dataSource) {
    return dataSource::getConnection;
  }

  @Bean
  @ConditionalOnMissingBean
  @DependsOn("syncSchemaInitializer")
  public OperationLog operationLog(ConnectionProvider connectionProvider,
      OperationLogStore operationLogStore) {
    return new OperationLog(connectionProvider, operationLogStore);
  }

  @Bean
  @ConditionalOnMissingBean
  @DependsOn("syncSchemaInitializer")
  public EventRecordRepository eventRecordRepository(ConnectionProvider connectionProvider,
      SyncedEventStore syncedEventStore, OperationLog operationLog) {
    return new EventRecordRepository(connectionProvider, syncedEventStore, operationLog);
  }

  @Bean
  @ConditionalOnMissingBean
  public PeerClient peerClient() {
    return new HttpPeerClient();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventProcessor eventProcessor(SyncConfig config) {
    return new EventProcessor(config.eventFilter());
  }

  @Bean
  @ConditionalOnMissingBean
  public SyncOrchestrator syncOrchestrator(SyncConfig config,
      EventRecordRepository repository,
      PeerClient peerClient,
      EventProcessor eventProcessor,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<JsonCodec> jsonCodecProvider) {
    return SyncOrchestrator.builder()
        .config(config)
        .repository(repository)
        .peerClient(peerClient)
        .processor(eventProcessor)
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .jsonCodec(jsonCodecProvider.getIfAvailable(JsonCodec::getDefault))
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public ReplayRegistry replayRegistry(ObjectProvider<JsonCodec> jsonCodecProvider) {
    return new ReplayRegistry(jsonCodecProvider.getIfAvailable(JsonCodec::getDefault));
  }

  @Bean
  @ConditionalOnMissingBean
  public ReplayListenerRegistrar replayListenerRegistrar(ListableBeanFactory beanFactory,
      ReplayRegistry replayRegistry) {
    return new ReplayListenerRegistrar(beanFactory, replayRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public ReplayEngine replayEngine(SyncConfig config,
      EventRecordRepository repository,
      ReplayRegistry replayRegistry,
      ObjectProvider<UnitOfWork> unitOfWorkProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<JsonCodec> jsonCodecProvider) {
    return ReplayEngine.builder()
        .repository(repository)
        .registry(replayRegistry)
        .unitOfWork(unitOfWorkProvider.getIfAvailable(() -> UnitOfWork.NOOP))
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .jsonCodec(jsonCodecProvider.getIfAvailable(JsonCodec::getDefault))
        .defaultBatchSize(config.batchSize())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventReceiver eventReceiver(SyncConfig config,
      EventRecordRepository repository,
      EventProcessor eventProcessor,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return new EventReceiver(config, repository, eventProcessor,
        metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
  }

  @Bean
  @ConditionalOnMissingBean
  public EventFeed eventFeed(SyncConfig config, EventRecordRepository repository,
      ObjectProvider<JsonCodec> jsonCodecProvider) {
    return new EventFeed(config, repository,
        jsonCodecProvider.getIfAvailable(JsonCodec::getDefault));
  }
}
