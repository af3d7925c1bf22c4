/**
 * Root API for event sync: a point-to-point bridge that pulls domain events from a remote
 * event-sourced application, stores each remote event at most once, forwards stored events
 * to a destination, and replays them into the local runtime.
 *
 * <h2>Core Design</h2>
 * <p>The {@linkplain eventsync.sync.SyncOrchestrator orchestrator} pulls a batch of
 * {@link eventsync.RawEvent}s from the source peer, runs each one through the
 * {@linkplain eventsync.processor.EventProcessor processor} (type validation and
 * {@linkplain eventsync.filter.EventFilter include/exclude filtering}) and stores it through the
 * {@linkplain eventsync.store.EventRecordRepository repository}, which skips records whose
 * ({@code event_id}, {@code source_url}) pair already exists. Every pull, send and replay is
 * summarized by one {@linkplain eventsync.model.OperationLogEntry operation log entry}.
 *
 * <p>Storage and replay are tracked separately: a stored record stays pending until the
 * {@linkplain eventsync.replay.ReplayEngine replay engine} has invoked its handler and the
 * {@link eventsync.spi.UnitOfWork} has committed, at which point the record is marked
 * replayed and never selected again.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>eventsync-core</b> - orchestrator, replay engine, filter, processor, SPIs</li>
 *   <li><b>eventsync-jdbc</b> - JDBC stores (H2, MySQL, PostgreSQL) and schema provisioning</li>
 *   <li><b>eventsync-micrometer</b> - Micrometer metrics bridge</li>
 *   <li><b>eventsync-spring-boot-starter</b> - auto-configuration and REST endpoints</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * SyncConfig config = SyncConfig.fromEnvironment(System.getenv());
 * ConnectionProvider connections = dataSource::getConnection;
 * EventRecordRepository records = new EventRecordRepository(
 *     connections, JdbcSyncedEventStores.detect(dataSource), new OperationLog(connections, logStore));
 *
 * SyncOrchestrator orchestrator = SyncOrchestrator.builder()
 *     .config(config)
 *     .repository(records)
 *     .peerClient(new HttpPeerClient())
 *     .build();
 *
 * PullResult result = orchestrator.pull(PullRequest.builder().limit(100).build());
 * }</pre>
 */
package eventsync;
