/**
 * Replay of stored events into the event-sourcing runtime.
 *
 * <p>{@link eventsync.replay.ReplayRegistry} maps event types to a
 * {@link eventsync.replay.PayloadBinder} and {@link eventsync.replay.ReplayHandler};
 * {@link eventsync.replay.ReplayEngine} walks pending records in batches, commits a
 * {@link eventsync.spi.UnitOfWork} and marks them replayed.
 */
package eventsync.replay;
