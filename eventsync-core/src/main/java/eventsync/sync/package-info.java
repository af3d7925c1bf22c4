/**
 * Pull and send against remote peers.
 *
 * <p>{@link eventsync.sync.SyncOrchestrator} is the entry point. Pull fetches a batch from the
 * source, filters and deduplicates it and stores new events; send selects stored events and
 * posts them to the destination. Each non-empty, non-dry-run operation writes one entry to
 * the operation log.
 */
package eventsync.sync;
