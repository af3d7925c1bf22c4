/**
 * Persistent and query model: {@link eventsync.model.SyncedEvent} records,
 * {@link eventsync.model.OperationLogEntry} audit entries and {@link eventsync.model.EventQuery}.
 */
package eventsync.model;
