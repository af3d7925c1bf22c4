/**
 * Validation and normalization of inbound events.
 *
 * @see eventsync.processor.EventProcessor
 */
package eventsync.processor;
