/**
 * Event type filtering driven by include/exclude configuration.
 */
package eventsync.filter;
