package eventsync.store;

import eventsync.model.OperationLogEntry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sync summary: the last successful pull and the number of stored records.
 *
 * @param lastPull          the newest successful pull entry, {@code null} if none
 * @param totalSyncedEvents number of stored records
 */
public record SyncStatus(OperationLogEntry lastPull, long totalSyncedEvents) {

  /**
   * Returns the summary in wire shape:
   * {@code {last_pull: {timestamp, events_count} | null, total_synced_events}}.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    if (lastPull == null) {
      map.put("last_pull", null);
    } else {
      Map<String, Object> pull = new LinkedHashMap<>();
      pull.put("timestamp", lastPull.timestamp().toString());
      pull.put("events_count", lastPull.eventsCount());
      map.put("last_pull", pull);
    }
    map.put("total_synced_events", totalSyncedEvents);
    return map;
  }
}
