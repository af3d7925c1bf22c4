package eventsync.receive;

import com.fasterxml.jackson.annotation.JsonProperty;
import eventsync.SyncConfig;

/**
 * Payload of the status endpoint.
 */
public record StatusReport(
    @JsonProperty("status") String status,
    @JsonProperty("version") String version,
    @JsonProperty("app_name") String appName,
    @JsonProperty("sync_type") String syncType
) {
  public static final String ONLINE = "online";

  public static StatusReport of(SyncConfig config) {
    return new StatusReport(ONLINE, SyncConfig.VERSION, config.appName(), config.syncType());
  }
}
