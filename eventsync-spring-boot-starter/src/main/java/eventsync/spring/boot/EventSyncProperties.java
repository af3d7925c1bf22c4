package eventsync.spring.boot;

import eventsync.SyncConfig;
import eventsync.filter.EventFilter;
import eventsync.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the event sync bridge.
 *
 * <p>Relaxed binding also reads environment variables such as {@code EVENTSYNC_SOURCE_URL}.
 *
 * @see EventSyncAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventsync")
public class EventSyncProperties {

    /**
     * Pull endpoint of the source peer.
     */
    private String sourceUrl;

    /**
     * Bearer token presented to the source.
     */
    private String apiToken;

    /**
     * Receive endpoint of the destination peer.
     */
    private String destinationUrl;

    /**
     * Key presented to the destination. Also accepted by the receive and feed endpoints
     * unless {@link #receiveKey} is set.
     */
    private String apiKey;

    /**
     * Key that inbound receive and feed requests must present.
     */
    private String receiveKey;

    /**
     * Event types to accept; {@code *} accepts all.
     */
    private List<String> includeEvents = new ArrayList<>(List.of(EventFilter.WILDCARD));

    /**
     * Event types to reject. Exclusion wins over inclusion.
     */
    private List<String> excludeEvents = new ArrayList<>();

    private int batchSize = SyncConfig.DEFAULT_BATCH_SIZE;

    private int retryAttempts = SyncConfig.DEFAULT_RETRY_ATTEMPTS;

    private Duration requestTimeout = SyncConfig.DEFAULT_REQUEST_TIMEOUT;

    private String appUrl;

    private String appName = SyncConfig.DEFAULT_APP_NAME;

    /**
     * Role reported by the status endpoint.
     */
    private String syncType = SyncConfig.DEFAULT_SYNC_TYPE;

    private final Schema schema = new Schema();
    private final Metrics metrics = new Metrics();
    private final Web web = new Web();

    public String getSourceUrl() {
        return sourceUrl;
    }

    public void setSourceUrl(String sourceUrl) {
        this.sourceUrl = sourceUrl;
    }

    public String getApiToken() {
        return apiToken;
    }

    public void setApiToken(String apiToken) {
        this.apiToken = apiToken;
    }

    public String getDestinationUrl() {
        return destinationUrl;
    }

    public void setDestinationUrl(String destinationUrl) {
        this.destinationUrl = destinationUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getReceiveKey() {
        return receiveKey;
    }

    public void setReceiveKey(String receiveKey) {
        this.receiveKey = receiveKey;
    }

    public List<String> getIncludeEvents() {
        return includeEvents;
    }

    public void setIncludeEvents(List<String> includeEvents) {
        this.includeEvents = includeEvents;
    }

    public List<String> getExcludeEvents() {
        return excludeEvents;
    }

    public void setExcludeEvents(List<String> excludeEvents) {
        this.excludeEvents = excludeEvents;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public void setRetryAttempts(int retryAttempts) {
        this.retryAttempts = retryAttempts;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public String getAppUrl() {
        return appUrl;
    }

    public void setAppUrl(String appUrl) {
        this.appUrl = appUrl;
    }

    public String getAppName() {
        return appName;
    }

    public void setAppName(String appName) {
        this.appName = appName;
    }

    public String getSyncType() {
        return syncType;
    }

    public void setSyncType(String syncType) {
        this.syncType = syncType;
    }

    public Schema getSchema() {
        return schema;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Web getWeb() {
        return web;
    }

    /**
     * Converts these properties to the core configuration.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public SyncConfig toSyncConfig() {
        return SyncConfig.builder()
                .sourceUrl(sourceUrl)
                .sourceToken(apiToken)
                .destinationUrl(destinationUrl)
                .destinationKey(apiKey)
                .receiveKey(receiveKey)
                .eventFilter(EventFilter.of(
                        includeEvents == null ? List.of(EventFilter.WILDCARD) : includeEvents,
                        excludeEvents == null ? List.of() : excludeEvents))
                .batchSize(batchSize)
                .retryAttempts(retryAttempts)
                .requestTimeout(requestTimeout)
                .appUrl(appUrl)
                .appName(appName)
                .syncType(syncType)
                .build();
    }

    public static class Schema {
        /**
         * Create the sync tables at startup if they are absent.
         */
        private boolean provision = false;

        /**
         * Fail startup when a sync table or column is missing.
         */
        private boolean verify = true;

        private String eventTable = TableNames.DEFAULT_EVENT_TABLE;

        private String logTable = TableNames.DEFAULT_LOG_TABLE;

        public boolean isProvision() {
            return provision;
        }

        public void setProvision(boolean provision) {
            this.provision = provision;
        }

        public boolean isVerify() {
            return verify;
        }

        public void setVerify(boolean verify) {
            this.verify = verify;
        }

        public String getEventTable() {
            return eventTable;
        }

        public void setEventTable(String eventTable) {
            this.eventTable = eventTable;
        }

        public String getLogTable() {
            return logTable;
        }

        public void setLogTable(String logTable) {
            this.logTable = logTable;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventsync";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }

    public static class Web {
        /**
         * Expose the feed, receive and status endpoints.
         */
        private boolean enabled = true;

        private String basePath = "/api/event-sync";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBasePath() {
            return basePath;
        }

        public void setBasePath(String basePath) {
            this.basePath = basePath;
        }
    }
}
