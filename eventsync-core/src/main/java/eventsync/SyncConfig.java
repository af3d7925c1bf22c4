package eventsync;

import eventsync.filter.EventFilter;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable configuration for the sync bridge.
 *
 * <p>Build programmatically with {@link #builder()} or read from environment variables with
 * {@link #fromEnvironment(Map)}:
 *
 * <table>
 *   <caption>Environment variables</caption>
 *   <tr><th>Variable</th><th>Meaning</th><th>Default</th></tr>
 *   <tr><td>{@code EVENT_SYNC_SOURCE_URL}</td><td>pull endpoint</td><td>none</td></tr>
 *   <tr><td>{@code EVENT_SYNC_API_TOKEN}</td><td>bearer token for pull</td><td>none</td></tr>
 *   <tr><td>{@code EVENT_SYNC_DESTINATION_URL}</td><td>send endpoint</td><td>none</td></tr>
 *   <tr><td>{@code EVENT_SYNC_API_KEY}</td><td>send key; also accepted by receive and feed</td><td>none</td></tr>
 *   <tr><td>{@code EVENT_SYNC_INCLUDE_EVENTS}</td><td>comma list or {@code *}</td><td>{@code *}</td></tr>
 *   <tr><td>{@code EVENT_SYNC_EXCLUDE_EVENTS}</td><td>comma list</td><td>empty</td></tr>
 *   <tr><td>{@code EVENT_SYNC_BATCH_SIZE}</td><td>default batch limit</td><td>100</td></tr>
 *   <tr><td>{@code EVENT_SYNC_RETRY_ATTEMPTS}</td><td>advisory retry count</td><td>3</td></tr>
 *   <tr><td>{@code EVENT_SYNC_APP_URL}</td><td>this application's URL</td><td>none</td></tr>
 *   <tr><td>{@code EVENT_SYNC_APP_NAME}</td><td>this application's name</td><td>{@code event-sync}</td></tr>
 *   <tr><td>{@code EVENT_SYNC_TYPE}</td><td>role reported by the status endpoint</td><td>{@code destination}</td></tr>
 * </table>
 */
public final class SyncConfig {
  public static final String ENV_PREFIX = "EVENT_SYNC_";
  public static final int DEFAULT_BATCH_SIZE = 100;
  public static final int DEFAULT_RETRY_ATTEMPTS = 3;
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
  public static final String DEFAULT_APP_NAME = "event-sync";
  public static final String DEFAULT_SYNC_TYPE = "destination";
  public static final String VERSION = "1.0";

  private final String sourceUrl;
  private final String sourceToken;
  private final String destinationUrl;
  private final String destinationKey;
  private final String receiveKey;
  private final EventFilter eventFilter;
  private final int batchSize;
  private final int retryAttempts;
  private final Duration requestTimeout;
  private final String appUrl;
  private final String appName;
  private final String syncType;

  private SyncConfig(Builder builder) {
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.retryAttempts < 0) {
      throw new IllegalArgumentException("retryAttempts must be >= 0");
    }
    Objects.requireNonNull(builder.requestTimeout, "requestTimeout");
    if (builder.requestTimeout.isZero() || builder.requestTimeout.isNegative()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
    this.sourceUrl = blankToNull(builder.sourceUrl);
    this.sourceToken = blankToNull(builder.sourceToken);
    this.destinationUrl = blankToNull(builder.destinationUrl);
    this.destinationKey = blankToNull(builder.destinationKey);
    this.receiveKey = builder.receiveKey != null
        ? blankToNull(builder.receiveKey) : this.destinationKey;
    this.eventFilter = builder.eventFilter != null ? builder.eventFilter : EventFilter.allowAll();
    this.batchSize = builder.batchSize;
    this.retryAttempts = builder.retryAttempts;
    this.requestTimeout = builder.requestTimeout;
    this.appUrl = blankToNull(builder.appUrl);
    this.appName = builder.appName == null || builder.appName.isBlank()
        ? DEFAULT_APP_NAME : builder.appName;
    this.syncType = builder.syncType == null || builder.syncType.isBlank()
        ? DEFAULT_SYNC_TYPE : builder.syncType;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads configuration from environment-style variables (see class docs).
   *
   * @param env variables, typically {@code System.getenv()}
   * @return the configuration
   * @throws IllegalArgumentException if a numeric variable is not a valid number
   */
  public static SyncConfig fromEnvironment(Map<String, String> env) {
    Objects.requireNonNull(env, "env");
    return builder()
        .sourceUrl(env.get(ENV_PREFIX + "SOURCE_URL"))
        .sourceToken(env.get(ENV_PREFIX + "API_TOKEN"))
        .destinationUrl(env.get(ENV_PREFIX + "DESTINATION_URL"))
        .destinationKey(env.get(ENV_PREFIX + "API_KEY"))
        .eventFilter(EventFilter.parse(
            env.getOrDefault(ENV_PREFIX + "INCLUDE_EVENTS", EventFilter.WILDCARD),
            env.get(ENV_PREFIX + "EXCLUDE_EVENTS")))
        .batchSize(intValue(env, ENV_PREFIX + "BATCH_SIZE", DEFAULT_BATCH_SIZE))
        .retryAttempts(intValue(env, ENV_PREFIX + "RETRY_ATTEMPTS", DEFAULT_RETRY_ATTEMPTS))
        .appUrl(env.get(ENV_PREFIX + "APP_URL"))
        .appName(env.get(ENV_PREFIX + "APP_NAME"))
        .syncType(env.get(ENV_PREFIX + "TYPE"))
        .build();
  }

  public String sourceUrl() {
    return sourceUrl;
  }

  public String sourceToken() {
    return sourceToken;
  }

  public String destinationUrl() {
    return destinationUrl;
  }

  public String destinationKey() {
    return destinationKey;
  }

  /**
   * Key that inbound receive and feed requests must present. Defaults to the destination key.
   */
  public String receiveKey() {
    return receiveKey;
  }

  public EventFilter eventFilter() {
    return eventFilter;
  }

  public Set<String> includeEvents() {
    return eventFilter.include();
  }

  public Set<String> excludeEvents() {
    return eventFilter.exclude();
  }

  public int batchSize() {
    return batchSize;
  }

  /**
   * Retry count carried from configuration. Transfers are not retried automatically;
   * callers that want retries read this value.
   */
  public int retryAttempts() {
    return retryAttempts;
  }

  public Duration requestTimeout() {
    return requestTimeout;
  }

  public String appUrl() {
    return appUrl;
  }

  public String appName() {
    return appName;
  }

  public String syncType() {
    return syncType;
  }

  public boolean hasSource() {
    return sourceUrl != null;
  }

  public boolean hasDestination() {
    return destinationUrl != null && destinationKey != null;
  }

  @Override
  public String toString() {
    return "SyncConfig{sourceUrl=" + sourceUrl
        + ", destinationUrl=" + destinationUrl
        + ", filter=" + eventFilter
        + ", batchSize=" + batchSize
        + ", appName=" + appName + '}';
  }

  private static int intValue(Map<String, String> env, String key, int defaultValue) {
    String raw = env.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " must be an integer but was '" + raw + "'", e);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  /** Builder for {@link SyncConfig}. */
  public static final class Builder {
    private String sourceUrl;
    private String sourceToken;
    private String destinationUrl;
    private String destinationKey;
    private String receiveKey;
    private EventFilter eventFilter;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private int retryAttempts = DEFAULT_RETRY_ATTEMPTS;
    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    private String appUrl;
    private String appName;
    private String syncType;

    private Builder() {
    }

    public Builder sourceUrl(String sourceUrl) {
      this.sourceUrl = sourceUrl;
      return this;
    }

    public Builder sourceToken(String sourceToken) {
      this.sourceToken = sourceToken;
      return this;
    }

    public Builder destinationUrl(String destinationUrl) {
      this.destinationUrl = destinationUrl;
      return this;
    }

    public Builder destinationKey(String destinationKey) {
      this.destinationKey = destinationKey;
      return this;
    }

    /**
     * Overrides the key inbound requests must present. Optional; defaults to the
     * destination key.
     */
    public Builder receiveKey(String receiveKey) {
      this.receiveKey = receiveKey;
      return this;
    }

    public Builder eventFilter(EventFilter eventFilter) {
      this.eventFilter = eventFilter;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder retryAttempts(int retryAttempts) {
      this.retryAttempts = retryAttempts;
      return this;
    }

    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    public Builder appUrl(String appUrl) {
      this.appUrl = appUrl;
      return this;
    }

    public Builder appName(String appName) {
      this.appName = appName;
      return this;
    }

    public Builder syncType(String syncType) {
      this.syncType = syncType;
      return this;
    }

    public SyncConfig build() {
      return new SyncConfig(this);
    }
  }
}
