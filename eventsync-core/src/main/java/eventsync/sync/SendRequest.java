package eventsync.sync;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Parameters of one send.
 */
public final class SendRequest {
  private final Set<String> eventTypes;
  private final Instant since;
  private final Integer limit;
  private final boolean dryRun;

  private SendRequest(Builder builder) {
    if (builder.limit != null && builder.limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    this.eventTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.eventTypes));
    this.since = builder.since;
    this.limit = builder.limit;
    this.dryRun = builder.dryRun;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Set<String> eventTypes() {
    return eventTypes;
  }

  /** Inclusive lower bound on record creation time, {@code null} for none. */
  public Instant since() {
    return since;
  }

  /** Batch limit, {@code null} to use the configured batch size. */
  public Integer limit() {
    return limit;
  }

  public boolean dryRun() {
    return dryRun;
  }

  /** Builder for {@link SendRequest}. */
  public static final class Builder {
    private final Set<String> eventTypes = new LinkedHashSet<>();
    private Instant since;
    private Integer limit;
    private boolean dryRun;

    private Builder() {
    }

    public Builder eventTypes(Set<String> types) {
      if (types != null) {
        types.forEach(this::eventType);
      }
      return this;
    }

    public Builder eventType(String type) {
      if (type != null && !type.isBlank()) {
        eventTypes.add(type.trim());
      }
      return this;
    }

    public Builder since(Instant since) {
      this.since = since;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder dryRun(boolean dryRun) {
      this.dryRun = dryRun;
      return this;
    }

    public SendRequest build() {
      return new SendRequest(this);
    }
  }
}
