package eventsync.replay;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Parameters of one replay run.
 */
public final class ReplayRequest {
  private final Instant since;
  private final Set<String> eventTypes;
  private final Integer limit;
  private final boolean dryRun;
  private final boolean continueUntilExhausted;

  private ReplayRequest(Builder builder) {
    if (builder.limit != null && builder.limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    this.since = builder.since;
    this.eventTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.eventTypes));
    this.limit = builder.limit;
    this.dryRun = builder.dryRun;
    this.continueUntilExhausted = builder.continueUntilExhausted;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Instant since() {
    return since;
  }

  public Set<String> eventTypes() {
    return eventTypes;
  }

  /** Batch size, {@code null} for the engine default. */
  public Integer limit() {
    return limit;
  }

  public boolean dryRun() {
    return dryRun;
  }

  public boolean continueUntilExhausted() {
    return continueUntilExhausted;
  }

  /** Builder for {@link ReplayRequest}. */
  public static final class Builder {
    private Instant since;
    private final Set<String> eventTypes = new LinkedHashSet<>();
    private Integer limit;
    private boolean dryRun;
    private boolean continueUntilExhausted;

    private Builder() {
    }

    /** Inclusive lower bound on record creation time. */
    public Builder since(Instant since) {
      this.since = since;
      return this;
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

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder dryRun(boolean dryRun) {
      this.dryRun = dryRun;
      return this;
    }

    /** Keeps fetching batches until none remain. */
    public Builder continueUntilExhausted(boolean continueUntilExhausted) {
      this.continueUntilExhausted = continueUntilExhausted;
      return this;
    }

    public ReplayRequest build() {
      return new ReplayRequest(this);
    }
  }
}
