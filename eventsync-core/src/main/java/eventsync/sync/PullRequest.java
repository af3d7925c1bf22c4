package eventsync.sync;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Parameters of one pull.
 */
public final class PullRequest {
  private final Instant since;
  private final Set<String> eventTypes;
  private final Integer limit;
  private final boolean dryRun;
  private final boolean breakdown;

  private PullRequest(Builder builder) {
    if (builder.limit != null && builder.limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    this.since = builder.since;
    this.eventTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.eventTypes));
    this.limit = builder.limit;
    this.dryRun = builder.dryRun;
    this.breakdown = builder.breakdown;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Lower bound passed to the source, {@code null} for none. */
  public Instant since() {
    return since;
  }

  /** Types requested from the source; empty for all. */
  public Set<String> eventTypes() {
    return eventTypes;
  }

  /** Batch limit, {@code null} to use the configured batch size. */
  public Integer limit() {
    return limit;
  }

  public boolean dryRun() {
    return dryRun;
  }

  public boolean breakdown() {
    return breakdown;
  }

  /** Builder for {@link PullRequest}. */
  public static final class Builder {
    private Instant since;
    private final Set<String> eventTypes = new LinkedHashSet<>();
    private Integer limit;
    private boolean dryRun;
    private boolean breakdown;

    private Builder() {
    }

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

    /** Requests a per-type count of processed events in the result. */
    public Builder breakdown(boolean breakdown) {
      this.breakdown = breakdown;
      return this;
    }

    public PullRequest build() {
      return new PullRequest(this);
    }
  }
}
