package eventsync.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Selection criteria for stored events.
 *
 * <p>All criteria are optional; an empty query selects every record, oldest first, up to
 * {@link #DEFAULT_LIMIT}. The keyset cursor ({@link Builder#after}) selects records strictly
 * after a given ({@code syncedAt}, {@code sequence}) position and is what lets replay walk
 * through the table without revisiting rows it deliberately skipped.
 */
public final class EventQuery {
  public static final int DEFAULT_LIMIT = 100;

  /** Result ordering by creation time. */
  public enum Order {
    OLDEST_FIRST,
    NEWEST_FIRST
  }

  private final Set<String> eventTypes;
  private final Instant since;
  private final Boolean replayed;
  private final Instant afterSyncedAt;
  private final long afterSequence;
  private final int limit;
  private final Order order;

  private EventQuery(Builder builder) {
    if (builder.limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    this.eventTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.eventTypes));
    this.since = builder.since;
    this.replayed = builder.replayed;
    this.afterSyncedAt = builder.afterSyncedAt;
    this.afterSequence = builder.afterSequence;
    this.limit = builder.limit;
    this.order = builder.order;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Set<String> eventTypes() {
    return eventTypes;
  }

  public Instant since() {
    return since;
  }

  /**
   * Replay-state filter: {@code null} for any, {@code false} for pending records only,
   * {@code true} for replayed records only.
   */
  public Boolean replayed() {
    return replayed;
  }

  public Instant afterSyncedAt() {
    return afterSyncedAt;
  }

  public long afterSequence() {
    return afterSequence;
  }

  public int limit() {
    return limit;
  }

  public Order order() {
    return order;
  }

  /** Builder for {@link EventQuery}. */
  public static final class Builder {
    private final Set<String> eventTypes = new LinkedHashSet<>();
    private Instant since;
    private Boolean replayed;
    private Instant afterSyncedAt;
    private long afterSequence;
    private int limit = DEFAULT_LIMIT;
    private Order order = Order.OLDEST_FIRST;

    private Builder() {
    }

    public Builder eventTypes(Set<String> types) {
      if (types != null) {
        for (String type : types) {
          if (type != null && !type.isBlank()) {
            eventTypes.add(type.trim());
          }
        }
      }
      return this;
    }

    public Builder eventType(String type) {
      if (type != null && !type.isBlank()) {
        eventTypes.add(type.trim());
      }
      return this;
    }

    /** Inclusive lower bound on creation time. */
    public Builder since(Instant since) {
      this.since = since;
      return this;
    }

    public Builder replayed(Boolean replayed) {
      this.replayed = replayed;
      return this;
    }

    public Builder pendingReplayOnly() {
      return replayed(Boolean.FALSE);
    }

    /** Exclusive keyset cursor. */
    public Builder after(Instant syncedAt, long sequence) {
      this.afterSyncedAt = Objects.requireNonNull(syncedAt, "syncedAt");
      this.afterSequence = sequence;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder order(Order order) {
      this.order = Objects.requireNonNull(order, "order");
      return this;
    }

    public EventQuery build() {
      return new EventQuery(this);
    }
  }
}
