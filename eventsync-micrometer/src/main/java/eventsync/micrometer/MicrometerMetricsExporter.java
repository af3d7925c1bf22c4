package eventsync.micrometer;

import eventsync.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventsync.pull.stored} - pulled events stored</li>
 *   <li>{@code eventsync.pull.skipped} - pulled events skipped (duplicate or filtered)</li>
 *   <li>{@code eventsync.events.failed} - pulled or received events that failed</li>
 *   <li>{@code eventsync.send.events} - events delivered to the destination</li>
 *   <li>{@code eventsync.send.failures} - failed send operations</li>
 *   <li>{@code eventsync.replay.events} - records replayed</li>
 *   <li>{@code eventsync.replay.failures} - records whose replay handler failed</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code eventsync.peer.request} - duration of pull and send HTTP exchanges</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter pulled;
  private final Counter skipped;
  private final Counter failed;
  private final Counter sent;
  private final Counter sendFailures;
  private final Counter replayed;
  private final Counter replayFailures;
  private final Timer peerRequest;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventsync"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventsync");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.eventsync"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.pulled = Counter.builder(namePrefix + ".pull.stored")
        .description("Pulled events stored")
        .register(registry);
    this.skipped = Counter.builder(namePrefix + ".pull.skipped")
        .description("Pulled events skipped as duplicates or filtered out")
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".events.failed")
        .description("Pulled or received events that failed processing")
        .register(registry);
    this.sent = Counter.builder(namePrefix + ".send.events")
        .description("Events delivered to the destination")
        .register(registry);
    this.sendFailures = Counter.builder(namePrefix + ".send.failures")
        .description("Failed send operations")
        .register(registry);
    this.replayed = Counter.builder(namePrefix + ".replay.events")
        .description("Records replayed")
        .register(registry);
    this.replayFailures = Counter.builder(namePrefix + ".replay.failures")
        .description("Records whose replay handler failed")
        .register(registry);
    this.peerRequest = Timer.builder(namePrefix + ".peer.request")
        .description("Duration of HTTP exchanges with the peer")
        .register(registry);
  }

  @Override
  public void incrementEventsPulled(int count) {
    increment(pulled, count);
  }

  @Override
  public void incrementEventsSkipped(int count) {
    increment(skipped, count);
  }

  @Override
  public void incrementEventsFailed(int count) {
    increment(failed, count);
  }

  @Override
  public void incrementEventsSent(int count) {
    increment(sent, count);
  }

  @Override
  public void incrementSendFailures() {
    increment(sendFailures, 1);
  }

  @Override
  public void incrementEventsReplayed(int count) {
    increment(replayed, count);
  }

  @Override
  public void incrementReplayFailures(int count) {
    increment(replayFailures, count);
  }

  @Override
  public void recordFetchDurationMs(long durationMs) {
    if (closed) return;
    peerRequest.record(Duration.ofMillis(Math.max(0L, durationMs)));
  }

  private void increment(Counter counter, int count) {
    if (closed || count <= 0) return;
    counter.increment(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(pulled, skipped, failed, sent, sendFailures,
        replayed, replayFailures, peerRequest)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
