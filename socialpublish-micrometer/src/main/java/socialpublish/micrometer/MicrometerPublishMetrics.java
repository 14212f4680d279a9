package socialpublish.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import socialpublish.spi.PublishMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link PublishMetrics}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code socialpublish.publish.success} (tag {@code target}): target attempts that succeeded</li>
 *   <li>{@code socialpublish.publish.failure} (tag {@code target}): target attempts that failed</li>
 *   <li>{@code socialpublish.publish.rejected}: broadcasts rejected before dispatch</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code socialpublish.broadcast.duration}: wall-clock time of one broadcast</li>
 * </ul>
 *
 * @see PublishMetrics
 */
public final class MicrometerPublishMetrics implements PublishMetrics, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter rejected;
  private final Timer broadcastDuration;
  private final Map<String, Counter> successByTarget = new ConcurrentHashMap<>();
  private final Map<String, Counter> failureByTarget = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates metrics with the default name prefix {@code "socialpublish"}.
   */
  public MicrometerPublishMetrics(MeterRegistry registry) {
    this(registry, "socialpublish");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "blog.socialpublish"})
   */
  public MicrometerPublishMetrics(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.rejected = Counter.builder(namePrefix + ".publish.rejected")
        .description("Broadcasts rejected by pre-flight validation")
        .register(registry);
    this.broadcastDuration = Timer.builder(namePrefix + ".broadcast.duration")
        .description("Wall-clock time of one broadcast")
        .register(registry);
  }

  @Override
  public void incrementTargetSuccess(String target) {
    if (closed) return;
    successByTarget.computeIfAbsent(target, t -> Counter.builder(namePrefix + ".publish.success")
        .description("Target attempts that succeeded")
        .tag("target", t)
        .register(registry)).increment();
  }

  @Override
  public void incrementTargetFailure(String target) {
    if (closed) return;
    failureByTarget.computeIfAbsent(target, t -> Counter.builder(namePrefix + ".publish.failure")
        .description("Target attempts that failed")
        .tag("target", t)
        .register(registry)).increment();
  }

  @Override
  public void incrementRejected() {
    if (closed) return;
    rejected.increment();
  }

  @Override
  public void recordBroadcastDurationMs(long durationMs) {
    if (closed) return;
    broadcastDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this instance from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(rejected, broadcastDuration));
    meters.addAll(successByTarget.values());
    meters.addAll(failureByTarget.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
