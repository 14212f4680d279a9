package socialpublish.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerPublishMetricsTest {

  private SimpleMeterRegistry registry;
  private MicrometerPublishMetrics metrics;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    metrics = new MicrometerPublishMetrics(registry);
  }

  @Test
  void successCountedPerTarget() {
    metrics.incrementTargetSuccess("mastodon");
    metrics.incrementTargetSuccess("mastodon");
    metrics.incrementTargetSuccess("bluesky");

    assertEquals(2.0, counter("socialpublish.publish.success", "mastodon").count());
    assertEquals(1.0, counter("socialpublish.publish.success", "bluesky").count());
  }

  @Test
  void failureCountedPerTarget() {
    metrics.incrementTargetFailure("twitter");
    assertEquals(1.0, counter("socialpublish.publish.failure", "twitter").count());
    assertNull(registry.find("socialpublish.publish.success").counter());
  }

  @Test
  void rejectedCounted() {
    metrics.incrementRejected();
    metrics.incrementRejected();
    Counter rejected = registry.find("socialpublish.publish.rejected").counter();
    assertNotNull(rejected);
    assertEquals(2.0, rejected.count());
  }

  @Test
  void broadcastDurationRecorded() {
    metrics.recordBroadcastDurationMs(120);
    metrics.recordBroadcastDurationMs(80);

    Timer timer = registry.find("socialpublish.broadcast.duration").timer();
    assertNotNull(timer);
    assertEquals(2, timer.count());
    assertEquals(200.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerPublishMetrics(registry, "blog.socialpublish");
    custom.incrementTargetSuccess("feed");
    assertEquals(1.0, counter("blog.socialpublish.publish.success", "feed").count());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerPublishMetrics(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerPublishMetrics(registry, "app."));
    assertThrows(NullPointerException.class, () -> new MicrometerPublishMetrics(null));
  }

  @Test
  void closeRemovesMetersAndStopsRecording() {
    metrics.incrementTargetSuccess("mastodon");
    metrics.incrementTargetFailure("bluesky");

    metrics.close();

    assertNull(registry.find("socialpublish.publish.success").counter());
    assertNull(registry.find("socialpublish.publish.failure").counter());
    assertNull(registry.find("socialpublish.publish.rejected").counter());
    assertNull(registry.find("socialpublish.broadcast.duration").timer());

    metrics.incrementTargetSuccess("mastodon");
    assertNull(registry.find("socialpublish.publish.success").counter());
  }

  private Counter counter(String name, String target) {
    Counter c = registry.find(name).tag("target", target).counter();
    assertNotNull(c, "Counter not found: " + name + " target=" + target);
    return c;
  }
}
