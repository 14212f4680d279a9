package socialpublish.publish;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate result of {@link PublishOrchestrator#broadcastPost}.
 *
 * <ul>
 *   <li>{@link Published}: every target succeeded (or there were none)</li>
 *   <li>{@link Rejected}: pre-flight validation failed; nothing was attempted or stored</li>
 *   <li>{@link CompositeFailure}: at least one target failed; reports cover every target</li>
 * </ul>
 */
public sealed interface PublishResult
    permits PublishResult.Published, PublishResult.Rejected, PublishResult.CompositeFailure {

  int BAD_REQUEST = 400;
  int SERVICE_UNAVAILABLE = 503;

  /**
   * HTTP-style status for the whole broadcast.
   */
  int status();

  /**
   * @param responses per-target responses keyed by normalized target name, in request order
   */
  record Published(Map<String, PlatformResponse> responses) implements PublishResult {
    public Published {
      responses = Collections.unmodifiableMap(new LinkedHashMap<>(responses));
    }

    public static Published empty() {
      return new Published(Map.of());
    }

    @Override
    public int status() {
      return 200;
    }
  }

  record Rejected(String message) implements PublishResult {
    public Rejected {
      Objects.requireNonNull(message, "message");
    }

    @Override
    public int status() {
      return BAD_REQUEST;
    }
  }

  /**
   * @param message summary naming the failed targets
   * @param reports one report per attempted target, successes included, in request order
   */
  record CompositeFailure(String message, List<TargetReport> reports) implements PublishResult {
    public CompositeFailure {
      Objects.requireNonNull(message, "message");
      reports = List.copyOf(reports);
    }

    @Override
    public int status() {
      return SERVICE_UNAVAILABLE;
    }

    public List<TargetReport> failures() {
      return reports.stream().filter(report -> !report.succeeded()).toList();
    }
  }
}
