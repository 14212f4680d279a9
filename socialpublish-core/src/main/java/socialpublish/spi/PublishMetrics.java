package socialpublish.spi;

/**
 * Observability hook for broadcast counters and timings.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to
 * bridge into Micrometer or another monitoring system.
 */
public interface PublishMetrics {

  /**
   * No-op instance that discards all metrics.
   */
  PublishMetrics NOOP = new Noop();

  /**
   * Counts a target attempt that succeeded.
   *
   * @param target normalized target name
   */
  void incrementTargetSuccess(String target);

  /**
   * Counts a target attempt that failed, including unconfigured targets.
   *
   * @param target normalized target name
   */
  void incrementTargetFailure(String target);

  /**
   * Counts a broadcast rejected by pre-flight validation.
   */
  void incrementRejected();

  /**
   * Records the wall-clock duration of one broadcast, from validation to aggregation.
   *
   * @param durationMs duration in milliseconds (never negative)
   */
  default void recordBroadcastDurationMs(long durationMs) {
  }

  final class Noop implements PublishMetrics {
    private Noop() {
    }

    @Override
    public void incrementTargetSuccess(String target) {
    }

    @Override
    public void incrementTargetFailure(String target) {
    }

    @Override
    public void incrementRejected() {
    }
  }
}
