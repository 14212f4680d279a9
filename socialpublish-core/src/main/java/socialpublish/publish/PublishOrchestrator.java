package socialpublish.publish;

import socialpublish.spi.PublishMetrics;
import socialpublish.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Fans one logical post out to every requested target and aggregates the outcomes.
 *
 * <p>A broadcast proceeds in four steps:
 * <ol>
 *   <li>Target names are lower-cased and de-duplicated, keeping first-seen order.</li>
 *   <li>The request is validated as a whole; a violation returns
 *       {@link PublishResult.Rejected} before any target runs.</li>
 *   <li>Every target is attempted independently on a bounded worker pool. Unknown or
 *       unconfigured targets, thrown exceptions and timeouts become failures; no
 *       failure stops the other attempts, and nothing is retried.</li>
 *   <li>Outcomes are collected in request order into either
 *       {@link PublishResult.Published} or {@link PublishResult.CompositeFailure}.</li>
 * </ol>
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} to release its worker pool.
 */
public final class PublishOrchestrator implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PublishOrchestrator.class.getName());

  private final TargetRegistry registry;
  private final RequestValidator validator;
  private final PublishMetrics metrics;
  private final ExecutorService workers;
  private final long targetTimeoutMs;

  private PublishOrchestrator(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    PublishConfig config = builder.config != null ? builder.config : new PublishConfig();
    this.validator = new RequestValidator(config);
    this.metrics = builder.metrics != null ? builder.metrics : PublishMetrics.NOOP;
    this.targetTimeoutMs = config.getTargetTimeoutMs();
    this.workers = Executors.newFixedThreadPool(config.getMaxConcurrency(),
        new DaemonThreadFactory("socialpublish-publish-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Broadcasts {@code request} on behalf of {@code ownerId}.
   *
   * <p>Never throws for a target failure; those are reported in the result. If the
   * calling thread is interrupted while waiting, in-flight attempts are cancelled and
   * no partial result is returned.
   *
   * @param ownerId account publishing the post, supplied by the auth layer
   * @param request the post and its targets
   * @return the aggregate result
   * @throws InterruptedException if interrupted while waiting for targets
   */
  public PublishResult broadcastPost(UUID ownerId, NewPostRequest request) throws InterruptedException {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(request, "request");
    long startNanos = System.nanoTime();
    try {
      List<String> targets = normalizeTargets(request.targets());
      if (targets.isEmpty()) {
        return PublishResult.Published.empty();
      }

      Optional<String> invalid = validator.validate(request, targets);
      if (invalid.isPresent()) {
        metrics.incrementRejected();
        logger.fine("Broadcast rejected: " + invalid.get());
        return new PublishResult.Rejected(invalid.get());
      }

      PublishCommand command = new PublishCommand(ownerId, request.messages(), request.language(), targets);
      List<TargetReport> reports = dispatchAll(targets, command);
      return aggregate(reports);
    } finally {
      metrics.recordBroadcastDurationMs(
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }
  }

  static List<String> normalizeTargets(List<String> requested) {
    if (requested == null) {
      return List.of();
    }
    Set<String> normalized = new LinkedHashSet<>();
    for (String target : requested) {
      if (target == null || target.isBlank()) {
        continue;
      }
      normalized.add(target.trim().toLowerCase(Locale.ROOT));
    }
    return List.copyOf(normalized);
  }

  private List<TargetReport> dispatchAll(List<String> targets, PublishCommand command)
      throws InterruptedException {
    List<Future<PublishOutcome>> futures = new ArrayList<>(targets.size());
    for (String target : targets) {
      futures.add(workers.submit(() -> attempt(target, command)));
    }

    List<TargetReport> reports = new ArrayList<>(targets.size());
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(targetTimeoutMs);
    try {
      for (int i = 0; i < targets.size(); i++) {
        String target = targets.get(i);
        PublishOutcome outcome = await(target, futures.get(i), deadline);
        record(target, outcome);
        reports.add(new TargetReport(target, outcome));
      }
    } catch (InterruptedException e) {
      for (Future<PublishOutcome> future : futures) {
        future.cancel(true);
      }
      throw e;
    }
    return reports;
  }

  private PublishOutcome await(String target, Future<PublishOutcome> future, long deadline)
      throws InterruptedException {
    long remaining = Math.max(0L, deadline - System.nanoTime());
    try {
      return future.get(remaining, TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      return PublishOutcome.failure(504, target,
          "Publishing to " + RequestValidator.displayName(target) + " timed out");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      logger.log(Level.WARNING, "Target " + target + " failed outside its attempt", cause);
      return PublishOutcome.failure(500, target, "Failed to publish: " + cause.getMessage());
    }
  }

  private PublishOutcome attempt(String target, PublishCommand command) {
    Optional<PublishTarget> resolved = registry.find(target);
    if (resolved.isEmpty() || !resolved.get().isConfigured()) {
      return PublishOutcome.failure(PublishResult.SERVICE_UNAVAILABLE, target,
          RequestValidator.displayName(target) + " integration not configured");
    }
    try {
      PublishOutcome outcome = resolved.get().publish(command);
      if (outcome == null) {
        return PublishOutcome.failure(500, target, "Target returned no outcome");
      }
      return outcome;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return PublishOutcome.failure(500, target, "Publishing was interrupted");
    } catch (Exception e) {
      logger.log(Level.WARNING, "Target " + target + " threw while publishing", e);
      return PublishOutcome.failure(500, target, "Failed to publish: " + e.getMessage());
    }
  }

  private void record(String target, PublishOutcome outcome) {
    if (outcome instanceof PublishOutcome.Success) {
      metrics.incrementTargetSuccess(target);
    } else if (outcome instanceof PublishOutcome.Failure failure) {
      metrics.incrementTargetFailure(target);
      logger.warning("Publishing to " + target + " failed (" + failure.error().status() + "): "
          + failure.error().message());
    }
  }

  private static PublishResult aggregate(List<TargetReport> reports) {
    List<TargetReport> failed = reports.stream().filter(report -> !report.succeeded()).toList();
    if (!failed.isEmpty()) {
      String names = failed.stream().map(TargetReport::target).collect(Collectors.joining(", "));
      return new PublishResult.CompositeFailure("Failed to create post via " + names + ".", reports);
    }
    Map<String, PlatformResponse> responses = new LinkedHashMap<>();
    for (TargetReport report : reports) {
      responses.put(report.target(), ((PublishOutcome.Success) report.outcome()).response());
    }
    return new PublishResult.Published(responses);
  }

  /**
   * Stops the worker pool, cancelling attempts that are still running.
   */
  @Override
  public void close() {
    workers.shutdownNow();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.warning("Publish workers did not terminate within 5s");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  public static final class Builder {
    private TargetRegistry registry;
    private PublishConfig config;
    private PublishMetrics metrics;

    private Builder() {
    }

    public Builder targetRegistry(TargetRegistry registry) {
      this.registry = registry;
      return this;
    }

    public Builder config(PublishConfig config) {
      this.config = config;
      return this;
    }

    public Builder metrics(PublishMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    public PublishOrchestrator build() {
      return new PublishOrchestrator(this);
    }
  }
}
