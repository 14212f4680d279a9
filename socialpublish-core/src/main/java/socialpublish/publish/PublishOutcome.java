package socialpublish.publish;

import java.util.Objects;

/**
 * Result of attempting one target.
 *
 * <ul>
 *   <li>{@link Success}: the platform accepted the post</li>
 *   <li>{@link Failure}: the attempt failed or the target is not configured</li>
 * </ul>
 */
public sealed interface PublishOutcome permits PublishOutcome.Success, PublishOutcome.Failure {

  static Success success(PlatformResponse response) {
    return new Success(response);
  }

  static Failure failure(int status, String module, String message) {
    return new Failure(new PlatformError(status, module, message));
  }

  /**
   * Outcome type as reported in composite failures: {@code "success"} or {@code "error"}.
   */
  String type();

  record Success(PlatformResponse response) implements PublishOutcome {
    public Success {
      Objects.requireNonNull(response, "response");
    }

    @Override
    public String type() {
      return "success";
    }
  }

  record Failure(PlatformError error) implements PublishOutcome {
    public Failure {
      Objects.requireNonNull(error, "error");
    }

    @Override
    public String type() {
      return "error";
    }
  }
}
