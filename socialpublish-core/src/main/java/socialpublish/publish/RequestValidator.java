package socialpublish.publish;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pre-flight checks over a whole broadcast request, run before any target is
 * attempted or anything is stored.
 */
public final class RequestValidator {
  private final int maxContentLength;
  private final Map<String, Integer> maxThreadLengths;

  public RequestValidator(PublishConfig config) {
    Objects.requireNonNull(config, "config");
    this.maxContentLength = config.getMaxContentLength();
    this.maxThreadLengths = config.getMaxThreadLengths();
  }

  /**
   * Validates {@code request} against the given normalized targets.
   *
   * @return a client-facing error message, or empty if the request may proceed
   */
  public Optional<String> validate(NewPostRequest request, Collection<String> targets) {
    if (request.messages().isEmpty()) {
      return Optional.of("At least one message is required");
    }
    for (PostMessage message : request.messages()) {
      int length = message.content().length();
      if (length == 0 || length > maxContentLength) {
        return Optional.of("Content must be between 1 and " + maxContentLength + " characters");
      }
    }
    for (String target : targets) {
      Integer limit = maxThreadLengths.get(target);
      if (limit != null && request.messages().size() > limit) {
        return Optional.of(displayName(target) + " supports at most " + limit
            + (limit == 1 ? " message" : " messages") + " per thread");
      }
    }
    return Optional.empty();
  }

  static String displayName(String target) {
    return switch (target) {
      case "linkedin" -> "LinkedIn";
      case "bluesky" -> "Bluesky";
      case "rss" -> "RSS";
      default -> target.isEmpty()
          ? target
          : Character.toUpperCase(target.charAt(0)) + target.substring(1);
    };
  }
}
