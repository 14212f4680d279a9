package socialpublish.publish;

import java.util.Objects;

/**
 * A target's failure.
 *
 * @param status  HTTP-style status class of the failure
 * @param module  failing module
 * @param message human-readable description
 */
public record PlatformError(int status, String module, String message) {

  public PlatformError {
    Objects.requireNonNull(message, "message");
  }
}
