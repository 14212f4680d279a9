package socialpublish.publish;

/**
 * An external publish destination, such as a platform account.
 *
 * <p>Platform adapters implement this; the orchestrator knows nothing about wire
 * formats. Implementations should report failures as {@link PublishOutcome.Failure};
 * anything thrown is captured as a failure too.
 */
public interface PublishTarget {

  /**
   * Target name as used in requests. Matched case-insensitively.
   */
  String name();

  /**
   * Whether credentials and settings for this target are present. Unconfigured
   * targets are reported as failed without being called.
   */
  default boolean isConfigured() {
    return true;
  }

  /**
   * Publishes the command's messages.
   *
   * @param command messages, language and owner of the broadcast
   * @return the outcome; never {@code null}
   * @throws Exception on unexpected failure
   */
  PublishOutcome publish(PublishCommand command) throws Exception;
}
