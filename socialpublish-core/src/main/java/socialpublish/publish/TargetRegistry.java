package socialpublish.publish;

import java.util.Optional;

/**
 * Resolves target names to {@link PublishTarget}s.
 *
 * @see DefaultTargetRegistry
 */
public interface TargetRegistry {

  /**
   * Finds the target registered under {@code name}.
   *
   * @param name normalized (lower-case) target name
   * @return the target, or empty if none was registered
   */
  Optional<PublishTarget> find(String name);
}
