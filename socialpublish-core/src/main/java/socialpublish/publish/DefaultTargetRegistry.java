package socialpublish.publish;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry keyed by lower-cased target name.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * TargetRegistry registry = new DefaultTargetRegistry()
 *     .register(new FeedTarget(posts, "https://example.com"))
 *     .register(mastodonAdapter);
 * }</pre>
 *
 * <p>Registering a second target under the same name replaces the first.
 */
public final class DefaultTargetRegistry implements TargetRegistry {
  private final Map<String, PublishTarget> targets = new ConcurrentHashMap<>();

  /**
   * Registers a target under its {@link PublishTarget#name()}.
   *
   * @return this registry for chaining
   */
  public DefaultTargetRegistry register(PublishTarget target) {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(target.name(), "target.name()");
    targets.put(target.name().toLowerCase(Locale.ROOT), target);
    return this;
  }

  @Override
  public Optional<PublishTarget> find(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(targets.get(name.toLowerCase(Locale.ROOT)));
  }

  public Set<String> names() {
    return Set.copyOf(targets.keySet());
  }
}
