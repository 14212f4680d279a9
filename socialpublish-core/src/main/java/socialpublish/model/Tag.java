package socialpublish.model;

import java.util.Objects;

/**
 * A {@code (name, kind)} label attached to a {@link Document}.
 *
 * <p>A document's tag set is replaced as a whole on every write; there is no
 * incremental add or remove.
 *
 * @param name tag name (e.g. a target such as {@code "mastodon"})
 * @param kind tag kind, usually {@link #KIND_TARGET} or {@link #KIND_LABEL}
 */
public record Tag(String name, String kind) {
  public static final String KIND_TARGET = "target";
  public static final String KIND_LABEL = "label";

  public Tag {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
  }

  public static Tag target(String name) {
    return new Tag(name, KIND_TARGET);
  }

  public static Tag label(String name) {
    return new Tag(name, KIND_LABEL);
  }

  public boolean isKind(String kind) {
    return this.kind.equals(kind);
  }
}
