package socialpublish.post;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A decoded {@code "post"} document.
 *
 * @param uuid      document uuid
 * @param ownerId   owning account
 * @param targets   publish destinations, taken from the document's target tags
 * @param createdAt creation time
 * @param payload   decoded payload
 */
public record Post(String uuid, UUID ownerId, List<String> targets, Instant createdAt, PostPayload payload) {

  public Post {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(payload, "payload");
    targets = targets == null ? List.of() : List.copyOf(targets);
  }

  public String content() {
    return payload.content();
  }

  public String link() {
    return payload.link();
  }

  public List<String> labels() {
    return payload.tags();
  }

  public String language() {
    return payload.language();
  }

  public List<String> images() {
    return payload.images();
  }

  public String replyToPostUuid() {
    return payload.replyToPostUuid();
  }
}
