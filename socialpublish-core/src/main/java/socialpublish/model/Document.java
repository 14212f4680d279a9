package socialpublish.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A tenant-owned, tagged record with an opaque payload. The only entity shape the
 * document store persists; payload interpretation belongs to the caller.
 *
 * <p>{@code uuid}, {@code ownerId} and {@code createdAt} never change once the
 * document exists. {@code (searchKey, ownerId)} is the natural key used for upserts.
 *
 * @param uuid      immutable primary key
 * @param searchKey caller-supplied key, or {@code "{kind}:{uuid}"} when none was given
 * @param kind      document kind (e.g. {@code "post"})
 * @param tags      the complete tag set from the most recent write
 * @param payload   opaque payload, typically JSON
 * @param ownerId   owning account
 * @param createdAt creation time
 */
public record Document(
    String uuid,
    String searchKey,
    String kind,
    List<Tag> tags,
    String payload,
    UUID ownerId,
    Instant createdAt) {

  public Document {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(searchKey, "searchKey");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(createdAt, "createdAt");
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  /**
   * Returns a copy carrying a new payload and tag set; identity fields are preserved.
   */
  public Document withPayloadAndTags(String payload, List<Tag> tags) {
    return new Document(uuid, searchKey, kind, tags, payload, ownerId, createdAt);
  }

  /**
   * Returns a copy with the given tag set.
   */
  public Document withTags(List<Tag> tags) {
    return new Document(uuid, searchKey, kind, tags, payload, ownerId, createdAt);
  }

  /**
   * Returns the names of all tags of the given kind, in stored order.
   */
  public List<String> tagNames(String tagKind) {
    return tags.stream()
        .filter(tag -> tag.isKind(tagKind))
        .map(Tag::name)
        .toList();
  }

  /**
   * Whether this document belongs to the given owner.
   */
  public boolean isOwnedBy(UUID owner) {
    return ownerId != null && ownerId.equals(owner);
  }
}
