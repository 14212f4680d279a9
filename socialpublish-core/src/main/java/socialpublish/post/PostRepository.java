package socialpublish.post;

import socialpublish.StoreException;
import socialpublish.model.Document;
import socialpublish.model.OrderBy;
import socialpublish.model.Tag;
import socialpublish.spi.DocumentStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Typed view over a {@link DocumentStore} for documents of kind {@value #KIND}.
 *
 * <p>Publish destinations are stored as {@code "target"} tags and labels as
 * {@code "label"} tags, written together with the payload in one document write.
 * Every read is scoped to an owner: a post belonging to someone else is reported as
 * absent, even when the uuid exists.
 *
 * <pre>{@code
 * PostRepository posts = new PostRepository(documentStore);
 * Post post = posts.create(ownerId, PostPayload.ofContent("hello"), List.of("mastodon"));
 * Optional<Post> same = posts.getByUuid(ownerId, post.uuid());
 * }</pre>
 */
public final class PostRepository {
  public static final String KIND = "post";

  private final DocumentStore store;
  private final PostCodec codec;

  public PostRepository(DocumentStore store) {
    this(store, PostCodec.getDefault());
  }

  public PostRepository(DocumentStore store, PostCodec codec) {
    this.store = Objects.requireNonNull(store, "store");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * Stores a new post with its targets.
   *
   * @param ownerId owning account
   * @param payload post content
   * @param targets publish destinations; may be empty
   * @return the stored post
   * @throws StoreException if the write fails
   */
  public Post create(UUID ownerId, PostPayload payload, List<String> targets) {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(payload, "payload");
    List<String> targetNames = targets == null ? List.of() : List.copyOf(targets);
    Document row = store.createOrUpdate(KIND, codec.encode(payload), ownerId, null,
        tagsFor(targetNames, payload.tags()));
    return new Post(row.uuid(), row.ownerId(), targetNames, row.createdAt(), payload);
  }

  /**
   * Returns the owner's posts, newest first.
   */
  public List<Post> getAllForOwner(UUID ownerId) {
    Objects.requireNonNull(ownerId, "ownerId");
    return store.getAllForUser(KIND, ownerId, OrderBy.CREATED_AT_DESC).stream()
        .map(this::decode)
        .toList();
  }

  /**
   * Looks up one of the owner's posts.
   *
   * @return the post, or empty when it does not exist, is not a post, or belongs to another owner
   */
  public Optional<Post> getByUuid(UUID ownerId, String uuid) {
    Objects.requireNonNull(ownerId, "ownerId");
    if (uuid == null) {
      return Optional.empty();
    }
    return store.searchByUuid(uuid)
        .filter(doc -> KIND.equals(doc.kind()))
        .filter(doc -> doc.isOwnedBy(ownerId))
        .map(this::decode);
  }

  Post decode(Document doc) {
    PostPayload payload;
    try {
      payload = codec.decode(doc.payload());
    } catch (IllegalArgumentException e) {
      throw new StoreException("Unreadable payload in post " + doc.uuid(), e);
    }
    return new Post(doc.uuid(), doc.ownerId(), doc.tagNames(Tag.KIND_TARGET), doc.createdAt(), payload);
  }

  private static List<Tag> tagsFor(List<String> targets, List<String> labels) {
    List<Tag> tags = new ArrayList<>();
    for (String target : targets) {
      tags.add(Tag.target(target));
    }
    if (labels != null) {
      labels.stream().distinct().map(Tag::label).forEach(tags::add);
    }
    return tags;
  }
}
