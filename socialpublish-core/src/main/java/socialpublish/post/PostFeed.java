package socialpublish.post;

import socialpublish.model.OrderBy;
import socialpublish.spi.SiteWideDocumentReader;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Whole-feed read path for syndication: posts of every owner, newest first.
 *
 * <p>This is the only consumer of a {@link SiteWideDocumentReader}; owner-scoped
 * reads go through {@link PostRepository}.
 */
public final class PostFeed {
  private final SiteWideDocumentReader reader;
  private final PostRepository decoder;

  public PostFeed(SiteWideDocumentReader reader, PostRepository decoder) {
    this.reader = Objects.requireNonNull(reader, "reader");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
  }

  public List<Post> allPosts() {
    return reader.getAll(PostRepository.KIND, OrderBy.CREATED_AT_DESC).stream()
        .map(decoder::decode)
        .toList();
  }

  /**
   * Returns posts that were addressed to {@code target} (case-insensitive).
   */
  public List<Post> postsForTarget(String target) {
    Objects.requireNonNull(target, "target");
    String normalized = target.toLowerCase(Locale.ROOT);
    return allPosts().stream()
        .filter(post -> post.targets().contains(normalized))
        .toList();
  }
}
