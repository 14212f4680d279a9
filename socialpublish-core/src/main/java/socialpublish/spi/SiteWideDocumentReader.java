package socialpublish.spi;

import socialpublish.model.Document;
import socialpublish.model.OrderBy;

import java.util.List;

/**
 * Reads documents across all owners. Handed only to whole-feed read paths such as
 * syndication, never to owner-scoped request handling.
 *
 * @see socialpublish.post.PostFeed
 */
@FunctionalInterface
public interface SiteWideDocumentReader {

  /**
   * Returns every document of {@code kind}, for all owners.
   *
   * @throws socialpublish.StoreException if the underlying transaction fails
   */
  List<Document> getAll(String kind, OrderBy orderBy);
}
