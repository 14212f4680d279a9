package socialpublish.spi;

import socialpublish.StoreException;
import socialpublish.model.Document;
import socialpublish.model.OrderBy;
import socialpublish.model.Tag;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Tenant-scoped, tag-indexed document persistence.
 *
 * <p>Every method runs in its own transaction; no connection is held between calls.
 * All methods throw {@link StoreException} when the underlying transaction fails.
 * Lookups that match nothing return an empty result rather than failing.
 *
 * <p>Site-wide reads across all owners are deliberately absent from this interface;
 * see {@link SiteWideDocumentReader}.
 */
public interface DocumentStore {

  /**
   * Inserts a document, or updates the one already stored under
   * {@code (searchKey, ownerId)}.
   *
   * <p>On update the payload is overwritten and the tag set is replaced by
   * {@code tags}; {@code uuid} and {@code createdAt} are preserved. On insert, a
   * missing {@code searchKey} becomes {@code "{kind}:{uuid}"}.
   *
   * @param kind      document kind
   * @param payload   opaque payload
   * @param ownerId   owning account, supplied by the caller's auth layer
   * @param searchKey upsert key, or {@code null} to always insert
   * @param tags      the complete tag set for the document
   * @return the stored document
   */
  Document createOrUpdate(String kind, String payload, UUID ownerId, String searchKey, List<Tag> tags);

  /**
   * Looks up a document by its search key.
   */
  Optional<Document> searchByKey(String searchKey);

  /**
   * Looks up a document by uuid regardless of owner. Owner-scoped callers must
   * check {@link Document#isOwnedBy(UUID)} before exposing the result.
   */
  Optional<Document> searchByUuid(String uuid);

  /**
   * Returns every document of {@code kind} owned by {@code ownerId}.
   */
  List<Document> getAllForUser(String kind, UUID ownerId, OrderBy orderBy);
}
