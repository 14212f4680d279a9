package socialpublish.model;

/**
 * Supported orderings for document listings.
 */
public enum OrderBy {
  /**
   * Newest first. Documents created in the same instant are returned
   * in reverse insertion order.
   */
  CREATED_AT_DESC
}
