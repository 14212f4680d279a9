/**
 * Persisted document model: {@link socialpublish.model.Document}, its
 * {@link socialpublish.model.Tag}s, and listing order.
 */
package socialpublish.model;
