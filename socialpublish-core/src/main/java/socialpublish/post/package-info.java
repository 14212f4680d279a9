/**
 * Typed post persistence on top of the document store.
 *
 * <p>{@link socialpublish.post.PostRepository} handles owner-scoped reads and
 * writes; {@link socialpublish.post.PostFeed} is the site-wide syndication view.
 */
package socialpublish.post;
