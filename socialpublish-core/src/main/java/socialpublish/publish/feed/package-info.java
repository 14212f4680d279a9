/**
 * The built-in {@code feed} target, which publishes into the document store.
 */
package socialpublish.publish.feed;
