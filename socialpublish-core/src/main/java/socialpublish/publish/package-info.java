/**
 * Broadcast of one post to many independent targets.
 *
 * <p>{@link socialpublish.publish.PublishOrchestrator} validates a
 * {@link socialpublish.publish.NewPostRequest}, attempts every
 * {@link socialpublish.publish.PublishTarget} resolved through a
 * {@link socialpublish.publish.TargetRegistry}, and returns a
 * {@link socialpublish.publish.PublishResult}.
 */
package socialpublish.publish;
