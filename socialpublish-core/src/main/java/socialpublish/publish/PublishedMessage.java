package socialpublish.publish;

/**
 * A single message as it was published by a platform.
 *
 * @param id        platform identifier
 * @param uri       public location, if the platform reports one
 * @param replyToId identifier of the message this one replies to, for threads
 */
public record PublishedMessage(String id, String uri, String replyToId) {
}
