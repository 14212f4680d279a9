package socialpublish.publish;

import java.util.List;

/**
 * A request to publish one logical post, possibly a thread, to several targets.
 *
 * @param targets  target names in any casing; {@code null} means none
 * @param language optional language code applied to every message
 * @param messages the messages, root first
 */
public record NewPostRequest(List<String> targets, String language, List<PostMessage> messages) {

  public NewPostRequest {
    targets = targets == null ? null : List.copyOf(targets);
    messages = messages == null ? List.of() : List.copyOf(messages);
  }

  /**
   * Creates a single-message request.
   */
  public static NewPostRequest of(String content, List<String> targets) {
    return new NewPostRequest(targets, null, List.of(PostMessage.of(content)));
  }

  /**
   * Creates a single-message request with optional link, language and images.
   */
  public static NewPostRequest of(String content, List<String> targets, String link,
      String language, List<String> images) {
    return new NewPostRequest(targets, language, List.of(new PostMessage(content, link, images)));
  }
}
