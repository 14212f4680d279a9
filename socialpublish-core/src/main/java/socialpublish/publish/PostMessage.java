package socialpublish.publish;

import java.util.List;
import java.util.Objects;

/**
 * One message of a post. A request with several messages describes a thread.
 *
 * @param content message text
 * @param link    optional link
 * @param images  optional image references (attachments)
 */
public record PostMessage(String content, String link, List<String> images) {

  public PostMessage {
    Objects.requireNonNull(content, "content");
    images = images == null ? null : List.copyOf(images);
  }

  public static PostMessage of(String content) {
    return new PostMessage(content, null, null);
  }
}
