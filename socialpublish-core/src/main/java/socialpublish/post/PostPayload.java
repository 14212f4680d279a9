package socialpublish.post;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * JSON payload stored in a {@code "post"} document. Targets are not part of the
 * payload; they live in the document's {@code "target"} tags.
 *
 * @param content         post text
 * @param link            optional link
 * @param tags            optional free-form labels
 * @param language        optional language code
 * @param images          optional image references
 * @param replyToPostUuid uuid of the previous post when this one continues a thread
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PostPayload(
    String content,
    String link,
    List<String> tags,
    String language,
    List<String> images,
    String replyToPostUuid) {

  public PostPayload {
    Objects.requireNonNull(content, "content");
    tags = tags == null ? null : List.copyOf(tags);
    images = images == null ? null : List.copyOf(images);
  }

  public static PostPayload ofContent(String content) {
    return new PostPayload(content, null, null, null, null, null);
  }
}
