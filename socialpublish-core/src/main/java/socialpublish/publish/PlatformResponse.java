package socialpublish.publish;

import java.util.List;
import java.util.Objects;

/**
 * A target's successful response.
 *
 * @param module   responding module (usually the target name)
 * @param id       identifier of the root message
 * @param uri      public location of the root message
 * @param messages every published message, root first
 */
public record PlatformResponse(String module, String id, String uri, List<PublishedMessage> messages) {

  public PlatformResponse {
    Objects.requireNonNull(module, "module");
    messages = messages == null ? List.of() : List.copyOf(messages);
  }
}
