package socialpublish.publish;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * What a {@link PublishTarget} receives for one broadcast.
 *
 * @param ownerId  account the post is published for
 * @param messages the validated messages, root first
 * @param language optional language code
 * @param targets  every normalized target of the broadcast, this one included
 */
public record PublishCommand(UUID ownerId, List<PostMessage> messages, String language, List<String> targets) {

  public PublishCommand {
    Objects.requireNonNull(ownerId, "ownerId");
    messages = List.copyOf(messages);
    targets = List.copyOf(targets);
  }
}
