package socialpublish.publish.feed;

import socialpublish.StoreException;
import socialpublish.post.Post;
import socialpublish.post.PostPayload;
import socialpublish.post.PostRepository;
import socialpublish.publish.PlatformResponse;
import socialpublish.publish.PostMessage;
import socialpublish.publish.PublishConfig;
import socialpublish.publish.PublishCommand;
import socialpublish.publish.PublishOutcome;
import socialpublish.publish.PublishTarget;
import socialpublish.publish.PublishedMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in target that stores the post in the owner's own feed.
 *
 * <p>Each message of a thread becomes one post, chained to the previous one through
 * {@code replyToPostUuid}. Hashtags in the content are stored as labels. If a message
 * fails to store, the ones already stored for this thread are kept and the failure is
 * reported.
 */
public final class FeedTarget implements PublishTarget {
  public static final String NAME = "feed";

  private static final Logger logger = Logger.getLogger(FeedTarget.class.getName());
  private static final Pattern HASHTAG = Pattern.compile("(?:^|\\s)#(\\w+)");

  private final PostRepository posts;
  private final String baseUrl;

  /**
   * Feed target whose post URIs start at {@link PublishConfig#getFeedBaseUrl()}.
   */
  public FeedTarget(PostRepository posts, PublishConfig config) {
    this(posts, Objects.requireNonNull(config, "config").getFeedBaseUrl());
  }

  public FeedTarget(PostRepository posts, String baseUrl) {
    this.posts = Objects.requireNonNull(posts, "posts");
    Objects.requireNonNull(baseUrl, "baseUrl");
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public PublishOutcome publish(PublishCommand command) {
    List<PublishedMessage> published = new ArrayList<>();
    String previousUuid = null;
    for (PostMessage message : command.messages()) {
      PostPayload payload = new PostPayload(
          message.content(),
          message.link(),
          hashtags(message.content()),
          command.language(),
          message.images(),
          previousUuid);
      Post post;
      try {
        post = posts.create(command.ownerId(), payload, command.targets());
      } catch (StoreException e) {
        logger.log(Level.SEVERE, "Failed to save feed item", e);
        return PublishOutcome.failure(500, NAME, "Failed to save feed item: " + e.getMessage());
      }
      published.add(new PublishedMessage(post.uuid(), postUri(command, post), previousUuid));
      previousUuid = post.uuid();
    }
    String rootUri = published.isEmpty()
        ? baseUrl + "/feed/" + command.ownerId()
        : published.get(0).uri();
    String rootId = published.isEmpty() ? null : published.get(0).id();
    return PublishOutcome.success(new PlatformResponse(NAME, rootId, rootUri, published));
  }

  private String postUri(PublishCommand command, Post post) {
    return baseUrl + "/feed/" + command.ownerId() + "/" + post.uuid();
  }

  static List<String> hashtags(String content) {
    List<String> tags = new ArrayList<>();
    Matcher matcher = HASHTAG.matcher(content);
    while (matcher.find()) {
      tags.add(matcher.group(1));
    }
    return tags;
  }
}
