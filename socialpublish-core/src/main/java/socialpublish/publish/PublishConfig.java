package socialpublish.publish;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for {@link PublishOrchestrator} and the built-in feed target.
 *
 * <p>Defaults: 4 concurrent target attempts, a 30s broadcast deadline, 1000 characters
 * per message, threads of at most 2 messages for {@code linkedin}.
 */
public final class PublishConfig {
  public static final String PREFIX = "socialpublish.publish.";

  private int maxConcurrency = 4;
  private long targetTimeoutMs = 30_000L;
  private int maxContentLength = 1000;
  private final Map<String, Integer> maxThreadLengths = new LinkedHashMap<>(Map.of("linkedin", 2));
  private String feedBaseUrl = "http://localhost:3000";

  /**
   * Reads {@code socialpublish.publish.*} keys; absent keys keep their defaults.
   *
   * <p>Recognized keys: {@code maxConcurrency}, {@code targetTimeoutMs},
   * {@code maxContentLength}, {@code feedBaseUrl}, and
   * {@code maxThreadLength.<target>}.
   */
  public static PublishConfig fromProperties(Properties properties) {
    PublishConfig config = new PublishConfig();
    String value = properties.getProperty(PREFIX + "maxConcurrency");
    if (value != null) {
      config.setMaxConcurrency(Integer.parseInt(value.trim()));
    }
    value = properties.getProperty(PREFIX + "targetTimeoutMs");
    if (value != null) {
      config.setTargetTimeoutMs(Long.parseLong(value.trim()));
    }
    value = properties.getProperty(PREFIX + "maxContentLength");
    if (value != null) {
      config.setMaxContentLength(Integer.parseInt(value.trim()));
    }
    value = properties.getProperty(PREFIX + "feedBaseUrl");
    if (value != null) {
      config.setFeedBaseUrl(value.trim());
    }
    String threadPrefix = PREFIX + "maxThreadLength.";
    for (String key : properties.stringPropertyNames()) {
      if (key.startsWith(threadPrefix)) {
        config.setMaxThreadLength(key.substring(threadPrefix.length()),
            Integer.parseInt(properties.getProperty(key).trim()));
      }
    }
    return config;
  }

  public int getMaxConcurrency() {
    return maxConcurrency;
  }

  public PublishConfig setMaxConcurrency(int maxConcurrency) {
    if (maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be >= 1");
    }
    this.maxConcurrency = maxConcurrency;
    return this;
  }

  public long getTargetTimeoutMs() {
    return targetTimeoutMs;
  }

  public PublishConfig setTargetTimeoutMs(long targetTimeoutMs) {
    if (targetTimeoutMs <= 0) {
      throw new IllegalArgumentException("targetTimeoutMs must be > 0");
    }
    this.targetTimeoutMs = targetTimeoutMs;
    return this;
  }

  public int getMaxContentLength() {
    return maxContentLength;
  }

  public PublishConfig setMaxContentLength(int maxContentLength) {
    if (maxContentLength < 1) {
      throw new IllegalArgumentException("maxContentLength must be >= 1");
    }
    this.maxContentLength = maxContentLength;
    return this;
  }

  /**
   * Per-target limits on thread length, keyed by lower-case target name.
   */
  public Map<String, Integer> getMaxThreadLengths() {
    return Map.copyOf(maxThreadLengths);
  }

  public PublishConfig setMaxThreadLength(String target, int maxMessages) {
    if (maxMessages < 1) {
      throw new IllegalArgumentException("maxMessages must be >= 1");
    }
    maxThreadLengths.put(target.toLowerCase(Locale.ROOT), maxMessages);
    return this;
  }

  /**
   * Public base URL of this service; feed post URIs are built under it.
   */
  public String getFeedBaseUrl() {
    return feedBaseUrl;
  }

  public PublishConfig setFeedBaseUrl(String feedBaseUrl) {
    this.feedBaseUrl = Objects.requireNonNull(feedBaseUrl, "feedBaseUrl");
    return this;
  }
}
