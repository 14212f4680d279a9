package socialpublish.post;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link PostCodec} backed by a shared Jackson {@link ObjectMapper}.
 */
public final class JacksonPostCodec implements PostCodec {
  static final JacksonPostCodec INSTANCE = new JacksonPostCodec(new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));

  private final ObjectMapper mapper;

  public JacksonPostCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public String encode(PostPayload payload) {
    try {
      return mapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode post payload", e);
    }
  }

  @Override
  public PostPayload decode(String json) {
    if (json == null || json.isBlank()) {
      throw new IllegalArgumentException("Post payload is empty");
    }
    try {
      PostPayload payload = mapper.readValue(json, PostPayload.class);
      if (payload == null) {
        throw new IllegalArgumentException("Post payload is null");
      }
      return payload;
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid post payload", e);
    }
  }
}
