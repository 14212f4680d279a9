package socialpublish.post;

/**
 * Converts {@link PostPayload} to and from the JSON stored in a document.
 *
 * @see #getDefault()
 * @see JacksonPostCodec
 */
public interface PostCodec {

  /**
   * Returns the default Jackson-backed singleton.
   */
  static PostCodec getDefault() {
    return JacksonPostCodec.INSTANCE;
  }

  /**
   * Encodes a payload as a JSON object string. Absent optional fields are omitted.
   *
   * @throws IllegalArgumentException if the payload cannot be encoded
   */
  String encode(PostPayload payload);

  /**
   * Decodes a JSON object string. Unknown fields are ignored.
   *
   * @throws IllegalArgumentException if the input is not a valid post payload
   */
  PostPayload decode(String json);
}
