package diffstore.codec;

import java.lang.reflect.Type;

/**
 * Decodes the payload of one pending change into a value of the caller's choosing.
 *
 * <p>The requested type should be compatible with the value originally passed to
 * {@code add}; no check is made beyond what the codec itself enforces.
 */
public interface Decoder {

  /**
   * Decodes the payload into an instance of {@code type}.
   *
   * @throws CodecException if the payload cannot be read as {@code type}
   */
  <T> T decode(Class<T> type);

  /**
   * Decodes the payload into a generic type, e.g. {@code List<Row>}.
   *
   * @throws CodecException if the payload cannot be read as {@code type}
   */
  <T> T decode(Type type);

  /**
   * Returns a copy of the raw encoded payload.
   */
  byte[] bytes();
}
