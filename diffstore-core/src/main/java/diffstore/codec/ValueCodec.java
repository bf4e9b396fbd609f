package diffstore.codec;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Encodes staged values into pending payloads and binds decoders to stored payloads.
 *
 * <p>A default implementation is discovered through {@link ServiceLoader} from
 * {@code META-INF/services/diffstore.codec.ValueCodec}; the {@code diffstore-jackson}
 * module registers one.
 *
 * @see #getDefault()
 */
public interface ValueCodec {

  /**
   * Returns the first codec registered through {@link ServiceLoader}.
   *
   * @return the default {@link ValueCodec}
   * @throws IllegalStateException if no codec is on the class path
   */
  static ValueCodec getDefault() {
    Iterator<ValueCodec> codecs = ServiceLoader.load(ValueCodec.class).iterator();
    if (!codecs.hasNext()) {
      throw new IllegalStateException("No ValueCodec registered in META-INF/services/"
          + ValueCodec.class.getName() + "; add diffstore-jackson or pass a codec explicitly");
    }
    return codecs.next();
  }

  /**
   * Unique identifier of this codec (e.g. "jackson-json").
   */
  String name();

  /**
   * Encodes a value.
   *
   * @param value the value to encode, may be {@code null}
   * @return the encoded bytes
   * @throws CodecException if the value cannot be encoded
   */
  byte[] encode(Object value);

  /**
   * Binds a decoder to an encoded payload. Decoding happens lazily on
   * {@link Decoder#decode}.
   *
   * @param payload bytes previously returned by {@link #encode}
   * @return a decoder over {@code payload}
   */
  Decoder decoder(byte[] payload);
}
