package diffstore.fingerprint;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * A 64-bit structural digest of a value.
 *
 * <p>Persisted as 8 raw bytes holding the little-endian encoding of the unsigned value.
 */
public record Fingerprint(long value) {

  public static final int BYTES = Long.BYTES;

  /**
   * Decodes a persisted fingerprint.
   *
   * @param bytes exactly {@value #BYTES} little-endian bytes
   * @throws IllegalArgumentException if the length is wrong
   */
  public static Fingerprint fromBytes(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    if (bytes.length != BYTES) {
      throw new IllegalArgumentException("Fingerprint must be " + BYTES + " bytes, got " + bytes.length);
    }
    return new Fingerprint(ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).getLong());
  }

  public byte[] toBytes() {
    return ByteBuffer.allocate(BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(value).array();
  }

  @Override
  public String toString() {
    return String.format("%016x", value);
  }
}
