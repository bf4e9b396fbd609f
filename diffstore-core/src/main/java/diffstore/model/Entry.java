package diffstore.model;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A single key/value pair read from a region, as returned by ordered scans.
 */
public record Entry(byte[] key, byte[] value) {

  public Entry {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Entry other)) return false;
    return Arrays.equals(key, other.key) && Arrays.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(key) + Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    HexFormat hex = HexFormat.of();
    return "Entry[key=" + hex.formatHex(key) + ", value=" + hex.formatHex(value) + "]";
  }
}
