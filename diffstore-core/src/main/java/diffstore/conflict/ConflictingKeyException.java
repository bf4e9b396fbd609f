package diffstore.conflict;

import java.util.HexFormat;

/**
 * Thrown by {@code add} when conflict tracking is active and the identity was already
 * added during the current cycle. Nothing is written when this is thrown.
 */
public final class ConflictingKeyException extends RuntimeException {
  private final String collection;
  private final byte[] id;

  public ConflictingKeyException(String collection, byte[] id) {
    super("Multiple objects with the same ID were added in the same change version: collection="
        + collection + ", id=" + HexFormat.of().formatHex(id));
    this.collection = collection;
    this.id = id.clone();
  }

  public String collection() {
    return collection;
  }

  public byte[] id() {
    return id.clone();
  }
}
