package diffstore.apply;

import java.util.HexFormat;
import java.util.Objects;

/**
 * One pending change whose callback failed during a scan.
 *
 * @param id    the identity of the change (the array is not copied)
 * @param cause what the callback threw
 */
public record ItemFailure(byte[] id, Exception cause) {

  public ItemFailure {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(cause, "cause");
  }

  /**
   * Returns the identity as lowercase hex.
   */
  public String idHex() {
    return HexFormat.of().formatHex(id);
  }

  @Override
  public String toString() {
    return "ItemFailure[id=" + idHex() + ", cause=" + cause + "]";
  }
}
