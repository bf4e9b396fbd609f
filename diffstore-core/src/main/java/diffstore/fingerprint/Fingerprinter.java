package diffstore.fingerprint;

/**
 * Computes the digest used to decide whether an item changed since it was last applied.
 *
 * <p>Implementations must be pure: structurally equal values yield the same
 * fingerprint in every process run, regardless of map or set iteration order, while a
 * different sequence order or any different scalar yields a different one (up to the
 * collision probability of a 64-bit digest).
 *
 * @see #getDefault()
 * @see StructuralFingerprinter
 */
@FunctionalInterface
public interface Fingerprinter {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link Fingerprinter}
   */
  static Fingerprinter getDefault() {
    return StructuralFingerprinter.INSTANCE;
  }

  /**
   * Digests a value.
   *
   * @param value the value, may be {@code null}
   * @return the fingerprint
   * @throws FingerprintException if the value holds an unsupported member
   */
  Fingerprint fingerprint(Object value);
}
