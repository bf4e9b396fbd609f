package diffstore.fingerprint;

/**
 * Thrown when a value holds something that has no structural digest, such as a thread,
 * a stream or a cyclic object graph.
 */
public final class FingerprintException extends RuntimeException {
  public FingerprintException(String message) {
    super(message);
  }

  public FingerprintException(String message, Throwable cause) {
    super(message, cause);
  }
}
