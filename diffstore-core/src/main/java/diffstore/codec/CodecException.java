package diffstore.codec;

/**
 * Unchecked exception raised when a value cannot be encoded into a pending payload, or a
 * payload cannot be decoded into the type requested by the caller.
 */
public final class CodecException extends RuntimeException {
  public CodecException(String message, Throwable cause) {
    super(message, cause);
  }

  public CodecException(String message) {
    super(message);
  }
}
