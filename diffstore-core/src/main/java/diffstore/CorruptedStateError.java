package diffstore;

/**
 * Raised when persisted state breaks an invariant the store itself maintains, such as
 * a pending record whose payload is missing. This means the tables were modified
 * outside diffstore; retrying cannot help, so it is an {@link Error} rather than an
 * exception.
 */
public final class CorruptedStateError extends Error {
  public CorruptedStateError(String message) {
    super(message);
  }
}
