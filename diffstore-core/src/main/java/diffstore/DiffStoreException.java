package diffstore;

/**
 * Unchecked exception wrapping failures of the underlying store: connections that
 * cannot be obtained, statements that fail, commits that do not go through.
 *
 * <p>The transaction that was running when the failure happened is rolled back as a
 * whole.
 */
public class DiffStoreException extends RuntimeException {
  public DiffStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  public DiffStoreException(String message) {
    super(message);
  }
}
