package diffstore.apply;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Thrown by {@code each} after its transaction committed, when at least one callback
 * failed or the scan was cancelled.
 *
 * <p>Changes applied before the failures or the cancellation are committed; the failed
 * ones and those never visited stay pending. {@link #errors()} lists the recorded
 * conditions in the order they were encountered, cancellation always last since it ends
 * the scan. Each of them is also attached as a suppressed exception.
 */
public final class ApplyException extends RuntimeException {
  private final String collection;
  private final int applied;
  private final List<ItemFailure> failures;
  private final CancellationException cancellation;

  public ApplyException(String collection, int applied, List<ItemFailure> failures,
      CancellationException cancellation) {
    super(buildMessage(collection, failures, cancellation));
    this.collection = Objects.requireNonNull(collection, "collection");
    this.applied = applied;
    this.failures = List.copyOf(failures);
    this.cancellation = cancellation;
    for (ItemFailure failure : this.failures) {
      addSuppressed(failure.cause());
    }
    if (cancellation != null) {
      addSuppressed(cancellation);
    }
  }

  public String collection() {
    return collection;
  }

  /**
   * Number of changes applied and committed by the scan.
   */
  public int applied() {
    return applied;
  }

  /**
   * Per-item failures in the order the scan met them.
   */
  public List<ItemFailure> failures() {
    return failures;
  }

  public boolean isCancelled() {
    return cancellation != null;
  }

  /**
   * Returns the cancellation condition, or {@code null} if the scan ran to completion.
   */
  public CancellationException cancellation() {
    return cancellation;
  }

  /**
   * All recorded conditions in encounter order: item failures, then cancellation.
   */
  public List<Exception> errors() {
    List<Exception> errors = new ArrayList<>(failures.size() + 1);
    for (ItemFailure failure : failures) {
      errors.add(failure.cause());
    }
    if (cancellation != null) {
      errors.add(cancellation);
    }
    return errors;
  }

  private static String buildMessage(String collection, List<ItemFailure> failures,
      CancellationException cancellation) {
    int count = failures.size() + (cancellation == null ? 0 : 1);
    StringBuilder sb = new StringBuilder()
        .append(count).append(count == 1 ? " error" : " errors")
        .append(" occurred applying changes of collection ").append(collection).append(':');
    for (ItemFailure failure : failures) {
      sb.append("\n\t* id=").append(failure.idHex()).append(": ").append(failure.cause());
    }
    if (cancellation != null) {
      sb.append("\n\t* ").append(cancellation.getMessage());
    }
    return sb.toString();
  }
}
