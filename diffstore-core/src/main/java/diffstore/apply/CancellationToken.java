package diffstore.apply;

/**
 * Cooperative stop signal polled by a scan once before each pending change.
 *
 * <p>Cancellation never interrupts a running callback and never undoes changes already
 * applied; it only stops the scan from visiting further changes.
 *
 * @see CancellationSource
 */
public interface CancellationToken {

  /**
   * Token that is never cancelled.
   */
  CancellationToken NONE = () -> false;

  /**
   * Returns {@code true} once the scan should stop.
   */
  boolean isCancellationRequested();

  /**
   * Describes why cancellation was requested; used as the message of the recorded
   * {@link java.util.concurrent.CancellationException}.
   */
  default String reason() {
    return "Scan cancelled";
  }
}
