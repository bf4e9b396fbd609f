package diffstore.apply;

import diffstore.codec.Decoder;

/**
 * Callback that applies one pending change downstream.
 *
 * <h2>Error Handling</h2>
 * <p>Returning normally promotes the change to committed. Throwing any
 * {@link Exception} leaves the change pending for the next scan and is reported in the
 * {@link ApplyException} raised once the scan has committed; the remaining changes are
 * still offered. An {@link Error} aborts the whole scan and rolls it back.
 *
 * <h2>Execution Model</h2>
 * <p>Callbacks run synchronously on the thread that called {@code each}, while the
 * scan's write transaction is open. They must not call back into the same
 * differential, which would wait on the scan's own locks.
 *
 * <h2>Idempotency</h2>
 * <p>Delivery is at-least-once: a change whose callback succeeded but whose scan then
 * failed to commit is offered again.
 */
@FunctionalInterface
public interface ApplyFunction {

  /**
   * Applies one pending change.
   *
   * @param id      the identity passed to {@code add}
   * @param decoder decoder over the staged value
   * @throws Exception if the change could not be applied; it stays pending
   */
  void apply(byte[] id, Decoder decoder) throws Exception;
}
