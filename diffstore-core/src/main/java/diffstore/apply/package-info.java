/**
 * Draining pending changes: the {@link diffstore.apply.ChangeScan scan} that applies them,
 * the {@link diffstore.apply.ApplyFunction callback} contract, cooperative
 * {@link diffstore.apply.CancellationToken cancellation}, and the
 * {@link diffstore.apply.ApplyException aggregated failure report}.
 */
package diffstore.apply;
