/**
 * Per-cycle guard against adding the same identity twice before the first change is
 * flushed.
 */
package diffstore.conflict;
