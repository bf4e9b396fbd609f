/**
 * Connection-scoped transactions used by every store operation.
 */
package diffstore.tx;
