/**
 * Structural digests deciding whether an item changed since it was last applied.
 */
package diffstore.fingerprint;
