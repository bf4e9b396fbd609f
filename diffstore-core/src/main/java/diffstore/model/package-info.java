/**
 * Persisted layout: the {@link diffstore.model.Region regions} of a collection and the
 * {@link diffstore.model.Entry entries} read from them.
 */
package diffstore.model;
