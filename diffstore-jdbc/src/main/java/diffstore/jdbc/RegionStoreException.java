package diffstore.jdbc;

import diffstore.DiffStoreException;

/**
 * Unchecked exception wrapping JDBC errors thrown by
 * {@link diffstore.jdbc.store.AbstractJdbcRegionStore} and its subclasses.
 */
public final class RegionStoreException extends DiffStoreException {
  public RegionStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
