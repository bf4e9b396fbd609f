package diffstore;

/**
 * A value that carries its own identity, e.g. a row that knows its primary key.
 *
 * <p>The identity must be stable across the lifetime of the item. Fields holding it are
 * fingerprinted like any other field.
 *
 * @see Differential#add(Identified)
 */
public interface Identified {

  /**
   * Returns the identity of this value within its collection.
   */
  byte[] id();
}
