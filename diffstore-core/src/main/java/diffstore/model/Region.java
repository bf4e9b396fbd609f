package diffstore.model;

/**
 * Nested key/value regions held under every collection.
 *
 * <p>The identifiers are part of the persisted layout and must never change.
 */
public enum Region {
  /** identity → fingerprint last applied successfully. */
  COMMITTED("_m"),
  /** identity → fingerprint awaiting apply. */
  PENDING("_ph"),
  /** fingerprint → encoded value of a pending change. */
  PAYLOAD("_pd"),
  /** Caller bookkeeping, untouched by change tracking. */
  USER_DATA("_ud"),
  /** identity → sentinel for the current conflict tracking cycle. */
  CONFLICTS("_dk");

  private final String id;

  Region(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  /**
   * Regions created when a collection is opened. {@link #CONFLICTS} is created lazily
   * the first time conflict tracking is reset.
   */
  public static Region[] openedEagerly() {
    return new Region[] {COMMITTED, PENDING, PAYLOAD, USER_DATA};
  }
}
