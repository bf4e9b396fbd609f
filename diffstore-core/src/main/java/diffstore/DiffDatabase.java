package diffstore;

import diffstore.codec.ValueCodec;
import diffstore.fingerprint.Fingerprinter;
import diffstore.model.Region;
import diffstore.spi.ConnectionProvider;
import diffstore.spi.MetricsExporter;
import diffstore.spi.RegionStore;
import diffstore.tx.TransactionManager;
import diffstore.tx.TransactionManager.Transaction;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point: a handle on the store that holds every collection and hands out one
 * {@link Differential} per collection name.
 *
 * <p>Create instances via {@link #builder()}:
 * <pre>{@code
 * DiffDatabase db = DiffDatabase.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .regionStore(JdbcRegionStores.detect(dataSource))
 *     .build();
 * Differential users = db.open("users");
 * }</pre>
 *
 * <p>This class is thread-safe and implements {@link AutoCloseable}. After
 * {@link #close()} every operation, including those of differentials already handed out,
 * fails with {@link IllegalStateException}.
 *
 * @see DiffDatabase.Builder
 */
public final class DiffDatabase implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DiffDatabase.class.getName());

  /** Longest collection name accepted. */
  public static final int MAX_NAME_LENGTH = 255;

  private final ConnectionProvider connectionProvider;
  private final RegionStore store;
  private final TransactionManager txManager;
  private final ValueCodec codec;
  private final Fingerprinter fingerprinter;
  private final MetricsExporter metrics;
  private final int scanPageSize;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private DiffDatabase(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.regionStore, "regionStore");
    this.codec = builder.codec != null ? builder.codec : ValueCodec.getDefault();
    this.fingerprinter = builder.fingerprinter != null ? builder.fingerprinter : Fingerprinter.getDefault();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.scanPageSize <= 0) {
      throw new IllegalArgumentException("scanPageSize must be > 0");
    }
    this.scanPageSize = builder.scanPageSize;
    this.txManager = new TransactionManager(connectionProvider);

    if (builder.createSchema) {
      try (Transaction tx = txManager.begin()) {
        store.createSchema(tx.connection());
        tx.commit();
      } catch (SQLException e) {
        throw new DiffStoreException("Failed to create schema", e);
      }
    }
    logger.log(Level.FINE, "Opened diff database with codec {0}", codec.name());
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Opens the collection {@code name}, creating its regions on first use. Existing
   * committed and pending records are picked up as they are.
   *
   * <p>Each call returns a new handle. Conflict tracking is off on a new handle until
   * {@link Differential#resetConflictTracking()} is called on it.
   *
   * @param name collection name, 1 to {@value #MAX_NAME_LENGTH} characters
   * @return the handle
   * @throws DiffStoreException if the regions cannot be created
   */
  public Differential open(String name) {
    validateName(name);
    ensureOpen();
    try (Transaction tx = txManager.begin()) {
      Connection conn = tx.connection();
      for (Region region : Region.openedEagerly()) {
        store.createRegion(conn, name, region);
      }
      tx.commit();
    } catch (SQLException e) {
      throw new DiffStoreException("Failed to open collection " + name, e);
    }
    logger.log(Level.FINE, "Opened collection {0}", name);
    return new Differential(this, name, store, txManager, codec, fingerprinter, metrics, scanPageSize);
  }

  /**
   * Deletes a collection with all of its committed, pending and user data.
   *
   * @return {@code true} if the collection existed
   */
  public boolean delete(String name) {
    validateName(name);
    ensureOpen();
    boolean dropped;
    try (Transaction tx = txManager.begin()) {
      store.lockCollection(tx.connection(), name);
      dropped = store.dropCollection(tx.connection(), name);
      tx.commit();
    } catch (SQLException e) {
      throw new DiffStoreException("Failed to delete collection " + name, e);
    }
    if (dropped) {
      logger.log(Level.INFO, "Deleted collection {0}", name);
    }
    return dropped;
  }

  public boolean exists(String name) {
    validateName(name);
    ensureOpen();
    try (Transaction tx = txManager.beginReadOnly()) {
      return store.collectionExists(tx.connection(), name);
    } catch (SQLException e) {
      throw new DiffStoreException("Failed to look up collection " + name, e);
    }
  }

  /**
   * Lists the names of all collections in ascending order.
   */
  public List<String> collections() {
    ensureOpen();
    try (Transaction tx = txManager.beginReadOnly()) {
      return store.listCollections(tx.connection());
    } catch (SQLException e) {
      throw new DiffStoreException("Failed to list collections", e);
    }
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Closes this handle and, if it is {@link AutoCloseable}, the connection provider.
   * Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (connectionProvider instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        throw new DiffStoreException("Failed to close connection provider", e);
      }
    }
    logger.fine("Closed diff database");
  }

  void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("DiffDatabase is closed");
    }
  }

  private static void validateName(String name) {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
      throw new IllegalArgumentException(
          "Collection name must be 1 to " + MAX_NAME_LENGTH + " characters, got " + name.length());
    }
  }

  /**
   * Builder for {@link DiffDatabase}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private RegionStore regionStore;
    private ValueCodec codec;
    private Fingerprinter fingerprinter;
    private MetricsExporter metrics;
    private int scanPageSize = 100;
    private boolean createSchema = true;

    private Builder() {}

    /**
     * Sets the connection provider every transaction obtains its connection from.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the region store that persists the collections.
     *
     * <p><b>Required.</b> Use {@code JdbcRegionStores.detect(dataSource)} to pick one for
     * the database at hand.
     *
     * @param regionStore the persistence backend
     * @return this builder
     */
    public Builder regionStore(RegionStore regionStore) {
      this.regionStore = regionStore;
      return this;
    }

    /**
     * Sets the codec used to encode staged values.
     *
     * <p>Optional. Defaults to {@link ValueCodec#getDefault()}.
     *
     * @param codec the value codec
     * @return this builder
     */
    public Builder codec(ValueCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Sets the fingerprinter used to detect changes.
     *
     * <p>Optional. Defaults to {@link Fingerprinter#getDefault()}. Changing the
     * fingerprinter of an existing database makes every tracked item look changed once.
     *
     * @param fingerprinter the fingerprinter
     * @return this builder
     */
    public Builder fingerprinter(Fingerprinter fingerprinter) {
      this.fingerprinter = fingerprinter;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how many pending changes a scan reads from the store at a time.
     *
     * <p>Optional. Defaults to {@code 100}. Must be positive.
     *
     * @param scanPageSize page size
     * @return this builder
     */
    public Builder scanPageSize(int scanPageSize) {
      this.scanPageSize = scanPageSize;
      return this;
    }

    /**
     * Sets whether {@link #build()} creates the backing tables if they are missing.
     *
     * <p>Optional. Defaults to {@code true}. Disable when the schema is managed by a
     * migration tool.
     *
     * @param createSchema whether to create the schema
     * @return this builder
     */
    public Builder createSchema(boolean createSchema) {
      this.createSchema = createSchema;
      return this;
    }

    /**
     * Builds the database handle.
     *
     * @return a new {@link DiffDatabase}
     * @throws NullPointerException     if a required property is missing
     * @throws IllegalArgumentException if {@code scanPageSize} is not positive
     * @throws IllegalStateException    if no codec is set and none is registered
     * @throws DiffStoreException       if the schema cannot be created
     */
    public DiffDatabase build() {
      return new DiffDatabase(this);
    }
  }
}
