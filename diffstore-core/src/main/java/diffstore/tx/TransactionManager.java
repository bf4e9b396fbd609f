package diffstore.tx;

import diffstore.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lightweight transaction manager for the store operations. Obtains a connection,
 * disables auto-commit, and hands it out through a {@link Transaction}.
 *
 * <p>Use via try-with-resources on the returned {@link Transaction}:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     store.put(tx.connection(), collection, Region.PENDING, id, fingerprint);
 *     tx.commit();
 * }
 * }</pre>
 */
public final class TransactionManager {
  private final ConnectionProvider connectionProvider;

  public TransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Begins a new read-write transaction.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained
   */
  public Transaction begin() throws SQLException {
    return begin(false);
  }

  /**
   * Begins a transaction that is never committed. {@link Transaction#commit()} rolls it
   * back instead.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained
   */
  public Transaction beginReadOnly() throws SQLException {
    return begin(true);
  }

  private Transaction begin(boolean readOnly) throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      if (readOnly) {
        connection.setReadOnly(true);
      }
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return new Transaction(connection, readOnly);
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} triggers a rollback automatically.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final boolean readOnly;
    private final List<Runnable> afterCommit = new ArrayList<>();
    private boolean completed;

    private Transaction(Connection connection, boolean readOnly) {
      this.connection = connection;
      this.readOnly = readOnly;
    }

    /**
     * Returns the connection bound to this transaction.
     *
     * @throws IllegalStateException if the transaction already completed
     */
    public Connection connection() {
      if (completed) {
        throw new IllegalStateException("Transaction already completed");
      }
      return connection;
    }

    public boolean isReadOnly() {
      return readOnly;
    }

    /**
     * Registers a callback to run once this transaction commits. Callbacks are
     * discarded on rollback.
     *
     * @param callback action to execute post-commit
     */
    public void afterCommit(Runnable callback) {
      Objects.requireNonNull(callback, "callback");
      if (completed) {
        throw new IllegalStateException("Transaction already completed");
      }
      afterCommit.add(callback);
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      if (readOnly) {
        rollback();
        return;
      }
      boolean committed = false;
      try {
        connection.commit();
        committed = true;
      } catch (SQLException e) {
        safeRollback(e);
        throw e;
      } finally {
        finalizeTx(committed);
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finalizeTx(false);
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finalizeTx(boolean committed) throws SQLException {
      RuntimeException callbackException = null;
      try {
        if (committed) {
          for (Runnable callback : afterCommit) {
            try {
              callback.run();
            } catch (RuntimeException e) {
              if (callbackException == null) callbackException = e;
              else callbackException.addSuppressed(e);
            }
          }
        }
      } finally {
        afterCommit.clear();
        completed = true;
        // Pooled connections get auto-commit and read-only reset by the pool on return
        connection.close();
      }
      if (callbackException != null) {
        throw callbackException;
      }
    }

    private void safeRollback(SQLException failure) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        failure.addSuppressed(e);
      }
    }
  }
}
