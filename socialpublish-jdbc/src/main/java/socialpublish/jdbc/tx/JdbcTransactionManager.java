package socialpublish.jdbc.tx;

import socialpublish.StoreException;
import socialpublish.jdbc.spi.Dialect;
import socialpublish.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Scoped JDBC transactions over a pooled {@link ConnectionProvider}.
 *
 * <p>{@link #withTransaction(TxCallback)} obtains a connection, disables auto-commit,
 * binds the connection to the {@link ThreadLocalTxContext}, runs the body, and commits.
 * Any exception, including a {@link socialpublish.QueryCancelledException}, rolls the
 * whole transaction back. On every exit path auto-commit is restored and the
 * connection is returned to the pool.
 *
 * <pre>{@code
 * Document doc = txManager.withTransaction(conn -> {
 *     jdbc.update("INSERT INTO ...", ...);
 *     return ...;
 * });
 * }</pre>
 *
 * <p>A call made while a transaction is already active on the thread joins it.
 * {@link SQLException}s escaping the body are classified by the {@link Dialect}
 * and rethrown as {@link socialpublish.SqlUpdateException}.
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager {
  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;
  private final Dialect dialect;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext,
      Dialect dialect) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public ThreadLocalTxContext txContext() {
    return txContext;
  }

  /**
   * Runs {@code body} in a transaction and returns its result.
   *
   * @throws StoreException if no connection can be obtained or a statement fails
   */
  public <T> T withTransaction(TxCallback<T> body) {
    Objects.requireNonNull(body, "body");
    if (txContext.isTransactionActive()) {
      try {
        return body.execute(txContext.currentConnection());
      } catch (SQLException e) {
        throw dialect.classify(e);
      }
    }

    Transaction tx;
    try {
      tx = begin();
    } catch (SQLException e) {
      throw new StoreException("Failed to begin transaction", e);
    }
    try (tx) {
      T result = body.execute(tx.connection());
      tx.commit();
      return result;
    } catch (SQLException e) {
      throw dialect.classify(e);
    }
  }

  /**
   * Begins a new transaction by obtaining a connection and binding it to the thread context.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
    }

    public Connection connection() {
      return connection;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        try {
          connection.rollback();
        } catch (SQLException rollbackFailure) {
          e.addSuppressed(rollbackFailure);
        }
        throw e;
      } finally {
        release();
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        release();
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void release() throws SQLException {
      completed = true;
      txContext.clear();
      try {
        connection.setAutoCommit(true);
      } finally {
        connection.close();
      }
    }
  }
}
