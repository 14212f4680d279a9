package socialpublish.jdbc.tx;

import java.sql.Connection;

/**
 * Keeps the active transaction's connection in a {@link ThreadLocal}.
 *
 * <p>Bound and cleared by {@link JdbcTransactionManager}; statements issued on the
 * same thread inside the scope pick the connection up from here.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext {
  private final ThreadLocal<Connection> current = new ThreadLocal<>();

  public boolean isTransactionActive() {
    return current.get() != null;
  }

  public Connection currentConnection() {
    Connection connection = current.get();
    if (connection == null) {
      throw new IllegalStateException("No active transaction");
    }
    return connection;
  }

  void bind(Connection connection) {
    if (current.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    current.set(connection);
  }

  void clear() {
    current.remove();
  }
}
