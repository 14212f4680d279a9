package socialpublish.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides pooled JDBC connections to the transaction manager.
 *
 * <p>Callers are responsible for closing the returned connection, which hands it
 * back to the pool. A {@code DataSource} is adapted with {@code dataSource::getConnection}.
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a connection, blocking until one is available or the pool gives up.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
