package socialpublish.jdbc.tx;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Body of a transaction scope.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TxCallback<T> {
  T execute(Connection connection) throws SQLException;
}
