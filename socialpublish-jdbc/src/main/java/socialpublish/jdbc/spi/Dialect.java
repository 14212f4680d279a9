package socialpublish.jdbc.spi;

import socialpublish.SqlUpdateException;
import socialpublish.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations cover what differs between engines: how constraint violations are
 * reported, how the schema is introspected by the migrations, and which column
 * reflects insertion order. Register custom dialects via
 * {@code META-INF/services/socialpublish.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: SQLite (production), H2.
 *
 * @see socialpublish.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "sqlite", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:sqlite:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * SQL run on every new pooled connection, if the engine needs any.
   */
  default Optional<String> connectionInitSql() {
    return Optional.empty();
  }

  /**
   * Column usable in {@code ORDER BY} to break ties by insertion order.
   */
  String insertionOrderColumn();

  /**
   * Whether {@code table} exists in the current schema.
   */
  boolean tableExists(JdbcTemplate jdbc, Connection conn, String table) throws SQLException;

  /**
   * Whether {@code table} has a column named {@code column}.
   */
  boolean columnExists(JdbcTemplate jdbc, Connection conn, String table, String column)
      throws SQLException;

  /**
   * Classifies a failed statement.
   *
   * @return a {@link SqlUpdateException.Unknown} when the error is not a recognized violation
   */
  SqlUpdateException classify(SQLException e);
}
