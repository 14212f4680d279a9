package socialpublish.jdbc.migration;

import socialpublish.jdbc.JdbcTemplate;
import socialpublish.jdbc.spi.Dialect;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;

/**
 * What a migration sees while the migration transaction is open.
 *
 * @param connection     the migration transaction's connection
 * @param jdbc           statement helper
 * @param dialect        the engine's dialect, for schema introspection
 * @param passwordHasher hasher for seeded accounts
 * @param clock          source of seeded timestamps
 */
public record MigrationContext(
    Connection connection,
    JdbcTemplate jdbc,
    Dialect dialect,
    PasswordHasher passwordHasher,
    Clock clock) {

  public boolean tableExists(String table) throws SQLException {
    return dialect.tableExists(jdbc, connection, table);
  }

  public boolean columnExists(String table, String column) throws SQLException {
    return dialect.columnExists(jdbc, connection, table, column);
  }

  public long count(String sql, Object... params) throws SQLException {
    return jdbc.queryLong(connection, sql, params);
  }

  public int update(String sql, Object... params) throws SQLException {
    return jdbc.update(connection, sql, params);
  }

  public void execute(String sql) throws SQLException {
    jdbc.execute(connection, sql);
  }
}
