package socialpublish.jdbc.dialect;

import socialpublish.SqlUpdateException;
import socialpublish.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * SQLite dialect, the production engine.
 *
 * <p>SQLite reports violations only in the message text, e.g.
 * {@code UNIQUE constraint failed: documents.search_key}. The table and column are
 * taken from the {@code table.column} detail when the engine provides one.
 */
public final class SqliteDialect extends AbstractDialect {
  private static final Pattern DETAIL = Pattern.compile(
      "constraint failed:\\s*([^\\s,)\\]]+)", Pattern.CASE_INSENSITIVE);

  @Override
  public String name() {
    return "sqlite";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:sqlite:");
  }

  @Override
  public Optional<String> connectionInitSql() {
    return Optional.of("PRAGMA foreign_keys = ON");
  }

  @Override
  public String insertionOrderColumn() {
    return "rowid";
  }

  @Override
  public boolean tableExists(JdbcTemplate jdbc, Connection conn, String table) throws SQLException {
    return jdbc.queryLong(conn,
        "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = ?", table) > 0;
  }

  @Override
  public boolean columnExists(JdbcTemplate jdbc, Connection conn, String table, String column)
      throws SQLException {
    return jdbc.queryLong(conn,
        "SELECT COUNT(*) FROM pragma_table_info(?) WHERE name = ?", table, column) > 0;
  }

  @Override
  protected SqlUpdateException violationOf(SQLException e) {
    String message = e.getMessage();
    String detail = group(DETAIL, message, 1);
    String table = null;
    String column = null;
    if (detail != null && detail.indexOf('.') > 0) {
      table = detail.substring(0, detail.indexOf('.'));
      column = detail.substring(detail.indexOf('.') + 1);
    }
    if (containsIgnoreCase(message, "UNIQUE constraint")) {
      return new SqlUpdateException.UniqueViolation(table, column, detail, e);
    }
    if (containsIgnoreCase(message, "FOREIGN KEY constraint")) {
      return new SqlUpdateException.ForeignKeyViolation(table, column, detail, e);
    }
    if (containsIgnoreCase(message, "CHECK constraint")) {
      return new SqlUpdateException.CheckViolation(null, null, detail, e);
    }
    return null;
  }
}
