package socialpublish.jdbc.dialect;

import socialpublish.SqlUpdateException;
import socialpublish.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * H2 dialect. Primarily for testing.
 *
 * <p>Violations are recognized by SQLState, falling back to message text.
 */
public final class H2Dialect extends AbstractDialect {
  private static final Pattern UNIQUE_DETAIL = Pattern.compile(
      "\"(?:\\w+\\.)?(\\w+) ON (?:\\w+\\.)?(\\w+)\\((\\w+)");
  private static final Pattern FOREIGN_KEY_DETAIL = Pattern.compile(
      "\"(\\w+): (?:\\w+\\.)?(\\w+) FOREIGN KEY\\((\\w+)\\)");
  private static final Pattern CHECK_DETAIL = Pattern.compile("\"(\\w+): ");

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public String insertionOrderColumn() {
    return "_ROWID_";
  }

  @Override
  public boolean tableExists(JdbcTemplate jdbc, Connection conn, String table) throws SQLException {
    return jdbc.queryLong(conn,
        "SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES"
            + " WHERE TABLE_SCHEMA = CURRENT_SCHEMA AND UPPER(TABLE_NAME) = UPPER(?)", table) > 0;
  }

  @Override
  public boolean columnExists(JdbcTemplate jdbc, Connection conn, String table, String column)
      throws SQLException {
    return jdbc.queryLong(conn,
        "SELECT COUNT(*) FROM INFORMATION_SCHEMA.COLUMNS"
            + " WHERE TABLE_SCHEMA = CURRENT_SCHEMA AND UPPER(TABLE_NAME) = UPPER(?)"
            + " AND UPPER(COLUMN_NAME) = UPPER(?)", table, column) > 0;
  }

  @Override
  protected SqlUpdateException violationOf(SQLException e) {
    String state = e.getSQLState() == null ? "" : e.getSQLState();
    String message = e.getMessage();
    if (state.equals("23505") || containsIgnoreCase(message, "Unique index or primary key violation")) {
      return new SqlUpdateException.UniqueViolation(
          group(UNIQUE_DETAIL, message, 2), group(UNIQUE_DETAIL, message, 3),
          group(UNIQUE_DETAIL, message, 1), e);
    }
    if (state.equals("23503") || state.equals("23506")
        || containsIgnoreCase(message, "Referential integrity constraint violation")) {
      return new SqlUpdateException.ForeignKeyViolation(
          group(FOREIGN_KEY_DETAIL, message, 2), group(FOREIGN_KEY_DETAIL, message, 3),
          group(FOREIGN_KEY_DETAIL, message, 1), e);
    }
    if (state.equals("23513") || state.equals("23514")
        || containsIgnoreCase(message, "Check constraint violation")) {
      return new SqlUpdateException.CheckViolation(null, null, group(CHECK_DETAIL, message, 1), e);
    }
    return null;
  }
}
