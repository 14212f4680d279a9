package socialpublish.jdbc;

import socialpublish.jdbc.tx.StatementExecutor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Lightweight JDBC helper used by the migrations and the document store.
 *
 * <p>Every statement goes through the {@link StatementExecutor}, so it can be
 * cancelled by interrupting the calling thread. {@link SQLException}s propagate
 * unchanged; the transaction manager classifies them.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  @FunctionalInterface
  public interface StatementBinder {
    void bind(PreparedStatement ps) throws SQLException;
  }

  private final StatementExecutor executor;

  public JdbcTemplate(StatementExecutor executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /** Execute a single statement with an explicit binder, map every returned row. */
  public <T> List<T> execute(Connection conn, String sql, StatementBinder binder, RowMapper<T> mapper)
      throws SQLException {
    return executor.execute(conn, sql, ps -> {
      binder.bind(ps);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    });
  }

  /** Execute UPDATE / INSERT / DELETE, return rows affected. */
  public int update(Connection conn, String sql, Object... params) throws SQLException {
    return executor.execute(conn, sql, ps -> {
      bindParams(ps, params);
      return ps.executeUpdate();
    });
  }

  /** Execute DDL. */
  public void execute(Connection conn, String sql) throws SQLException {
    executor.execute(conn, sql, ps -> ps.execute());
  }

  /** Execute SELECT, map rows. */
  public <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params)
      throws SQLException {
    return execute(conn, sql, ps -> bindParams(ps, params), mapper);
  }

  /** Execute SELECT, map the first row if there is one. */
  public <T> Optional<T> queryFirst(Connection conn, String sql, RowMapper<T> mapper, Object... params)
      throws SQLException {
    return executor.execute(conn, sql, ps -> {
      bindParams(ps, params);
      ps.setMaxRows(1);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.ofNullable(mapper.map(rs)) : Optional.empty();
      }
    });
  }

  /** Execute a single-value SELECT such as {@code COUNT(*)}; returns 0 when no row comes back. */
  public long queryLong(Connection conn, String sql, Object... params) throws SQLException {
    return queryFirst(conn, sql, rs -> rs.getLong(1), params).orElse(0L);
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }
}
