/**
 * JDBC persistence: the pooled {@link socialpublish.jdbc.Database} bootstrap,
 * {@link socialpublish.jdbc.JdbcTemplate}, and the connection provider.
 *
 * <p>Transactions live in {@code socialpublish.jdbc.tx}, migrations in
 * {@code socialpublish.jdbc.migration}, engine differences in
 * {@code socialpublish.jdbc.dialect}.
 */
package socialpublish.jdbc;
