/**
 * Manual JDBC transaction management.
 *
 * <p>{@link socialpublish.jdbc.tx.JdbcTransactionManager} scopes transactions with
 * {@link socialpublish.jdbc.tx.ThreadLocalTxContext};
 * {@link socialpublish.jdbc.tx.StatementExecutor} runs each statement so that
 * interrupting the caller cancels it.
 *
 * @see socialpublish.jdbc.tx.JdbcTransactionManager
 * @see socialpublish.jdbc.tx.ThreadLocalTxContext
 */
package socialpublish.jdbc.tx;
