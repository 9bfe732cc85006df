/**
 * Manual JDBC transaction management.
 *
 * <p>{@link lockerhub.jdbc.tx.JdbcTransactionManager} binds one connection per thread
 * through {@link lockerhub.jdbc.tx.ThreadLocalTxContext}; nested calls join the
 * outer transaction.
 *
 * @see lockerhub.jdbc.DatabaseManager
 */
package lockerhub.jdbc.tx;
