package lockerhub.jdbc.tx;

import lockerhub.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Begins JDBC transactions and binds them to a {@link ThreadLocalTxContext} so that
 * every repository call on the same thread joins the transaction.
 *
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     contracts.extendContract(id, newEnd, "admin", null);
 *     events.create(event);
 *     tx.commit();
 * }
 * }</pre>
 *
 * <p>Most callers use {@code DatabaseManager.inTransaction} instead, which adds
 * transient-error retry on top of this class.
 */
public final class JdbcTransactionManager {
  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  /**
   * Obtains a connection, switches off auto-commit and binds it to the current thread.
   *
   * @return the transaction handle; use with try-with-resources
   * @throws SQLException if a connection cannot be obtained or configured
   * @throws IllegalStateException if a transaction is already active on this thread
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  /**
   * Handle of an active transaction. Closing it without a successful {@link #commit()}
   * rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
    }

    public boolean isCompleted() {
      return completed;
    }

    /**
     * Commits and runs the after-commit callbacks. If the commit fails the
     * transaction is rolled back and the after-rollback callbacks run instead.
     */
    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        try {
          connection.rollback();
        } catch (SQLException rollbackFailure) {
          e.addSuppressed(rollbackFailure);
        }
        finish(false);
        throw e;
      }
      finish(true);
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finish(false);
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finish(boolean committed) throws SQLException {
      completed = true;
      try {
        txContext.complete(committed);
      } finally {
        try {
          connection.setAutoCommit(true);
        } finally {
          connection.close();
        }
      }
    }
  }
}
