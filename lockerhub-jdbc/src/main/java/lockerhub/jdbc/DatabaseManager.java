package lockerhub.jdbc;

import lockerhub.DuplicateKeyException;
import lockerhub.FatalStorageException;
import lockerhub.StorageException;
import lockerhub.TransientStorageException;
import lockerhub.jdbc.dialect.Dialects;
import lockerhub.jdbc.spi.Dialect;
import lockerhub.jdbc.tx.JdbcTransactionManager;
import lockerhub.jdbc.tx.ThreadLocalTxContext;
import lockerhub.spi.ConnectionProvider;
import lockerhub.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Connection and transaction manager shared by every repository.
 *
 * <p>Work runs on the current transaction's connection when {@link #inTransaction}
 * is active on the calling thread, otherwise on a fresh auto-committed connection.
 * Every new connection gets the dialect's session settings (lock wait timeout,
 * journaling pragmas).
 *
 * <p>{@link SQLException}s are translated through the dialect into
 * {@link DuplicateKeyException}, {@link TransientStorageException} or
 * {@link FatalStorageException}. Only transient failures are retried, with linear
 * backoff ({@code retryDelay * attempt}), and only at the outermost level: a
 * statement inside a transaction is never retried on its own, the whole
 * transaction is.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class DatabaseManager {
  private static final Logger logger = Logger.getLogger(DatabaseManager.class.getName());

  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(100);
  public static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(5);

  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;
  private final MetricsExporter metrics;
  private final int maxAttempts;
  private final Duration retryDelay;
  private final List<String> sessionInitStatements;
  private final ThreadLocalTxContext txContext = new ThreadLocalTxContext();
  private final JdbcTransactionManager txManager;

  private DatabaseManager(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.dialect = Objects.requireNonNull(builder.dialect, "dialect");
    Objects.requireNonNull(builder.retryDelay, "retryDelay");
    Objects.requireNonNull(builder.busyTimeout, "busyTimeout");
    if (builder.maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0, got: " + builder.maxAttempts);
    }
    if (builder.retryDelay.isNegative()) {
      throw new IllegalArgumentException("retryDelay must be >= 0");
    }
    if (builder.busyTimeout.isNegative()) {
      throw new IllegalArgumentException("busyTimeout must be >= 0");
    }
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.maxAttempts = builder.maxAttempts;
    this.retryDelay = builder.retryDelay;
    this.sessionInitStatements = List.copyOf(dialect.sessionInitStatements(builder.busyTimeout));
    this.txManager = new JdbcTransactionManager(this::openConnection, txContext);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Dialect dialect() {
    return dialect;
  }

  public MetricsExporter metrics() {
    return metrics;
  }

  public boolean isTransactionActive() {
    return txContext.isTransactionActive();
  }

  /**
   * Runs {@code work} on the current transaction's connection, or on a new
   * auto-committed connection with transient-error retry when no transaction is active.
   *
   * @throws StorageException if the database reports an error
   */
  public <T> T execute(SqlWork<T> work) {
    Objects.requireNonNull(work, "work");
    if (txContext.isTransactionActive()) {
      try {
        return work.run(txContext.currentConnection());
      } catch (SQLException e) {
        throw translate(e);
      }
    }
    return withRetry(() -> {
      try (Connection conn = openConnection()) {
        return work.run(conn);
      } catch (SQLException e) {
        throw translate(e);
      }
    }, maxAttempts, retryDelay);
  }

  /**
   * Runs {@code work} in a transaction. Repository calls made by {@code work} on this
   * thread share the transaction's connection and commit or roll back together.
   *
   * <p>A nested call joins the enclosing transaction. The outermost call commits,
   * rolls back when {@code work} throws, and re-runs {@code work} from the start on a
   * transient failure, so {@code work} must not have side effects outside the database.
   */
  public <T> T inTransaction(Supplier<T> work) {
    Objects.requireNonNull(work, "work");
    if (txContext.isTransactionActive()) {
      return work.get();
    }
    return withRetry(() -> runInNewTransaction(work), maxAttempts, retryDelay);
  }

  private <T> T runInNewTransaction(Supplier<T> work) {
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      T result = work.get();
      tx.commit();
      return result;
    } catch (SQLException e) {
      throw translate(e);
    }
  }

  /**
   * Runs {@code callback} after the current transaction commits, or immediately when
   * no transaction is active. Callbacks registered in a transaction that rolls back never run.
   */
  public void afterCommit(Runnable callback) {
    if (txContext.isTransactionActive()) {
      txContext.afterCommit(callback);
    } else {
      callback.run();
    }
  }

  /**
   * Runs {@code callback} once the current transaction ends, whether it commits or rolls
   * back, or immediately when no transaction is active.
   */
  public void afterCompletion(Runnable callback) {
    if (txContext.isTransactionActive()) {
      txContext.afterCommit(callback);
      txContext.afterRollback(callback);
    } else {
      callback.run();
    }
  }

  /**
   * Runs {@code work}, re-running it after a {@link TransientStorageException} up to
   * {@code maxAttempts} times in total with a delay of {@code delay * attempt} between
   * attempts. Any other exception propagates immediately.
   */
  public <T> T withRetry(Supplier<T> work, int maxAttempts, Duration delay) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0, got: " + maxAttempts);
    }
    for (int attempt = 1; ; attempt++) {
      try {
        return work.get();
      } catch (TransientStorageException e) {
        if (attempt >= maxAttempts) {
          throw e;
        }
        logger.log(Level.WARNING, "Transient storage failure (attempt {0} of {1}), retrying: {2}",
            new Object[]{attempt, maxAttempts, e.getMessage()});
        metrics.incrementTransientRetries();
        if (!pause(delay.toMillis() * attempt)) {
          throw e;
        }
      }
    }
  }

  /**
   * Returns {@code true} if the database answers a trivial query.
   */
  public boolean healthCheck() {
    try {
      return execute(conn -> JdbcTemplate.queryLong(conn, "SELECT 1") == 1L);
    } catch (StorageException e) {
      logger.log(Level.WARNING, "Database health check failed", e);
      return false;
    }
  }

  Connection openConnection() throws SQLException {
    Connection conn = connectionProvider.getConnection();
    try {
      JdbcTemplate.executeAll(conn, sessionInitStatements);
    } catch (SQLException e) {
      try {
        conn.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return conn;
  }

  StorageException translate(SQLException e) {
    String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    if (dialect.isUniqueViolation(e)) {
      return new DuplicateKeyException(message, e.getSQLState(), e);
    }
    if (dialect.isTransient(e)) {
      return new TransientStorageException(message, e.getSQLState(), e);
    }
    return new FatalStorageException(message, e.getSQLState(), e);
  }

  private static boolean pause(long millis) {
    if (millis <= 0) {
      return true;
    }
    try {
      Thread.sleep(millis);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /** Builder for {@link DatabaseManager}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private Dialect dialect;
    private MetricsExporter metrics;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private Duration retryDelay = DEFAULT_RETRY_DELAY;
    private Duration busyTimeout = DEFAULT_BUSY_TIMEOUT;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b> See {@link Dialects} for detection helpers.
     */
    public Builder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Total attempts for an operation failing with a transient error.
     * Optional. Defaults to {@code 3}. Must be &gt; 0.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Base delay of the linear retry backoff. Optional. Defaults to {@code 100ms}.
     */
    public Builder retryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
      return this;
    }

    /**
     * How long a statement waits on a lock before failing. Optional. Defaults to {@code 5s}.
     */
    public Builder busyTimeout(Duration busyTimeout) {
      this.busyTimeout = busyTimeout;
      return this;
    }

    public DatabaseManager build() {
      return new DatabaseManager(this);
    }
  }
}
