package lockerhub.jdbc.tx;

import lockerhub.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TxContext} that keeps the current transaction's connection in a {@link ThreadLocal}.
 *
 * <p>Bound and cleared by {@link JdbcTransactionManager}; repositories only read it.
 */
public final class ThreadLocalTxContext implements TxContext {
  private final ThreadLocal<TxState> state = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return state.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return required().connection;
  }

  @Override
  public void afterCommit(Runnable callback) {
    required().afterCommit.add(callback);
  }

  @Override
  public void afterRollback(Runnable callback) {
    required().afterRollback.add(callback);
  }

  void bind(Connection connection) {
    if (state.get() != null) {
      throw new IllegalStateException("Transaction already active on " + Thread.currentThread().getName());
    }
    state.set(new TxState(connection));
  }

  /**
   * Unbinds the transaction and runs the callbacks registered for its outcome.
   * Every callback runs even if an earlier one throws; the first failure is rethrown
   * with later ones suppressed.
   */
  void complete(boolean committed) {
    TxState current = state.get();
    if (current == null) {
      return;
    }
    state.remove();
    List<Runnable> callbacks = committed ? current.afterCommit : current.afterRollback;
    RuntimeException first = null;
    for (Runnable callback : callbacks) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private TxState required() {
    TxState current = state.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current;
  }

  private static final class TxState {
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();
    private final List<Runnable> afterRollback = new ArrayList<>();

    private TxState(Connection connection) {
      this.connection = connection;
    }
  }
}
