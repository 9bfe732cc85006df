package lockerhub.spi;

import java.sql.Connection;

/**
 * The transaction a locker operation runs in, if any.
 *
 * <p>When a transaction is bound, every repository call on the thread writes through
 * {@link #currentConnection()}, so a locker update, its audit event and any command it
 * enqueues commit or roll back together. Without one each statement auto-commits.
 */
public interface TxContext {

    boolean isTransactionActive();

    /**
     * @throws IllegalStateException if no transaction is bound to this thread
     */
    Connection currentConnection();

    /**
     * Defers {@code callback} until the bound transaction commits; it is dropped on rollback.
     *
     * @throws IllegalStateException if no transaction is bound to this thread
     */
    void afterCommit(Runnable callback);

    /**
     * @throws IllegalStateException if no transaction is bound to this thread
     */
    void afterRollback(Runnable callback);
}
