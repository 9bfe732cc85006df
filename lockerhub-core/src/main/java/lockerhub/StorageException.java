package lockerhub;

/**
 * Database failure, already classified by the active SQL dialect.
 *
 * @see TransientStorageException
 * @see FatalStorageException
 */
public abstract class StorageException extends LockerHubException {

    private final String sqlState;

    protected StorageException(String message, String sqlState, Throwable cause) {
        super(message, cause);
        this.sqlState = sqlState;
    }

    /**
     * Returns the SQLSTATE reported by the driver, or {@code null} if none was available.
     */
    public String sqlState() {
        return sqlState;
    }

    /**
     * Returns {@code true} if the failed operation may succeed when attempted again.
     */
    public abstract boolean isRetryable();
}
