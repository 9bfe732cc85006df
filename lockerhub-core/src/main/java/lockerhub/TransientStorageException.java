package lockerhub;

/**
 * Lock contention (busy, locked, deadlock, lock timeout). The connection manager
 * retries these a bounded number of times before giving up.
 */
public class TransientStorageException extends StorageException {

    public TransientStorageException(String message, String sqlState, Throwable cause) {
        super(message, sqlState, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
