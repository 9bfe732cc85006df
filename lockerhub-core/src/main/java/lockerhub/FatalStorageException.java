package lockerhub;

/**
 * Any database failure that is not transient. Propagated immediately, never retried.
 */
public class FatalStorageException extends StorageException {

    public FatalStorageException(String message, String sqlState, Throwable cause) {
        super(message, sqlState, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
