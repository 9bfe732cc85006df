package lockerhub;

/**
 * Unique or primary key violation.
 */
public class DuplicateKeyException extends FatalStorageException {

    public DuplicateKeyException(String message, String sqlState, Throwable cause) {
        super(message, sqlState, cause);
    }
}
