package lockerhub;

/**
 * Base type for every error raised by the lockerhub core.
 *
 * <p>All errors are unchecked. Callers that need to react to a specific failure
 * catch one of the subtypes: {@link NotFoundException}, {@link OptimisticLockException},
 * {@link ValidationException} or {@link StorageException}.
 */
public class LockerHubException extends RuntimeException {

    public LockerHubException(String message) {
        super(message);
    }

    public LockerHubException(String message, Throwable cause) {
        super(message, cause);
    }
}
