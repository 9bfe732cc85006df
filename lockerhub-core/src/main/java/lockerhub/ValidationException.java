package lockerhub;

/**
 * Thrown when input is rejected before it reaches storage, for example a staff
 * event without a staff user or an update that changes nothing.
 */
public class ValidationException extends LockerHubException {

    public ValidationException(String message) {
        super(message);
    }
}
