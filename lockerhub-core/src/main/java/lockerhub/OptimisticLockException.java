package lockerhub;

import java.util.Objects;

/**
 * Thrown when a versioned update finds the row but at a different version than
 * the caller expected. The row is left untouched.
 *
 * <p>Callers re-read the entity and retry against {@link #actualVersion()}, or
 * surface a "this record changed, please retry" message to the user.
 */
public class OptimisticLockException extends LockerHubException {

    private final String entity;
    private final String id;
    private final long expectedVersion;
    private final long actualVersion;

    public OptimisticLockException(String entity, Object id, long expectedVersion, long actualVersion) {
        super(entity + " " + id + " was modified concurrently: expected version "
                + expectedVersion + ", found " + actualVersion);
        this.entity = Objects.requireNonNull(entity, "entity");
        this.id = String.valueOf(id);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String entity() {
        return entity;
    }

    public String id() {
        return id;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }
}
