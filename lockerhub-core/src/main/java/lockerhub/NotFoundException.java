package lockerhub;

import java.util.Objects;

/**
 * Thrown when an operation targets an entity that does not exist.
 */
public class NotFoundException extends LockerHubException {

    private final String entity;
    private final String id;

    public NotFoundException(String entity, Object id) {
        super(entity + " not found: " + id);
        this.entity = Objects.requireNonNull(entity, "entity");
        this.id = String.valueOf(id);
    }

    public String entity() {
        return entity;
    }

    public String id() {
        return id;
    }
}
