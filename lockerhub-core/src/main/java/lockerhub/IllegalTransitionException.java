package lockerhub;

/**
 * Thrown when a state machine is asked to move from a state that does not
 * allow the requested transition.
 */
public class IllegalTransitionException extends ValidationException {

    private final String entity;
    private final String id;
    private final String from;
    private final String to;

    public IllegalTransitionException(String entity, Object id, String from, String to) {
        super("Cannot move " + entity + " " + id + " from " + from + " to " + to);
        this.entity = entity;
        this.id = String.valueOf(id);
        this.from = from;
        this.to = to;
    }

    public String entity() {
        return entity;
    }

    public String id() {
        return id;
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }
}
