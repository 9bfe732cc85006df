package lockerhub;

import lockerhub.model.Event;
import lockerhub.model.EventFilter;
import lockerhub.model.EventStatistics;
import lockerhub.model.EventType;
import lockerhub.model.NewEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only audit log.
 */
public interface EventLog {

    Duration DEFAULT_RETENTION = Duration.ofDays(30);
    int DEFAULT_RECENT_LIMIT = 100;

    Event create(NewEvent event);

    /**
     * Convenience for non-staff events.
     *
     * @throws ValidationException if {@code type} requires a staff user
     */
    default Event logEvent(String kioskId, Integer lockerId, EventType type, Map<String, Object> details) {
        return create(NewEvent.builder(type, kioskId).lockerId(lockerId).details(details).build());
    }

    Optional<Event> findById(long id);

    List<Event> findAll(EventFilter filter);

    int count(EventFilter filter);

    List<Event> findByDateRange(Instant from, Instant to);

    List<Event> findRecent(int limit);

    default List<Event> findRecent() {
        return findRecent(DEFAULT_RECENT_LIMIT);
    }

    List<Event> findByLocker(String kioskId, int lockerId, int limit);

    /**
     * Staff and VIP administration events, see {@link EventType#staffAudited()}.
     *
     * @param staffUser restrict to one staff member, or {@code null}
     * @param from      inclusive lower bound, or {@code null}
     * @param to        inclusive upper bound, or {@code null}
     */
    List<Event> findStaffActions(String staffUser, Instant from, Instant to);

    /**
     * @param from inclusive lower bound, or {@code null}
     * @param to   inclusive upper bound, or {@code null}
     */
    EventStatistics getStatistics(Instant from, Instant to);

    /**
     * @return number of events deleted
     */
    int cleanupOldEvents(Duration retention);

    default int cleanupOldEvents() {
        return cleanupOldEvents(DEFAULT_RETENTION);
    }
}
