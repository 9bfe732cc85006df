package lockerhub.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted audit event. Events are never modified after they are written.
 *
 * @param typeCode the code as stored; differs from {@code type.code()} only for
 *     {@link EventType#OTHER}
 */
public record Event(
    long id,
    Instant timestamp,
    String kioskId,
    Integer lockerId,
    EventType type,
    String typeCode,
    String rfidCard,
    String deviceId,
    String staffUser,
    Map<String, Object> details
) {

  public Event {
    Objects.requireNonNull(type, "type");
    if (typeCode == null) {
      typeCode = type.code();
    }
  }

  public Event(long id, Instant timestamp, String kioskId, Integer lockerId, EventType type,
      String rfidCard, String deviceId, String staffUser, Map<String, Object> details) {
    this(id, timestamp, kioskId, lockerId, type, type.code(), rfidCard, deviceId, staffUser, details);
  }

  public EventCategory category() {
    return EventCategory.of(typeCode, staffUser != null);
  }
}
