package lockerhub.model;

import lockerhub.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An audit event waiting to be appended to the event log.
 *
 * <p>Events that name a staff member are {@link StaffAction}s, all others are
 * {@link Action}s. Staff-only types ({@link EventType#requiresStaffUser()}) cannot
 * be built as an {@link Action}, so a staff event without an actor is rejected at
 * construction time.
 *
 * <pre>{@code
 * NewEvent event = NewEvent.builder(EventType.STAFF_OPEN, "K1")
 *     .lockerId(5)
 *     .staffUser("admin")
 *     .detail("reason", "customer lost card")
 *     .build();
 * }</pre>
 */
public sealed interface NewEvent permits NewEvent.Action, NewEvent.StaffAction {

  EventType type();

  String kioskId();

  Integer lockerId();

  String rfidCard();

  String deviceId();

  String staffUser();

  Map<String, Object> details();

  static Builder builder(EventType type, String kioskId) {
    return new Builder(type, kioskId);
  }

  /** Event raised by a kiosk, a card holder or the system itself. */
  record Action(
      EventType type,
      String kioskId,
      Integer lockerId,
      String rfidCard,
      String deviceId,
      Map<String, Object> details
  ) implements NewEvent {

    public Action {
      requireWritable(type);
      Objects.requireNonNull(kioskId, "kioskId");
      if (type.requiresStaffUser()) {
        throw new ValidationException("Event type " + type.code() + " requires a staff user");
      }
      details = copy(details);
    }

    @Override
    public String staffUser() {
      return null;
    }
  }

  /** Event performed by a staff member; {@code staffUser} is mandatory. */
  record StaffAction(
      EventType type,
      String kioskId,
      Integer lockerId,
      String staffUser,
      String rfidCard,
      String deviceId,
      Map<String, Object> details
  ) implements NewEvent {

    public StaffAction {
      requireWritable(type);
      Objects.requireNonNull(kioskId, "kioskId");
      if (staffUser == null || staffUser.isBlank()) {
        throw new ValidationException("Staff action " + type.code() + " requires a staff user");
      }
      details = copy(details);
    }
  }

  private static void requireWritable(EventType type) {
    Objects.requireNonNull(type, "type");
    if (type == EventType.OTHER) {
      throw new ValidationException("Event type " + type.code() + " cannot be written");
    }
  }

  private static Map<String, Object> copy(Map<String, Object> details) {
    return details == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  final class Builder {
    private final EventType type;
    private final String kioskId;
    private Integer lockerId;
    private String rfidCard;
    private String deviceId;
    private String staffUser;
    private final Map<String, Object> details = new LinkedHashMap<>();

    private Builder(EventType type, String kioskId) {
      this.type = type;
      this.kioskId = kioskId;
    }

    public Builder lockerId(Integer lockerId) {
      this.lockerId = lockerId;
      return this;
    }

    public Builder rfidCard(String rfidCard) {
      this.rfidCard = rfidCard;
      return this;
    }

    public Builder deviceId(String deviceId) {
      this.deviceId = deviceId;
      return this;
    }

    public Builder staffUser(String staffUser) {
      this.staffUser = staffUser;
      return this;
    }

    public Builder detail(String key, Object value) {
      details.put(key, value);
      return this;
    }

    public Builder details(Map<String, Object> details) {
      if (details != null) {
        this.details.putAll(details);
      }
      return this;
    }

    /**
     * Builds a {@link StaffAction} when a staff user was given, otherwise an {@link Action}.
     *
     * @throws ValidationException if the type requires a staff user and none was given
     */
    public NewEvent build() {
      if (staffUser != null) {
        return new StaffAction(type, kioskId, lockerId, staffUser, rfidCard, deviceId, details);
      }
      return new Action(type, kioskId, lockerId, rfidCard, deviceId, details);
    }
  }
}
