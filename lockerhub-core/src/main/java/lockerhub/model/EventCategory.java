package lockerhub.model;

/**
 * Bucket used by event statistics: staff if a staff user is recorded, system for
 * kiosk lifecycle and {@code system_*} events, user for everything else.
 */
public enum EventCategory {
  STAFF,
  SYSTEM,
  USER;

  public static EventCategory of(EventType type, boolean hasStaffUser) {
    return of(type.code(), hasStaffUser);
  }

  /** Classifies a stored event code, including codes with no {@link EventType}. */
  public static EventCategory of(String code, boolean hasStaffUser) {
    if (hasStaffUser) {
      return STAFF;
    }
    if (code.startsWith("system_") || code.startsWith("kiosk_")
        || code.equals(EventType.RESTARTED.code())) {
      return SYSTEM;
    }
    return USER;
  }
}
