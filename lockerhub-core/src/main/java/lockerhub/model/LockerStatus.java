package lockerhub.model;

/**
 * Lifecycle state of a locker compartment.
 *
 * <p>{@link #FREE} lockers can be reserved; {@link #RESERVED} lockers revert to
 * {@link #FREE} when the reservation expires; {@link #OWNED} lockers hold an item;
 * {@link #OPENING} is set while the kiosk drives the relay; {@link #BLOCKED} is a
 * staff hold; {@link #ERROR} marks a hardware fault.
 */
public enum LockerStatus {
  FREE("Free"),
  RESERVED("Reserved"),
  OWNED("Owned"),
  BLOCKED("Blocked"),
  OPENING("Opening"),
  ERROR("Error");

  private final String code;

  LockerStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /** Returns {@code true} if a locker in this state is held by an owner. */
  public boolean isHeld() {
    return this == RESERVED || this == OWNED || this == OPENING;
  }

  public static LockerStatus fromCode(String code) {
    for (LockerStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown locker status: " + code);
  }
}
