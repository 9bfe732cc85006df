package lockerhub.model;

import java.util.Objects;

/**
 * Composite identity of a locker: the kiosk it belongs to and its number within that kiosk.
 */
public record LockerKey(String kioskId, int lockerId) {

  public LockerKey {
    Objects.requireNonNull(kioskId, "kioskId");
  }

  public static LockerKey of(String kioskId, int lockerId) {
    return new LockerKey(kioskId, lockerId);
  }

  @Override
  public String toString() {
    return kioskId + ":" + lockerId;
  }
}
