package lockerhub.model;

import java.util.Objects;

/**
 * Data needed to provision a locker. New lockers start {@link LockerStatus#FREE} at version 1.
 */
public record NewLocker(String kioskId, int id, boolean vip, String displayName) {

  public NewLocker {
    Objects.requireNonNull(kioskId, "kioskId");
    if (kioskId.isBlank()) {
      throw new IllegalArgumentException("kioskId cannot be blank");
    }
    if (id <= 0) {
      throw new IllegalArgumentException("locker id must be > 0, got: " + id);
    }
    if (displayName != null) {
      displayName = LockerUpdate.validateDisplayName(displayName);
    }
  }

  public static NewLocker of(String kioskId, int id) {
    return new NewLocker(kioskId, id, false, null);
  }
}
