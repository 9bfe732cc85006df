package lockerhub.model;

import java.time.Instant;

/**
 * Liveness row of a kiosk.
 *
 * @param offlineThresholdSeconds how long this kiosk may stay silent before the
 *                                sweep marks it offline
 */
public record KioskHeartbeat(
    String kioskId,
    Instant lastSeen,
    String zone,
    KioskStatus status,
    String version,
    String lastConfigHash,
    int offlineThresholdSeconds,
    String hardwareId,
    String registrationSecret,
    Instant createdAt,
    Instant updatedAt
) {

  public boolean isOnline() {
    return status == KioskStatus.ONLINE;
  }

  @Override
  public String toString() {
    return "KioskHeartbeat{kioskId=" + kioskId + ", zone=" + zone + ", status=" + status.code()
        + ", lastSeen=" + lastSeen + ", version=" + version + "}";
  }
}
