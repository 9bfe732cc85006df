package lockerhub.model;

/**
 * Criteria for {@code KioskRegistry.findAll}; results are ordered by zone, then kiosk id.
 */
public record KioskFilter(String zone, KioskStatus status, String hardwareId, String version) {

  public static KioskFilter all() {
    return new KioskFilter(null, null, null, null);
  }

  public KioskFilter withZone(String zone) {
    return new KioskFilter(zone, status, hardwareId, version);
  }

  public KioskFilter withStatus(KioskStatus status) {
    return new KioskFilter(zone, status, hardwareId, version);
  }

  public KioskFilter withHardwareId(String hardwareId) {
    return new KioskFilter(zone, status, hardwareId, version);
  }

  public KioskFilter withVersion(String version) {
    return new KioskFilter(zone, status, hardwareId, version);
  }
}
