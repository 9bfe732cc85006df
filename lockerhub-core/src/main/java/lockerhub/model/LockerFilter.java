package lockerhub.model;

/**
 * Criteria for {@code LockerRepository.findAll}. {@code null} fields are not constrained.
 */
public record LockerFilter(String kioskId, LockerStatus status, String ownerKey, Boolean vip) {

  public static LockerFilter all() {
    return new LockerFilter(null, null, null, null);
  }

  public static LockerFilter byKiosk(String kioskId) {
    return new LockerFilter(kioskId, null, null, null);
  }

  public LockerFilter withKiosk(String kioskId) {
    return new LockerFilter(kioskId, status, ownerKey, vip);
  }

  public LockerFilter withStatus(LockerStatus status) {
    return new LockerFilter(kioskId, status, ownerKey, vip);
  }

  public LockerFilter withOwnerKey(String ownerKey) {
    return new LockerFilter(kioskId, status, ownerKey, vip);
  }

  public LockerFilter withVip(Boolean vip) {
    return new LockerFilter(kioskId, status, ownerKey, vip);
  }
}
