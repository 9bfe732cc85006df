package lockerhub.model;

import java.time.Instant;

/**
 * Read-only snapshot of a persisted locker row.
 *
 * @param owner         current holder, or {@code null} when nobody holds the locker
 * @param version       optimistic lock counter; starts at 1 and grows by one per update
 */
public record Locker(
    String kioskId,
    int id,
    LockerStatus status,
    Owner owner,
    Instant reservedAt,
    Instant ownedAt,
    boolean vip,
    long version,
    String displayName,
    Instant nameUpdatedAt,
    String nameUpdatedBy,
    Instant createdAt,
    Instant updatedAt
) {

  public LockerKey key() {
    return new LockerKey(kioskId, id);
  }

  /** Free and not reserved for a VIP contract. */
  public boolean isAvailable() {
    return status == LockerStatus.FREE && !vip;
  }

  public boolean isOwnedBy(String ownerKey) {
    return owner != null && owner.key().equals(ownerKey);
  }
}
