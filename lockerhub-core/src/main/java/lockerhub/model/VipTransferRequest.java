package lockerhub.model;

import java.time.Instant;

/**
 * Request to move a VIP contract to another locker, optionally with a new card.
 */
public record VipTransferRequest(
    long id,
    long contractId,
    String fromKioskId,
    int fromLockerId,
    String toKioskId,
    int toLockerId,
    String newRfidCard,
    String reason,
    String requestedBy,
    String approvedBy,
    VipTransferStatus status,
    String rejectionReason,
    Instant createdAt,
    Instant approvedAt,
    Instant completedAt
) {

  public boolean touches(String kioskId, int lockerId) {
    return (fromKioskId.equals(kioskId) && fromLockerId == lockerId)
        || (toKioskId.equals(kioskId) && toLockerId == lockerId);
  }
}
