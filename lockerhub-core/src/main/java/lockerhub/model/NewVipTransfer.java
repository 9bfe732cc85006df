package lockerhub.model;

import java.util.Objects;

/**
 * Data needed to request a transfer. The source location is taken from the contract.
 */
public record NewVipTransfer(
    long contractId,
    String toKioskId,
    int toLockerId,
    String newRfidCard,
    String reason,
    String requestedBy
) {

  public NewVipTransfer {
    Objects.requireNonNull(toKioskId, "toKioskId");
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(requestedBy, "requestedBy");
    if (toLockerId <= 0) {
      throw new IllegalArgumentException("toLockerId must be > 0, got: " + toLockerId);
    }
  }
}
