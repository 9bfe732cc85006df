package lockerhub.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Data needed to create a VIP contract. New contracts start {@link VipContractStatus#ACTIVE}.
 *
 * <p>The store does not enforce exclusivity: callers check
 * {@code VipContractRepository.isLockerAvailable} and {@code isRfidCardAvailable} first.
 */
public record NewVipContract(
    String kioskId,
    int lockerId,
    String rfidCard,
    String backupCard,
    LocalDate startDate,
    LocalDate endDate,
    String createdBy
) {

  public NewVipContract {
    Objects.requireNonNull(kioskId, "kioskId");
    Objects.requireNonNull(rfidCard, "rfidCard");
    Objects.requireNonNull(startDate, "startDate");
    Objects.requireNonNull(endDate, "endDate");
    Objects.requireNonNull(createdBy, "createdBy");
    if (lockerId <= 0) {
      throw new IllegalArgumentException("lockerId must be > 0, got: " + lockerId);
    }
    if (rfidCard.isBlank()) {
      throw new IllegalArgumentException("rfidCard cannot be blank");
    }
    if (endDate.isBefore(startDate)) {
      throw new IllegalArgumentException("endDate must not be before startDate");
    }
    if (rfidCard.equals(backupCard)) {
      throw new IllegalArgumentException("backupCard must differ from rfidCard");
    }
  }
}
