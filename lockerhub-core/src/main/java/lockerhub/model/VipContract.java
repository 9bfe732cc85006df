package lockerhub.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Long-term lease binding an RFID card (and optionally a backup card) to one locker
 * for a date range. Both dates are inclusive.
 */
public record VipContract(
    long id,
    String kioskId,
    int lockerId,
    String rfidCard,
    String backupCard,
    LocalDate startDate,
    LocalDate endDate,
    VipContractStatus status,
    String createdBy,
    long version,
    Instant createdAt,
    Instant updatedAt
) {

  /** Returns {@code kioskId:lockerId}. */
  public String location() {
    return kioskId + ":" + lockerId;
  }

  public boolean isActiveOn(LocalDate day) {
    return status == VipContractStatus.ACTIVE
        && !day.isBefore(startDate)
        && !day.isAfter(endDate);
  }

  public boolean holdsCard(String card) {
    return card.equals(rfidCard) || card.equals(backupCard);
  }
}
