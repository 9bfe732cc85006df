package lockerhub.model;

import java.time.LocalDate;

/**
 * Criteria for {@code VipContractRepository.findAll}. {@code rfidCard} matches
 * either the primary or the backup card.
 */
public record VipContractFilter(
    String kioskId,
    Integer lockerId,
    String rfidCard,
    VipContractStatus status,
    String createdBy,
    LocalDate expiresBefore,
    LocalDate expiresAfter
) {

  public static VipContractFilter all() {
    return new VipContractFilter(null, null, null, null, null, null, null);
  }

  public VipContractFilter withLocker(String kioskId, Integer lockerId) {
    return new VipContractFilter(kioskId, lockerId, rfidCard, status, createdBy, expiresBefore, expiresAfter);
  }

  public VipContractFilter withKiosk(String kioskId) {
    return new VipContractFilter(kioskId, lockerId, rfidCard, status, createdBy, expiresBefore, expiresAfter);
  }

  public VipContractFilter withCard(String rfidCard) {
    return new VipContractFilter(kioskId, lockerId, rfidCard, status, createdBy, expiresBefore, expiresAfter);
  }

  public VipContractFilter withStatus(VipContractStatus status) {
    return new VipContractFilter(kioskId, lockerId, rfidCard, status, createdBy, expiresBefore, expiresAfter);
  }

  public VipContractFilter withCreatedBy(String createdBy) {
    return new VipContractFilter(kioskId, lockerId, rfidCard, status, createdBy, expiresBefore, expiresAfter);
  }

  public VipContractFilter expiringBetween(LocalDate after, LocalDate before) {
    return new VipContractFilter(kioskId, lockerId, rfidCard, status, createdBy, before, after);
  }
}
