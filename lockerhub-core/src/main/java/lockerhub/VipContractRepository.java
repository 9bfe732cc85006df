package lockerhub;

import lockerhub.model.NewVipContract;
import lockerhub.model.VipAuditTrail;
import lockerhub.model.VipContract;
import lockerhub.model.VipContractFilter;
import lockerhub.model.VipContractStatistics;
import lockerhub.model.VipHistoryEntry;
import lockerhub.model.VipOperation;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * VIP contract store.
 *
 * <p>Every mutation runs in one transaction that re-reads the contract, applies a
 * versioned update and appends a history row, so either both are stored or neither is.
 *
 * <p>Exclusivity of lockers and cards is a caller precondition: check
 * {@link #isLockerAvailable} and {@link #isRfidCardAvailable} before {@link #create}.
 */
public interface VipContractRepository extends Repository<VipContract, Long, VipContractFilter> {

    int DEFAULT_EXPIRING_DAYS = 7;

    /** Creates the contract and its {@code created} history row. */
    VipContract create(NewVipContract contract);

    /** Active contract whose date range covers today and that holds this card as primary or backup. */
    Optional<VipContract> findActiveByCard(String rfidCard);

    Optional<VipContract> findActiveByLocker(String kioskId, int lockerId);

    boolean isLockerAvailable(String kioskId, int lockerId);

    boolean isRfidCardAvailable(String rfidCard);

    /** Active contracts ending within the next {@code days} days. */
    List<VipContract> findExpiringSoon(int days);

    /**
     * Moves active contracts whose end date has passed to expired.
     *
     * @return number of contracts expired
     */
    int markExpiredContracts();

    VipContract extendContract(long contractId, LocalDate newEndDate, String performedBy, String reason);

    VipContract changeCard(long contractId, String newCard, String performedBy, String reason);

    VipContract cancelContract(long contractId, String performedBy, String reason);

    /**
     * Moves the contract to another locker.
     *
     * @param newCard replacement card, or {@code null} to keep the current one
     */
    VipContract transferContract(long contractId, String newKioskId, int newLockerId,
            String performedBy, String newCard, String reason);

    /**
     * Files an operator-level audit record for a VIP operation, enriched with the
     * contract's current location, card and status.
     *
     * @throws NotFoundException if the contract does not exist
     */
    VipHistoryEntry auditVipOperation(VipOperation operation, long contractId, String performedBy,
            Map<String, Object> details, String ipAddress, String userAgent);

    VipAuditTrail getComprehensiveAuditTrail(long contractId);

    VipContractStatistics getStatistics();
}
