package lockerhub.jdbc;

import lockerhub.EventLog;
import lockerhub.LockerRepository;
import lockerhub.ValidationException;
import lockerhub.VipContractRepository;
import lockerhub.VipTransferRepository;
import lockerhub.model.EventType;
import lockerhub.model.Locker;
import lockerhub.model.LockerUpdate;
import lockerhub.model.NewEvent;
import lockerhub.model.NewVipTransfer;
import lockerhub.model.VipContract;
import lockerhub.model.VipTransferRequest;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives a VIP transfer request from request to completion, writing a
 * {@code vip_transfer_*} event for each step in the same transaction as the state change.
 *
 * <p>Completing a transfer moves the contract, flips the VIP flag of the source and
 * target lockers and marks the request completed, all or nothing.
 */
public final class VipTransferWorkflow {
  private static final Logger logger = Logger.getLogger(VipTransferWorkflow.class.getName());

  private final DatabaseManager db;
  private final VipTransferRepository transfers;
  private final VipContractRepository contracts;
  private final LockerRepository lockers;
  private final EventLog events;

  public VipTransferWorkflow(DatabaseManager db, VipTransferRepository transfers,
      VipContractRepository contracts, LockerRepository lockers, EventLog events) {
    this.db = Objects.requireNonNull(db, "db");
    this.transfers = Objects.requireNonNull(transfers, "transfers");
    this.contracts = Objects.requireNonNull(contracts, "contracts");
    this.lockers = Objects.requireNonNull(lockers, "lockers");
    this.events = Objects.requireNonNull(events, "events");
  }

  public VipTransferRequest request(NewVipTransfer transfer) {
    Objects.requireNonNull(transfer, "transfer");
    return db.inTransaction(() -> {
      VipTransferRequest created = transfers.create(transfer);
      log(EventType.VIP_TRANSFER_REQUESTED, created, created.requestedBy(), created.reason());
      return created;
    });
  }

  public VipTransferRequest approve(long transferId, String approvedBy) {
    return db.inTransaction(() -> {
      VipTransferRequest approved = transfers.approve(transferId, approvedBy);
      log(EventType.VIP_TRANSFER_APPROVED, approved, approvedBy, null);
      return approved;
    });
  }

  public VipTransferRequest reject(long transferId, String rejectedBy, String rejectionReason) {
    return db.inTransaction(() -> {
      VipTransferRequest rejected = transfers.reject(transferId, rejectedBy, rejectionReason);
      log(EventType.VIP_TRANSFER_REJECTED, rejected, rejectedBy, rejectionReason);
      return rejected;
    });
  }

  /**
   * Applies an approved transfer.
   *
   * @throws ValidationException if another active contract already holds the target locker
   */
  public VipContract complete(long transferId, String performedBy) {
    Objects.requireNonNull(performedBy, "performedBy");
    VipContract moved = db.inTransaction(() -> {
      VipTransferRequest completed = transfers.complete(transferId);
      if (!contracts.isLockerAvailable(completed.toKioskId(), completed.toLockerId())) {
        throw new ValidationException("Locker " + completed.toKioskId() + ":" + completed.toLockerId()
            + " already has an active VIP contract");
      }
      VipContract contract = contracts.transferContract(completed.contractId(), completed.toKioskId(),
          completed.toLockerId(), performedBy, completed.newRfidCard(), completed.reason());
      setVip(completed.fromKioskId(), completed.fromLockerId(), false);
      setVip(completed.toKioskId(), completed.toLockerId(), true);
      log(EventType.VIP_TRANSFER_COMPLETED, completed, performedBy, completed.reason());
      return contract;
    });
    logger.log(Level.INFO, "VIP contract {0} moved to {1}", new Object[]{moved.id(), moved.location()});
    return moved;
  }

  public VipTransferRequest cancel(long transferId, String cancelledBy) {
    return db.inTransaction(() -> {
      VipTransferRequest cancelled = transfers.cancel(transferId);
      log(EventType.VIP_TRANSFER_CANCELLED, cancelled, cancelledBy, null);
      return cancelled;
    });
  }

  private void setVip(String kioskId, int lockerId, boolean vip) {
    Optional<Locker> locker = lockers.findByKioskAndId(kioskId, lockerId);
    if (locker.isPresent() && locker.get().vip() != vip) {
      lockers.update(locker.get().key(), LockerUpdate.builder().vip(vip).build(), locker.get().version());
    }
  }

  private void log(EventType type, VipTransferRequest transfer, String staffUser, String reason) {
    events.create(NewEvent.builder(type, transfer.fromKioskId())
        .lockerId(transfer.fromLockerId())
        .staffUser(staffUser)
        .detail("contract_id", transfer.contractId())
        .detail("transfer_id", transfer.id())
        .detail("to_kiosk_id", transfer.toKioskId())
        .detail("to_locker_id", transfer.toLockerId())
        .detail("reason", reason)
        .build());
  }
}
