package lockerhub;

import lockerhub.model.NewVipTransfer;
import lockerhub.model.VipTransferRequest;
import lockerhub.model.VipTransferStatus;

import java.util.List;

/**
 * Transfer requests and their state machine.
 *
 * @see VipTransferStatus
 */
public interface VipTransferRepository extends Repository<VipTransferRequest, Long, VipTransferStatus> {

    /**
     * Creates a pending request.
     *
     * @throws NotFoundException   if the contract does not exist
     * @throws ValidationException if the contract is not active, or the source or
     *                             target locker already has a pending or approved transfer
     */
    VipTransferRequest create(NewVipTransfer transfer);

    VipTransferRequest approve(long transferId, String approvedBy);

    VipTransferRequest reject(long transferId, String rejectedBy, String rejectionReason);

    VipTransferRequest complete(long transferId);

    VipTransferRequest cancel(long transferId);

    List<VipTransferRequest> getPendingTransfers();

    List<VipTransferRequest> getTransfersByContract(long contractId);

    /** {@code true} if a pending or approved transfer leaves from or goes to this locker. */
    boolean hasLockerPendingTransfers(String kioskId, int lockerId);
}
