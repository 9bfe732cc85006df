package lockerhub;

import lockerhub.model.NewVipHistoryEntry;
import lockerhub.model.VipHistoryEntry;
import lockerhub.model.VipHistoryFilter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Append-only history of VIP contract changes.
 */
public interface VipHistoryRepository {

    Duration DEFAULT_RETENTION = Duration.ofDays(365);
    int DEFAULT_RECENT_LIMIT = 50;

    VipHistoryEntry logAction(NewVipHistoryEntry entry);

    List<VipHistoryEntry> getContractHistory(long contractId);

    List<VipHistoryEntry> getStaffAuditTrail(String performedBy, Instant from, Instant to);

    List<VipHistoryEntry> getRecentActions(int limit);

    List<VipHistoryEntry> findAll(VipHistoryFilter filter);

    int cleanupOldHistory(Duration retention);

    default int cleanupOldHistory() {
        return cleanupOldHistory(DEFAULT_RETENTION);
    }
}
