package lockerhub.model;

import java.util.List;

/**
 * Everything recorded about a contract: its current row, its history, the
 * {@code vip_*} events logged for its locker and its transfer requests.
 */
public record VipAuditTrail(
    VipContract contract,
    List<VipHistoryEntry> history,
    List<Event> events,
    List<VipTransferRequest> transfers
) {

  public VipAuditTrail {
    history = List.copyOf(history);
    events = List.copyOf(events);
    transfers = List.copyOf(transfers);
  }
}
