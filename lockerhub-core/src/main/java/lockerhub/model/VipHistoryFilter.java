package lockerhub.model;

import java.time.Instant;

/**
 * Criteria for {@code VipHistoryRepository.findAll}; results are newest first.
 *
 * @param limit maximum rows, or {@code 0} for no limit
 */
public record VipHistoryFilter(
    Long contractId,
    VipHistoryAction action,
    String performedBy,
    Instant from,
    Instant to,
    int limit
) {

  public static VipHistoryFilter all() {
    return new VipHistoryFilter(null, null, null, null, null, 0);
  }

  public VipHistoryFilter withContract(Long contractId) {
    return new VipHistoryFilter(contractId, action, performedBy, from, to, limit);
  }

  public VipHistoryFilter withAction(VipHistoryAction action) {
    return new VipHistoryFilter(contractId, action, performedBy, from, to, limit);
  }

  public VipHistoryFilter withPerformedBy(String performedBy) {
    return new VipHistoryFilter(contractId, action, performedBy, from, to, limit);
  }

  public VipHistoryFilter between(Instant from, Instant to) {
    return new VipHistoryFilter(contractId, action, performedBy, from, to, limit);
  }

  public VipHistoryFilter withLimit(int limit) {
    return new VipHistoryFilter(contractId, action, performedBy, from, to, limit);
  }
}
