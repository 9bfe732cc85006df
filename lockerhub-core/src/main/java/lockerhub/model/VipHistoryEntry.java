package lockerhub.model;

import java.time.Instant;
import java.util.Map;

/**
 * One row of a contract's history: what changed, who changed it and why.
 */
public record VipHistoryEntry(
    long id,
    long contractId,
    VipHistoryAction action,
    String performedBy,
    Instant timestamp,
    Map<String, Object> oldValues,
    Map<String, Object> newValues,
    String reason,
    Map<String, Object> details
) {}
