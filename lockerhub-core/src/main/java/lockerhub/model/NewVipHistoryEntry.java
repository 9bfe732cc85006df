package lockerhub.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record NewVipHistoryEntry(
    long contractId,
    VipHistoryAction action,
    String performedBy,
    Map<String, Object> oldValues,
    Map<String, Object> newValues,
    String reason,
    Map<String, Object> details
) {

  public NewVipHistoryEntry {
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(performedBy, "performedBy");
    oldValues = copy(oldValues);
    newValues = copy(newValues);
    details = copy(details);
  }

  public static NewVipHistoryEntry of(long contractId, VipHistoryAction action, String performedBy,
      String reason) {
    return new NewVipHistoryEntry(contractId, action, performedBy, null, null, reason, null);
  }

  private static Map<String, Object> copy(Map<String, Object> values) {
    return values == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }
}
