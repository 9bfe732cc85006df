package lockerhub.model;

import java.util.Map;

/**
 * Queue counts, overall or for a single kiosk.
 */
public record CommandStatistics(
    int total,
    Map<CommandStatus, Integer> byStatus,
    Map<CommandType, Integer> byType
) {

  public CommandStatistics {
    byStatus = Map.copyOf(byStatus);
    byType = Map.copyOf(byType);
  }

  public int count(CommandStatus status) {
    return byStatus.getOrDefault(status, 0);
  }

  public int count(CommandType type) {
    return byType.getOrDefault(type, 0);
  }
}
