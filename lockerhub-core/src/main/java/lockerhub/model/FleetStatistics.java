package lockerhub.model;

import java.util.Map;

/**
 * Fleet-wide liveness counts.
 */
public record FleetStatistics(
    int total,
    int online,
    int offline,
    int maintenance,
    int error,
    Map<String, ZoneStatistics> byZone,
    Map<String, Integer> byVersion
) {

  public FleetStatistics {
    byZone = Map.copyOf(byZone);
    byVersion = Map.copyOf(byVersion);
  }

  public record ZoneStatistics(int total, int online, int offline) {}
}
