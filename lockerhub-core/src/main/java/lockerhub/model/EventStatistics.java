package lockerhub.model;

import java.util.Map;

public record EventStatistics(
    int total,
    Map<EventType, Integer> byType,
    Map<String, Integer> byKiosk,
    Map<EventCategory, Integer> byCategory
) {

  public EventStatistics {
    byType = Map.copyOf(byType);
    byKiosk = Map.copyOf(byKiosk);
    byCategory = Map.copyOf(byCategory);
  }

  public int count(EventType type) {
    return byType.getOrDefault(type, 0);
  }

  public int count(EventCategory category) {
    return byCategory.getOrDefault(category, 0);
  }
}
