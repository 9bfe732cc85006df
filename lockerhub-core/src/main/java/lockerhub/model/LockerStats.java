package lockerhub.model;

/**
 * Per-kiosk locker counts for dashboards.
 */
public record LockerStats(
    String kioskId,
    int total,
    int free,
    int reserved,
    int owned,
    int blocked,
    int opening,
    int error,
    int vip
) {}
