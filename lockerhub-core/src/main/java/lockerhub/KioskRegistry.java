package lockerhub;

import lockerhub.model.FleetStatistics;
import lockerhub.model.KioskFilter;
import lockerhub.model.KioskHeartbeat;
import lockerhub.model.KioskRegistration;
import lockerhub.model.KioskStatus;

import java.util.List;
import java.util.Optional;

/**
 * Kiosk liveness registry.
 *
 * <p>A kiosk registers once (re-registration updates the existing row), then
 * reports heartbeats. {@link #markOfflineKiosks()} flips kiosks that have been
 * silent longer than their own threshold to offline.
 */
public interface KioskRegistry extends Repository<KioskHeartbeat, String, KioskFilter> {

    /**
     * Inserts the kiosk, or updates zone, version, hardware id and secret and
     * marks it online if it is already registered.
     */
    KioskHeartbeat registerKiosk(KioskRegistration registration);

    /**
     * Marks the kiosk online and refreshes {@code last_seen}.
     *
     * @param version    reported software version, or {@code null} to keep the stored one
     * @param configHash reported configuration hash, or {@code null} to keep the stored one
     * @throws NotFoundException if the kiosk was never registered
     */
    KioskHeartbeat updateHeartbeat(String kioskId, String version, String configHash);

    default KioskHeartbeat updateHeartbeat(String kioskId) {
        return updateHeartbeat(kioskId, null, null);
    }

    /**
     * @return number of kiosks flipped to offline
     */
    int markOfflineKiosks();

    /**
     * @throws NotFoundException if the kiosk was never registered
     */
    KioskHeartbeat updateStatus(String kioskId, KioskStatus status);

    List<KioskHeartbeat> getOfflineKiosks();

    List<KioskHeartbeat> getKiosksByZone(String zone);

    List<String> getAllZones();

    Optional<KioskHeartbeat> findByHardwareId(String hardwareId);

    FleetStatistics getStatistics();
}
