package lockerhub;

import lockerhub.model.Locker;
import lockerhub.model.LockerFilter;
import lockerhub.model.LockerKey;
import lockerhub.model.LockerStats;
import lockerhub.model.LockerUpdate;
import lockerhub.model.NewLocker;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative store of locker state.
 */
public interface LockerRepository extends VersionedRepository<Locker, LockerKey, LockerFilter, LockerUpdate> {

    Duration DEFAULT_RESERVATION_TIMEOUT = Duration.ofSeconds(90);

    Optional<Locker> findByKioskAndId(String kioskId, int lockerId);

    /**
     * @throws DuplicateKeyException if the locker already exists
     */
    Locker create(NewLocker locker);

    /**
     * Versioned update of a single locker. See {@link VersionedRepository#update}.
     */
    Locker updateLocker(String kioskId, int lockerId, LockerUpdate update, long expectedVersion);

    /** Free, non-VIP lockers of a kiosk ordered by locker id. */
    List<Locker> findAvailable(String kioskId);

    /** The Reserved or Owned locker held by this owner key, most recent first. */
    Optional<Locker> findByOwnerKey(String ownerKey);

    List<Locker> findExpiredReserved(Duration timeout);

    /**
     * Frees every Reserved locker whose reservation is older than {@code timeout}
     * in one statement.
     *
     * @return number of lockers freed; {@code 0} when nothing had expired
     */
    int cleanupExpiredReservations(Duration timeout);

    default int cleanupExpiredReservations() {
        return cleanupExpiredReservations(DEFAULT_RESERVATION_TIMEOUT);
    }

    LockerStats getStatsByKiosk(String kioskId);

    /**
     * Deletes a locker unless an active VIP contract references it.
     *
     * @throws ValidationException if an active VIP contract references the locker
     */
    @Override
    boolean delete(LockerKey key);
}
