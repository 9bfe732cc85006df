package lockerhub;

/**
 * Repository whose entities carry an optimistic-lock version.
 *
 * <p>{@link #update} is a single conditional statement matching identity and
 * {@code expectedVersion}. When it matches nothing the row is re-read to tell
 * the two failure modes apart.
 *
 * @param <U> update type
 */
public interface VersionedRepository<T, ID, F, U> extends Repository<T, ID, F> {

    /**
     * Applies {@code update} if the stored version equals {@code expectedVersion},
     * incrementing the version by one.
     *
     * @return the entity as stored after the update
     * @throws NotFoundException       if the entity does not exist
     * @throws OptimisticLockException if the entity exists at a different version
     */
    T update(ID id, U update, long expectedVersion);
}
