package lockerhub;

import java.util.List;
import java.util.Optional;

/**
 * Read and delete contract shared by every lockerhub repository.
 *
 * @param <T>  entity type
 * @param <ID> identity type
 * @param <F>  filter type accepted by {@link #findAll}
 */
public interface Repository<T, ID, F> {

    Optional<T> findById(ID id);

    /**
     * Returns the entity or throws.
     *
     * @throws NotFoundException if no entity has this identity
     */
    T getById(ID id);

    List<T> findAll(F filter);

    boolean exists(ID id);

    int count(F filter);

    /**
     * Deletes the entity.
     *
     * @return {@code true} if a row was deleted, {@code false} if none existed
     */
    boolean delete(ID id);
}
