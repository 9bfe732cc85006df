/**
 * Spring Boot auto-configuration for the locker hub.
 *
 * <p>{@link lockerhub.spring.boot.LockerHubAutoConfiguration} wires a
 * {@link lockerhub.jdbc.LockerHub} from the application's {@code DataSource} and
 * {@code lockerhub.*} properties, and runs the maintenance sweeps in the background.
 *
 * @see lockerhub.spring.boot.LockerHubAutoConfiguration
 * @see lockerhub.spring.boot.LockerHubProperties
 */
package lockerhub.spring.boot;
