/**
 * JDBC persistence for the locker hub.
 *
 * <p>{@link lockerhub.jdbc.LockerHub} is the entry point. It builds a
 * {@link lockerhub.jdbc.DatabaseManager} and wires it into every repository.
 *
 * @see lockerhub.jdbc.LockerHub
 * @see lockerhub.jdbc.dialect.Dialects
 */
package lockerhub.jdbc;
