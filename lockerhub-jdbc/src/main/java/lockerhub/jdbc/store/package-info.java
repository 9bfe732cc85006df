/**
 * JDBC implementations of the repository interfaces in {@code lockerhub}.
 *
 * <p>{@link lockerhub.jdbc.store.AbstractJdbcRepository} holds the shared plumbing:
 * filter-to-WHERE translation, versioned updates and JSON columns. Statements stay
 * portable; database differences go through {@link lockerhub.jdbc.spi.Dialect}.
 */
package lockerhub.jdbc.store;
