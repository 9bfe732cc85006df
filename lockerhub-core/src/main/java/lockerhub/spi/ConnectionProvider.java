package lockerhub.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for every lockerhub repository.
 *
 * <p>One provider (typically a pooled {@code DataSource}) is created at process
 * start and handed to the composition root, which passes it on explicitly.
 * Callers are responsible for closing the returned connection.
 */
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
