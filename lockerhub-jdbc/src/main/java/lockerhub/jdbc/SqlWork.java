package lockerhub.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of database work run by {@link DatabaseManager#execute}.
 */
@FunctionalInterface
public interface SqlWork<T> {
  T run(Connection conn) throws SQLException;
}
