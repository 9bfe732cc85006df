package lockerhub.jdbc.spi;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations classify driver errors and supply the few SQL fragments that
 * differ between databases. Register custom dialects via
 * {@code META-INF/services/lockerhub.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: H2, PostgreSQL, MySQL, SQLite.
 *
 * @see lockerhub.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "h2", "postgresql").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Statements run on every connection before use: lock wait timeouts and, for
   * embedded engines, durability settings.
   *
   * @param busyTimeout how long a statement waits for a lock before failing
   */
  default List<String> sessionInitStatements(Duration busyTimeout) {
    return List.of();
  }

  /**
   * Returns {@code true} for lock contention errors (busy, locked, deadlock,
   * lock timeout, serialization failure) that may succeed on retry.
   */
  boolean isTransient(SQLException e);

  /**
   * Returns {@code true} for unique or primary key violations.
   */
  boolean isUniqueViolation(SQLException e);

  /**
   * SQL expression adding a number of seconds to a timestamp.
   *
   * @param timestampExpr column or expression of timestamp type
   * @param secondsExpr   column or expression of integer type
   */
  String plusSeconds(String timestampExpr, String secondsExpr);
}
