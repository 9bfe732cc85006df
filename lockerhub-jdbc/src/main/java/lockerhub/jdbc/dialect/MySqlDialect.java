package lockerhub.jdbc.dialect;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * MySQL dialect. Also handles MariaDB.
 */
public final class MySqlDialect extends AbstractDialect {
  private static final int DUPLICATE_ENTRY = 1062;
  private static final int LOCK_WAIT_TIMEOUT = 1205;
  private static final int DEADLOCK = 1213;

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  public List<String> sessionInitStatements(Duration busyTimeout) {
    long seconds = Math.max(1L, busyTimeout.toSeconds());
    return List.of("SET SESSION innodb_lock_wait_timeout = " + seconds);
  }

  @Override
  protected boolean isVendorTransient(SQLException e) {
    return e.getErrorCode() == LOCK_WAIT_TIMEOUT || e.getErrorCode() == DEADLOCK;
  }

  @Override
  protected boolean isVendorUniqueViolation(SQLException e) {
    return e.getErrorCode() == DUPLICATE_ENTRY;
  }
}
