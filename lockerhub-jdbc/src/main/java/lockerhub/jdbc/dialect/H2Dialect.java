package lockerhub.jdbc.dialect;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * H2 dialect. Primarily for testing.
 */
public final class H2Dialect extends AbstractDialect {
  private static final int LOCK_TIMEOUT = 50200;
  private static final int DEADLOCK = 40001;
  private static final int CONCURRENT_UPDATE = 90131;

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public List<String> sessionInitStatements(Duration busyTimeout) {
    return List.of("SET LOCK_TIMEOUT " + busyTimeout.toMillis());
  }

  @Override
  protected boolean isVendorTransient(SQLException e) {
    int code = e.getErrorCode();
    return code == LOCK_TIMEOUT || code == DEADLOCK || code == CONCURRENT_UPDATE
        || "HYT00".equals(e.getSQLState());
  }
}
