package lockerhub.jdbc.dialect;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<String> sessionInitStatements(Duration busyTimeout) {
    return List.of("SET lock_timeout = '" + busyTimeout.toMillis() + "ms'");
  }

  @Override
  protected boolean isVendorTransient(SQLException e) {
    // lock_not_available
    return "55P03".equals(e.getSQLState());
  }

  @Override
  public String plusSeconds(String timestampExpr, String secondsExpr) {
    return "(" + timestampExpr + " + " + secondsExpr + " * INTERVAL '1 second')";
  }
}
