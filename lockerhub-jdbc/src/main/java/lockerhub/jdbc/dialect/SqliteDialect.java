package lockerhub.jdbc.dialect;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * SQLite dialect for single-node deployments on the kiosk controller itself.
 *
 * <p>Connections are switched to WAL journaling with {@code synchronous=NORMAL} and a
 * busy timeout so concurrent readers and a writer wait briefly instead of failing.
 * Timestamps are stored by the xerial driver as epoch milliseconds.
 */
public final class SqliteDialect extends AbstractDialect {
  private static final int SQLITE_BUSY = 5;
  private static final int SQLITE_LOCKED = 6;

  @Override
  public String name() {
    return "sqlite";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:sqlite:");
  }

  @Override
  public List<String> sessionInitStatements(Duration busyTimeout) {
    return List.of(
        "PRAGMA journal_mode = WAL",
        "PRAGMA synchronous = NORMAL",
        "PRAGMA cache_size = 1000",
        "PRAGMA temp_store = MEMORY",
        "PRAGMA foreign_keys = ON",
        "PRAGMA busy_timeout = " + busyTimeout.toMillis());
  }

  @Override
  protected boolean isVendorTransient(SQLException e) {
    int code = e.getErrorCode() & 0xff;
    if (code == SQLITE_BUSY || code == SQLITE_LOCKED) {
      return true;
    }
    String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
    return message.contains("database is locked") || message.contains("database is busy");
  }

  @Override
  protected boolean isVendorUniqueViolation(SQLException e) {
    String message = e.getMessage() == null ? "" : e.getMessage();
    return message.contains("UNIQUE constraint failed") || message.contains("PRIMARY KEY constraint failed");
  }

  @Override
  public String plusSeconds(String timestampExpr, String secondsExpr) {
    return "(" + timestampExpr + " + " + secondsExpr + " * 1000)";
  }
}
