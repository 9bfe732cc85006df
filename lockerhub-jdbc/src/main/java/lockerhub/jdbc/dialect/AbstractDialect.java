package lockerhub.jdbc.dialect;

import lockerhub.jdbc.spi.Dialect;

import java.sql.SQLException;

/**
 * Base dialect with SQLSTATE-based error classification.
 *
 * <p>Subclasses add vendor error codes and override SQL fragments where needed.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public boolean isTransient(SQLException e) {
    for (SQLException current = e; current != null; current = next(current)) {
      String state = current.getSQLState();
      if ((state != null && state.startsWith("40")) || isVendorTransient(current)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean isUniqueViolation(SQLException e) {
    for (SQLException current = e; current != null; current = next(current)) {
      if ("23505".equals(current.getSQLState()) || isVendorUniqueViolation(current)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String plusSeconds(String timestampExpr, String secondsExpr) {
    return "TIMESTAMPADD(SECOND, " + secondsExpr + ", " + timestampExpr + ")";
  }

  /** Vendor error codes for lock contention beyond SQLSTATE class 40. */
  protected boolean isVendorTransient(SQLException e) {
    return false;
  }

  /** Vendor error codes for unique violations beyond SQLSTATE 23505. */
  protected boolean isVendorUniqueViolation(SQLException e) {
    return false;
  }

  private static SQLException next(SQLException e) {
    if (e.getNextException() != null) {
      return e.getNextException();
    }
    return e.getCause() instanceof SQLException cause ? cause : null;
  }
}
