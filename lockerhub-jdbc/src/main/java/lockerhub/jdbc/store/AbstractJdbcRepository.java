package lockerhub.jdbc.store;

import lockerhub.NotFoundException;
import lockerhub.OptimisticLockException;
import lockerhub.jdbc.DatabaseManager;
import lockerhub.jdbc.JdbcTemplate;
import lockerhub.jdbc.SqlWork;

import java.sql.Connection;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToLongFunction;

/**
 * Shared plumbing for JDBC repositories: time source, row-mapping helpers and the
 * optimistic compare-and-swap update.
 *
 * @param <T> entity type
 */
public abstract class AbstractJdbcRepository<T> {
  protected final DatabaseManager db;
  protected final Clock clock;

  protected AbstractJdbcRepository(DatabaseManager db, Clock clock) {
    this.db = Objects.requireNonNull(db, "db");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Entity name used in error messages. */
  protected abstract String entityName();

  protected Instant now() {
    return clock.instant();
  }

  protected LocalDate today() {
    return LocalDate.now(clock);
  }

  /**
   * Runs a single conditional UPDATE that matches identity and {@code expectedVersion}.
   * When it matches nothing, the row is re-read on the same connection to tell a missing
   * entity from a stale version.
   *
   * @param update  the conditional statement; returns rows affected
   * @param finder  reads the entity by identity
   * @param version extracts the stored version
   * @return the entity as stored after the update
   * @throws NotFoundException       if the entity does not exist
   * @throws OptimisticLockException if the entity exists at a different version
   */
  protected T executeOptimisticUpdate(Object id, long expectedVersion, SqlWork<Integer> update,
      SqlWork<Optional<T>> finder, ToLongFunction<T> version) {
    return db.execute(conn -> {
      int rows = update.run(conn);
      Optional<T> current = finder.run(conn);
      if (current.isEmpty()) {
        throw new NotFoundException(entityName(), id);
      }
      if (rows == 0) {
        db.metrics().incrementOptimisticConflicts();
        throw new OptimisticLockException(entityName(), id, expectedVersion,
            version.applyAsLong(current.get()));
      }
      return current.get();
    });
  }

  protected T require(Optional<T> entity, Object id) {
    return entity.orElseThrow(() -> new NotFoundException(entityName(), id));
  }

  protected static int count(Connection conn, String sql, Object... params) throws SQLException {
    return Math.toIntExact(JdbcTemplate.queryLong(conn, sql, params));
  }

  protected static Timestamp ts(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  protected static Date date(LocalDate day) {
    return day == null ? null : Date.valueOf(day);
  }

  protected static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp value = rs.getTimestamp(column);
    return value == null ? null : value.toInstant();
  }

  protected static LocalDate localDate(ResultSet rs, String column) throws SQLException {
    Date value = rs.getDate(column);
    return value == null ? null : value.toLocalDate();
  }

  protected static Integer nullableInt(ResultSet rs, String column) throws SQLException {
    int value = rs.getInt(column);
    return rs.wasNull() ? null : value;
  }
}
