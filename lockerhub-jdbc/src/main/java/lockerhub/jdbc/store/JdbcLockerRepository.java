package lockerhub.jdbc.store;

import lockerhub.LockerRepository;
import lockerhub.ValidationException;
import lockerhub.jdbc.DatabaseManager;
import lockerhub.jdbc.JdbcTemplate;
import lockerhub.model.Locker;
import lockerhub.model.LockerFilter;
import lockerhub.model.LockerKey;
import lockerhub.model.LockerStats;
import lockerhub.model.LockerStatus;
import lockerhub.model.LockerUpdate;
import lockerhub.model.NewLocker;
import lockerhub.model.Owner;
import lockerhub.model.OwnerType;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC {@link LockerRepository} over the {@code lockers} table.
 *
 * <p>Every update bumps {@code version} by one and {@code updated_at} to now. The
 * expiry sweep is a single UPDATE so it never races a concurrent writer between
 * reading and writing.
 */
public final class JdbcLockerRepository extends AbstractJdbcRepository<Locker> implements LockerRepository {
  private static final Logger logger = Logger.getLogger(JdbcLockerRepository.class.getName());

  private static final String COLUMNS = "kiosk_id, id, status, owner_type, owner_key, reserved_at, owned_at, "
      + "is_vip, version, display_name, name_updated_at, name_updated_by, created_at, updated_at";

  private static final JdbcTemplate.RowMapper<Locker> ROW_MAPPER = rs -> {
    String ownerType = rs.getString("owner_type");
    String ownerKey = rs.getString("owner_key");
    Owner owner = ownerType == null || ownerKey == null
        ? null : new Owner(OwnerType.fromCode(ownerType), ownerKey);
    return new Locker(
        rs.getString("kiosk_id"),
        rs.getInt("id"),
        LockerStatus.fromCode(rs.getString("status")),
        owner,
        instant(rs, "reserved_at"),
        instant(rs, "owned_at"),
        rs.getBoolean("is_vip"),
        rs.getLong("version"),
        rs.getString("display_name"),
        instant(rs, "name_updated_at"),
        rs.getString("name_updated_by"),
        instant(rs, "created_at"),
        instant(rs, "updated_at"));
  };

  public JdbcLockerRepository(DatabaseManager db) {
    this(db, Clock.systemUTC());
  }

  public JdbcLockerRepository(DatabaseManager db, Clock clock) {
    super(db, clock);
  }

  @Override
  protected String entityName() {
    return "Locker";
  }

  @Override
  public Optional<Locker> findById(LockerKey key) {
    return db.execute(conn -> find(conn, key));
  }

  @Override
  public Optional<Locker> findByKioskAndId(String kioskId, int lockerId) {
    return findById(LockerKey.of(kioskId, lockerId));
  }

  @Override
  public Locker getById(LockerKey key) {
    return require(findById(key), key);
  }

  private static Optional<Locker> find(Connection conn, LockerKey key) throws SQLException {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM lockers WHERE kiosk_id=? AND id=?",
        ROW_MAPPER, key.kioskId(), key.lockerId());
  }

  @Override
  public List<Locker> findAll(LockerFilter filter) {
    SqlWhere where = where(filter);
    return db.execute(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM lockers" + where.sql() + " ORDER BY kiosk_id, id",
        ROW_MAPPER, where.params()));
  }

  @Override
  public int count(LockerFilter filter) {
    SqlWhere where = where(filter);
    return db.execute(conn -> count(conn, "SELECT COUNT(*) FROM lockers" + where.sql(), where.params()));
  }

  private static SqlWhere where(LockerFilter filter) {
    Objects.requireNonNull(filter, "filter");
    return new SqlWhere()
        .eq("kiosk_id", filter.kioskId())
        .eq("status", filter.status() == null ? null : filter.status().code())
        .eq("owner_key", filter.ownerKey())
        .eq("is_vip", filter.vip());
  }

  @Override
  public boolean exists(LockerKey key) {
    return db.execute(conn -> count(conn,
        "SELECT COUNT(*) FROM lockers WHERE kiosk_id=? AND id=?", key.kioskId(), key.lockerId()) > 0);
  }

  @Override
  public Locker create(NewLocker locker) {
    Objects.requireNonNull(locker, "locker");
    Timestamp now = ts(now());
    return db.execute(conn -> {
      JdbcTemplate.update(conn,
          "INSERT INTO lockers (" + COLUMNS + ") VALUES (?,?,?,NULL,NULL,NULL,NULL,?,1,?,?,NULL,?,?)",
          locker.kioskId(), locker.id(), LockerStatus.FREE.code(), locker.vip(),
          locker.displayName(), locker.displayName() == null ? null : now, now, now);
      return find(conn, LockerKey.of(locker.kioskId(), locker.id())).orElseThrow();
    });
  }

  @Override
  public Locker update(LockerKey key, LockerUpdate update, long expectedVersion) {
    Objects.requireNonNull(key, "key");
    if (update == null) {
      throw new ValidationException("No fields to update for locker " + key);
    }
    Instant now = now();
    List<String> assignments = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    if (update.has(LockerUpdate.Field.STATUS)) {
      assignments.add("status=?");
      params.add(update.status().code());
    }
    if (update.has(LockerUpdate.Field.OWNER)) {
      Owner owner = update.owner();
      assignments.add("owner_type=?");
      assignments.add("owner_key=?");
      params.add(owner == null ? null : owner.type().code());
      params.add(owner == null ? null : owner.key());
    }
    if (update.has(LockerUpdate.Field.RESERVED_AT)) {
      assignments.add("reserved_at=?");
      params.add(ts(update.reservedAt()));
    }
    if (update.has(LockerUpdate.Field.OWNED_AT)) {
      assignments.add("owned_at=?");
      params.add(ts(update.ownedAt()));
    }
    if (update.has(LockerUpdate.Field.VIP)) {
      assignments.add("is_vip=?");
      params.add(update.vip());
    }
    if (update.has(LockerUpdate.Field.DISPLAY_NAME)) {
      assignments.add("display_name=?");
      assignments.add("name_updated_at=?");
      assignments.add("name_updated_by=?");
      params.add(update.displayName());
      params.add(ts(now));
      params.add(update.nameUpdatedBy());
    }
    assignments.add("version=version+1");
    assignments.add("updated_at=?");
    params.add(ts(now));
    params.add(key.kioskId());
    params.add(key.lockerId());
    params.add(expectedVersion);

    String sql = "UPDATE lockers SET " + String.join(", ", assignments)
        + " WHERE kiosk_id=? AND id=? AND version=?";
    return executeOptimisticUpdate(key, expectedVersion,
        conn -> JdbcTemplate.update(conn, sql, params.toArray()),
        conn -> find(conn, key),
        Locker::version);
  }

  @Override
  public Locker updateLocker(String kioskId, int lockerId, LockerUpdate update, long expectedVersion) {
    return update(LockerKey.of(kioskId, lockerId), update, expectedVersion);
  }

  @Override
  public List<Locker> findAvailable(String kioskId) {
    return db.execute(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM lockers WHERE kiosk_id=? AND status=? AND is_vip=? ORDER BY id",
        ROW_MAPPER, kioskId, LockerStatus.FREE.code(), false));
  }

  @Override
  public Optional<Locker> findByOwnerKey(String ownerKey) {
    return db.execute(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM lockers WHERE owner_key=? AND status IN (?,?)"
            + " ORDER BY COALESCE(owned_at, reserved_at) DESC LIMIT 1",
        ROW_MAPPER, ownerKey, LockerStatus.RESERVED.code(), LockerStatus.OWNED.code())
        .stream().findFirst());
  }

  @Override
  public List<Locker> findExpiredReserved(Duration timeout) {
    Timestamp cutoff = ts(now().minus(timeout));
    return db.execute(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM lockers WHERE status=? AND reserved_at < ? ORDER BY reserved_at",
        ROW_MAPPER, LockerStatus.RESERVED.code(), cutoff));
  }

  @Override
  public int cleanupExpiredReservations(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    Instant now = now();
    int freed = db.execute(conn -> JdbcTemplate.update(conn,
        "UPDATE lockers SET status=?, owner_type=NULL, owner_key=NULL, reserved_at=NULL, owned_at=NULL,"
            + " version=version+1, updated_at=? WHERE status=? AND reserved_at < ?",
        LockerStatus.FREE.code(), ts(now), LockerStatus.RESERVED.code(), ts(now.minus(timeout))));
    if (freed > 0) {
      logger.log(Level.FINE, "Freed {0} reservations older than {1}", new Object[]{freed, timeout});
      db.afterCommit(() -> db.metrics().addReservationsExpired(freed));
    }
    return freed;
  }

  @Override
  public LockerStats getStatsByKiosk(String kioskId) {
    return db.execute(conn -> JdbcTemplate.query(conn,
        "SELECT COUNT(*) AS n_total,"
            + " SUM(CASE WHEN status='Free' THEN 1 ELSE 0 END) AS n_free,"
            + " SUM(CASE WHEN status='Reserved' THEN 1 ELSE 0 END) AS n_reserved,"
            + " SUM(CASE WHEN status='Owned' THEN 1 ELSE 0 END) AS n_owned,"
            + " SUM(CASE WHEN status='Blocked' THEN 1 ELSE 0 END) AS n_blocked,"
            + " SUM(CASE WHEN status='Opening' THEN 1 ELSE 0 END) AS n_opening,"
            + " SUM(CASE WHEN status='Error' THEN 1 ELSE 0 END) AS n_error,"
            + " SUM(CASE WHEN is_vip THEN 1 ELSE 0 END) AS n_vip"
            + " FROM lockers WHERE kiosk_id=?",
        rs -> new LockerStats(kioskId,
            rs.getInt("n_total"), rs.getInt("n_free"), rs.getInt("n_reserved"), rs.getInt("n_owned"),
            rs.getInt("n_blocked"), rs.getInt("n_opening"), rs.getInt("n_error"), rs.getInt("n_vip")),
        kioskId).get(0));
  }

  @Override
  public boolean delete(LockerKey key) {
    return db.execute(conn -> {
      int deleted = JdbcTemplate.update(conn,
          "DELETE FROM lockers WHERE kiosk_id=? AND id=? AND NOT EXISTS ("
              + "SELECT 1 FROM vip_contracts c WHERE c.kiosk_id=? AND c.locker_id=? AND c.status='active')",
          key.kioskId(), key.lockerId(), key.kioskId(), key.lockerId());
      if (deleted > 0) {
        return true;
      }
      if (find(conn, key).isPresent()) {
        throw new ValidationException("Locker " + key + " is referenced by an active VIP contract");
      }
      return false;
    });
  }
}
