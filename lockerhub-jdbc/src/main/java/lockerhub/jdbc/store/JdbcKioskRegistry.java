package lockerhub.jdbc.store;

import lockerhub.DuplicateKeyException;
import lockerhub.KioskRegistry;
import lockerhub.NotFoundException;
import lockerhub.jdbc.DatabaseManager;
import lockerhub.jdbc.JdbcTemplate;
import lockerhub.model.FleetStatistics;
import lockerhub.model.KioskFilter;
import lockerhub.model.KioskHeartbeat;
import lockerhub.model.KioskRegistration;
import lockerhub.model.KioskStatus;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC {@link KioskRegistry} over the {@code kiosk_heartbeat} table.
 *
 * <p>The offline sweep compares each row against its own
 * {@code offline_threshold_seconds}, so the comparison is pushed into SQL through the
 * dialect's timestamp arithmetic.
 */
public final class JdbcKioskRegistry extends AbstractJdbcRepository<KioskHeartbeat> implements KioskRegistry {
  private static final Logger logger = Logger.getLogger(JdbcKioskRegistry.class.getName());

  private static final String COLUMNS = "kiosk_id, last_seen, zone, status, version, last_config_hash, "
      + "offline_threshold_seconds, hardware_id, registration_secret, created_at, updated_at";

  private static final JdbcTemplate.RowMapper<KioskHeartbeat> ROW_MAPPER = rs -> new KioskHeartbeat(
      rs.getString("kiosk_id"),
      instant(rs, "last_seen"),
      rs.getString("zone"),
      KioskStatus.fromCode(rs.getString("status")),
      rs.getString("version"),
      rs.getString("last_config_hash"),
      rs.getInt("offline_threshold_seconds"),
      rs.getString("hardware_id"),
      rs.getString("registration_secret"),
      instant(rs, "created_at"),
      instant(rs, "updated_at"));

  public JdbcKioskRegistry(DatabaseManager db) {
    this(db, Clock.systemUTC());
  }

  public JdbcKioskRegistry(DatabaseManager db, Clock clock) {
    super(db, clock);
  }

  @Override
  protected String entityName() {
    return "Kiosk";
  }

  @Override
  public KioskHeartbeat registerKiosk(KioskRegistration registration) {
    Objects.requireNonNull(registration, "registration");
    Timestamp now = ts(now());
    try {
      db.execute(conn -> JdbcTemplate.update(conn,
          "INSERT INTO kiosk_heartbeat (" + COLUMNS + ") VALUES (?,?,?,?,?,NULL,?,?,?,?,?)",
          registration.kioskId(), now, registration.zone(), KioskStatus.ONLINE.code(),
          registration.version(), registration.offlineThresholdSeconds(),
          registration.hardwareId(), registration.registrationSecret(), now, now));
      logger.log(Level.INFO, "Registered kiosk {0} in zone {1}",
          new Object[]{registration.kioskId(), registration.zone()});
    } catch (DuplicateKeyException e) {
      db.execute(conn -> JdbcTemplate.update(conn,
          "UPDATE kiosk_heartbeat SET zone=?, version=?, offline_threshold_seconds=?, hardware_id=?,"
              + " registration_secret=?, status=?, last_seen=?, updated_at=? WHERE kiosk_id=?",
          registration.zone(), registration.version(), registration.offlineThresholdSeconds(),
          registration.hardwareId(), registration.registrationSecret(), KioskStatus.ONLINE.code(),
          now, now, registration.kioskId()));
      logger.log(Level.FINE, "Re-registered kiosk {0}", registration.kioskId());
    }
    return getById(registration.kioskId());
  }

  @Override
  public KioskHeartbeat updateHeartbeat(String kioskId, String version, String configHash) {
    Objects.requireNonNull(kioskId, "kioskId");
    Timestamp now = ts(now());
    return db.execute(conn -> {
      int rows = JdbcTemplate.update(conn,
          "UPDATE kiosk_heartbeat SET last_seen=?, status=?, version=COALESCE(?, version),"
              + " last_config_hash=COALESCE(?, last_config_hash), updated_at=? WHERE kiosk_id=?",
          now, KioskStatus.ONLINE.code(), version, configHash, now, kioskId);
      if (rows == 0) {
        throw new NotFoundException(entityName(), kioskId);
      }
      return find(conn, kioskId).orElseThrow();
    });
  }

  @Override
  public int markOfflineKiosks() {
    Timestamp now = ts(now());
    String deadline = db.dialect().plusSeconds("last_seen", "offline_threshold_seconds");
    int marked = db.execute(conn -> JdbcTemplate.update(conn,
        "UPDATE kiosk_heartbeat SET status=?, updated_at=? WHERE status=? AND " + deadline + " < ?",
        KioskStatus.OFFLINE.code(), now, KioskStatus.ONLINE.code(), now));
    if (marked > 0) {
      logger.log(Level.WARNING, "Marked {0} silent kiosks offline", marked);
      db.afterCommit(() -> db.metrics().addKiosksMarkedOffline(marked));
    }
    return marked;
  }

  @Override
  public KioskHeartbeat updateStatus(String kioskId, KioskStatus status) {
    Objects.requireNonNull(kioskId, "kioskId");
    Objects.requireNonNull(status, "status");
    return db.execute(conn -> {
      int rows = JdbcTemplate.update(conn,
          "UPDATE kiosk_heartbeat SET status=?, updated_at=? WHERE kiosk_id=?",
          status.code(), ts(now()), kioskId);
      if (rows == 0) {
        throw new NotFoundException(entityName(), kioskId);
      }
      return find(conn, kioskId).orElseThrow();
    });
  }

  @Override
  public List<KioskHeartbeat> getOfflineKiosks() {
    return findAll(KioskFilter.all().withStatus(KioskStatus.OFFLINE));
  }

  @Override
  public List<KioskHeartbeat> getKiosksByZone(String zone) {
    return findAll(KioskFilter.all().withZone(Objects.requireNonNull(zone, "zone")));
  }

  @Override
  public List<String> getAllZones() {
    return db.execute(conn -> JdbcTemplate.query(conn,
        "SELECT DISTINCT zone FROM kiosk_heartbeat ORDER BY zone", rs -> rs.getString(1)));
  }

  @Override
  public Optional<KioskHeartbeat> findByHardwareId(String hardwareId) {
    Objects.requireNonNull(hardwareId, "hardwareId");
    return findAll(KioskFilter.all().withHardwareId(hardwareId)).stream().findFirst();
  }

  @Override
  public FleetStatistics getStatistics() {
    return db.execute(conn -> {
      Map<KioskStatus, Integer> byStatus = new HashMap<>();
      Map<String, int[]> zones = new TreeMap<>();
      Map<String, Integer> byVersion = new TreeMap<>();
      int total = 0;
      for (KioskHeartbeat kiosk : JdbcTemplate.query(conn,
          "SELECT " + COLUMNS + " FROM kiosk_heartbeat", ROW_MAPPER)) {
        total++;
        byStatus.merge(kiosk.status(), 1, Integer::sum);
        byVersion.merge(kiosk.version(), 1, Integer::sum);
        int[] zone = zones.computeIfAbsent(kiosk.zone(), z -> new int[3]);
        zone[0]++;
        if (kiosk.status() == KioskStatus.ONLINE) {
          zone[1]++;
        } else if (kiosk.status() == KioskStatus.OFFLINE) {
          zone[2]++;
        }
      }
      Map<String, FleetStatistics.ZoneStatistics> byZone = new TreeMap<>();
      zones.forEach((name, c) -> byZone.put(name, new FleetStatistics.ZoneStatistics(c[0], c[1], c[2])));
      return new FleetStatistics(total,
          byStatus.getOrDefault(KioskStatus.ONLINE, 0),
          byStatus.getOrDefault(KioskStatus.OFFLINE, 0),
          byStatus.getOrDefault(KioskStatus.MAINTENANCE, 0),
          byStatus.getOrDefault(KioskStatus.ERROR, 0),
          byZone, byVersion);
    });
  }

  @Override
  public Optional<KioskHeartbeat> findById(String kioskId) {
    return db.execute(conn -> find(conn, kioskId));
  }

  @Override
  public KioskHeartbeat getById(String kioskId) {
    return require(findById(kioskId), kioskId);
  }

  private static Optional<KioskHeartbeat> find(Connection conn, String kioskId) throws SQLException {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM kiosk_heartbeat WHERE kiosk_id=?", ROW_MAPPER, kioskId);
  }

  @Override
  public List<KioskHeartbeat> findAll(KioskFilter filter) {
    SqlWhere where = where(filter);
    return db.execute(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM kiosk_heartbeat" + where.sql() + " ORDER BY zone, kiosk_id",
        ROW_MAPPER, where.params()));
  }

  @Override
  public int count(KioskFilter filter) {
    SqlWhere where = where(filter);
    return db.execute(conn -> count(conn, "SELECT COUNT(*) FROM kiosk_heartbeat" + where.sql(), where.params()));
  }

  private static SqlWhere where(KioskFilter filter) {
    Objects.requireNonNull(filter, "filter");
    return new SqlWhere()
        .eq("zone", filter.zone())
        .eq("status", filter.status() == null ? null : filter.status().code())
        .eq("hardware_id", filter.hardwareId())
        .eq("version", filter.version());
  }

  @Override
  public boolean exists(String kioskId) {
    return db.execute(conn -> count(conn,
        "SELECT COUNT(*) FROM kiosk_heartbeat WHERE kiosk_id=?", kioskId) > 0);
  }

  @Override
  public boolean delete(String kioskId) {
    return db.execute(conn -> JdbcTemplate.update(conn,
        "DELETE FROM kiosk_heartbeat WHERE kiosk_id=?", kioskId) > 0);
  }
}
