package lockerhub.jdbc.store;

import lockerhub.EventLog;
import lockerhub.jdbc.DatabaseManager;
import lockerhub.jdbc.JdbcTemplate;
import lockerhub.model.Event;
import lockerhub.model.EventCategory;
import lockerhub.model.EventFilter;
import lockerhub.model.EventStatistics;
import lockerhub.model.EventType;
import lockerhub.model.NewEvent;
import lockerhub.util.JsonCodec;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * JDBC {@link EventLog} over the {@code events} table. Rows are only ever inserted
 * and purged by age.
 */
public final class JdbcEventLog extends AbstractJdbcRepository<Event> implements EventLog {

  private static final String COLUMNS =
      "id, timestamp, kiosk_id, locker_id, event_type, rfid_card, device_id, staff_user, details";

  private static final String STAFF_AUDITED_IN = EventType.staffAudited().stream()
      .map(type -> "'" + type.code() + "'")
      .sorted()
      .collect(Collectors.joining(",", "(", ")"));

  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<Event> rowMapper;

  public JdbcEventLog(DatabaseManager db) {
    this(db, Clock.systemUTC(), JsonCodec.getDefault());
  }

  public JdbcEventLog(DatabaseManager db, Clock clock, JsonCodec jsonCodec) {
    super(db, clock);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> new Event(
        rs.getLong("id"),
        instant(rs, "timestamp"),
        rs.getString("kiosk_id"),
        nullableInt(rs, "locker_id"),
        EventType.fromStoredCode(rs.getString("event_type")),
        rs.getString("event_type"),
        rs.getString("rfid_card"),
        rs.getString("device_id"),
        rs.getString("staff_user"),
        this.jsonCodec.parseObject(rs.getString("details")));
  }

  @Override
  protected String entityName() {
    return "Event";
  }

  @Override
  public Event create(NewEvent event) {
    Objects.requireNonNull(event, "event");
    Instant now = now();
    String details = jsonCodec.toJson(event.details());
    long id = db.execute(conn -> JdbcTemplate.insertReturningKey(conn,
        "INSERT INTO events (timestamp, kiosk_id, locker_id, event_type, rfid_card, device_id, staff_user, details)"
            + " VALUES (?,?,?,?,?,?,?,?)",
        ts(now), event.kioskId(), event.lockerId(), event.type().code(),
        event.rfidCard(), event.deviceId(), event.staffUser(), details));
    return new Event(id, now, event.kioskId(), event.lockerId(), event.type(),
        event.rfidCard(), event.deviceId(), event.staffUser(), event.details());
  }

  @Override
  public Optional<Event> findById(long id) {
    return db.execute(conn -> JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM events WHERE id=?", rowMapper, id));
  }

  @Override
  public List<Event> findAll(EventFilter filter) {
    SqlWhere where = where(filter);
    String sql = "SELECT " + COLUMNS + " FROM events" + where.sql() + " ORDER BY timestamp DESC, id DESC";
    if (filter.limit() > 0) {
      return db.execute(conn -> JdbcTemplate.query(conn, sql + " LIMIT ? OFFSET ?", rowMapper,
          where.params(filter.limit(), filter.offset())));
    }
    return db.execute(conn -> JdbcTemplate.query(conn, sql, rowMapper, where.params()));
  }

  @Override
  public int count(EventFilter filter) {
    SqlWhere where = where(filter);
    return db.execute(conn -> count(conn, "SELECT COUNT(*) FROM events" + where.sql(), where.params()));
  }

  private static SqlWhere where(EventFilter filter) {
    Objects.requireNonNull(filter, "filter");
    return range(new SqlWhere()
        .eq("kiosk_id", filter.kioskId())
        .eq("locker_id", filter.lockerId())
        .eq("event_type", filter.type() == null ? null : filter.type().code())
        .eq("rfid_card", filter.rfidCard())
        .eq("device_id", filter.deviceId())
        .eq("staff_user", filter.staffUser()), filter.from(), filter.to());
  }

  private static SqlWhere range(SqlWhere where, Instant from, Instant to) {
    return where
        .when(from, "timestamp >= ?", ts(from))
        .when(to, "timestamp <= ?", ts(to));
  }

  @Override
  public List<Event> findByDateRange(Instant from, Instant to) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    SqlWhere where = range(new SqlWhere(), from, to);
    return db.execute(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM events" + where.sql() + " ORDER BY timestamp, id",
        rowMapper, where.params()));
  }

  @Override
  public List<Event> findRecent(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    return findAll(EventFilter.builder().limit(limit).build());
  }

  @Override
  public List<Event> findByLocker(String kioskId, int lockerId, int limit) {
    Objects.requireNonNull(kioskId, "kioskId");
    return findAll(EventFilter.builder().kioskId(kioskId).lockerId(lockerId).limit(limit).build());
  }

  @Override
  public List<Event> findStaffActions(String staffUser, Instant from, Instant to) {
    SqlWhere where = range(new SqlWhere()
        .clause("event_type IN " + STAFF_AUDITED_IN)
        .eq("staff_user", staffUser), from, to);
    return db.execute(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM events" + where.sql() + " ORDER BY timestamp DESC, id DESC",
        rowMapper, where.params()));
  }

  @Override
  public EventStatistics getStatistics(Instant from, Instant to) {
    SqlWhere where = range(new SqlWhere(), from, to);
    return db.execute(conn -> {
      Map<EventType, Integer> byType = new EnumMap<>(EventType.class);
      Map<String, Integer> byKiosk = new TreeMap<>();
      Map<EventCategory, Integer> byCategory = new EnumMap<>(EventCategory.class);
      int total = 0;
      List<Object[]> rows = JdbcTemplate.query(conn,
          "SELECT event_type, kiosk_id, CASE WHEN staff_user IS NULL THEN 0 ELSE 1 END AS staff, COUNT(*) AS n"
              + " FROM events" + where.sql()
              + " GROUP BY event_type, kiosk_id, CASE WHEN staff_user IS NULL THEN 0 ELSE 1 END",
          rs -> new Object[]{rs.getString("event_type"), rs.getString("kiosk_id"),
              rs.getInt("staff") == 1, rs.getInt("n")},
          where.params());
      for (Object[] row : rows) {
        String code = (String) row[0];
        int n = (Integer) row[3];
        byType.merge(EventType.fromStoredCode(code), n, Integer::sum);
        byKiosk.merge((String) row[1], n, Integer::sum);
        byCategory.merge(EventCategory.of(code, (Boolean) row[2]), n, Integer::sum);
        total += n;
      }
      return new EventStatistics(total, byType, byKiosk, byCategory);
    });
  }

  @Override
  public int cleanupOldEvents(Duration retention) {
    Objects.requireNonNull(retention, "retention");
    Timestamp cutoff = ts(now().minus(retention));
    return db.execute(conn -> JdbcTemplate.update(conn, "DELETE FROM events WHERE timestamp < ?", cutoff));
  }
}
