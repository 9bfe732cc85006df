package lockerhub.jdbc.store;

import lockerhub.VipHistoryRepository;
import lockerhub.jdbc.DatabaseManager;
import lockerhub.jdbc.JdbcTemplate;
import lockerhub.model.NewVipHistoryEntry;
import lockerhub.model.VipHistoryAction;
import lockerhub.model.VipHistoryEntry;
import lockerhub.model.VipHistoryFilter;
import lockerhub.util.JsonCodec;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * JDBC {@link VipHistoryRepository} over {@code vip_contract_history}.
 */
public final class JdbcVipHistoryRepository extends AbstractJdbcRepository<VipHistoryEntry>
    implements VipHistoryRepository {

  private static final String COLUMNS =
      "id, contract_id, action_type, performed_by, timestamp, old_values, new_values, reason, details";

  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<VipHistoryEntry> rowMapper;

  public JdbcVipHistoryRepository(DatabaseManager db) {
    this(db, Clock.systemUTC(), JsonCodec.getDefault());
  }

  public JdbcVipHistoryRepository(DatabaseManager db, Clock clock, JsonCodec jsonCodec) {
    super(db, clock);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> new VipHistoryEntry(
        rs.getLong("id"),
        rs.getLong("contract_id"),
        VipHistoryAction.fromCode(rs.getString("action_type")),
        rs.getString("performed_by"),
        instant(rs, "timestamp"),
        this.jsonCodec.parseObject(rs.getString("old_values")),
        this.jsonCodec.parseObject(rs.getString("new_values")),
        rs.getString("reason"),
        this.jsonCodec.parseObject(rs.getString("details")));
  }

  @Override
  protected String entityName() {
    return "VipHistoryEntry";
  }

  @Override
  public VipHistoryEntry logAction(NewVipHistoryEntry entry) {
    Objects.requireNonNull(entry, "entry");
    Instant now = now();
    long id = db.execute(conn -> JdbcTemplate.insertReturningKey(conn,
        "INSERT INTO vip_contract_history (contract_id, action_type, performed_by, timestamp,"
            + " old_values, new_values, reason, details) VALUES (?,?,?,?,?,?,?,?)",
        entry.contractId(), entry.action().code(), entry.performedBy(), ts(now),
        jsonCodec.toJson(entry.oldValues()), jsonCodec.toJson(entry.newValues()),
        entry.reason(), jsonCodec.toJson(entry.details())));
    return new VipHistoryEntry(id, entry.contractId(), entry.action(), entry.performedBy(), now,
        entry.oldValues(), entry.newValues(), entry.reason(), entry.details());
  }

  @Override
  public List<VipHistoryEntry> getContractHistory(long contractId) {
    return findAll(VipHistoryFilter.all().withContract(contractId));
  }

  @Override
  public List<VipHistoryEntry> getStaffAuditTrail(String performedBy, Instant from, Instant to) {
    Objects.requireNonNull(performedBy, "performedBy");
    return findAll(VipHistoryFilter.all().withPerformedBy(performedBy).between(from, to));
  }

  @Override
  public List<VipHistoryEntry> getRecentActions(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    return findAll(VipHistoryFilter.all().withLimit(limit));
  }

  @Override
  public List<VipHistoryEntry> findAll(VipHistoryFilter filter) {
    Objects.requireNonNull(filter, "filter");
    SqlWhere where = new SqlWhere()
        .eq("contract_id", filter.contractId())
        .eq("action_type", filter.action() == null ? null : filter.action().code())
        .eq("performed_by", filter.performedBy())
        .when(filter.from(), "timestamp >= ?", ts(filter.from()))
        .when(filter.to(), "timestamp <= ?", ts(filter.to()));
    String sql = "SELECT " + COLUMNS + " FROM vip_contract_history" + where.sql()
        + " ORDER BY timestamp DESC, id DESC";
    if (filter.limit() > 0) {
      return db.execute(conn -> JdbcTemplate.query(conn, sql + " LIMIT ?", rowMapper,
          where.params(filter.limit())));
    }
    return db.execute(conn -> JdbcTemplate.query(conn, sql, rowMapper, where.params()));
  }

  @Override
  public int cleanupOldHistory(Duration retention) {
    Objects.requireNonNull(retention, "retention");
    Timestamp cutoff = ts(now().minus(retention));
    return db.execute(conn -> JdbcTemplate.update(conn,
        "DELETE FROM vip_contract_history WHERE timestamp < ?", cutoff));
  }
}
