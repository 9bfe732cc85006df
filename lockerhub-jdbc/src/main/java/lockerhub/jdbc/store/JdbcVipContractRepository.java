package lockerhub.jdbc.store;

import lockerhub.EventLog;
import lockerhub.IllegalTransitionException;
import lockerhub.ValidationException;
import lockerhub.VipContractRepository;
import lockerhub.VipHistoryRepository;
import lockerhub.VipTransferRepository;
import lockerhub.jdbc.DatabaseManager;
import lockerhub.jdbc.JdbcTemplate;
import lockerhub.model.Event;
import lockerhub.model.EventFilter;
import lockerhub.model.EventType;
import lockerhub.model.LockerKey;
import lockerhub.model.NewEvent;
import lockerhub.model.NewVipContract;
import lockerhub.model.NewVipHistoryEntry;
import lockerhub.model.VipAuditTrail;
import lockerhub.model.VipContract;
import lockerhub.model.VipContractFilter;
import lockerhub.model.VipContractStatistics;
import lockerhub.model.VipContractStatus;
import lockerhub.model.VipHistoryAction;
import lockerhub.model.VipHistoryEntry;
import lockerhub.model.VipOperation;
import lockerhub.model.VipTransferRequest;

import java.sql.Connection;
import java.sql.Date;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC {@link VipContractRepository} over {@code vip_contracts}.
 *
 * <p>Mutations run in one transaction: re-read the contract, update it conditioned on
 * its version, append a history row and a {@code vip_*} event naming the staff member.
 */
public final class JdbcVipContractRepository extends AbstractJdbcRepository<VipContract>
    implements VipContractRepository {
  private static final Logger logger = Logger.getLogger(JdbcVipContractRepository.class.getName());

  static final String AUDIT_VERSION = "1.0";

  private static final String COLUMNS = "id, kiosk_id, locker_id, rfid_card, backup_card, start_date, end_date, "
      + "status, created_by, version, created_at, updated_at";

  private static final JdbcTemplate.RowMapper<VipContract> ROW_MAPPER = rs -> new VipContract(
      rs.getLong("id"),
      rs.getString("kiosk_id"),
      rs.getInt("locker_id"),
      rs.getString("rfid_card"),
      rs.getString("backup_card"),
      localDate(rs, "start_date"),
      localDate(rs, "end_date"),
      VipContractStatus.fromCode(rs.getString("status")),
      rs.getString("created_by"),
      rs.getLong("version"),
      instant(rs, "created_at"),
      instant(rs, "updated_at"));

  private final VipHistoryRepository history;
  private final EventLog events;
  private final VipTransferRepository transfers;

  public JdbcVipContractRepository(DatabaseManager db, Clock clock, VipHistoryRepository history,
      EventLog events, VipTransferRepository transfers) {
    super(db, clock);
    this.history = Objects.requireNonNull(history, "history");
    this.events = Objects.requireNonNull(events, "events");
    this.transfers = Objects.requireNonNull(transfers, "transfers");
  }

  @Override
  protected String entityName() {
    return "VipContract";
  }

  @Override
  public VipContract create(NewVipContract contract) {
    Objects.requireNonNull(contract, "contract");
    return db.inTransaction(() -> {
      Instant now = now();
      VipContract created = db.execute(conn -> {
        long id = JdbcTemplate.insertReturningKey(conn,
            "INSERT INTO vip_contracts (kiosk_id, locker_id, rfid_card, backup_card, start_date, end_date,"
                + " status, created_by, version, created_at, updated_at) VALUES (?,?,?,?,?,?,?,?,1,?,?)",
            contract.kioskId(), contract.lockerId(), contract.rfidCard(), contract.backupCard(),
            date(contract.startDate()), date(contract.endDate()), VipContractStatus.ACTIVE.code(),
            contract.createdBy(), ts(now), ts(now));
        return find(conn, id).orElseThrow();
      });
      history.logAction(new NewVipHistoryEntry(created.id(), VipHistoryAction.CREATED, contract.createdBy(),
          null, snapshot(created), null, null));
      logEvent(EventType.VIP_CONTRACT_CREATED, created, contract.createdBy(), Map.of(
          "rfid_card", created.rfidCard(),
          "start_date", created.startDate().toString(),
          "end_date", created.endDate().toString()));
      logger.log(Level.INFO, "Created VIP contract {0} for locker {1}",
          new Object[]{created.id(), created.location()});
      return created;
    });
  }

  @Override
  public Optional<VipContract> findById(Long id) {
    return db.execute(conn -> find(conn, id));
  }

  @Override
  public VipContract getById(Long id) {
    return require(findById(id), id);
  }

  private static Optional<VipContract> find(Connection conn, long id) throws SQLException {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM vip_contracts WHERE id=?", ROW_MAPPER, id);
  }

  @Override
  public List<VipContract> findAll(VipContractFilter filter) {
    SqlWhere where = where(filter);
    return db.execute(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM vip_contracts" + where.sql() + " ORDER BY created_at DESC, id DESC",
        ROW_MAPPER, where.params()));
  }

  @Override
  public int count(VipContractFilter filter) {
    SqlWhere where = where(filter);
    return db.execute(conn -> count(conn, "SELECT COUNT(*) FROM vip_contracts" + where.sql(), where.params()));
  }

  private static SqlWhere where(VipContractFilter filter) {
    Objects.requireNonNull(filter, "filter");
    return new SqlWhere()
        .eq("kiosk_id", filter.kioskId())
        .eq("locker_id", filter.lockerId())
        .when(filter.rfidCard(), "(rfid_card=? OR backup_card=?)", filter.rfidCard(), filter.rfidCard())
        .eq("status", filter.status() == null ? null : filter.status().code())
        .eq("created_by", filter.createdBy())
        .when(filter.expiresBefore(), "end_date <= ?", date(filter.expiresBefore()))
        .when(filter.expiresAfter(), "end_date >= ?", date(filter.expiresAfter()));
  }

  @Override
  public boolean exists(Long id) {
    return findById(id).isPresent();
  }

  @Override
  public boolean delete(Long id) {
    return db.execute(conn -> JdbcTemplate.update(conn, "DELETE FROM vip_contracts WHERE id=?", id) > 0);
  }

  @Override
  public Optional<VipContract> findActiveByCard(String rfidCard) {
    Objects.requireNonNull(rfidCard, "rfidCard");
    Date today = date(today());
    return db.execute(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM vip_contracts WHERE (rfid_card=? OR backup_card=?) AND status=?"
            + " AND start_date <= ? AND end_date >= ? ORDER BY created_at DESC, id DESC",
        ROW_MAPPER, rfidCard, rfidCard, VipContractStatus.ACTIVE.code(), today, today)
        .stream().findFirst());
  }

  @Override
  public Optional<VipContract> findActiveByLocker(String kioskId, int lockerId) {
    Objects.requireNonNull(kioskId, "kioskId");
    return findAll(VipContractFilter.all().withLocker(kioskId, lockerId).withStatus(VipContractStatus.ACTIVE))
        .stream().findFirst();
  }

  @Override
  public boolean isLockerAvailable(String kioskId, int lockerId) {
    return findActiveByLocker(kioskId, lockerId).isEmpty();
  }

  @Override
  public boolean isRfidCardAvailable(String rfidCard) {
    Objects.requireNonNull(rfidCard, "rfidCard");
    return count(VipContractFilter.all().withCard(rfidCard).withStatus(VipContractStatus.ACTIVE)) == 0;
  }

  @Override
  public List<VipContract> findExpiringSoon(int days) {
    if (days < 0) {
      throw new IllegalArgumentException("days must be >= 0");
    }
    LocalDate today = today();
    return db.execute(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM vip_contracts WHERE status=? AND end_date >= ? AND end_date <= ?"
            + " ORDER BY end_date, id",
        ROW_MAPPER, VipContractStatus.ACTIVE.code(), date(today), date(today.plusDays(days))));
  }

  @Override
  public int markExpiredContracts() {
    int expired = db.execute(conn -> JdbcTemplate.update(conn,
        "UPDATE vip_contracts SET status=?, version=version+1, updated_at=? WHERE status=? AND end_date < ?",
        VipContractStatus.EXPIRED.code(), ts(now()), VipContractStatus.ACTIVE.code(), date(today())));
    if (expired > 0) {
      logger.log(Level.INFO, "Expired {0} VIP contracts", expired);
      db.afterCommit(() -> db.metrics().addContractsExpired(expired));
    }
    return expired;
  }

  @Override
  public VipContract extendContract(long contractId, LocalDate newEndDate, String performedBy, String reason) {
    Objects.requireNonNull(newEndDate, "newEndDate");
    Objects.requireNonNull(performedBy, "performedBy");
    return db.inTransaction(() -> {
      VipContract current = requireActive(contractId, "extended");
      if (!newEndDate.isAfter(current.endDate())) {
        throw new ValidationException("New end date " + newEndDate + " must be after " + current.endDate());
      }
      VipContract updated = versionedUpdate(current, "end_date=?", date(newEndDate));
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("extension_days", ChronoUnit.DAYS.between(current.endDate(), newEndDate));
      details.put("old_end_date", current.endDate().toString());
      details.put("new_end_date", newEndDate.toString());
      history.logAction(new NewVipHistoryEntry(contractId, VipHistoryAction.EXTENDED, performedBy,
          Map.of("end_date", current.endDate().toString()), Map.of("end_date", newEndDate.toString()),
          reason, details));
      logEvent(EventType.VIP_CONTRACT_EXTENDED, updated, performedBy, details);
      return updated;
    });
  }

  @Override
  public VipContract changeCard(long contractId, String newCard, String performedBy, String reason) {
    Objects.requireNonNull(newCard, "newCard");
    Objects.requireNonNull(performedBy, "performedBy");
    if (newCard.isBlank()) {
      throw new ValidationException("New card cannot be blank");
    }
    return db.inTransaction(() -> {
      VipContract current = requireActive(contractId, "re-carded");
      if (newCard.equals(current.rfidCard())) {
        throw new ValidationException("Contract " + contractId + " already uses card " + newCard);
      }
      VipContract updated = versionedUpdate(current, "rfid_card=?", newCard);
      history.logAction(new NewVipHistoryEntry(contractId, VipHistoryAction.CARD_CHANGED, performedBy,
          Map.of("rfid_card", current.rfidCard()), Map.of("rfid_card", newCard), reason, null));
      logEvent(EventType.VIP_CARD_CHANGED, updated, performedBy,
          Map.of("old_card", current.rfidCard(), "new_card", newCard));
      return updated;
    });
  }

  @Override
  public VipContract cancelContract(long contractId, String performedBy, String reason) {
    Objects.requireNonNull(performedBy, "performedBy");
    return db.inTransaction(() -> {
      VipContract current = requireActive(contractId, VipContractStatus.CANCELLED.code());
      VipContract updated = versionedUpdate(current, "status=?", VipContractStatus.CANCELLED.code());
      LocalDate today = today();
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("cancelled_at", now().toString());
      details.put("original_end_date", current.endDate().toString());
      details.put("days_remaining", Math.max(0L, ChronoUnit.DAYS.between(today, current.endDate())));
      history.logAction(new NewVipHistoryEntry(contractId, VipHistoryAction.CANCELLED, performedBy,
          Map.of("status", current.status().code()), Map.of("status", updated.status().code()),
          reason, details));
      logEvent(EventType.VIP_CONTRACT_CANCELLED, updated, performedBy, details);
      return updated;
    });
  }

  @Override
  public VipContract transferContract(long contractId, String newKioskId, int newLockerId,
      String performedBy, String newCard, String reason) {
    Objects.requireNonNull(newKioskId, "newKioskId");
    Objects.requireNonNull(performedBy, "performedBy");
    return db.inTransaction(() -> {
      VipContract current = requireActive(contractId, "transferred");
      String card = newCard == null ? current.rfidCard() : newCard;
      VipContract updated = versionedUpdate(current, "kiosk_id=?, locker_id=?, rfid_card=?",
          newKioskId, newLockerId, card);
      history.logAction(new NewVipHistoryEntry(contractId, VipHistoryAction.TRANSFERRED, performedBy,
          location(current), location(updated), reason, null));
      return updated;
    });
  }

  @Override
  public VipHistoryEntry auditVipOperation(VipOperation operation, long contractId, String performedBy,
      Map<String, Object> details, String ipAddress, String userAgent) {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(performedBy, "performedBy");
    VipContract contract = getById(contractId);
    Map<String, Object> audit = new LinkedHashMap<>();
    if (details != null) {
      audit.putAll(details);
    }
    Object reason = audit.get("reason");
    String auditReason = reason == null || reason.toString().isBlank()
        ? operation.code() + " operation" : reason.toString();
    audit.put("operation", operation.code());
    audit.put("contract_id", contractId);
    audit.put("performed_by", performedBy);
    audit.put("timestamp", now().toString());
    audit.put("contract_location", contract.location());
    audit.put("rfid_card", contract.rfidCard());
    audit.put("status", contract.status().code());
    audit.put("ip_address", ipAddress);
    audit.put("user_agent", userAgent);
    audit.put("audit_version", AUDIT_VERSION);
    return history.logAction(new NewVipHistoryEntry(contractId, operation.historyAction(), performedBy,
        null, null, auditReason, audit));
  }

  @Override
  public VipAuditTrail getComprehensiveAuditTrail(long contractId) {
    VipContract contract = getById(contractId);
    List<VipTransferRequest> contractTransfers = transfers.getTransfersByContract(contractId);
    Set<LockerKey> locations = new LinkedHashSet<>();
    locations.add(LockerKey.of(contract.kioskId(), contract.lockerId()));
    for (VipTransferRequest transfer : contractTransfers) {
      locations.add(LockerKey.of(transfer.fromKioskId(), transfer.fromLockerId()));
      locations.add(LockerKey.of(transfer.toKioskId(), transfer.toLockerId()));
    }
    Map<Long, Event> related = new LinkedHashMap<>();
    for (LockerKey location : locations) {
      for (Event event : events.findAll(EventFilter.builder()
          .kioskId(location.kioskId()).lockerId(location.lockerId()).build())) {
        if (event.type().code().startsWith("vip_") && refersTo(event, contractId)) {
          related.put(event.id(), event);
        }
      }
    }
    List<Event> relatedEvents = new ArrayList<>(related.values());
    relatedEvents.sort(Comparator.comparing(Event::timestamp).thenComparingLong(Event::id).reversed());
    return new VipAuditTrail(contract, history.getContractHistory(contractId), relatedEvents, contractTransfers);
  }

  private static boolean refersTo(Event event, long contractId) {
    Object id = event.details().get("contract_id");
    return id instanceof Number n && n.longValue() == contractId;
  }

  @Override
  public VipContractStatistics getStatistics() {
    LocalDate today = today();
    return db.execute(conn -> {
      Map<String, Integer> byStatus = new LinkedHashMap<>();
      for (Object[] row : JdbcTemplate.query(conn,
          "SELECT status, COUNT(*) FROM vip_contracts GROUP BY status",
          rs -> new Object[]{rs.getString(1), rs.getInt(2)})) {
        byStatus.put((String) row[0], (Integer) row[1]);
      }
      int expiringSoon = count(conn,
          "SELECT COUNT(*) FROM vip_contracts WHERE status=? AND end_date >= ? AND end_date <= ?",
          VipContractStatus.ACTIVE.code(), date(today), date(today.plusDays(DEFAULT_EXPIRING_DAYS)));
      Function<VipContractStatus, Integer> of = status -> byStatus.getOrDefault(status.code(), 0);
      int total = byStatus.values().stream().mapToInt(Integer::intValue).sum();
      return new VipContractStatistics(total, of.apply(VipContractStatus.ACTIVE),
          of.apply(VipContractStatus.EXPIRED), of.apply(VipContractStatus.CANCELLED), expiringSoon);
    });
  }

  /**
   * Event log entry for a contract change. Transfer events are written by the transfer workflow.
   */
  void logEvent(EventType type, VipContract contract, String staffUser, Map<String, Object> details) {
    events.create(NewEvent.builder(type, contract.kioskId())
        .lockerId(contract.lockerId())
        .rfidCard(contract.rfidCard())
        .staffUser(staffUser)
        .detail("contract_id", contract.id())
        .details(details)
        .build());
  }

  private VipContract requireActive(long contractId, String target) {
    VipContract current = getById(contractId);
    if (current.status() != VipContractStatus.ACTIVE) {
      throw new IllegalTransitionException(entityName(), contractId, current.status().code(), target);
    }
    return current;
  }

  private VipContract versionedUpdate(VipContract current, String assignments, Object... values) {
    Object[] params = new Object[values.length + 3];
    System.arraycopy(values, 0, params, 0, values.length);
    params[values.length] = ts(now());
    params[values.length + 1] = current.id();
    params[values.length + 2] = current.version();
    String sql = "UPDATE vip_contracts SET " + assignments + ", version=version+1, updated_at=?"
        + " WHERE id=? AND version=?";
    return executeOptimisticUpdate(current.id(), current.version(),
        conn -> JdbcTemplate.update(conn, sql, params),
        conn -> find(conn, current.id()),
        VipContract::version);
  }

  private static Map<String, Object> snapshot(VipContract contract) {
    Map<String, Object> values = new LinkedHashMap<>(location(contract));
    values.put("backup_card", contract.backupCard());
    values.put("start_date", contract.startDate().toString());
    values.put("end_date", contract.endDate().toString());
    return values;
  }

  private static Map<String, Object> location(VipContract contract) {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("kiosk_id", contract.kioskId());
    values.put("locker_id", contract.lockerId());
    values.put("rfid_card", contract.rfidCard());
    return values;
  }
}
