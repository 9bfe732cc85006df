package lockerhub.jdbc.store;

import lockerhub.IllegalTransitionException;
import lockerhub.NotFoundException;
import lockerhub.ValidationException;
import lockerhub.VipTransferRepository;
import lockerhub.jdbc.DatabaseManager;
import lockerhub.jdbc.JdbcTemplate;
import lockerhub.model.NewVipTransfer;
import lockerhub.model.VipContractStatus;
import lockerhub.model.VipTransferRequest;
import lockerhub.model.VipTransferStatus;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JDBC {@link VipTransferRepository} over {@code vip_transfer_requests}.
 *
 * <p>Each transition is an UPDATE guarded by the statuses that may move to the target,
 * see {@link VipTransferStatus#canTransitionTo}.
 */
public final class JdbcVipTransferRepository extends AbstractJdbcRepository<VipTransferRequest>
    implements VipTransferRepository {

  private static final String COLUMNS = "id, contract_id, from_kiosk_id, from_locker_id, to_kiosk_id, "
      + "to_locker_id, new_rfid_card, reason, requested_by, approved_by, status, rejection_reason, "
      + "created_at, approved_at, completed_at";

  private static final String OPEN_STATUS_IN =
      "('" + VipTransferStatus.PENDING.code() + "','" + VipTransferStatus.APPROVED.code() + "')";

  private static final JdbcTemplate.RowMapper<VipTransferRequest> ROW_MAPPER = rs -> new VipTransferRequest(
      rs.getLong("id"),
      rs.getLong("contract_id"),
      rs.getString("from_kiosk_id"),
      rs.getInt("from_locker_id"),
      rs.getString("to_kiosk_id"),
      rs.getInt("to_locker_id"),
      rs.getString("new_rfid_card"),
      rs.getString("reason"),
      rs.getString("requested_by"),
      rs.getString("approved_by"),
      VipTransferStatus.fromCode(rs.getString("status")),
      rs.getString("rejection_reason"),
      instant(rs, "created_at"),
      instant(rs, "approved_at"),
      instant(rs, "completed_at"));

  public JdbcVipTransferRepository(DatabaseManager db) {
    this(db, Clock.systemUTC());
  }

  public JdbcVipTransferRepository(DatabaseManager db, Clock clock) {
    super(db, clock);
  }

  @Override
  protected String entityName() {
    return "VipTransferRequest";
  }

  @Override
  public VipTransferRequest create(NewVipTransfer transfer) {
    Objects.requireNonNull(transfer, "transfer");
    Timestamp now = ts(now());
    return db.inTransaction(() -> db.execute(conn -> {
      Object[] source = JdbcTemplate.queryOne(conn,
              "SELECT kiosk_id, locker_id, status FROM vip_contracts WHERE id=?",
              rs -> new Object[]{rs.getString(1), rs.getInt(2), rs.getString(3)}, transfer.contractId())
          .orElseThrow(() -> new NotFoundException("VipContract", transfer.contractId()));
      String fromKiosk = (String) source[0];
      int fromLocker = (Integer) source[1];
      if (VipContractStatus.fromCode((String) source[2]) != VipContractStatus.ACTIVE) {
        throw new ValidationException("VIP contract " + transfer.contractId() + " is " + source[2]
            + ", only active contracts can be transferred");
      }
      if (fromKiosk.equals(transfer.toKioskId()) && fromLocker == transfer.toLockerId()) {
        throw new ValidationException("Transfer target equals the current locker " + fromKiosk + ":" + fromLocker);
      }
      if (hasOpenTransfer(conn, fromKiosk, fromLocker)) {
        throw new ValidationException("Locker " + fromKiosk + ":" + fromLocker + " already has a pending transfer");
      }
      if (hasOpenTransfer(conn, transfer.toKioskId(), transfer.toLockerId())) {
        throw new ValidationException("Locker " + transfer.toKioskId() + ":" + transfer.toLockerId()
            + " already has a pending transfer");
      }
      long id = JdbcTemplate.insertReturningKey(conn,
          "INSERT INTO vip_transfer_requests (contract_id, from_kiosk_id, from_locker_id, to_kiosk_id,"
              + " to_locker_id, new_rfid_card, reason, requested_by, status, created_at)"
              + " VALUES (?,?,?,?,?,?,?,?,?,?)",
          transfer.contractId(), fromKiosk, fromLocker, transfer.toKioskId(), transfer.toLockerId(),
          transfer.newRfidCard(), transfer.reason(), transfer.requestedBy(),
          VipTransferStatus.PENDING.code(), now);
      return find(conn, id).orElseThrow();
    }));
  }

  @Override
  public VipTransferRequest approve(long transferId, String approvedBy) {
    Objects.requireNonNull(approvedBy, "approvedBy");
    return transition(transferId, VipTransferStatus.APPROVED,
        "approved_by=?, approved_at=?", approvedBy, ts(now()));
  }

  @Override
  public VipTransferRequest reject(long transferId, String rejectedBy, String rejectionReason) {
    Objects.requireNonNull(rejectedBy, "rejectedBy");
    Timestamp now = ts(now());
    return transition(transferId, VipTransferStatus.REJECTED,
        "approved_by=?, rejection_reason=?, completed_at=?", rejectedBy, rejectionReason, now);
  }

  @Override
  public VipTransferRequest complete(long transferId) {
    return transition(transferId, VipTransferStatus.COMPLETED, "completed_at=?", ts(now()));
  }

  @Override
  public VipTransferRequest cancel(long transferId) {
    return transition(transferId, VipTransferStatus.CANCELLED, "completed_at=?", ts(now()));
  }

  private VipTransferRequest transition(long transferId, VipTransferStatus target, String assignments,
      Object... assignmentParams) {
    String allowedFrom = Arrays.stream(VipTransferStatus.values())
        .filter(status -> status.canTransitionTo(target))
        .map(status -> "'" + status.code() + "'")
        .collect(Collectors.joining(",", "(", ")"));
    Object[] params = Arrays.copyOf(assignmentParams, assignmentParams.length + 2);
    params[assignmentParams.length] = target.code();
    params[assignmentParams.length + 1] = transferId;
    return db.execute(conn -> {
      int rows = JdbcTemplate.update(conn,
          "UPDATE vip_transfer_requests SET " + assignments + ", status=? WHERE id=? AND status IN " + allowedFrom,
          params);
      VipTransferRequest current = find(conn, transferId)
          .orElseThrow(() -> new NotFoundException(entityName(), transferId));
      if (rows == 0) {
        throw new IllegalTransitionException(entityName(), transferId, current.status().code(), target.code());
      }
      return current;
    });
  }

  @Override
  public List<VipTransferRequest> getPendingTransfers() {
    return findAll(VipTransferStatus.PENDING);
  }

  @Override
  public List<VipTransferRequest> getTransfersByContract(long contractId) {
    return db.execute(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM vip_transfer_requests WHERE contract_id=? ORDER BY created_at DESC, id DESC",
        ROW_MAPPER, contractId));
  }

  @Override
  public boolean hasLockerPendingTransfers(String kioskId, int lockerId) {
    Objects.requireNonNull(kioskId, "kioskId");
    return db.execute(conn -> hasOpenTransfer(conn, kioskId, lockerId));
  }

  private static boolean hasOpenTransfer(Connection conn, String kioskId, int lockerId) throws SQLException {
    return count(conn,
        "SELECT COUNT(*) FROM vip_transfer_requests"
            + " WHERE ((from_kiosk_id=? AND from_locker_id=?) OR (to_kiosk_id=? AND to_locker_id=?))"
            + " AND status IN " + OPEN_STATUS_IN,
        kioskId, lockerId, kioskId, lockerId) > 0;
  }

  private static Optional<VipTransferRequest> find(Connection conn, long id) throws SQLException {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM vip_transfer_requests WHERE id=?", ROW_MAPPER, id);
  }

  @Override
  public Optional<VipTransferRequest> findById(Long id) {
    return db.execute(conn -> find(conn, id));
  }

  @Override
  public VipTransferRequest getById(Long id) {
    return require(findById(id), id);
  }

  /**
   * @param status restricts to one status, or {@code null} for all
   */
  @Override
  public List<VipTransferRequest> findAll(VipTransferStatus status) {
    SqlWhere where = new SqlWhere().eq("status", status == null ? null : status.code());
    return db.execute(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM vip_transfer_requests" + where.sql() + " ORDER BY created_at, id",
        ROW_MAPPER, where.params()));
  }

  @Override
  public int count(VipTransferStatus status) {
    SqlWhere where = new SqlWhere().eq("status", status == null ? null : status.code());
    return db.execute(conn -> count(conn, "SELECT COUNT(*) FROM vip_transfer_requests" + where.sql(),
        where.params()));
  }

  @Override
  public boolean exists(Long id) {
    return findById(id).isPresent();
  }

  @Override
  public boolean delete(Long id) {
    return db.execute(conn -> JdbcTemplate.update(conn,
        "DELETE FROM vip_transfer_requests WHERE id=?", id) > 0);
  }
}
