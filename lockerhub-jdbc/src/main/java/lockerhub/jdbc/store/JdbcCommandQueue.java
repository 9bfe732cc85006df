package lockerhub.jdbc.store;

import lockerhub.CommandQueue;
import lockerhub.IllegalTransitionException;
import lockerhub.NotFoundException;
import lockerhub.jdbc.DatabaseManager;
import lockerhub.jdbc.JdbcTemplate;
import lockerhub.model.Command;
import lockerhub.model.CommandFilter;
import lockerhub.model.CommandRequest;
import lockerhub.model.CommandStatistics;
import lockerhub.model.CommandStatus;
import lockerhub.model.CommandType;
import lockerhub.retry.ExponentialBackoffRetryPolicy;
import lockerhub.util.JsonCodec;
import lockerhub.util.Strings;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC {@link CommandQueue} over the {@code command_queue} table.
 *
 * <p>Each transition is a single UPDATE guarded by the allowed source states, so a
 * terminal command can never be moved again, whatever the interleaving of callers.
 */
public final class JdbcCommandQueue extends AbstractJdbcRepository<Command> implements CommandQueue {
  private static final Logger logger = Logger.getLogger(JdbcCommandQueue.class.getName());

  private static final String COLUMNS = "command_id, kiosk_id, command_type, payload, status, retry_count, "
      + "max_retries, next_attempt_at, last_error, created_at, executed_at, completed_at";

  private static final String ACTIVE_STATUS_IN =
      "('" + CommandStatus.PENDING.code() + "','" + CommandStatus.EXECUTING.code() + "')";

  private final JsonCodec jsonCodec;
  private final ExponentialBackoffRetryPolicy retryPolicy;
  private final JdbcTemplate.RowMapper<Command> rowMapper;

  public JdbcCommandQueue(DatabaseManager db) {
    this(db, Clock.systemUTC(), JsonCodec.getDefault(), new ExponentialBackoffRetryPolicy());
  }

  /**
   * @param retryPolicy supplies the default base delay and the cap for {@link #markFailed}
   */
  public JdbcCommandQueue(DatabaseManager db, Clock clock, JsonCodec jsonCodec,
      ExponentialBackoffRetryPolicy retryPolicy) {
    super(db, clock);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.rowMapper = rs -> new Command(
        rs.getString("command_id"),
        rs.getString("kiosk_id"),
        CommandType.fromCode(rs.getString("command_type")),
        this.jsonCodec.parseObject(rs.getString("payload")),
        CommandStatus.fromCode(rs.getString("status")),
        rs.getInt("retry_count"),
        rs.getInt("max_retries"),
        instant(rs, "next_attempt_at"),
        rs.getString("last_error"),
        instant(rs, "created_at"),
        instant(rs, "executed_at"),
        instant(rs, "completed_at"));
  }

  @Override
  protected String entityName() {
    return "Command";
  }

  @Override
  public Command enqueue(CommandRequest request) {
    Objects.requireNonNull(request, "request");
    Command command = db.execute(conn -> {
      insert(conn, request);
      return find(conn, request.commandId()).orElseThrow();
    });
    db.afterCommit(() -> db.metrics().incrementCommandsEnqueued());
    logger.log(Level.FINE, "Enqueued {0}", request);
    return command;
  }

  @Override
  public List<Command> enqueueAll(List<CommandRequest> requests) {
    Objects.requireNonNull(requests, "requests");
    if (requests.isEmpty()) {
      return List.of();
    }
    List<Command> commands = db.inTransaction(() -> db.execute(conn -> {
      List<Command> inserted = new ArrayList<>(requests.size());
      for (CommandRequest request : requests) {
        insert(conn, request);
        inserted.add(find(conn, request.commandId()).orElseThrow());
      }
      return inserted;
    }));
    db.afterCommit(() -> {
      for (int i = 0; i < commands.size(); i++) {
        db.metrics().incrementCommandsEnqueued();
      }
    });
    return commands;
  }

  private void insert(Connection conn, CommandRequest request) throws SQLException {
    Instant now = now();
    Instant due = request.notBefore() == null ? now : request.notBefore();
    JdbcTemplate.update(conn,
        "INSERT INTO command_queue (" + COLUMNS + ") VALUES (?,?,?,?,?,0,?,?,NULL,?,NULL,NULL)",
        request.commandId(), request.kioskId(), request.type().code(),
        jsonCodec.toJson(request.payload()), CommandStatus.PENDING.code(),
        request.maxRetries(), ts(due), ts(now));
  }

  private Optional<Command> find(Connection conn, String commandId) throws SQLException {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM command_queue WHERE command_id=?", rowMapper, commandId);
  }

  @Override
  public Optional<Command> findById(String commandId) {
    return db.execute(conn -> find(conn, commandId));
  }

  @Override
  public Command getById(String commandId) {
    return require(findById(commandId), commandId);
  }

  @Override
  public List<Command> findAll(CommandFilter filter) {
    SqlWhere where = where(filter);
    String sql = "SELECT " + COLUMNS + " FROM command_queue" + where.sql()
        + " ORDER BY created_at DESC, command_id DESC";
    if (filter.limit() > 0) {
      return db.execute(conn -> JdbcTemplate.query(conn, sql + " LIMIT ?", rowMapper,
          where.params(filter.limit())));
    }
    return db.execute(conn -> JdbcTemplate.query(conn, sql, rowMapper, where.params()));
  }

  @Override
  public int count(CommandFilter filter) {
    SqlWhere where = where(filter);
    return db.execute(conn -> count(conn, "SELECT COUNT(*) FROM command_queue" + where.sql(), where.params()));
  }

  private static SqlWhere where(CommandFilter filter) {
    Objects.requireNonNull(filter, "filter");
    return new SqlWhere()
        .eq("kiosk_id", filter.kioskId())
        .eq("status", filter.status() == null ? null : filter.status().code())
        .eq("command_type", filter.type() == null ? null : filter.type().code());
  }

  @Override
  public boolean exists(String commandId) {
    return db.execute(conn -> count(conn,
        "SELECT COUNT(*) FROM command_queue WHERE command_id=?", commandId) > 0);
  }

  @Override
  public boolean delete(String commandId) {
    return db.execute(conn -> JdbcTemplate.update(conn,
        "DELETE FROM command_queue WHERE command_id=?", commandId) > 0);
  }

  @Override
  public List<Command> getPendingCommands(String kioskId, int limit) {
    Objects.requireNonNull(kioskId, "kioskId");
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0");
    }
    String sql = "SELECT " + COLUMNS + " FROM command_queue WHERE kiosk_id=? AND status=?"
        + " AND next_attempt_at <= ? ORDER BY next_attempt_at, created_at, command_id";
    Timestamp now = ts(now());
    if (limit > 0) {
      return db.execute(conn -> JdbcTemplate.query(conn, sql + " LIMIT ?", rowMapper,
          kioskId, CommandStatus.PENDING.code(), now, limit));
    }
    return db.execute(conn -> JdbcTemplate.query(conn, sql, rowMapper,
        kioskId, CommandStatus.PENDING.code(), now));
  }

  @Override
  public Command markExecuting(String commandId) {
    return transition(commandId, CommandStatus.EXECUTING,
        "UPDATE command_queue SET status=?, executed_at=? WHERE command_id=? AND status=?",
        CommandStatus.EXECUTING.code(), ts(now()), commandId, CommandStatus.PENDING.code());
  }

  @Override
  public Command markCompleted(String commandId) {
    Command command = transition(commandId, CommandStatus.COMPLETED,
        "UPDATE command_queue SET status=?, completed_at=? WHERE command_id=? AND status IN " + ACTIVE_STATUS_IN,
        CommandStatus.COMPLETED.code(), ts(now()), commandId);
    db.afterCommit(() -> db.metrics().incrementCommandsCompleted());
    return command;
  }

  @Override
  public Command cancelCommand(String commandId) {
    Command command = transition(commandId, CommandStatus.CANCELLED,
        "UPDATE command_queue SET status=?, completed_at=? WHERE command_id=? AND status IN " + ACTIVE_STATUS_IN,
        CommandStatus.CANCELLED.code(), ts(now()), commandId);
    db.afterCommit(() -> db.metrics().addCommandsCancelled(1));
    return command;
  }

  private Command transition(String commandId, CommandStatus target, String sql, Object... params) {
    Objects.requireNonNull(commandId, "commandId");
    return db.execute(conn -> {
      int rows = JdbcTemplate.update(conn, sql, params);
      Command current = find(conn, commandId)
          .orElseThrow(() -> new NotFoundException(entityName(), commandId));
      if (rows == 0) {
        throw new IllegalTransitionException(entityName(), commandId, current.status().code(), target.code());
      }
      return current;
    });
  }

  @Override
  public Command markFailed(String commandId, String error) {
    return markFailed(commandId, error, Duration.ofMillis(retryPolicy.baseDelayMs()));
  }

  @Override
  public Command markFailed(String commandId, String error, Duration retryDelay) {
    Objects.requireNonNull(commandId, "commandId");
    Objects.requireNonNull(retryDelay, "retryDelay");
    if (retryDelay.isNegative() || retryDelay.isZero()) {
      throw new IllegalArgumentException("retryDelay must be > 0");
    }
    ExponentialBackoffRetryPolicy policy = retryDelay.toMillis() == retryPolicy.baseDelayMs()
        ? retryPolicy : retryPolicy.withBaseDelayMs(retryDelay.toMillis());
    Command updated = db.execute(conn -> {
      Command current = find(conn, commandId)
          .orElseThrow(() -> new NotFoundException(entityName(), commandId));
      if (current.isTerminal()) {
        throw new IllegalTransitionException(entityName(), commandId,
            current.status().code(), CommandStatus.FAILED.code());
      }
      int retryCount = current.retryCount() + 1;
      CommandStatus next = retryCount < current.maxRetries() ? CommandStatus.PENDING : CommandStatus.FAILED;
      Instant now = now();
      Instant nextAttemptAt = now.plusMillis(policy.computeDelayMs(retryCount));
      int rows = JdbcTemplate.update(conn,
          "UPDATE command_queue SET status=?, retry_count=?, next_attempt_at=?, last_error=?, completed_at=?"
              + " WHERE command_id=? AND retry_count=? AND status IN " + ACTIVE_STATUS_IN,
          next.code(), retryCount, ts(nextAttemptAt), Strings.truncateError(error),
          next == CommandStatus.FAILED ? ts(now) : null,
          commandId, current.retryCount());
      if (rows == 0) {
        // another caller moved the command between our read and write
        Command latest = find(conn, commandId).orElseThrow(() -> new NotFoundException(entityName(), commandId));
        throw new IllegalTransitionException(entityName(), commandId,
            latest.status().code() + "@" + latest.retryCount(), next.code());
      }
      return find(conn, commandId).orElseThrow();
    });
    if (updated.status() == CommandStatus.FAILED) {
      logger.log(Level.WARNING, "Command {0} for kiosk {1} failed after {2} attempts: {3}",
          new Object[]{commandId, updated.kioskId(), updated.retryCount(), updated.lastError()});
      db.afterCommit(() -> db.metrics().incrementCommandsFailed());
    } else {
      db.afterCommit(() -> db.metrics().incrementCommandsRetried());
    }
    return updated;
  }

  @Override
  public int clearPendingCommands(String kioskId) {
    Objects.requireNonNull(kioskId, "kioskId");
    Instant now = now();
    int cancelled = db.execute(conn -> JdbcTemplate.update(conn,
        "UPDATE command_queue SET status=?, last_error=?, completed_at=?"
            + " WHERE kiosk_id=? AND status IN " + ACTIVE_STATUS_IN,
        CommandStatus.CANCELLED.code(), CLEARED_ON_RESTART, ts(now), kioskId));
    if (cancelled > 0) {
      logger.log(Level.INFO, "Cancelled {0} in-flight commands for restarted kiosk {1}",
          new Object[]{cancelled, kioskId});
      db.afterCommit(() -> db.metrics().addCommandsCancelled(cancelled));
    }
    return cancelled;
  }

  @Override
  public List<Command> findStaleExecutingCommands(Duration threshold) {
    Objects.requireNonNull(threshold, "threshold");
    Timestamp cutoff = ts(now().minus(threshold));
    return db.execute(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM command_queue WHERE status=? AND executed_at < ? ORDER BY executed_at",
        rowMapper, CommandStatus.EXECUTING.code(), cutoff));
  }

  @Override
  public List<Command> getCommandHistory(String kioskId, int limit) {
    return findAll(CommandFilter.byKiosk(kioskId).withLimit(limit));
  }

  @Override
  public int cleanupOldCommands(Duration retention) {
    Objects.requireNonNull(retention, "retention");
    Timestamp cutoff = ts(now().minus(retention));
    return db.execute(conn -> JdbcTemplate.update(conn,
        "DELETE FROM command_queue WHERE status IN (?,?,?) AND created_at < ?",
        CommandStatus.COMPLETED.code(), CommandStatus.FAILED.code(), CommandStatus.CANCELLED.code(), cutoff));
  }

  @Override
  public CommandStatistics getStatistics(String kioskId) {
    SqlWhere where = new SqlWhere().eq("kiosk_id", kioskId);
    return db.execute(conn -> {
      Map<CommandStatus, Integer> byStatus = new EnumMap<>(CommandStatus.class);
      Map<CommandType, Integer> byType = new EnumMap<>(CommandType.class);
      int total = 0;
      for (Object[] row : JdbcTemplate.query(conn,
          "SELECT status, command_type, COUNT(*) FROM command_queue" + where.sql()
              + " GROUP BY status, command_type",
          rs -> new Object[]{rs.getString(1), rs.getString(2), rs.getInt(3)}, where.params())) {
        int n = (Integer) row[2];
        byStatus.merge(CommandStatus.fromCode((String) row[0]), n, Integer::sum);
        byType.merge(CommandType.fromCode((String) row[1]), n, Integer::sum);
        total += n;
      }
      return new CommandStatistics(total, byStatus, byType);
    });
  }
}
