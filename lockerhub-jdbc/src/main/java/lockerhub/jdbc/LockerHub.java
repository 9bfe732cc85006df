package lockerhub.jdbc;

import lockerhub.CommandQueue;
import lockerhub.EventLog;
import lockerhub.KioskRegistry;
import lockerhub.LockerRepository;
import lockerhub.VipContractRepository;
import lockerhub.VipHistoryRepository;
import lockerhub.VipTransferRepository;
import lockerhub.jdbc.dialect.Dialects;
import lockerhub.jdbc.spi.Dialect;
import lockerhub.jdbc.store.JdbcCommandQueue;
import lockerhub.jdbc.store.JdbcEventLog;
import lockerhub.jdbc.store.JdbcKioskRegistry;
import lockerhub.jdbc.store.JdbcLockerRepository;
import lockerhub.jdbc.store.JdbcVipContractRepository;
import lockerhub.jdbc.store.JdbcVipHistoryRepository;
import lockerhub.jdbc.store.JdbcVipTransferRepository;
import lockerhub.maintenance.MaintenanceScheduler;
import lockerhub.model.CommandRequest;
import lockerhub.retry.ExponentialBackoffRetryPolicy;
import lockerhub.spi.ConnectionProvider;
import lockerhub.spi.MetricsExporter;
import lockerhub.util.JsonCodec;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry point that wires one {@link DatabaseManager} into every repository, the locker
 * transitions and the VIP transfer workflow.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * LockerHub hub = LockerHub.builder()
 *     .dataSource(dataSource)
 *     .build();
 *
 * hub.withTransaction(() -> {
 *   hub.lockerOperations().assign("K1", 5, Owner.rfid("0009652489"));
 *   return hub.commands().enqueue(CommandRequest.of("K1", CommandType.OPEN_LOCKER, Map.of("locker_id", 5)));
 * });
 *
 * try (MaintenanceScheduler maintenance = hub.maintenanceScheduler().build()) {
 *   maintenance.start();
 *   // ...
 * }
 * }</pre>
 */
public final class LockerHub {
  private final DatabaseManager db;
  private final Duration reservationTimeout;
  private final LockerRepository lockers;
  private final CommandQueue commands;
  private final KioskRegistry kiosks;
  private final EventLog events;
  private final VipHistoryRepository history;
  private final VipTransferRepository transfers;
  private final VipContractRepository contracts;
  private final LockerOperations lockerOperations;
  private final VipTransferWorkflow transferWorkflow;

  private LockerHub(Builder builder) {
    ConnectionProvider connectionProvider = builder.connectionProvider;
    if (connectionProvider == null) {
      Objects.requireNonNull(builder.dataSource, "dataSource or connectionProvider");
      connectionProvider = builder.dataSource::getConnection;
    }
    Dialect dialect = builder.dialect;
    if (dialect == null) {
      if (builder.dataSource == null) {
        throw new IllegalArgumentException("dialect is required when no dataSource is given");
      }
      dialect = Dialects.detect(builder.dataSource);
    }
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    JsonCodec json = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    ExponentialBackoffRetryPolicy commandRetryPolicy = builder.commandRetryPolicy != null
        ? builder.commandRetryPolicy : new ExponentialBackoffRetryPolicy();
    this.reservationTimeout = Objects.requireNonNull(builder.reservationTimeout, "reservationTimeout");

    this.db = DatabaseManager.builder()
        .connectionProvider(connectionProvider)
        .dialect(dialect)
        .metrics(builder.metrics)
        .maxAttempts(builder.maxAttempts)
        .retryDelay(builder.retryDelay)
        .busyTimeout(builder.busyTimeout)
        .build();
    this.lockers = new JdbcLockerRepository(db, clock);
    this.commands = new JdbcCommandQueue(db, clock, json, commandRetryPolicy);
    this.kiosks = new JdbcKioskRegistry(db, clock);
    this.events = new JdbcEventLog(db, clock, json);
    this.history = new JdbcVipHistoryRepository(db, clock, json);
    this.transfers = new JdbcVipTransferRepository(db, clock);
    this.contracts = new JdbcVipContractRepository(db, clock, history, events, transfers);
    this.lockerOperations = LockerOperations.builder()
        .db(db)
        .lockers(lockers)
        .commands(commands)
        .events(events)
        .clock(clock)
        .maxAttempts(builder.optimisticMaxAttempts)
        .commandMaxRetries(builder.commandMaxRetries)
        .build();
    this.transferWorkflow = new VipTransferWorkflow(db, transfers, contracts, lockers, events);
  }

  public static Builder builder() {
    return new Builder();
  }

  public DatabaseManager database() {
    return db;
  }

  public LockerRepository lockers() {
    return lockers;
  }

  public CommandQueue commands() {
    return commands;
  }

  public KioskRegistry kiosks() {
    return kiosks;
  }

  public EventLog events() {
    return events;
  }

  public VipContractRepository contracts() {
    return contracts;
  }

  public VipHistoryRepository history() {
    return history;
  }

  public VipTransferRepository transfers() {
    return transfers;
  }

  public LockerOperations lockerOperations() {
    return lockerOperations;
  }

  public VipTransferWorkflow transferWorkflow() {
    return transferWorkflow;
  }

  /**
   * Runs {@code work} in one transaction; see {@link DatabaseManager#inTransaction}.
   */
  public <T> T withTransaction(Supplier<T> work) {
    return db.inTransaction(work);
  }

  /**
   * Returns a scheduler builder wired to this hub's repositories and metrics. Intervals
   * and retention windows keep their defaults unless overridden.
   */
  public MaintenanceScheduler.Builder maintenanceScheduler() {
    return MaintenanceScheduler.builder()
        .lockers(lockers)
        .kiosks(kiosks)
        .contracts(contracts)
        .commands(commands)
        .events(events)
        .history(history)
        .metrics(db.metrics())
        .reservationTimeout(reservationTimeout);
  }

  /** Builder for {@link LockerHub}. */
  public static final class Builder {
    private DataSource dataSource;
    private ConnectionProvider connectionProvider;
    private Dialect dialect;
    private Clock clock;
    private JsonCodec jsonCodec;
    private MetricsExporter metrics;
    private int maxAttempts = DatabaseManager.DEFAULT_MAX_ATTEMPTS;
    private Duration retryDelay = DatabaseManager.DEFAULT_RETRY_DELAY;
    private Duration busyTimeout = DatabaseManager.DEFAULT_BUSY_TIMEOUT;
    private int optimisticMaxAttempts = LockerOperations.DEFAULT_MAX_ATTEMPTS;
    private ExponentialBackoffRetryPolicy commandRetryPolicy;
    private int commandMaxRetries = CommandRequest.DEFAULT_MAX_RETRIES;
    private Duration reservationTimeout = LockerRepository.DEFAULT_RESERVATION_TIMEOUT;

    private Builder() {}

    /** Data source; the dialect is detected from its JDBC URL unless set. */
    public Builder dataSource(DataSource dataSource) {
      this.dataSource = dataSource;
      return this;
    }

    /** Alternative to {@link #dataSource}; requires {@link #dialect}. */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Attempts for operations failing with a transient storage error. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder retryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
      return this;
    }

    public Builder busyTimeout(Duration busyTimeout) {
      this.busyTimeout = busyTimeout;
      return this;
    }

    /** Attempts per locker transition that loses an optimistic-lock race. */
    public Builder optimisticMaxAttempts(int optimisticMaxAttempts) {
      this.optimisticMaxAttempts = optimisticMaxAttempts;
      return this;
    }

    /** Backoff for failed kiosk commands. Defaults to 5s doubling, capped at 1h. */
    public Builder commandRetryPolicy(ExponentialBackoffRetryPolicy commandRetryPolicy) {
      this.commandRetryPolicy = commandRetryPolicy;
      return this;
    }

    public Builder commandMaxRetries(int commandMaxRetries) {
      this.commandMaxRetries = commandMaxRetries;
      return this;
    }

    public Builder reservationTimeout(Duration reservationTimeout) {
      this.reservationTimeout = reservationTimeout;
      return this;
    }

    public LockerHub build() {
      return new LockerHub(this);
    }
  }
}
