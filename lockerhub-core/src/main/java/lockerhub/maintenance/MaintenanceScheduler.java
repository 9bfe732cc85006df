package lockerhub.maintenance;

import lockerhub.CommandQueue;
import lockerhub.EventLog;
import lockerhub.KioskRegistry;
import lockerhub.LockerRepository;
import lockerhub.VipContractRepository;
import lockerhub.VipHistoryRepository;
import lockerhub.model.FleetStatistics;
import lockerhub.spi.MetricsExporter;
import lockerhub.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that drives the periodic sweeps and retention purges.
 *
 * <p>Every sweep interval it frees expired reservations, flips silent kiosks offline,
 * expires VIP contracts past their end date and records the fleet status. Every purge
 * interval it deletes terminal commands, events and VIP history past their retention.
 * Collaborators left unset on the builder are skipped.
 *
 * <p>Each task runs in its own auto-committed statement; a failing task is logged and
 * does not prevent the remaining tasks or later cycles from running.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class MaintenanceScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MaintenanceScheduler.class.getName());

  private final LockerRepository lockers;
  private final KioskRegistry kiosks;
  private final VipContractRepository contracts;
  private final CommandQueue commands;
  private final EventLog events;
  private final VipHistoryRepository history;
  private final MetricsExporter metrics;
  private final Duration reservationTimeout;
  private final Duration commandRetention;
  private final Duration eventRetention;
  private final Duration historyRetention;
  private final Duration sweepInterval;
  private final Duration purgeInterval;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private MaintenanceScheduler(Builder builder) {
    if (builder.lockers == null && builder.kiosks == null && builder.contracts == null
        && builder.commands == null && builder.events == null && builder.history == null) {
      throw new IllegalArgumentException("at least one repository must be configured");
    }
    requirePositive(builder.reservationTimeout, "reservationTimeout");
    requirePositive(builder.commandRetention, "commandRetention");
    requirePositive(builder.eventRetention, "eventRetention");
    requirePositive(builder.historyRetention, "historyRetention");
    requirePositive(builder.sweepInterval, "sweepInterval");
    requirePositive(builder.purgeInterval, "purgeInterval");

    this.lockers = builder.lockers;
    this.kiosks = builder.kiosks;
    this.contracts = builder.contracts;
    this.commands = builder.commands;
    this.events = builder.events;
    this.history = builder.history;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.reservationTimeout = builder.reservationTimeout;
    this.commandRetention = builder.commandRetention;
    this.eventRetention = builder.eventRetention;
    this.historyRetention = builder.historyRetention;
    this.sweepInterval = builder.sweepInterval;
    this.purgeInterval = builder.purgeInterval;
  }

  private static void requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be > 0");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts both loops. The first sweep runs one sweep interval after start.
   * Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("MaintenanceScheduler has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = Executors.newScheduledThreadPool(2, new DaemonThreadFactory("lockerhub-maintenance-"));
    long sweepMs = sweepInterval.toMillis();
    long purgeMs = purgeInterval.toMillis();
    sweepTask = scheduler.scheduleWithFixedDelay(this::runSweepOnce, sweepMs, sweepMs, TimeUnit.MILLISECONDS);
    purgeTask = scheduler.scheduleWithFixedDelay(this::runPurgeOnce, purgeMs, purgeMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes one sweep cycle. May be invoked directly by an external scheduler or a test.
   */
  public void runSweepOnce() {
    if (closed) {
      return;
    }
    if (lockers != null) {
      run("reservation expiry", () -> lockers.cleanupExpiredReservations(reservationTimeout));
    }
    if (kiosks != null) {
      run("offline sweep", kiosks::markOfflineKiosks);
      run("fleet status", () -> {
        FleetStatistics stats = kiosks.getStatistics();
        metrics.recordFleetStatus(stats.online(), stats.offline());
        return 0;
      });
    }
    if (contracts != null) {
      run("contract expiry", contracts::markExpiredContracts);
    }
  }

  /**
   * Executes one retention cycle. May be invoked directly by an external scheduler or a test.
   */
  public void runPurgeOnce() {
    if (closed) {
      return;
    }
    if (commands != null) {
      run("command purge", () -> purged(commands.cleanupOldCommands(commandRetention)));
    }
    if (events != null) {
      run("event purge", () -> purged(events.cleanupOldEvents(eventRetention)));
    }
    if (history != null) {
      run("VIP history purge", () -> purged(history.cleanupOldHistory(historyRetention)));
    }
  }

  private int purged(int count) {
    if (count > 0) {
      metrics.addRowsPurged(count);
    }
    return count;
  }

  private void run(String task, IntSupplier action) {
    try {
      int affected = action.getAsInt();
      if (affected > 0) {
        logger.log(Level.INFO, "{0} affected {1} rows", new Object[]{task, affected});
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Maintenance task failed: " + task, t);
    }
  }

  /** Cancels both schedules and shuts down the scheduler threads. */
  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link MaintenanceScheduler}. */
  public static final class Builder {
    private LockerRepository lockers;
    private KioskRegistry kiosks;
    private VipContractRepository contracts;
    private CommandQueue commands;
    private EventLog events;
    private VipHistoryRepository history;
    private MetricsExporter metrics;
    private Duration reservationTimeout = LockerRepository.DEFAULT_RESERVATION_TIMEOUT;
    private Duration commandRetention = CommandQueue.DEFAULT_RETENTION;
    private Duration eventRetention = EventLog.DEFAULT_RETENTION;
    private Duration historyRetention = VipHistoryRepository.DEFAULT_RETENTION;
    private Duration sweepInterval = Duration.ofSeconds(10);
    private Duration purgeInterval = Duration.ofHours(1);

    private Builder() {}

    /** Enables the reservation expiry sweep. */
    public Builder lockers(LockerRepository lockers) {
      this.lockers = lockers;
      return this;
    }

    /** Enables the offline sweep and fleet status gauges. */
    public Builder kiosks(KioskRegistry kiosks) {
      this.kiosks = kiosks;
      return this;
    }

    /** Enables the VIP contract expiry sweep. */
    public Builder contracts(VipContractRepository contracts) {
      this.contracts = contracts;
      return this;
    }

    public Builder commands(CommandQueue commands) {
      this.commands = commands;
      return this;
    }

    public Builder events(EventLog events) {
      this.events = events;
      return this;
    }

    public Builder history(VipHistoryRepository history) {
      this.history = history;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to 90 seconds. */
    public Builder reservationTimeout(Duration reservationTimeout) {
      this.reservationTimeout = reservationTimeout;
      return this;
    }

    /** Optional. Defaults to 7 days. */
    public Builder commandRetention(Duration commandRetention) {
      this.commandRetention = commandRetention;
      return this;
    }

    /** Optional. Defaults to 30 days. */
    public Builder eventRetention(Duration eventRetention) {
      this.eventRetention = eventRetention;
      return this;
    }

    /** Optional. Defaults to 365 days. */
    public Builder historyRetention(Duration historyRetention) {
      this.historyRetention = historyRetention;
      return this;
    }

    /** Optional. Defaults to 10 seconds. */
    public Builder sweepInterval(Duration sweepInterval) {
      this.sweepInterval = sweepInterval;
      return this;
    }

    /** Optional. Defaults to 1 hour. */
    public Builder purgeInterval(Duration purgeInterval) {
      this.purgeInterval = purgeInterval;
      return this;
    }

    /**
     * @throws IllegalArgumentException if no repository is set or a duration is not positive
     */
    public MaintenanceScheduler build() {
      return new MaintenanceScheduler(this);
    }
  }
}
