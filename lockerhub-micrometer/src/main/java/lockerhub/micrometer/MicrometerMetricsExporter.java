package lockerhub.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import lockerhub.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code lockerhub.commands.enqueued} / {@code .completed} / {@code .retried} /
 *       {@code .failed} / {@code .cancelled}</li>
 *   <li>{@code lockerhub.reservations.expired}: reservations freed by the expiry sweep</li>
 *   <li>{@code lockerhub.kiosks.marked.offline}: kiosks flipped offline by the liveness sweep</li>
 *   <li>{@code lockerhub.contracts.expired}: VIP contracts expired by the contract sweep</li>
 *   <li>{@code lockerhub.optimistic.conflicts}: versioned updates that lost a race</li>
 *   <li>{@code lockerhub.storage.transient.retries}: retries after busy/locked errors</li>
 *   <li>{@code lockerhub.retention.purged}: rows deleted by retention clean-up</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code lockerhub.kiosks.online}</li>
 *   <li>{@code lockerhub.kiosks.offline}</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter commandsEnqueued;
  private final Counter commandsCompleted;
  private final Counter commandsRetried;
  private final Counter commandsFailed;
  private final Counter commandsCancelled;
  private final Counter reservationsExpired;
  private final Counter kiosksMarkedOffline;
  private final Counter contractsExpired;
  private final Counter optimisticConflicts;
  private final Counter transientRetries;
  private final Counter rowsPurged;
  private final Gauge onlineGauge;
  private final Gauge offlineGauge;

  private final AtomicInteger online = new AtomicInteger();
  private final AtomicInteger offline = new AtomicInteger();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "lockerhub");
  }

  /**
   * @param namePrefix prefix for all meter names (e.g. {@code "site1.lockerhub"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.commandsEnqueued = counter(namePrefix + ".commands.enqueued", "Commands added to a kiosk queue");
    this.commandsCompleted = counter(namePrefix + ".commands.completed", "Commands reported completed");
    this.commandsRetried = counter(namePrefix + ".commands.retried", "Failed attempts rescheduled with backoff");
    this.commandsFailed = counter(namePrefix + ".commands.failed", "Commands that exhausted their retries");
    this.commandsCancelled = counter(namePrefix + ".commands.cancelled", "Commands cancelled");
    this.reservationsExpired = counter(namePrefix + ".reservations.expired", "Reservations freed by the sweep");
    this.kiosksMarkedOffline = counter(namePrefix + ".kiosks.marked.offline", "Kiosks flipped offline");
    this.contractsExpired = counter(namePrefix + ".contracts.expired", "VIP contracts expired");
    this.optimisticConflicts = counter(namePrefix + ".optimistic.conflicts", "Versioned updates that lost a race");
    this.transientRetries = counter(namePrefix + ".storage.transient.retries",
        "Operations retried after a busy or locked database");
    this.rowsPurged = counter(namePrefix + ".retention.purged", "Rows deleted by retention clean-up");

    this.onlineGauge = Gauge.builder(namePrefix + ".kiosks.online", online, AtomicInteger::get)
        .register(registry);
    this.offlineGauge = Gauge.builder(namePrefix + ".kiosks.offline", offline, AtomicInteger::get)
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementCommandsEnqueued() {
    if (closed) return;
    commandsEnqueued.increment();
  }

  @Override
  public void incrementCommandsCompleted() {
    if (closed) return;
    commandsCompleted.increment();
  }

  @Override
  public void incrementCommandsRetried() {
    if (closed) return;
    commandsRetried.increment();
  }

  @Override
  public void incrementCommandsFailed() {
    if (closed) return;
    commandsFailed.increment();
  }

  @Override
  public void addCommandsCancelled(int count) {
    if (closed) return;
    commandsCancelled.increment(count);
  }

  @Override
  public void addReservationsExpired(int count) {
    if (closed) return;
    reservationsExpired.increment(count);
  }

  @Override
  public void addKiosksMarkedOffline(int count) {
    if (closed) return;
    kiosksMarkedOffline.increment(count);
  }

  @Override
  public void addContractsExpired(int count) {
    if (closed) return;
    contractsExpired.increment(count);
  }

  @Override
  public void incrementOptimisticConflicts() {
    if (closed) return;
    optimisticConflicts.increment();
  }

  @Override
  public void incrementTransientRetries() {
    if (closed) return;
    transientRetries.increment();
  }

  @Override
  public void addRowsPurged(int count) {
    if (closed) return;
    rowsPurged.increment(count);
  }

  @Override
  public void recordFleetStatus(int online, int offline) {
    if (closed) return;
    this.online.set(online);
    this.offline.set(offline);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(commandsEnqueued, commandsCompleted, commandsRetried, commandsFailed,
        commandsCancelled, reservationsExpired, kiosksMarkedOffline, contractsExpired,
        optimisticConflicts, transientRetries, rowsPurged, onlineGauge, offlineGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
