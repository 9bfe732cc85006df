package lockerhub.spi;

/**
 * Observability hook for exporting queue, sweep and contention counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Counts for writes made
 * inside a transaction are reported only after the transaction commits.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of commands added to a kiosk queue.
     */
    void incrementCommandsEnqueued();

    /**
     * Increments the count of commands a kiosk reported as completed.
     */
    void incrementCommandsCompleted();

    /**
     * Increments the count of failed attempts that were rescheduled.
     */
    void incrementCommandsRetried();

    /**
     * Increments the count of commands that exhausted their retries.
     */
    void incrementCommandsFailed();

    /**
     * Adds to the count of cancelled commands (single cancel or restart clean-up).
     */
    void addCommandsCancelled(int count);

    /**
     * Adds to the count of reservations freed by the expiry sweep.
     */
    void addReservationsExpired(int count);

    /**
     * Adds to the count of kiosks flipped offline by the liveness sweep.
     */
    void addKiosksMarkedOffline(int count);

    /**
     * Adds to the count of VIP contracts expired by the contract sweep.
     */
    void addContractsExpired(int count);

    /**
     * Increments the count of versioned updates that lost a race.
     */
    default void incrementOptimisticConflicts() {
    }

    /**
     * Increments the count of operations retried after a transient storage error.
     */
    default void incrementTransientRetries() {
    }

    /**
     * Adds to the count of rows deleted by retention clean-up.
     */
    default void addRowsPurged(int count) {
    }

    /**
     * Records the current number of online and offline kiosks.
     */
    void recordFleetStatus(int online, int offline);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementCommandsEnqueued() {
        }

        @Override
        public void incrementCommandsCompleted() {
        }

        @Override
        public void incrementCommandsRetried() {
        }

        @Override
        public void incrementCommandsFailed() {
        }

        @Override
        public void addCommandsCancelled(int count) {
        }

        @Override
        public void addReservationsExpired(int count) {
        }

        @Override
        public void addKiosksMarkedOffline(int count) {
        }

        @Override
        public void addContractsExpired(int count) {
        }

        @Override
        public void recordFleetStatus(int online, int offline) {
        }
    }
}
