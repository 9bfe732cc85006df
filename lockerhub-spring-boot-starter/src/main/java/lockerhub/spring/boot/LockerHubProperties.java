package lockerhub.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the locker hub.
 *
 * @see LockerHubAutoConfiguration
 */
@ConfigurationProperties(prefix = "lockerhub")
public class LockerHubProperties {

    /**
     * SQL dialect name ({@code h2}, {@code mysql}, {@code postgresql}, {@code sqlite}).
     * Detected from the JDBC URL when unset.
     */
    private String dialect;

    /**
     * Lock wait applied to each connection before giving up with a busy error.
     */
    private Duration busyTimeout = Duration.ofSeconds(5);

    private final TransientRetry transientRetry = new TransientRetry();
    private final OptimisticRetry optimisticRetry = new OptimisticRetry();
    private final Commands commands = new Commands();
    private final Lockers lockers = new Lockers();
    private final Maintenance maintenance = new Maintenance();
    private final Metrics metrics = new Metrics();

    public String getDialect() {
        return dialect;
    }

    public void setDialect(String dialect) {
        this.dialect = dialect;
    }

    public Duration getBusyTimeout() {
        return busyTimeout;
    }

    public void setBusyTimeout(Duration busyTimeout) {
        this.busyTimeout = busyTimeout;
    }

    public TransientRetry getTransientRetry() {
        return transientRetry;
    }

    public OptimisticRetry getOptimisticRetry() {
        return optimisticRetry;
    }

    public Commands getCommands() {
        return commands;
    }

    public Lockers getLockers() {
        return lockers;
    }

    public Maintenance getMaintenance() {
        return maintenance;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Retries of operations that fail with a transient storage error.
     */
    public static class TransientRetry {

        private int maxAttempts = 3;

        /**
         * Base delay; attempt {@code n} waits {@code n * delay}.
         */
        private Duration delay = Duration.ofMillis(100);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getDelay() {
            return delay;
        }

        public void setDelay(Duration delay) {
            this.delay = delay;
        }
    }

    public static class OptimisticRetry {

        /**
         * Attempts per locker transition that loses a version race.
         */
        private int maxAttempts = 3;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    /**
     * Backoff of failed kiosk commands.
     */
    public static class Commands {

        private Duration baseDelay = Duration.ofSeconds(5);

        private Duration maxDelay = Duration.ofHours(1);

        private int defaultMaxRetries = 3;

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public int getDefaultMaxRetries() {
            return defaultMaxRetries;
        }

        public void setDefaultMaxRetries(int defaultMaxRetries) {
            this.defaultMaxRetries = defaultMaxRetries;
        }
    }

    public static class Lockers {

        /**
         * Age after which an unconfirmed reservation is released.
         */
        private Duration reservationTimeout = Duration.ofSeconds(90);

        public Duration getReservationTimeout() {
            return reservationTimeout;
        }

        public void setReservationTimeout(Duration reservationTimeout) {
            this.reservationTimeout = reservationTimeout;
        }
    }

    /**
     * Background sweeps and retention purges.
     */
    public static class Maintenance {

        private boolean enabled = true;

        private Duration sweepInterval = Duration.ofSeconds(10);

        private Duration purgeInterval = Duration.ofHours(1);

        private Duration commandRetention = Duration.ofDays(7);

        private Duration eventRetention = Duration.ofDays(30);

        private Duration historyRetention = Duration.ofDays(365);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public Duration getPurgeInterval() {
            return purgeInterval;
        }

        public void setPurgeInterval(Duration purgeInterval) {
            this.purgeInterval = purgeInterval;
        }

        public Duration getCommandRetention() {
            return commandRetention;
        }

        public void setCommandRetention(Duration commandRetention) {
            this.commandRetention = commandRetention;
        }

        public Duration getEventRetention() {
            return eventRetention;
        }

        public void setEventRetention(Duration eventRetention) {
            this.eventRetention = eventRetention;
        }

        public Duration getHistoryRetention() {
            return historyRetention;
        }

        public void setHistoryRetention(Duration historyRetention) {
            this.historyRetention = historyRetention;
        }
    }

    public static class Metrics {

        /**
         * Whether to register Micrometer meters when a MeterRegistry is present.
         */
        private boolean enabled = true;

        private String namePrefix = "lockerhub";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
