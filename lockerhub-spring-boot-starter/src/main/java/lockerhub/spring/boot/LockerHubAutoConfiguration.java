package lockerhub.spring.boot;

import lockerhub.CommandQueue;
import lockerhub.EventLog;
import lockerhub.KioskRegistry;
import lockerhub.LockerRepository;
import lockerhub.VipContractRepository;
import lockerhub.VipHistoryRepository;
import lockerhub.VipTransferRepository;
import lockerhub.jdbc.LockerHub;
import lockerhub.jdbc.LockerOperations;
import lockerhub.jdbc.VipTransferWorkflow;
import lockerhub.jdbc.dialect.Dialects;
import lockerhub.maintenance.MaintenanceScheduler;
import lockerhub.retry.ExponentialBackoffRetryPolicy;
import lockerhub.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for the locker hub.
 *
 * <p>Wires a {@link LockerHub} from a {@link DataSource} and {@link LockerHubProperties},
 * exposes its repositories as beans and starts a {@link MaintenanceScheduler} unless
 * {@code lockerhub.maintenance.enabled} is false.
 *
 * @see LockerHubProperties
 * @see LockerHubMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(LockerHub.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(LockerHubProperties.class)
public class LockerHubAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public LockerHub lockerHub(DataSource dataSource, LockerHubProperties props,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<Clock> clockProvider) {
    var commands = props.getCommands();
    var builder = LockerHub.builder()
        .dataSource(dataSource)
        .busyTimeout(props.getBusyTimeout())
        .maxAttempts(props.getTransientRetry().getMaxAttempts())
        .retryDelay(props.getTransientRetry().getDelay())
        .optimisticMaxAttempts(props.getOptimisticRetry().getMaxAttempts())
        .commandRetryPolicy(new ExponentialBackoffRetryPolicy(
            commands.getBaseDelay().toMillis(), commands.getMaxDelay().toMillis()))
        .commandMaxRetries(commands.getDefaultMaxRetries())
        .reservationTimeout(props.getLockers().getReservationTimeout());
    String dialect = props.getDialect();
    if (dialect != null && !dialect.isBlank()) {
      builder.dialect(Dialects.get(dialect));
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    Clock clock = clockProvider.getIfAvailable();
    if (clock != null) {
      builder.clock(clock);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public LockerRepository lockerRepository(LockerHub hub) {
    return hub.lockers();
  }

  @Bean
  @ConditionalOnMissingBean
  public CommandQueue commandQueue(LockerHub hub) {
    return hub.commands();
  }

  @Bean
  @ConditionalOnMissingBean
  public KioskRegistry kioskRegistry(LockerHub hub) {
    return hub.kiosks();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventLog eventLog(LockerHub hub) {
    return hub.events();
  }

  @Bean
  @ConditionalOnMissingBean
  public VipContractRepository vipContractRepository(LockerHub hub) {
    return hub.contracts();
  }

  @Bean
  @ConditionalOnMissingBean
  public VipHistoryRepository vipHistoryRepository(LockerHub hub) {
    return hub.history();
  }

  @Bean
  @ConditionalOnMissingBean
  public VipTransferRepository vipTransferRepository(LockerHub hub) {
    return hub.transfers();
  }

  @Bean
  @ConditionalOnMissingBean
  public LockerOperations lockerOperations(LockerHub hub) {
    return hub.lockerOperations();
  }

  @Bean
  @ConditionalOnMissingBean
  public VipTransferWorkflow vipTransferWorkflow(LockerHub hub) {
    return hub.transferWorkflow();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "lockerhub.maintenance", name = "enabled", matchIfMissing = true)
  public MaintenanceScheduler maintenanceScheduler(LockerHub hub, LockerHubProperties props) {
    var maintenance = props.getMaintenance();
    return hub.maintenanceScheduler()
        .sweepInterval(maintenance.getSweepInterval())
        .purgeInterval(maintenance.getPurgeInterval())
        .commandRetention(maintenance.getCommandRetention())
        .eventRetention(maintenance.getEventRetention())
        .historyRetention(maintenance.getHistoryRetention())
        .build();
  }
}
