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
import lockerhub.jdbc.dialect.H2Dialect;
import lockerhub.maintenance.MaintenanceScheduler;
import lockerhub.model.KioskRegistration;
import lockerhub.model.NewLocker;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class LockerHubAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          LockerHubAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:lockerhub_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:schema.sql",
          "lockerhub.maintenance.enabled=false");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertInstanceOf(LockerHub.class, ctx.getBean(LockerHub.class));
      assertNotNull(ctx.getBean(LockerRepository.class));
      assertNotNull(ctx.getBean(CommandQueue.class));
      assertNotNull(ctx.getBean(KioskRegistry.class));
      assertNotNull(ctx.getBean(EventLog.class));
      assertNotNull(ctx.getBean(VipContractRepository.class));
      assertNotNull(ctx.getBean(VipHistoryRepository.class));
      assertNotNull(ctx.getBean(VipTransferRepository.class));
      assertNotNull(ctx.getBean(LockerOperations.class));
      assertNotNull(ctx.getBean(VipTransferWorkflow.class));
      assertFalse(ctx.containsBean("maintenanceScheduler"));

      LockerHub hub = ctx.getBean(LockerHub.class);
      assertInstanceOf(H2Dialect.class, hub.database().dialect());
      assertSame(hub.lockers(), ctx.getBean(LockerRepository.class));
    });
  }

  @Test
  void beansWorkAgainstInitializedSchema() {
    runner.run(ctx -> {
      ctx.getBean(KioskRegistry.class).registerKiosk(KioskRegistration.of("K1", "lobby"));
      ctx.getBean(LockerRepository.class).create(NewLocker.of("K1", 1));

      assertEquals(1, ctx.getBean(LockerRepository.class).findAvailable("K1").size());
      assertEquals(1, ctx.getBean(KioskRegistry.class).getAllZones().size());
    });
  }

  @Test
  void startsMaintenanceSchedulerByDefault() {
    runner
        .withPropertyValues("lockerhub.maintenance.enabled=true",
            "lockerhub.maintenance.sweep-interval=1h")
        .run(ctx -> {
          assertTrue(ctx.containsBean("maintenanceScheduler"));
          assertInstanceOf(MaintenanceScheduler.class, ctx.getBean(MaintenanceScheduler.class));
        });
  }

  @Test
  void explicitDialect() {
    runner.withPropertyValues("lockerhub.dialect=h2").run(ctx -> {
      assertEquals("h2", ctx.getBean(LockerHub.class).database().dialect().name());
    });
  }

  @Test
  void unknownDialectFailsStartup() {
    runner.withPropertyValues("lockerhub.dialect=oracle").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(LockerHubAutoConfiguration.class))
        .run(ctx -> {
          assertFalse(ctx.containsBean("lockerHub"));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomQueueConfig.class).run(ctx -> {
      assertEquals("myQueue", ctx.getBeanNamesForType(CommandQueue.class)[0]);
      assertEquals(1, ctx.getBeanNamesForType(CommandQueue.class).length);
    });
  }

  @Configuration
  static class CustomQueueConfig {
    @Bean
    CommandQueue myQueue(LockerHub hub) {
      return hub.commands();
    }
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }
}
