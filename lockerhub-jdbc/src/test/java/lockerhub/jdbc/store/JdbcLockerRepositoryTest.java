package lockerhub.jdbc.store;

import lockerhub.LockerRepository;
import lockerhub.NotFoundException;
import lockerhub.OptimisticLockException;
import lockerhub.ValidationException;
import lockerhub.jdbc.H2Databases;
import lockerhub.jdbc.LockerHub;
import lockerhub.jdbc.MutableClock;
import lockerhub.model.Locker;
import lockerhub.model.LockerFilter;
import lockerhub.model.LockerKey;
import lockerhub.model.LockerStats;
import lockerhub.model.LockerStatus;
import lockerhub.model.LockerUpdate;
import lockerhub.model.NewLocker;
import lockerhub.model.NewVipContract;
import lockerhub.model.Owner;
import lockerhub.model.OwnerType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JdbcLockerRepositoryTest {

  private MutableClock clock;
  private LockerHub hub;
  private LockerRepository lockers;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
    hub = LockerHub.builder()
        .dataSource(H2Databases.newDataSource())
        .clock(clock)
        .build();
    lockers = hub.lockers();
  }

  @Test
  void createStartsFreeAtVersionOne() {
    Locker locker = lockers.create(new NewLocker("K1", 1, false, "Front row"));

    assertEquals(LockerStatus.FREE, locker.status());
    assertEquals(1L, locker.version());
    assertNull(locker.owner());
    assertEquals("Front row", locker.displayName());
    assertEquals(clock.instant(), locker.createdAt());
    assertTrue(lockers.exists(LockerKey.of("K1", 1)));
  }

  @Test
  void everyUpdateBumpsVersionByOne() {
    lockers.create(NewLocker.of("K1", 1));

    Locker reserved = lockers.updateLocker("K1", 1, LockerUpdate.builder()
        .status(LockerStatus.RESERVED)
        .owner(Owner.rfid("0009652489"))
        .reservedAt(clock.instant())
        .build(), 1);
    assertEquals(2L, reserved.version());
    assertEquals(new Owner(OwnerType.RFID, "0009652489"), reserved.owner());

    clock.advance(Duration.ofSeconds(5));
    Locker owned = lockers.updateLocker("K1", 1, LockerUpdate.builder()
        .status(LockerStatus.OWNED)
        .ownedAt(clock.instant())
        .build(), 2);
    assertEquals(3L, owned.version());
    assertEquals(clock.instant(), owned.updatedAt());
    assertEquals(reserved.reservedAt(), owned.reservedAt());
  }

  @Test
  void staleVersionIsRejected() {
    lockers.create(NewLocker.of("K1", 1));
    lockers.updateLocker("K1", 1, LockerUpdate.builder().status(LockerStatus.BLOCKED).build(), 1);

    OptimisticLockException e = assertThrows(OptimisticLockException.class,
        () -> lockers.updateLocker("K1", 1, LockerUpdate.builder().status(LockerStatus.FREE).build(), 1));

    assertEquals(1L, e.expectedVersion());
    assertEquals(2L, e.actualVersion());
    assertEquals(LockerStatus.BLOCKED, lockers.getById(LockerKey.of("K1", 1)).status());
  }

  @Test
  void updatingMissingLockerIsNotFound() {
    assertThrows(NotFoundException.class, () -> lockers.updateLocker("K1", 99,
        LockerUpdate.builder().status(LockerStatus.BLOCKED).build(), 1));
  }

  @Test
  void concurrentWritersHaveExactlyOneWinner() throws Exception {
    lockers.create(NewLocker.of("K1", 1));
    int writers = 6;
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger wins = new AtomicInteger();
    AtomicInteger conflicts = new AtomicInteger();
    try {
      for (int i = 0; i < writers; i++) {
        String card = "card-" + i;
        pool.submit(() -> {
          start.await();
          try {
            lockers.updateLocker("K1", 1, LockerUpdate.builder()
                .status(LockerStatus.RESERVED)
                .owner(Owner.rfid(card))
                .reservedAt(clock.instant())
                .build(), 1);
            wins.incrementAndGet();
          } catch (OptimisticLockException e) {
            conflicts.incrementAndGet();
          }
          return null;
        });
      }
      start.countDown();
    } finally {
      pool.shutdown();
      assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
    }

    assertEquals(1, wins.get());
    assertEquals(writers - 1, conflicts.get());
    assertEquals(2L, lockers.getById(LockerKey.of("K1", 1)).version());
  }

  @Test
  void findAvailableSkipsVipAndHeldLockers() {
    lockers.create(NewLocker.of("K1", 1));
    lockers.create(new NewLocker("K1", 2, true, null));
    lockers.create(NewLocker.of("K1", 3));
    lockers.create(NewLocker.of("K2", 1));
    lockers.updateLocker("K1", 3, LockerUpdate.builder().status(LockerStatus.BLOCKED).build(), 1);

    List<Locker> available = lockers.findAvailable("K1");

    assertEquals(1, available.size());
    assertEquals(1, available.get(0).id());
  }

  @Test
  void findByOwnerKeyReturnsLatestHeldLocker() {
    lockers.create(NewLocker.of("K1", 1));
    lockers.create(NewLocker.of("K1", 2));
    lockers.updateLocker("K1", 1, LockerUpdate.builder()
        .status(LockerStatus.RESERVED).owner(Owner.rfid("A")).reservedAt(clock.instant()).build(), 1);

    assertEquals(1, lockers.findByOwnerKey("A").orElseThrow().id());
    assertTrue(lockers.findByOwnerKey("B").isEmpty());
  }

  @Test
  void expiredReservationsAreFreedOnce() {
    lockers.create(NewLocker.of("K1", 1));
    lockers.create(NewLocker.of("K1", 2));
    lockers.updateLocker("K1", 1, LockerUpdate.builder()
        .status(LockerStatus.RESERVED).owner(Owner.rfid("A")).reservedAt(clock.instant()).build(), 1);
    clock.advance(Duration.ofSeconds(60));
    lockers.updateLocker("K1", 2, LockerUpdate.builder()
        .status(LockerStatus.RESERVED).owner(Owner.rfid("B")).reservedAt(clock.instant()).build(), 1);
    clock.advance(Duration.ofSeconds(31));

    assertEquals(1, lockers.findExpiredReserved(Duration.ofSeconds(90)).size());
    assertEquals(1, lockers.cleanupExpiredReservations(Duration.ofSeconds(90)));
    assertEquals(0, lockers.cleanupExpiredReservations(Duration.ofSeconds(90)));

    Locker freed = lockers.getById(LockerKey.of("K1", 1));
    assertEquals(LockerStatus.FREE, freed.status());
    assertNull(freed.owner());
    assertNull(freed.reservedAt());
    assertEquals(3L, freed.version());
    assertEquals(LockerStatus.RESERVED, lockers.getById(LockerKey.of("K1", 2)).status());
  }

  @Test
  void statsCountEveryStatus() {
    lockers.create(NewLocker.of("K1", 1));
    lockers.create(new NewLocker("K1", 2, true, null));
    lockers.create(NewLocker.of("K1", 3));
    lockers.updateLocker("K1", 3, LockerUpdate.builder().status(LockerStatus.ERROR).build(), 1);

    LockerStats stats = lockers.getStatsByKiosk("K1");

    assertEquals(3, stats.total());
    assertEquals(2, stats.free());
    assertEquals(1, stats.error());
    assertEquals(1, stats.vip());
    assertEquals(0, lockers.getStatsByKiosk("missing").total());
  }

  @Test
  void filtersCombine() {
    lockers.create(NewLocker.of("K1", 1));
    lockers.create(new NewLocker("K1", 2, true, null));
    lockers.create(NewLocker.of("K2", 1));

    assertEquals(2, lockers.count(LockerFilter.byKiosk("K1")));
    assertEquals(1, lockers.count(LockerFilter.byKiosk("K1").withVip(true)));
    assertEquals(3, lockers.findAll(LockerFilter.all().withStatus(LockerStatus.FREE)).size());
  }

  @Test
  void deleteIsRefusedWhileVipContractIsActive() {
    lockers.create(new NewLocker("K1", 1, true, null));
    lockers.create(NewLocker.of("K1", 2));
    hub.contracts().create(new NewVipContract("K1", 1, "VIP-1", null,
        LocalDate.of(2024, 3, 1), LocalDate.of(2024, 6, 1), "admin"));

    assertThrows(ValidationException.class, () -> lockers.delete(LockerKey.of("K1", 1)));
    assertTrue(lockers.delete(LockerKey.of("K1", 2)));
    assertFalse(lockers.delete(LockerKey.of("K1", 2)));
  }
}
