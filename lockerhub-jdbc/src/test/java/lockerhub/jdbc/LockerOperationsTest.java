package lockerhub.jdbc;

import lockerhub.CommandQueue;
import lockerhub.EventLog;
import lockerhub.IllegalTransitionException;
import lockerhub.LockerRepository;
import lockerhub.ValidationException;
import lockerhub.model.Command;
import lockerhub.model.CommandType;
import lockerhub.model.Event;
import lockerhub.model.EventFilter;
import lockerhub.model.EventType;
import lockerhub.model.Locker;
import lockerhub.model.LockerKey;
import lockerhub.model.LockerStatus;
import lockerhub.model.NewLocker;
import lockerhub.model.NewVipContract;
import lockerhub.model.Owner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class LockerOperationsTest {

  private MutableClock clock;
  private LockerHub hub;
  private LockerOperations ops;
  private LockerRepository lockers;
  private EventLog events;
  private CommandQueue commands;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
    hub = LockerHub.builder()
        .dataSource(H2Databases.newDataSource())
        .clock(clock)
        .commandMaxRetries(5)
        .build();
    ops = hub.lockerOperations();
    lockers = hub.lockers();
    events = hub.events();
    commands = hub.commands();
    for (int id = 1; id <= 4; id++) {
      lockers.create(NewLocker.of("K1", id));
    }
    lockers.create(new NewLocker("K1", 10, true, "VIP 10"));
  }

  private List<EventType> eventTypes() {
    return events.findAll(EventFilter.all()).stream().map(Event::type).toList();
  }

  @Test
  void fullRentalCycle() {
    Locker reserved = ops.assign("K1", 1, Owner.rfid("CARD-1"));
    assertEquals(LockerStatus.RESERVED, reserved.status());
    assertEquals(clock.instant(), reserved.reservedAt());
    assertEquals(2, reserved.version());

    Locker owned = ops.confirmOwnership("K1", 1);
    assertEquals(LockerStatus.OWNED, owned.status());
    assertEquals(clock.instant(), owned.ownedAt());

    assertEquals(LockerStatus.OPENING, ops.markOpening("K1", 1).status());

    Locker freed = ops.release("K1", 1, "CARD-1");
    assertEquals(LockerStatus.FREE, freed.status());
    assertNull(freed.owner());
    assertNull(freed.reservedAt());
    assertEquals(5, freed.version());

    Event release = events.findAll(EventFilter.builder().type(EventType.RFID_RELEASE).build()).get(0);
    assertEquals("CARD-1", release.rfidCard());
    assertEquals("Opening", release.details().get("previous_status"));
  }

  @Test
  void deviceOwnersLogQrEvents() {
    ops.assign("K1", 2, Owner.device("phone-7"));
    ops.release("K1", 2, null);

    assertTrue(eventTypes().containsAll(List.of(EventType.QR_ASSIGN, EventType.QR_RELEASE)));
    Event assign = events.findAll(EventFilter.builder().type(EventType.QR_ASSIGN).build()).get(0);
    assertEquals("phone-7", assign.deviceId());
    assertNull(assign.rfidCard());
  }

  @Test
  void cardMayHoldOnlyOneLocker() {
    ops.assign("K1", 1, Owner.rfid("CARD-1"));

    assertThrows(ValidationException.class, () -> ops.assign("K1", 2, Owner.rfid("CARD-1")));
    assertEquals(LockerStatus.FREE, lockers.getById(LockerKey.of("K1", 2)).status());
  }

  @Test
  void reservedLockerCannotBeTakenByAnotherCard() {
    ops.assign("K1", 1, Owner.rfid("CARD-1"));

    assertThrows(IllegalTransitionException.class, () -> ops.assign("K1", 1, Owner.rfid("CARD-2")));
  }

  @Test
  void releaseChecksHolder() {
    ops.assign("K1", 1, Owner.rfid("CARD-1"));

    assertThrows(ValidationException.class, () -> ops.release("K1", 1, "CARD-2"));
    assertEquals(LockerStatus.FREE, ops.release("K1", 1, "CARD-1").status());
  }

  @Test
  void confirmRequiresReservation() {
    assertThrows(IllegalTransitionException.class, () -> ops.confirmOwnership("K1", 1));
    assertThrows(IllegalTransitionException.class, () -> ops.markOpening("K1", 1));
  }

  @Test
  void blockedLockerRefusesAssignmentUntilUnblocked() {
    Locker blocked = ops.block("K1", 3, "alice", "cleaning");
    assertEquals(LockerStatus.BLOCKED, blocked.status());

    assertThrows(IllegalTransitionException.class, () -> ops.assign("K1", 3, Owner.rfid("CARD-1")));
    assertThrows(IllegalTransitionException.class, () -> ops.block("K1", 3, "alice", "again"));

    assertEquals(LockerStatus.FREE, ops.unblock("K1", 3, "alice").status());
    assertEquals(LockerStatus.RESERVED, ops.assign("K1", 3, Owner.rfid("CARD-1")).status());

    Event block = events.findAll(EventFilter.builder().type(EventType.STAFF_BLOCK).build()).get(0);
    assertEquals("alice", block.staffUser());
    assertEquals("cleaning", block.details().get("reason"));
  }

  @Test
  void staffActionsRequireStaffUser() {
    assertThrows(ValidationException.class, () -> ops.block("K1", 3, " ", "x"));
    assertThrows(ValidationException.class, () -> ops.staffOpen("K1", 3, null, "x"));
    assertEquals(0, events.count(EventFilter.all()));
  }

  @Test
  void hardwareErrorDropsOwnerUntilResolved() {
    ops.assign("K1", 1, Owner.rfid("CARD-1"));

    Locker failed = ops.reportHardwareError("K1", 1, "relay stuck");
    assertEquals(LockerStatus.ERROR, failed.status());
    assertNull(failed.owner());
    assertThrows(IllegalTransitionException.class, () -> ops.assign("K1", 1, Owner.rfid("CARD-2")));

    assertEquals(LockerStatus.FREE, ops.resolveError("K1", 1, null).status());
    Event error = events.findAll(EventFilter.builder().type(EventType.HARDWARE_ERROR).build()).get(0);
    assertEquals("relay stuck", error.details().get("error"));
    assertEquals("Reserved", error.details().get("previous_status"));
  }

  @Test
  void vipLockersAreNeverAssigned() {
    LocalDate today = LocalDate.of(2024, 3, 1);
    hub.contracts().create(new NewVipContract("K1", 10, "VIP-1", "VIP-2", today, today.plusDays(30), "alice"));

    assertThrows(ValidationException.class, () -> ops.assign("K1", 10, Owner.rfid("VIP-1")));
    assertThrows(ValidationException.class, () -> ops.assign("K1", 10, Owner.rfid("WALK-IN")));
    assertThrows(ValidationException.class, () -> ops.assign("K1", 10, Owner.vip("VIP-2")));
    assertThrows(ValidationException.class, () -> ops.assign("K1", 1, Owner.vip("VIP-1")));

    assertEquals(LockerStatus.FREE, lockers.getById(LockerKey.of("K1", 10)).status());
    assertEquals(LockerStatus.FREE, lockers.getById(LockerKey.of("K1", 1)).status());
    assertTrue(events.findAll(EventFilter.all()).stream().noneMatch(e -> e.type() == EventType.RFID_ASSIGN));
  }

  @Test
  void sameCardWaitsForEnclosingTransactionToCommit() throws Exception {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<Locker> second = hub.withTransaction(() -> {
        ops.assign("K1", 1, Owner.rfid("CARD-1"));
        Future<Locker> pending = executor.submit(() -> ops.assign("K1", 2, Owner.rfid("CARD-1")));
        assertThrows(TimeoutException.class, () -> pending.get(200, TimeUnit.MILLISECONDS));
        return pending;
      });

      ExecutionException failure = assertThrows(ExecutionException.class, () -> second.get(10, TimeUnit.SECONDS));
      assertInstanceOf(ValidationException.class, failure.getCause());
    } finally {
      executor.shutdownNow();
    }
    assertEquals(LockerStatus.RESERVED, lockers.getById(LockerKey.of("K1", 1)).status());
    assertEquals(LockerStatus.FREE, lockers.getById(LockerKey.of("K1", 2)).status());
  }

  @Test
  void rolledBackAssignmentReleasesTheCard() throws Exception {
    assertThrows(IllegalStateException.class, () -> hub.withTransaction(() -> {
      ops.assign("K1", 1, Owner.rfid("CARD-1"));
      throw new IllegalStateException("kiosk rejected the reservation");
    }));

    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Locker other = executor.submit(() -> ops.assign("K1", 2, Owner.rfid("CARD-1")))
          .get(10, TimeUnit.SECONDS);
      assertEquals(LockerStatus.RESERVED, other.status());
    } finally {
      executor.shutdownNow();
    }
    assertEquals(LockerStatus.FREE, lockers.getById(LockerKey.of("K1", 1)).status());
  }

  @Test
  void renameUpdatesDisplayName() {
    Locker renamed = ops.rename("K1", 2, "  Gym bag  ", "alice");

    assertEquals("Gym bag", renamed.displayName());
    assertEquals("alice", renamed.nameUpdatedBy());
    assertEquals(clock.instant(), renamed.nameUpdatedAt());
  }

  @Test
  void staffOpenQueuesCommandAndAuditEvent() {
    Command command = ops.staffOpen("K1", 2, "alice", "customer lost card");

    assertEquals(CommandType.OPEN_LOCKER, command.type());
    assertEquals(5, command.maxRetries());
    assertEquals(2, command.payload().get("locker_id"));
    assertEquals(1, commands.getPendingCommands("K1").size());

    Event event = events.findAll(EventFilter.builder().type(EventType.STAFF_OPEN).build()).get(0);
    assertEquals("alice", event.staffUser());
    assertEquals(command.commandId(), event.details().get("command_id"));
    assertEquals(LockerStatus.FREE, lockers.getById(LockerKey.of("K1", 2)).status());
  }

  @Test
  void bulkOpenSkipsVipAndUnknownLockers() {
    Command command = ops.bulkOpen("K1", List.of(1, 2, 10, 99), "alice", true);

    assertEquals(CommandType.BULK_OPEN, command.type());
    assertEquals(List.of(1, 2), command.payload().get("locker_ids"));
    Event event = events.findAll(EventFilter.builder().type(EventType.BULK_OPEN).build()).get(0);
    assertEquals(2, event.details().get("count"));

    assertThrows(ValidationException.class, () -> ops.bulkOpen("K1", List.of(10), "alice", true));
    assertEquals(1, commands.getPendingCommands("K1").size());
  }

  @Test
  void missingLockerIsNotFound() {
    assertThrows(lockerhub.NotFoundException.class, () -> ops.assign("K9", 1, Owner.rfid("CARD-1")));
  }
}
