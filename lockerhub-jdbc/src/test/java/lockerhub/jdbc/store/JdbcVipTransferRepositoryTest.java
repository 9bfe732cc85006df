package lockerhub.jdbc.store;

import lockerhub.IllegalTransitionException;
import lockerhub.NotFoundException;
import lockerhub.ValidationException;
import lockerhub.VipTransferRepository;
import lockerhub.jdbc.H2Databases;
import lockerhub.jdbc.LockerHub;
import lockerhub.jdbc.MutableClock;
import lockerhub.model.NewVipContract;
import lockerhub.model.NewVipTransfer;
import lockerhub.model.VipContract;
import lockerhub.model.VipTransferRequest;
import lockerhub.model.VipTransferStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class JdbcVipTransferRepositoryTest {

  private LockerHub hub;
  private VipTransferRepository transfers;
  private VipContract contract;

  @BeforeEach
  void setUp() {
    MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
    hub = LockerHub.builder()
        .dataSource(H2Databases.newDataSource())
        .clock(clock)
        .build();
    transfers = hub.transfers();
    LocalDate today = LocalDate.of(2024, 3, 1);
    contract = hub.contracts().create(
        new NewVipContract("K1", 1, "CARD-1", null, today, today.plusDays(30), "alice"));
  }

  private VipTransferRequest request(int toLocker) {
    return transfers.create(new NewVipTransfer(contract.id(), "K2", toLocker, null, "closer to gym", "bob"));
  }

  @Test
  void createTakesSourceFromContract() {
    VipTransferRequest created = request(4);

    assertEquals(VipTransferStatus.PENDING, created.status());
    assertEquals("K1", created.fromKioskId());
    assertEquals(1, created.fromLockerId());
    assertTrue(created.touches("K2", 4));
    assertTrue(transfers.hasLockerPendingTransfers("K1", 1));
    assertTrue(transfers.hasLockerPendingTransfers("K2", 4));
    assertFalse(transfers.hasLockerPendingTransfers("K2", 5));
    assertEquals(1, transfers.getPendingTransfers().size());
  }

  @Test
  void onlyOneOpenTransferPerLocker() {
    request(4);

    assertThrows(ValidationException.class, () -> request(5));
  }

  @Test
  void targetMustDifferFromSource() {
    assertThrows(ValidationException.class, () -> transfers.create(
        new NewVipTransfer(contract.id(), "K1", 1, null, "same", "bob")));
  }

  @Test
  void unknownOrInactiveContractIsRejected() {
    assertThrows(NotFoundException.class, () -> transfers.create(
        new NewVipTransfer(999L, "K2", 4, null, "x", "bob")));

    hub.contracts().cancelContract(contract.id(), "bob", null);
    assertThrows(ValidationException.class, () -> request(4));
  }

  @Test
  void approveThenComplete() {
    VipTransferRequest created = request(4);

    VipTransferRequest approved = transfers.approve(created.id(), "manager");
    assertEquals(VipTransferStatus.APPROVED, approved.status());
    assertEquals("manager", approved.approvedBy());
    assertNotNull(approved.approvedAt());
    assertTrue(transfers.hasLockerPendingTransfers("K2", 4));

    VipTransferRequest completed = transfers.complete(created.id());
    assertEquals(VipTransferStatus.COMPLETED, completed.status());
    assertNotNull(completed.completedAt());
    assertFalse(transfers.hasLockerPendingTransfers("K2", 4));
  }

  @Test
  void rejectedTransferFreesTheLockers() {
    VipTransferRequest created = request(4);

    VipTransferRequest rejected = transfers.reject(created.id(), "manager", "locker reserved for staff");
    assertEquals(VipTransferStatus.REJECTED, rejected.status());
    assertEquals("locker reserved for staff", rejected.rejectionReason());
    assertFalse(transfers.hasLockerPendingTransfers("K1", 1));

    assertEquals(VipTransferStatus.PENDING, request(5).status());
  }

  @Test
  void illegalTransitionsAreRefused() {
    VipTransferRequest created = request(4);

    assertThrows(IllegalTransitionException.class, () -> transfers.complete(created.id()));
    transfers.cancel(created.id());
    assertThrows(IllegalTransitionException.class, () -> transfers.approve(created.id(), "manager"));
    assertThrows(IllegalTransitionException.class, () -> transfers.cancel(created.id()));
    assertThrows(NotFoundException.class, () -> transfers.approve(999L, "manager"));
  }

  @Test
  void transfersByContractAndStatusCounts() {
    VipTransferRequest first = request(4);
    transfers.cancel(first.id());
    request(5);

    assertEquals(2, transfers.getTransfersByContract(contract.id()).size());
    assertEquals(1, transfers.count(VipTransferStatus.CANCELLED));
    assertEquals(2, transfers.count(null));
  }
}
