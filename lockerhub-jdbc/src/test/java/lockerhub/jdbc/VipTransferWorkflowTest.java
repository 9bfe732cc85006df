package lockerhub.jdbc;

import lockerhub.EventLog;
import lockerhub.IllegalTransitionException;
import lockerhub.ValidationException;
import lockerhub.model.Event;
import lockerhub.model.EventFilter;
import lockerhub.model.EventType;
import lockerhub.model.LockerKey;
import lockerhub.model.NewLocker;
import lockerhub.model.NewVipContract;
import lockerhub.model.NewVipTransfer;
import lockerhub.model.VipContract;
import lockerhub.model.VipHistoryAction;
import lockerhub.model.VipTransferRequest;
import lockerhub.model.VipTransferStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VipTransferWorkflowTest {

  private static final LocalDate TODAY = LocalDate.of(2024, 3, 1);

  private LockerHub hub;
  private VipTransferWorkflow workflow;
  private EventLog events;
  private VipContract contract;

  @BeforeEach
  void setUp() {
    hub = LockerHub.builder()
        .dataSource(H2Databases.newDataSource())
        .clock(MutableClock.startingAt("2024-03-01T10:00:00Z"))
        .build();
    workflow = hub.transferWorkflow();
    events = hub.events();
    hub.lockers().create(new NewLocker("K1", 1, true, null));
    hub.lockers().create(NewLocker.of("K2", 4));
    contract = hub.contracts().create(
        new NewVipContract("K1", 1, "CARD-1", null, TODAY, TODAY.plusDays(60), "alice"));
  }

  private VipTransferRequest request(String newCard) {
    return workflow.request(new NewVipTransfer(contract.id(), "K2", 4, newCard, "closer to pool", "bob"));
  }

  private List<EventType> transferEvents() {
    return events.findAll(EventFilter.all()).stream()
        .map(Event::type)
        .filter(type -> type.code().startsWith("vip_transfer_"))
        .toList();
  }

  @Test
  void completedTransferMovesContractAndVipFlags() {
    VipTransferRequest requested = request("CARD-NEW");
    workflow.approve(requested.id(), "manager");

    VipContract moved = workflow.complete(requested.id(), "manager");

    assertEquals("K2:4", moved.location());
    assertEquals("CARD-NEW", moved.rfidCard());
    assertFalse(hub.lockers().getById(LockerKey.of("K1", 1)).vip());
    assertTrue(hub.lockers().getById(LockerKey.of("K2", 4)).vip());
    assertEquals(VipTransferStatus.COMPLETED, hub.transfers().getById(requested.id()).status());
    assertEquals(VipHistoryAction.TRANSFERRED, hub.history().getContractHistory(contract.id()).get(0).action());
    assertEquals(List.of(EventType.VIP_TRANSFER_COMPLETED, EventType.VIP_TRANSFER_APPROVED,
        EventType.VIP_TRANSFER_REQUESTED), transferEvents());
    assertTrue(hub.contracts().isLockerAvailable("K1", 1));
  }

  @Test
  void completeRequiresApproval() {
    VipTransferRequest requested = request(null);

    assertThrows(IllegalTransitionException.class, () -> workflow.complete(requested.id(), "manager"));
    assertEquals("K1:1", hub.contracts().getById(contract.id()).location());
    assertEquals(List.of(EventType.VIP_TRANSFER_REQUESTED), transferEvents());
  }

  @Test
  void occupiedTargetRollsBackEverything() {
    VipTransferRequest requested = request(null);
    workflow.approve(requested.id(), "manager");
    hub.contracts().create(new NewVipContract("K2", 4, "CARD-9", null, TODAY, TODAY.plusDays(10), "alice"));

    assertThrows(ValidationException.class, () -> workflow.complete(requested.id(), "manager"));

    assertEquals(VipTransferStatus.APPROVED, hub.transfers().getById(requested.id()).status());
    assertEquals("K1:1", hub.contracts().getById(contract.id()).location());
    assertTrue(hub.lockers().getById(LockerKey.of("K1", 1)).vip());
  }

  @Test
  void rejectionIsLoggedWithReason() {
    VipTransferRequest requested = request(null);

    VipTransferRequest rejected = workflow.reject(requested.id(), "manager", "target under repair");

    assertEquals(VipTransferStatus.REJECTED, rejected.status());
    Event event = events.findAll(EventFilter.builder().type(EventType.VIP_TRANSFER_REJECTED).build()).get(0);
    assertEquals("manager", event.staffUser());
    assertEquals("target under repair", event.details().get("reason"));
    assertEquals(requested.id(), ((Number) event.details().get("transfer_id")).longValue());
  }

  @Test
  void cancelledRequestFreesLockersForNewRequest() {
    VipTransferRequest requested = request(null);

    assertEquals(VipTransferStatus.CANCELLED, workflow.cancel(requested.id(), "bob").status());
    assertFalse(hub.transfers().hasLockerPendingTransfers("K2", 4));
    assertEquals(VipTransferStatus.PENDING, request(null).status());
  }

  @Test
  void failedRequestLeavesNoEvent() {
    request(null);

    assertThrows(ValidationException.class, () -> request(null));
    assertEquals(1, transferEvents().size());
  }
}
