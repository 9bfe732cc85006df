package lockerhub.model;

import lockerhub.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NewEventTest {

  @Test
  void staffUserProducesStaffAction() {
    NewEvent event = NewEvent.builder(EventType.STAFF_OPEN, "K1")
        .lockerId(5)
        .staffUser("admin")
        .detail("reason", "lost card")
        .build();

    assertInstanceOf(NewEvent.StaffAction.class, event);
    assertEquals("admin", event.staffUser());
    assertEquals(5, event.lockerId());
    assertEquals("lost card", event.details().get("reason"));
  }

  @Test
  void staffOnlyTypesRequireStaffUser() {
    for (EventType type : new EventType[]{EventType.STAFF_OPEN, EventType.STAFF_BLOCK, EventType.STAFF_UNBLOCK}) {
      var builder = NewEvent.builder(type, "K1").lockerId(1);
      assertThrows(ValidationException.class, builder::build, type.code());
    }
  }

  @Test
  void blankStaffUserIsRejected() {
    var builder = NewEvent.builder(EventType.STAFF_BLOCK, "K1").staffUser("  ");

    assertThrows(ValidationException.class, builder::build);
  }

  @Test
  void ordinaryEventsDoNotNeedStaffUser() {
    NewEvent event = NewEvent.builder(EventType.RFID_ASSIGN, "K1")
        .lockerId(3)
        .rfidCard("0009652489")
        .build();

    assertInstanceOf(NewEvent.Action.class, event);
    assertNull(event.staffUser());
    assertEquals("0009652489", event.rfidCard());
  }

  @Test
  void detailsAreCopiedAndImmutable() {
    Map<String, Object> details = new HashMap<>();
    details.put("a", 1);
    NewEvent event = NewEvent.builder(EventType.RESTARTED, "K1").details(details).build();
    details.put("b", 2);

    assertEquals(Map.of("a", 1), event.details());
    assertThrows(UnsupportedOperationException.class, () -> event.details().put("c", 3));
  }

  @Test
  void categoryFollowsTypeAndStaffUser() {
    assertEquals(EventCategory.STAFF, EventCategory.of(EventType.RFID_ASSIGN, true));
    assertEquals(EventCategory.SYSTEM, EventCategory.of(EventType.RESTARTED, false));
    assertEquals(EventCategory.SYSTEM, EventCategory.of(EventType.KIOSK_OFFLINE, false));
    assertEquals(EventCategory.USER, EventCategory.of(EventType.QR_ASSIGN, false));
  }

  @Test
  void typeCodesRoundTrip() {
    for (EventType type : EventType.values()) {
      if (type != EventType.OTHER) {
        assertSame(type, EventType.fromCode(type.code()));
      }
    }
    assertThrows(IllegalArgumentException.class, () -> EventType.fromCode("nope"));
    assertThrows(IllegalArgumentException.class, () -> EventType.fromCode("other"));
  }

  @Test
  void unknownStoredCodesReadAsOther() {
    assertSame(EventType.OTHER, EventType.fromStoredCode("staff_release"));
    assertSame(EventType.STAFF_OPEN, EventType.fromStoredCode("staff_open"));

    Event legacy = new Event(7L, Instant.EPOCH, "K1", 3, EventType.OTHER, "system_boot",
        null, null, null, Map.of());
    assertEquals("system_boot", legacy.typeCode());
    assertEquals(EventCategory.SYSTEM, legacy.category());
    assertEquals(EventCategory.USER, EventCategory.of("staff_release", false));
  }

  @Test
  void otherCannotBeWritten() {
    assertThrows(ValidationException.class, () -> new NewEvent.Action(
        EventType.OTHER, "K1", 1, null, null, Map.of()));
  }
}
