package lockerhub.model;

import lockerhub.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LockerUpdateTest {

  @Test
  void emptyUpdateIsRejected() {
    assertThrows(ValidationException.class, () -> LockerUpdate.builder().build());
  }

  @Test
  void onlySetFieldsAreChanged() {
    Instant now = Instant.parse("2024-01-01T00:00:00Z");
    LockerUpdate update = LockerUpdate.builder()
        .status(LockerStatus.RESERVED)
        .owner(Owner.rfid("123"))
        .reservedAt(now)
        .build();

    assertTrue(update.has(LockerUpdate.Field.STATUS));
    assertTrue(update.has(LockerUpdate.Field.OWNER));
    assertFalse(update.has(LockerUpdate.Field.VIP));
    assertEquals(LockerStatus.RESERVED, update.status());
    assertEquals(Owner.rfid("123"), update.owner());
    assertEquals(now, update.reservedAt());
  }

  @Test
  void clearOwnerClearsTimestamps() {
    LockerUpdate update = LockerUpdate.builder().status(LockerStatus.FREE).clearOwner().build();

    assertTrue(update.has(LockerUpdate.Field.OWNER));
    assertTrue(update.has(LockerUpdate.Field.RESERVED_AT));
    assertTrue(update.has(LockerUpdate.Field.OWNED_AT));
    assertNull(update.owner());
    assertNull(update.reservedAt());
  }

  @Test
  void displayNameIsTrimmedAndBounded() {
    LockerUpdate update = LockerUpdate.builder().displayName("  Gym A  ", "staff").build();
    assertEquals("Gym A", update.displayName());
    assertEquals("staff", update.nameUpdatedBy());

    assertThrows(ValidationException.class,
        () -> LockerUpdate.builder().displayName("   ", "staff"));
    assertThrows(ValidationException.class,
        () -> LockerUpdate.builder().displayName("x".repeat(21), "staff"));
  }

  @Test
  void statusCodesRoundTrip() {
    for (LockerStatus status : LockerStatus.values()) {
      assertSame(status, LockerStatus.fromCode(status.code()));
    }
    assertTrue(LockerStatus.OPENING.isHeld());
    assertFalse(LockerStatus.BLOCKED.isHeld());
  }

  @Test
  void ownerKeyCannotBeBlank() {
    assertThrows(IllegalArgumentException.class, () -> Owner.rfid(" "));
  }
}
