package lockerhub.model;

import org.junit.jupiter.api.Test;

import static lockerhub.model.VipTransferStatus.*;
import static org.junit.jupiter.api.Assertions.*;

class VipTransferStatusTest {

  @Test
  void pendingCanBeApprovedRejectedOrCancelled() {
    assertTrue(PENDING.canTransitionTo(APPROVED));
    assertTrue(PENDING.canTransitionTo(REJECTED));
    assertTrue(PENDING.canTransitionTo(CANCELLED));
    assertFalse(PENDING.canTransitionTo(COMPLETED));
  }

  @Test
  void approvedCanCompleteOrCancel() {
    assertTrue(APPROVED.canTransitionTo(COMPLETED));
    assertTrue(APPROVED.canTransitionTo(CANCELLED));
    assertFalse(APPROVED.canTransitionTo(REJECTED));
  }

  @Test
  void terminalStatesAreFinal() {
    for (VipTransferStatus terminal : new VipTransferStatus[]{REJECTED, COMPLETED, CANCELLED}) {
      assertTrue(terminal.isTerminal());
      for (VipTransferStatus next : values()) {
        assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
      }
    }
  }

  @Test
  void fromCode() {
    assertSame(APPROVED, VipTransferStatus.fromCode("approved"));
    assertThrows(IllegalArgumentException.class, () -> VipTransferStatus.fromCode("done"));
  }
}
