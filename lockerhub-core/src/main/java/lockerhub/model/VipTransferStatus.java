package lockerhub.model;

/**
 * Transfer request states: {@code pending -> approved | rejected},
 * {@code approved -> completed}, and any non-terminal state {@code -> cancelled}.
 */
public enum VipTransferStatus {
  PENDING("pending"),
  APPROVED("approved"),
  REJECTED("rejected"),
  COMPLETED("completed"),
  CANCELLED("cancelled");

  private final String code;

  VipTransferStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public boolean isTerminal() {
    return this == REJECTED || this == COMPLETED || this == CANCELLED;
  }

  public boolean canTransitionTo(VipTransferStatus next) {
    switch (next) {
      case APPROVED:
      case REJECTED:
        return this == PENDING;
      case COMPLETED:
        return this == APPROVED;
      case CANCELLED:
        return !isTerminal();
      default:
        return false;
    }
  }

  public static VipTransferStatus fromCode(String code) {
    for (VipTransferStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown transfer status: " + code);
  }
}
