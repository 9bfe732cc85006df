package lockerhub.model;

public enum VipContractStatus {
  ACTIVE("active"),
  EXPIRED("expired"),
  CANCELLED("cancelled");

  private final String code;

  VipContractStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static VipContractStatus fromCode(String code) {
    for (VipContractStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown VIP contract status: " + code);
  }
}
