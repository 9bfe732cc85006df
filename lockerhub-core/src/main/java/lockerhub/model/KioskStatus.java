package lockerhub.model;

public enum KioskStatus {
  ONLINE("online"),
  OFFLINE("offline"),
  MAINTENANCE("maintenance"),
  ERROR("error");

  private final String code;

  KioskStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static KioskStatus fromCode(String code) {
    for (KioskStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown kiosk status: " + code);
  }
}
