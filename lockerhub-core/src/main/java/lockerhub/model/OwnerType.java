package lockerhub.model;

public enum OwnerType {
  RFID("rfid"),
  DEVICE("device"),
  VIP("vip");

  private final String code;

  OwnerType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static OwnerType fromCode(String code) {
    for (OwnerType type : values()) {
      if (type.code.equals(code)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown owner type: " + code);
  }
}
