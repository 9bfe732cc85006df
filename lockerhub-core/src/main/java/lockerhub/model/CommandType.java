package lockerhub.model;

public enum CommandType {
  OPEN_LOCKER("open_locker"),
  BULK_OPEN("bulk_open"),
  BLOCK_LOCKER("block_locker"),
  UNBLOCK_LOCKER("unblock_locker"),
  APPLY_CONFIG("apply_config"),
  RESTART_SERVICE("restart_service");

  private final String code;

  CommandType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static CommandType fromCode(String code) {
    for (CommandType type : values()) {
      if (type.code.equals(code)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown command type: " + code);
  }
}
