package lockerhub.model;

public enum VipHistoryAction {
  CREATED("created"),
  EXTENDED("extended"),
  CARD_CHANGED("card_changed"),
  TRANSFERRED("transferred"),
  CANCELLED("cancelled");

  private final String code;

  VipHistoryAction(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static VipHistoryAction fromCode(String code) {
    for (VipHistoryAction action : values()) {
      if (action.code.equals(code)) {
        return action;
      }
    }
    throw new IllegalArgumentException("Unknown VIP history action: " + code);
  }
}
