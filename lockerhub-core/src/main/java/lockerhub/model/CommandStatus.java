package lockerhub.model;

/**
 * Command lifecycle. {@link #COMPLETED}, {@link #FAILED} and {@link #CANCELLED} are terminal.
 */
public enum CommandStatus {
  PENDING("pending"),
  EXECUTING("executing"),
  COMPLETED("completed"),
  FAILED("failed"),
  CANCELLED("cancelled");

  private final String code;

  CommandStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  public static CommandStatus fromCode(String code) {
    for (CommandStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown command status: " + code);
  }
}
