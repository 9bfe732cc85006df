package lockerhub.model;

/**
 * Criteria for {@code CommandQueue.findAll}; results are newest first.
 *
 * @param limit maximum rows, or {@code 0} for no limit
 */
public record CommandFilter(String kioskId, CommandStatus status, CommandType type, int limit) {

  public CommandFilter {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0");
    }
  }

  public static CommandFilter all() {
    return new CommandFilter(null, null, null, 0);
  }

  public static CommandFilter byKiosk(String kioskId) {
    return new CommandFilter(kioskId, null, null, 0);
  }

  public CommandFilter withStatus(CommandStatus status) {
    return new CommandFilter(kioskId, status, type, limit);
  }

  public CommandFilter withType(CommandType type) {
    return new CommandFilter(kioskId, status, type, limit);
  }

  public CommandFilter withLimit(int limit) {
    return new CommandFilter(kioskId, status, type, limit);
  }
}
