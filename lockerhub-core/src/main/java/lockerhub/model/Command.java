package lockerhub.model;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only snapshot of a queued hardware command.
 *
 * @param payload       command arguments; never {@code null}, may be empty
 * @param nextAttemptAt earliest time the kiosk may pick the command up
 */
public record Command(
    String commandId,
    String kioskId,
    CommandType type,
    Map<String, Object> payload,
    CommandStatus status,
    int retryCount,
    int maxRetries,
    Instant nextAttemptAt,
    String lastError,
    Instant createdAt,
    Instant executedAt,
    Instant completedAt
) {

  public boolean isTerminal() {
    return status.isTerminal();
  }
}
