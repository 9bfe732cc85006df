package lockerhub;

import lockerhub.model.Command;
import lockerhub.model.CommandFilter;
import lockerhub.model.CommandRequest;
import lockerhub.model.CommandStatistics;

import java.time.Duration;
import java.util.List;

/**
 * Per-kiosk command queue polled by kiosk agents.
 *
 * <p>States: {@code pending -> executing -> completed}; failures go back to
 * {@code pending} with exponential backoff until {@code max_retries} is reached,
 * then to {@code failed}; {@code pending} and {@code executing} commands can be
 * cancelled. Terminal commands never change again.
 */
public interface CommandQueue extends Repository<Command, String, CommandFilter> {

    String CLEARED_ON_RESTART = "Cleared on system restart";
    Duration DEFAULT_RETENTION = Duration.ofDays(7);

    Command enqueue(CommandRequest request);

    /** Enqueues all requests atomically. */
    List<Command> enqueueAll(List<CommandRequest> requests);

    /**
     * Due commands for a kiosk, oldest deadline first.
     *
     * @param limit maximum commands, or {@code 0} for all
     */
    List<Command> getPendingCommands(String kioskId, int limit);

    default List<Command> getPendingCommands(String kioskId) {
        return getPendingCommands(kioskId, 0);
    }

    /**
     * @throws IllegalTransitionException if the command is not pending
     */
    Command markExecuting(String commandId);

    /**
     * @throws IllegalTransitionException if the command is already terminal
     */
    Command markCompleted(String commandId);

    /**
     * Records a failed attempt using the queue's configured base delay.
     */
    Command markFailed(String commandId, String error);

    /**
     * Records a failed attempt: increments {@code retry_count}, schedules the next attempt
     * {@code retryDelay * 2^(retry_count - 1)} from now, and fails the command for good
     * once {@code retry_count} reaches {@code max_retries}.
     *
     * @throws IllegalTransitionException if the command is already terminal
     */
    Command markFailed(String commandId, String error, Duration retryDelay);

    /**
     * @throws IllegalTransitionException if the command is already terminal
     */
    Command cancelCommand(String commandId);

    /**
     * Cancels every pending or executing command of a kiosk, used when the kiosk restarts.
     *
     * @return number of commands cancelled
     */
    int clearPendingCommands(String kioskId);

    /** Commands stuck in {@code executing} for longer than {@code threshold}. */
    List<Command> findStaleExecutingCommands(Duration threshold);

    List<Command> getCommandHistory(String kioskId, int limit);

    /**
     * Deletes terminal commands created more than {@code retention} ago.
     *
     * @return number of commands deleted
     */
    int cleanupOldCommands(Duration retention);

    default int cleanupOldCommands() {
        return cleanupOldCommands(DEFAULT_RETENTION);
    }

    /**
     * @param kioskId restricts the counts to one kiosk, or {@code null} for all
     */
    CommandStatistics getStatistics(String kioskId);
}
