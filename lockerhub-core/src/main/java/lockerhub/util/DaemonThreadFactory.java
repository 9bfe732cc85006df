package lockerhub.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the daemon threads behind the maintenance loops, named {@code <prefix>N}.
 *
 * <p>An exception escaping a task is logged at {@code SEVERE} rather than printed to
 * standard error.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger();

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, prefix + sequence.incrementAndGet());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) ->
            logger.log(Level.SEVERE, "Uncaught exception in " + t.getName(), e));
        return thread;
    }

    /** Number of threads created so far. */
    public int createdCount() {
        return sequence.get();
    }
}
