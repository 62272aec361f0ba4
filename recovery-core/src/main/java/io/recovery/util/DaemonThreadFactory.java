package io.recovery.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Daemon threads for the recovery loops, named {@code <prefix>1}, {@code <prefix>2}, ...
 *
 * <p>Anything escaping a task is logged rather than lost with the thread.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private final String namePrefix;
    private final AtomicInteger nextId = new AtomicInteger(1);

    public DaemonThreadFactory(String namePrefix) {
        this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread worker = new Thread(task, namePrefix + nextId.getAndIncrement());
        worker.setDaemon(true);
        worker.setUncaughtExceptionHandler((t, e) ->
                logger.log(Level.SEVERE, "Uncaught failure on " + t.getName(), e));
        return worker;
    }
}
