package express.mvp.scrpc.server;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates the platform threads that run the accept loop and connection workers.
 *
 * <p>Threads are named {@code "{prefix}-{counter}"}. Daemon threads do not keep the JVM alive once
 * the application's own threads have finished.
 */
final class WorkerThreadFactory implements ThreadFactory {

    private final AtomicLong threadCount = new AtomicLong(0);
    private final String namePrefix;
    private final boolean daemon;

    WorkerThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = namePrefix;
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, namePrefix + "-" + threadCount.incrementAndGet());
        thread.setDaemon(daemon);
        return thread;
    }

    @Override
    public String toString() {
        return "WorkerThreadFactory[prefix=" + namePrefix + ", created=" + threadCount.get() + "]";
    }
}
