package io.gridsync.core.scheduler;

import io.gridsync.core.config.SyncConfig;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event loop backed by a single daemon thread.
 *
 * <p>
 * All tasks, whatever their phase, run on the same thread in due-time order, so the engine sees
 * the same single-threaded model as in a host UI loop. Hosts that call the settings controller
 * directly must do so from this loop's thread (submit a microtask to get there).
 *
 * <p>
 * {@link #close()} stops the thread; tasks submitted afterwards are dropped with a warning.
 */
public final class ExecutorEventLoop extends AbstractEventLoop implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutorEventLoop.class);

    private final ScheduledExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a loop with the given frame delay.
     *
     * @param frameDelayMs delay of a frame task in milliseconds
     */
    public ExecutorEventLoop(long frameDelayMs) {
        super(frameDelayMs);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "grid-sync-loop");
            t.setDaemon(true);
            return t;
        });
        LOG.debug("Event loop started: frame_delay_ms={}", frameDelayMs);
    }

    /** Loop whose frame lasts {@link SyncConfig#frameDelayMs()}. */
    public static ExecutorEventLoop fromConfig(SyncConfig config) {
        return new ExecutorEventLoop(config.frameDelayMs());
    }

    @Override
    protected void enqueue(GuardedTask task, long delayMs) {
        try {
            Future<?> future = delayMs == 0
                    ? executor.submit(task)
                    : executor.schedule(task, delayMs, TimeUnit.MILLISECONDS);
            task.attach(future);
        } catch (RejectedExecutionException e) {
            LOG.warn("Event loop closed, dropping task: task={}", task.name());
            task.cancel();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Stops the loop thread. Queued tasks are discarded. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        executor.shutdownNow();
        LOG.debug("Event loop stopped");
    }
}
