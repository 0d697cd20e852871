package io.gridsync.core.scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for event loops: turns a phase and delay into an absolute delay, wraps the action in a
 * liveness-guarded, cancellable task and hands it to the subclass for queuing.
 */
public abstract class AbstractEventLoop implements EventLoop {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractEventLoop.class);

    private final long frameDelayMs;

    protected AbstractEventLoop(long frameDelayMs) {
        if (frameDelayMs < 0) {
            throw new IllegalArgumentException("frameDelayMs must not be negative: " + frameDelayMs);
        }
        this.frameDelayMs = frameDelayMs;
    }

    @Override
    public final ScheduledTask schedule(
            TaskPhase phase, Duration delay, String name, BooleanSupplier liveness, Runnable action) {
        Objects.requireNonNull(phase, "phase must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(liveness, "liveness must not be null");
        Objects.requireNonNull(action, "action must not be null");
        long extraMs = delay == null ? 0 : Math.max(0, delay.toMillis());
        long delayMs =
                switch (phase) {
                    case MICROTASK -> 0;
                    case FRAME -> frameDelayMs + extraMs;
                    case TIMER -> extraMs;
                };
        GuardedTask task = new GuardedTask(name, phase, liveness, action);
        enqueue(task, delayMs);
        return task;
    }

    /** Delay of a {@link TaskPhase#FRAME} task with no extra delay. */
    public long frameDelayMs() {
        return frameDelayMs;
    }

    /**
     * Queues a task.
     *
     * @param task    the task; call {@link GuardedTask#run()} to execute it
     * @param delayMs absolute delay from now; zero for microtasks
     */
    protected abstract void enqueue(GuardedTask task, long delayMs);

    /**
     * A task that checks cancellation and its liveness guard before running, and logs rather than
     * propagates failures.
     */
    protected static final class GuardedTask implements ScheduledTask, Runnable {

        private final String name;
        private final TaskPhase phase;
        private final BooleanSupplier liveness;
        private final Runnable action;
        private volatile boolean cancelled;
        private volatile boolean done;
        private volatile Future<?> future;

        GuardedTask(String name, TaskPhase phase, BooleanSupplier liveness, Runnable action) {
            this.name = name;
            this.phase = phase;
            this.liveness = liveness;
            this.action = action;
        }

        @Override
        public void run() {
            if (cancelled || done) {
                return;
            }
            done = true;
            if (!isLive()) {
                LOG.debug("Skipped scheduled task, target no longer live: task={}", name);
                return;
            }
            try {
                action.run();
            } catch (RuntimeException e) {
                LOG.warn("Scheduled task failed: task={}", name, e);
            }
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public TaskPhase phase() {
            return phase;
        }

        @Override
        public void cancel() {
            if (done) {
                return;
            }
            cancelled = true;
            done = true;
            Future<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done;
        }

        /** Links the executor future so {@link #cancel()} can also dequeue it. */
        void attach(Future<?> future) {
            this.future = future;
        }

        private boolean isLive() {
            try {
                return liveness.getAsBoolean();
            } catch (RuntimeException e) {
                LOG.warn("Liveness check failed, skipping task: task={}", name, e);
                return false;
            }
        }

        @Override
        public String toString() {
            return "GuardedTask[" + name + ", " + phase + (cancelled ? ", cancelled" : done ? ", done" : "") + "]";
        }
    }
}
