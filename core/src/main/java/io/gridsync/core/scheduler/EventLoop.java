package io.gridsync.core.scheduler;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Single-threaded scheduler for deferred work.
 *
 * <p>
 * Every task carries a liveness guard that is checked just before it runs; if the guard returns
 * {@code false} (for example because the grid the task targets was destroyed) the task is skipped.
 * Exceptions thrown by a task are logged and never stop the loop.
 */
public interface EventLoop {

    /**
     * Schedules a task.
     *
     * @param phase    when the task runs
     * @param delay    extra delay; ignored for {@link TaskPhase#MICROTASK}
     * @param name     short name used in logs
     * @param liveness checked before running; {@code false} skips the task
     * @param action   the work
     * @return a handle that can cancel the task
     */
    ScheduledTask schedule(TaskPhase phase, Duration delay, String name, BooleanSupplier liveness, Runnable action);

    /** Schedules a task to run right after the current one. */
    default ScheduledTask microtask(String name, BooleanSupplier liveness, Runnable action) {
        return schedule(TaskPhase.MICROTASK, Duration.ZERO, name, liveness, action);
    }

    /** Schedules a task for the next rendering frame. */
    default ScheduledTask nextFrame(String name, BooleanSupplier liveness, Runnable action) {
        return schedule(TaskPhase.FRAME, Duration.ZERO, name, liveness, action);
    }

    /** Schedules a task after {@code delay}. */
    default ScheduledTask after(Duration delay, String name, BooleanSupplier liveness, Runnable action) {
        return schedule(TaskPhase.TIMER, delay, name, liveness, action);
    }
}
